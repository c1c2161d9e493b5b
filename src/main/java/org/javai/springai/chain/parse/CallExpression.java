package org.javai.springai.chain.parse;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A recognised {@code [FUNC name(args) = placeholder]} marker.
 *
 * @param functionName tool name, known to the registry the plan was parsed against
 * @param arguments arguments in written order
 * @param outputPlaceholder the identifier this call's result is bound to
 * @param sourceSpan where the whole marker sits in the original text
 */
public record CallExpression(
		String functionName,
		List<Argument> arguments,
		String outputPlaceholder,
		SourceSpan sourceSpan
) {

	public CallExpression {
		Objects.requireNonNull(functionName, "functionName must not be null");
		Objects.requireNonNull(outputPlaceholder, "outputPlaceholder must not be null");
		Objects.requireNonNull(sourceSpan, "sourceSpan must not be null");
		arguments = arguments != null ? List.copyOf(arguments) : List.of();
	}

	/**
	 * Placeholders referenced by the arguments, in first-use order.
	 */
	public Set<String> references() {
		return arguments.stream()
				.filter(Argument.Reference.class::isInstance)
				.map(a -> ((Argument.Reference) a).placeholder())
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	/**
	 * Canonical marker text, e.g. {@code [FUNC add(3, 2) = y1]}.
	 */
	public String render() {
		String args = arguments.stream().map(Argument::raw).collect(Collectors.joining(", "));
		return "[FUNC " + functionName + "(" + args + ") = " + outputPlaceholder + "]";
	}

	@Override
	public String toString() {
		return render() + "@" + sourceSpan;
	}
}
