package org.javai.springai.chain.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node whose tool invocation failed.
 *
 * @param placeholder the failed node
 * @param functionName the tool that was called
 * @param arguments the resolved arguments it was called with; elements may be {@code null}
 * @param message short description of the failure
 * @param cause the exception raised at the tool boundary
 */
public record NodeFailure(
		String placeholder,
		String functionName,
		List<Object> arguments,
		String message,
		Throwable cause
) {

	public NodeFailure {
		Objects.requireNonNull(placeholder, "placeholder must not be null");
		Objects.requireNonNull(functionName, "functionName must not be null");
		arguments = arguments != null ? Collections.unmodifiableList(new ArrayList<>(arguments)) : List.of();
		message = message != null ? message : "";
	}

	public String describe() {
		return "%s = %s%s failed: %s".formatted(placeholder, functionName, arguments, message);
	}
}
