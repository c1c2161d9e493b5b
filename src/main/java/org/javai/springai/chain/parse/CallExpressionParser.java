package org.javai.springai.chain.parse;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.javai.springai.chain.api.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts call expressions from plan text for one set of available tools.
 *
 * <h2>Argument classification</h2>
 * <ul>
 *   <li>Quoted tokens are always string literals, so {@code "y1"} is the text {@code y1}.</li>
 *   <li>Unquoted integers, decimals and booleans ({@code true/false/True/False}) are
 *       coerced to {@link Integer} (or {@link Long}/{@link BigInteger} when larger),
 *       {@link Double} and {@link Boolean}.</li>
 *   <li>An unquoted bare identifier is a placeholder reference when a recognised call
 *       anywhere in the plan outputs it, or when it has the shape of a placeholder
 *       ({@link #DEFAULT_REFERENCE_PATTERN} unless configured). Forward references are
 *       therefore kept, and left for the graph builder to order or reject.</li>
 *   <li>Everything else is a string literal holding the trimmed source text.</li>
 * </ul>
 *
 * <p>Parsing never fails: malformed markers and markers naming unknown functions
 * are reported as diagnostics and left in the text untouched.</p>
 */
public class CallExpressionParser {

	private static final Logger logger = LoggerFactory.getLogger(CallExpressionParser.class);

	public static final Pattern DEFAULT_REFERENCE_PATTERN = Pattern.compile("y\\d+");

	private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
	private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	private final Set<String> functionNames;
	private final Pattern referencePattern;

	public CallExpressionParser(Set<String> functionNames) {
		this(functionNames, DEFAULT_REFERENCE_PATTERN);
	}

	public CallExpressionParser(Set<String> functionNames, Pattern referencePattern) {
		this.functionNames = Set.copyOf(Objects.requireNonNull(functionNames, "functionNames must not be null"));
		this.referencePattern = Objects.requireNonNull(referencePattern, "referencePattern must not be null");
	}

	public static CallExpressionParser forTools(ToolRegistry tools) {
		return new CallExpressionParser(tools.names());
	}

	public static CallExpressionParser forTools(ToolRegistry tools, Pattern referencePattern) {
		return new CallExpressionParser(tools.names(), referencePattern);
	}

	public ParseResult parse(String planText) {
		Objects.requireNonNull(planText, "planText must not be null");
		CallExpressionScanner.ScanResult scanned = new CallExpressionScanner(planText).scan();
		List<ParseDiagnostic> diagnostics = new ArrayList<>(scanned.diagnostics());

		List<CallExpressionScanner.ScannedCall> recognised = new ArrayList<>();
		for (CallExpressionScanner.ScannedCall call : scanned.calls()) {
			if (functionNames.contains(call.functionName())) {
				recognised.add(call);
			} else {
				diagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.UNKNOWN_FUNCTION, call.span().start(),
						"Unknown function '" + call.functionName() + "'", call.span().slice(planText)));
			}
		}

		Set<String> defined = new HashSet<>();
		recognised.forEach(call -> defined.add(call.placeholder()));

		List<CallExpression> calls = recognised.stream()
				.map(call -> new CallExpression(
						call.functionName(),
						call.arguments().stream().map(token -> classify(token, defined)).toList(),
						call.placeholder(),
						call.span()))
				.toList();

		diagnostics.sort((a, b) -> Integer.compare(a.position(), b.position()));
		diagnostics.forEach(d -> logger.warn("Skipping call marker: {} [{}]", d, d.text()));
		logger.debug("Parsed {} call expression(s) with {} diagnostic(s)", calls.size(), diagnostics.size());
		return new ParseResult(planText, calls, diagnostics);
	}

	Argument classify(ArgumentToken token, Set<String> definedPlaceholders) {
		if (token.isQuoted()) {
			return Argument.literal(token.value(), token.raw());
		}
		String text = token.value();
		if (INTEGER.matcher(text).matches()) {
			return Argument.literal(parseInteger(text), text);
		}
		if (DECIMAL.matcher(text).matches()) {
			return Argument.literal(Double.parseDouble(text), text);
		}
		if (text.equals("true") || text.equals("True")) {
			return Argument.literal(Boolean.TRUE, text);
		}
		if (text.equals("false") || text.equals("False")) {
			return Argument.literal(Boolean.FALSE, text);
		}
		if (IDENTIFIER.matcher(text).matches()
				&& (definedPlaceholders.contains(text) || referencePattern.matcher(text).matches())) {
			return Argument.reference(text);
		}
		return Argument.literal(text, text);
	}

	private static Object parseInteger(String text) {
		BigInteger value = new BigInteger(text.startsWith("+") ? text.substring(1) : text);
		if (value.bitLength() < Integer.SIZE) {
			return value.intValue();
		}
		if (value.bitLength() < Long.SIZE) {
			return value.longValue();
		}
		return value;
	}
}
