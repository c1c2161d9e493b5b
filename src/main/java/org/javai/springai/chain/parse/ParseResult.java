package org.javai.springai.chain.parse;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link CallExpressionParser}: recognised calls in textual order
 * plus diagnostics for everything that was skipped.
 */
public record ParseResult(String planText, List<CallExpression> calls, List<ParseDiagnostic> diagnostics) {

	public ParseResult {
		Objects.requireNonNull(planText, "planText must not be null");
		calls = calls != null ? List.copyOf(calls) : List.of();
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public boolean hasCalls() {
		return !calls.isEmpty();
	}

	public boolean hasDiagnostics() {
		return !diagnostics.isEmpty();
	}
}
