package org.javai.springai.chain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.springai.chain.exec.ExecutionReport;
import org.javai.springai.chain.parse.ParseDiagnostic;

/**
 * Tagged result of one run. Exactly one of {@link #answer()} and
 * {@link #failureReason()} is set; a failed run never carries an answer.
 * <p>
 * Intermediate artifacts are kept for diagnostics as far as the run got:
 * the plan text once the model answered, the diagnostics once it was parsed,
 * the execution report once tools ran, the filled plan once it was rewritten.
 *
 * @param outcome how the run ended
 * @param question the question asked
 * @param planText the model's abstract plan, or {@code null} if none was obtained
 * @param diagnostics markers that were skipped while parsing
 * @param filledPlan the plan with every call replaced by its result, or {@code null}
 * @param answer the final answer, or {@code null} on failure
 * @param failureReason human-readable reason, or {@code null} on success
 * @param report the execution report, or {@code null} if execution never started
 * @param error the originating exception, or {@code null}
 */
public record ChainRunResult(
		ChainOutcome outcome,
		String question,
		String planText,
		List<ParseDiagnostic> diagnostics,
		String filledPlan,
		String answer,
		String failureReason,
		ExecutionReport report,
		Throwable error
) {

	public ChainRunResult {
		Objects.requireNonNull(outcome, "outcome must not be null");
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
		if (outcome.isSuccess() && answer == null) {
			throw new IllegalArgumentException("A successful run must carry an answer");
		}
		if (!outcome.isSuccess() && answer != null) {
			throw new IllegalArgumentException("A failed run cannot carry an answer");
		}
	}

	static ChainRunResult succeeded(String question, String planText, List<ParseDiagnostic> diagnostics,
			String filledPlan, String answer, ExecutionReport report) {
		return new ChainRunResult(ChainOutcome.SUCCEEDED, question, planText, diagnostics, filledPlan, answer, null,
				report, null);
	}

	static ChainRunResult failed(ChainOutcome outcome, String question, String planText,
			List<ParseDiagnostic> diagnostics, String filledPlan, ExecutionReport report, String reason,
			Throwable error) {
		return new ChainRunResult(outcome, question, planText, diagnostics, filledPlan, null, reason, report, error);
	}

	public boolean isSuccess() {
		return outcome.isSuccess();
	}

	public Optional<String> answerIfPresent() {
		return Optional.ofNullable(answer);
	}

	public String describe() {
		if (isSuccess()) {
			return "Run succeeded: " + answer;
		}
		return "Run failed (" + outcome + "): " + failureReason;
	}
}
