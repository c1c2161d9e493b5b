package org.javai.springai.chain.api;

/**
 * The model side of the first pass: turns a question into plan text that may
 * contain {@code [FUNC name(args) = placeholder]} markers.
 * <p>
 * A single request/response; implementations do not retry.
 */
@FunctionalInterface
public interface PlanSource {

	/**
	 * @param toolSignatures rendered signatures of the tools the plan may call, one per line
	 * @param question the user's question
	 * @return the abstract plan text
	 */
	String requestPlan(String toolSignatures, String question);
}
