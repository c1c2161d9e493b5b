package org.javai.springai.chain.api;

/**
 * The model side of the second pass: phrases the final answer from the
 * question and the filled plan. Nothing else crosses this boundary.
 */
@FunctionalInterface
public interface RefinementSink {

	String refine(String question, String filledPlan);
}
