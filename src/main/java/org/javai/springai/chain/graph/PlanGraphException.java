package org.javai.springai.chain.graph;

/**
 * The plan cannot be turned into an executable graph. Raised before any tool
 * is invoked.
 */
public abstract class PlanGraphException extends RuntimeException {

	protected PlanGraphException(String message) {
		super(message);
	}
}
