package org.javai.springai.chain;

/**
 * How one {@link AbstractionChain} run ended.
 */
public enum ChainOutcome {
	SUCCEEDED,
	PLAN_REQUEST_FAILED,
	GRAPH_INVALID,
	EXECUTION_FAILED,
	REWRITE_FAILED,
	REFINEMENT_FAILED,
	CANCELLED;

	public boolean isSuccess() {
		return this == SUCCEEDED;
	}
}
