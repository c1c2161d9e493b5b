package org.javai.springai.chain.instrument;

public enum InvocationKind {
	/** A tool call for one plan node. */
	TOOL,
	/** The model request producing the abstract plan. */
	PLAN,
	/** The model request phrasing the final answer. */
	REFINE
}
