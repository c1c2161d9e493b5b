package org.javai.springai.chain.rewrite;

import org.javai.springai.chain.graph.NodeStatus;

/**
 * A call in the plan text cannot be replaced by a value. This means the text
 * and the executed graph disagree; the rewriter never emits partial output.
 */
public class PlanRewriteException extends RuntimeException {

	private final String placeholder;
	private final NodeStatus status;

	public PlanRewriteException(String placeholder, NodeStatus status, String message) {
		super(message);
		this.placeholder = placeholder;
		this.status = status;
	}

	public PlanRewriteException(String placeholder, NodeStatus status, String message, Throwable cause) {
		super(message, cause);
		this.placeholder = placeholder;
		this.status = status;
	}

	public String placeholder() {
		return placeholder;
	}

	/**
	 * Status of the node at rewrite time, or {@code null} when the plan has no such node.
	 */
	public NodeStatus status() {
		return status;
	}
}
