package org.javai.springai.chain.graph;

/**
 * Lifecycle of a {@link DependencyNode}.
 * <p>
 * {@code PENDING -> READY -> RUNNING -> DONE | FAILED}. A node that never
 * becomes ready (because a dependency failed) stays {@code PENDING}.
 */
public enum NodeStatus {
	PENDING,
	READY,
	RUNNING,
	DONE,
	FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}
}
