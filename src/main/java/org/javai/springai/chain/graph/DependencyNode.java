package org.javai.springai.chain.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.springai.chain.parse.CallExpression;

/**
 * One call of the plan, keyed by its output placeholder.
 * <p>
 * Status, resolved arguments, result and failure are written by the single
 * coordinator that drives the plan; workers never touch a node. Transitions
 * outside {@link NodeStatus}'s lifecycle throw {@link IllegalStateException}.
 */
public final class DependencyNode {

	private final CallExpression call;
	private final Set<String> dependencies;

	private NodeStatus status = NodeStatus.PENDING;
	private List<Object> resolvedArgs;
	private Object result;
	private Throwable failure;

	DependencyNode(CallExpression call) {
		this.call = Objects.requireNonNull(call, "call must not be null");
		this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(call.references()));
	}

	public String id() {
		return call.outputPlaceholder();
	}

	public String functionName() {
		return call.functionName();
	}

	public CallExpression call() {
		return call;
	}

	public Set<String> dependencies() {
		return dependencies;
	}

	public NodeStatus status() {
		return status;
	}

	/**
	 * Arguments with references replaced by dependency results; {@code null}
	 * until the node has been dispatched.
	 */
	public List<Object> resolvedArgs() {
		return resolvedArgs;
	}

	/**
	 * The tool's return value. May legitimately be {@code null}; check
	 * {@link #status()} for {@link NodeStatus#DONE}.
	 */
	public Object result() {
		return result;
	}

	public Throwable failure() {
		return failure;
	}

	public void markReady() {
		transition(NodeStatus.PENDING, NodeStatus.READY);
	}

	public void markRunning(List<Object> resolvedArgs) {
		transition(NodeStatus.READY, NodeStatus.RUNNING);
		this.resolvedArgs = Collections.unmodifiableList(new ArrayList<>(resolvedArgs));
	}

	public void markDone(Object result) {
		transition(NodeStatus.RUNNING, NodeStatus.DONE);
		this.result = result;
	}

	/**
	 * Fails a running node, or a ready node whose arguments could not be resolved.
	 */
	public void markFailed(Throwable failure) {
		if (status != NodeStatus.RUNNING && status != NodeStatus.READY) {
			throw new IllegalStateException("Node '%s' cannot fail from %s".formatted(id(), status));
		}
		this.status = NodeStatus.FAILED;
		this.failure = Objects.requireNonNull(failure, "failure must not be null");
	}

	private void transition(NodeStatus from, NodeStatus to) {
		if (status != from) {
			throw new IllegalStateException("Node '%s' cannot move to %s from %s".formatted(id(), to, status));
		}
		status = to;
	}

	@Override
	public String toString() {
		return id() + "=" + functionName() + call.arguments() + " " + status;
	}
}
