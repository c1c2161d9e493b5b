package org.javai.springai.chain.exec;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.springai.chain.graph.DependencyNode;
import org.javai.springai.chain.graph.ExecutionPlan;

/**
 * Outcome of executing a plan.
 * <p>
 * A failed report still carries every result that completed, so independent
 * branches remain available for diagnostics.
 *
 * @param success true when every node reached DONE
 * @param plan the executed plan, with final node states
 * @param failures failed nodes in the order their failures were observed
 * @param dispatchOrder placeholders in the order their tools were dispatched
 */
public record ExecutionReport(
		boolean success,
		ExecutionPlan plan,
		List<NodeFailure> failures,
		List<String> dispatchOrder
) {

	public ExecutionReport {
		Objects.requireNonNull(plan, "plan must not be null");
		failures = failures != null ? List.copyOf(failures) : List.of();
		dispatchOrder = dispatchOrder != null ? List.copyOf(dispatchOrder) : List.of();
		if (success && !failures.isEmpty()) {
			throw new IllegalArgumentException("A successful report cannot carry failures");
		}
	}

	public static ExecutionReport succeeded(ExecutionPlan plan, List<String> dispatchOrder) {
		return new ExecutionReport(true, plan, List.of(), dispatchOrder);
	}

	public static ExecutionReport failed(ExecutionPlan plan, List<NodeFailure> failures, List<String> dispatchOrder) {
		return new ExecutionReport(false, plan, failures, dispatchOrder);
	}

	/**
	 * Placeholder to result for every node that completed, failed run or not.
	 */
	public Map<String, Object> results() {
		return plan.results();
	}

	public Optional<NodeFailure> firstFailure() {
		return failures.isEmpty() ? Optional.empty() : Optional.of(failures.get(0));
	}

	/**
	 * Position of a placeholder in {@link #dispatchOrder()}, or -1 if it was never dispatched.
	 */
	public int dispatchIndex(String placeholder) {
		return dispatchOrder.indexOf(placeholder);
	}

	public String describe() {
		StringBuilder sb = new StringBuilder(success ? "Execution succeeded" : "Execution failed");
		sb.append(" (").append(plan.size()).append(" node(s))");
		for (DependencyNode node : plan.nodes().values()) {
			sb.append("\n  ").append(node.id()).append(" = ").append(node.functionName())
					.append(": ").append(node.status());
			switch (node.status()) {
				case DONE -> sb.append(" -> ").append(node.result());
				case FAILED -> sb.append(" (").append(node.failure().getMessage()).append(")");
				default -> {
				}
			}
		}
		return sb.toString();
	}
}
