package org.javai.springai.chain.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.springai.chain.parse.CallExpression;

/**
 * The dependency graph of one model-generated plan.
 * <p>
 * Owned by a single run: created by {@link DependencyGraphBuilder}, mutated in
 * place while it executes, read once by the rewriter, then discarded. Nodes
 * are kept in textual order; {@link #topologicalOrder()} gives one valid
 * execution order. The plan can render itself for debugging.
 */
public final class ExecutionPlan {

	private final String planText;
	private final List<CallExpression> calls;
	private final Map<String, DependencyNode> nodes;
	private final Map<String, List<String>> dependents;
	private final List<String> topologicalOrder;

	ExecutionPlan(String planText, List<CallExpression> calls, Map<String, DependencyNode> nodes,
			Map<String, List<String>> dependents, List<String> topologicalOrder) {
		this.planText = Objects.requireNonNull(planText, "planText must not be null");
		this.calls = List.copyOf(calls);
		this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
		this.dependents = Map.copyOf(dependents);
		this.topologicalOrder = List.copyOf(topologicalOrder);
	}

	public String planText() {
		return planText;
	}

	/**
	 * Recognised calls in textual order.
	 */
	public List<CallExpression> calls() {
		return calls;
	}

	public Map<String, DependencyNode> nodes() {
		return nodes;
	}

	public Optional<DependencyNode> findNode(String placeholder) {
		return Optional.ofNullable(nodes.get(placeholder));
	}

	public DependencyNode node(String placeholder) {
		DependencyNode node = nodes.get(placeholder);
		if (node == null) {
			throw new IllegalArgumentException("No node for placeholder: " + placeholder);
		}
		return node;
	}

	/**
	 * Placeholders whose calls take {@code placeholder}'s result as an argument.
	 */
	public List<String> dependents(String placeholder) {
		return dependents.getOrDefault(placeholder, List.of());
	}

	public List<String> topologicalOrder() {
		return topologicalOrder;
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	public int size() {
		return nodes.size();
	}

	public Set<String> placeholdersWithStatus(NodeStatus status) {
		return nodes.values().stream()
				.filter(node -> node.status() == status)
				.map(DependencyNode::id)
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	/**
	 * Placeholder to result for every node that completed.
	 */
	public Map<String, Object> results() {
		Map<String, Object> results = new LinkedHashMap<>();
		nodes.values().stream()
				.filter(node -> node.status() == NodeStatus.DONE)
				.forEach(node -> results.put(node.id(), node.result()));
		return Collections.unmodifiableMap(results);
	}

	public String describe() {
		if (nodes.isEmpty()) {
			return "ExecutionPlan: <empty>";
		}
		StringBuilder sb = new StringBuilder("ExecutionPlan:\n");
		int index = 1;
		for (String placeholder : topologicalOrder) {
			DependencyNode node = nodes.get(placeholder);
			sb.append(index++)
					.append(". ")
					.append(placeholder)
					.append(" [function=")
					.append(node.functionName())
					.append(", args=")
					.append(node.call().arguments())
					.append(", status=")
					.append(node.status());
			if (!node.dependencies().isEmpty()) {
				sb.append(", dependsOn=").append(node.dependencies());
			}
			sb.append("]\n");
		}
		return sb.toString().trim();
	}

	@Override
	public String toString() {
		return describe();
	}
}
