package org.javai.springai.chain.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.springai.chain.parse.CallExpression;
import org.javai.springai.chain.parse.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link ExecutionPlan}s from parsed call expressions. Dependencies come
 * only from argument references, never from textual order.
 * <p>
 * Validation runs in a fixed order and stops at the first defect: duplicate
 * placeholder, then unknown reference, then cycle.
 */
public class DependencyGraphBuilder {

	private static final Logger logger = LoggerFactory.getLogger(DependencyGraphBuilder.class);

	public ExecutionPlan build(ParseResult parsed) {
		Objects.requireNonNull(parsed, "parsed must not be null");
		return build(parsed.planText(), parsed.calls());
	}

	/**
	 * @throws DuplicatePlaceholderException if two calls bind the same placeholder
	 * @throws UnknownReferenceException if an argument refers to a placeholder no call defines
	 * @throws DependencyCycleException if the references form a cycle
	 */
	public ExecutionPlan build(String planText, List<CallExpression> calls) {
		Objects.requireNonNull(planText, "planText must not be null");
		Objects.requireNonNull(calls, "calls must not be null");

		try {
			Map<String, DependencyNode> nodes = createNodes(calls);
			verifyReferences(nodes);
			Map<String, List<String>> dependents = collectDependents(nodes);
			verifyAcyclic(nodes);

			Map<String, Set<String>> dependencies = new LinkedHashMap<>();
			nodes.forEach((id, node) -> dependencies.put(id, node.dependencies()));
			List<String> order = TopologicalOrder.of(dependencies, dependents);

			ExecutionPlan plan = new ExecutionPlan(planText, calls, nodes, dependents, order);
			logger.debug("Built {}", plan.describe());
			return plan;
		}
		catch (PlanGraphException e) {
			logger.warn("Rejected plan: {}", e.getMessage());
			throw e;
		}
	}

	private Map<String, DependencyNode> createNodes(List<CallExpression> calls) {
		Map<String, DependencyNode> nodes = new LinkedHashMap<>();
		for (CallExpression call : calls) {
			DependencyNode previous = nodes.putIfAbsent(call.outputPlaceholder(), new DependencyNode(call));
			if (previous != null) {
				throw new DuplicatePlaceholderException(call.outputPlaceholder(),
						previous.call().render(), call.render());
			}
		}
		return nodes;
	}

	private void verifyReferences(Map<String, DependencyNode> nodes) {
		for (DependencyNode node : nodes.values()) {
			for (String dependency : node.dependencies()) {
				if (!nodes.containsKey(dependency)) {
					throw new UnknownReferenceException(dependency, node.id());
				}
			}
		}
	}

	private Map<String, List<String>> collectDependents(Map<String, DependencyNode> nodes) {
		Map<String, List<String>> dependents = new HashMap<>();
		nodes.forEach((id, node) -> node.dependencies()
				.forEach(dependency -> dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(id)));
		return dependents;
	}

	private void verifyAcyclic(Map<String, DependencyNode> nodes) {
		Set<String> finished = new HashSet<>();
		for (String id : nodes.keySet()) {
			visit(id, nodes, new ArrayList<>(), new HashSet<>(), finished);
		}
	}

	private void visit(String id, Map<String, DependencyNode> nodes, List<String> path, Set<String> onPath,
			Set<String> finished) {
		if (finished.contains(id)) {
			return;
		}
		if (onPath.contains(id)) {
			List<String> cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
			cycle.add(id);
			throw new DependencyCycleException(cycle);
		}
		path.add(id);
		onPath.add(id);
		for (String dependency : nodes.get(id).dependencies()) {
			visit(dependency, nodes, path, onPath, finished);
		}
		path.remove(path.size() - 1);
		onPath.remove(id);
		finished.add(id);
	}
}
