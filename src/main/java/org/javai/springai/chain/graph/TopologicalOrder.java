package org.javai.springai.chain.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;

/**
 * Kahn's algorithm over placeholder dependencies. Ties are broken by the
 * iteration order of the input map, i.e. textual order.
 */
final class TopologicalOrder {

	private TopologicalOrder() {
	}

	/**
	 * @param dependenciesById placeholder -> placeholders it depends on; every
	 * dependency must itself be a key
	 * @return placeholders ordered so that each follows all of its dependencies
	 * @throws IllegalStateException if the graph is not acyclic
	 */
	static List<String> of(Map<String, Set<String>> dependenciesById, Map<String, List<String>> dependents) {
		Objects.requireNonNull(dependenciesById, "dependenciesById must not be null");
		Map<String, Integer> indegree = new LinkedHashMap<>();
		dependenciesById.forEach((id, deps) -> indegree.put(id, deps.size()));

		// Seed queue with nodes that have no unmet dependencies
		Queue<String> ready = new ArrayDeque<>();
		indegree.forEach((id, degree) -> {
			if (degree == 0) {
				ready.add(id);
			}
		});

		List<String> ordered = new ArrayList<>();
		while (!ready.isEmpty()) {
			String current = ready.remove();
			ordered.add(current);
			for (String successor : dependents.getOrDefault(current, List.of())) {
				int degree = indegree.computeIfPresent(successor, (k, v) -> v - 1);
				if (degree == 0) {
					ready.add(successor);
				}
			}
		}

		// Any leftover nodes imply a cycle
		if (ordered.size() != dependenciesById.size()) {
			throw new IllegalStateException("Cycle detected while ordering execution plan");
		}
		return ordered;
	}
}
