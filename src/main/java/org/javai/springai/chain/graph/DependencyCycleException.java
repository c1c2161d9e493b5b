package org.javai.springai.chain.graph;

import java.util.List;

/**
 * Following dependency edges leads back to a placeholder already on the path.
 */
public class DependencyCycleException extends PlanGraphException {

	private final List<String> cycle;

	/**
	 * @param cycle the path, starting and ending with the same placeholder
	 */
	public DependencyCycleException(List<String> cycle) {
		super("Dependency cycle detected: " + String.join(" -> ", cycle));
		this.cycle = List.copyOf(cycle);
	}

	public List<String> cycle() {
		return cycle;
	}
}
