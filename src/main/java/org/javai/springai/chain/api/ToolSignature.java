package org.javai.springai.chain.api;

import java.util.List;
import java.util.Objects;

/**
 * Name, ordered parameter names and description of a tool, as shown to the
 * model when it is asked for a plan.
 *
 * @param name the function name used inside {@code [FUNC ...]} markers
 * @param parameters ordered parameter names
 * @param description free text, may be empty
 */
public record ToolSignature(String name, List<String> parameters, String description) {

	public ToolSignature {
		Objects.requireNonNull(name, "name must not be null");
		if (name.isBlank()) {
			throw new IllegalArgumentException("Tool name must not be blank");
		}
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		description = description != null ? description.strip() : "";
	}

	public static ToolSignature of(String name, String... parameters) {
		return new ToolSignature(name, parameters != null ? List.of(parameters) : List.of(), "");
	}

	public ToolSignature withDescription(String description) {
		return new ToolSignature(name, parameters, description);
	}

	/**
	 * Renders as {@code name(p1, p2): description}.
	 */
	public String render() {
		String call = name + "(" + String.join(", ", parameters) + ")";
		return description.isEmpty() ? call : call + ": " + description;
	}
}
