package org.javai.springai.chain.graph;

/**
 * Two calls bind their result to the same placeholder.
 */
public class DuplicatePlaceholderException extends PlanGraphException {

	private final String placeholder;

	public DuplicatePlaceholderException(String placeholder, String firstCall, String secondCall) {
		super("Placeholder '%s' is defined twice: %s and %s".formatted(placeholder, firstCall, secondCall));
		this.placeholder = placeholder;
	}

	public String placeholder() {
		return placeholder;
	}
}
