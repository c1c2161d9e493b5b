package org.javai.springai.chain.graph;

/**
 * An argument refers to a placeholder that no call in the plan defines.
 */
public class UnknownReferenceException extends PlanGraphException {

	private final String placeholder;
	private final String referencedBy;

	public UnknownReferenceException(String placeholder, String referencedBy) {
		super("Call '%s' refers to undefined placeholder '%s'".formatted(referencedBy, placeholder));
		this.placeholder = placeholder;
		this.referencedBy = referencedBy;
	}

	public String placeholder() {
		return placeholder;
	}

	/**
	 * The output placeholder of the call holding the bad reference.
	 */
	public String referencedBy() {
		return referencedBy;
	}
}
