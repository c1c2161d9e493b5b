package org.javai.springai.chain.api;

/**
 * Raised at the tool boundary: the tool is unknown, rejected its arguments,
 * failed, or did not answer in time.
 */
public class ToolInvocationException extends RuntimeException {

	private final String toolName;

	public ToolInvocationException(String toolName, String message) {
		super(message);
		this.toolName = toolName;
	}

	public ToolInvocationException(String toolName, String message, Throwable cause) {
		super(message, cause);
		this.toolName = toolName;
	}

	public String toolName() {
		return toolName;
	}
}
