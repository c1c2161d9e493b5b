package org.javai.springai.chain.exec;

/**
 * The thread driving a plan was interrupted. In-flight tool invocations have
 * been cancelled and the interrupt flag restored.
 */
public class ExecutionCancelledException extends RuntimeException {

	public ExecutionCancelledException(String message, Throwable cause) {
		super(message, cause);
	}
}
