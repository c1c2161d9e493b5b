package org.javai.springai.chain.instrument;

/**
 * Receives invocation events. Called from the thread driving the run, never
 * concurrently for one run.
 */
@FunctionalInterface
public interface InvocationListener {

	void onEvent(InvocationEvent event);
}
