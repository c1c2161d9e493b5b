package org.javai.springai.chain.exec;

import org.javai.springai.chain.api.ToolRegistry;
import org.javai.springai.chain.graph.ExecutionPlan;
import org.javai.springai.chain.instrument.InvocationEmitter;

/**
 * Drives every node of an {@link ExecutionPlan} to DONE or FAILED.
 * <p>
 * Tool failures do not throw; they are reported through
 * {@link ExecutionReport#success()} and {@link ExecutionReport#failures()}.
 */
public interface ExecutionEngine {

	/**
	 * Execute a plan without instrumentation.
	 */
	default ExecutionReport execute(ExecutionPlan plan, ToolRegistry tools) {
		return execute(plan, tools, InvocationEmitter.silent());
	}

	/**
	 * @throws ExecutionCancelledException if the calling thread is interrupted
	 */
	ExecutionReport execute(ExecutionPlan plan, ToolRegistry tools, InvocationEmitter emitter);
}
