package org.javai.springai.chain.exec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.springai.chain.api.Tool;
import org.javai.springai.chain.api.ToolInvocationException;
import org.javai.springai.chain.api.ToolRegistry;
import org.javai.springai.chain.graph.DependencyNode;
import org.javai.springai.chain.graph.ExecutionPlan;
import org.javai.springai.chain.instrument.InvocationEmitter;
import org.javai.springai.chain.instrument.InvocationEventType;
import org.javai.springai.chain.instrument.InvocationKind;
import org.javai.springai.chain.parse.Argument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes a plan by repeatedly dispatching ready nodes to a bounded worker pool.
 *
 * <h2>Scheduling</h2>
 * <p>The calling thread is the only one that reads or writes node state. It
 * resolves arguments, marks nodes running, submits tool invocations, and
 * applies each completion it takes back from a {@link CompletionService}.
 * Workers only run the tool and hand back a value or an exception.</p>
 *
 * <ul>
 *   <li>A node is dispatched only after all of its dependencies are DONE.</li>
 *   <li>At most {@code concurrencyLimit} invocations are in flight.</li>
 *   <li>Mutually independent nodes are dispatched in textual order, but may complete in any order.</li>
 *   <li>After the first failure nothing new is dispatched; in-flight invocations
 *       finish and their results are kept.</li>
 *   <li>No retries: a tool that throws fails its node, as does an invocation the executor rejects.</li>
 * </ul>
 *
 * <pre>{@code
 * DefaultExecutionEngine engine = DefaultExecutionEngine.builder()
 *     .concurrencyLimit(4)
 *     .build();
 * ExecutionReport report = engine.execute(plan, tools);
 * }</pre>
 */
public class DefaultExecutionEngine implements ExecutionEngine {

	private static final Logger logger = LoggerFactory.getLogger(DefaultExecutionEngine.class);

	public static final int DEFAULT_CONCURRENCY_LIMIT = 4;

	private final int concurrencyLimit;
	private final ExecutorService executor;
	private final boolean verbose;

	/**
	 * Create an engine with the default concurrency limit and a pool per run.
	 */
	public DefaultExecutionEngine() {
		this(builder());
	}

	private DefaultExecutionEngine(Builder builder) {
		this.concurrencyLimit = builder.concurrencyLimit;
		this.executor = builder.executor;
		this.verbose = builder.verbose;
	}

	public static Builder builder() {
		return new Builder();
	}

	public int concurrencyLimit() {
		return concurrencyLimit;
	}

	@Override
	public ExecutionReport execute(ExecutionPlan plan, ToolRegistry tools, InvocationEmitter emitter) {
		Objects.requireNonNull(plan, "plan must not be null");
		Objects.requireNonNull(tools, "tools must not be null");
		Objects.requireNonNull(emitter, "emitter must not be null");
		if (plan.isEmpty()) {
			return ExecutionReport.succeeded(plan, List.of());
		}

		ExecutorService pool = executor != null
				? executor
				: Executors.newFixedThreadPool(Math.min(concurrencyLimit, plan.size()), new ToolThreadFactory());
		try {
			return new Run(plan, tools, emitter, new ExecutorCompletionService<>(pool)).drive();
		}
		finally {
			if (executor == null) {
				pool.shutdownNow();
			}
		}
	}

	private void trace(String format, Object... args) {
		if (verbose) {
			logger.info(format, args);
		} else {
			logger.debug(format, args);
		}
	}

	/**
	 * Value or exception handed back by a worker.
	 */
	private record Outcome(Object value, Throwable error, long durationMs) {

		boolean failed() {
			return error != null;
		}
	}

	private record InFlight(DependencyNode node, String invocationId) {
	}

	/**
	 * State of one execution; confined to the calling thread.
	 */
	private final class Run {

		private final ExecutionPlan plan;
		private final ToolRegistry tools;
		private final InvocationEmitter emitter;
		private final CompletionService<Outcome> completions;

		private final Map<String, Integer> unresolved = new HashMap<>();
		private final Queue<DependencyNode> ready = new ArrayDeque<>();
		private final Map<Future<Outcome>, InFlight> inFlight = new LinkedHashMap<>();
		private final List<String> dispatchOrder = new ArrayList<>();
		private final List<NodeFailure> failures = new ArrayList<>();

		Run(ExecutionPlan plan, ToolRegistry tools, InvocationEmitter emitter, CompletionService<Outcome> completions) {
			this.plan = plan;
			this.tools = tools;
			this.emitter = emitter;
			this.completions = completions;
		}

		ExecutionReport drive() {
			for (DependencyNode node : plan.nodes().values()) {
				unresolved.put(node.id(), node.dependencies().size());
				if (node.dependencies().isEmpty()) {
					enqueue(node);
				}
			}

			while (true) {
				while (!halted() && inFlight.size() < concurrencyLimit && !ready.isEmpty()) {
					dispatch(ready.remove());
				}
				if (inFlight.isEmpty()) {
					break;
				}
				Future<Outcome> completed = awaitNext();
				InFlight call = inFlight.remove(completed);
				apply(call, outcomeOf(completed));
			}

			if (failures.isEmpty()) {
				trace("Executed {} node(s) in order {}", plan.size(), dispatchOrder);
				return ExecutionReport.succeeded(plan, dispatchOrder);
			}
			return ExecutionReport.failed(plan, failures, dispatchOrder);
		}

		private boolean halted() {
			return !failures.isEmpty();
		}

		private void enqueue(DependencyNode node) {
			node.markReady();
			ready.add(node);
		}

		private void dispatch(DependencyNode node) {
			List<Object> args = resolveArguments(node);
			node.markRunning(args);
			dispatchOrder.add(node.id());
			String invocationId = emitter.nextInvocationId();
			Map<String, Object> attributes = Map.of(
					"placeholder", node.id(),
					"arguments", String.valueOf(args),
					"dispatchIndex", dispatchOrder.size());
			emitter.emit(InvocationKind.TOOL, InvocationEventType.REQUESTED, node.functionName(), invocationId, null,
					attributes);

			Optional<Tool> tool = tools.find(node.functionName());
			if (tool.isEmpty()) {
				fail(new InFlight(node, invocationId), new ToolInvocationException(node.functionName(),
						"No tool registered under '" + node.functionName() + "'"), 0L);
				return;
			}

			trace("Dispatching {} = {}{}", node.id(), node.functionName(), args);
			emitter.emit(InvocationKind.TOOL, InvocationEventType.STARTED, node.functionName(), invocationId, null,
					attributes);
			Tool target = tool.get();
			Future<Outcome> future;
			try {
				future = completions.submit(() -> invoke(target, args));
			}
			catch (RejectedExecutionException e) {
				fail(new InFlight(node, invocationId), new ToolInvocationException(node.functionName(),
						"Executor rejected invocation of '" + node.functionName() + "'", e), 0L);
				return;
			}
			inFlight.put(future, new InFlight(node, invocationId));
		}

		private List<Object> resolveArguments(DependencyNode node) {
			List<Object> args = new ArrayList<>(node.call().arguments().size());
			for (Argument argument : node.call().arguments()) {
				if (argument instanceof Argument.Reference reference) {
					args.add(plan.node(reference.placeholder()).result());
				} else {
					args.add(((Argument.Literal) argument).value());
				}
			}
			return args;
		}

		private Future<Outcome> awaitNext() {
			try {
				return completions.take();
			}
			catch (InterruptedException e) {
				inFlight.keySet().forEach(future -> future.cancel(true));
				Thread.currentThread().interrupt();
				throw new ExecutionCancelledException(
						"Plan execution interrupted with " + inFlight.size() + " invocation(s) in flight", e);
			}
		}

		private Outcome outcomeOf(Future<Outcome> completed) {
			try {
				return completed.get();
			}
			catch (ExecutionException e) {
				return new Outcome(null, e.getCause(), 0L);
			}
			catch (CancellationException e) {
				return new Outcome(null, e, 0L);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new ExecutionCancelledException("Plan execution interrupted", e);
			}
		}

		private void apply(InFlight call, Outcome outcome) {
			if (outcome.failed()) {
				fail(call, outcome.error(), outcome.durationMs());
				return;
			}
			DependencyNode node = call.node();
			node.markDone(outcome.value());
			trace("Completed {} = {} in {} ms", node.id(), outcome.value(), outcome.durationMs());
			emitter.emit(InvocationKind.TOOL, InvocationEventType.SUCCEEDED, node.functionName(), call.invocationId(),
					outcome.durationMs(), Map.of("placeholder", node.id()));

			for (String dependent : plan.dependents(node.id())) {
				int remaining = unresolved.merge(dependent, -1, Integer::sum);
				if (remaining == 0 && !halted()) {
					enqueue(plan.node(dependent));
				}
			}
		}

		private void fail(InFlight call, Throwable error, long durationMs) {
			DependencyNode node = call.node();
			node.markFailed(error);
			String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
			NodeFailure failure = new NodeFailure(node.id(), node.functionName(), node.resolvedArgs(), message, error);
			failures.add(failure);
			logger.warn("Tool invocation failed: {}", failure.describe());
			emitter.emit(InvocationKind.TOOL, InvocationEventType.FAILED, node.functionName(), call.invocationId(),
					durationMs, Map.of("placeholder", node.id(), "error", message));
		}
	}

	private static Outcome invoke(Tool tool, List<Object> args) {
		long start = System.nanoTime();
		try {
			Object value = tool.invoke(args);
			return new Outcome(value, null, elapsedMs(start));
		}
		catch (Exception e) {
			return new Outcome(null, e, elapsedMs(start));
		}
	}

	private static long elapsedMs(long startNanos) {
		return (System.nanoTime() - startNanos) / 1_000_000;
	}

	private static final class ToolThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable task) {
			Thread thread = new Thread(task, "abstraction-chain-tool-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}

	/**
	 * Builder for configuring a {@link DefaultExecutionEngine}.
	 */
	public static final class Builder {
		private int concurrencyLimit = DEFAULT_CONCURRENCY_LIMIT;
		private ExecutorService executor;
		private boolean verbose;

		private Builder() {
		}

		/**
		 * Maximum number of tool invocations in flight for one plan.
		 *
		 * @param concurrencyLimit at least 1
		 * @return this builder
		 */
		public Builder concurrencyLimit(int concurrencyLimit) {
			if (concurrencyLimit < 1) {
				throw new IllegalArgumentException("concurrencyLimit must be at least 1: " + concurrencyLimit);
			}
			this.concurrencyLimit = concurrencyLimit;
			return this;
		}

		/**
		 * Run tool invocations on a caller-owned executor instead of a pool
		 * created per run. The engine never shuts it down.
		 *
		 * @param executor the executor to use
		 * @return this builder
		 */
		public Builder executor(ExecutorService executor) {
			this.executor = executor;
			return this;
		}

		/**
		 * Log dispatches and completions at INFO instead of DEBUG.
		 *
		 * @param verbose whether to log verbosely
		 * @return this builder
		 */
		public Builder verbose(boolean verbose) {
			this.verbose = verbose;
			return this;
		}

		public DefaultExecutionEngine build() {
			return new DefaultExecutionEngine(this);
		}
	}
}
