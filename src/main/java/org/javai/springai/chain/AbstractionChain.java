package org.javai.springai.chain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.StringUtils;
import org.javai.springai.chain.api.PlanSource;
import org.javai.springai.chain.api.RefinementSink;
import org.javai.springai.chain.api.Tool;
import org.javai.springai.chain.api.ToolRegistry;
import org.javai.springai.chain.config.ChainOptions;
import org.javai.springai.chain.exec.DefaultExecutionEngine;
import org.javai.springai.chain.exec.ExecutionCancelledException;
import org.javai.springai.chain.exec.ExecutionEngine;
import org.javai.springai.chain.exec.ExecutionReport;
import org.javai.springai.chain.exec.NodeFailure;
import org.javai.springai.chain.graph.DependencyGraphBuilder;
import org.javai.springai.chain.graph.ExecutionPlan;
import org.javai.springai.chain.graph.PlanGraphException;
import org.javai.springai.chain.instrument.InvocationEmitter;
import org.javai.springai.chain.instrument.InvocationEventType;
import org.javai.springai.chain.instrument.InvocationKind;
import org.javai.springai.chain.instrument.InvocationListener;
import org.javai.springai.chain.parse.CallExpressionParser;
import org.javai.springai.chain.parse.ParseDiagnostic;
import org.javai.springai.chain.parse.ParseResult;
import org.javai.springai.chain.prompt.ChatClientPlanSource;
import org.javai.springai.chain.prompt.ChatClientRefinementSink;
import org.javai.springai.chain.rewrite.PlanRewriteException;
import org.javai.springai.chain.rewrite.PlanRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Drives one question through both model passes:
 * request plan, parse, build graph, execute, rewrite, refine.
 * <p>
 * Every failure is reported through {@link ChainRunResult}; {@link #run(String)}
 * does not throw for model, graph, tool or rewrite errors. A run that fails
 * never asks the model for a final answer.
 *
 * <pre>{@code
 * AbstractionChain chain = AbstractionChain.builder()
 *     .chatClient(chatClient)
 *     .tools(ToolCallbackRegistries.fromToolObjects(new ArithmeticTools()))
 *     .options(ChainOptions.builder().concurrencyLimit(6).build())
 *     .build();
 * ChainRunResult result = chain.run("Sally has 3 apples ...");
 * }</pre>
 */
public final class AbstractionChain {

	private static final Logger logger = LoggerFactory.getLogger(AbstractionChain.class);

	static final String PLAN_BOUNDARY = "plan";
	static final String REFINE_BOUNDARY = "refine";

	private final PlanSource planSource;
	private final RefinementSink refinementSink;
	private final ToolRegistry tools;
	private final ChainOptions options;
	private final List<InvocationListener> listeners;
	private final CallExpressionParser parser;
	private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
	private final ExecutionEngine engine;
	private final PlanRewriter rewriter = new PlanRewriter();

	private AbstractionChain(Builder builder) {
		this.options = builder.options;
		PlanSource source = builder.planSource;
		RefinementSink sink = builder.refinementSink;
		if (builder.chatClient != null && source == null) {
			source = new ChatClientPlanSource(builder.chatClient, options.reasoningTemplate(), null);
		}
		if (builder.chatClient != null && sink == null) {
			sink = new ChatClientRefinementSink(builder.chatClient, options.refinementTemplate());
		}
		this.planSource = Objects.requireNonNull(source, "planSource must not be null");
		this.refinementSink = Objects.requireNonNull(sink, "refinementSink must not be null");
		this.tools = builder.tools.build();
		this.listeners = List.copyOf(builder.listeners);
		this.parser = CallExpressionParser.forTools(tools, options.referencePattern());
		this.engine = DefaultExecutionEngine.builder()
				.concurrencyLimit(options.concurrencyLimit())
				.executor(builder.executor)
				.verbose(options.verbose())
				.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public ToolRegistry tools() {
		return tools;
	}

	public ChainOptions options() {
		return options;
	}

	/**
	 * Answer a question. Each call is independent: it owns its own plan and
	 * shares no mutable state with concurrent calls.
	 */
	public ChainRunResult run(String question) {
		Objects.requireNonNull(question, "question must not be null");
		InvocationEmitter emitter = new InvocationEmitter(UUID.randomUUID().toString(), listeners);
		ChainRunResult result = new Run(question, emitter).execute();
		if (result.isSuccess()) {
			logger.info("Run {} succeeded", emitter.correlationId());
		} else {
			logger.info("Run {} ended with {}: {}", emitter.correlationId(), result.outcome(), result.failureReason());
		}
		return result;
	}

	private void trace(String format, Object... args) {
		if (options.verbose()) {
			logger.info(format, args);
		} else {
			logger.debug(format, args);
		}
	}

	/**
	 * State of one question; fields fill in as the run progresses.
	 */
	private final class Run {

		private final String question;
		private final InvocationEmitter emitter;

		private String planText;
		private ParseResult parsed;
		private ExecutionReport report;
		private String filledPlan;

		Run(String question, InvocationEmitter emitter) {
			this.question = question;
			this.emitter = emitter;
		}

		ChainRunResult execute() {
			if (Thread.currentThread().isInterrupted()) {
				return cancelled("Run cancelled before the plan was requested", null);
			}
			try {
				planText = callModel(PLAN_BOUNDARY, () -> planSource.requestPlan(tools.renderSignatures(), question));
			}
			catch (RuntimeException e) {
				return fail(ChainOutcome.PLAN_REQUEST_FAILED, "Plan request failed: " + messageOf(e), e);
			}
			trace("Plan for run {}:\n{}", emitter.correlationId(), planText);

			parsed = parser.parse(planText);

			ExecutionPlan plan;
			try {
				plan = graphBuilder.build(parsed);
			}
			catch (PlanGraphException e) {
				return fail(ChainOutcome.GRAPH_INVALID, e.getMessage(), e);
			}

			try {
				report = executePlan(plan);
			}
			catch (ExecutionCancelledException e) {
				return cancelled(e.getMessage(), e);
			}
			if (!report.success()) {
				NodeFailure failure = report.firstFailure().orElseThrow();
				return fail(ChainOutcome.EXECUTION_FAILED, "Could not complete the plan: " + failure.describe(),
						failure.cause());
			}

			try {
				filledPlan = rewriter.rewrite(plan);
			}
			catch (PlanRewriteException e) {
				return fail(ChainOutcome.REWRITE_FAILED, e.getMessage(), e);
			}
			trace("Filled plan for run {}:\n{}", emitter.correlationId(), filledPlan);

			if (Thread.currentThread().isInterrupted()) {
				return cancelled("Run cancelled before the final answer was requested", null);
			}
			String answer;
			try {
				answer = callModel(REFINE_BOUNDARY, () -> refinementSink.refine(question, filledPlan));
			}
			catch (RuntimeException e) {
				return fail(ChainOutcome.REFINEMENT_FAILED, "Refinement failed: " + messageOf(e), e);
			}
			return ChainRunResult.succeeded(question, planText, parsed.diagnostics(), filledPlan, answer, report);
		}

		private ExecutionReport executePlan(ExecutionPlan plan) {
			if (options.toolTimeout() == null || plan.isEmpty()) {
				return engine.execute(plan, tools, emitter);
			}
			// each engine worker blocks on its timed call, so the calls need their own pool
			ExecutorService timeoutPool = Executors.newCachedThreadPool(new DaemonThreadFactory());
			try {
				return engine.execute(plan, tools.withTimeout(options.toolTimeout(), timeoutPool), emitter);
			}
			finally {
				timeoutPool.shutdownNow();
			}
		}

		private String callModel(String boundary, ModelCall call) {
			String invocationId = emitter.nextInvocationId();
			InvocationKind kind = PLAN_BOUNDARY.equals(boundary) ? InvocationKind.PLAN : InvocationKind.REFINE;
			emitter.emit(kind, InvocationEventType.STARTED, boundary, invocationId, null,
					Map.of("question", StringUtils.abbreviate(question, 200)));
			long start = System.nanoTime();
			try {
				String text = call.invoke();
				if (text == null) {
					throw new IllegalStateException("Model returned no text at the " + boundary + " boundary");
				}
				emitter.emit(kind, InvocationEventType.SUCCEEDED, boundary, invocationId, elapsedMs(start),
						Map.of("length", text.length()));
				return text;
			}
			catch (RuntimeException e) {
				emitter.emit(kind, InvocationEventType.FAILED, boundary, invocationId, elapsedMs(start),
						Map.of("error", messageOf(e)));
				throw e;
			}
		}

		private ChainRunResult fail(ChainOutcome outcome, String reason, Throwable error) {
			return ChainRunResult.failed(outcome, question, planText, diagnostics(), filledPlan, report, reason, error);
		}

		private ChainRunResult cancelled(String reason, Throwable error) {
			return fail(ChainOutcome.CANCELLED, reason, error);
		}

		private List<ParseDiagnostic> diagnostics() {
			return parsed != null ? parsed.diagnostics() : List.of();
		}
	}

	@FunctionalInterface
	private interface ModelCall {
		String invoke();
	}

	private static String messageOf(Throwable e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}

	private static long elapsedMs(long startNanos) {
		return (System.nanoTime() - startNanos) / 1_000_000;
	}

	private static final class DaemonThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable task) {
			Thread thread = new Thread(task, "abstraction-chain-timeout-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}

	/**
	 * Builder for configuring an {@link AbstractionChain}.
	 */
	public static final class Builder {
		private PlanSource planSource;
		private RefinementSink refinementSink;
		private ChatClient chatClient;
		private final ToolRegistry.Builder tools = ToolRegistry.builder();
		private ChainOptions options = ChainOptions.defaults();
		private ExecutorService executor;
		private final List<InvocationListener> listeners = new ArrayList<>();

		private Builder() {
		}

		public Builder planSource(PlanSource planSource) {
			this.planSource = planSource;
			return this;
		}

		public Builder refinementSink(RefinementSink refinementSink) {
			this.refinementSink = refinementSink;
			return this;
		}

		/**
		 * Ask {@code chatClient} for both the plan and the final answer, using the
		 * reasoning and refinement templates of the configured options. An explicit
		 * {@link #planSource} or {@link #refinementSink} takes precedence.
		 */
		public Builder chatClient(ChatClient chatClient) {
			this.chatClient = chatClient;
			return this;
		}

		/**
		 * Add every tool of {@code registry}. May be called more than once;
		 * a name registered twice is rejected.
		 */
		public Builder tools(ToolRegistry registry) {
			this.tools.registerAll(registry);
			return this;
		}

		public Builder tool(String name, Tool tool) {
			this.tools.register(name, tool);
			return this;
		}

		public Builder options(ChainOptions options) {
			this.options = Objects.requireNonNull(options, "options must not be null");
			return this;
		}

		/**
		 * Run tool invocations on a caller-owned executor. The chain never shuts it down.
		 */
		public Builder executor(ExecutorService executor) {
			this.executor = executor;
			return this;
		}

		public Builder listener(InvocationListener listener) {
			this.listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
			return this;
		}

		public AbstractionChain build() {
			return new AbstractionChain(this);
		}
	}
}
