package org.javai.springai.chain.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.Level;
import org.javai.springai.chain.api.ToolInvocationException;
import org.javai.springai.chain.api.ToolRegistry;
import org.javai.springai.chain.graph.DependencyGraphBuilder;
import org.javai.springai.chain.graph.ExecutionPlan;
import org.javai.springai.chain.graph.NodeStatus;
import org.javai.springai.chain.instrument.InvocationEmitter;
import org.javai.springai.chain.instrument.InvocationEvent;
import org.javai.springai.chain.instrument.InvocationEventType;
import org.javai.springai.chain.parse.CallExpressionParser;
import org.javai.springai.chain.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultExecutionEngine")
class DefaultExecutionEngineTest {

	private static final ToolRegistry ARITHMETIC = ToolRegistry.builder()
			.register("add", args -> ((Number) args.get(0)).intValue() + ((Number) args.get(1)).intValue())
			.register("multiply", args -> ((Number) args.get(0)).intValue() * ((Number) args.get(1)).intValue())
			.build();

	private static ExecutionPlan plan(ToolRegistry tools, String text) {
		return new DependencyGraphBuilder().build(CallExpressionParser.forTools(tools).parse(text));
	}

	private static ExecutionPlan plan(String text, String... functionNames) {
		CallExpressionParser parser = new CallExpressionParser(Set.of(functionNames));
		return new DependencyGraphBuilder().build(parser.parse(text));
	}

	@Nested
	@DisplayName("ordering")
	class Ordering {

		@Test
		void emptyPlanIsATriviallyEmptySuccess() {
			ExecutionPlan plan = plan(ARITHMETIC, "No calls at all.");

			ExecutionReport report = new DefaultExecutionEngine().execute(plan, ARITHMETIC);

			assertThat(report.success()).isTrue();
			assertThat(report.results()).isEmpty();
			assertThat(report.dispatchOrder()).isEmpty();
		}

		@Test
		void sallyPlanComputesFiveThenFifteen() {
			ExecutionPlan plan = plan(ARITHMETIC,
					"Sally has [FUNC add(3, 2) = y1] apples... multiplies by 3, [FUNC multiply(y1, 3) = y2] apples.");

			ExecutionReport report = new DefaultExecutionEngine().execute(plan, ARITHMETIC);

			assertThat(report.success()).isTrue();
			assertThat(report.results()).containsEntry("y1", 5).containsEntry("y2", 15);
			assertThat(report.dispatchOrder()).containsExactly("y1", "y2");
			assertThat(plan.node("y2").resolvedArgs()).containsExactly(5, 3);
			assertThat(plan.placeholdersWithStatus(NodeStatus.DONE)).containsExactly("y1", "y2");
		}

		@Test
		void dependencyCompletesBeforeDependentIsRequested() {
			List<InvocationEvent> events = Collections.synchronizedList(new ArrayList<>());
			ExecutionPlan plan = plan(ARITHMETIC,
					"[FUNC multiply(y3, 2) = y1] [FUNC add(1, 1) = y2] [FUNC add(y2, 1) = y3] [FUNC add(y1, y3) = y4]");

			ExecutionReport report = DefaultExecutionEngine.builder().concurrencyLimit(4).build()
					.execute(plan, ARITHMETIC, InvocationEmitter.of("run-1", events::add));

			assertThat(report.success()).isTrue();
			assertThat(report.results()).containsEntry("y2", 2).containsEntry("y3", 3).containsEntry("y1", 6)
					.containsEntry("y4", 9);
			for (String id : plan.nodes().keySet()) {
				for (String dependency : plan.node(id).dependencies()) {
					long dependencyDone = sequenceOf(events, dependency, InvocationEventType.SUCCEEDED);
					long dependentRequested = sequenceOf(events, id, InvocationEventType.REQUESTED);
					assertThat(dependencyDone)
							.as("%s must complete before %s is dispatched", dependency, id)
							.isLessThan(dependentRequested);
				}
			}
			assertThat(report.dispatchIndex("y2")).isLessThan(report.dispatchIndex("y3"));
			assertThat(report.dispatchIndex("y3")).isLessThan(report.dispatchIndex("y1"));
			assertThat(report.dispatchIndex("y1")).isLessThan(report.dispatchIndex("y4"));
		}

		@Test
		void nullResultIsPassedOnAsNullArgument() {
			AtomicReference<List<Object>> seen = new AtomicReference<>();
			ToolRegistry tools = ToolRegistry.builder()
					.register("nothing", args -> null)
					.register("echo", args -> {
						seen.set(args);
						return "got " + args.get(0);
					})
					.build();
			ExecutionPlan plan = plan(tools, "[FUNC nothing() = y1] [FUNC echo(y1) = y2]");

			ExecutionReport report = new DefaultExecutionEngine().execute(plan, tools);

			assertThat(report.success()).isTrue();
			assertThat(report.results()).containsEntry("y1", null).containsEntry("y2", "got null");
			assertThat(seen.get()).containsExactly((Object) null);
		}

		private long sequenceOf(List<InvocationEvent> events, String placeholder, InvocationEventType type) {
			return events.stream()
					.filter(event -> event.type() == type && placeholder.equals(event.attribute("placeholder")))
					.mapToLong(InvocationEvent::sequence)
					.findFirst()
					.orElseThrow(() -> new AssertionError("No " + type + " event for " + placeholder));
		}
	}

	@Nested
	@DisplayName("concurrency")
	class Concurrency {

		@Test
		void independentCallsAreInFlightTogether() {
			CountDownLatch bothStarted = new CountDownLatch(2);
			ToolRegistry tools = ToolRegistry.builder()
					.register("uber_10k", args -> awaitPeer(bothStarted, "Uber revenue: $17.4B"))
					.register("lyft_10k", args -> awaitPeer(bothStarted, "Lyft revenue: $3.2B"))
					.build();
			ExecutionPlan plan = plan(tools,
					"[FUNC uber_10k(\"What was Uber's revenue in 2021?\") = y1] and "
							+ "[FUNC lyft_10k(\"What was Lyft's revenue in 2021?\") = y2]");

			ExecutionReport report = DefaultExecutionEngine.builder().concurrencyLimit(2).build().execute(plan, tools);

			assertThat(report.success()).isTrue();
			assertThat(report.results())
					.containsEntry("y1", "Uber revenue: $17.4B")
					.containsEntry("y2", "Lyft revenue: $3.2B");
			assertThat(plan.node("y1").resolvedArgs()).containsExactly("What was Uber's revenue in 2021?");
		}

		@Test
		void neverExceedsTheConcurrencyLimit() {
			AtomicInteger running = new AtomicInteger();
			AtomicInteger maxRunning = new AtomicInteger();
			ToolRegistry tools = ToolRegistry.builder()
					.register("slow", args -> {
						int now = running.incrementAndGet();
						maxRunning.accumulateAndGet(now, Math::max);
						Thread.sleep(30);
						running.decrementAndGet();
						return args.get(0);
					})
					.build();
			ExecutionPlan plan = plan(tools,
					"[FUNC slow(1) = y1] [FUNC slow(2) = y2] [FUNC slow(3) = y3] [FUNC slow(4) = y4] [FUNC slow(5) = y5]");

			ExecutionReport report = DefaultExecutionEngine.builder().concurrencyLimit(2).build().execute(plan, tools);

			assertThat(report.success()).isTrue();
			assertThat(report.results()).hasSize(5);
			assertThat(maxRunning.get()).isBetween(1, 2);
		}

		@Test
		void limitBelowOneIsRejected() {
			assertThatThrownBy(() -> DefaultExecutionEngine.builder().concurrencyLimit(0))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		void callerOwnedExecutorIsUsedAndLeftRunning() {
			ExecutorService executor = Executors.newFixedThreadPool(2);
			try {
				AtomicReference<String> threadName = new AtomicReference<>();
				ToolRegistry tools = ToolRegistry.builder()
						.register("where", args -> {
							threadName.set(Thread.currentThread().getName());
							return "here";
						})
						.build();

				ExecutionReport report = DefaultExecutionEngine.builder().executor(executor).build()
						.execute(plan(tools, "[FUNC where() = y1]"), tools);

				assertThat(report.success()).isTrue();
				assertThat(threadName.get()).startsWith("pool-");
				assertThat(executor.isShutdown()).isFalse();
			}
			finally {
				executor.shutdownNow();
			}
		}

		private Object awaitPeer(CountDownLatch latch, String answer) throws InterruptedException {
			latch.countDown();
			if (!latch.await(5, TimeUnit.SECONDS)) {
				throw new IllegalStateException("peer invocation was never started");
			}
			return answer;
		}
	}

	@Nested
	@DisplayName("failures")
	class Failures {

		@Test
		void failingToolFailsTheRunAndNamesFunctionAndArguments() {
			ToolRegistry tools = ToolRegistry.builder()
					.register("add", args -> {
						throw new IllegalStateException("calculator offline");
					})
					.register("multiply", args -> 0)
					.build();
			ExecutionPlan plan = plan(tools, "[FUNC add(3, 2) = y1] [FUNC multiply(y1, 3) = y2]");

			ExecutionReport report = new DefaultExecutionEngine().execute(plan, tools);

			assertThat(report.success()).isFalse();
			assertThat(report.firstFailure()).hasValueSatisfying(failure -> {
				assertThat(failure.placeholder()).isEqualTo("y1");
				assertThat(failure.functionName()).isEqualTo("add");
				assertThat(failure.arguments()).containsExactly(3, 2);
				assertThat(failure.message()).isEqualTo("calculator offline");
				assertThat(failure.cause()).isInstanceOf(IllegalStateException.class);
				assertThat(failure.describe()).isEqualTo("y1 = add[3, 2] failed: calculator offline");
			});
			assertThat(plan.node("y1").status()).isEqualTo(NodeStatus.FAILED);
			assertThat(plan.node("y2").status()).isEqualTo(NodeStatus.PENDING);
			assertThat(report.dispatchOrder()).containsExactly("y1");
		}

		@Test
		void nothingNewIsDispatchedAfterAFailure() {
			AtomicBoolean laterRan = new AtomicBoolean();
			ToolRegistry tools = ToolRegistry.builder()
					.register("broken", args -> {
						throw new ToolInvocationException("broken", "no");
					})
					.register("fine", args -> {
						laterRan.set(true);
						return 1;
					})
					.build();
			ExecutionPlan plan = plan(tools, "[FUNC broken() = y1] [FUNC fine() = y2]");

			ExecutionReport report = DefaultExecutionEngine.builder().concurrencyLimit(1).build().execute(plan, tools);

			assertThat(report.success()).isFalse();
			assertThat(laterRan).isFalse();
			assertThat(plan.node("y2").status()).isEqualTo(NodeStatus.READY);
			assertThat(report.dispatchIndex("y2")).isEqualTo(-1);
		}

		@Test
		void completedSiblingResultsAreRetained() {
			CountDownLatch failureSeen = new CountDownLatch(1);
			ToolRegistry tools = ToolRegistry.builder()
					.register("slow_ok", args -> {
						failureSeen.await(5, TimeUnit.SECONDS);
						return "sibling";
					})
					.register("broken", args -> {
						failureSeen.countDown();
						throw new IllegalArgumentException("bad input");
					})
					.register("after", args -> "never")
					.build();
			ExecutionPlan plan = plan(tools, "[FUNC slow_ok() = y1] [FUNC broken() = y2] [FUNC after(y2) = y3]");

			ExecutionReport report = DefaultExecutionEngine.builder().concurrencyLimit(4).build().execute(plan, tools);

			assertThat(report.success()).isFalse();
			assertThat(report.results()).containsOnlyKeys("y1").containsEntry("y1", "sibling");
			assertThat(report.failures()).extracting(NodeFailure::placeholder).containsExactly("y2");
			assertThat(plan.node("y3").status()).isEqualTo(NodeStatus.PENDING);
			assertThat(report.describe())
					.contains("y1 = slow_ok: DONE -> sibling")
					.contains("y2 = broken: FAILED (bad input)")
					.contains("y3 = after: PENDING");
		}

		@Test
		void unregisteredToolFailsItsNode() {
			ExecutionPlan plan = plan("[FUNC ghost(1) = y1]", "ghost");

			ExecutionReport report = new DefaultExecutionEngine().execute(plan, ARITHMETIC);

			assertThat(report.success()).isFalse();
			assertThat(report.firstFailure()).hasValueSatisfying(failure -> {
				assertThat(failure.cause()).isInstanceOf(ToolInvocationException.class);
				assertThat(failure.message()).contains("No tool registered under 'ghost'");
			});
		}

		@Test
		void executorThatRejectsWorkFailsTheNodeInsteadOfThrowing() {
			ExecutorService executor = Executors.newSingleThreadExecutor();
			executor.shutdown();
			ExecutionPlan plan = plan(ARITHMETIC, "[FUNC add(3, 2) = y1] [FUNC multiply(y1, 3) = y2]");

			ExecutionReport report = DefaultExecutionEngine.builder().executor(executor).build()
					.execute(plan, ARITHMETIC);

			assertThat(report.success()).isFalse();
			assertThat(report.firstFailure()).hasValueSatisfying(failure -> {
				assertThat(failure.placeholder()).isEqualTo("y1");
				assertThat(failure.cause()).isInstanceOf(ToolInvocationException.class);
				assertThat(failure.message()).contains("Executor rejected invocation of 'add'");
			});
			assertThat(plan.node("y1").status()).isEqualTo(NodeStatus.FAILED);
			assertThat(plan.node("y2").status()).isEqualTo(NodeStatus.PENDING);
		}

		@Test
		void failureIsLoggedAtWarnAndEmitted() {
			List<InvocationEvent> events = new ArrayList<>();
			ToolRegistry tools = ToolRegistry.builder()
					.register("add", args -> {
						throw new ArithmeticException("overflow");
					})
					.build();
			ExecutionPlan plan = plan(tools, "[FUNC add(1, 2) = y1]");

			try (LogCaptorAppender logs = LogCaptorAppender.capture(DefaultExecutionEngine.class, Level.WARN)) {
				new DefaultExecutionEngine().execute(plan, tools, InvocationEmitter.of("run", events::add));

				assertThat(logs.messagesAt(Level.WARN)).singleElement()
						.satisfies(message -> assertThat(message).contains("y1 = add[1, 2] failed: overflow"));
			}
			assertThat(events).extracting(InvocationEvent::type).containsExactly(
					InvocationEventType.REQUESTED, InvocationEventType.STARTED, InvocationEventType.FAILED);
			assertThat(events.get(2).attribute("error")).isEqualTo("overflow");
		}
	}

	@Nested
	@DisplayName("cancellation")
	class Cancellation {

		@Test
		void interruptingTheDriverCancelsInFlightWork() throws InterruptedException {
			CountDownLatch started = new CountDownLatch(1);
			CountDownLatch never = new CountDownLatch(1);
			ToolRegistry tools = ToolRegistry.builder()
					.register("hang", args -> {
						started.countDown();
						never.await();
						return null;
					})
					.build();
			ExecutionPlan plan = plan(tools, "[FUNC hang() = y1]");
			AtomicReference<Throwable> thrown = new AtomicReference<>();
			AtomicBoolean interruptRestored = new AtomicBoolean();

			Thread driver = new Thread(() -> {
				try {
					new DefaultExecutionEngine().execute(plan, tools);
				}
				catch (RuntimeException e) {
					thrown.set(e);
					interruptRestored.set(Thread.currentThread().isInterrupted());
				}
			});
			driver.start();
			assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
			driver.interrupt();
			driver.join(5000);

			assertThat(thrown.get()).isInstanceOf(ExecutionCancelledException.class);
			assertThat(interruptRestored).isTrue();
			assertThat(plan.node("y1").status()).isEqualTo(NodeStatus.RUNNING);
		}
	}
}
