package org.javai.springai.chain.instrument;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.springai.chain.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class InvocationEmitterTest {

	@Test
	void deliversEventsWithIncreasingSequenceNumbers() {
		List<InvocationEvent> events = new ArrayList<>();
		InvocationEmitter emitter = InvocationEmitter.of("run-7", events::add);
		String invocationId = emitter.nextInvocationId();

		emitter.emit(InvocationKind.TOOL, InvocationEventType.REQUESTED, "add", invocationId, null,
				Map.of("placeholder", "y1"));
		emitter.emit(InvocationKind.TOOL, InvocationEventType.SUCCEEDED, "add", invocationId, 12L, null);

		assertThat(events).hasSize(2);
		assertThat(events).extracting(InvocationEvent::sequence).containsExactly(1L, 2L);
		assertThat(events).allSatisfy(event -> {
			assertThat(event.correlationId()).isEqualTo("run-7");
			assertThat(event.invocationId()).isEqualTo(invocationId);
			assertThat(event.name()).isEqualTo("add");
		});
		assertThat(events.get(0).attribute("placeholder")).isEqualTo("y1");
		assertThat(events.get(0).durationMs()).isNull();
		assertThat(events.get(1).durationMs()).isEqualTo(12L);
		assertThat(events.get(1).attributes()).isEmpty();
	}

	@Test
	void failingListenerIsLoggedAndDoesNotStopOthers() {
		List<InvocationEvent> received = new ArrayList<>();
		InvocationListener broken = event -> {
			throw new IllegalStateException("listener bug");
		};
		InvocationEmitter emitter = InvocationEmitter.of("run", broken, received::add);

		try (LogCaptorAppender logs = LogCaptorAppender.capture(InvocationEmitter.class, Level.WARN)) {
			emitter.emit(InvocationKind.PLAN, InvocationEventType.STARTED, "plan", "i-1", null, Map.of());

			assertThat(logs.messagesAt(Level.WARN)).singleElement()
					.satisfies(message -> assertThat(message).contains("STARTED").contains("plan"));
		}
		assertThat(received).singleElement()
				.satisfies(event -> assertThat(event.kind()).isEqualTo(InvocationKind.PLAN));
	}

	@Test
	void silentEmitterHasNoListeners() {
		InvocationEmitter emitter = InvocationEmitter.silent();

		emitter.emit(InvocationKind.TOOL, InvocationEventType.REQUESTED, "add", "i", null, Map.of());

		assertThat(emitter.hasListeners()).isFalse();
		assertThat(emitter.nextInvocationId()).isNotEqualTo(emitter.nextInvocationId());
	}
}
