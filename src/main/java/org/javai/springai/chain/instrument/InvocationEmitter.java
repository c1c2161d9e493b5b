package org.javai.springai.chain.instrument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits invocation events to registered listeners. One emitter per run; the
 * sequence counter orders every event of that run.
 */
public class InvocationEmitter {

	private static final Logger logger = LoggerFactory.getLogger(InvocationEmitter.class);

	private final String correlationId;
	private final List<InvocationListener> listeners;
	private final AtomicLong sequence = new AtomicLong();

	public InvocationEmitter(String correlationId, List<InvocationListener> listeners) {
		this.correlationId = correlationId != null ? correlationId : "";
		this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
	}

	public static InvocationEmitter of(String correlationId, InvocationListener... listeners) {
		List<InvocationListener> list = new ArrayList<>();
		if (listeners != null) {
			for (InvocationListener l : listeners) {
				if (l != null) {
					list.add(l);
				}
			}
		}
		return new InvocationEmitter(correlationId, list);
	}

	public static InvocationEmitter silent() {
		return new InvocationEmitter("", List.of());
	}

	public String correlationId() {
		return correlationId;
	}

	public boolean hasListeners() {
		return !listeners.isEmpty();
	}

	public String nextInvocationId() {
		return UUID.randomUUID().toString();
	}

	public void emit(InvocationKind kind, InvocationEventType type, String name, String invocationId,
			Long durationMs, Map<String, Object> attributes) {
		long seq = sequence.incrementAndGet();
		if (listeners.isEmpty()) {
			return;
		}
		InvocationEvent event = new InvocationEvent(
				Objects.requireNonNullElse(kind, InvocationKind.TOOL),
				Objects.requireNonNullElse(type, InvocationEventType.REQUESTED),
				name,
				correlationId,
				invocationId,
				seq,
				Instant.now(),
				durationMs,
				attributes);
		for (InvocationListener listener : listeners) {
			try {
				listener.onEvent(event);
			}
			catch (RuntimeException e) {
				logger.warn("Invocation listener {} failed on {} {}", listener, type, name, e);
			}
		}
	}
}
