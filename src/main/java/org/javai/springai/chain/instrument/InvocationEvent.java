package org.javai.springai.chain.instrument;

import java.time.Instant;
import java.util.Map;

/**
 * One lifecycle step of a tool or model invocation.
 *
 * @param kind what was invoked
 * @param type lifecycle step
 * @param name tool name, or the model boundary name
 * @param correlationId identifies the run
 * @param invocationId identifies the invocation within the run
 * @param sequence order of the event within the run, starting at 1
 * @param timestamp when the event was emitted
 * @param durationMs elapsed time for SUCCEEDED/FAILED events, otherwise {@code null}
 * @param attributes extra details such as {@code placeholder}, {@code arguments} or {@code error}
 */
public record InvocationEvent(
		InvocationKind kind,
		InvocationEventType type,
		String name,
		String correlationId,
		String invocationId,
		long sequence,
		Instant timestamp,
		Long durationMs,
		Map<String, Object> attributes) {

	public InvocationEvent {
		kind = kind != null ? kind : InvocationKind.TOOL;
		type = type != null ? type : InvocationEventType.REQUESTED;
		name = name != null ? name : "";
		correlationId = correlationId != null ? correlationId : "";
		invocationId = invocationId != null ? invocationId : "";
		timestamp = timestamp != null ? timestamp : Instant.now();
		attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
	}

	public Object attribute(String key) {
		return attributes.get(key);
	}
}
