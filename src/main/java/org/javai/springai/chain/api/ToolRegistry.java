package org.javai.springai.chain.api;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Immutable name-to-tool mapping built once per run.
 * <p>
 * Registration order is preserved; it is the order in which signatures are
 * rendered for the model.
 */
public final class ToolRegistry {

	private final Map<String, Entry> entries;

	private ToolRegistry(Map<String, Entry> entries) {
		this.entries = entries;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static ToolRegistry empty() {
		return new ToolRegistry(Map.of());
	}

	public Optional<Tool> find(String name) {
		Entry entry = entries.get(name);
		return entry != null ? Optional.of(entry.tool()) : Optional.empty();
	}

	public boolean contains(String name) {
		return entries.containsKey(name);
	}

	public Set<String> names() {
		return entries.keySet();
	}

	public List<ToolSignature> signatures() {
		return entries.values().stream().map(Entry::signature).toList();
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/**
	 * One rendered signature per line, in registration order.
	 */
	public String renderSignatures() {
		return entries.values().stream()
				.map(entry -> entry.signature().render())
				.collect(Collectors.joining("\n"));
	}

	/**
	 * Returns a registry whose tools give up after {@code timeout}.
	 *
	 * @param timeout per-invocation limit
	 * @param executor runs the wrapped invocations; owned by the caller
	 */
	public ToolRegistry withTimeout(Duration timeout, ExecutorService executor) {
		Objects.requireNonNull(timeout, "timeout must not be null");
		Objects.requireNonNull(executor, "executor must not be null");
		Map<String, Entry> wrapped = new LinkedHashMap<>();
		entries.forEach((name, entry) -> wrapped.put(name,
				new Entry(entry.signature(), new TimeLimitedTool(name, entry.tool(), timeout, executor))));
		return new ToolRegistry(Collections.unmodifiableMap(wrapped));
	}

	@Override
	public String toString() {
		return "ToolRegistry" + entries.keySet();
	}

	private record Entry(ToolSignature signature, Tool tool) {
	}

	public static final class Builder {

		private final Map<String, Entry> entries = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder register(String name, Tool tool) {
			return register(ToolSignature.of(name), tool);
		}

		public Builder register(ToolSignature signature, Tool tool) {
			Objects.requireNonNull(signature, "signature must not be null");
			Objects.requireNonNull(tool, "tool must not be null");
			if (entries.containsKey(signature.name())) {
				throw new IllegalStateException("Duplicate tool definition: " + signature.name());
			}
			entries.put(signature.name(), new Entry(signature, tool));
			return this;
		}

		public Builder registerAll(ToolRegistry other) {
			Objects.requireNonNull(other, "other must not be null");
			other.entries.values().forEach(entry -> register(entry.signature(), entry.tool()));
			return this;
		}

		public ToolRegistry build() {
			return new ToolRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
		}
	}
}
