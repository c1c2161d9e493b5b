package org.javai.springai.chain.rewrite;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Turns a tool result into the literal text substituted into the plan.
 * <p>
 * Strings are used verbatim, scalars via {@link String#valueOf(Object)}
 * ({@link BigDecimal} in plain notation), {@code null} as {@code null}, and
 * everything else as compact JSON.
 */
public class ResultRenderer {

	private final ObjectMapper mapper;

	public ResultRenderer() {
		this(new ObjectMapper());
	}

	public ResultRenderer(ObjectMapper mapper) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	/**
	 * @throws IllegalArgumentException if the value cannot be serialised
	 */
	public String render(Object value) {
		if (value == null) {
			return "null";
		}
		if (value instanceof CharSequence text) {
			return text.toString();
		}
		if (value instanceof BigDecimal decimal) {
			return decimal.toPlainString();
		}
		if (value instanceof Number || value instanceof Boolean || value instanceof Character
				|| value instanceof Enum<?>) {
			return String.valueOf(value);
		}
		try {
			return mapper.writeValueAsString(value);
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Cannot render result of type " + value.getClass().getName(), e);
		}
	}
}
