package org.javai.springai.chain.parse;

import java.util.Objects;

/**
 * One argument of a call expression: either a literal value or a reference to
 * the placeholder of another call.
 */
public sealed interface Argument {

	/**
	 * The argument text as written in the plan, trimmed.
	 */
	String raw();

	static Literal literal(Object value, String raw) {
		return new Literal(value, raw);
	}

	static Reference reference(String placeholder) {
		return new Reference(placeholder);
	}

	/**
	 * @param value coerced value: Integer, Long, BigInteger, Double, Boolean or String
	 * @param raw source text
	 */
	record Literal(Object value, String raw) implements Argument {

		public Literal {
			Objects.requireNonNull(value, "value must not be null");
			raw = raw != null ? raw : String.valueOf(value);
		}

		@Override
		public String toString() {
			return raw;
		}
	}

	record Reference(String placeholder) implements Argument {

		public Reference {
			Objects.requireNonNull(placeholder, "placeholder must not be null");
		}

		@Override
		public String raw() {
			return placeholder;
		}

		@Override
		public String toString() {
			return placeholder;
		}
	}
}
