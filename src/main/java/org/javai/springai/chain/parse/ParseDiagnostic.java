package org.javai.springai.chain.parse;

import java.util.Objects;

/**
 * A marker that was left in the text as-is instead of becoming a call.
 *
 * @param kind why it was skipped
 * @param position index of the marker's opening {@code [}
 * @param message human-readable reason
 * @param text the offending text, as far as it could be delimited
 */
public record ParseDiagnostic(Kind kind, int position, String message, String text) {

	public enum Kind {
		/** The bracket syntax could not be read. */
		MALFORMED,
		/** Well-formed, but names a function that is not available to this run. */
		UNKNOWN_FUNCTION
	}

	public ParseDiagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		message = message != null ? message : "";
		text = text != null ? text : "";
	}

	@Override
	public String toString() {
		return kind + " at " + position + ": " + message;
	}
}
