package org.javai.springai.chain.parse;

/**
 * One comma-separated argument of a call marker, before classification.
 *
 * @param type whether the argument was quoted
 * @param value unescaped content for quoted tokens, trimmed text otherwise
 * @param raw the trimmed source text, quotes included
 * @param position offset of the token within the argument list
 */
public record ArgumentToken(TokenType type, String value, String raw, int position) {

	public enum TokenType {
		QUOTED,    // 'text' or "text"
		BARE       // numbers, booleans, identifiers, anything else unquoted
	}

	public boolean isQuoted() {
		return type == TokenType.QUOTED;
	}

	@Override
	public String toString() {
		return type == TokenType.QUOTED ? "QUOTED(" + raw + ")" : "BARE(" + value + ")";
	}
}
