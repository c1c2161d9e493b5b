package org.javai.springai.chain.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text between a marker's parentheses into argument tokens.
 * <p>
 * Commas only separate arguments at nesting depth zero and outside quotes, so
 * {@code "a, b"} and {@code f(1, 2)} each stay one argument. Both quote
 * characters are accepted; a backslash escapes the next character inside a
 * quoted string. A quote only opens a string at the start of a token, so an
 * apostrophe inside a bare word is ordinary text.
 */
public class ArgumentTokenizer {

	private final String input;
	private int pos = 0;

	public ArgumentTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * @return tokens in order; empty when the argument list is blank
	 * @throws ArgumentSyntaxException on an empty argument, an unterminated
	 * string, unbalanced brackets, or text trailing a quoted string
	 */
	public List<ArgumentToken> tokenize() {
		List<ArgumentToken> tokens = new ArrayList<>();
		if (input.isBlank()) {
			return tokens;
		}

		while (true) {
			tokens.add(nextToken());
			if (isAtEnd()) {
				break;
			}
			advance(); // consume ','
		}
		return tokens;
	}

	private ArgumentToken nextToken() {
		skipWhitespace();
		int start = pos;
		if (isAtEnd() || peek() == ',') {
			throw new ArgumentSyntaxException("Empty argument at position " + start);
		}
		if (isQuote(peek())) {
			return scanQuoted(start);
		}
		return scanBare(start);
	}

	private ArgumentToken scanQuoted(int start) {
		char quote = advance();
		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != quote) {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}
		if (isAtEnd()) {
			throw new ArgumentSyntaxException("Unterminated string at position " + start);
		}
		advance(); // consume closing quote
		String raw = input.substring(start, pos);
		skipWhitespace();
		if (!isAtEnd() && peek() != ',') {
			throw new ArgumentSyntaxException(
					"Unexpected '" + peek() + "' after string at position " + pos);
		}
		return new ArgumentToken(ArgumentToken.TokenType.QUOTED, sb.toString(), raw, start);
	}

	private ArgumentToken scanBare(int start) {
		int depth = 0;
		while (!isAtEnd()) {
			char c = peek();
			if (depth == 0 && c == ',') {
				break;
			}
			if (isQuote(c) && opensString(input, pos, 0)) {
				skipQuoted(c);
				continue;
			}
			if (isOpening(c)) {
				depth++;
			} else if (isClosing(c)) {
				if (depth == 0) {
					throw new ArgumentSyntaxException("Unbalanced '" + c + "' at position " + pos);
				}
				depth--;
			}
			advance();
		}
		if (depth != 0) {
			throw new ArgumentSyntaxException("Unclosed bracket in argument at position " + start);
		}
		String raw = input.substring(start, pos).strip();
		return new ArgumentToken(ArgumentToken.TokenType.BARE, raw, raw, start);
	}

	private void skipQuoted(char quote) {
		int start = pos;
		advance();
		while (!isAtEnd() && peek() != quote) {
			if (advance() == '\\' && !isAtEnd()) {
				advance();
			}
		}
		if (isAtEnd()) {
			throw new ArgumentSyntaxException("Unterminated string at position " + start);
		}
		advance();
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			advance();
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	/**
	 * Whether the quote at {@code index} starts a string: it must be the first
	 * non-blank character after {@code regionStart} or follow an opening
	 * bracket, a comma, a colon or an equals sign.
	 */
	static boolean opensString(CharSequence text, int index, int regionStart) {
		int i = index - 1;
		while (i >= regionStart && Character.isWhitespace(text.charAt(i))) {
			i--;
		}
		if (i < regionStart) {
			return true;
		}
		char previous = text.charAt(i);
		return isOpening(previous) || previous == ',' || previous == ':' || previous == '=';
	}

	static boolean isQuote(char c) {
		return c == '\'' || c == '"';
	}

	static boolean isOpening(char c) {
		return c == '(' || c == '[' || c == '{';
	}

	static boolean isClosing(char c) {
		return c == ')' || c == ']' || c == '}';
	}
}
