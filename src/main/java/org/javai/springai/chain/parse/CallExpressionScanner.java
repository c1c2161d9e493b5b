package org.javai.springai.chain.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds {@code [FUNC name(args) = placeholder]} markers in free text.
 * <p>
 * Works as a small state machine started at every {@code [FUNC} occurrence.
 * A marker that cannot be read produces a {@link ParseDiagnostic} and the
 * scan resumes one character after its opening bracket, so a broken marker
 * never hides the ones after it. Text outside markers is not inspected.
 */
public class CallExpressionScanner {

	public static final String MARKER = "[FUNC";

	private final String input;
	private int pos;

	public CallExpressionScanner(String input) {
		this.input = Objects.requireNonNull(input, "input must not be null");
	}

	/**
	 * A syntactically valid marker, before function names and arguments are
	 * checked against the tools of a run.
	 */
	public record ScannedCall(String functionName, List<ArgumentToken> arguments, String placeholder,
			SourceSpan span) {

		public ScannedCall {
			arguments = List.copyOf(arguments);
		}
	}

	public record ScanResult(List<ScannedCall> calls, List<ParseDiagnostic> diagnostics) {

		public ScanResult {
			calls = List.copyOf(calls);
			diagnostics = List.copyOf(diagnostics);
		}
	}

	public ScanResult scan() {
		List<ScannedCall> calls = new ArrayList<>();
		List<ParseDiagnostic> diagnostics = new ArrayList<>();
		int from = 0;
		while (true) {
			int start = input.indexOf(MARKER, from);
			if (start < 0) {
				break;
			}
			try {
				ScannedCall call = readMarker(start);
				calls.add(call);
				from = call.span().end();
			}
			catch (ArgumentSyntaxException e) {
				diagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.MALFORMED, start, e.getMessage(),
						excerpt(start)));
				from = start + 1;
			}
		}
		return new ScanResult(calls, diagnostics);
	}

	private ScannedCall readMarker(int start) {
		pos = start + MARKER.length();
		if (isAtEnd() || !Character.isWhitespace(peek())) {
			throw new ArgumentSyntaxException("Expected whitespace after " + MARKER);
		}
		skipWhitespace();
		String name = readIdentifier("function name");
		skipWhitespace();
		expect('(');
		int argsStart = pos;
		int argsEnd = findArgumentListEnd(argsStart);
		pos = argsEnd + 1;
		skipWhitespace();
		expect('=');
		skipWhitespace();
		String placeholder = readIdentifier("placeholder");
		skipWhitespace();
		expect(']');

		List<ArgumentToken> arguments = new ArgumentTokenizer(input.substring(argsStart, argsEnd)).tokenize();
		return new ScannedCall(name, arguments, placeholder, new SourceSpan(start, pos));
	}

	/**
	 * Returns the index of the {@code )} closing the argument list that starts at {@code argsStart}.
	 */
	private int findArgumentListEnd(int argsStart) {
		int depth = 0;
		int i = argsStart;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (ArgumentTokenizer.isQuote(c) && ArgumentTokenizer.opensString(input, i, argsStart)) {
				i = skipQuoted(i, c);
				continue;
			}
			if (ArgumentTokenizer.isOpening(c)) {
				depth++;
			} else if (ArgumentTokenizer.isClosing(c)) {
				if (depth == 0) {
					if (c == ')') {
						return i;
					}
					throw new ArgumentSyntaxException("Unbalanced '" + c + "' in argument list at position " + i);
				}
				depth--;
			}
			i++;
		}
		throw new ArgumentSyntaxException("Unterminated argument list starting at position " + argsStart);
	}

	private int skipQuoted(int start, char quote) {
		int i = start + 1;
		while (i < input.length() && input.charAt(i) != quote) {
			if (input.charAt(i) == '\\') {
				i++;
			}
			i++;
		}
		if (i >= input.length()) {
			throw new ArgumentSyntaxException("Unterminated string at position " + start);
		}
		return i + 1;
	}

	private String readIdentifier(String what) {
		int start = pos;
		if (isAtEnd() || !isIdentifierStart(peek())) {
			throw new ArgumentSyntaxException("Expected " + what + " at position " + pos);
		}
		while (!isAtEnd() && isIdentifierChar(peek())) {
			pos++;
		}
		return input.substring(start, pos);
	}

	private void expect(char expected) {
		if (isAtEnd() || peek() != expected) {
			String found = isAtEnd() ? "end of text" : "'" + peek() + "'";
			throw new ArgumentSyntaxException("Expected '" + expected + "' but found " + found + " at position " + pos);
		}
		pos++;
	}

	private String excerpt(int start) {
		int close = input.indexOf(']', start);
		int lineEnd = input.indexOf('\n', start);
		int end = close >= 0 ? close + 1 : input.length();
		if (lineEnd >= 0 && lineEnd < end) {
			end = lineEnd;
		}
		return input.substring(start, end);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			pos++;
		}
	}

	private char peek() {
		return input.charAt(pos);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	static boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	static boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || (c >= '0' && c <= '9');
	}
}
