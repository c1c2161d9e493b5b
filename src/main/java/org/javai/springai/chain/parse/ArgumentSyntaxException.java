package org.javai.springai.chain.parse;

/**
 * Thrown while reading a single call marker. Never escapes the parser: the
 * marker is reported as {@link ParseDiagnostic.Kind#MALFORMED} instead.
 */
public class ArgumentSyntaxException extends RuntimeException {

	public ArgumentSyntaxException(String message) {
		super(message);
	}
}
