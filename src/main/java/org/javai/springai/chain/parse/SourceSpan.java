package org.javai.springai.chain.parse;

/**
 * Half-open character range {@code [start, end)} in the original plan text.
 *
 * @param start index of the opening {@code [}
 * @param end index just past the closing {@code ]}
 */
public record SourceSpan(int start, int end) implements Comparable<SourceSpan> {

	public SourceSpan {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid span [%d, %d)".formatted(start, end));
		}
	}

	public int length() {
		return end - start;
	}

	public boolean overlaps(SourceSpan other) {
		return start < other.end && other.start < end;
	}

	public String slice(String text) {
		return text.substring(start, end);
	}

	@Override
	public int compareTo(SourceSpan other) {
		int byStart = Integer.compare(start, other.start);
		return byStart != 0 ? byStart : Integer.compare(end, other.end);
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}
}
