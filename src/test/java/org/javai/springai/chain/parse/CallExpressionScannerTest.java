package org.javai.springai.chain.parse;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CallExpressionScanner")
class CallExpressionScannerTest {

	@Test
	void textWithoutMarkersYieldsNothing() {
		CallExpressionScanner.ScanResult result = new CallExpressionScanner("The answer is 42 [citation].").scan();

		assertThat(result.calls()).isEmpty();
		assertThat(result.diagnostics()).isEmpty();
	}

	@Test
	void readsNameArgumentsPlaceholderAndSpan() {
		String text = "Sally has [FUNC add(3, 2) = y1] apples.";

		CallExpressionScanner.ScanResult result = new CallExpressionScanner(text).scan();

		assertThat(result.calls()).singleElement().satisfies(call -> {
			assertThat(call.functionName()).isEqualTo("add");
			assertThat(call.arguments()).extracting(ArgumentToken::value).containsExactly("3", "2");
			assertThat(call.placeholder()).isEqualTo("y1");
			assertThat(call.span().slice(text)).isEqualTo("[FUNC add(3, 2) = y1]");
		});
	}

	@Test
	void toleratesFlexibleWhitespaceInsideTheMarker() {
		String text = "[FUNC   lookup ( 'a' )=y7 ]";

		CallExpressionScanner.ScanResult result = new CallExpressionScanner(text).scan();

		assertThat(result.calls()).singleElement().satisfies(call -> {
			assertThat(call.functionName()).isEqualTo("lookup");
			assertThat(call.placeholder()).isEqualTo("y7");
			assertThat(call.span()).isEqualTo(new SourceSpan(0, text.length()));
		});
	}

	@Test
	void zeroArgumentCallIsAccepted() {
		CallExpressionScanner.ScanResult result = new CallExpressionScanner("[FUNC now() = t1]").scan();

		assertThat(result.calls()).singleElement()
				.satisfies(call -> assertThat(call.arguments()).isEmpty());
	}

	@Test
	void closingParenthesisInsideStringDoesNotEndArgumentList() {
		String text = "[FUNC search(\"foo (bar)) baz\") = y1]";

		CallExpressionScanner.ScanResult result = new CallExpressionScanner(text).scan();

		assertThat(result.calls()).singleElement()
				.satisfies(call -> assertThat(call.arguments().get(0).value()).isEqualTo("foo (bar)) baz"));
	}

	@Test
	void malformedMarkerIsReportedAndLaterMarkersStillFound() {
		String text = "First [FUNC add(1, 2 = y1] then [FUNC add(3, 4) = y2].";

		CallExpressionScanner.ScanResult result = new CallExpressionScanner(text).scan();

		assertThat(result.calls()).extracting(CallExpressionScanner.ScannedCall::placeholder).containsExactly("y2");
		assertThat(result.diagnostics()).singleElement().satisfies(diagnostic -> {
			assertThat(diagnostic.kind()).isEqualTo(ParseDiagnostic.Kind.MALFORMED);
			assertThat(diagnostic.position()).isEqualTo(text.indexOf("[FUNC add(1"));
		});
	}

	@Test
	void missingPlaceholderIsMalformed() {
		CallExpressionScanner.ScanResult result = new CallExpressionScanner("[FUNC add(1, 2)]").scan();

		assertThat(result.calls()).isEmpty();
		assertThat(result.diagnostics()).singleElement().satisfies(diagnostic -> {
			assertThat(diagnostic.message()).contains("Expected '='");
			assertThat(diagnostic.text()).isEqualTo("[FUNC add(1, 2)]");
		});
	}

	@Test
	void markerWithoutSpaceAfterFuncIsMalformed() {
		CallExpressionScanner.ScanResult result = new CallExpressionScanner("[FUNCadd(1) = y1]").scan();

		assertThat(result.calls()).isEmpty();
		assertThat(result.diagnostics()).singleElement()
				.satisfies(diagnostic -> assertThat(diagnostic.message()).contains("Expected whitespace"));
	}

	@Test
	void adjacentMarkersAreBothFound() {
		String text = "[FUNC a(1) = y1][FUNC b(2) = y2]";

		CallExpressionScanner.ScanResult result = new CallExpressionScanner(text).scan();

		assertThat(result.calls()).extracting(call -> call.span().slice(text))
				.containsExactly("[FUNC a(1) = y1]", "[FUNC b(2) = y2]");
	}
}
