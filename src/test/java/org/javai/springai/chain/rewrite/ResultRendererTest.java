package org.javai.springai.chain.rewrite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.springai.chain.graph.NodeStatus;
import org.junit.jupiter.api.Test;

class ResultRendererTest {

	private final ResultRenderer renderer = new ResultRenderer();

	@Test
	void scalarsRenderAsPlainText() {
		assertThat(renderer.render("Uber revenue: $17.4B")).isEqualTo("Uber revenue: $17.4B");
		assertThat(renderer.render(15)).isEqualTo("15");
		assertThat(renderer.render(2.0d)).isEqualTo("2.0");
		assertThat(renderer.render(true)).isEqualTo("true");
		assertThat(renderer.render('x')).isEqualTo("x");
		assertThat(renderer.render(NodeStatus.DONE)).isEqualTo("DONE");
		assertThat(renderer.render(new BigDecimal("1E+3"))).isEqualTo("1000");
	}

	@Test
	void nullRendersAsTheWordNull() {
		assertThat(renderer.render(null)).isEqualTo("null");
	}

	@Test
	void structuredValuesRenderAsCompactJson() {
		Map<String, Object> revenue = new LinkedHashMap<>();
		revenue.put("company", "Lyft");
		revenue.put("quarters", List.of(1, 2));

		assertThat(renderer.render(List.of("a", "b"))).isEqualTo("[\"a\",\"b\"]");
		assertThat(renderer.render(revenue)).isEqualTo("{\"company\":\"Lyft\",\"quarters\":[1,2]}");
	}

	@Test
	void unserialisableValueIsRejected() {
		assertThatThrownBy(() -> renderer.render(new Object()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("java.lang.Object");
	}
}
