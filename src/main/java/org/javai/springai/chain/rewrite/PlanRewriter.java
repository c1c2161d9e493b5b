package org.javai.springai.chain.rewrite;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.chain.graph.DependencyNode;
import org.javai.springai.chain.graph.ExecutionPlan;
import org.javai.springai.chain.graph.NodeStatus;
import org.javai.springai.chain.parse.CallExpression;
import org.javai.springai.chain.parse.SourceSpan;

/**
 * Produces the filled plan: every recognised call marker replaced by its
 * rendered result.
 * <p>
 * Substitution uses the spans captured at parse time and walks the original
 * text once, left to right, so earlier replacements never shift later
 * offsets. Text outside recognised spans, including markers the parser
 * skipped, is copied unchanged.
 */
public class PlanRewriter {

	private final ResultRenderer renderer;

	public PlanRewriter() {
		this(new ResultRenderer());
	}

	public PlanRewriter(ResultRenderer renderer) {
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
	}

	/**
	 * Rewrite an executed plan.
	 *
	 * @throws PlanRewriteException if any call's node is not DONE
	 */
	public String rewrite(ExecutionPlan plan) {
		Objects.requireNonNull(plan, "plan must not be null");
		return substitute(plan.planText(), plan.calls(), call -> {
			DependencyNode node = plan.findNode(call.outputPlaceholder()).orElse(null);
			if (node == null) {
				throw notExecuted(call, null);
			}
			if (node.status() != NodeStatus.DONE) {
				throw notExecuted(call, node.status());
			}
			return node.result();
		});
	}

	/**
	 * Rewrite from a bare result mapping. A call whose placeholder is absent
	 * from {@code results} was never executed and fails the rewrite.
	 *
	 * @throws PlanRewriteException if a placeholder has no result
	 */
	public String rewrite(String planText, List<CallExpression> calls, Map<String, Object> results) {
		Objects.requireNonNull(planText, "planText must not be null");
		Objects.requireNonNull(calls, "calls must not be null");
		Objects.requireNonNull(results, "results must not be null");
		return substitute(planText, calls, call -> {
			if (!results.containsKey(call.outputPlaceholder())) {
				throw notExecuted(call, null);
			}
			return results.get(call.outputPlaceholder());
		});
	}

	@FunctionalInterface
	private interface ResultLookup {
		Object resultOf(CallExpression call);
	}

	private String substitute(String planText, List<CallExpression> calls, ResultLookup lookup) {
		if (calls.isEmpty()) {
			return planText;
		}
		List<CallExpression> ordered = new ArrayList<>(calls);
		ordered.sort(Comparator.comparing(CallExpression::sourceSpan));

		StringBuilder sb = new StringBuilder(planText.length());
		int cursor = 0;
		for (CallExpression call : ordered) {
			SourceSpan span = call.sourceSpan();
			if (span.start() < cursor) {
				throw new PlanRewriteException(call.outputPlaceholder(), null,
						"Span %s of '%s' overlaps a preceding call".formatted(span, call.outputPlaceholder()));
			}
			if (span.end() > planText.length()) {
				throw new PlanRewriteException(call.outputPlaceholder(), null,
						"Span %s of '%s' lies outside the plan text".formatted(span, call.outputPlaceholder()));
			}
			sb.append(planText, cursor, span.start());
			sb.append(render(call, lookup.resultOf(call)));
			cursor = span.end();
		}
		sb.append(planText, cursor, planText.length());
		return sb.toString();
	}

	private String render(CallExpression call, Object result) {
		try {
			return renderer.render(result);
		}
		catch (IllegalArgumentException e) {
			throw new PlanRewriteException(call.outputPlaceholder(), NodeStatus.DONE,
					"Cannot render result of '%s': %s".formatted(call.outputPlaceholder(), e.getMessage()), e);
		}
	}

	private static PlanRewriteException notExecuted(CallExpression call, NodeStatus status) {
		String state = status != null ? status.name() : "never executed";
		return new PlanRewriteException(call.outputPlaceholder(), status,
				"Cannot substitute %s: node is %s".formatted(call.render(), state));
	}
}
