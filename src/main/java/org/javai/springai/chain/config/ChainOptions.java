package org.javai.springai.chain.config;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;
import org.javai.springai.chain.exec.DefaultExecutionEngine;
import org.javai.springai.chain.parse.CallExpressionParser;
import org.javai.springai.chain.prompt.PromptTemplates;

/**
 * Settings for one {@link org.javai.springai.chain.AbstractionChain}.
 *
 * @param concurrencyLimit maximum tool invocations in flight per plan
 * @param toolTimeout per-invocation limit, or {@code null} for none
 * @param referencePattern shape of a bare argument that always denotes a placeholder
 * @param verbose log dispatches and model exchanges at INFO
 * @param reasoningTemplate prompt for the planning pass when the chain is built with a {@code ChatClient}
 * @param refinementTemplate prompt for the answering pass when the chain is built with a {@code ChatClient}
 */
public record ChainOptions(
		int concurrencyLimit,
		Duration toolTimeout,
		Pattern referencePattern,
		boolean verbose,
		String reasoningTemplate,
		String refinementTemplate
) {

	public ChainOptions {
		if (concurrencyLimit < 1) {
			throw new IllegalArgumentException("concurrencyLimit must be at least 1: " + concurrencyLimit);
		}
		if (toolTimeout != null && (toolTimeout.isNegative() || toolTimeout.isZero())) {
			throw new IllegalArgumentException("toolTimeout must be positive: " + toolTimeout);
		}
		referencePattern = referencePattern != null ? referencePattern : CallExpressionParser.DEFAULT_REFERENCE_PATTERN;
		reasoningTemplate = PromptTemplates.validateReasoning(
				Objects.requireNonNullElse(reasoningTemplate, PromptTemplates.DEFAULT_REASONING));
		refinementTemplate = PromptTemplates.validateRefinement(
				Objects.requireNonNullElse(refinementTemplate, PromptTemplates.DEFAULT_REFINEMENT));
	}

	public static ChainOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.concurrencyLimit(concurrencyLimit)
				.toolTimeout(toolTimeout)
				.referencePattern(referencePattern)
				.verbose(verbose)
				.reasoningTemplate(reasoningTemplate)
				.refinementTemplate(refinementTemplate);
	}

	public static final class Builder {
		private int concurrencyLimit = DefaultExecutionEngine.DEFAULT_CONCURRENCY_LIMIT;
		private Duration toolTimeout;
		private Pattern referencePattern;
		private boolean verbose;
		private String reasoningTemplate;
		private String refinementTemplate;

		private Builder() {
		}

		public Builder concurrencyLimit(int concurrencyLimit) {
			this.concurrencyLimit = concurrencyLimit;
			return this;
		}

		public Builder toolTimeout(Duration toolTimeout) {
			this.toolTimeout = toolTimeout;
			return this;
		}

		public Builder referencePattern(Pattern referencePattern) {
			this.referencePattern = referencePattern;
			return this;
		}

		public Builder referencePattern(String regex) {
			this.referencePattern = regex != null ? Pattern.compile(regex) : null;
			return this;
		}

		public Builder verbose(boolean verbose) {
			this.verbose = verbose;
			return this;
		}

		public Builder reasoningTemplate(String reasoningTemplate) {
			this.reasoningTemplate = reasoningTemplate;
			return this;
		}

		public Builder refinementTemplate(String refinementTemplate) {
			this.refinementTemplate = refinementTemplate;
			return this;
		}

		public ChainOptions build() {
			return new ChainOptions(concurrencyLimit, toolTimeout, referencePattern, verbose, reasoningTemplate,
					refinementTemplate);
		}
	}
}
