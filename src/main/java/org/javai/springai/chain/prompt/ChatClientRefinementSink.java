package org.javai.springai.chain.prompt;

import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.javai.springai.chain.api.RefinementSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link RefinementSink} backed by a Spring AI {@link ChatClient}.
 */
public class ChatClientRefinementSink implements RefinementSink {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientRefinementSink.class);

	private final ChatClient chatClient;
	private final String template;

	public ChatClientRefinementSink(ChatClient chatClient) {
		this(chatClient, PromptTemplates.DEFAULT_REFINEMENT);
	}

	public ChatClientRefinementSink(ChatClient chatClient, String template) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.template = PromptTemplates.validateRefinement(template);
	}

	@Override
	public String refine(String question, String filledPlan) {
		String prompt = PromptTemplates.renderRefinement(template, question, filledPlan);
		logger.debug("Refinement request:\n{}", prompt);
		String content = chatClient.prompt().user(prompt).call().content();
		if (StringUtils.isBlank(content)) {
			throw new IllegalStateException("Model returned an empty answer for question: "
					+ StringUtils.abbreviate(question, 80));
		}
		return content.strip();
	}
}
