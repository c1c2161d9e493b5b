package org.javai.springai.chain.prompt;

import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.javai.springai.chain.api.PlanSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link PlanSource} backed by a Spring AI {@link ChatClient}: renders the
 * reasoning template and makes one call.
 */
public class ChatClientPlanSource implements PlanSource {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientPlanSource.class);

	private final ChatClient chatClient;
	private final String template;
	private final String systemPrompt;

	public ChatClientPlanSource(ChatClient chatClient) {
		this(chatClient, PromptTemplates.DEFAULT_REASONING, null);
	}

	/**
	 * @param chatClient the client to call
	 * @param template reasoning template containing {@code {tools}} and {@code {question}}
	 * @param systemPrompt optional system message, may be {@code null}
	 */
	public ChatClientPlanSource(ChatClient chatClient, String template, String systemPrompt) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.template = PromptTemplates.validateReasoning(template);
		this.systemPrompt = systemPrompt;
	}

	@Override
	public String requestPlan(String toolSignatures, String question) {
		String prompt = PromptTemplates.renderReasoning(template, toolSignatures, question);
		logger.debug("Plan request:\n{}", prompt);
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		if (StringUtils.isNotBlank(systemPrompt)) {
			request = request.system(systemPrompt);
		}
		String content = request.user(prompt).call().content();
		if (StringUtils.isBlank(content)) {
			throw new IllegalStateException("Model returned an empty plan for question: "
					+ StringUtils.abbreviate(question, 80));
		}
		logger.debug("Plan response:\n{}", StringUtils.abbreviate(content, 2000));
		return content;
	}
}
