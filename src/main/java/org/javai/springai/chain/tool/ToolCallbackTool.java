package org.javai.springai.chain.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.javai.springai.chain.api.Tool;
import org.javai.springai.chain.api.ToolInvocationException;
import org.javai.springai.chain.api.ToolSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Exposes a Spring AI {@link ToolCallback} as a positional {@link Tool}.
 * <p>
 * Positional arguments are bound to the properties of the callback's JSON
 * input schema in declaration order, serialized as a JSON object, and passed
 * to {@link ToolCallback#call(String)}. A JSON reply is decoded into plain
 * Java values; any other reply is returned as the raw string.
 */
public final class ToolCallbackTool implements Tool {

	private static final Logger logger = LoggerFactory.getLogger(ToolCallbackTool.class);

	private final ToolCallback callback;
	private final ObjectMapper objectMapper;
	private final ToolSignature signature;

	public ToolCallbackTool(ToolCallback callback) {
		this(callback, new ObjectMapper());
	}

	public ToolCallbackTool(ToolCallback callback, ObjectMapper objectMapper) {
		this.callback = Objects.requireNonNull(callback, "callback must not be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		ToolDefinition definition = Objects.requireNonNull(callback.getToolDefinition(),
				"tool definition must not be null");
		this.signature = new ToolSignature(definition.name(), parameterNames(definition, objectMapper),
				definition.description());
	}

	public ToolSignature signature() {
		return signature;
	}

	@Override
	public Object invoke(List<Object> arguments) {
		List<String> parameters = signature.parameters();
		if (arguments.size() != parameters.size()) {
			throw new ToolInvocationException(signature.name(),
					"Tool '%s' expects %d argument(s) %s but got %d".formatted(signature.name(), parameters.size(),
							parameters, arguments.size()));
		}

		ObjectNode input = objectMapper.createObjectNode();
		for (int i = 0; i < parameters.size(); i++) {
			input.set(parameters.get(i), objectMapper.valueToTree(arguments.get(i)));
		}

		String request;
		try {
			request = objectMapper.writeValueAsString(input);
		}
		catch (JsonProcessingException e) {
			throw new ToolInvocationException(signature.name(),
					"Cannot serialize arguments for '%s': %s".formatted(signature.name(), e.getOriginalMessage()), e);
		}
		logger.debug("Calling tool callback {} with {}", signature.name(), request);
		String reply = callback.call(request);
		return decode(reply);
	}

	private Object decode(String reply) {
		if (StringUtils.isBlank(reply)) {
			return reply;
		}
		try {
			return objectMapper.readValue(reply, Object.class);
		}
		catch (JsonProcessingException e) {
			logger.debug("Reply of {} is not JSON, keeping it as text", signature.name());
			return reply;
		}
	}

	private static List<String> parameterNames(ToolDefinition definition, ObjectMapper objectMapper) {
		String schema = definition.inputSchema();
		if (StringUtils.isBlank(schema)) {
			return List.of();
		}
		try {
			JsonNode properties = objectMapper.readTree(schema).path("properties");
			List<String> names = new ArrayList<>();
			Iterator<String> fields = properties.fieldNames();
			fields.forEachRemaining(names::add);
			return names;
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException(
					"Input schema of tool '%s' is not valid JSON".formatted(definition.name()), e);
		}
	}

	@Override
	public String toString() {
		return "ToolCallbackTool[" + signature.render() + "]";
	}
}
