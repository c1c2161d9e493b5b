package org.javai.springai.chain.tool;

import java.util.Objects;
import org.javai.springai.chain.api.ToolRegistry;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

/**
 * Builds a {@link ToolRegistry} from Spring AI tool callbacks, or from objects
 * whose methods carry {@link org.springframework.ai.tool.annotation.Tool}.
 *
 * <pre>{@code
 * ToolRegistry tools = ToolCallbackRegistries.fromToolObjects(new ArithmeticTools());
 * }</pre>
 */
public final class ToolCallbackRegistries {

	private ToolCallbackRegistries() {
	}

	public static ToolRegistry from(ToolCallback... callbacks) {
		Objects.requireNonNull(callbacks, "callbacks must not be null");
		ToolRegistry.Builder builder = ToolRegistry.builder();
		for (ToolCallback callback : callbacks) {
			ToolCallbackTool tool = new ToolCallbackTool(callback);
			builder.register(tool.signature(), tool);
		}
		return builder.build();
	}

	public static ToolRegistry fromToolObjects(Object... toolObjects) {
		Objects.requireNonNull(toolObjects, "toolObjects must not be null");
		ToolCallback[] callbacks = MethodToolCallbackProvider.builder()
				.toolObjects(toolObjects)
				.build()
				.getToolCallbacks();
		return from(callbacks);
	}
}
