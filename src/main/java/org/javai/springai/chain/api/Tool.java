package org.javai.springai.chain.api;

import java.util.List;

/**
 * A capability that a plan may call by name.
 * <p>
 * Arguments arrive in the order they were written in the plan, already
 * resolved: literals are coerced to {@link Integer}/{@link Long},
 * {@link Double}, {@link Boolean} or {@link String}, and placeholder
 * references are replaced with the result of the call that defined them.
 * Any exception thrown marks the calling node as failed.
 */
@FunctionalInterface
public interface Tool {

	Object invoke(List<Object> arguments) throws Exception;
}
