package org.javai.springai.chain.api;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decorates a tool with a wall-clock limit. The delegate runs on the supplied
 * executor; when the limit passes the invocation is cancelled and reported as
 * a {@link ToolInvocationException}.
 */
public final class TimeLimitedTool implements Tool {

	private final String name;
	private final Tool delegate;
	private final Duration timeout;
	private final ExecutorService executor;

	public TimeLimitedTool(String name, Tool delegate, Duration timeout, ExecutorService executor) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive: " + timeout);
		}
	}

	@Override
	public Object invoke(List<Object> arguments) throws Exception {
		Future<Object> future = executor.submit(() -> delegate.invoke(arguments));
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			future.cancel(true);
			throw new ToolInvocationException(name,
					"Tool '%s' timed out after %d ms".formatted(name, timeout.toMillis()), e);
		}
		catch (InterruptedException e) {
			future.cancel(true);
			throw e;
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof Exception ex) {
				throw ex;
			}
			throw new ToolInvocationException(name, "Tool '%s' failed: %s".formatted(name, cause), cause);
		}
	}

	public Duration timeout() {
		return timeout;
	}
}
