package org.javai.springai.chain.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link ChainOptions} from YAML. Every key is optional:
 *
 * <pre>
 * concurrency-limit: 6
 * tool-timeout: PT30S        # or milliseconds, e.g. 30000
 * reference-pattern: "y\\d+"
 * verbose: true
 * reasoning-template: |
 *   ...{tools}...{question}...
 * refinement-template: |
 *   ...{question}...{filled_plan}...
 * </pre>
 *
 * Unknown keys are rejected so that typos do not silently fall back to defaults.
 */
public class ChainOptionsLoader {

	static final Set<String> KEYS = Set.of("concurrency-limit", "tool-timeout", "reference-pattern", "verbose",
			"reasoning-template", "refinement-template");

	private final Yaml yaml = new Yaml();

	/**
	 * Load options from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource is missing or invalid
	 */
	public ChainOptions loadResource(String resource) {
		ClassLoader loader = Thread.currentThread().getContextClassLoader();
		if (loader == null) {
			loader = ChainOptionsLoader.class.getClassLoader();
		}
		try (InputStream in = loader.getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalArgumentException("Options resource not found: " + resource);
			}
			return load(in);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read options resource: " + resource, e);
		}
	}

	public ChainOptions load(InputStream inputStream) {
		Object data = yaml.load(inputStream);
		return fromData(data);
	}

	public ChainOptions loadString(String yamlContent) {
		Object data = yaml.load(yamlContent);
		return fromData(data);
	}

	private ChainOptions fromData(Object data) {
		if (data == null) {
			return ChainOptions.defaults();
		}
		if (!(data instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("Options YAML must be a mapping, got " + data.getClass().getSimpleName());
		}
		Set<String> unknown = new TreeSet<>();
		map.keySet().forEach(key -> {
			if (!KEYS.contains(String.valueOf(key))) {
				unknown.add(String.valueOf(key));
			}
		});
		if (!unknown.isEmpty()) {
			throw new IllegalArgumentException("Unknown option(s) " + unknown + "; expected any of " + new TreeSet<>(KEYS));
		}

		ChainOptions.Builder builder = ChainOptions.builder();
		if (map.containsKey("concurrency-limit")) {
			builder.concurrencyLimit(asInt("concurrency-limit", map.get("concurrency-limit")));
		}
		if (map.containsKey("tool-timeout")) {
			builder.toolTimeout(asDuration(map.get("tool-timeout")));
		}
		if (map.containsKey("reference-pattern")) {
			builder.referencePattern(asString("reference-pattern", map.get("reference-pattern")));
		}
		if (map.containsKey("verbose")) {
			builder.verbose(asBoolean("verbose", map.get("verbose")));
		}
		if (map.containsKey("reasoning-template")) {
			builder.reasoningTemplate(asString("reasoning-template", map.get("reasoning-template")));
		}
		if (map.containsKey("refinement-template")) {
			builder.refinementTemplate(asString("refinement-template", map.get("refinement-template")));
		}
		return builder.build();
	}

	private static int asInt(String key, Object value) {
		try {
			return integral(value).intValueExact();
		}
		catch (ArithmeticException | NumberFormatException e) {
			throw new IllegalArgumentException("Option '" + key + "' must be an integer: " + value, e);
		}
	}

	/**
	 * Whole-number value of a YAML scalar; fractions and non-numeric text throw.
	 */
	private static BigInteger integral(Object value) {
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return BigInteger.valueOf(((Number) value).longValue());
		}
		if (value instanceof BigInteger big) {
			return big;
		}
		if (value instanceof Number number) {
			return new BigDecimal(number.toString()).toBigIntegerExact();
		}
		return new BigInteger(String.valueOf(value).strip());
	}

	private static Duration asDuration(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof Number) {
			try {
				return Duration.ofMillis(integral(value).longValueExact());
			}
			catch (ArithmeticException e) {
				throw new IllegalArgumentException("Option 'tool-timeout' must be a whole number of milliseconds: "
						+ value, e);
			}
		}
		try {
			return Duration.parse(String.valueOf(value).strip());
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Option 'tool-timeout' must be an ISO-8601 duration or milliseconds: "
					+ value, e);
		}
	}

	private static boolean asBoolean(String key, Object value) {
		if (value instanceof Boolean flag) {
			return flag;
		}
		String text = String.valueOf(value).strip();
		if ("true".equalsIgnoreCase(text)) {
			return true;
		}
		if ("false".equalsIgnoreCase(text)) {
			return false;
		}
		throw new IllegalArgumentException("Option '" + key + "' must be true or false: " + value);
	}

	private static String asString(String key, Object value) {
		if (value == null) {
			throw new IllegalArgumentException("Option '" + key + "' must not be empty");
		}
		return String.valueOf(value);
	}
}
