package org.javai.springai.chain.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default prompts for the two model passes, and the slot substitution they use.
 * <p>
 * Slots are written {@code {name}}. The reasoning template must contain
 * {@value #TOOLS} and {@value #QUESTION}; the refinement template must contain
 * {@value #QUESTION} and {@value #FILLED_PLAN}.
 */
public final class PromptTemplates {

	public static final String TOOLS = "{tools}";
	public static final String QUESTION = "{question}";
	public static final String FILLED_PLAN = "{filled_plan}";

	public static final String DEFAULT_REASONING = """
			Write an abstract plan of reasoning for the question below. Use placeholders \
			for every value that has to be computed or looked up, and name them y1, y2, and so on.

			Write each function call inline as [FUNC function_name(argument1, argument2) = yN].
			Arguments are numbers, true/false, quoted strings, or placeholders of earlier calls.
			Someone will replace each call with its result and read your plan afterwards, so keep \
			the reasoning readable around the calls.

			Only use the functions listed below; never invent one. A question that needs no \
			function calls may be answered directly.

			Example:
			-----------
			Available functions:
			add(a, b): add two numbers
			multiply(a, b): multiply two numbers

			Question:
			Sally has 3 apples and buys 2 more. Then magically, a wizard casts a spell that \
			multiplies the number of apples by 3. How many apples does Sally have now?

			Abstract plan of reasoning:
			After buying the apples, Sally has [FUNC add(3, 2) = y1] apples. Then, the wizard \
			casts a spell to multiply the number of apples by 3, resulting in \
			[FUNC multiply(y1, 3) = y2] apples.
			-----------

			Available functions:
			{tools}

			Question:
			{question}

			Abstract plan of reasoning:
			""";

	public static final String DEFAULT_REFINEMENT = """
			Answer the question using the reasoning below. The reasoning already contains \
			the computed values; use them as facts and do not recompute them.

			Example:
			-----------
			Question:
			Sally has 3 apples and buys 2 more. Then magically, a wizard casts a spell that \
			multiplies the number of apples by 3. How many apples does Sally have now?

			Previous reasoning:
			After buying the apples, Sally has 5 apples. Then, the wizard casts a spell to \
			multiply the number of apples by 3, resulting in 15 apples.

			Response:
			After the wizard casts the spell, Sally has 15 apples.
			-----------

			Question:
			{question}

			Previous reasoning:
			{filled_plan}

			Response:
			""";

	private PromptTemplates() {
	}

	/**
	 * @throws IllegalArgumentException if a required slot is missing
	 */
	public static String validateReasoning(String template) {
		return requireSlots("reasoning", template, TOOLS, QUESTION);
	}

	/**
	 * @throws IllegalArgumentException if a required slot is missing
	 */
	public static String validateRefinement(String template) {
		return requireSlots("refinement", template, QUESTION, FILLED_PLAN);
	}

	public static String renderReasoning(String template, String tools, String question) {
		return fill(template, Map.of(TOOLS, tools, QUESTION, question));
	}

	public static String renderRefinement(String template, String question, String filledPlan) {
		return fill(template, Map.of(QUESTION, question, FILLED_PLAN, filledPlan));
	}

	/**
	 * Replaces slots in a single pass, so slot-like text inside a value is never expanded.
	 */
	static String fill(String template, Map<String, String> values) {
		Objects.requireNonNull(template, "template must not be null");
		StringBuilder sb = new StringBuilder(template.length());
		int i = 0;
		outer:
		while (i < template.length()) {
			if (template.charAt(i) == '{') {
				for (Map.Entry<String, String> entry : values.entrySet()) {
					if (template.startsWith(entry.getKey(), i)) {
						sb.append(Objects.requireNonNullElse(entry.getValue(), ""));
						i += entry.getKey().length();
						continue outer;
					}
				}
			}
			sb.append(template.charAt(i++));
		}
		return sb.toString();
	}

	private static String requireSlots(String kind, String template, String... slots) {
		Objects.requireNonNull(template, kind + " template must not be null");
		List<String> missing = new ArrayList<>();
		for (String slot : slots) {
			if (!template.contains(slot)) {
				missing.add(slot);
			}
		}
		if (!missing.isEmpty()) {
			throw new IllegalArgumentException("The " + kind + " template is missing slot(s) " + missing);
		}
		return template;
	}
}
