package org.javai.pgintrospect.joins;

import java.util.Objects;

/**
 * One proposed join clause.
 *
 * @param joinType the join keyword the expression starts with
 * @param expression a complete clause: {@code <JOIN KIND> <table>[ <alias>] ON <a>.<col> = <b>.<col>}
 * @param description why the join is proposed
 * @param score plausibility, higher is more certain (0 to 105)
 */
public record JoinSuggestion(JoinType joinType, String expression, String description, int score) {

	/** Suggestions at or above this score also get an INNER JOIN variant. */
	public static final int INNER_VARIANT_THRESHOLD = 90;

	/** Added to the score of an INNER JOIN variant. */
	public static final int INNER_VARIANT_BONUS = 5;

	public JoinSuggestion {
		Objects.requireNonNull(joinType, "joinType must not be null");
		Objects.requireNonNull(expression, "expression must not be null");
		Objects.requireNonNull(description, "description must not be null");
	}

	public static JoinSuggestion leftJoin(String expression, String description, int score) {
		return new JoinSuggestion(JoinType.LEFT_JOIN, expression, description, score);
	}

	public ConfidenceBand confidence() {
		return ConfidenceBand.of(score);
	}

	public boolean qualifiesForInnerVariant() {
		return joinType == JoinType.LEFT_JOIN && score >= INNER_VARIANT_THRESHOLD;
	}

	/**
	 * The INNER JOIN counterpart of a LEFT JOIN suggestion: same clause with the keyword
	 * swapped, score raised by {@value #INNER_VARIANT_BONUS}.
	 */
	public JoinSuggestion toInnerVariant() {
		if (joinType != JoinType.LEFT_JOIN) {
			throw new IllegalStateException("Only LEFT JOIN suggestions have an INNER JOIN variant");
		}
		return new JoinSuggestion(
				JoinType.INNER_JOIN,
				replaceFirst(expression, JoinType.LEFT_JOIN.keyword(), JoinType.INNER_JOIN.keyword()),
				replaceFirst(description, "Left join", "Inner join"),
				score + INNER_VARIANT_BONUS);
	}

	private static String replaceFirst(String text, String target, String replacement) {
		int at = text.indexOf(target);
		if (at < 0) {
			return text;
		}
		return text.substring(0, at) + replacement + text.substring(at + target.length());
	}
}
