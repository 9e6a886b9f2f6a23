package org.javai.pgintrospect.tool;

import org.javai.pgintrospect.joins.ConfidenceBand;
import org.javai.pgintrospect.joins.JoinSuggestion;
import org.javai.pgintrospect.joins.JoinType;

/**
 * A join suggestion as returned to the model.
 */
public record SuggestedJoin(
		JoinType joinType,
		String expression,
		String description,
		int score,
		ConfidenceBand confidence
) {

	public static SuggestedJoin from(JoinSuggestion suggestion) {
		return new SuggestedJoin(
				suggestion.joinType(),
				suggestion.expression(),
				suggestion.description(),
				suggestion.score(),
				suggestion.confidence());
	}
}
