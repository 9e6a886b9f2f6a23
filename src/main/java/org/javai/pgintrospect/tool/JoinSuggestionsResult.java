package org.javai.pgintrospect.tool;

import java.util.List;

/**
 * Outcome of a join suggestion request.
 *
 * <p>An empty {@code suggestions} list with {@code error == false} means no relationship was
 * found; an error carries its description in {@code message}.</p>
 *
 * @param newTable the table being joined
 * @param alias the alias requested for it
 * @param suggestions ranked suggestions
 * @param error whether the request failed
 * @param message human-readable summary
 */
public record JoinSuggestionsResult(
		String newTable,
		String alias,
		List<SuggestedJoin> suggestions,
		boolean error,
		String message
) {

	static final String NO_SUGGESTIONS =
			"No JOIN suggestions found based on foreign key relationships or naming patterns.";

	static JoinSuggestionsResult of(String newTable, String alias, List<SuggestedJoin> suggestions) {
		String message = suggestions.isEmpty()
				? NO_SUGGESTIONS
				: "Found " + suggestions.size() + " potential JOIN expressions";
		return new JoinSuggestionsResult(newTable, alias, List.copyOf(suggestions), false, message);
	}

	static JoinSuggestionsResult failed(String newTable, String alias, String message) {
		return new JoinSuggestionsResult(newTable, alias, List.of(), true, message);
	}
}
