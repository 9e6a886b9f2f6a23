package org.javai.pgintrospect.joins;

import java.util.ArrayList;
import java.util.List;
import org.javai.pgintrospect.schema.ForeignKeyEdge;

/**
 * The rules backed by declared foreign keys. Each clause introduces the referenced side of the
 * relationship: the new table for a direct reference, the existing table for a reverse one,
 * so that both directions of one foreign key render the same clause.
 */
public enum ForeignKeyJoinRule implements JoinRule {

	/**
	 * The existing table references the new one.
	 * Scores 100 when the referencing column embeds the new table's alias, else 95.
	 */
	DIRECT_REFERENCE {
		@Override
		public List<JoinSuggestion> candidates(EdgePair pair, JoinClauseRenderer renderer) {
			AliasedTable left = pair.left();
			AliasedTable right = pair.right();
			List<JoinSuggestion> candidates = new ArrayList<>();
			for (ForeignKeyEdge edge : pair.directReferences()) {
				String expression = renderer.leftJoin(right,
						left.alias(), edge.sourceColumn(), right.alias(), edge.targetColumn());
				int score = edge.sourceColumn().contains(right.alias()) ? 100 : 95;
				String description = "Direct foreign key relationship from %s to %s (FK: %s)"
						.formatted(left.bareName(), right.bareName(), edge.constraintName());
				candidates.add(JoinSuggestion.leftJoin(expression, description, score));
			}
			return candidates;
		}
	},

	/**
	 * The new table references the existing one; the clause introduces the existing table.
	 * Scores 100 when the referencing column embeds the existing table's alias, else 95.
	 */
	REVERSE_REFERENCE {
		@Override
		public List<JoinSuggestion> candidates(EdgePair pair, JoinClauseRenderer renderer) {
			AliasedTable left = pair.left();
			AliasedTable right = pair.right();
			List<JoinSuggestion> candidates = new ArrayList<>();
			for (ForeignKeyEdge edge : pair.reverseReferences()) {
				String expression = renderer.leftJoin(left,
						right.alias(), edge.sourceColumn(), left.alias(), edge.targetColumn());
				int score = edge.sourceColumn().contains(left.alias()) ? 100 : 95;
				String description = "Reverse foreign key relationship from %s to %s (FK: %s)"
						.formatted(right.bareName(), left.bareName(), edge.constraintName());
				candidates.add(JoinSuggestion.leftJoin(expression, description, score));
			}
			return candidates;
		}
	},

	/**
	 * Both tables reference the same column of a third table.
	 * Scores 90 when either referencing column embeds its own table's alias, else 85.
	 */
	SHARED_REFERENCE {
		@Override
		public List<JoinSuggestion> candidates(EdgePair pair, JoinClauseRenderer renderer) {
			AliasedTable left = pair.left();
			AliasedTable right = pair.right();
			List<JoinSuggestion> candidates = new ArrayList<>();
			for (SharedReference shared : pair.sharedReferences()) {
				ForeignKeyEdge leftEdge = shared.leftEdge();
				ForeignKeyEdge rightEdge = shared.rightEdge();
				String expression = renderer.leftJoin(right,
						left.alias(), leftEdge.sourceColumn(), right.alias(), rightEdge.sourceColumn());
				boolean aliasEmbedded = rightEdge.sourceColumn().contains(right.alias())
						|| leftEdge.sourceColumn().contains(left.alias());
				int score = aliasEmbedded ? 90 : 85;
				String description = "Join through shared reference to %s (FK: %s, %s)"
						.formatted(leftEdge.target().table(), leftEdge.constraintName(), rightEdge.constraintName());
				candidates.add(JoinSuggestion.leftJoin(expression, description, score));
			}
			return candidates;
		}
	};

	/**
	 * @return the rules in the order their candidates are emitted
	 */
	public static List<JoinRule> standardRules() {
		return List.of(DIRECT_REFERENCE, REVERSE_REFERENCE, SHARED_REFERENCE);
	}
}
