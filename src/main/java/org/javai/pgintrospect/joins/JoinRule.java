package org.javai.pgintrospect.joins;

import java.util.List;

/**
 * Produces LEFT JOIN candidates for one (existing table, new table) pair.
 *
 * <p>Rules are pure: everything they look at is in the {@link EdgePair}. INNER JOIN
 * variants, deduplication and ranking are applied by {@link JoinInferenceEngine}.</p>
 */
public interface JoinRule {

	List<JoinSuggestion> candidates(EdgePair pair, JoinClauseRenderer renderer);

	/**
	 * @return true if the rule reads {@link EdgePair#leftShape()} and {@link EdgePair#rightShape()}
	 */
	default boolean needsTableShapes() {
		return false;
	}
}
