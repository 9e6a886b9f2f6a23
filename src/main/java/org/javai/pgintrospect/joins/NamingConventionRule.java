package org.javai.pgintrospect.joins;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.pgintrospect.schema.Column;
import org.javai.pgintrospect.schema.PrimaryKey;

/**
 * Suggests joins from column names alone: a column {@code <x>_id} on one side is taken to
 * reference the other side's single-column primary key when that table is named {@code <x>},
 * {@code <x>s} or {@code <x>es}.
 *
 * <p>Scores {@value #SCORE}, below the foreign-key rules, so a declared key always wins
 * for the same clause. Disabled unless configured.</p>
 */
public final class NamingConventionRule implements JoinRule {

	public static final int SCORE = 80;

	private static final String ID_SUFFIX = "_id";

	@Override
	public boolean needsTableShapes() {
		return true;
	}

	@Override
	public List<JoinSuggestion> candidates(EdgePair pair, JoinClauseRenderer renderer) {
		if (pair.leftShape().isEmpty() || pair.rightShape().isEmpty()) {
			return List.of();
		}
		AliasedTable left = pair.left();
		AliasedTable right = pair.right();
		TableShape leftShape = pair.leftShape().get();
		TableShape rightShape = pair.rightShape().get();
		List<JoinSuggestion> candidates = new ArrayList<>();

		PrimaryKey rightKey = rightShape.primaryKey();
		if (rightKey.isSingleColumn()) {
			for (Column column : leftShape.columns()) {
				if (referencesByName(column.name(), right.bareName())) {
					String pk = rightKey.columns().get(0);
					candidates.add(JoinSuggestion.leftJoin(
							renderer.leftJoin(right, left.alias(), column.name(), right.alias(), pk),
							describe(left, column, right, pk),
							SCORE));
				}
			}
		}

		PrimaryKey leftKey = leftShape.primaryKey();
		if (leftKey.isSingleColumn()) {
			for (Column column : rightShape.columns()) {
				if (referencesByName(column.name(), left.bareName())) {
					String pk = leftKey.columns().get(0);
					candidates.add(JoinSuggestion.leftJoin(
							renderer.leftJoin(left, right.alias(), column.name(), left.alias(), pk),
							describe(right, column, left, pk),
							SCORE));
				}
			}
		}
		return candidates;
	}

	static boolean referencesByName(String columnName, String tableName) {
		String column = columnName.toLowerCase(Locale.ROOT);
		if (!column.endsWith(ID_SUFFIX) || column.length() == ID_SUFFIX.length()) {
			return false;
		}
		String stem = column.substring(0, column.length() - ID_SUFFIX.length());
		String table = tableName.toLowerCase(Locale.ROOT);
		return table.equals(stem) || table.equals(stem + "s") || table.equals(stem + "es");
	}

	private static String describe(AliasedTable from, Column column, AliasedTable to, String pk) {
		return "Naming convention match: %s.%s looks like a reference to %s.%s"
				.formatted(from.bareName(), column.name(), to.bareName(), pk);
	}
}
