package org.javai.pgintrospect.joins;

/**
 * Renders LEFT JOIN clauses that bring a table into a query.
 *
 * <p>The table is written without its schema when it lives in the default schema. The alias
 * is left out when it equals the bare table name ({@code LEFT JOIN orders ON ...} rather
 * than {@code LEFT JOIN orders orders ON ...}).</p>
 */
public final class JoinClauseRenderer {

	private final String defaultSchema;

	public JoinClauseRenderer(String defaultSchema) {
		this.defaultSchema = defaultSchema;
	}

	/**
	 * @param joined the table the clause introduces
	 * @return {@code LEFT JOIN <joined>[ <alias>] ON <leftAlias>.<leftColumn> = <rightAlias>.<rightColumn>}
	 */
	public String leftJoin(AliasedTable joined, String leftAlias, String leftColumn, String rightAlias,
			String rightColumn) {
		StringBuilder sql = new StringBuilder(JoinType.LEFT_JOIN.keyword())
				.append(' ')
				.append(joined.name().render(defaultSchema));
		if (!joined.alias().equals(joined.bareName())) {
			sql.append(' ').append(joined.alias());
		}
		return sql.append(" ON ")
				.append(leftAlias).append('.').append(leftColumn)
				.append(" = ")
				.append(rightAlias).append('.').append(rightColumn)
				.toString();
	}
}
