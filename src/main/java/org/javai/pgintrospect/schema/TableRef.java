package org.javai.pgintrospect.schema;

/**
 * A table as it appears in a query: an identifier (optionally schema-qualified) plus the
 * alias the query uses for it.
 *
 * @param tableName {@code table} or {@code schema.table}
 * @param alias non-empty alias qualifying column references
 */
public record TableRef(String tableName, String alias) {

	public TableRef {
		if (tableName == null || tableName.isBlank()) {
			throw new IllegalArgumentException("tableName must not be blank");
		}
		if (alias == null || alias.isBlank()) {
			throw new IllegalArgumentException("alias must not be blank for table " + tableName);
		}
		tableName = tableName.trim();
		alias = alias.trim();
	}

	/**
	 * Creates a reference whose alias is the bare table name.
	 */
	public static TableRef of(String tableName) {
		if (tableName == null || tableName.isBlank()) {
			throw new IllegalArgumentException("tableName must not be blank");
		}
		return new TableRef(tableName, QualifiedName.parse(tableName).table());
	}

	public QualifiedName qualifiedName(String defaultSchema) {
		return QualifiedName.parse(tableName, defaultSchema);
	}
}
