package org.javai.pgintrospect.schema;

/**
 * One column of a table.
 *
 * @param name column name, unique within its table
 * @param type declared data type as reported by the catalog
 * @param nullable whether the column accepts NULL
 * @param defaultValue default expression, or null
 * @param maxLength maximum character length, or null when not applicable
 * @param comment column comment, or null
 */
public record Column(
		String name,
		String type,
		boolean nullable,
		String defaultValue,
		Integer maxLength,
		String comment
) {

	public Column {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("column name must not be blank");
		}
	}

	public static Column of(String name, String type) {
		return new Column(name, type, true, null, null, null);
	}

	public ColumnKind kind() {
		return ColumnKind.classify(type);
	}
}
