package org.javai.pgintrospect.schema;

import java.util.List;

/**
 * Primary-key columns of a table in declaration order. An empty list means the table has
 * no primary key.
 */
public record PrimaryKey(List<String> columns) {

	private static final PrimaryKey NONE = new PrimaryKey(List.of());

	public PrimaryKey {
		columns = columns != null ? List.copyOf(columns) : List.of();
	}

	public static PrimaryKey none() {
		return NONE;
	}

	public static PrimaryKey of(String... columns) {
		return new PrimaryKey(List.of(columns));
	}

	public boolean isPresent() {
		return !columns.isEmpty();
	}

	public boolean isSingleColumn() {
		return columns.size() == 1;
	}
}
