package org.javai.pgintrospect.tool;

import org.javai.pgintrospect.schema.Column;
import org.javai.pgintrospect.schema.ColumnKind;

/**
 * Detailed information about a database column, suitable for LLM tool responses.
 *
 * @param name column name
 * @param dataType declared SQL type
 * @param kind textual, binary or other
 * @param nullable whether the column accepts NULL
 * @param defaultValue default expression, or null
 * @param maxLength maximum character length, or null
 * @param comment column comment, or null
 */
public record ColumnDetail(
		String name,
		String dataType,
		ColumnKind kind,
		boolean nullable,
		String defaultValue,
		Integer maxLength,
		String comment
) {

	public static ColumnDetail from(Column column) {
		return new ColumnDetail(
				column.name(),
				column.type(),
				column.kind(),
				column.nullable(),
				column.defaultValue(),
				column.maxLength(),
				column.comment());
	}
}
