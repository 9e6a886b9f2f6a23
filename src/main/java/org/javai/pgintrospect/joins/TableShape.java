package org.javai.pgintrospect.joins;

import java.util.List;
import org.javai.pgintrospect.schema.Column;
import org.javai.pgintrospect.schema.PrimaryKey;

/**
 * Columns and primary key of a table, for rules that look beyond foreign keys.
 */
public record TableShape(List<Column> columns, PrimaryKey primaryKey) {

	public TableShape {
		columns = List.copyOf(columns);
		primaryKey = primaryKey != null ? primaryKey : PrimaryKey.none();
	}
}
