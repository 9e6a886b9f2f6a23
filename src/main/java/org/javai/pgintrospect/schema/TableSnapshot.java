package org.javai.pgintrospect.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata of one table, read in a single call and never updated afterwards.
 *
 * @param name the resolved table name
 * @param columns columns in ordinal order
 * @param primaryKey primary-key columns
 * @param outgoingForeignKeys edges whose source is this table
 * @param incomingForeignKeys edges whose target is this table
 * @param indexes indexes on this table
 */
public record TableSnapshot(
		QualifiedName name,
		List<Column> columns,
		PrimaryKey primaryKey,
		List<ForeignKeyEdge> outgoingForeignKeys,
		List<ForeignKeyEdge> incomingForeignKeys,
		List<IndexDescriptor> indexes
) {

	public TableSnapshot {
		Objects.requireNonNull(name, "name must not be null");
		columns = List.copyOf(columns);
		primaryKey = primaryKey != null ? primaryKey : PrimaryKey.none();
		outgoingForeignKeys = List.copyOf(outgoingForeignKeys);
		incomingForeignKeys = List.copyOf(incomingForeignKeys);
		indexes = List.copyOf(indexes);
	}

	public Optional<Column> findColumn(String columnName) {
		return columns.stream()
				.filter(c -> c.name().equals(columnName))
				.findFirst();
	}
}
