package org.javai.pgintrospect.tool;

import java.util.List;
import org.javai.pgintrospect.schema.IndexDescriptor;
import org.javai.pgintrospect.schema.TableSnapshot;

/**
 * Full detail about a database table, suitable for LLM tool responses.
 *
 * @param schema the table's schema
 * @param name the bare table name
 * @param columns columns in ordinal order
 * @param primaryKey primary-key columns in declaration order
 * @param foreignKeys foreign keys declared on this table
 * @param incomingForeignKeys foreign keys of other tables referencing this one
 * @param indexes indexes on this table
 */
public record TableDetail(
		String schema,
		String name,
		List<ColumnDetail> columns,
		List<String> primaryKey,
		List<TableRelationship> foreignKeys,
		List<TableRelationship> incomingForeignKeys,
		List<IndexDescriptor> indexes
) {

	public static TableDetail from(TableSnapshot snapshot, String defaultSchema) {
		return new TableDetail(
				snapshot.name().schema(),
				snapshot.name().table(),
				snapshot.columns().stream().map(ColumnDetail::from).toList(),
				snapshot.primaryKey().columns(),
				snapshot.outgoingForeignKeys().stream()
						.map(edge -> TableRelationship.from(edge, defaultSchema))
						.toList(),
				snapshot.incomingForeignKeys().stream()
						.map(edge -> TableRelationship.from(edge, defaultSchema))
						.toList(),
				snapshot.indexes());
	}
}
