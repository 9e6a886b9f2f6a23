package org.javai.pgintrospect.tool;

import org.javai.pgintrospect.schema.ForeignKeyEdge;

/**
 * Describes one column pair of a foreign key, suitable for LLM tool responses.
 *
 * @param fromTable the table containing the foreign key
 * @param fromColumn the foreign key column
 * @param toTable the referenced table
 * @param toColumn the referenced column
 * @param constraintName the foreign key constraint
 */
public record TableRelationship(
		String fromTable,
		String fromColumn,
		String toTable,
		String toColumn,
		String constraintName
) {

	public static TableRelationship from(ForeignKeyEdge edge, String defaultSchema) {
		return new TableRelationship(
				edge.source().render(defaultSchema),
				edge.sourceColumn(),
				edge.target().render(defaultSchema),
				edge.targetColumn(),
				edge.constraintName());
	}
}
