package org.javai.pgintrospect.schema;

import java.util.Objects;

/**
 * One column pair of a foreign key, directed from the referencing (source) column to the
 * referenced (target) column. Composite keys appear as several edges sharing a constraint name.
 *
 * @param source table holding the foreign key
 * @param sourceColumn referencing column
 * @param target referenced table
 * @param targetColumn referenced column
 * @param constraintName name of the foreign-key constraint
 */
public record ForeignKeyEdge(
		QualifiedName source,
		String sourceColumn,
		QualifiedName target,
		String targetColumn,
		String constraintName
) {

	public ForeignKeyEdge {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(sourceColumn, "sourceColumn must not be null");
		Objects.requireNonNull(targetColumn, "targetColumn must not be null");
		Objects.requireNonNull(constraintName, "constraintName must not be null");
	}

	/**
	 * True if this edge and {@code other} reference the same schema, table and column.
	 */
	public boolean sharesTargetWith(ForeignKeyEdge other) {
		return target.equals(other.target) && targetColumn.equals(other.targetColumn);
	}
}
