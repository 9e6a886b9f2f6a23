package org.javai.pgintrospect.schema;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of table metadata, keyed by {@code (schema, table)}.
 *
 * <p>Implementations answer point queries about one table at a time and never mutate the
 * underlying store. Every method except {@link #resolveTable} expects a name that was
 * previously resolved. Failures of the underlying store surface as
 * {@link MetadataUnavailableException}.</p>
 *
 * @see org.javai.pgintrospect.schema.jdbc.JdbcMetadataProvider
 * @see InMemoryMetadataProvider
 */
public interface MetadataProvider {

	/**
	 * Resolves a requested name to the table it denotes.
	 *
	 * @return the canonical name, or empty if no such table exists
	 * @throws AmbiguousIdentifierException if several tables match and none exactly
	 */
	Optional<QualifiedName> resolveTable(QualifiedName requested);

	/**
	 * @return columns in ordinal order
	 */
	List<Column> columns(QualifiedName table);

	PrimaryKey primaryKey(QualifiedName table);

	/**
	 * @return one edge per column pair of every foreign key declared on {@code table}
	 */
	List<ForeignKeyEdge> outgoingForeignKeys(QualifiedName table);

	/**
	 * @return one edge per column pair of every foreign key referencing {@code table}
	 */
	List<ForeignKeyEdge> incomingForeignKeys(QualifiedName table);

	List<IndexDescriptor> indexes(QualifiedName table);

	/**
	 * @return all user tables ordered by schema, then table
	 */
	List<QualifiedName> listTables();

	/**
	 * Finds tables whose name or schema matches a case-sensitive regular expression.
	 * Results are ranked: exact table name first, then case-insensitive prefix matches,
	 * then case-insensitive substring matches, then the rest; each group by schema and table.
	 */
	List<QualifiedName> searchTables(String pattern);
}
