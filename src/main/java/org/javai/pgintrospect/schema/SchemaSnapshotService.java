package org.javai.pgintrospect.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles {@link TableSnapshot}s from a {@link MetadataProvider}.
 *
 * <p>Nothing is cached: every call reads the provider again, so a snapshot always reflects
 * the schema at the time of the call. A snapshot is either complete or not returned at all.</p>
 */
public final class SchemaSnapshotService {

	private static final Logger logger = LoggerFactory.getLogger(SchemaSnapshotService.class);

	private final MetadataProvider provider;
	private final String defaultSchema;

	public SchemaSnapshotService(MetadataProvider provider) {
		this(provider, QualifiedName.DEFAULT_SCHEMA);
	}

	public SchemaSnapshotService(MetadataProvider provider, String defaultSchema) {
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
		this.defaultSchema = Objects.requireNonNull(defaultSchema, "defaultSchema must not be null");
	}

	public String defaultSchema() {
		return defaultSchema;
	}

	/**
	 * Reads the full metadata of a table.
	 *
	 * @param identifier {@code table} or {@code schema.table}
	 * @return the snapshot, or empty if the table does not exist
	 */
	public Optional<TableSnapshot> snapshot(String identifier) {
		return tryResolve(identifier).map(this::read);
	}

	/**
	 * Like {@link #snapshot(String)}, but a missing table is an error.
	 */
	public TableSnapshot requireSnapshot(String identifier) {
		return read(resolve(identifier));
	}

	public Optional<QualifiedName> tryResolve(String identifier) {
		QualifiedName requested = QualifiedName.parse(identifier, defaultSchema);
		return provider.resolveTable(requested);
	}

	/**
	 * @throws TableNotFoundException if the identifier does not name a table
	 */
	public QualifiedName resolve(String identifier) {
		return tryResolve(identifier).orElseThrow(() -> new TableNotFoundException(identifier));
	}

	public List<QualifiedName> listTables() {
		return provider.listTables();
	}

	public List<QualifiedName> searchTables(String pattern) {
		if (pattern == null || pattern.isEmpty()) {
			throw new IllegalArgumentException("search pattern must not be empty");
		}
		return provider.searchTables(pattern);
	}

	private TableSnapshot read(QualifiedName name) {
		logger.debug("Reading metadata snapshot of {}", name);
		return new TableSnapshot(
				name,
				provider.columns(name),
				provider.primaryKey(name),
				provider.outgoingForeignKeys(name),
				provider.incomingForeignKeys(name),
				provider.indexes(name));
	}
}
