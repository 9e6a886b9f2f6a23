package org.javai.pgintrospect.schema;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A schema-qualified table name.
 *
 * @param schema the schema (namespace) holding the table
 * @param table the bare table name
 */
public record QualifiedName(String schema, String table) {

	public static final String DEFAULT_SCHEMA = "public";

	public QualifiedName {
		if (schema == null || schema.isBlank()) {
			throw new IllegalArgumentException("schema must not be blank");
		}
		if (table == null || table.isBlank()) {
			throw new IllegalArgumentException("table must not be blank");
		}
	}

	/**
	 * Parses {@code schema.table} or a bare {@code table}. Only the first dot separates
	 * schema from table; a bare name falls into {@code defaultSchema}.
	 */
	public static QualifiedName parse(String identifier, String defaultSchema) {
		if (identifier == null || identifier.isBlank()) {
			throw new IllegalArgumentException("table identifier must not be blank");
		}
		String trimmed = identifier.trim();
		int dot = trimmed.indexOf('.');
		if (dot < 0) {
			return new QualifiedName(defaultSchema, trimmed);
		}
		return new QualifiedName(trimmed.substring(0, dot), trimmed.substring(dot + 1));
	}

	public static QualifiedName parse(String identifier) {
		return parse(identifier, DEFAULT_SCHEMA);
	}

	/**
	 * Renders the name for use in SQL, leaving out the schema when it is the default one.
	 */
	public String render(String defaultSchema) {
		return schema.equals(defaultSchema) ? table : schema + "." + table;
	}

	public boolean matchesIgnoreCase(QualifiedName other) {
		return other != null
				&& schema.equalsIgnoreCase(other.schema)
				&& table.equalsIgnoreCase(other.table);
	}

	/**
	 * Picks the table a requested name refers to from the case-insensitive matches a
	 * metadata source found for it. An exact match wins, a single match is accepted,
	 * several matches without an exact one are ambiguous.
	 *
	 * @throws AmbiguousIdentifierException if the request cannot be resolved to one table
	 */
	public static Optional<QualifiedName> pick(QualifiedName requested, Collection<QualifiedName> matches) {
		Objects.requireNonNull(requested, "requested must not be null");
		List<QualifiedName> candidates = matches.stream()
				.filter(requested::matchesIgnoreCase)
				.distinct()
				.toList();
		if (candidates.contains(requested)) {
			return Optional.of(requested);
		}
		if (candidates.size() > 1) {
			throw new AmbiguousIdentifierException(requested, candidates);
		}
		return candidates.stream().findFirst();
	}

	@Override
	public String toString() {
		return schema + "." + table;
	}
}
