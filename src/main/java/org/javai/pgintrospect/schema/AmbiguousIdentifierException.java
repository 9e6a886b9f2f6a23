package org.javai.pgintrospect.schema;

import java.util.List;

/**
 * Thrown when a table identifier matches more than one table and none of them exactly.
 */
public class AmbiguousIdentifierException extends SchemaIntrospectionException {

	private final List<QualifiedName> candidates;

	public AmbiguousIdentifierException(QualifiedName requested, List<QualifiedName> candidates) {
		super("Identifier '" + requested + "' is ambiguous; matches " + candidates);
		this.candidates = List.copyOf(candidates);
	}

	public List<QualifiedName> candidates() {
		return candidates;
	}
}
