package org.javai.pgintrospect.schema;

import java.util.List;

/**
 * An index on a table. Informational only.
 *
 * @param name index name
 * @param columns indexed columns in key order
 * @param unique whether the index enforces uniqueness
 * @param accessMethod access method, e.g. {@code btree}
 */
public record IndexDescriptor(String name, List<String> columns, boolean unique, String accessMethod) {

	public IndexDescriptor {
		columns = columns != null ? List.copyOf(columns) : List.of();
	}
}
