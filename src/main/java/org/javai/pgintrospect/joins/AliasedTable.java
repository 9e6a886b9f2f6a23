package org.javai.pgintrospect.joins;

import java.util.Objects;
import org.javai.pgintrospect.schema.QualifiedName;

/**
 * A query table whose identifier has been resolved against the schema.
 *
 * @param name the resolved table
 * @param alias the alias the query uses for it
 */
public record AliasedTable(QualifiedName name, String alias) {

	public AliasedTable {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(alias, "alias must not be null");
	}

	public String bareName() {
		return name.table();
	}
}
