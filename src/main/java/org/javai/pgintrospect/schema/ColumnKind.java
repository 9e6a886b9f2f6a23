package org.javai.pgintrospect.schema;

import java.util.Locale;

/**
 * Coarse classification of a column's declared type.
 */
public enum ColumnKind {
	TEXTUAL,
	BINARY,
	OTHER;

	public static ColumnKind classify(String declaredType) {
		if (declaredType == null) {
			return OTHER;
		}
		String type = declaredType.toLowerCase(Locale.ROOT);
		if (type.contains("text") || type.contains("varchar") || type.contains("character varying")) {
			return TEXTUAL;
		}
		if (type.contains("bytea")) {
			return BINARY;
		}
		return OTHER;
	}
}
