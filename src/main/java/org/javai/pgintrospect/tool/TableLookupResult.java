package org.javai.pgintrospect.tool;

/**
 * Outcome of a table lookup: the table, or a message saying why there is none.
 *
 * @param found whether the table exists
 * @param error whether the lookup failed
 * @param message human-readable outcome
 * @param table the table detail, null unless found
 */
public record TableLookupResult(boolean found, boolean error, String message, TableDetail table) {

	static TableLookupResult found(TableDetail table) {
		return new TableLookupResult(true, false, "Table " + table.schema() + "." + table.name(), table);
	}

	static TableLookupResult notFound(String tableName) {
		return new TableLookupResult(false, false, "Table '" + tableName + "' not found", null);
	}

	static TableLookupResult failed(String message) {
		return new TableLookupResult(false, true, message, null);
	}
}
