package org.javai.pgintrospect.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.javai.pgintrospect.schema.QualifiedName;

/**
 * A list of tables grouped by schema, suitable for LLM tool responses.
 *
 * @param count number of tables
 * @param tablesBySchema table names per schema, schemas sorted
 * @param error whether the listing failed
 * @param message human-readable summary
 */
public record TableListing(int count, Map<String, List<String>> tablesBySchema, boolean error, String message) {

	/**
	 * Groups tables by schema, keeping their order within a schema.
	 */
	static TableListing of(List<QualifiedName> tables, String message) {
		Map<String, List<String>> bySchema = new TreeMap<>();
		for (QualifiedName table : tables) {
			bySchema.computeIfAbsent(table.schema(), k -> new ArrayList<>()).add(table.table());
		}
		bySchema.replaceAll((schema, names) -> List.copyOf(names));
		return new TableListing(tables.size(), Collections.unmodifiableMap(bySchema), false, message);
	}

	static TableListing failed(String message) {
		return new TableListing(0, Map.of(), true, message);
	}
}
