package org.javai.pgintrospect.tool;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import org.javai.pgintrospect.schema.TableRef;

/**
 * A table and alias as supplied by the model.
 */
public record JoinTableInput(
		@JsonProperty(value = "table_name", required = true)
		@JsonPropertyDescription("Table name, optionally schema-qualified (schema.table)")
		String tableName,
		@JsonProperty("alias")
		@JsonPropertyDescription("Alias used for this table in the query; defaults to the table name when omitted")
		String alias
) {

	public TableRef toTableRef() {
		return alias == null || alias.isBlank() ? TableRef.of(tableName) : new TableRef(tableName, alias);
	}
}
