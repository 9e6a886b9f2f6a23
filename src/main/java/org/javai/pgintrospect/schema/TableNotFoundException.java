package org.javai.pgintrospect.schema;

/**
 * Thrown when a table identifier supplied by the caller does not resolve to a table.
 */
public class TableNotFoundException extends SchemaIntrospectionException {

	private final String identifier;

	public TableNotFoundException(String identifier) {
		super("Table '" + identifier + "' not found");
		this.identifier = identifier;
	}

	public String identifier() {
		return identifier;
	}
}
