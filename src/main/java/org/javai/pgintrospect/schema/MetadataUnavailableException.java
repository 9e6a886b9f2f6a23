package org.javai.pgintrospect.schema;

/**
 * Thrown when the metadata source could not answer a query (connectivity, permission,
 * timeout). Not a semantic failure, so callers may retry.
 */
public class MetadataUnavailableException extends SchemaIntrospectionException {

	public MetadataUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public boolean isRetryable() {
		return true;
	}
}
