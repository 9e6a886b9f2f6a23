package org.javai.pgintrospect.schema;

/**
 * Base type for failures raised while reading schema metadata or inferring joins.
 *
 * <p>A missing relationship between two tables is never reported through this type;
 * it is represented by an empty result.</p>
 */
public class SchemaIntrospectionException extends RuntimeException {

	public SchemaIntrospectionException(String message) {
		super(message);
	}

	public SchemaIntrospectionException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return true if the caller may reasonably retry the same request
	 */
	public boolean isRetryable() {
		return false;
	}
}
