package org.javai.pgintrospect.config;

/**
 * Thrown when a configuration file cannot be read or contains invalid values.
 */
public class IntrospectionConfigException extends RuntimeException {

	public IntrospectionConfigException(String message) {
		super(message);
	}

	public IntrospectionConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
