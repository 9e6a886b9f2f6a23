package org.javai.pgintrospect.joins;

import org.javai.pgintrospect.schema.SchemaIntrospectionException;

/**
 * Thrown when a suggestion request is abandoned before all metadata lookups completed,
 * through a timeout or an interrupt. No partial result accompanies it.
 */
public class JoinInferenceCancelledException extends SchemaIntrospectionException {

	public JoinInferenceCancelledException(String message) {
		super(message);
	}

	public JoinInferenceCancelledException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public boolean isRetryable() {
		return true;
	}
}
