package org.javai.pgintrospect.joins;

/**
 * Coarse reading of a suggestion score.
 */
public enum ConfidenceBand {
	/** 90 and above: backed by a declared foreign key. */
	HIGH,
	/** 70 to 89: backed by naming conventions. */
	MEDIUM,
	/** 50 to 69: partial naming matches. */
	LOW,
	/** Below 50. */
	VERY_LOW;

	public static ConfidenceBand of(int score) {
		if (score >= 90) {
			return HIGH;
		}
		if (score >= 70) {
			return MEDIUM;
		}
		if (score >= 50) {
			return LOW;
		}
		return VERY_LOW;
	}
}
