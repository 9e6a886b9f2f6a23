package org.javai.pgintrospect.joins;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Join kinds a suggestion may use.
 */
public enum JoinType {
	INNER_JOIN("INNER JOIN"),
	LEFT_JOIN("LEFT JOIN");

	private final String keyword;

	JoinType(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * @return the SQL keyword, e.g. {@code LEFT JOIN}
	 */
	@JsonValue
	public String keyword() {
		return keyword;
	}
}
