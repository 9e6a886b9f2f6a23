package org.javai.pgintrospect.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TableRef")
class TableRefTest {

	@Test
	@DisplayName("alias must not be empty")
	void aliasRequired() {
		assertThatThrownBy(() -> new TableRef("orders", ""))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("orders");
		assertThatThrownBy(() -> new TableRef("orders", null)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("of uses the bare table name as alias")
	void ofUsesBareName() {
		assertThat(TableRef.of("sales.orders")).isEqualTo(new TableRef("sales.orders", "orders"));
	}

	@Test
	@DisplayName("resolves against the given default schema")
	void qualifiedName() {
		assertThat(new TableRef(" orders ", " o ").qualifiedName("sales"))
				.isEqualTo(new QualifiedName("sales", "orders"));
		assertThat(new TableRef("public.orders", "o").qualifiedName("sales"))
				.isEqualTo(new QualifiedName("public", "orders"));
	}
}
