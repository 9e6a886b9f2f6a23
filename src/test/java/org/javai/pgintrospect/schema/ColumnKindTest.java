package org.javai.pgintrospect.schema;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ColumnKind")
class ColumnKindTest {

	@Test
	@DisplayName("character types are textual, whatever the case")
	void textual() {
		assertThat(ColumnKind.classify("text")).isEqualTo(ColumnKind.TEXTUAL);
		assertThat(ColumnKind.classify("character varying")).isEqualTo(ColumnKind.TEXTUAL);
		assertThat(ColumnKind.classify("varchar(40)")).isEqualTo(ColumnKind.TEXTUAL);
		assertThat(ColumnKind.classify("TEXT")).isEqualTo(ColumnKind.TEXTUAL);
	}

	@Test
	@DisplayName("bytea is binary")
	void binary() {
		assertThat(ColumnKind.classify("bytea")).isEqualTo(ColumnKind.BINARY);
		assertThat(Column.of("payload", "bytea").kind()).isEqualTo(ColumnKind.BINARY);
	}

	@Test
	@DisplayName("everything else, including an unknown type, is OTHER")
	void other() {
		assertThat(ColumnKind.classify("integer")).isEqualTo(ColumnKind.OTHER);
		assertThat(ColumnKind.classify("timestamp with time zone")).isEqualTo(ColumnKind.OTHER);
		assertThat(ColumnKind.classify(null)).isEqualTo(ColumnKind.OTHER);
	}
}
