package org.javai.pgintrospect.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QualifiedName")
class QualifiedNameTest {

	@Nested
	@DisplayName("parse")
	class Parse {

		@Test
		@DisplayName("bare name falls into the default schema")
		void bareNameUsesDefaultSchema() {
			assertThat(QualifiedName.parse("orders")).isEqualTo(new QualifiedName("public", "orders"));
			assertThat(QualifiedName.parse("orders", "sales")).isEqualTo(new QualifiedName("sales", "orders"));
		}

		@Test
		@DisplayName("splits schema and table on the first dot only")
		void splitsOnFirstDot() {
			QualifiedName name = QualifiedName.parse("sales.orders.archive");

			assertThat(name.schema()).isEqualTo("sales");
			assertThat(name.table()).isEqualTo("orders.archive");
		}

		@Test
		@DisplayName("trims surrounding whitespace")
		void trims() {
			assertThat(QualifiedName.parse("  sales.orders ")).isEqualTo(new QualifiedName("sales", "orders"));
		}

		@Test
		@DisplayName("rejects blank identifiers and empty parts")
		void rejectsBlank() {
			assertThatThrownBy(() -> QualifiedName.parse(" ")).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> QualifiedName.parse(null)).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> QualifiedName.parse(".orders")).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> QualifiedName.parse("sales.")).isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Test
	@DisplayName("render omits the default schema only")
	void renderOmitsDefaultSchema() {
		assertThat(new QualifiedName("public", "orders").render("public")).isEqualTo("orders");
		assertThat(new QualifiedName("sales", "orders").render("public")).isEqualTo("sales.orders");
		assertThat(new QualifiedName("public", "orders").toString()).isEqualTo("public.orders");
	}

	@Nested
	@DisplayName("pick")
	class Pick {

		private final QualifiedName requested = new QualifiedName("public", "Orders");

		@Test
		@DisplayName("exact match wins over case-insensitive ones")
		void exactMatchWins() {
			List<QualifiedName> matches = List.of(new QualifiedName("public", "orders"), requested);

			assertThat(QualifiedName.pick(requested, matches)).contains(requested);
		}

		@Test
		@DisplayName("a single case-insensitive match is accepted")
		void singleCaseInsensitiveMatch() {
			QualifiedName actual = new QualifiedName("public", "orders");

			assertThat(QualifiedName.pick(requested, List.of(actual))).contains(actual);
		}

		@Test
		@DisplayName("several case-insensitive matches without an exact one are ambiguous")
		void ambiguous() {
			List<QualifiedName> matches = List.of(new QualifiedName("public", "orders"),
					new QualifiedName("public", "ORDERS"));

			assertThatThrownBy(() -> QualifiedName.pick(requested, matches))
					.isInstanceOf(AmbiguousIdentifierException.class)
					.satisfies(e -> assertThat(((AmbiguousIdentifierException) e).candidates())
							.containsExactlyElementsOf(matches));
		}

		@Test
		@DisplayName("no match is empty, not an error")
		void noMatch() {
			assertThat(QualifiedName.pick(requested, List.of(new QualifiedName("public", "users")))).isEmpty();
		}
	}
}
