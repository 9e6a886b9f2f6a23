package org.javai.pgintrospect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import org.javai.pgintrospect.config.IntrospectionConfig;
import org.javai.pgintrospect.joins.NamingConventionRule;
import org.javai.pgintrospect.schema.TableRef;
import org.javai.pgintrospect.testsupport.ShopSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PgIntrospection")
class PgIntrospectionTest {

	@Test
	@DisplayName("wires snapshots, join engine and tool around a provider")
	void wiring() {
		try (PgIntrospection introspection = PgIntrospection.using(ShopSchema.provider())) {
			assertThat(introspection.snapshots().requireSnapshot("orders").columns()).hasSize(3);
			assertThat(introspection.tool().listTables().count()).isEqualTo(4);
			assertThat(introspection.joinEngine().rules()).noneMatch(NamingConventionRule.class::isInstance);
		}
	}

	@Test
	@DisplayName("join settings reach the engine")
	void joinSettings() {
		IntrospectionConfig config = new IntrospectionConfig(null, 0, null, false, null, null, null, null, 0, null,
				new IntrospectionConfig.JoinSettings(true, 5000, true));

		try (PgIntrospection introspection = PgIntrospection.using(config, ShopSchema.provider())) {
			assertThat(introspection.joinEngine().rules()).anyMatch(NamingConventionRule.class::isInstance);
			assertThat(introspection.joinEngine().suggestJoins(
					List.of(new TableRef("users", "u"), new TableRef("orders", "o")),
					new TableRef("order_items", "oi"))).isNotEmpty();
		}
	}

	@Test
	@DisplayName("refuses to connect without credentials")
	void connectValidates() {
		assertThatThrownBy(() -> PgIntrospection.connect(IntrospectionConfig.defaults()))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("POSTGRES_DATABASE");
	}
}
