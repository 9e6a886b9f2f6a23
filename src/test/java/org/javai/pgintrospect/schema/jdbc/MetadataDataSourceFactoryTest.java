package org.javai.pgintrospect.schema.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import com.zaxxer.hikari.HikariConfig;
import java.util.Map;
import org.javai.pgintrospect.config.IntrospectionConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetadataDataSourceFactory")
class MetadataDataSourceFactoryTest {

	private final IntrospectionConfig config = IntrospectionConfig.defaults().withEnvironment(Map.of(
			"POSTGRES_HOST", "db.internal",
			"POSTGRES_DATABASE", "shop",
			"POSTGRES_USER", "reader",
			"POSTGRES_PASSWORD", "secret"));

	@Test
	@DisplayName("pool defaults to five connections, 2 s acquisition and 30 s idle timeouts")
	void poolDefaults() {
		HikariConfig hikari = MetadataDataSourceFactory.hikariConfig(config);

		assertThat(hikari.getJdbcUrl()).isEqualTo("jdbc:postgresql://db.internal:5432/shop");
		assertThat(hikari.getUsername()).isEqualTo("reader");
		assertThat(hikari.getPassword()).isEqualTo("secret");
		assertThat(hikari.getMaximumPoolSize()).isEqualTo(5);
		assertThat(hikari.getMinimumIdle()).isEqualTo(1);
		assertThat(hikari.getConnectionTimeout()).isEqualTo(2000);
		assertThat(hikari.getIdleTimeout()).isEqualTo(30000);
	}

	@Test
	@DisplayName("connections are read-only and identify the application")
	void readOnlySessions() {
		HikariConfig hikari = MetadataDataSourceFactory.hikariConfig(config);

		assertThat(hikari.isReadOnly()).isTrue();
		assertThat(hikari.getConnectionInitSql()).isEqualTo("SET default_transaction_read_only = on");
		assertThat(hikari.getDataSourceProperties())
				.containsEntry("ApplicationName", IntrospectionConfig.DEFAULT_APPLICATION_NAME);
		assertThat(hikari.getPoolName()).isEqualTo("pg-introspect-postgresql-mcp-readonly");
	}
}
