package org.javai.pgintrospect.schema.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.javai.pgintrospect.config.IntrospectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the small, read-only connection pool used for metadata queries.
 *
 * <p>The returned pool belongs to the caller, who must close it. Connections are read-only,
 * run with {@code default_transaction_read_only = on} and report the configured
 * {@code application_name}.</p>
 */
public final class MetadataDataSourceFactory {

	private static final Logger logger = LoggerFactory.getLogger(MetadataDataSourceFactory.class);

	private MetadataDataSourceFactory() {
	}

	public static HikariConfig hikariConfig(IntrospectionConfig config) {
		IntrospectionConfig.PoolSettings pool = config.pool();
		HikariConfig hikariConfig = new HikariConfig();
		hikariConfig.setJdbcUrl(config.jdbcUrl());
		hikariConfig.setUsername(config.username());
		hikariConfig.setPassword(config.password());
		hikariConfig.setMaximumPoolSize(pool.maximumSize());
		hikariConfig.setMinimumIdle(Math.min(1, pool.maximumSize()));
		hikariConfig.setConnectionTimeout(pool.connectionTimeoutMs());
		hikariConfig.setIdleTimeout(pool.idleTimeoutMs());
		hikariConfig.setReadOnly(true);
		hikariConfig.setAutoCommit(true);
		hikariConfig.setConnectionInitSql("SET default_transaction_read_only = on");
		hikariConfig.addDataSourceProperty("ApplicationName", config.applicationName());
		hikariConfig.setPoolName("pg-introspect-" + config.applicationName());
		return hikariConfig;
	}

	public static HikariDataSource create(IntrospectionConfig config) {
		HikariConfig hikariConfig = hikariConfig(config);
		logger.info("Creating metadata connection pool {} for {} (user: {}, maxPoolSize={}, connectionTimeoutMs={})",
				hikariConfig.getPoolName(), config.jdbcUrl(), config.username(),
				hikariConfig.getMaximumPoolSize(), hikariConfig.getConnectionTimeout());
		return new HikariDataSource(hikariConfig);
	}
}
