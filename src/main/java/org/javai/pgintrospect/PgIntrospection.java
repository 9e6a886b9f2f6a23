package org.javai.pgintrospect;

import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.javai.pgintrospect.config.IntrospectionConfig;
import org.javai.pgintrospect.config.IntrospectionConfigLoader;
import org.javai.pgintrospect.joins.JoinInferenceEngine;
import org.javai.pgintrospect.schema.MetadataProvider;
import org.javai.pgintrospect.schema.SchemaSnapshotService;
import org.javai.pgintrospect.schema.jdbc.JdbcMetadataProvider;
import org.javai.pgintrospect.schema.jdbc.MetadataDataSourceFactory;
import org.javai.pgintrospect.tool.DatabaseIntrospectionTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires configuration, connection pool, metadata provider, join engine and tool together.
 *
 * <pre>{@code
 * try (PgIntrospection introspection = PgIntrospection.fromEnvironment()) {
 *     chatClient.prompt(question).tools(introspection.tool()).call();
 * }
 * }</pre>
 *
 * <p>Closing releases the pool and the lookup executor, if either was created here.</p>
 */
public final class PgIntrospection implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(PgIntrospection.class);

	private final AutoCloseable pool;
	private final ExecutorService lookupExecutor;
	private final SchemaSnapshotService snapshots;
	private final JoinInferenceEngine joinEngine;
	private final DatabaseIntrospectionTool tool;

	private PgIntrospection(IntrospectionConfig config, MetadataProvider provider, AutoCloseable pool) {
		IntrospectionConfig.JoinSettings joins = config.joins();
		this.pool = pool;
		this.lookupExecutor = joins.parallelLookups()
				? Executors.newFixedThreadPool(config.pool().maximumSize())
				: null;
		this.snapshots = new SchemaSnapshotService(provider, config.defaultSchema());
		this.joinEngine = JoinInferenceEngine.builder(provider)
				.defaultSchema(config.defaultSchema())
				.executor(lookupExecutor)
				.requestTimeout(Duration.ofMillis(joins.requestTimeoutMs()))
				.namingConventionHeuristic(joins.namingConventionHeuristic())
				.build();
		this.tool = new DatabaseIntrospectionTool(snapshots, joinEngine);
	}

	/**
	 * Connects using {@code pg-introspect.yml} from the classpath overlaid with the
	 * {@code POSTGRES_*} environment variables.
	 */
	public static PgIntrospection fromEnvironment() {
		return connect(new IntrospectionConfigLoader().loadDefault().withEnvironment(System.getenv()));
	}

	/**
	 * Opens a connection pool for {@code config}.
	 *
	 * @throws IllegalStateException if required connection settings are missing
	 */
	public static PgIntrospection connect(IntrospectionConfig config) {
		config.validate();
		HikariDataSource dataSource = MetadataDataSourceFactory.create(config);
		try {
			return new PgIntrospection(config, new JdbcMetadataProvider(dataSource, config.queryTimeoutSeconds()),
					dataSource);
		}
		catch (RuntimeException e) {
			dataSource.close();
			throw e;
		}
	}

	/**
	 * Uses a caller-owned provider; nothing is closed by {@link #close()} except the
	 * lookup executor.
	 */
	public static PgIntrospection using(IntrospectionConfig config, MetadataProvider provider) {
		return new PgIntrospection(config, Objects.requireNonNull(provider, "provider must not be null"), null);
	}

	public static PgIntrospection using(MetadataProvider provider) {
		return using(IntrospectionConfig.defaults(), provider);
	}

	public SchemaSnapshotService snapshots() {
		return snapshots;
	}

	public JoinInferenceEngine joinEngine() {
		return joinEngine;
	}

	public DatabaseIntrospectionTool tool() {
		return tool;
	}

	@Override
	public void close() {
		if (lookupExecutor != null) {
			lookupExecutor.shutdownNow();
			try {
				lookupExecutor.awaitTermination(5, TimeUnit.SECONDS);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
		if (pool != null) {
			try {
				pool.close();
				logger.info("Metadata connection pool closed");
			}
			catch (Exception e) {
				logger.warn("Failed to close metadata connection pool: {}", e.getMessage(), e);
			}
		}
	}
}
