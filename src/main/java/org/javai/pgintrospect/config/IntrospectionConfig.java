package org.javai.pgintrospect.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.pgintrospect.schema.QualifiedName;

/**
 * Connection, pool and join-inference settings.
 *
 * <p>Usually loaded with {@link IntrospectionConfigLoader}; environment overrides are applied
 * with {@link #withEnvironment(Map)}.</p>
 *
 * @param host database host
 * @param port database port
 * @param database database name
 * @param ssl whether to connect with SSL
 * @param username login role
 * @param password login password
 * @param defaultSchema schema assumed for unqualified table names
 * @param applicationName reported to the server as {@code application_name}
 * @param queryTimeoutSeconds per-statement timeout for metadata queries
 * @param pool connection pool settings
 * @param joins join inference settings
 */
public record IntrospectionConfig(
		String host,
		int port,
		String database,
		boolean ssl,
		String username,
		String password,
		String defaultSchema,
		String applicationName,
		int queryTimeoutSeconds,
		PoolSettings pool,
		JoinSettings joins
) {

	public static final String DEFAULT_APPLICATION_NAME = "postgresql-mcp-readonly";

	public IntrospectionConfig {
		host = host != null ? host : "localhost";
		port = port > 0 ? port : 5432;
		defaultSchema = defaultSchema != null ? defaultSchema : QualifiedName.DEFAULT_SCHEMA;
		applicationName = applicationName != null ? applicationName : DEFAULT_APPLICATION_NAME;
		queryTimeoutSeconds = queryTimeoutSeconds > 0 ? queryTimeoutSeconds : 30;
		pool = pool != null ? pool : PoolSettings.defaults();
		joins = joins != null ? joins : JoinSettings.defaults();
	}

	public static IntrospectionConfig defaults() {
		return new IntrospectionConfig(null, 0, null, false, null, null, null, null, 0, null, null);
	}

	public String jdbcUrl() {
		String url = "jdbc:postgresql://" + host + ":" + port + "/" + (database != null ? database : "");
		return ssl ? url + "?ssl=true" : url;
	}

	/**
	 * Applies {@code POSTGRES_HOST}, {@code POSTGRES_PORT}, {@code POSTGRES_DATABASE},
	 * {@code POSTGRES_USER}, {@code POSTGRES_PASSWORD} and {@code POSTGRES_SSL} on top of
	 * these settings.
	 */
	public IntrospectionConfig withEnvironment(Map<String, String> env) {
		String portValue = env.get("POSTGRES_PORT");
		int effectivePort;
		try {
			effectivePort = portValue != null ? Integer.parseInt(portValue.trim()) : port;
		}
		catch (NumberFormatException e) {
			throw new IllegalStateException("POSTGRES_PORT is not a number: " + portValue, e);
		}
		String sslValue = env.get("POSTGRES_SSL");
		return new IntrospectionConfig(
				env.getOrDefault("POSTGRES_HOST", host),
				effectivePort,
				env.getOrDefault("POSTGRES_DATABASE", database),
				sslValue != null ? "true".equalsIgnoreCase(sslValue.trim()) : ssl,
				env.getOrDefault("POSTGRES_USER", username),
				env.getOrDefault("POSTGRES_PASSWORD", password),
				defaultSchema,
				applicationName,
				queryTimeoutSeconds,
				pool,
				joins);
	}

	/**
	 * @throws IllegalStateException naming every missing required setting
	 */
	public IntrospectionConfig validate() {
		List<String> missing = new ArrayList<>();
		if (database == null || database.isBlank()) {
			missing.add("database (POSTGRES_DATABASE)");
		}
		if (username == null || username.isBlank()) {
			missing.add("username (POSTGRES_USER)");
		}
		if (password == null) {
			missing.add("password (POSTGRES_PASSWORD)");
		}
		if (!missing.isEmpty()) {
			throw new IllegalStateException("Missing required database configuration: " + String.join(", ", missing));
		}
		return this;
	}

	@Override
	public String toString() {
		return "IntrospectionConfig[url=" + jdbcUrl() + ", username=" + username
				+ ", defaultSchema=" + defaultSchema + ", pool=" + pool + ", joins=" + joins + "]";
	}

	/**
	 * @param maximumSize upper bound on concurrent connections
	 * @param connectionTimeoutMs how long to wait for a free connection
	 * @param idleTimeoutMs how long an idle connection is kept
	 */
	public record PoolSettings(int maximumSize, long connectionTimeoutMs, long idleTimeoutMs) {

		public PoolSettings {
			maximumSize = maximumSize > 0 ? maximumSize : 5;
			connectionTimeoutMs = connectionTimeoutMs > 0 ? connectionTimeoutMs : 2000;
			idleTimeoutMs = idleTimeoutMs > 0 ? idleTimeoutMs : 30000;
		}

		public static PoolSettings defaults() {
			return new PoolSettings(0, 0, 0);
		}
	}

	/**
	 * @param parallelLookups issue the per-table metadata lookups of one request concurrently
	 * @param requestTimeoutMs upper bound on one suggestion request when lookups run concurrently
	 * @param namingConventionHeuristic also suggest joins from {@code <table>_id} column names
	 */
	public record JoinSettings(boolean parallelLookups, long requestTimeoutMs, boolean namingConventionHeuristic) {

		public JoinSettings {
			requestTimeoutMs = requestTimeoutMs > 0 ? requestTimeoutMs : 30000;
		}

		public static JoinSettings defaults() {
			return new JoinSettings(false, 0, false);
		}
	}
}
