package org.javai.pgintrospect.config;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link IntrospectionConfig} from YAML.
 *
 * <pre>
 * host: db.internal
 * port: 5432
 * database: shop
 * username: reader
 * password: secret
 * default-schema: public
 * query-timeout-seconds: 30
 * pool:
 *   maximum-size: 5
 *   connection-timeout-ms: 2000
 *   idle-timeout-ms: 30000
 * joins:
 *   parallel-lookups: false
 *   request-timeout-ms: 30000
 *   naming-convention-heuristic: false
 * </pre>
 *
 * <p>Absent keys take the defaults of {@link IntrospectionConfig}.</p>
 */
public class IntrospectionConfigLoader {

	public static final String DEFAULT_RESOURCE = "pg-introspect.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns defaults when absent.
	 */
	public IntrospectionConfig loadDefault() {
		InputStream in = IntrospectionConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			return IntrospectionConfig.defaults();
		}
		try (in) {
			return load(in);
		}
		catch (IntrospectionConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new IntrospectionConfigException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public IntrospectionConfig load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return fromMap(yaml.load(reader));
		}
		catch (IntrospectionConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new IntrospectionConfigException("Failed to read configuration from path: " + path, e);
		}
	}

	public IntrospectionConfig load(InputStream inputStream) {
		try {
			return fromMap(yaml.load(inputStream));
		}
		catch (IntrospectionConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new IntrospectionConfigException("Failed to read configuration from input stream", e);
		}
	}

	private IntrospectionConfig fromMap(Map<String, Object> data) {
		if (data == null) {
			return IntrospectionConfig.defaults();
		}
		Map<String, Object> pool = section(data, "pool");
		Map<String, Object> joins = section(data, "joins");
		return new IntrospectionConfig(
				string(data, "host"),
				integer(data, "port"),
				string(data, "database"),
				bool(data, "ssl"),
				string(data, "username"),
				string(data, "password"),
				string(data, "default-schema"),
				string(data, "application-name"),
				integer(data, "query-timeout-seconds"),
				new IntrospectionConfig.PoolSettings(
						integer(pool, "maximum-size"),
						number(pool, "connection-timeout-ms"),
						number(pool, "idle-timeout-ms")),
				new IntrospectionConfig.JoinSettings(
						bool(joins, "parallel-lookups"),
						number(joins, "request-timeout-ms"),
						bool(joins, "naming-convention-heuristic")));
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new IntrospectionConfigException("'" + key + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static String string(Map<String, Object> data, String key) {
		Object value = data.get(key);
		return value != null ? value.toString() : null;
	}

	private static int integer(Map<String, Object> data, String key) {
		return (int) number(data, key);
	}

	private static long number(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return 0;
		}
		if (value instanceof Number n) {
			return n.longValue();
		}
		try {
			return Long.parseLong(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new IntrospectionConfigException("'" + key + "' must be a number but was: " + value, e);
		}
	}

	private static boolean bool(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value instanceof Boolean b) {
			return b;
		}
		return value != null && Boolean.parseBoolean(value.toString().trim());
	}
}
