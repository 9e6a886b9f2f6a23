package org.javai.pgintrospect.schema.jdbc;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.javai.pgintrospect.schema.Column;
import org.javai.pgintrospect.schema.ForeignKeyEdge;
import org.javai.pgintrospect.schema.IndexDescriptor;
import org.javai.pgintrospect.schema.MetadataProvider;
import org.javai.pgintrospect.schema.MetadataUnavailableException;
import org.javai.pgintrospect.schema.PrimaryKey;
import org.javai.pgintrospect.schema.QualifiedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetadataProvider} reading the PostgreSQL system catalogs through a pooled
 * {@link DataSource}.
 *
 * <p>Each method is one logical query: it borrows a connection, runs a single read-only
 * statement and returns the connection to the pool on every exit path. No transaction spans
 * two calls. Catalog rows are mapped into typed records here and nowhere else.</p>
 */
public class JdbcMetadataProvider implements MetadataProvider {

	private static final Logger logger = LoggerFactory.getLogger(JdbcMetadataProvider.class);

	private final DataSource dataSource;
	private final int queryTimeoutSeconds;

	/**
	 * @param dataSource pooled, read-only data source; owned by the caller
	 * @param queryTimeoutSeconds per-statement timeout, 0 for none
	 */
	public JdbcMetadataProvider(DataSource dataSource, int queryTimeoutSeconds) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
		if (queryTimeoutSeconds < 0) {
			throw new IllegalArgumentException("queryTimeoutSeconds must not be negative");
		}
		this.queryTimeoutSeconds = queryTimeoutSeconds;
	}

	@Override
	public Optional<QualifiedName> resolveTable(QualifiedName requested) {
		List<QualifiedName> matches = query("resolve " + requested, PostgresCatalogQueries.RESOLVE_TABLE,
				JdbcMetadataProvider::tableName, requested.schema(), requested.table());
		return QualifiedName.pick(requested, matches);
	}

	@Override
	public List<Column> columns(QualifiedName table) {
		return query("columns of " + table, PostgresCatalogQueries.COLUMNS, rs -> {
			int maxLength = rs.getInt("character_maximum_length");
			Integer effectiveMaxLength = rs.wasNull() ? null : maxLength;
			return new Column(
					rs.getString("column_name"),
					rs.getString("data_type"),
					"YES".equals(rs.getString("is_nullable")),
					rs.getString("column_default"),
					effectiveMaxLength,
					rs.getString("comment"));
		}, table.schema(), table.table());
	}

	@Override
	public PrimaryKey primaryKey(QualifiedName table) {
		List<String> columns = query("primary key of " + table, PostgresCatalogQueries.PRIMARY_KEY,
				rs -> rs.getString("attname"), table.schema(), table.table());
		return new PrimaryKey(columns);
	}

	@Override
	public List<ForeignKeyEdge> outgoingForeignKeys(QualifiedName table) {
		return query("outgoing foreign keys of " + table, PostgresCatalogQueries.OUTGOING_FOREIGN_KEYS,
				JdbcMetadataProvider::foreignKeyEdge, table.schema(), table.table());
	}

	@Override
	public List<ForeignKeyEdge> incomingForeignKeys(QualifiedName table) {
		return query("incoming foreign keys of " + table, PostgresCatalogQueries.INCOMING_FOREIGN_KEYS,
				JdbcMetadataProvider::foreignKeyEdge, table.schema(), table.table());
	}

	@Override
	public List<IndexDescriptor> indexes(QualifiedName table) {
		return query("indexes of " + table, PostgresCatalogQueries.INDEXES, rs -> new IndexDescriptor(
				rs.getString("index_name"),
				stringArray(rs.getArray("columns")),
				rs.getBoolean("is_unique"),
				rs.getString("access_method")), table.schema(), table.table());
	}

	@Override
	public List<QualifiedName> listTables() {
		return query("table list", PostgresCatalogQueries.LIST_TABLES, JdbcMetadataProvider::tableName);
	}

	@Override
	public List<QualifiedName> searchTables(String pattern) {
		return query("table search '" + pattern + "'", PostgresCatalogQueries.SEARCH_TABLES,
				JdbcMetadataProvider::tableName, pattern, pattern, pattern, pattern, pattern);
	}

	private <T> List<T> query(String description, String sql, RowMapper<T> mapper, Object... params) {
		logger.debug("Metadata query: {}", description);
		try (Connection connection = dataSource.getConnection();
				PreparedStatement statement = connection.prepareStatement(sql)) {
			statement.setQueryTimeout(queryTimeoutSeconds);
			for (int i = 0; i < params.length; i++) {
				statement.setObject(i + 1, params[i]);
			}
			try (ResultSet rs = statement.executeQuery()) {
				List<T> rows = new ArrayList<>();
				while (rs.next()) {
					rows.add(mapper.map(rs));
				}
				return rows;
			}
		}
		catch (SQLException e) {
			logger.warn("Metadata query failed ({}): {} [SQLState {}]", description, e.getMessage(), e.getSQLState());
			throw new MetadataUnavailableException("Failed to read " + description + ": " + e.getMessage(), e);
		}
	}

	private static QualifiedName tableName(ResultSet rs) throws SQLException {
		return new QualifiedName(rs.getString("schemaname"), rs.getString("tablename"));
	}

	private static ForeignKeyEdge foreignKeyEdge(ResultSet rs) throws SQLException {
		return new ForeignKeyEdge(
				new QualifiedName(rs.getString("source_schema"), rs.getString("source_table")),
				rs.getString("source_column"),
				new QualifiedName(rs.getString("target_schema"), rs.getString("target_table")),
				rs.getString("target_column"),
				rs.getString("constraint_name"));
	}

	private static List<String> stringArray(Array array) throws SQLException {
		if (array == null) {
			return List.of();
		}
		try {
			Object[] values = (Object[]) array.getArray();
			List<String> result = new ArrayList<>(values.length);
			for (Object value : values) {
				result.add(String.valueOf(value));
			}
			return result;
		}
		finally {
			array.free();
		}
	}

	@FunctionalInterface
	private interface RowMapper<T> {
		T map(ResultSet rs) throws SQLException;
	}
}
