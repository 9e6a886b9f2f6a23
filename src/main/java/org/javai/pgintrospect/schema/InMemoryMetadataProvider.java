package org.javai.pgintrospect.schema;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * In-memory {@link MetadataProvider} for tests or fixed schemas.
 *
 * <p>Supports fluent configuration of tables, columns, keys and indexes:</p>
 *
 * <pre>{@code
 * MetadataProvider provider = new InMemoryMetadataProvider()
 *     .addTable("users")
 *     .addColumn("users", "id", "integer", false)
 *     .withPrimaryKey("users", "id")
 *     .addTable("orders")
 *     .addColumn("orders", "id", "integer", false)
 *     .addColumn("orders", "user_id", "integer", true)
 *     .withPrimaryKey("orders", "id")
 *     .addForeignKey("orders_user_id_fkey", "orders", "user_id", "users", "id");
 * }</pre>
 *
 * <p>Bare table names are placed in {@link QualifiedName#DEFAULT_SCHEMA}. Configure the
 * provider fully before sharing it between threads.</p>
 */
public final class InMemoryMetadataProvider implements MetadataProvider {

	private final Map<QualifiedName, TableBuilder> tables = new LinkedHashMap<>();
	private final List<ForeignKeyEdge> foreignKeys = new ArrayList<>();
	private final AtomicInteger queryCount = new AtomicInteger();
	private volatile boolean unavailable;
	private volatile Duration latency = Duration.ZERO;

	public InMemoryMetadataProvider addTable(String tableName) {
		QualifiedName name = QualifiedName.parse(tableName);
		tables.putIfAbsent(name, new TableBuilder());
		return this;
	}

	public InMemoryMetadataProvider addColumn(String tableName, String columnName, String type, boolean nullable) {
		return addColumn(tableName, new Column(columnName, type, nullable, null, null, null));
	}

	public InMemoryMetadataProvider addColumn(String tableName, Column column) {
		TableBuilder table = requireTable(tableName);
		boolean duplicate = table.columns.stream().anyMatch(c -> c.name().equals(column.name()));
		if (duplicate) {
			throw new IllegalArgumentException("Column " + column.name() + " already defined on " + tableName);
		}
		table.columns.add(column);
		return this;
	}

	public InMemoryMetadataProvider withPrimaryKey(String tableName, String... columns) {
		requireTable(tableName).primaryKey = PrimaryKey.of(columns);
		return this;
	}

	/**
	 * Declares a single-column foreign key.
	 */
	public InMemoryMetadataProvider addForeignKey(String constraintName, String sourceTable, String sourceColumn,
			String targetTable, String targetColumn) {
		return addForeignKey(constraintName, sourceTable, List.of(sourceColumn), targetTable, List.of(targetColumn));
	}

	/**
	 * Declares a (possibly composite) foreign key; column lists are paired by position.
	 */
	public InMemoryMetadataProvider addForeignKey(String constraintName, String sourceTable, List<String> sourceColumns,
			String targetTable, List<String> targetColumns) {
		if (sourceColumns.size() != targetColumns.size() || sourceColumns.isEmpty()) {
			throw new IllegalArgumentException("Foreign key " + constraintName + " needs matching, non-empty column lists");
		}
		requireTable(sourceTable);
		requireTable(targetTable);
		QualifiedName source = QualifiedName.parse(sourceTable);
		QualifiedName target = QualifiedName.parse(targetTable);
		for (int i = 0; i < sourceColumns.size(); i++) {
			foreignKeys.add(new ForeignKeyEdge(source, sourceColumns.get(i), target, targetColumns.get(i), constraintName));
		}
		return this;
	}

	public InMemoryMetadataProvider addIndex(String tableName, String indexName, List<String> columns, boolean unique,
			String accessMethod) {
		requireTable(tableName).indexes.add(new IndexDescriptor(indexName, columns, unique, accessMethod));
		return this;
	}

	/**
	 * Makes every subsequent call fail as if the database were unreachable.
	 */
	public InMemoryMetadataProvider withUnavailable(boolean unavailable) {
		this.unavailable = unavailable;
		return this;
	}

	/**
	 * Delays every call, for exercising timeouts.
	 */
	public InMemoryMetadataProvider withLatency(Duration latency) {
		this.latency = latency != null ? latency : Duration.ZERO;
		return this;
	}

	/**
	 * @return number of metadata queries answered so far
	 */
	public int queryCount() {
		return queryCount.get();
	}

	@Override
	public Optional<QualifiedName> resolveTable(QualifiedName requested) {
		query();
		return QualifiedName.pick(requested, tables.keySet());
	}

	@Override
	public List<Column> columns(QualifiedName table) {
		query();
		return List.copyOf(table(table).columns);
	}

	@Override
	public PrimaryKey primaryKey(QualifiedName table) {
		query();
		return table(table).primaryKey;
	}

	@Override
	public List<ForeignKeyEdge> outgoingForeignKeys(QualifiedName table) {
		query();
		return foreignKeys.stream()
				.filter(edge -> edge.source().equals(table))
				.toList();
	}

	@Override
	public List<ForeignKeyEdge> incomingForeignKeys(QualifiedName table) {
		query();
		return foreignKeys.stream()
				.filter(edge -> edge.target().equals(table))
				.sorted(Comparator.comparing((ForeignKeyEdge edge) -> edge.source().table()))
				.toList();
	}

	@Override
	public List<IndexDescriptor> indexes(QualifiedName table) {
		query();
		return table(table).indexes.stream()
				.sorted(Comparator.comparing(IndexDescriptor::name))
				.toList();
	}

	@Override
	public List<QualifiedName> listTables() {
		query();
		return tables.keySet().stream()
				.sorted(Comparator.comparing(QualifiedName::schema).thenComparing(QualifiedName::table))
				.toList();
	}

	@Override
	public List<QualifiedName> searchTables(String pattern) {
		query();
		Pattern regex;
		try {
			regex = Pattern.compile(pattern);
		}
		catch (PatternSyntaxException e) {
			throw new IllegalArgumentException("Invalid table search pattern: " + pattern, e);
		}
		String lowered = pattern.toLowerCase(Locale.ROOT);
		return tables.keySet().stream()
				.filter(name -> regex.matcher(name.table()).find() || regex.matcher(name.schema()).find())
				.sorted(Comparator.comparingInt((QualifiedName name) -> searchRank(name, pattern, lowered))
						.thenComparing(QualifiedName::schema)
						.thenComparing(QualifiedName::table))
				.toList();
	}

	private static int searchRank(QualifiedName name, String pattern, String lowered) {
		String table = name.table().toLowerCase(Locale.ROOT);
		if (name.table().equals(pattern)) {
			return 1;
		}
		if (table.startsWith(lowered)) {
			return 2;
		}
		if (table.contains(lowered)) {
			return 3;
		}
		return 4;
	}

	private void query() {
		queryCount.incrementAndGet();
		if (!latency.isZero()) {
			try {
				Thread.sleep(latency.toMillis());
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new MetadataUnavailableException("Metadata query interrupted", e);
			}
		}
		if (unavailable) {
			throw new MetadataUnavailableException("Metadata source unavailable", null);
		}
	}

	private TableBuilder table(QualifiedName name) {
		TableBuilder table = tables.get(name);
		if (table == null) {
			throw new TableNotFoundException(name.toString());
		}
		return table;
	}

	private TableBuilder requireTable(String tableName) {
		TableBuilder table = tables.get(QualifiedName.parse(tableName));
		if (table == null) {
			throw new IllegalArgumentException("Unknown table: " + tableName + " (call addTable first)");
		}
		return table;
	}

	private static final class TableBuilder {
		private final List<Column> columns = new ArrayList<>();
		private final List<IndexDescriptor> indexes = new ArrayList<>();
		private PrimaryKey primaryKey = PrimaryKey.none();
	}
}
