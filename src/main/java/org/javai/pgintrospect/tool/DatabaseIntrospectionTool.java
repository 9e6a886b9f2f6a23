package org.javai.pgintrospect.tool;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.pgintrospect.joins.JoinInferenceEngine;
import org.javai.pgintrospect.schema.QualifiedName;
import org.javai.pgintrospect.schema.SchemaIntrospectionException;
import org.javai.pgintrospect.schema.SchemaSnapshotService;
import org.javai.pgintrospect.schema.TableRef;
import org.javai.pgintrospect.schema.TableSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

/**
 * Tool providing read-only access to database schema metadata and join suggestions for LLMs.
 *
 * <h2>Usage Pattern</h2>
 *
 * <p>The LLM typically:</p>
 * <ol>
 *   <li>Calls {@link #listTables()} or {@link #searchTables(String)} to find candidate tables</li>
 *   <li>Calls {@link #getTableInfo(String)} for tables relevant to the user's question</li>
 *   <li>Calls {@link #suggestJoins(List, JoinTableInput)} each time it adds a table to a query</li>
 * </ol>
 *
 * <p>Failures never escape as exceptions: every method answers with a result record whose
 * {@code error} flag and {@code message} describe the problem, so the model can recover.</p>
 *
 * @see SchemaSnapshotService
 * @see JoinInferenceEngine
 */
public class DatabaseIntrospectionTool {

	private static final Logger logger = LoggerFactory.getLogger(DatabaseIntrospectionTool.class);

	private final SchemaSnapshotService snapshots;
	private final JoinInferenceEngine joinEngine;

	public DatabaseIntrospectionTool(SchemaSnapshotService snapshots, JoinInferenceEngine joinEngine) {
		this.snapshots = Objects.requireNonNull(snapshots, "snapshots must not be null");
		this.joinEngine = Objects.requireNonNull(joinEngine, "joinEngine must not be null");
	}

	@Tool(name = "getTableInfo", description = """
			Get detailed information about a database table including columns, types, constraints and foreign keys.
			Returns: columns (name, type, nullability, default, max length, comment), primary key,
			outgoing and incoming foreign keys, and indexes.""")
	public TableLookupResult getTableInfo(
			@ToolParam(description = "Name of the table to inspect (can include schema: schema.table)") String tableName) {
		try {
			Optional<TableSnapshot> snapshot = snapshots.snapshot(tableName);
			return snapshot
					.map(s -> TableLookupResult.found(TableDetail.from(s, snapshots.defaultSchema())))
					.orElseGet(() -> TableLookupResult.notFound(tableName));
		}
		catch (SchemaIntrospectionException | IllegalArgumentException e) {
			logger.warn("getTableInfo failed for '{}': {}", tableName, e.getMessage());
			return TableLookupResult.failed("Error getting table info: " + e.getMessage());
		}
	}

	@Tool(name = "listTables", description = """
			List all accessible tables in the database, grouped by schema.""")
	public TableListing listTables() {
		try {
			List<QualifiedName> tables = snapshots.listTables();
			String message = tables.isEmpty()
					? "No tables found or accessible."
					: "Database Tables (" + tables.size() + " found)";
			return TableListing.of(tables, message);
		}
		catch (SchemaIntrospectionException e) {
			logger.warn("listTables failed: {}", e.getMessage());
			return TableListing.failed("Error listing tables: " + e.getMessage());
		}
	}

	@Tool(name = "searchTables", description = """
			Search for tables using a regex pattern. Helps find tables when you're not sure of the exact name.
			Exact name matches come first, then prefix matches, then substring matches.""")
	public TableListing searchTables(
			@ToolParam(description = "Regex pattern to search for in table names (case-sensitive)") String pattern) {
		try {
			List<QualifiedName> tables = snapshots.searchTables(pattern);
			String message = tables.isEmpty()
					? """
					No tables found matching the pattern.
					Tips: the pattern is case-sensitive; use .* for wildcard matching; \
					try partial matches like 'user' to find 'users', 'user_profiles', etc."""
					: "Found " + tables.size() + " matching table(s)";
			return TableListing.of(tables, message);
		}
		catch (SchemaIntrospectionException | IllegalArgumentException e) {
			logger.warn("searchTables failed for '{}': {}", pattern, e.getMessage());
			return TableListing.failed("Error searching tables: " + e.getMessage());
		}
	}

	@Tool(name = "suggestJoins", description = """
			Suggest JOIN expressions based on foreign key relationships between tables.
			Use this to learn how to join a new table to the tables already in a query.
			Returns ranked suggestions: join type, complete join clause, rationale, score and confidence.
			Score 90-105: declared foreign keys. Score 70-89: naming conventions.
			Use INNER JOIN when you only want matching rows, LEFT JOIN to keep unmatched rows of the existing tables.""")
	public JoinSuggestionsResult suggestJoins(
			@ToolParam(description = "Tables already in the query with their aliases") List<JoinTableInput> existingTables,
			@ToolParam(description = "The new table to suggest JOIN expressions for") JoinTableInput newTable) {
		String newTableName = newTable != null ? newTable.tableName() : null;
		String newAlias = newTable != null ? newTable.alias() : null;
		try {
			if (newTable == null) {
				throw new IllegalArgumentException("newTable is required");
			}
			List<TableRef> existing = existingTables != null
					? existingTables.stream().map(DatabaseIntrospectionTool::existingTableRef).toList()
					: List.of();
			List<SuggestedJoin> suggestions = joinEngine.suggestJoins(existing, newTable.toTableRef()).stream()
					.map(SuggestedJoin::from)
					.toList();
			return JoinSuggestionsResult.of(newTableName, newAlias, suggestions);
		}
		catch (SchemaIntrospectionException | IllegalArgumentException e) {
			logger.warn("suggestJoins failed for '{}': {}", newTableName, e.getMessage());
			return JoinSuggestionsResult.failed(newTableName, newAlias,
					"Error generating JOIN suggestions: " + e.getMessage());
		}
	}

	private static TableRef existingTableRef(JoinTableInput input) {
		if (input == null) {
			throw new IllegalArgumentException("existingTables must not contain null entries");
		}
		return input.toTableRef();
	}
}
