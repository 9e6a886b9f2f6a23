package org.javai.pgintrospect.schema.jdbc;

/**
 * Catalog queries used by {@link JdbcMetadataProvider}. Every query is a read of
 * {@code pg_catalog} or {@code information_schema} and takes bind parameters only.
 */
final class PostgresCatalogQueries {

	private PostgresCatalogQueries() {
	}

	static final String RESOLVE_TABLE = """
			SELECT schemaname, tablename
			FROM pg_tables
			WHERE lower(schemaname) = lower(?) AND lower(tablename) = lower(?)
			ORDER BY schemaname, tablename
			""";

	static final String COLUMNS = """
			SELECT
				c.column_name,
				c.data_type,
				c.is_nullable,
				c.column_default,
				c.character_maximum_length,
				col_description(pgc.oid, c.ordinal_position) AS comment
			FROM information_schema.columns c
			JOIN pg_namespace pgn ON pgn.nspname = c.table_schema
			JOIN pg_class pgc ON pgc.relname = c.table_name AND pgc.relnamespace = pgn.oid
			WHERE c.table_schema = ? AND c.table_name = ?
			ORDER BY c.ordinal_position
			""";

	static final String PRIMARY_KEY = """
			SELECT a.attname
			FROM pg_index i
			JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey)
			WHERE i.indrelid = (quote_ident(?) || '.' || quote_ident(?))::regclass
			AND i.indisprimary
			ORDER BY array_position(i.indkey::int2[], a.attnum)
			""";

	// One row per column pair; composite keys are paired by ordinal position.
	private static final String FOREIGN_KEY_EDGES = """
			SELECT
				src_ns.nspname AS source_schema,
				src.relname AS source_table,
				sa.attname AS source_column,
				tgt_ns.nspname AS target_schema,
				tgt.relname AS target_table,
				ta.attname AS target_column,
				c.conname AS constraint_name
			FROM pg_constraint c
			CROSS JOIN LATERAL unnest(c.conkey, c.confkey) WITH ORDINALITY AS k(source_attnum, target_attnum, ord)
			JOIN pg_class src ON src.oid = c.conrelid
			JOIN pg_namespace src_ns ON src_ns.oid = src.relnamespace
			JOIN pg_class tgt ON tgt.oid = c.confrelid
			JOIN pg_namespace tgt_ns ON tgt_ns.oid = tgt.relnamespace
			JOIN pg_attribute sa ON sa.attrelid = c.conrelid AND sa.attnum = k.source_attnum
			JOIN pg_attribute ta ON ta.attrelid = c.confrelid AND ta.attnum = k.target_attnum
			WHERE c.contype = 'f'
			""";

	static final String OUTGOING_FOREIGN_KEYS = FOREIGN_KEY_EDGES + """
			AND src_ns.nspname = ? AND src.relname = ?
			ORDER BY c.conname, k.ord
			""";

	static final String INCOMING_FOREIGN_KEYS = FOREIGN_KEY_EDGES + """
			AND tgt_ns.nspname = ? AND tgt.relname = ?
			ORDER BY src.relname, c.conname, k.ord
			""";

	static final String INDEXES = """
			SELECT
				i.relname AS index_name,
				array_agg(a.attname::text ORDER BY array_position(ix.indkey::int2[], a.attnum)) AS columns,
				ix.indisunique AS is_unique,
				am.amname AS access_method
			FROM pg_class t
			JOIN pg_index ix ON t.oid = ix.indrelid
			JOIN pg_class i ON i.oid = ix.indexrelid
			JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = ANY(ix.indkey)
			JOIN pg_am am ON i.relam = am.oid
			JOIN pg_namespace n ON n.oid = t.relnamespace
			WHERE n.nspname = ? AND t.relname = ?
			GROUP BY i.relname, ix.indisunique, am.amname
			ORDER BY i.relname
			""";

	static final String LIST_TABLES = """
			SELECT schemaname, tablename
			FROM pg_tables
			WHERE schemaname NOT IN ('information_schema', 'pg_catalog', 'pg_toast')
			ORDER BY schemaname, tablename
			""";

	static final String SEARCH_TABLES = """
			SELECT schemaname, tablename
			FROM pg_tables
			WHERE schemaname NOT IN ('information_schema', 'pg_catalog', 'pg_toast')
			AND (tablename ~ ? OR schemaname ~ ?)
			ORDER BY
				CASE
					WHEN tablename = ? THEN 1
					WHEN tablename ILIKE ? || '%' THEN 2
					WHEN tablename ILIKE '%' || ? || '%' THEN 3
					ELSE 4
				END,
				schemaname, tablename
			""";
}
