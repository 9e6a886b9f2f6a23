package org.javai.pgintrospect.joins;

import java.util.Objects;
import java.util.Optional;
import org.javai.pgintrospect.schema.MetadataProvider;
import org.javai.pgintrospect.schema.QualifiedName;
import org.javai.pgintrospect.schema.TableNotFoundException;
import org.javai.pgintrospect.schema.TableRef;

/**
 * Read-only projection of the foreign-key graph for pairs of tables.
 *
 * <p>Edges are fetched fresh from the {@link MetadataProvider} for every pair: one query for
 * each side's outgoing edges, regardless of schema size. Whole outgoing edge sets are
 * returned, not only edges between the two tables, since shared references go through a
 * third table.</p>
 */
public final class ForeignKeyGraphView {

	private final MetadataProvider provider;
	private final String defaultSchema;

	public ForeignKeyGraphView(MetadataProvider provider, String defaultSchema) {
		this.provider = Objects.requireNonNull(provider, "provider must not be null");
		this.defaultSchema = Objects.requireNonNull(defaultSchema, "defaultSchema must not be null");
	}

	public String defaultSchema() {
		return defaultSchema;
	}

	/**
	 * @throws TableNotFoundException if the reference does not name a table
	 */
	public AliasedTable resolve(TableRef ref) {
		QualifiedName requested = ref.qualifiedName(defaultSchema);
		QualifiedName resolved = provider.resolveTable(requested)
				.orElseThrow(() -> new TableNotFoundException(ref.tableName()));
		return new AliasedTable(resolved, ref.alias());
	}

	public EdgePair edgesBetween(AliasedTable left, AliasedTable right) {
		return edgesBetween(left, right, false);
	}

	/**
	 * @param withShapes also read columns and primary keys of both tables
	 */
	public EdgePair edgesBetween(AliasedTable left, AliasedTable right, boolean withShapes) {
		return new EdgePair(
				left,
				right,
				provider.outgoingForeignKeys(left.name()),
				provider.outgoingForeignKeys(right.name()),
				withShapes ? Optional.of(shapeOf(left.name())) : Optional.empty(),
				withShapes ? Optional.of(shapeOf(right.name())) : Optional.empty());
	}

	private TableShape shapeOf(QualifiedName table) {
		return new TableShape(provider.columns(table), provider.primaryKey(table));
	}
}
