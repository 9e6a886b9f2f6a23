package org.javai.pgintrospect.joins;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.javai.pgintrospect.schema.ForeignKeyEdge;
import org.javai.pgintrospect.schema.InMemoryMetadataProvider;
import org.javai.pgintrospect.schema.QualifiedName;
import org.javai.pgintrospect.schema.TableNotFoundException;
import org.javai.pgintrospect.schema.TableRef;
import org.javai.pgintrospect.testsupport.ShopSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ForeignKeyGraphView")
class ForeignKeyGraphViewTest {

	private InMemoryMetadataProvider provider;
	private ForeignKeyGraphView graph;
	private AliasedTable orders;
	private AliasedTable orderItems;

	@BeforeEach
	void setUp() {
		provider = ShopSchema.provider();
		graph = new ForeignKeyGraphView(provider, QualifiedName.DEFAULT_SCHEMA);
		orders = graph.resolve(new TableRef("orders", "o"));
		orderItems = graph.resolve(new TableRef("order_items", "oi"));
	}

	@Test
	@DisplayName("returns the complete outgoing edge set of both tables")
	void completeEdgeSets() {
		EdgePair pair = graph.edgesBetween(orders, orderItems);

		assertThat(pair.leftEdges()).extracting(ForeignKeyEdge::constraintName)
				.containsExactly("orders_user_id_fkey");
		assertThat(pair.rightEdges()).extracting(ForeignKeyEdge::constraintName)
				.containsExactly("order_items_order_id_fkey", "order_items_user_id_fkey");
		assertThat(pair.leftShape()).isEmpty();
	}

	@Test
	@DisplayName("derives direct, reverse and shared references")
	void relationshipShapes() {
		EdgePair pair = graph.edgesBetween(orders, orderItems);

		assertThat(pair.directReferences()).isEmpty();
		assertThat(pair.reverseReferences()).extracting(ForeignKeyEdge::sourceColumn).containsExactly("order_id");
		assertThat(pair.sharedReferences()).singleElement().satisfies(shared -> {
			assertThat(shared.leftEdge().constraintName()).isEqualTo("orders_user_id_fkey");
			assertThat(shared.rightEdge().constraintName()).isEqualTo("order_items_user_id_fkey");
		});

		EdgePair swapped = graph.edgesBetween(orderItems, orders);
		assertThat(swapped.directReferences()).isEqualTo(pair.reverseReferences());
	}

	@Test
	@DisplayName("two queries per pair, plus four when table shapes are requested")
	void queryCount() {
		int before = provider.queryCount();
		graph.edgesBetween(orders, orderItems);
		assertThat(provider.queryCount() - before).isEqualTo(2);

		before = provider.queryCount();
		EdgePair withShapes = graph.edgesBetween(orders, orderItems, true);
		assertThat(provider.queryCount() - before).isEqualTo(6);
		assertThat(withShapes.rightShape()).get()
				.satisfies(shape -> assertThat(shape.primaryKey().columns()).containsExactly("id"));
	}

	@Test
	@DisplayName("unresolvable reference reports the identifier as given")
	void unresolvable() {
		assertThatThrownBy(() -> graph.resolve(new TableRef("sales.invoices", "i")))
				.isInstanceOf(TableNotFoundException.class)
				.hasMessage("Table 'sales.invoices' not found");
	}
}
