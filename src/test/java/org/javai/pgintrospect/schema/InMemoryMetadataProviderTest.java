package org.javai.pgintrospect.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;
import java.util.List;
import org.javai.pgintrospect.testsupport.ShopSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryMetadataProvider")
class InMemoryMetadataProviderTest {

	private static final QualifiedName USERS = new QualifiedName("public", "users");
	private static final QualifiedName ORDERS = new QualifiedName("public", "orders");
	private static final QualifiedName ORDER_ITEMS = new QualifiedName("public", "order_items");

	private InMemoryMetadataProvider provider;

	@BeforeEach
	void setUp() {
		provider = ShopSchema.provider();
	}

	@Nested
	@DisplayName("Configuration")
	class Configuration {

		@Test
		@DisplayName("columns keep declaration order")
		void columnsInOrder() {
			assertThat(provider.columns(ORDERS)).extracting(Column::name)
					.containsExactly("id", "user_id", "created_at");
		}

		@Test
		@DisplayName("rejects a duplicate column")
		void duplicateColumn() {
			assertThatThrownBy(() -> provider.addColumn("orders", "user_id", "integer", true))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("user_id");
		}

		@Test
		@DisplayName("rejects columns and keys on undeclared tables")
		void unknownTable() {
			assertThatThrownBy(() -> provider.addColumn("invoices", "id", "integer", false))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("invoices");
			assertThatThrownBy(() -> provider.addForeignKey("fk", "orders", "invoice_id", "invoices", "id"))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("composite foreign keys become one edge per column pair")
		void compositeForeignKey() {
			provider.addTable("shipments")
					.addForeignKey("shipments_item_fkey", "shipments", List.of("order_id", "item_no"),
							"order_items", List.of("order_id", "id"));

			assertThat(provider.outgoingForeignKeys(new QualifiedName("public", "shipments")))
					.extracting(ForeignKeyEdge::sourceColumn, ForeignKeyEdge::targetColumn,
							ForeignKeyEdge::constraintName)
					.containsExactly(
							tuple("order_id", "order_id", "shipments_item_fkey"),
							tuple("item_no", "id", "shipments_item_fkey"));
		}

		@Test
		@DisplayName("rejects mismatched composite column lists")
		void mismatchedComposite() {
			assertThatThrownBy(() -> provider.addForeignKey("fk", "orders", List.of("a", "b"), "users", List.of("id")))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("Foreign keys")
	class ForeignKeys {

		@Test
		@DisplayName("outgoing edges are those declared on the table")
		void outgoing() {
			assertThat(provider.outgoingForeignKeys(ORDER_ITEMS))
					.extracting(ForeignKeyEdge::constraintName)
					.containsExactly("order_items_order_id_fkey", "order_items_user_id_fkey");
			assertThat(provider.outgoingForeignKeys(USERS)).isEmpty();
		}

		@Test
		@DisplayName("incoming edges are sorted by referencing table")
		void incoming() {
			assertThat(provider.incomingForeignKeys(USERS))
					.extracting(edge -> edge.source().table())
					.containsExactly("order_items", "orders");
		}
	}

	@Nested
	@DisplayName("Resolution")
	class Resolution {

		@Test
		@DisplayName("resolves case-insensitively to the canonical name")
		void caseInsensitive() {
			assertThat(provider.resolveTable(new QualifiedName("PUBLIC", "Orders"))).contains(ORDERS);
		}

		@Test
		@DisplayName("unknown table resolves to empty")
		void unknown() {
			assertThat(provider.resolveTable(new QualifiedName("public", "invoices"))).isEmpty();
		}

		@Test
		@DisplayName("reading an unresolved table fails with TableNotFoundException")
		void readUnknown() {
			assertThatThrownBy(() -> provider.columns(new QualifiedName("public", "invoices")))
					.isInstanceOf(TableNotFoundException.class);
		}
	}

	@Nested
	@DisplayName("Listing and search")
	class ListingAndSearch {

		@Test
		@DisplayName("lists tables by schema then name")
		void listTables() {
			provider.addTable("archive.orders");

			assertThat(provider.listTables()).extracting(QualifiedName::toString)
					.containsExactly("archive.orders", "public.audit_log", "public.order_items",
							"public.orders", "public.users");
		}

		@Test
		@DisplayName("ranks exact matches before prefix and substring matches")
		void ranking() {
			provider.addTable("pending_orders");

			assertThat(provider.searchTables("orders")).extracting(QualifiedName::table)
					.containsExactly("orders", "pending_orders");
			assertThat(provider.searchTables("order")).extracting(QualifiedName::table)
					.containsExactly("order_items", "orders", "pending_orders");
		}

		@Test
		@DisplayName("matches the schema name too")
		void matchesSchema() {
			provider.addTable("archive.orders");

			assertThat(provider.searchTables("arch")).containsExactly(new QualifiedName("archive", "orders"));
		}

		@Test
		@DisplayName("invalid pattern is rejected")
		void invalidPattern() {
			assertThatThrownBy(() -> provider.searchTables("order("))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("order(");
		}
	}

	@Test
	@DisplayName("unavailable provider fails every call with a retryable error")
	void unavailable() {
		provider.withUnavailable(true);

		assertThatThrownBy(() -> provider.listTables())
				.isInstanceOf(MetadataUnavailableException.class)
				.satisfies(e -> assertThat(((SchemaIntrospectionException) e).isRetryable()).isTrue());
	}

	@Test
	@DisplayName("counts answered queries")
	void countsQueries() {
		int before = provider.queryCount();
		provider.columns(USERS);
		provider.primaryKey(USERS);

		assertThat(provider.queryCount()).isEqualTo(before + 2);
	}
}
