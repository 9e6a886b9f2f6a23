package org.javai.pgintrospect.testsupport;

import java.util.List;
import org.javai.pgintrospect.schema.Column;
import org.javai.pgintrospect.schema.InMemoryMetadataProvider;

/**
 * The shop schema most tests run against:
 *
 * <pre>
 * users(id pk, email)
 * orders(id pk, user_id -&gt; users.id, created_at)
 * order_items(id pk, order_id -&gt; orders.id, user_id -&gt; users.id, quantity)
 * audit_log(id pk, message)
 * </pre>
 */
public final class ShopSchema {

	private ShopSchema() {
	}

	public static InMemoryMetadataProvider provider() {
		return new InMemoryMetadataProvider()
				.addTable("users")
				.addColumn("users", "id", "integer", false)
				.addColumn("users", new Column("email", "character varying", false, null, 255, "Login address"))
				.withPrimaryKey("users", "id")
				.addIndex("users", "users_pkey", List.of("id"), true, "btree")
				.addIndex("users", "users_email_key", List.of("email"), true, "btree")
				.addTable("orders")
				.addColumn("orders", "id", "integer", false)
				.addColumn("orders", "user_id", "integer", false)
				.addColumn("orders", "created_at", "timestamp with time zone", false)
				.withPrimaryKey("orders", "id")
				.addForeignKey("orders_user_id_fkey", "orders", "user_id", "users", "id")
				.addTable("order_items")
				.addColumn("order_items", "id", "integer", false)
				.addColumn("order_items", "order_id", "integer", false)
				.addColumn("order_items", "user_id", "integer", false)
				.addColumn("order_items", "quantity", "integer", false)
				.withPrimaryKey("order_items", "id")
				.addForeignKey("order_items_order_id_fkey", "order_items", "order_id", "orders", "id")
				.addForeignKey("order_items_user_id_fkey", "order_items", "user_id", "users", "id")
				.addTable("audit_log")
				.addColumn("audit_log", "id", "bigint", false)
				.addColumn("audit_log", "message", "text", true)
				.withPrimaryKey("audit_log", "id");
	}
}
