package org.javai.pgintrospect.joins;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.pgintrospect.schema.ForeignKeyEdge;

/**
 * The complete outgoing foreign-key edge sets of two tables, and the three relationship
 * shapes derived from them.
 *
 * @param left the table already in the query
 * @param right the table being joined
 * @param leftEdges every edge whose source is {@code left}
 * @param rightEdges every edge whose source is {@code right}
 * @param leftShape columns and key of {@code left}, when requested
 * @param rightShape columns and key of {@code right}, when requested
 */
public record EdgePair(
		AliasedTable left,
		AliasedTable right,
		List<ForeignKeyEdge> leftEdges,
		List<ForeignKeyEdge> rightEdges,
		Optional<TableShape> leftShape,
		Optional<TableShape> rightShape
) {

	public EdgePair {
		Objects.requireNonNull(left, "left must not be null");
		Objects.requireNonNull(right, "right must not be null");
		leftEdges = List.copyOf(leftEdges);
		rightEdges = List.copyOf(rightEdges);
		leftShape = leftShape != null ? leftShape : Optional.empty();
		rightShape = rightShape != null ? rightShape : Optional.empty();
	}

	public EdgePair(AliasedTable left, AliasedTable right, List<ForeignKeyEdge> leftEdges,
			List<ForeignKeyEdge> rightEdges) {
		this(left, right, leftEdges, rightEdges, Optional.empty(), Optional.empty());
	}

	/**
	 * Edges from {@code left} to {@code right}.
	 */
	public List<ForeignKeyEdge> directReferences() {
		return leftEdges.stream()
				.filter(edge -> edge.target().equals(right.name()))
				.toList();
	}

	/**
	 * Edges from {@code right} to {@code left}.
	 */
	public List<ForeignKeyEdge> reverseReferences() {
		return rightEdges.stream()
				.filter(edge -> edge.target().equals(left.name()))
				.toList();
	}

	/**
	 * Every (left edge, right edge) combination referencing the same target column,
	 * in left-edge then right-edge order.
	 */
	public List<SharedReference> sharedReferences() {
		List<SharedReference> shared = new ArrayList<>();
		for (ForeignKeyEdge leftEdge : leftEdges) {
			for (ForeignKeyEdge rightEdge : rightEdges) {
				if (leftEdge.sharesTargetWith(rightEdge)) {
					shared.add(new SharedReference(leftEdge, rightEdge));
				}
			}
		}
		return shared;
	}
}
