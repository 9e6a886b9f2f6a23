package org.javai.pgintrospect.joins;

import org.javai.pgintrospect.schema.ForeignKeyEdge;

/**
 * Two foreign keys, one on each side of a pair, referencing the same column of a third table.
 */
public record SharedReference(ForeignKeyEdge leftEdge, ForeignKeyEdge rightEdge) {
}
