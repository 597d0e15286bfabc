package com.p14n.shadowsync.shadow;

/**
 * The outcome of reconciling a mutation against a document.
 *
 * @param document the resulting document
 * @param delta    the value changes made, empty for a no-op
 * @param modified whether the document differs from its input, which can be
 *                 true for an empty delta when only metadata changed
 */
public record Reconciliation(ShadowDocument document, ShadowDelta delta, boolean modified) {
}
