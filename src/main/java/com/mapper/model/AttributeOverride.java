package com.mapper.model;

/**
 * A per-attribute adjustment configured outside the OpenAPI document, keyed by dotted attribute path.
 *
 * @param computability Forced status, or {@code null} to keep the resolved one. Never overrides a
 *                      property the schema lists as required.
 * @param sensitive     Forced sensitivity, or {@code null} to keep the inferred one. Only honored on
 *                      string leaves.
 */
public record AttributeOverride(ComputedOptionalRequired computability, Boolean sensitive) {
}
