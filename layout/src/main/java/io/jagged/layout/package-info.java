/**
 * Immutable layout nodes for jagged, typed arrays.
 *
 * <p>A value is a tree of {@link io.jagged.layout.Content} nodes. Leaves hold elements ({@link
 * io.jagged.layout.NumpyContent}, {@link io.jagged.layout.StringContent}, {@link
 * io.jagged.layout.BytestringContent}, {@link io.jagged.layout.EmptyContent}); branching nodes
 * reinterpret their children as fixed-size groups, variable-length lists, records or tagged
 * unions. Every constructor checks the node's index constraints and throws {@link
 * io.jagged.layout.LayoutValidationException} on a violation.
 *
 * <p>{@link io.jagged.layout.Contents} walks trees and {@link io.jagged.layout.JaggedArray} turns
 * one into plain Java values.
 */
package io.jagged.layout;
