/**
 * jqwik integration for the content-tree generator.
 *
 * <p>{@link io.jagged.generator.jqwik.ContentArbitraries} turns generator options into {@code
 * Arbitrary} instances usable with {@code @ForAll}. The engine itself has no jqwik dependency; this
 * package only feeds it jqwik-drawn, shrinkable choice sequences.
 */
package io.jagged.generator.jqwik;
