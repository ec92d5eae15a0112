/**
 * Public generator API.
 *
 * <p>Start with {@link io.jagged.generator.api.ContentGenerator#create(GeneratorOptions)}. All
 * randomness flows through a {@link io.jagged.generator.api.DecisionTape}, so the same tape
 * contents always produce the same tree. Single constructors over caller-built children live in
 * {@link io.jagged.generator.api.ContentDraws}.
 */
package io.jagged.generator.api;
