/**
 * Generator internals: the recursive tree builder, the shared scalar budget and one draw class
 * per structural node kind. Not intended for direct use.
 */
package io.jagged.generator.impl;
