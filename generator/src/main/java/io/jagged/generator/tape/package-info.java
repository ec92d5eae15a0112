/** Decision tapes backed by a seeded random source or by a replayable choice sequence. */
package io.jagged.generator.tape;
