package io.jagged.generator.leaf;

/** Kinds of terminal node the generator can emit. */
public enum LeafKind {
  NUMPY,
  EMPTY,
  STRING,
  BYTESTRING
}
