package io.intellixity.sift.model;

import java.util.List;

/**
 * Result of resolving a (dot) field path.
 *
 * @param root  entity the path starts at
 * @param owner entity that declares the leaf field
 * @param field leaf field
 * @param path  original path
 * @param via   TO_ONE relations traversed, in order
 */
public record ResolvedField(EntityDescriptor root, EntityDescriptor owner, FieldDef field, String path, List<RelationDef> via) {
  public ResolvedField {
    via = List.copyOf(via == null ? List.of() : via);
  }

  public SemanticType type() { return field.type(); }

  /** A navigated field is nullable if the leaf is nullable. */
  public boolean nullable() { return field.nullable(); }
}
