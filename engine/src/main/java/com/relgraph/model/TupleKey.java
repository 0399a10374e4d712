package com.relgraph.model;

/**
 * Uniqueness key of a relationship tuple. Two grants with the same key are the same edge.
 */
public record TupleKey(String namespace, EntityRef resource, String relation, SubjectRef subject) {

  @Override
  public String toString() {
    return namespace + "/" + resource + "#" + relation + "@" + subject;
  }
}
