package io.intellixity.sift.model;

public enum Cardinality { TO_ONE, TO_MANY }
