package io.intellixity.sift.query;

public enum Clause { AND, OR }
