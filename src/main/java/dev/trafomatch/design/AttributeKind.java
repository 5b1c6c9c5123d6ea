package dev.trafomatch.design;

/** Value domain of a matchable attribute. */
public enum AttributeKind {
  NUMERIC,
  CATEGORICAL
}
