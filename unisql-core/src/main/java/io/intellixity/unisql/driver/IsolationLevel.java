package io.intellixity.unisql.driver;

/** Portable transaction isolation levels. */
public enum IsolationLevel {
  READ_UNCOMMITTED,
  READ_COMMITTED,
  REPEATABLE_READ,
  SERIALIZABLE
}
