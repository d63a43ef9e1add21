package io.intellixity.unisql.result;

public enum RelationType {
  ONE_TO_ONE,
  ONE_TO_MANY,
  MANY_TO_ONE,
  MANY_TO_MANY;

  public boolean isToMany() {
    return this == ONE_TO_MANY || this == MANY_TO_MANY;
  }
}
