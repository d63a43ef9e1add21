package io.intellixity.unisql.driver;

/** Logical operation names used for observability only. */
public enum Operation {
  FIND_FIRST("findFirst"),
  FIND_MANY("findMany"),
  FIND_UNIQUE("findUnique"),
  CREATE("create"),
  CREATE_MANY("createMany"),
  UPDATE("update"),
  UPDATE_MANY("updateMany"),
  DELETE("delete"),
  DELETE_MANY("deleteMany"),
  UPSERT("upsert"),
  COUNT("count"),
  AGGREGATE("aggregate"),
  GROUP_BY("groupBy"),
  EXIST("exist");

  private final String id;

  Operation(String id) {
    this.id = id;
  }

  public String id() { return id; }

  public boolean isBatch() {
    return this == CREATE_MANY || this == UPDATE_MANY || this == DELETE_MANY;
  }

  public static Operation fromId(String id) {
    for (Operation op : values()) {
      if (op.id.equals(id)) return op;
    }
    throw new IllegalArgumentException("Unknown operation: " + id);
  }
}
