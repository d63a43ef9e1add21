package io.intellixity.unisql.driver;

/** Model and operation of the call currently in flight; feeds spans and log events. */
public record QueryExecutionContext(String model, Operation operation) {
  public static final QueryExecutionContext NONE = new QueryExecutionContext(null, null);

  public static QueryExecutionContext of(String model, Operation operation) {
    return new QueryExecutionContext(model, operation);
  }

  public boolean isEmpty() {
    return model == null && operation == null;
  }
}
