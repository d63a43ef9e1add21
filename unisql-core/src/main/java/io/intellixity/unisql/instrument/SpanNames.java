package io.intellixity.unisql.instrument;

/** Span names and span attribute keys emitted by drivers. */
public final class SpanNames {
  public static final String EXECUTE = "unisql.execute";
  public static final String TRANSACTION = "unisql.transaction";
  public static final String BATCH = "unisql.batch";
  public static final String CONNECT = "unisql.connect";
  public static final String DISCONNECT = "unisql.disconnect";

  public static final String ATTR_DB_SYSTEM = "db.system";
  public static final String ATTR_DB_DRIVER = "db.driver";
  public static final String ATTR_DB_COLLECTION = "db.collection";
  public static final String ATTR_DB_OPERATION = "db.operation.name";
  public static final String ATTR_DB_QUERY_TEXT = "db.query.text";
  public static final String ATTR_DB_QUERY_PARAMS = "db.query.params";
  public static final String ATTR_DB_BATCH_SIZE = "db.operation.batch.size";

  private SpanNames() {}
}
