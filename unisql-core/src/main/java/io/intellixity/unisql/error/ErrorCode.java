package io.intellixity.unisql.error;

/**
 * Stable, machine-readable error codes carried by every {@link DriverException}.
 * <p>
 * Codes are grouped by family: 1xxx connection, 2xxx query, 3xxx constraint, 5xxx transaction,
 * 8xxx feature, 9xxx internal.
 */
public enum ErrorCode {
  CONNECTION_FAILED("U1001"),
  CONNECTION_TIMEOUT("U1002"),
  CONNECTION_CLOSED("U1003"),

  QUERY_FAILED("U2001"),
  QUERY_TIMEOUT("U2002"),
  QUERY_SYNTAX("U2003"),

  UNIQUE_CONSTRAINT("U3001"),
  FOREIGN_KEY_CONSTRAINT("U3002"),
  NOT_NULL_CONSTRAINT("U3003"),
  CHECK_CONSTRAINT("U3004"),

  TRANSACTION_FAILED("U5001"),
  TRANSACTION_TIMEOUT("U5002"),
  DEADLOCK("U5003"),
  SERIALIZATION_FAILURE("U5004"),

  FEATURE_NOT_SUPPORTED("U8001"),
  DRIVER_NOT_SUPPORTED("U8002"),

  INTERNAL_ERROR("U9001");

  private final String code;

  ErrorCode(String code) {
    this.code = code;
  }

  public String code() { return code; }
}
