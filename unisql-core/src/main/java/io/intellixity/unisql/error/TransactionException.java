package io.intellixity.unisql.error;

/** Begin, commit, rollback or savepoint handling failed, or a transaction ran past its deadline. */
public class TransactionException extends DriverException {
  public TransactionException(String message) {
    super(message, ErrorCode.TRANSACTION_FAILED);
  }

  public TransactionException(String message, Throwable cause) {
    super(message, ErrorCode.TRANSACTION_FAILED, cause);
  }

  public TransactionException(String message, ErrorCode code, String nativeCode, Throwable cause) {
    super(message, code, nativeCode, cause);
  }
}
