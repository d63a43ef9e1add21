package io.intellixity.unisql.error;

/** Failure to acquire, open or keep a backend connection. */
public class ConnectionException extends DriverException {
  public ConnectionException(String message) {
    super(message, ErrorCode.CONNECTION_FAILED);
  }

  public ConnectionException(String message, ErrorCode code) {
    super(message, code);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, ErrorCode.CONNECTION_FAILED, cause);
  }

  public ConnectionException(String message, ErrorCode code, String nativeCode, Throwable cause) {
    super(message, code, nativeCode, cause);
  }
}
