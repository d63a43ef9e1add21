package io.intellixity.unisql.http;

import java.util.List;
import java.util.stream.Collectors;

/** The endpoint answered, but with a non-2xx status or {@code success: false}. */
public final class D1ApiException extends Exception {
  private final int status;
  private final List<Integer> codes;

  D1ApiException(String message, int status, List<Integer> codes) {
    super(message);
    this.status = status;
    this.codes = List.copyOf(codes);
  }

  static D1ApiException fromErrors(int status, List<D1Response.ApiError> errors) {
    String joined = errors.stream().map(D1Response.ApiError::message).collect(Collectors.joining(", "));
    List<Integer> codes = errors.stream().map(D1Response.ApiError::code).collect(Collectors.toList());
    return new D1ApiException("D1 query failed: " + joined, status, codes);
  }

  public int status() { return status; }

  /** D1 error codes in the order reported; empty when the body carried none. */
  public List<Integer> codes() { return codes; }
}
