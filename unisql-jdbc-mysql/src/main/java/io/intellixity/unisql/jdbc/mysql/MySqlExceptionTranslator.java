package io.intellixity.unisql.jdbc.mysql;

import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.QueryException;
import io.intellixity.unisql.error.TransactionException;
import io.intellixity.unisql.jdbc.SqlStateExceptionTranslator;

import java.sql.SQLException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MySQL reports SQLState 23000 for every integrity violation, so translation goes by vendor error
 * code. The native code is the vendor code ({@code 1062}, {@code 1213}, ...).
 */
public final class MySqlExceptionTranslator extends SqlStateExceptionTranslator {
  public static final MySqlExceptionTranslator INSTANCE = new MySqlExceptionTranslator();

  static final int ER_DUP_ENTRY = 1062;
  static final int ER_ROW_IS_REFERENCED = 1451;
  static final int ER_NO_REFERENCED_ROW = 1452;
  static final int ER_BAD_NULL = 1048;
  static final int ER_CHECK_CONSTRAINT = 3819;
  static final int ER_LOCK_WAIT_TIMEOUT = 1205;
  static final int ER_LOCK_DEADLOCK = 1213;
  static final int ER_PARSE = 1064;

  // Duplicate entry 'a@x' for key 'users.users_email_key'
  private static final Pattern DUP_KEY = Pattern.compile("for key '([^']+)'");
  // ... a foreign key constraint fails (`app`.`posts`, CONSTRAINT `posts_ibfk_1` FOREIGN KEY (`user_id`) ...
  private static final Pattern FK = Pattern.compile("\\(`[^`]*`\\.`([^`]+)`, CONSTRAINT `([^`]+)`");

  @Override
  protected DriverException translateVendor(SQLException e, String sql, List<?> params) {
    String msg = message(e);
    String code = nativeCode(e);
    switch (e.getErrorCode()) {
      case ER_DUP_ENTRY:
        return unique(e, sql, params);
      case ER_ROW_IS_REFERENCED:
      case ER_NO_REFERENCED_ROW:
        return foreignKey(e, sql, params);
      case ER_BAD_NULL:
        return new QueryException(msg, ErrorCode.NOT_NULL_CONSTRAINT, code, sql, params, e);
      case ER_CHECK_CONSTRAINT:
        return new QueryException(msg, ErrorCode.CHECK_CONSTRAINT, code, sql, params, e);
      case ER_LOCK_DEADLOCK:
        return new TransactionException(msg, ErrorCode.DEADLOCK, code, e);
      case ER_LOCK_WAIT_TIMEOUT:
        return new QueryException(msg, ErrorCode.QUERY_TIMEOUT, code, sql, params, e);
      case ER_PARSE:
        return new QueryException(msg, ErrorCode.QUERY_SYNTAX, code, sql, params, e);
      default:
        return null;
    }
  }

  @Override
  protected String nativeCode(SQLException e) {
    return e.getErrorCode() != 0 ? String.valueOf(e.getErrorCode()) : e.getSQLState();
  }

  @Override
  protected String constraintName(SQLException e) {
    String msg = e.getMessage();
    if (msg == null) return null;
    if (e.getErrorCode() == ER_DUP_ENTRY) {
      Matcher m = DUP_KEY.matcher(msg);
      if (!m.find()) return null;
      String key = m.group(1);
      // MySQL 8 qualifies the key with its table
      int dot = key.lastIndexOf('.');
      return dot < 0 ? key : key.substring(dot + 1);
    }
    Matcher m = FK.matcher(msg);
    return m.find() ? m.group(2) : null;
  }

  @Override
  protected String tableName(SQLException e) {
    String msg = e.getMessage();
    if (msg == null) return null;
    if (e.getErrorCode() == ER_DUP_ENTRY) {
      Matcher m = DUP_KEY.matcher(msg);
      if (!m.find()) return null;
      int dot = m.group(1).lastIndexOf('.');
      return dot < 0 ? null : m.group(1).substring(0, dot);
    }
    Matcher m = FK.matcher(msg);
    return m.find() ? m.group(1) : null;
  }
}
