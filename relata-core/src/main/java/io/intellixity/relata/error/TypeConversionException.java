package io.intellixity.relata.error;

import io.intellixity.relata.types.LogicalType;

/** A value could not be converted to or from its logical type. Fatal for that value. */
public final class TypeConversionException extends RelataException {
  private final LogicalType logicalType;
  private final String column;
  private final String detail;

  public TypeConversionException(LogicalType logicalType, String message) {
    this(null, logicalType, null, message, null);
  }

  public TypeConversionException(LogicalType logicalType, String message, Throwable cause) {
    this(null, logicalType, null, message, cause);
  }

  public TypeConversionException(String dialectId, LogicalType logicalType, String column, String message, Throwable cause) {
    super(ErrorKind.TYPE_CONVERSION, dialectId, column == null ? null : "column " + column,
        message + " (type=" + logicalType + ")", cause);
    this.logicalType = logicalType;
    this.column = column;
    this.detail = message;
  }

  public LogicalType logicalType() { return logicalType; }
  public String column() { return column; }

  /** Copy with the dialect and column attached, used once the failing column is known. */
  public TypeConversionException at(String dialectId, String column) {
    return new TypeConversionException(dialectId, logicalType, column, detail, getCause());
  }
}
