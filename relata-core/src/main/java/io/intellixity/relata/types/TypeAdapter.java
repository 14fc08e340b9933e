package io.intellixity.relata.types;

/**
 * Bidirectional conversion for one logical type on one backend.
 *
 * @param <T> application-side Java type
 */
public interface TypeAdapter<T> {
  LogicalType logicalType();

  Class<T> javaType();

  /** Column type name used in DDL for this backend, e.g. {@code INTEGER} or {@code JSONB}. */
  String nativeType();

  /** Convert a non-null application value into the value handed to the driver. */
  Object toDatabase(T value);

  /** Convert a non-null driver value back into the application type. */
  T toApplication(Object raw);
}
