package io.intellixity.relata.types;

import java.util.Objects;

/** Helpers for composing adapters across dialect providers. */
public final class TypeAdapters {
  private TypeAdapters() {}

  /** Reuse an adapter's value conversion under a different native column type. */
  public static <T> TypeAdapter<T> withNativeType(TypeAdapter<T> delegate, String nativeType) {
    Objects.requireNonNull(delegate, "delegate");
    Objects.requireNonNull(nativeType, "nativeType");
    return new TypeAdapter<>() {
      @Override public LogicalType logicalType() { return delegate.logicalType(); }
      @Override public Class<T> javaType() { return delegate.javaType(); }
      @Override public String nativeType() { return nativeType; }
      @Override public Object toDatabase(T value) { return delegate.toDatabase(value); }
      @Override public T toApplication(Object raw) { return delegate.toApplication(raw); }
    };
  }
}
