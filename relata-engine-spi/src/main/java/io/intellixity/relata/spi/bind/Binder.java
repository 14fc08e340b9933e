package io.intellixity.relata.spi.bind;

import io.intellixity.relata.sql.Bind;

/**
 * Applies one driver-ready bind value to a native target (e.g. a {@code PreparedStatement}).\n
 *
 * The value has already been through the dialect's {@link io.intellixity.relata.types.TypeAdapter}.
 * Binders only adapt it to driver specifics.
 */
public interface Binder<TTarget, TValue> {
  Class<TTarget> targetType();

  Class<TValue> valueType();

  boolean supports(BindContext ctx, Bind bind, TValue value);

  void bind(TTarget target, BindContext ctx, Bind bind, TValue value);
}
