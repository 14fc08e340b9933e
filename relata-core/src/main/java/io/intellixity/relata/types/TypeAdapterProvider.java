package io.intellixity.relata.types;

import java.util.Collection;

/** Contributes {@link TypeAdapter}s for one dialect, or for all dialects ("*"). */
public interface TypeAdapterProvider {
  /** Dialect id this provider targets, or "*" for global. */
  String dialectId();

  Collection<TypeAdapter<?>> adapters();
}
