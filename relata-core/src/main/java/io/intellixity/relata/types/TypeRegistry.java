package io.intellixity.relata.types;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.error.TypeConversionException;
import io.intellixity.relata.util.RelataFactoriesLoader;

import java.util.*;

/**
 * Per-dialect type mapping table: {@link LogicalType} to exactly one {@link TypeAdapter}.\n
 *
 * Resolution:\n
 * - dialect-specific providers first\n
 * - global providers (dialectId="*")\n
 *
 * Every logical type must resolve, and no scope may register a type twice; both are checked here,
 * at construction, never at execution. The table is immutable afterwards and safe to share.
 */
public final class TypeRegistry {
  public static final String GLOBAL_DIALECT = "*";

  private final String dialectId;
  private final Map<LogicalType, TypeAdapter<?>> adapters;

  /** Registry built from providers discovered via {@code META-INF/relata.factories}. */
  public static TypeRegistry discover(String dialectId) {
    return new TypeRegistry(dialectId, RelataFactoriesLoader.load(TypeAdapterProvider.class));
  }

  public TypeRegistry(String dialectId, List<? extends TypeAdapterProvider> providers) {
    this.dialectId = Objects.requireNonNull(dialectId, "dialectId");
    Map<LogicalType, TypeAdapter<?>> dialect = new EnumMap<>(LogicalType.class);
    Map<LogicalType, TypeAdapter<?>> global = new EnumMap<>(LogicalType.class);

    for (TypeAdapterProvider p : providers == null ? List.<TypeAdapterProvider>of() : providers) {
      if (p == null) continue;
      String did = normalizeDialect(p.dialectId());
      Map<LogicalType, TypeAdapter<?>> scope;
      if (GLOBAL_DIALECT.equals(did)) scope = global;
      else if (dialectId.equals(did)) scope = dialect;
      else continue;
      for (TypeAdapter<?> a : p.adapters()) {
        TypeAdapter<?> prev = scope.putIfAbsent(a.logicalType(), a);
        if (prev != null) {
          throw new QueryConstructionException(dialectId, null,
              "duplicate type mapping for " + a.logicalType() + " in scope '" + did + "'");
        }
      }
    }

    Map<LogicalType, TypeAdapter<?>> merged = new EnumMap<>(global);
    merged.putAll(dialect);
    for (LogicalType t : LogicalType.values()) {
      if (!merged.containsKey(t)) {
        throw new QueryConstructionException(dialectId, null, "no type mapping for logical type " + t);
      }
    }
    this.adapters = Collections.unmodifiableMap(merged);
  }

  public String dialectId() { return dialectId; }

  public TypeAdapter<?> adapter(LogicalType type) {
    return adapters.get(Objects.requireNonNull(type, "type"));
  }

  public String nativeType(LogicalType type) {
    return adapter(type).nativeType();
  }

  /** Application value to driver value. Near-miss Java types are widened first (Integer to Long for BIGINT, etc.). */
  public Object toDatabase(Object value, LogicalType type) {
    Objects.requireNonNull(type, "type");
    if (value == null) return null;
    Object coerced = TypeCoercions.coerce(value, type);
    @SuppressWarnings("unchecked")
    TypeAdapter<Object> a = (TypeAdapter<Object>) adapter(type);
    try {
      return a.toDatabase(coerced);
    } catch (TypeConversionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TypeConversionException(dialectId, type, null, "failed to encode " + coerced.getClass().getSimpleName(), e);
    }
  }

  /** Driver value to application value. Never guesses: an unconvertible value raises {@link TypeConversionException}. */
  public Object toApplication(Object raw, LogicalType type) {
    Objects.requireNonNull(type, "type");
    if (raw == null) return null;
    TypeAdapter<?> a = adapter(type);
    try {
      return a.toApplication(raw);
    } catch (TypeConversionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TypeConversionException(dialectId, type, null, "failed to decode " + raw.getClass().getSimpleName(), e);
    }
  }

  private static String normalizeDialect(String did) {
    if (did == null) return GLOBAL_DIALECT;
    String s = did.trim();
    return s.isEmpty() ? GLOBAL_DIALECT : s;
  }
}
