package io.intellixity.relata.spi.bind;

import io.intellixity.relata.sql.Bind;
import io.intellixity.relata.sql.StatementKind;
import io.intellixity.relata.types.LogicalType;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveredBinderRegistryTest {

  private record Ctx(String dialectId, StatementKind statementKind) implements BindContext {}

  private static final class Tagging implements Binder<StringBuilder, Object> {
    private final String tag;
    private final LogicalType only;

    Tagging(String tag, LogicalType only) {
      this.tag = tag;
      this.only = only;
    }

    @Override public Class<StringBuilder> targetType() { return StringBuilder.class; }
    @Override public Class<Object> valueType() { return Object.class; }
    @Override public boolean supports(BindContext ctx, Bind bind, Object value) { return only == null || bind.type() == only; }
    @Override public void bind(StringBuilder target, BindContext ctx, Bind bind, Object value) { target.append(tag); }
  }

  private static BinderProvider provider(String dialectId, Binder<?, ?>... binders) {
    return new BinderProvider() {
      @Override public String dialectId() { return dialectId; }
      @Override public Collection<Binder<?, ?>> binders() { return List.of(binders); }
    };
  }

  private static final Ctx CTX = new Ctx("pg", StatementKind.INSERT);

  @Test
  void dialectBindersWinOverGlobal() {
    DiscoveredBinderRegistry r = new DiscoveredBinderRegistry("pg", List.of(
        provider("*", new Tagging("global", null)),
        provider("pg", new Tagging("jsonb", LogicalType.JSON))));

    StringBuilder json = new StringBuilder();
    r.bind(json, CTX, new Bind("{}", LogicalType.JSON));
    assertEquals("jsonb", json.toString());

    StringBuilder text = new StringBuilder();
    r.bind(text, CTX, new Bind("x", LogicalType.TEXT));
    assertEquals("global", text.toString());
  }

  @Test
  void otherDialectsAreIgnored() {
    DiscoveredBinderRegistry r = new DiscoveredBinderRegistry("sqlite", List.of(
        provider("pg", new Tagging("jsonb", null))));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> r.bind(new StringBuilder(), CTX, new Bind(null, LogicalType.JSON)));
    assertTrue(ex.getMessage().contains("No binder found for dialectId=sqlite"));
  }

  @Test
  void targetTypeMustMatch() {
    DiscoveredBinderRegistry r = new DiscoveredBinderRegistry("pg", List.of(provider("*", new Tagging("global", null))));
    assertThrows(IllegalArgumentException.class, () -> r.bind(new Object(), CTX, new Bind(1, LogicalType.INTEGER)));
  }
}
