package io.intellixity.paging.source;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class SourceDefTest {
  @Test
  void builderDefaultsTableAndAlias() {
    SourceDef people = SourceDef.builder("people")
        .primaryColumn("id", ColumnType.LONG)
        .column("name", ColumnType.STRING)
        .build();

    assertEquals("people", people.table());
    assertEquals(SourceDef.DEFAULT_ALIAS, people.alias());
    assertEquals(List.of("id", "name"), List.copyOf(people.columns().keySet()));
    assertEquals(ColumnType.STRING, people.columnType("name"));
    assertNull(people.columnType("nope"));
  }

  @Test
  void requiresDeclaredPrimaryColumns() {
    assertThrows(IllegalArgumentException.class,
        () -> new SourceDef("people", "people", null, List.of(), Map.of("id", ColumnType.LONG)));
    assertThrows(IllegalArgumentException.class,
        () -> new SourceDef("people", "people", null, List.of("uuid"), Map.of("id", ColumnType.LONG)));
  }

  @Test
  void coercesRequestStrings() {
    assertEquals(42L, ColumnType.LONG.coerce(" 42 "));
    assertEquals(7, ColumnType.INTEGER.coerce("7"));
    assertEquals(new BigDecimal("1.50"), ColumnType.DECIMAL.coerce("1.50"));
    assertEquals(Boolean.TRUE, ColumnType.BOOLEAN.coerce("yes"));
    UUID id = UUID.randomUUID();
    assertEquals(id, ColumnType.UUID.coerce(id.toString()));
    assertEquals(" keep ", ColumnType.STRING.coerce(" keep "));
    assertEquals(5L, ColumnType.INTEGER.coerce(5L));
  }

  @Test
  void rejectsUnconvertibleValues() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ColumnType.LONG.coerce("abc"));
    assertTrue(ex.getMessage().contains("'abc'"));
    assertThrows(IllegalArgumentException.class, () -> ColumnType.BOOLEAN.coerce("maybe"));
  }
}
