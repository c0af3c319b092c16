package io.intellixity.paging.exec;

import io.intellixity.paging.CapturingEngine;
import io.intellixity.paging.mapping.RowReaders;
import io.intellixity.paging.query.OffsetPage;
import io.intellixity.paging.query.QueryFilters;
import io.intellixity.paging.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class EngineResultSetTest {
  private final CapturingEngine engine = new CapturingEngine();

  private EngineResultSet<Map<String, Object>> people() {
    return new EngineResultSet<>(engine, CapturingEngine.PEOPLE, RowReaders.asMap());
  }

  @Test
  void searchAndsFiltersWithoutNesting() {
    EngineResultSet<Map<String, Object>> rs = people()
        .search(QueryFilters.eq("me.name", "a"))
        .search(QueryFilters.eq("me.email", "b"))
        .search(QueryFilters.eq("me.id", 1));

    assertEquals(QueryFilters.and(
        QueryFilters.eq("me.name", "a"),
        QueryFilters.eq("me.email", "b"),
        QueryFilters.eq("me.id", 1)
    ), rs.query().filter());
  }

  @Test
  void refinementsDoNotTouchTheOriginal() {
    EngineResultSet<Map<String, Object>> base = people();
    EngineResultSet<Map<String, Object>> refined = base.search(QueryFilters.eq("me.name", "a"),
        new SearchAttributes(List.of(SortField.asc("me.name")), 10, 2));

    assertNull(base.query().filter());
    assertTrue(base.query().sort().isEmpty());
    assertNull(base.query().page());
    assertEquals(new OffsetPage(10, 10), refined.query().page());
    assertEquals(10, refined.rows());
    assertEquals(2, refined.page());
  }

  @Test
  void attributesOverridePreviousOnes() {
    EngineResultSet<Map<String, Object>> rs = people()
        .search(null, SearchAttributes.orderBy(List.of(SortField.asc("me.id"))))
        .search(null, SearchAttributes.paged(5, 1))
        .search(null, SearchAttributes.orderBy(List.of(SortField.desc("me.name"))));

    assertEquals(List.of(SortField.desc("me.name")), rs.query().sort());
    assertEquals(new OffsetPage(0, 5), rs.query().page());
  }

  @Test
  void rowsWithoutPageIsFirstPageAndPageKeepsRows() {
    EngineResultSet<Map<String, Object>> rs = people().search(null, new SearchAttributes(null, 7, null));
    assertEquals(new OffsetPage(0, 7), rs.query().page());

    EngineResultSet<Map<String, Object>> third = rs.search(null, new SearchAttributes(null, null, 3));
    assertEquals(new OffsetPage(14, 7), third.query().page());
  }

  @Test
  void countAndDeleteIgnorePaging() {
    EngineResultSet<Map<String, Object>> rs = people()
        .search(QueryFilters.eq("me.name", "a"), new SearchAttributes(List.of(SortField.asc("me.id")), 5, 2));

    rs.count();
    rs.delete();

    assertEquals(QueryFilters.eq("me.name", "a"), engine.lastCount.filter());
    assertEquals(QueryFilters.eq("me.name", "a"), engine.lastDelete.filter());
    assertNull(engine.lastDelete.page());
    assertTrue(engine.lastDelete.sort().isEmpty());
  }

  @Test
  void exposedQueryIsACopy() {
    EngineResultSet<Map<String, Object>> rs = people().search(QueryFilters.eq("me.name", "a"),
        SearchAttributes.orderBy(List.of(SortField.asc("me.id"))));

    rs.query().withFilter(null).withPage(new OffsetPage(0, 1)).sort().clear();

    assertEquals(QueryFilters.eq("me.name", "a"), rs.query().filter());
    assertNull(rs.query().page());
    assertEquals(List.of(SortField.asc("me.id")), rs.query().sort());
  }

  @Test
  void qualifiesWithSourceAlias() {
    assertEquals("me.name", people().qualify("name"));
    assertEquals(List.of("id"), people().primaryColumns());
  }
}
