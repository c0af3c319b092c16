package io.intellixity.paging.paging;

import io.intellixity.paging.CapturingEngine;
import io.intellixity.paging.exec.ResultSet;
import io.intellixity.paging.mapping.RowReaders;
import io.intellixity.paging.query.SortField;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SortDispatcherTest {
  private final SortDispatcher dispatcher = SortDispatcher.builder()
      .on("full_name", dir -> List.of(new SortField("me.last_name", dir), new SortField("me.first_name", dir)))
      .fallback((sort, dir) -> List.of(new SortField("me." + sort, dir)))
      .build();

  @Test
  void registeredKeyExpandsToSeveralFields() {
    assertEquals(
        List.of(SortField.desc("me.last_name"), SortField.desc("me.first_name")),
        dispatcher.orderBy(RequestParams.of("sort", "full_name", "dir", "desc"))
    );
  }

  @Test
  void registeredKeyWithoutDirectionIsAscending() {
    assertEquals(
        List.of(SortField.asc("me.last_name"), SortField.asc("me.first_name")),
        dispatcher.orderBy(RequestParams.of("sort", "full_name"))
    );
  }

  @Test
  void unregisteredKeyUsesFallbackOnlyWithDirection() {
    assertEquals(List.of(SortField.asc("me.email")), dispatcher.orderBy(RequestParams.of("sort", "email", "dir", "ASC")));
    assertNull(dispatcher.orderBy(RequestParams.of("sort", "email")));
  }

  @Test
  void noSortLeavesResultSetUnchanged() {
    ResultSet<Map<String, Object>> rs = new CapturingEngine().resultSet(CapturingEngine.PEOPLE, RowReaders.asMap());
    assertSame(rs, dispatcher.apply(rs, RequestParams.of("dir", "desc")));
  }

  @Test
  void defaultFallbackUsesTheRawSortKey() {
    SortDispatcher plain = SortDispatcher.builder().build();
    assertEquals(List.of(SortField.desc("name")), plain.orderBy(RequestParams.of("sort", "name", "dir", "desc")));
  }

  @Test
  void rejectsUnknownDirection() {
    assertThrows(PagingParameterException.class,
        () -> dispatcher.orderBy(RequestParams.of("sort", "full_name", "dir", "up")));
  }
}
