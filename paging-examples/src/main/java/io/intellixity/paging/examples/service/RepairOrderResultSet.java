package io.intellixity.paging.examples.service;

import io.intellixity.paging.examples.domain.RepairOrder;
import io.intellixity.paging.examples.domain.Sources;
import io.intellixity.paging.exec.DataEngine;
import io.intellixity.paging.exec.EngineResultSet;
import io.intellixity.paging.exec.ResultSet;
import io.intellixity.paging.exec.SearchAttributes;
import io.intellixity.paging.paging.ControllerSearch;
import io.intellixity.paging.paging.ControllerSort;
import io.intellixity.paging.paging.ParamNames;
import io.intellixity.paging.paging.RequestParams;
import io.intellixity.paging.paging.SearchDispatcher;
import io.intellixity.paging.paging.SortDispatcher;
import io.intellixity.paging.query.Query;
import io.intellixity.paging.query.QueryFilters;
import io.intellixity.paging.query.SortField;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Repair orders with their own request vocabulary: {@code status} is an exact match,
 * {@code part_id} a substring, {@code customer} matches either name; {@code sort=customer_name}
 * orders by last then first name. Other sort keys name a column directly.
 */
public final class RepairOrderResultSet extends EngineResultSet<RepairOrder>
    implements ControllerSearch<RepairOrder>, ControllerSort<RepairOrder> {

  private static final SearchDispatcher SEARCH = SearchDispatcher.builder()
      .on("status", v -> QueryFilters.eq("me.repair_order_status", v.trim().toUpperCase(Locale.ROOT)))
      .on("part_id", v -> QueryFilters.contains("me.part_id", v))
      .on("customer", v -> QueryFilters.or(
          QueryFilters.contains("me.customer_last_name", v),
          QueryFilters.contains("me.customer_first_name", v)))
      .build();

  private final SortDispatcher sort;

  public RepairOrderResultSet(DataEngine engine, ParamNames names) {
    this(engine, names, new Query());
  }

  private RepairOrderResultSet(DataEngine engine, ParamNames names, Query query) {
    super(engine, Sources.REPAIR_ORDERS, RepairOrder.READER, query);
    this.sort = SortDispatcher.builder()
        .paramNames(names)
        .on("customer_name", d -> List.of(
            new SortField("me.customer_last_name", d),
            new SortField("me.customer_first_name", d)))
        .fallback((column, d) -> List.of(new SortField(qualify(column), d)))
        .build();
  }

  private RepairOrderResultSet(RepairOrderResultSet base, Query query) {
    super(base.engine(), base.source(), base.reader(), query);
    this.sort = base.sort;
  }

  @Override
  protected RepairOrderResultSet derive(Query query) {
    return new RepairOrderResultSet(this, query);
  }

  @Override
  public ResultSet<RepairOrder> controllerSearch(RequestParams params) {
    return SEARCH.apply(this, params);
  }

  /** Unsorted requests get primary-key order so pages stay stable. */
  @Override
  public ResultSet<RepairOrder> controllerSort(RequestParams params) {
    List<SortField> orderBy = sort.orderBy(params);
    if (orderBy == null || orderBy.isEmpty()) {
      orderBy = new ArrayList<>();
      for (String pk : primaryColumns()) orderBy.add(SortField.asc(qualify(pk)));
    }
    return search(null, SearchAttributes.orderBy(orderBy));
  }
}
