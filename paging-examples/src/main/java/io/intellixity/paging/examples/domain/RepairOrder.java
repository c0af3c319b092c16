package io.intellixity.paging.examples.domain;

import io.intellixity.paging.mapping.RowAdapter;
import io.intellixity.paging.mapping.RowReader;

public record RepairOrder(Long shopId, Long orderNo, String status,
                          String customerFirstName, String customerLastName, String partId) {
  public static final RowReader<RepairOrder> READER = RepairOrder::read;

  private static RepairOrder read(RowAdapter row) {
    return new RepairOrder(
        row.longValue("shop_id"),
        row.longValue("order_no"),
        row.string("repair_order_status"),
        row.string("customer_first_name"),
        row.string("customer_last_name"),
        row.string("part_id"));
  }
}
