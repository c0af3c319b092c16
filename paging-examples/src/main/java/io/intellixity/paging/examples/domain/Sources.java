package io.intellixity.paging.examples.domain;

import io.intellixity.paging.source.ColumnType;
import io.intellixity.paging.source.SourceDef;

public final class Sources {
  private Sources() {}

  public static final SourceDef PEOPLE = SourceDef.builder("Person")
      .table("people")
      .primaryColumn("id", ColumnType.LONG)
      .column("first_name", ColumnType.STRING)
      .column("last_name", ColumnType.STRING)
      .column("email", ColumnType.STRING)
      .build();

  /** Repair orders are numbered per shop, so the key is (shop_id, order_no). */
  public static final SourceDef REPAIR_ORDERS = SourceDef.builder("RepairOrder")
      .table("repair_orders")
      .primaryColumn("shop_id", ColumnType.INTEGER)
      .primaryColumn("order_no", ColumnType.INTEGER)
      .column("repair_order_status", ColumnType.STRING)
      .column("customer_first_name", ColumnType.STRING)
      .column("customer_last_name", ColumnType.STRING)
      .column("part_id", ColumnType.STRING)
      .build();
}
