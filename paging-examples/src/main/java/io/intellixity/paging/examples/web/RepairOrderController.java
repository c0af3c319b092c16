package io.intellixity.paging.examples.web;

import io.intellixity.paging.examples.domain.RepairOrder;
import io.intellixity.paging.examples.service.RepairOrderService;
import io.intellixity.paging.paging.DoesPaging;
import io.intellixity.paging.paging.PagingSettings;
import io.intellixity.paging.paging.RequestParams;
import io.intellixity.paging.spring.DeletionResponse;
import io.intellixity.paging.spring.StoreResponse;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/repair-orders")
public final class RepairOrderController implements DoesPaging {
  private final RepairOrderService repairOrders;
  private final PagingSettings settings;

  public RepairOrderController(RepairOrderService repairOrders, PagingSettings settings) {
    this.repairOrders = repairOrders;
    this.settings = settings;
  }

  @Override
  public PagingSettings pagingSettings() {
    return settings;
  }

  @GetMapping
  public StoreResponse<RepairOrder> list(RequestParams params) {
    return StoreResponse.of(pageAndSort(params, search(params, repairOrders.repairOrders())));
  }

  /** Each {@code to_delete} value is one {@code shop_id,order_no} pair. */
  @PostMapping("/delete")
  public DeletionResponse delete(RequestParams params) {
    return DeletionResponse.of(simpleDeletion(params, repairOrders.repairOrders()));
  }
}
