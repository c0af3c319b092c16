package io.intellixity.paging.examples.service;

import io.intellixity.paging.exec.DataEngine;
import io.intellixity.paging.paging.PagingSettings;
import org.springframework.stereotype.Service;

@Service
public final class RepairOrderService {
  private final DataEngine engine;
  private final PagingSettings settings;

  public RepairOrderService(DataEngine engine, PagingSettings settings) {
    this.engine = engine;
    this.settings = settings;
  }

  public RepairOrderResultSet repairOrders() {
    return new RepairOrderResultSet(engine, settings.paramNames());
  }
}
