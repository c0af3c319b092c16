package io.intellixity.paging.examples.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
final class RepairOrderControllerTest {
  @Autowired
  MockMvc mvc;

  @Test
  void unsortedListingFollowsCompositeKey() throws Exception {
    mvc.perform(get("/api/repair-orders"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(8))
        .andExpect(jsonPath("$.data[0].shopId").value(1))
        .andExpect(jsonPath("$.data[0].orderNo").value(1001))
        .andExpect(jsonPath("$.data[7].shopId").value(3))
        .andExpect(jsonPath("$.data[7].orderNo").value(1002));
  }

  @Test
  void searchUsesTheResultSetVocabulary() throws Exception {
    mvc.perform(get("/api/repair-orders").param("status", "open"))
        .andExpect(jsonPath("$.total").value(4))
        .andExpect(jsonPath("$.data[*].status", everyItem(is("OPEN"))));

    mvc.perform(get("/api/repair-orders").param("part_id", "brk"))
        .andExpect(jsonPath("$.total").value(4));

    mvc.perform(get("/api/repair-orders").param("customer", "smith"))
        .andExpect(jsonPath("$.data[*].customerFirstName", contains("Ann", "Erin")));
  }

  @Test
  void keysWithoutHandlerAreIgnored() throws Exception {
    mvc.perform(get("/api/repair-orders").param("password", "x"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(8));
  }

  @Test
  void namedSortOrdersByLastThenFirstName() throws Exception {
    mvc.perform(get("/api/repair-orders").param("sort", "customer_name").param("dir", "asc"))
        .andExpect(jsonPath("$.data[0].customerLastName").value("Becker"))
        .andExpect(jsonPath("$.data[5].customerFirstName").value("Ann"))
        .andExpect(jsonPath("$.data[6].customerFirstName").value("Erin"));
  }

  @Test
  void otherSortKeysNameAColumn() throws Exception {
    mvc.perform(get("/api/repair-orders").param("sort", "part_id").param("dir", "desc").param("limit", "1"))
        .andExpect(jsonPath("$.total").value(8))
        .andExpect(jsonPath("$.data", hasSize(1)))
        .andExpect(jsonPath("$.data[0].partId").value("TIR-330"));
  }

  @Test
  void compositeKeyNeedsBothValues() throws Exception {
    mvc.perform(post("/api/repair-orders/delete").param("to_delete", "1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false));
  }

  @Test
  @DirtiesContext(methodMode = DirtiesContext.MethodMode.AFTER_METHOD)
  void deletesCompositeKeys() throws Exception {
    mvc.perform(post("/api/repair-orders/delete").param("to_delete", "1,1001", "3,1002"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deleted", contains("1,1001", "3,1002")));

    mvc.perform(get("/api/repair-orders"))
        .andExpect(jsonPath("$.total").value(6))
        .andExpect(jsonPath("$.data[0].orderNo").value(1002));
  }
}
