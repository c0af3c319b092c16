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
final class PeopleControllerTest {
  @Autowired
  MockMvc mvc;

  @Test
  void firstPageUsesDefaultPageSizeAndKeyOrder() throws Exception {
    mvc.perform(get("/api/people"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.total").value(30))
        .andExpect(jsonPath("$.data", hasSize(25)))
        .andExpect(jsonPath("$.data[0].id").value(1))
        .andExpect(jsonPath("$.data[0].lastName").value("Smith"));
  }

  @Test
  void startAndLimitSelectThePage() throws Exception {
    mvc.perform(get("/api/people").param("start", "20").param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(30))
        .andExpect(jsonPath("$.data", hasSize(10)))
        .andExpect(jsonPath("$.data[0].id").value(21))
        .andExpect(jsonPath("$.data[9].id").value(30));
  }

  @Test
  void sortsByRequestedColumn() throws Exception {
    mvc.perform(get("/api/people").param("sort", "last_name").param("dir", "DESC").param("limit", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data[*].lastName", contains("Zhang", "Walsh", "Tanaka")));
  }

  @Test
  void searchesColumnsCaseInsensitively() throws Exception {
    mvc.perform(get("/api/people").param("last_name", "SMI"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.data[0].firstName").value("Ann"));

    mvc.perform(get("/api/people").param("email", ".net").param("first_name", "a").param("limit", "100"))
        .andExpect(jsonPath("$.total").value(9))
        .andExpect(jsonPath("$.data[*].id", contains(6, 10, 12, 16, 18, 20, 24, 28, 30)));

    mvc.perform(get("/api/people").param("first_name", "ann", "dana"))
        .andExpect(jsonPath("$.data[*].id", contains(1, 30)));
  }

  @Test
  void ignoredParamsAreNotSearched() throws Exception {
    mvc.perform(get("/api/people").param("_dc", "1700000000").param("xaction", "read"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(30));
  }

  @Test
  void rejectsMalformedPaging() throws Exception {
    mvc.perform(get("/api/people").param("limit", "abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message", containsString("limit")));

    mvc.perform(get("/api/people").param("sort", "last_name").param("dir", "sideways"))
        .andExpect(status().isBadRequest());

    mvc.perform(get("/api/people").param("start", "2147483647").param("limit", "1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message", containsString("start")));
  }

  @Test
  void rejectsUnknownColumns() throws Exception {
    mvc.perform(get("/api/people").param("password", "x"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message", containsString("Unknown column 'me.password'")));
  }

  @Test
  void deletionRequiresKeys() throws Exception {
    mvc.perform(post("/api/people/delete"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Required request parameter (to_delete) undefined!"));
  }

  @Test
  @DirtiesContext(methodMode = DirtiesContext.MethodMode.AFTER_METHOD)
  void deletesListedIds() throws Exception {
    mvc.perform(post("/api/people/delete").param("to_delete", "1,2,3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.deleted", contains("1", "2", "3")));

    mvc.perform(get("/api/people").param("limit", "1"))
        .andExpect(jsonPath("$.total").value(27))
        .andExpect(jsonPath("$.data[0].id").value(4));
  }
}
