package io.intellixity.paging.spring;

import io.intellixity.paging.paging.PagingParameterException;
import io.intellixity.paging.query.QueryValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

final class PagingExceptionHandlerTest {
  private final PagingExceptionHandler handler = new PagingExceptionHandler();

  @Test
  void missingDeletionKeysIsBadRequest() {
    ResponseEntity<ErrorResponse> res = handler.handlePagingParameter(
        new PagingParameterException("to_delete", "Required request parameter (to_delete) undefined!"));
    assertEquals(400, res.getStatusCode().value());
    assertFalse(res.getBody().success());
    assertEquals("Required request parameter (to_delete) undefined!", res.getBody().message());
  }

  @Test
  void unknownColumnIsBadRequest() {
    ResponseEntity<ErrorResponse> res = handler.handleQueryValidation(
        new QueryValidationException("Unknown column 'me.secret' for source 'people'"));
    assertEquals(400, res.getStatusCode().value());
    assertTrue(res.getBody().message().contains("me.secret"));
  }
}
