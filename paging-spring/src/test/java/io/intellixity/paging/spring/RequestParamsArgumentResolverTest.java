package io.intellixity.paging.spring;

import io.intellixity.paging.paging.RequestParams;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

import java.lang.reflect.Method;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RequestParamsArgumentResolverTest {
  private final RequestParamsArgumentResolver resolver = new RequestParamsArgumentResolver();

  @SuppressWarnings("unused")
  void handler(RequestParams params, String other) {}

  private static MethodParameter param(int index) throws NoSuchMethodException {
    Method m = RequestParamsArgumentResolverTest.class.getDeclaredMethod("handler", RequestParams.class, String.class);
    return new MethodParameter(m, index);
  }

  @Test
  void supportsOnlyRequestParams() throws Exception {
    assertTrue(resolver.supportsParameter(param(0)));
    assertFalse(resolver.supportsParameter(param(1)));
  }

  @Test
  void copiesAllValuesOfEveryParameter() throws Exception {
    MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/people");
    req.addParameter("name", "ann", "jo");
    req.addParameter("limit", "10");

    RequestParams params = resolver.resolveArgument(param(0), null, new ServletWebRequest(req), null);
    assertEquals(List.of("ann", "jo"), params.all("name"));
    assertEquals("10", params.first("limit"));
    assertFalse(params.containsKey("start"));
  }
}
