package io.intellixity.paging.spring;

import io.intellixity.paging.paging.RequestParams;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies the query-string and form parameters of the current request to handler methods that
 * declare a {@link RequestParams} argument.
 */
public final class RequestParamsArgumentResolver implements HandlerMethodArgumentResolver {
  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return RequestParams.class.equals(parameter.getParameterType());
  }

  @Override
  public RequestParams resolveArgument(MethodParameter parameter,
                                       ModelAndViewContainer mavContainer,
                                       NativeWebRequest webRequest,
                                       WebDataBinderFactory binderFactory) {
    return RequestParams.fromArrays(webRequest.getParameterMap());
  }
}
