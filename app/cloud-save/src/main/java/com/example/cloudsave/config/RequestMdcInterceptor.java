package com.example.cloudsave.config;

import com.example.common.Ids;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Tags status API requests with {@code trace_id}, {@code http_method}, {@code http_path} and the
 * queried {@code owner_id}. Only the keys this interceptor set are removed afterwards.
 */
@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String TRACE_HEADER = "X-Request-Id";
  static final String OWNER_HEADER = "X-Owner-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> values = new LinkedHashMap<>();
    values.put("trace_id", firstNonBlank(request.getHeader(TRACE_HEADER), Ids.newTraceId()));
    values.put("http_method", request.getMethod());
    values.put("http_path", request.getRequestURI());
    values.put(
        "owner_id", firstNonBlank(request.getParameter("owner_id"), request.getHeader(OWNER_HEADER)));
    values.values().removeIf(value -> value == null || value.isBlank());

    values.forEach(MDC::put);
    request.setAttribute(ATTRIBUTE_KEYS, Set.copyOf(values.keySet()));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof Set<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  @Nullable
  private static String firstNonBlank(@Nullable String first, @Nullable String second) {
    return first != null && !first.isBlank() ? first : second;
  }
}
