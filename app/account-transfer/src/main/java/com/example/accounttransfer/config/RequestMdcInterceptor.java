/*
 * どこで: Account Transfer Web 層
 * 何を: 転送 API のリクエスト属性を MDC に載せ、完了時に外す
 * なぜ: 1 回の import/export に関わるログをリクエスト単位で追えるようにするため
 */
package com.example.accounttransfer.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final String TRANSFER_PATH_PREFIX = "/admin/transfer/";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> fields = new LinkedHashMap<>();
    fields.put("request_id", requestId(request));
    fields.put("http_method", request.getMethod());
    fields.put("http_path", request.getRequestURI());
    // プロキシ越しの送信元は server.forward-headers-strategy で解決済み
    fields.put("client_ip", request.getRemoteAddr());
    fields.put("user_id", userId(request));
    final String operation = transferOperation(request.getRequestURI());
    if (operation != null) {
      fields.put("transfer_operation", operation);
      fields.put("dry_run", request.getParameter("dryRun"));
    }
    fields.values().removeIf(value -> value == null || value.isBlank());
    fields.forEach(MDC::put);
    request.setAttribute(ATTRIBUTE_KEYS, Set.copyOf(fields.keySet()));
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

  private static String requestId(HttpServletRequest request) {
    final String header = request.getHeader("X-Request-Id");
    return header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
  }

  private static String userId(HttpServletRequest request) {
    final Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication != null
        && authentication.isAuthenticated()
        && !"anonymousUser".equals(authentication.getName())) {
      return authentication.getName();
    }
    return request.getHeader("X-User-Id");
  }

  // /admin/transfer/import -> import
  private static String transferOperation(String uri) {
    if (uri == null || !uri.startsWith(TRANSFER_PATH_PREFIX)) {
      return null;
    }
    return uri.substring(TRANSFER_PATH_PREFIX.length());
  }
}
