/*
 * どこで: Account Transfer セキュリティ
 * 何を: 内部トークンと転送ヘッダから /admin/transfer 呼び出し元の認証を組み立てる
 * なぜ: 移行操作を BFF 経由の管理者に限定するため
 */
package com.example.accounttransfer.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String TRANSFER_PATH_PREFIX = "/admin/transfer";
  private static final String INTERNAL_ROLE = "ROLE_INTERNAL";
  private static final String ADMIN_ROLE = "ROLE_ADMIN";

  private final TransferInternalApiProperties properties;

  public InternalApiAuthenticationFilter(TransferInternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith(TRANSFER_PATH_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      logger.debug("internal authentication not established for path={}", request.getRequestURI());
      filterChain.doFilter(request, response);
      return;
    }
    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    if (forwardedUserId == null || forwardedUserId.isBlank()) {
      logger.warn(
          "transfer request rejected: missing required header {} on path={}",
          properties.userIdHeaderName(),
          request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            forwardedUserId,
            "N/A",
            buildAuthorities(request.getHeader(properties.userRolesHeaderName())));
    logger.debug(
        "internal authentication established for path={} authorities={}",
        request.getRequestURI(),
        authentication.getAuthorities());
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && !properties.token().isBlank()
        && actualToken.equals(properties.token());
  }

  private List<SimpleGrantedAuthority> buildAuthorities(String forwardedRoles) {
    final List<SimpleGrantedAuthority> authorities = new ArrayList<>();
    authorities.add(new SimpleGrantedAuthority(INTERNAL_ROLE));
    if (forwardedRoles == null || forwardedRoles.isBlank()) {
      return authorities;
    }
    for (String role : forwardedRoles.split(",")) {
      final String normalized = role.trim();
      if ("ADMIN".equals(normalized) || ADMIN_ROLE.equals(normalized)) {
        authorities.add(new SimpleGrantedAuthority(ADMIN_ROLE));
        break;
      }
    }
    return authorities;
  }
}
