package com.example.accounttransfer.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putsTransferKeysAndRemovesThemAfterCompletion() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/admin/transfer/import");
    request.addHeader("X-Request-Id", "req-1");
    request.setRemoteAddr("10.0.0.1");
    request.addHeader("X-User-Id", "admin-1");
    request.addParameter("dryRun", "true");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(MDC.get("user_id")).isEqualTo("admin-1");
    assertThat(MDC.get("transfer_operation")).isEqualTo("import");
    assertThat(MDC.get("dry_run")).isEqualTo("true");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("transfer_operation")).isNull();
    assertThat(MDC.get("dry_run")).isNull();
  }

  @Test
  void generatesRequestIdAndSkipsTransferKeysElsewhere() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
    request.addParameter("dryRun", "true");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("transfer_operation")).isNull();
    assertThat(MDC.get("dry_run")).isNull();
  }
}
