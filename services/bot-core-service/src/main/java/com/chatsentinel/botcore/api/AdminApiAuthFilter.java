package com.chatsentinel.botcore.api;

import com.chatsentinel.botcore.config.AdminProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gate in front of the admin API. Every /api/** request must carry {@value #HEADER} equal to
 * {@code bot.admin.token}; a deployment without a token refuses all admin calls instead of
 * serving them open.
 */
@Component
@Slf4j
public class AdminApiAuthFilter extends OncePerRequestFilter {

  static final String HEADER = "X-Admin-Token";
  private static final String ADMIN_PREFIX = "/api/";

  private final AdminProperties admin;
  private final ObjectMapper mapper;
  private final byte[] expected;

  public AdminApiAuthFilter(AdminProperties admin, ObjectMapper mapper) {
    this.admin = admin;
    this.mapper = mapper;
    this.expected = admin.token().getBytes(StandardCharsets.UTF_8);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String uri = request.getRequestURI();
    // servletPath is empty under MockMvc, so match on the URI
    String path = uri == null ? "" : uri.substring(request.getContextPath().length());
    return !path.startsWith(ADMIN_PREFIX);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    if (!admin.tokenConfigured()) {
      log.error("Admin call {} refused: bot.admin.token is not set", request.getRequestURI());
      reject(
          response,
          HttpStatus.SERVICE_UNAVAILABLE,
          ErrorResponse.of("ADMIN_TOKEN_NOT_CONFIGURED", "Admin API is disabled"));
      return;
    }
    if (!matches(request.getHeader(HEADER))) {
      log.warn("Admin token rejected for {} {}", request.getMethod(), request.getRequestURI());
      reject(
          response,
          HttpStatus.UNAUTHORIZED,
          ErrorResponse.of("UNAUTHORIZED", "Missing or invalid " + HEADER));
      return;
    }
    chain.doFilter(request, response);
  }

  private boolean matches(String provided) {
    if (provided == null) {
      return false;
    }
    return MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.UTF_8));
  }

  private void reject(HttpServletResponse response, HttpStatus status, ErrorResponse body)
      throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    mapper.writeValue(response.getOutputStream(), body);
  }
}
