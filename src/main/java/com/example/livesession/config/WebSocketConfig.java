package com.example.livesession.config;

import com.example.livesession.handler.SessionWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mounts the session hub. Allowed origins come from {@code app.websocket.allowed-origins};
 * a local dev origin admits every port of the loopback host.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

  private final SessionWebSocketHandler hub;
  private final String hubPath;
  private final List<String> origins;

  public WebSocketConfig(
      SessionWebSocketHandler hub,
      @Value("${app.websocket.path:/hubs/sessions}") String hubPath,
      @Value("${app.websocket.allowed-origins:http://localhost:8080}") String allowedOrigins,
      @Value("${app.websocket.any-origin:false}") boolean anyOrigin
  ) {
    this.hub = hub;
    this.hubPath = hubPath;
    this.origins = anyOrigin ? List.of("*") : originPatterns(allowedOrigins);
  }

  /** Comma-separated origins to Spring origin patterns; nothing configured means any origin. */
  static List<String> originPatterns(String csv) {
    Set<String> patterns = new LinkedHashSet<>();
    for (String raw : csv == null ? new String[0] : csv.split(",")) {
      String origin = raw.trim();
      if (!origin.isEmpty()) patterns.addAll(expandToPatterns(origin));
    }
    return patterns.isEmpty() ? List.of("*") : List.copyOf(patterns);
  }

  static List<String> expandToPatterns(String origin) {
    if (origin.startsWith("http://localhost")) {
      return List.of(origin, "http://localhost:*", "http://127.0.0.1:*");
    }
    if (origin.startsWith("https://localhost")) {
      return List.of(origin, "https://localhost:*");
    }
    return List.of(origin);
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(hub, hubPath).setAllowedOriginPatterns(origins.toArray(String[]::new));
    log.info("Session hub mounted at {} for origins {}", hubPath, origins);
  }
}
