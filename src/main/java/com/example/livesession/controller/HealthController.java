package com.example.livesession.controller;

import com.example.livesession.service.SessionRegistry;
import com.example.livesession.transport.WebSocketSessionTransport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final SessionRegistry registry;
  private final WebSocketSessionTransport transport;

  @Value("${spring.profiles.active:default}")
  private String activeProfile;

  @Value("${features.session-archive.enabled:false}")
  private boolean sessionArchiveEnabled;

  public HealthController(SessionRegistry registry, WebSocketSessionTransport transport) {
    this.registry = registry;
    this.transport = transport;
  }

  /** Liveness check, touches nothing. */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  @GetMapping("/admin/health")
  public Map<String, Object> adminHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("app", "ok");
    m.put("profile", activeProfile);
    m.put("sessionArchive", sessionArchiveEnabled ? "enabled" : "disabled");
    m.put("activeSessions", registry.size());
    m.put("connections", transport.connectionCount());
    return m;
  }
}
