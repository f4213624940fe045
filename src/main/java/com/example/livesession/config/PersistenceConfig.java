package com.example.livesession.config;

import com.example.livesession.persistence.JpaSessionArchive;
import com.example.livesession.persistence.NoOpSessionArchive;
import com.example.livesession.persistence.SessionArchive;
import com.example.livesession.repository.SessionResultRepository;
import com.example.livesession.sessions.service.SessionSnapshotter;
import com.example.livesession.sessions.store.SessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PersistenceConfig {

  @Bean
  @ConditionalOnProperty(name = "features.session-archive.enabled", havingValue = "true")
  public SessionArchive jpaSessionArchive(SessionResultRepository repo, ObjectMapper objectMapper) {
    return new JpaSessionArchive(repo, objectMapper);
  }

  // Default: results live only as long as the session stays in the registry.
  @Bean
  @ConditionalOnProperty(name = "features.session-archive.enabled", havingValue = "false", matchIfMissing = true)
  public SessionArchive noOpSessionArchive() {
    return new NoOpSessionArchive();
  }

  @Bean
  public SessionSnapshotter sessionSnapshotter(SessionStore store, Clock clock, SessionProperties props) {
    return new SessionSnapshotter(store, clock, props.getSnapshotDebounceMs());
  }
}
