package com.example.livesession.config;

import com.example.livesession.service.ExecutorRoundScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // Round deadlines and auto-advance; the idle sweep runs on Spring's own scheduler.
  @Bean(destroyMethod = "shutdown")
  public ExecutorRoundScheduler roundScheduler(SessionProperties props) {
    return new ExecutorRoundScheduler(props.getSchedulerPoolSize());
  }
}
