package com.example.livesession.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties("app.session")
public class SessionProperties {

  /** Length of the human-enterable join code. */
  private int codeLength = 6;

  /** Sessions without activity and without connected participants are ended after this. */
  private long idleTimeoutMs = 2 * 60 * 60 * 1000L;

  /** Ended sessions stay queryable (results, leaderboard) for this long. */
  private long endedRetentionMs = 30 * 60 * 1000L;

  /** Snapshots of forgotten sessions answer result queries until they are this old. */
  private long storedRetentionMs = 24 * 60 * 60 * 1000L;

  private long sweepIntervalMs = 60_000L;

  /** Debounce window of the store snapshotter. */
  private long snapshotDebounceMs = 500L;

  /** Used for questions that come without a time limit. */
  private int defaultTimeLimitSeconds = 30;

  /** Upper bound of a single ExtendTime call. */
  private int maxExtensionSeconds = 300;

  private int schedulerPoolSize = 2;

  // --- getters/setters ---

  public int getCodeLength() { return codeLength; }
  public void setCodeLength(int codeLength) { this.codeLength = codeLength; }

  public long getIdleTimeoutMs() { return idleTimeoutMs; }
  public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }

  public long getEndedRetentionMs() { return endedRetentionMs; }
  public void setEndedRetentionMs(long endedRetentionMs) { this.endedRetentionMs = endedRetentionMs; }

  public long getStoredRetentionMs() { return storedRetentionMs; }
  public void setStoredRetentionMs(long storedRetentionMs) { this.storedRetentionMs = storedRetentionMs; }

  public long getSweepIntervalMs() { return sweepIntervalMs; }
  public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }

  public long getSnapshotDebounceMs() { return snapshotDebounceMs; }
  public void setSnapshotDebounceMs(long snapshotDebounceMs) { this.snapshotDebounceMs = snapshotDebounceMs; }

  public int getDefaultTimeLimitSeconds() { return defaultTimeLimitSeconds; }
  public void setDefaultTimeLimitSeconds(int defaultTimeLimitSeconds) { this.defaultTimeLimitSeconds = defaultTimeLimitSeconds; }

  public int getMaxExtensionSeconds() { return maxExtensionSeconds; }
  public void setMaxExtensionSeconds(int maxExtensionSeconds) { this.maxExtensionSeconds = maxExtensionSeconds; }

  public int getSchedulerPoolSize() { return schedulerPoolSize; }
  public void setSchedulerPoolSize(int schedulerPoolSize) { this.schedulerPoolSize = schedulerPoolSize; }
}
