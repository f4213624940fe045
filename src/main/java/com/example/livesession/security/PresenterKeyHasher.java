package com.example.livesession.security;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/** Presenter keys: random bearer tokens, kept server-side only as BCrypt hashes. */
@Component
public class PresenterKeyHasher {
  private static final int KEY_BYTES = 24;

  private final BCryptPasswordEncoder enc = new BCryptPasswordEncoder();
  private final SecureRandom random = new SecureRandom();

  public String newKey() {
    byte[] buf = new byte[KEY_BYTES];
    random.nextBytes(buf);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
  }

  public String hash(String raw) {
    return enc.encode(raw == null ? "" : raw);
  }

  /** A blank key never matches. */
  public boolean matches(String raw, String hash) {
    if (raw == null || raw.isBlank() || hash == null || hash.isBlank()) return false;
    return enc.matches(raw, hash);
  }
}
