package com.example.livesession.service;

import com.example.livesession.config.SessionProperties;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.function.Predicate;

/** Join codes without look-alike characters (no 0/O, 1/I). */
@Component
public class SessionCodeGenerator {

    static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int MAX_ATTEMPTS = 100;

    private final SecureRandom random = new SecureRandom();
    private final int length;

    public SessionCodeGenerator(SessionProperties props) {
        this.length = Math.max(4, props.getCodeLength());
    }

    public String next(Predicate<String> taken) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String code = random();
            if (!taken.test(code)) return code;
        }
        throw new IllegalStateException("Could not allocate a free session code after " + MAX_ATTEMPTS + " attempts");
    }

    private String random() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
