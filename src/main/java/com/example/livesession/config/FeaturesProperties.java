package com.example.livesession.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "features")
public record FeaturesProperties(SessionArchive sessionArchive) {

    public FeaturesProperties {
        if (sessionArchive == null) sessionArchive = new SessionArchive(false);
    }

    public static record SessionArchive(boolean enabled) { }
}
