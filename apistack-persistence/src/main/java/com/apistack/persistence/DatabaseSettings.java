package com.apistack.persistence;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Connection and pool parameters for the active engine.
 * When {@code url} is set it is used verbatim, otherwise the dialect builds one from host/port/database.
 */
@Value
@Builder
public class DatabaseSettings {

    DatabaseEngine engine;
    String url;
    String host;
    int port;
    String database;
    String username;
    String password;

    @Builder.Default
    int maxPoolSize = 10;
    @Builder.Default
    int minIdle = 2;
    @Builder.Default
    Duration connectionTimeout = Duration.ofSeconds(5);
    @Builder.Default
    Duration statementTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration acquireRetryBackoff = Duration.ofMillis(100);
    @Builder.Default
    String poolName = "apistack-db";
}
