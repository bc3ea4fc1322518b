package com.apistack.service.config;

import com.apistack.service.ratelimit.FailureMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration for the API stack.
 * Bound once at startup from application.yml, whose placeholders are fed by environment variables.
 */
@Configuration
@ConfigurationProperties(prefix = "apistack")
@Data
public class ApiStackProperties {

    // ========== DATABASE ==========
    private DatabaseConfig database = new DatabaseConfig();

    @Data
    public static class DatabaseConfig {
        private String engine = "postgres";  // postgres | oracle
        private String url;                  // full JDBC URL, overrides host/port/database
        private EndpointConfig postgres = new EndpointConfig("localhost", 5432, "app");
        private EndpointConfig oracle = new EndpointConfig("localhost", 1521, "FREEPDB1");
        private PoolConfig pool = new PoolConfig();
        private Duration statementTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class EndpointConfig {
        private String host;
        private Integer port;
        private String database;
        private String username;
        private String password;

        public EndpointConfig() {
        }

        public EndpointConfig(String host, Integer port, String database) {
            this.host = host;
            this.port = port;
            this.database = database;
        }
    }

    @Data
    public static class PoolConfig {
        private Integer maxSize = 10;
        private Integer minIdle = 2;
        private Duration timeout = Duration.ofSeconds(5);
        private Duration retryBackoff = Duration.ofMillis(100);
    }

    // ========== SHARED STORES ==========
    private StoreConfig store = new StoreConfig();

    @Data
    public static class StoreConfig {
        private String mode = "redis";  // redis | local (single node only)
        private Long localMaximumSize = 100_000L;
    }

    // ========== RATE LIMITING ==========
    private RateLimitConfig rateLimit = new RateLimitConfig();

    @Data
    public static class RateLimitConfig {
        private Boolean enabled = true;
        private Integer requests = 100;
        private Integer windowSeconds = 60;
        private FailureMode failureMode = FailureMode.FAIL_OPEN;
    }

    // ========== RESPONSE CACHE ==========
    private CacheConfig cache = new CacheConfig();

    @Data
    public static class CacheConfig {
        private Boolean enabled = true;
        private Duration defaultTtl = Duration.ofSeconds(60);
        private String defaultNamespace = "default";
        private ExecutorConfig writer = new ExecutorConfig();
    }

    @Data
    public static class ExecutorConfig {
        private Integer corePoolSize = 2;
        private Integer maxPoolSize = 4;
        private Integer queueCapacity = 500;
    }

    // ========== SECURITY ==========
    private SecurityConfig security = new SecurityConfig();

    @Data
    public static class SecurityConfig {
        private JwtConfig jwt = new JwtConfig();
        private List<String> publicPaths = new ArrayList<>(List.of("/health", "/health/**"));
        private List<String> corsOrigins = new ArrayList<>();  // empty disables CORS handling
    }

    @Data
    public static class JwtConfig {
        private String secret;
        private String issuer;
        private Duration clockSkew = Duration.ofSeconds(30);
    }

    // ========== OBJECT STORAGE ==========
    private ObjectStorageConfig storage = new ObjectStorageConfig();

    @Data
    public static class ObjectStorageConfig {
        private String endpoint = "http://localhost:9000";
        private String accessKey;
        private String secretKey;
        private String bucket = "uploads";
        private String region = "us-east-1";
        private Boolean ensureBucketOnStartup = false;
        private Boolean verifyBeforeSigning = false;
    }

    // ========== ROUTES ==========
    private List<RouteConfig> routes = new ArrayList<>();

    @Data
    public static class RouteConfig {
        private String id;
        private String path;
        private List<String> methods = new ArrayList<>();
        private Boolean authRequired = true;
        private List<String> requiredRoles = new ArrayList<>();
        private Boolean rateLimited = true;
        private Integer rateLimitRequests;        // falls back to apistack.rate-limit.requests
        private Integer rateLimitWindowSeconds;   // falls back to apistack.rate-limit.window-seconds
        private Boolean cacheable = false;
        private Duration cacheTtl;                // falls back to apistack.cache.default-ttl
        private Boolean principalScoped;          // defaults to auth-required; false shares entries across callers
    }
}
