/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.workbridge.infrastructure.config;

import me.golemcore.workbridge.domain.model.ErrorCategory;
import me.golemcore.workbridge.domain.model.WorkspaceEventType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bridge, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code workbridge.*} prefix:
 * <ul>
 * <li>{@link ChannelProperties} - messaging channels (Telegram)</li>
 * <li>{@link WorkspaceProperties} - remote workspace agents, keyed by id</li>
 * <li>{@link WorkspaceClientProperties} - shared channel client settings and
 * result cache</li>
 * <li>{@link ThrottleProperties} - per event type rate limits</li>
 * <li>{@link NotificationProperties} - batching, queue drain and recipient
 * filters</li>
 * <li>{@link DeliveryProperties} - chunking, retry and circuit breaker for
 * outbound messages</li>
 * <li>{@link SecurityProperties} - blocked users and accessible
 * directories</li>
 * </ul>
 *
 * <p>
 * All durations are milliseconds.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "workbridge")
@Data
public class WorkbridgeProperties {

    private String language = "en";
    private Map<String, ChannelProperties> channels = new HashMap<>();
    private Map<String, WorkspaceProperties> workspaces = new LinkedHashMap<>();
    private WorkspaceClientProperties workspaceClient = new WorkspaceClientProperties();
    private ThrottleProperties throttle = new ThrottleProperties();
    private NotificationProperties notifications = new NotificationProperties();
    private DeliveryProperties delivery = new DeliveryProperties();
    private SecurityProperties security = new SecurityProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
    }

    // ==================== WORKSPACES ====================

    @Data
    public static class WorkspaceProperties {
        private String url;
        private String token;
        private boolean enabled = true;
        private List<String> recipients = new ArrayList<>();
        private boolean reconnect = true;
        private int maxReconnectAttempts = 5;
        private long reconnectDelay = 1000;
        private long commandTimeout = 10000;
        private long authTimeout = 10000;
    }

    @Data
    public static class WorkspaceClientProperties {
        private long pingInterval = 30000;
        private long cacheTtl = 300000;
        private int cacheMaxEntries = 1000;
        private long cacheCleanupInterval = 60000;
    }

    // ==================== EVENTS ====================

    @Data
    public static class ThrottleProperties {
        private Map<WorkspaceEventType, ThrottleRuleProperties> rules = defaultRules();
        private int subscriberBufferSize = 256;

        private static Map<WorkspaceEventType, ThrottleRuleProperties> defaultRules() {
            Map<WorkspaceEventType, ThrottleRuleProperties> rules = new EnumMap<>(WorkspaceEventType.class);
            rules.put(WorkspaceEventType.BUILD_COMPLETE, new ThrottleRuleProperties(5000, 2));
            rules.put(WorkspaceEventType.ERROR, new ThrottleRuleProperties(10000, 5));
            rules.put(WorkspaceEventType.GIT_OPERATION, new ThrottleRuleProperties(3000, 3));
            rules.put(WorkspaceEventType.FILE_CHANGED, new ThrottleRuleProperties(30000, 10));
            return rules;
        }
    }

    @Data
    public static class ThrottleRuleProperties {
        private boolean enabled = true;
        private long window;
        private int maxEvents;

        public ThrottleRuleProperties() {
        }

        public ThrottleRuleProperties(long window, int maxEvents) {
            this.window = window;
            this.maxEvents = maxEvents;
        }
    }

    // ==================== NOTIFICATIONS ====================

    @Data
    public static class NotificationProperties {
        private long batchWindow = 30000;
        private long drainInterval = 5000;
        private long retryDelay = 5000;
        private int deliveryThreads = 4;
        private Map<String, RecipientProperties> recipients = new HashMap<>();
    }

    @Data
    public static class RecipientProperties {
        private boolean enabled = true;
        private List<WorkspaceEventType> types = new ArrayList<>();
    }

    // ==================== DELIVERY ====================

    @Data
    public static class DeliveryProperties {
        private int maxMessageLength = 4096;
        private long chunkDelay = 500;
        private RetryProperties retry = new RetryProperties();
        private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private long initialDelay = 1000;
        private long maxDelay = 10000;
        private double multiplier = 2.0;
        private List<ErrorCategory> retryableCategories = new ArrayList<>(List.of(
                ErrorCategory.NETWORK,
                ErrorCategory.TIMEOUT,
                ErrorCategory.RATE_LIMITED,
                ErrorCategory.SERVER,
                ErrorCategory.CIRCUIT_OPEN));
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 5;
        private int successThreshold = 2;
        private long timeout = 60000;
        private long resetTimeout = 300000;
    }

    // ==================== SECURITY ====================

    @Data
    public static class SecurityProperties {
        private List<String> blockedUsers = new ArrayList<>();
        private List<String> defaultAccessibleDirectories = new ArrayList<>();
        private Map<String, List<String>> accessibleDirectories = new HashMap<>();
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/workbridge";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
