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

import me.golemcore.workbridge.adapter.outbound.workspace.WorkspaceClientManager;
import me.golemcore.workbridge.domain.service.NotificationDispatcher;
import me.golemcore.workbridge.domain.service.WorkspaceNotificationBridge;
import me.golemcore.workbridge.infrastructure.i18n.MessageService;
import me.golemcore.workbridge.port.inbound.ChannelPort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Shared beans and startup sequence.
 *
 * <p>
 * On startup the notification dispatcher recovers its queue first, then the
 * event bridge subscribes, then workspaces are connected, and finally the
 * enabled chat channels start accepting commands.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final WorkbridgeProperties properties;
    private final List<ChannelPort> channelPorts;
    private final NotificationDispatcher notificationDispatcher;
    private final WorkspaceNotificationBridge notificationBridge;
    private final WorkspaceClientManager workspaceClientManager;
    private final MessageService messageService;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("Workbridge starting (storage: {}, workspaces: {})",
                properties.getStorage().getLocal().getBasePath(), properties.getWorkspaces().keySet());
        messageService.setLanguage(properties.getLanguage());

        notificationDispatcher.start();
        notificationBridge.start();
        workspaceClientManager.start();

        for (ChannelPort channel : channelPorts) {
            String channelType = channel.getChannelType();
            if (isChannelEnabled(channelType)) {
                log.info("Starting channel: {}", channelType);
                channel.start();
            }
        }

        log.info("Workbridge started");
    }

    private boolean isChannelEnabled(String channelType) {
        WorkbridgeProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        return channelProps != null && channelProps.isEnabled();
    }
}
