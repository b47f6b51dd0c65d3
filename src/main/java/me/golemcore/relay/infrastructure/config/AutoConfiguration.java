package me.golemcore.relay.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.port.outbound.ChannelPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Shared beans and the startup banner.
 *
 * <p>
 * Logs the version, workspace, scheduler settings and the outbound channels
 * found on the classpath. A missing agent command is only reported here; jobs
 * that need it fail when they run.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RelayProperties properties;
    private final List<ChannelPort> channelPorts;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
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
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Relay v{} starting...", version);
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Cron: enabled={}, maxConcurrentRuns={}, lane={}", properties.getCron().isEnabled(),
                properties.getCron().getMaxConcurrentRuns(), properties.getCron().getLane());
        log.info("Channels: {}", channelPorts.stream().map(ChannelPort::getChannelType).toList());
        if (properties.getAgent().getCommand() == null || properties.getAgent().getCommand().isEmpty()) {
            log.warn("relay.agent.command is not set, isolated cron jobs will fail until it is configured");
        }
    }
}
