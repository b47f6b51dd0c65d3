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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Relay configuration bound from application.properties under the
 * {@code relay.*} prefix.
 *
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link CronProperties} - scheduler loop</li>
 * <li>{@link SessionProperties} - shared session store and idle window</li>
 * <li>{@link AgentProperties} - external agent command</li>
 * <li>{@link ChannelsProperties} - outbound messaging surfaces</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private StorageProperties storage = new StorageProperties();
    private CronProperties cron = new CronProperties();
    private SessionProperties session = new SessionProperties();
    private AgentProperties agent = new AgentProperties();
    private ChannelsProperties channels = new ChannelsProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/relay";
    }

    @Data
    public static class CronProperties {
        private boolean enabled = true;
        private int maxConcurrentRuns = 1;
        private long tickIntervalMs = 1000;
        private String lane = "cron";
    }

    @Data
    public static class SessionProperties {
        private int idleMinutes = 10080;
        private String mainKey = "main";
        private String mainLane = "main";
        private String store = "sessions/sessions.json";
        private boolean sendSystemOnce = false;
        private String sessionIntro = "";
    }

    @Data
    public static class AgentProperties {
        private List<String> command = new ArrayList<>();
        private String bodyPrefix = "";
        private int timeoutSeconds = 600;
        private String thinkingDefault = "";
    }

    @Data
    public static class ChannelsProperties {
        private WhatsAppProperties whatsapp = new WhatsAppProperties();
        private TokenChannelProperties telegram = new TokenChannelProperties();
        private DiscordProperties discord = new DiscordProperties();
    }

    @Data
    public static class WhatsAppProperties {
        private List<String> allowFrom = new ArrayList<>();
        private String gatewayUrl = "http://127.0.0.1:18789";
        private long sendTimeoutMs = 10000;
    }

    @Data
    public static class TokenChannelProperties {
        private String token;
    }

    @Data
    public static class DiscordProperties {
        private String token;
        private String apiUrl = "https://discord.com/api/v10";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private long callTimeout = 120000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
