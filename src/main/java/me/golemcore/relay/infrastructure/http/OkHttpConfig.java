package me.golemcore.relay.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the HTTP channel adapters (Discord REST, the
 * WhatsApp gateway), configured from {@code relay.http.*}. Every request
 * carries a {@code golemcore-relay/<version>} user agent unless the caller
 * sets its own. Adapters derive per-channel clients with
 * {@link OkHttpClient#newBuilder()} so the connection pool stays shared.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    static final String USER_AGENT_PREFIX = "golemcore-relay/";

    private final RelayProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public OkHttpClient okHttpClient() {
        RelayProperties.HttpProperties http = properties.getHttp();
        BuildProperties buildProperties = buildPropertiesProvider.getIfAvailable();
        String version = buildProperties != null ? buildProperties.getVersion() : "dev";

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .callTimeout(http.getCallTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .addInterceptor(userAgent(USER_AGENT_PREFIX + version))
                .build();
    }

    static Interceptor userAgent(String userAgent) {
        return chain -> {
            Request request = chain.request();
            if (request.header("User-Agent") != null) {
                return chain.proceed(request);
            }
            return chain.proceed(request.newBuilder().header("User-Agent", userAgent).build());
        };
    }
}
