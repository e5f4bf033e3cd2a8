package me.golemcore.pagepilot.infrastructure.http;

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
import me.golemcore.pagepilot.adapter.outbound.http.OkHttpFetchAdapter;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import me.golemcore.pagepilot.port.outbound.HttpFetchPort;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the OkHttp client used by the HTTP acquisition
 * strategies.
 *
 * <p>
 * Creates a shared {@link OkHttpClient} bean configured from
 * {@link PagePilotProperties.HttpProperties}:
 * <ul>
 * <li>Connect timeout - time to establish connection</li>
 * <li>Read timeout - time to wait for data</li>
 * <li>Write timeout - time to send data</li>
 * <li>Connection pool - maintains idle connections for reuse</li>
 * </ul>
 *
 * <p>
 * Per-request call timeouts and session cookie jars are derived from this
 * client with {@link OkHttpClient#newBuilder()}, sharing its pool.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final PagePilotProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        PagePilotProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean
    public HttpFetchPort httpFetchPort(OkHttpClient okHttpClient) {
        PagePilotProperties.AcquisitionProperties acquisition = properties.getAcquisition();
        return new OkHttpFetchAdapter(okHttpClient, acquisition.getUserAgent(),
                acquisition.getExtraction().getMaxResponseBytes());
    }
}
