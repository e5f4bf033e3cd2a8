package me.golemcore.pagepilot.adapter.outbound.http;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.port.outbound.HttpFetchPort;
import me.golemcore.pagepilot.port.outbound.HttpFetchResponse;
import okhttp3.JavaNetCookieJar;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp implementation of {@link HttpFetchPort}.
 *
 * <p>
 * Requests carry browser-like headers. The whole call, redirects included, is
 * bounded by the timeout passed to {@link #get(String, Duration)}, and at most
 * {@code maxResponseBytes} of the body are read.
 */
@Slf4j
public class OkHttpFetchAdapter implements HttpFetchPort {

    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";

    private final OkHttpClient client;
    private final String userAgent;
    private final long maxResponseBytes;

    public OkHttpFetchAdapter(OkHttpClient client, String userAgent, long maxResponseBytes) {
        this.client = client;
        this.userAgent = userAgent;
        this.maxResponseBytes = maxResponseBytes;
    }

    @Override
    public HttpFetchResponse get(String url, Duration timeout) throws IOException {
        long timeoutMs = Math.max(1, timeout.toMillis());
        OkHttpClient callClient = client.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .followSslRedirects(true)
                .build();

        Request.Builder request = new Request.Builder()
                .url(url)
                .get()
                .header("Accept", ACCEPT)
                .header("Accept-Language", ACCEPT_LANGUAGE);
        if (userAgent != null && !userAgent.isBlank()) {
            request.header("User-Agent", userAgent);
        }

        try (Response response = callClient.newCall(request.build()).execute()) {
            String body = response.peekBody(maxResponseBytes).string();
            String finalUrl = response.request().url().toString();
            log.debug("[Acquire] GET {} -> {} ({} chars, final {})", url, response.code(), body.length(), finalUrl);
            return new HttpFetchResponse(response.code(), body, finalUrl, response.header("Content-Type"));
        }
    }

    @Override
    public HttpFetchPort newSession() {
        CookieManager cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        OkHttpClient sessionClient = client.newBuilder()
                .cookieJar(new JavaNetCookieJar(cookieManager))
                .build();
        return new OkHttpFetchAdapter(sessionClient, userAgent, maxResponseBytes);
    }
}
