package me.golemcore.pagepilot.adapter.outbound.browser;

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

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.port.outbound.BrowserPort;
import me.golemcore.pagepilot.port.outbound.BrowserSession;
import me.golemcore.pagepilot.port.outbound.BrowserUnavailableException;

import java.time.Duration;

/**
 * Playwright implementation of {@link BrowserPort}.
 *
 * <p>
 * Every session gets its own {@link Playwright} driver, browser and context, so
 * a session is confined to the thread that opened it and closing it releases
 * the whole browser process tree. Branded backends ({@code chrome},
 * {@code msedge}) launch the installed vendor browser through a Chromium
 * channel.
 *
 * <p>
 * Used both by the browser acquisition strategy in the service and by the
 * sandbox child process.
 */
@Slf4j
public class PlaywrightBrowserAdapter implements BrowserPort {

    private final BrowserLaunchSettings settings;

    public PlaywrightBrowserAdapter(BrowserLaunchSettings settings) {
        this.settings = settings;
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public BrowserSession open(BrowserBackend backend, Duration defaultTimeout) {
        Playwright pw = null;
        Browser br = null;
        BrowserContext ctx = null;
        try {
            pw = Playwright.create();
            BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions()
                    .setHeadless(settings.headless())
                    .setTimeout(defaultTimeout.toMillis());
            if (backend.getChannel() != null) {
                launchOptions.setChannel(backend.getChannel());
            }
            br = browserType(pw, backend).launch(launchOptions);

            Browser.NewContextOptions contextOptions = new Browser.NewContextOptions();
            if (settings.userAgent() != null && !settings.userAgent().isBlank()) {
                contextOptions.setUserAgent(settings.userAgent());
            }
            ctx = br.newContext(contextOptions);
            Page page = ctx.newPage();
            page.setDefaultTimeout(defaultTimeout.toMillis());
            page.setDefaultNavigationTimeout(defaultTimeout.toMillis());

            log.debug("Playwright {} launched (headless: {})", backend.getId(), settings.headless());
            return new PlaywrightBrowserSession(pw, br, ctx, page);
        } catch (RuntimeException e) {
            // Clean up partially created resources to prevent process leaks
            closeQuietly(ctx);
            closeQuietly(br);
            closeQuietly(pw);
            throw new BrowserUnavailableException(
                    "Failed to launch " + backend.getId() + ": " + firstLine(e.getMessage()), e);
        }
    }

    private static BrowserType browserType(Playwright playwright, BrowserBackend backend) {
        return switch (backend.getEngine()) {
        case CHROMIUM -> playwright.chromium();
        case FIREFOX -> playwright.firefox();
        case WEBKIT -> playwright.webkit();
        };
    }

    static void closeQuietly(AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception ex) {
            log.trace("Error closing browser resource: {}", ex.getMessage());
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
