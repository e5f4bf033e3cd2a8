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
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.port.outbound.BrowserElement;
import me.golemcore.pagepilot.port.outbound.BrowserSession;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One page in a dedicated Playwright browser. Closing releases the page,
 * context, browser and driver, in that order.
 */
@Slf4j
class PlaywrightBrowserSession implements BrowserSession {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;
    private final AtomicBoolean closed = new AtomicBoolean();

    PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    @Override
    public void navigate(String url) {
        page.navigate(url, new Page.NavigateOptions().setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
    }

    @Override
    public List<BrowserElement> findElements(String selector) {
        return page.querySelectorAll(selector).stream()
                .<BrowserElement>map(PlaywrightElement::new)
                .toList();
    }

    @Override
    public String elementAttribute(BrowserElement element, String name) {
        return unwrap(element).handle().getAttribute(name);
    }

    @Override
    public void click(BrowserElement element) {
        unwrap(element).handle().click();
    }

    @Override
    public void typeText(BrowserElement element, String text) {
        unwrap(element).handle().fill(text);
    }

    @Override
    public byte[] screenshot() {
        return page.screenshot(new Page.ScreenshotOptions().setFullPage(true));
    }

    @Override
    public String pageSource() {
        return page.content();
    }

    @Override
    public String title() {
        return page.title();
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        PlaywrightBrowserAdapter.closeQuietly(page::close);
        PlaywrightBrowserAdapter.closeQuietly(context);
        PlaywrightBrowserAdapter.closeQuietly(browser);
        PlaywrightBrowserAdapter.closeQuietly(playwright);
        log.debug("Playwright session closed");
    }

    private static PlaywrightElement unwrap(BrowserElement element) {
        if (element instanceof PlaywrightElement playwrightElement) {
            return playwrightElement;
        }
        throw new IllegalArgumentException("Element does not belong to a Playwright session");
    }
}
