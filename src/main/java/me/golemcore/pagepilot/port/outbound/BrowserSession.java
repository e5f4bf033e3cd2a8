package me.golemcore.pagepilot.port.outbound;

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

import java.util.List;

/**
 * Live browser page. All operations may throw unchecked exceptions from the
 * underlying driver; {@link #close()} never does and is safe to call more than
 * once.
 */
public interface BrowserSession extends AutoCloseable {

    void navigate(String url);

    List<BrowserElement> findElements(String selector);

    /**
     * @return the attribute value, or {@code null} when absent
     */
    String elementAttribute(BrowserElement element, String name);

    void click(BrowserElement element);

    void typeText(BrowserElement element, String text);

    /**
     * @return PNG bytes of the full page
     */
    byte[] screenshot();

    /**
     * @return serialized DOM of the current page
     */
    String pageSource();

    String title();

    String currentUrl();

    @Override
    void close();
}
