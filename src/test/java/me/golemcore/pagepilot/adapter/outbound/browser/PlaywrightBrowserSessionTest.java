package me.golemcore.pagepilot.adapter.outbound.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import me.golemcore.pagepilot.port.outbound.BrowserElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlaywrightBrowserSessionTest {

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private Page page;
    private PlaywrightBrowserSession session;

    @BeforeEach
    void setUp() {
        playwright = mock(Playwright.class);
        browser = mock(Browser.class);
        context = mock(BrowserContext.class);
        page = mock(Page.class);
        session = new PlaywrightBrowserSession(playwright, browser, context, page);
    }

    @Test
    void shouldCloseEverythingOnceEvenWhenOneCloseFails() {
        doThrow(new IllegalStateException("Browser has been closed")).when(context).close();

        session.close();
        session.close();

        verify(page, times(1)).close();
        verify(context, times(1)).close();
        verify(browser, times(1)).close();
        verify(playwright, times(1)).close();
    }

    @Test
    void shouldWrapElementHandles() {
        ElementHandle handle = mock(ElementHandle.class);
        when(handle.innerText()).thenReturn("  ");
        when(handle.getAttribute("value")).thenReturn("Sign in");
        when(page.querySelectorAll("input")).thenReturn(List.of(handle));

        List<BrowserElement> elements = session.findElements("input");
        session.typeText(elements.get(0), "student");

        assertEquals("Sign in", elements.get(0).text());
        verify(handle).fill("student");
    }

    @Test
    void shouldRejectForeignElements() {
        BrowserElement foreign = () -> "text";

        assertThrows(IllegalArgumentException.class, () -> session.click(foreign));
    }
}
