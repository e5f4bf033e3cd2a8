package me.golemcore.pagepilot.sandbox;

import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.port.outbound.BrowserElement;
import me.golemcore.pagepilot.port.outbound.BrowserPort;
import me.golemcore.pagepilot.port.outbound.BrowserSession;
import me.golemcore.pagepilot.port.outbound.BrowserUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScriptRunnerTest {

    private static final String URL = "https://example.test/login";

    @TempDir
    Path tempDir;

    private BrowserPort browserPort;
    private BrowserSession session;
    private ScriptRunner runner;

    @BeforeEach
    void setUp() {
        browserPort = mock(BrowserPort.class);
        session = mock(BrowserSession.class);
        when(browserPort.open(eq(BrowserBackend.CHROMIUM), any(Duration.class))).thenReturn(session);
        runner = new ScriptRunner(browserPort);
    }

    @Test
    void shouldRunScriptAndCollectOutput() {
        BrowserElement button = mock(BrowserElement.class);
        when(session.title()).thenReturn("Login");
        when(session.findElements("#submit")).thenReturn(List.of(button));
        when(session.screenshot()).thenReturn(new byte[] { 1, 2, 3 });

        SandboxReport report = runner.run(job("chromium"), """
                browser.navigate(url)
                println "Title: ${browser.title()}"
                assert browser.exists('#submit')
                browser.click('#submit')
                browser.screenshot('after login')
                """);

        assertEquals(SandboxStatus.SUCCESS, report.status());
        assertTrue(report.logs().contains("Title: Login"));
        assertEquals(1, report.screenshots().size());
        assertTrue(Files.exists(Path.of(report.screenshots().get(0))));
        assertTrue(report.screenshots().get(0).endsWith("attempt-01-chromium-1-after_login.png"));
        verify(session).navigate(URL);
        verify(session).click(button);
        verify(session).close();
    }

    @Test
    void shouldReportFailedAssertion() {
        when(session.findElements("#missing")).thenReturn(List.of());

        SandboxReport report = runner.run(job("chromium"), "assert browser.exists('#missing')");

        assertEquals(SandboxStatus.FAILURE, report.status());
        assertTrue(report.error().contains("exists"));
        verify(session).close();
    }

    @Test
    void shouldReportScriptExceptions() {
        when(session.findElements("#nope")).thenReturn(List.of());

        SandboxReport report = runner.run(job("chromium"), "browser.click('#nope')");

        assertEquals(SandboxStatus.FAILURE, report.status());
        assertTrue(report.error().contains("No element matches selector: #nope"));
    }

    @Test
    void shouldReportCompilationErrors() {
        SandboxReport report = runner.run(job("chromium"), "def x = ");

        assertEquals(SandboxStatus.FAILURE, report.status());
        assertTrue(report.error().startsWith("MultipleCompilationErrorsException"));
    }

    @Test
    void shouldReportSandboxFailureWhenBrowserCannotStart() {
        when(browserPort.open(eq(BrowserBackend.FIREFOX), any(Duration.class)))
                .thenThrow(new BrowserUnavailableException("Failed to launch firefox: Executable doesn't exist",
                        null));

        SandboxReport report = runner.run(job("firefox"), "println 'never'");

        assertEquals(SandboxStatus.SANDBOX_FAILURE, report.status());
        assertTrue(report.error().contains("Executable doesn't exist"));
    }

    @Test
    void shouldReportSandboxFailureForUnknownBackend() {
        SandboxReport report = runner.run(job("netscape"), "println 'never'");

        assertEquals(SandboxStatus.SANDBOX_FAILURE, report.status());
        verify(browserPort, never()).open(any(), any());
    }

    private SandboxJob job(String backend) {
        Path attempt = tempDir.resolve("attempt-01-" + backend);
        return new SandboxJob(URL, backend, attempt.resolve("script.groovy").toString(),
                attempt.resolve("result.json").toString(), tempDir.resolve("screenshots").toString(), 5000, true,
                "test-agent", 50);
    }
}
