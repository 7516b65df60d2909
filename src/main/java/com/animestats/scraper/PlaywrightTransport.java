package com.animestats.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link PageTransport} that renders pages in headless Chromium via Playwright, for
 * markup that is only complete after client-side scripts run.
 * <p>
 * Playwright objects are not thread-safe, so each calling thread lazily gets its own
 * Playwright instance, browser and context. Every request opens and closes a fresh page.
 *
 * @author Anime Stats Scraper Team
 * @since 1.0
 */
public class PlaywrightTransport implements PageTransport {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightTransport.class);

    private final ThreadLocal<Session> sessions = new ThreadLocal<>();
    private final List<Session> allSessions = new CopyOnWriteArrayList<>();

    private record Session(Playwright playwright, Browser browser, BrowserContext context) {
        void close() {
            try { context.close(); } catch (PlaywrightException e) { logger.debug("Failed to close context: {}", e.getMessage()); }
            try { browser.close(); } catch (PlaywrightException e) { logger.debug("Failed to close browser: {}", e.getMessage()); }
            try { playwright.close(); } catch (PlaywrightException e) { logger.debug("Failed to close Playwright: {}", e.getMessage()); }
        }
    }

    @Override
    public TransportResponse get(URI uri, Map<String, String> headers, Duration timeout) throws IOException {
        Page page = null;
        try {
            page = session().context().newPage();
            page.setExtraHTTPHeaders(headers);
            Response response = page.navigate(uri.toString(), new Page.NavigateOptions().setTimeout(timeout.toMillis()));
            page.waitForLoadState(LoadState.DOMCONTENTLOADED, new Page.WaitForLoadStateOptions().setTimeout(timeout.toMillis()));
            int status = response == null ? 200 : response.status();
            String finalUrl = response == null ? page.url() : response.url();
            logger.debug("Rendered {} -> {}", uri, status);
            return new TransportResponse(status, page.content(), finalUrl);
        } catch (TimeoutError e) {
            throw new SocketTimeoutException("Navigation timed out after " + timeout.toMillis() + " ms: " + e.getMessage());
        } catch (PlaywrightException e) {
            throw new IOException("Browser navigation failed: " + e.getMessage(), e);
        } finally {
            if (page != null) {
                try { page.close(); } catch (PlaywrightException e) { logger.debug("Failed to close page: {}", e.getMessage()); }
            }
        }
    }

    private Session session() {
        Session session = sessions.get();
        if (session == null) {
            Playwright playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(launchOptions());
            session = new Session(playwright, browser, browser.newContext(new Browser.NewContextOptions().setLocale("en-US")));
            sessions.set(session);
            allSessions.add(session);
            logger.info("Started headless browser for thread {}", Thread.currentThread().getName());
        }
        return session;
    }

    private static BrowserType.LaunchOptions launchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(true);
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--lang=en-US"
        ));
        return options;
    }

    @Override
    public void close() {
        for (Session session : allSessions) {
            session.close();
        }
        allSessions.clear();
        logger.info("Closed headless browser sessions.");
    }
}
