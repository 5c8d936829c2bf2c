package com.delta.autoapply.run.scrape;

import com.delta.autoapply.config.AutoApplyProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobDescriptionScraperTest {
    private MockWebServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void prefersMainContentAndSendsUserAgent() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html")
            .setBody("<html><body><nav>Home Careers</nav><main><h1>Backend Engineer</h1>"
                + "<p>Build   services\n in Java.</p></main><footer>Footer</footer></body></html>"));
        server.start();

        AutoApplyProperties properties = new AutoApplyProperties();
        properties.getScrape().setUserAgent("auto-apply-test/1.0");
        JobDescriptionScraper scraper = new JobDescriptionScraper(properties);

        String text = scraper.scrape(server.url("/jobs/1").toString());

        assertThat(text).isEqualTo("Backend Engineer Build services in Java.");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo("auto-apply-test/1.0");
    }

    @Test
    void fetchFailureYieldsEmptyText() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404).setBody("gone"));
        server.start();

        JobDescriptionScraper scraper = new JobDescriptionScraper(new AutoApplyProperties());

        assertThat(scraper.scrape(server.url("/missing").toString())).isEmpty();
        assertThat(scraper.scrape("not a url")).isEmpty();
        assertThat(scraper.scrape(null)).isEmpty();
    }

    @Test
    void fallsBackToBodyAndTruncates() {
        String html = "<html><body><div>Senior   Data Engineer role</div></body></html>";

        assertThat(JobDescriptionScraper.extractText(Jsoup.parse(html), 1000)).isEqualTo("Senior Data Engineer role");
        assertThat(JobDescriptionScraper.extractText(Jsoup.parse(html), 6)).isEqualTo("Senior");
    }
}
