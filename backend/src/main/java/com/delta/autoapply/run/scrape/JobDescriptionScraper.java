package com.delta.autoapply.run.scrape;

import com.delta.autoapply.config.AutoApplyProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Fetches a job posting and reduces it to the plain text handed to resume tailoring.
 */
@Service
public class JobDescriptionScraper {
    private static final Logger log = LoggerFactory.getLogger(JobDescriptionScraper.class);
    private static final String CONTENT_SELECTOR = "main, .content, #content, .job, article";

    private final AutoApplyProperties.Scrape properties;

    public JobDescriptionScraper(AutoApplyProperties properties) {
        this.properties = properties.getScrape();
    }

    /**
     * @return the posting text, or an empty string when the page cannot be fetched
     */
    public String scrape(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            Document document = Jsoup.connect(url)
                .userAgent(properties.getUserAgent())
                .timeout(properties.getTimeoutMs())
                .get();
            return extractText(document, properties.getMaxChars());
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to fetch job description from {}: {}", url, e.getMessage());
            return "";
        }
    }

    static String extractText(Document document, int maxChars) {
        Element content = document.selectFirst(CONTENT_SELECTOR);
        Element source = content != null ? content : document.body();
        if (source == null) {
            return "";
        }
        String text = source.text().replaceAll("\\s+", " ").trim();
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}
