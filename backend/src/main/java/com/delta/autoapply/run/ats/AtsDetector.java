package com.delta.autoapply.run.ats;

import com.delta.autoapply.run.model.AtsType;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

@Component
public class AtsDetector {
    public AtsType detect(String url) {
        String host = hostOf(url);
        if (host == null) {
            return AtsType.UNKNOWN;
        }

        if (host.contains("myworkdayjobs.com") || host.contains(".wd")) {
            return AtsType.WORKDAY;
        }
        if (host.contains("taleo.net") || host.contains("oraclecloud")) {
            return AtsType.TALEO;
        }
        if (host.contains("icims.com")) {
            return AtsType.ICIMS;
        }
        if (host.contains("lever.co")) {
            return AtsType.LEVER;
        }
        if (host.contains("greenhouse.io")) {
            return AtsType.GREENHOUSE;
        }
        if (host.contains("ashbyhq.com")) {
            return AtsType.ASHBY;
        }
        return AtsType.UNKNOWN;
    }

    /**
     * Lower-cased host of the URL, tolerating a missing scheme. {@code null} when none can be found.
     */
    public static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getHost() != null) {
                return uri.getHost().toLowerCase(Locale.ROOT);
            }
            URI withHttps = new URI("https://" + url.trim());
            return withHttps.getHost() == null ? null : withHttps.getHost().toLowerCase(Locale.ROOT);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
