package com.delta.autoapply.run.auth;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.browser.ElementRole;
import com.delta.autoapply.run.browser.PageElements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * DOM heuristics that tell a login or signup wall apart from an application form.
 */
@Component
public class LoginWallDetector {
    private static final Logger log = LoggerFactory.getLogger(LoginWallDetector.class);

    static final String PASSWORD_INPUT = "input[type='password']";
    static final String FILE_INPUT = "input[type='file']";
    private static final Pattern LOGIN_WORDS = Pattern.compile(
        "(sign\\s*in|log\\s*in|create\\s*account|new\\s*user|returning\\s*user|register)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern GUEST = Pattern.compile("(apply|continue)\\s+as\\s+guest", Pattern.CASE_INSENSITIVE);
    private static final Pattern UPLOAD_RESUME = Pattern.compile("(upload|attach).*(resume|cv)", Pattern.CASE_INSENSITIVE);
    private static final Pattern APPLICATION_BUTTON = Pattern.compile("(submit|apply|next)", Pattern.CASE_INSENSITIVE);

    private final Duration guestSettle;

    public LoginWallDetector(AutoApplyProperties properties) {
        this.guestSettle = Duration.ofMillis(properties.getAuth().getGuestSettleMs());
    }

    public boolean looksLikeLoginWall(BrowserPage page) {
        if (page.locate(PASSWORD_INPUT).count() > 0) {
            return true;
        }
        if (page.byText(LOGIN_WORDS).count() > 0) {
            return true;
        }
        return isProviderLoginRoute(page.url());
    }

    /**
     * Clicks an "apply as guest" style control when the portal offers one.
     *
     * @return true when a control was clicked
     */
    public boolean tryContinueAsGuest(BrowserPage page) {
        PageElements buttons = page.byRole(ElementRole.BUTTON, null).withText(GUEST);
        if (buttons.count() > 0) {
            return clickAndSettle(page, buttons, "button");
        }
        PageElements links = page.byText(GUEST);
        if (links.count() > 0) {
            return clickAndSettle(page, links, "text");
        }
        return false;
    }

    /**
     * Loose readiness signal: a "Next" button on a multi-step login page also counts.
     */
    public boolean applicationReady(BrowserPage page) {
        if (page.locate(FILE_INPUT).count() > 0) {
            return true;
        }
        if (page.byText(UPLOAD_RESUME).count() > 0) {
            return true;
        }
        return page.byRole(ElementRole.BUTTON, APPLICATION_BUTTON).count() > 0;
    }

    static boolean isProviderLoginRoute(String url) {
        if (url == null) {
            return false;
        }
        if (url.contains("taleo.net/careersection/iam/accessmanagement")) {
            return true;
        }
        if (url.contains("icims") && (url.contains("login") || url.contains("profile.ftl"))) {
            return true;
        }
        return url.contains("myworkdayjobs.com") && url.contains("SignIn");
    }

    private boolean clickAndSettle(BrowserPage page, PageElements control, String kind) {
        try {
            control.first().click();
            page.pause(guestSettle);
            return true;
        } catch (RuntimeException e) {
            log.debug("Guest {} click failed: {}", kind, e.getMessage());
            return false;
        }
    }
}
