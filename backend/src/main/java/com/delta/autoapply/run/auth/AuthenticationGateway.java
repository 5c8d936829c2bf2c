package com.delta.autoapply.run.auth;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.ats.AtsDetector;
import com.delta.autoapply.run.browser.BrowserDriver;
import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.browser.BrowserSession;
import com.delta.autoapply.run.events.RunEventSink;
import com.delta.autoapply.run.model.AuthOutcome;
import com.delta.autoapply.run.model.AuthPhase;
import com.delta.autoapply.run.model.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Gets a run past login walls. Tries the guest path first, then hands control to the
 * human and polls the page until it looks like an application form.
 */
@Service
public class AuthenticationGateway {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationGateway.class);

    static final String MANUAL_AUTH_INSTRUCTIONS =
        "Please sign in or create an account in the browser window. Complete any 2FA or SSO. "
            + "When you land on the application form, click 'I'm signed in' in the UI.";

    private final AuthStateStore stateStore;
    private final LoginWallDetector detector;
    private final AtsDetector atsDetector;
    private final BrowserDriver browserDriver;
    private final AutoApplyProperties.Auth properties;

    public AuthenticationGateway(
        AuthStateStore stateStore,
        LoginWallDetector detector,
        AtsDetector atsDetector,
        BrowserDriver browserDriver,
        AutoApplyProperties properties
    ) {
        this.stateStore = stateStore;
        this.detector = detector;
        this.atsDetector = atsDetector;
        this.browserDriver = browserDriver;
        this.properties = properties.getAuth();
    }

    /**
     * Opens a browser session seeded with whatever state was saved for the URL's host.
     */
    public BrowserSession openSession(String url) {
        Optional<Path> state = stateStore.load(url);
        state.ifPresent(path -> log.info("Reusing auth state {} for {}", path, AtsDetector.hostOf(url)));
        return browserDriver.open(state.orElse(null));
    }

    /**
     * Runs the wall / guest / manual-login sequence on a page already navigated to the
     * apply URL. Never fails on an unrecognised page; the outcome says how far it got.
     * {@code signInConfirmed} reports the human's "I'm signed in" click and ends the
     * manual-login wait even when the page heuristics disagree.
     */
    public AuthOutcome authenticate(
        RunEventSink run,
        BrowserSession session,
        BrowserPage page,
        String applyUrl,
        BooleanSupplier signInConfirmed
    ) throws InterruptedException {
        List<AuthPhase> transitions = new ArrayList<>();
        transitions.add(AuthPhase.INITIAL);
        String provider = atsDetector.detect(page.url()).providerName();

        if (detector.looksLikeLoginWall(page)) {
            transitions.add(AuthPhase.LOGIN_WALL_DETECTED);
            log.info("Run {} hit a {} login wall at {}", run.runId(), provider, page.url());
            if (detector.tryContinueAsGuest(page)) {
                transitions.add(AuthPhase.GUEST_ATTEMPTED);
                run.emit(EventEnvelope.info("Clicked 'Continue as guest'"));
                page.waitForLoad();
            }
            if (detector.looksLikeLoginWall(page)) {
                transitions.add(AuthPhase.AWAITING_MANUAL_AUTH);
                run.emit(EventEnvelope.authGate(provider, page.url(), MANUAL_AUTH_INSTRUCTIONS));
                BoundedPoller poller = new BoundedPoller(
                    Duration.ofMillis(properties.getPollIntervalMs()),
                    properties.getMaxPollAttempts()
                );
                boolean ready = poller.pollUntil(
                    () -> signInConfirmed.getAsBoolean() || detector.applicationReady(page)
                );
                log.info("Run {} manual auth poll finished (ready={})", run.runId(), ready);
            }
        }

        String host = AtsDetector.hostOf(applyUrl);
        if (signInConfirmed.getAsBoolean() || detector.applicationReady(page)) {
            transitions.add(AuthPhase.READY);
            boolean saved = stateStore.save(session, applyUrl);
            run.emit(EventEnvelope.info(saved
                ? "Authenticated on " + host + "; session state saved."
                : "Authenticated on " + host + "; session state could not be saved."));
            return new AuthOutcome(AuthPhase.READY, transitions, provider, saved);
        }

        transitions.add(AuthPhase.UNCONFIRMED);
        run.emit(EventEnvelope.warn("Still on login. Complete the remaining steps or click 'I'm signed in'."));
        log.warn("Run {} could not confirm authentication on {}", run.runId(), host);
        return new AuthOutcome(AuthPhase.UNCONFIRMED, transitions, provider, false);
    }
}
