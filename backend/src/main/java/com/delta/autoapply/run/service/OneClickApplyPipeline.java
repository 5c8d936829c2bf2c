package com.delta.autoapply.run.service;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.auth.AuthenticationGateway;
import com.delta.autoapply.run.browser.BrowserOperationException;
import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.browser.BrowserSession;
import com.delta.autoapply.run.fill.FormFillRouter;
import com.delta.autoapply.run.fill.FormFillStrategy;
import com.delta.autoapply.run.model.ApplicantAnswers;
import com.delta.autoapply.run.model.ApplyRequest;
import com.delta.autoapply.run.model.AuthOutcome;
import com.delta.autoapply.run.model.EventEnvelope;
import com.delta.autoapply.run.model.JobContext;
import com.delta.autoapply.run.model.RunStatus;
import com.delta.autoapply.run.model.TailorResult;
import com.delta.autoapply.run.model.TailoredResume;
import com.delta.autoapply.run.scrape.JobDescriptionScraper;
import com.delta.autoapply.run.tailor.ResumeTailoringClient;
import com.delta.autoapply.run.tailor.TailoredResumeExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

/**
 * One-click tailor and apply: tailor the resume, open the apply page, get past login,
 * prefill, then wait for the human to review and submit.
 */
@Service
public class OneClickApplyPipeline {
    private static final Logger log = LoggerFactory.getLogger(OneClickApplyPipeline.class);

    static final String MANUAL_RESUME_PROMPT =
        "Paste the structured resume JSON as the tailored output and start the run again.";
    static final String REVIEW_PROMPT =
        "Review and submit the application in the browser window, then click Mark Submitted.";

    private final JobDescriptionScraper scraper;
    private final ResumeTailoringClient tailoringClient;
    private final TailoredResumeExtractor extractor;
    private final AuthenticationGateway authenticationGateway;
    private final FormFillRouter formFillRouter;
    private final AutoApplyProperties properties;

    public OneClickApplyPipeline(
        JobDescriptionScraper scraper,
        ResumeTailoringClient tailoringClient,
        TailoredResumeExtractor extractor,
        AuthenticationGateway authenticationGateway,
        FormFillRouter formFillRouter,
        AutoApplyProperties properties
    ) {
        this.scraper = scraper;
        this.tailoringClient = tailoringClient;
        this.extractor = extractor;
        this.authenticationGateway = authenticationGateway;
        this.formFillRouter = formFillRouter;
        this.properties = properties;
    }

    public void run(RunContext run, ApplyRequest request) {
        run.emit(EventEnvelope.info("Starting one-click tailor+apply"));
        BrowserSession session = null;
        try {
            Optional<TailoredResume> tailored = tailor(run, request);
            if (tailored.isEmpty()) {
                run.emit(EventEnvelope.warn("Could not parse structured resume JSON; pausing for manual input"));
                run.emit(EventEnvelope.gate(MANUAL_RESUME_PROMPT));
                run.transition(RunStatus.HALTED);
                return;
            }
            run.emit(EventEnvelope.tailored(tailored.get().keywords()));

            run.transition(RunStatus.AUTHENTICATING);
            session = authenticationGateway.openSession(request.applyUrl());
            BrowserPage page = session.newPage();
            page.navigate(request.applyUrl());
            run.emit(EventEnvelope.info("Opened " + request.applyUrl()));
            screenshot(run, page, run.runId() + ".png");

            AuthOutcome auth = authenticationGateway.authenticate(
                run, session, page, request.applyUrl(), run::signInConfirmed
            );
            log.info("Run {} authentication finished in {} ({})", run.runId(), auth.finalPhase(), auth.provider());

            run.transition(RunStatus.FILLING);
            FormFillStrategy strategy = formFillRouter.resolve(request.applyUrl());
            try {
                formFillRouter.prefill(strategy, page, request.resumePath(), applicantFor(request), run);
            } catch (RuntimeException e) {
                log.warn("Run {} prefill failed", run.runId(), e);
                run.emit(EventEnvelope.warn("ATS prefill error: " + e.getMessage()));
            }

            run.transition(RunStatus.AWAITING_APPROVAL);
            run.emit(EventEnvelope.gate(REVIEW_PROMPT));
            run.gate().await();

            run.transition(RunStatus.FINALIZING);
            screenshot(run, page, run.runId() + "_final.png");
            run.transition(RunStatus.DONE);
            run.emit(EventEnvelope.done(true));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Run {} cancelled", run.runId());
            run.emit(EventEnvelope.warn("Run cancelled"));
            fail(run);
        } catch (RuntimeException e) {
            log.warn("Run {} failed", run.runId(), e);
            run.emit(EventEnvelope.error("Run failed: " + e.getMessage()));
            fail(run);
        } finally {
            closeQuietly(run, session);
        }
    }

    private Optional<TailoredResume> tailor(RunContext run, ApplyRequest request) {
        String output;
        if (request.tailoredOutput() != null && !request.tailoredOutput().isBlank()) {
            run.emit(EventEnvelope.info("Using supplied tailored output"));
            output = request.tailoredOutput();
        } else {
            String description = request.jobDescription();
            if (description == null || description.isBlank()) {
                description = scraper.scrape(request.jobUrlOrApplyUrl());
            }
            JobContext job = new JobContext(
                request.jobTitle(),
                request.company(),
                request.jobUrlOrApplyUrl(),
                description
            );
            TailorResult result = tailoringClient.tailor(job, request.baseResume(), Map.of());
            if (result.degraded()) {
                run.emit(EventEnvelope.warn(result.changesExplanation()));
            }
            output = result.rawOutput();
        }
        return extractor.extract(output);
    }

    private void screenshot(RunContext run, BrowserPage page, String fileName) {
        Path filesDir = Paths.get(properties.getFilesDir());
        try {
            Files.createDirectories(filesDir);
        } catch (IOException e) {
            throw new BrowserOperationException("Cannot create screenshot directory " + filesDir, e);
        }
        page.screenshot(filesDir.resolve(fileName));
        run.emit(EventEnvelope.screenshot("/files/" + fileName));
    }

    private ApplicantAnswers applicantFor(ApplyRequest request) {
        return request.applicant() != null ? request.applicant() : properties.getApplicant().toAnswers();
    }

    private void fail(RunContext run) {
        run.transition(RunStatus.FAILED);
        run.emit(EventEnvelope.done(false));
    }

    private void closeQuietly(RunContext run, BrowserSession session) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("Run {} failed to close browser session", run.runId(), e);
        }
    }
}
