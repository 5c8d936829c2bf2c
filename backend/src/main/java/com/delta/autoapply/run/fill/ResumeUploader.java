package com.delta.autoapply.run.fill;

import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.browser.PageElements;
import com.delta.autoapply.run.model.TacticOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Sets the resume on whatever file input the form exposes, trying progressively looser
 * lookups until one takes the file.
 */
@Component
public class ResumeUploader {
    private static final Logger log = LoggerFactory.getLogger(ResumeUploader.class);

    static final String FILE_INPUT = "input[type='file']";
    private static final String BUTTONS = "button, [role='button']";
    private static final Pattern RESUME_WORDS = Pattern.compile("resume|cv", Pattern.CASE_INSENSITIVE);
    private static final Pattern UPLOAD_WORDS = Pattern.compile("upload|attach|resume|cv", Pattern.CASE_INSENSITIVE);
    private static final Duration REVEAL_SETTLE = Duration.ofMillis(300);

    public TacticOutcome upload(BrowserPage page, Path resume) {
        TacticOutcome lastError = null;
        PageElements inputs = page.locate(FILE_INPUT);
        int inputCount = inputs.count();

        TacticOutcome outcome = attempt("labelled-file-input", () -> uploadToLabelledInput(inputs, inputCount, resume));
        if (outcome.isFound()) {
            return outcome;
        }
        lastError = errorOr(outcome, lastError);

        outcome = attempt("label-text", () -> uploadViaLabelText(page, resume));
        if (outcome.isFound()) {
            return outcome;
        }
        lastError = errorOr(outcome, lastError);

        outcome = attempt("reveal-button", () -> uploadAfterReveal(page, resume));
        if (outcome.isFound()) {
            return outcome;
        }
        lastError = errorOr(outcome, lastError);

        if (inputCount > 0) {
            outcome = attempt("first-file-input", () -> {
                inputs.first().setInputFiles(resume);
                return true;
            });
            if (outcome.isFound()) {
                return outcome;
            }
            lastError = errorOr(outcome, lastError);
        }
        return lastError != null ? lastError : TacticOutcome.notFound("resume-upload");
    }

    private boolean uploadToLabelledInput(PageElements inputs, int inputCount, Path resume) {
        for (int i = 0; i < inputCount; i++) {
            PageElements input = inputs.nth(i);
            String labelText = input.labelText();
            if (labelText != null && RESUME_WORDS.matcher(labelText).find()) {
                input.setInputFiles(resume);
                return true;
            }
        }
        return false;
    }

    private boolean uploadViaLabelText(BrowserPage page, Path resume) {
        PageElements labels = page.byText(RESUME_WORDS).enclosingLabel();
        if (labels.count() == 0) {
            return false;
        }
        PageElements fileInput = labels.locate(FILE_INPUT);
        if (fileInput.count() == 0) {
            return false;
        }
        fileInput.first().setInputFiles(resume);
        return true;
    }

    private boolean uploadAfterReveal(BrowserPage page, Path resume) {
        PageElements candidates = page.locate(BUTTONS).withText(UPLOAD_WORDS);
        if (candidates.count() == 0) {
            return false;
        }
        candidates.first().click();
        page.pause(REVEAL_SETTLE);
        PageElements revealed = page.locate(FILE_INPUT);
        if (revealed.count() == 0) {
            return false;
        }
        revealed.first().setInputFiles(resume);
        return true;
    }

    private TacticOutcome attempt(String tactic, Tactic body) {
        try {
            return body.run() ? TacticOutcome.found(tactic, null) : TacticOutcome.notFound(tactic);
        } catch (RuntimeException e) {
            log.debug("Resume tactic {} failed: {}", tactic, e.getMessage());
            return TacticOutcome.error(tactic, e);
        }
    }

    private static TacticOutcome errorOr(TacticOutcome outcome, TacticOutcome previous) {
        return outcome.kind() == TacticOutcome.Kind.ERROR ? outcome : previous;
    }

    @FunctionalInterface
    private interface Tactic {
        boolean run();
    }
}
