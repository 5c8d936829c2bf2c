package com.delta.autoapply.run.fill;

import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.browser.PageElements;
import com.delta.autoapply.run.model.ApplicantAnswers;
import com.delta.autoapply.run.model.FieldMatch;
import com.delta.autoapply.run.model.FieldPurpose;
import com.delta.autoapply.run.model.TacticOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class ProfileFieldFiller {
    private static final Logger log = LoggerFactory.getLogger(ProfileFieldFiller.class);

    static final String TEXT_INPUTS = "input[type='text'],input[type='email'],input[type='tel'],textarea";
    private static final int MAX_TEXT_NODES = 5;

    public Map<FieldPurpose, TacticOutcome> fillAll(BrowserPage page, ApplicantAnswers answers) {
        Map<FieldPurpose, TacticOutcome> outcomes = new EnumMap<>(FieldPurpose.class);
        for (FieldPurpose purpose : FieldPurpose.values()) {
            String value = answers.valueFor(purpose);
            if (value.isEmpty()) {
                continue;
            }
            outcomes.put(purpose, fill(page, purpose, value));
        }
        return outcomes;
    }

    public TacticOutcome fill(BrowserPage page, FieldPurpose purpose, String value) {
        if (value == null || value.isEmpty()) {
            return TacticOutcome.notFound("empty-value");
        }
        TacticOutcome lastError = null;
        for (Pattern pattern : purpose.labelPatterns()) {
            PageElements labelled = page.byLabel(pattern);
            if (labelled.count() > 0) {
                TacticOutcome outcome = attempt(new FieldMatch(purpose, labelled.first(), "label"), value);
                if (outcome.isFound()) {
                    return outcome;
                }
                lastError = outcome;
            }
        }
        // Text-proximity lookups only run once every label association has missed.
        for (Pattern pattern : purpose.labelPatterns()) {
            PageElements textNodes = page.byText(pattern);
            int limit = Math.min(textNodes.count(), MAX_TEXT_NODES);
            for (int i = 0; i < limit; i++) {
                PageElements inputs = textNodes.nth(i).container().locate(TEXT_INPUTS);
                if (inputs.count() > 0) {
                    TacticOutcome outcome = attempt(new FieldMatch(purpose, inputs.first(), "text-proximity"), value);
                    if (outcome.isFound()) {
                        return outcome;
                    }
                    lastError = outcome;
                }
            }
        }
        return lastError != null ? lastError : TacticOutcome.notFound(purpose.name());
    }

    private TacticOutcome attempt(FieldMatch match, String value) {
        try {
            match.control().fill(value);
            return TacticOutcome.found(match.locatedBy(), match.purpose().name());
        } catch (RuntimeException e) {
            log.debug("Filling {} via {} failed: {}", match.purpose(), match.locatedBy(), e.getMessage());
            return TacticOutcome.error(match.locatedBy(), e);
        }
    }
}
