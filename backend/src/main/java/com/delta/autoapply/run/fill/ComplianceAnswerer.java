package com.delta.autoapply.run.fill;

import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.browser.PageElements;
import com.delta.autoapply.run.model.AnswerIntent;
import com.delta.autoapply.run.model.ApplicantAnswers;
import com.delta.autoapply.run.model.ComplianceQuestion;
import com.delta.autoapply.run.model.TacticOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Answers eligibility questions by locating the question text and choosing among the
 * radio labels, select options or chip buttons in the same container.
 */
@Component
public class ComplianceAnswerer {
    private static final Logger log = LoggerFactory.getLogger(ComplianceAnswerer.class);

    static final String CHOICE_LABELS = "label:has(input[type='radio']),label:has(input[type='checkbox'])";
    static final String SELECTS = "select";
    static final String CHIPS = "button,[role='button'],.chip,.option";

    public Map<ComplianceQuestion, TacticOutcome> answerAll(BrowserPage page, ApplicantAnswers answers) {
        Map<ComplianceQuestion, TacticOutcome> outcomes = new EnumMap<>(ComplianceQuestion.class);
        for (ComplianceQuestion question : ComplianceQuestion.values()) {
            outcomes.put(question, answer(page, question, answers.intentFor(question)));
        }
        return outcomes;
    }

    public TacticOutcome answer(BrowserPage page, ComplianceQuestion question, AnswerIntent intent) {
        TacticOutcome lastError = null;
        for (Pattern pattern : question.questionPatterns()) {
            PageElements questionText = page.byText(pattern);
            if (questionText.count() == 0) {
                continue;
            }
            PageElements container = questionText.nth(0).container();

            TacticOutcome outcome = chooseRadio(container, intent);
            if (outcome.isFound()) {
                return outcome;
            }
            lastError = outcome.kind() == TacticOutcome.Kind.ERROR ? outcome : lastError;

            outcome = chooseSelect(container, intent);
            if (outcome.isFound()) {
                return outcome;
            }
            lastError = outcome.kind() == TacticOutcome.Kind.ERROR ? outcome : lastError;

            outcome = chooseChip(container, intent);
            if (outcome.isFound()) {
                return outcome;
            }
            lastError = outcome.kind() == TacticOutcome.Kind.ERROR ? outcome : lastError;
        }
        if (lastError != null) {
            log.warn("Could not answer {}: {}", question, lastError.detail());
            return lastError;
        }
        return TacticOutcome.notFound(question.name());
    }

    private TacticOutcome chooseRadio(PageElements container, AnswerIntent intent) {
        try {
            PageElements options = container.locate(CHOICE_LABELS);
            int count = options.count();
            if (count == 0) {
                return TacticOutcome.notFound("radio");
            }
            List<String> texts = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                texts.add(options.nth(i).innerText());
            }
            int index = OptionChooser.chooseRadioIndex(texts, intent);
            options.nth(index).click();
            return TacticOutcome.found("radio", texts.get(index).trim());
        } catch (RuntimeException e) {
            log.debug("Radio answer failed: {}", e.getMessage());
            return TacticOutcome.error("radio", e);
        }
    }

    private TacticOutcome chooseSelect(PageElements container, AnswerIntent intent) {
        try {
            PageElements select = container.locate(SELECTS);
            if (select.count() == 0) {
                return TacticOutcome.notFound("select");
            }
            Optional<String> label = OptionChooser.chooseSelectLabel(select.first().optionLabels(), intent);
            if (label.isEmpty()) {
                return TacticOutcome.notFound("select");
            }
            select.first().selectOptionByLabel(label.get());
            return TacticOutcome.found("select", label.get());
        } catch (RuntimeException e) {
            log.debug("Select answer failed: {}", e.getMessage());
            return TacticOutcome.error("select", e);
        }
    }

    private TacticOutcome chooseChip(PageElements container, AnswerIntent intent) {
        try {
            PageElements chips = container.locate(CHIPS);
            int count = chips.count();
            for (int i = 0; i < count; i++) {
                String text = chips.nth(i).innerText();
                if (OptionChooser.chipMatches(text, intent)) {
                    chips.nth(i).click();
                    return TacticOutcome.found("chip", text.trim());
                }
            }
            return TacticOutcome.notFound("chip");
        } catch (RuntimeException e) {
            log.debug("Chip answer failed: {}", e.getMessage());
            return TacticOutcome.error("chip", e);
        }
    }
}
