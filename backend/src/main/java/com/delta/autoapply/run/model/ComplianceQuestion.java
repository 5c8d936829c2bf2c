package com.delta.autoapply.run.model;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * US eligibility and self-identification questions answered on most ATS forms.
 */
public enum ComplianceQuestion {
    WORK_AUTHORIZATION(
        "(are you|i am).*(authorized|legally authorized).*work.*united states",
        "work authorization",
        "authorized to work in the us"
    ),
    SPONSORSHIP(
        "(require|need).*(visa|sponsorship).*(now|future)?",
        "will you now or in the future require sponsorship"
    ),
    VETERAN_STATUS("(protected\\s*veteran|veteran\\s*status)"),
    DISABILITY_STATUS("(disability|disabled)", "cc-?305", "ofccp");

    private final List<Pattern> questionPatterns;

    ComplianceQuestion(String... regexes) {
        this.questionPatterns = Arrays.stream(regexes)
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();
    }

    public List<Pattern> questionPatterns() {
        return questionPatterns;
    }
}
