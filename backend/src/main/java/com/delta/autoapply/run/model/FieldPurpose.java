package com.delta.autoapply.run.model;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Logical profile fields looked up on application forms, in fill order.
 */
public enum FieldPurpose {
    FULL_NAME(false, "full\\s*name", "legal\\s*name"),
    FIRST_NAME(false, "first\\s*name"),
    LAST_NAME(false, "last\\s*name"),
    EMAIL(false, "email"),
    PHONE(false, "phone"),
    CITY(false, "city|town"),
    STATE(false, "state|province|region"),
    LINKEDIN(true, "linkedin"),
    WEBSITE(true, "website|portfolio|personal\\s*site"),
    GITHUB(true, "github");

    private final boolean optional;
    private final List<Pattern> labelPatterns;

    FieldPurpose(boolean optional, String... labelRegexes) {
        this.optional = optional;
        this.labelPatterns = Arrays.stream(labelRegexes)
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();
    }

    public boolean isOptional() {
        return optional;
    }

    public List<Pattern> labelPatterns() {
        return labelPatterns;
    }
}
