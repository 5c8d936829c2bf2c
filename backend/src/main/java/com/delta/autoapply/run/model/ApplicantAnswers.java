package com.delta.autoapply.run.model;

/**
 * Answers supplied once per run. First and last name fall back to the first and last
 * token of the full name when not given.
 */
public record ApplicantAnswers(
    String fullName,
    String firstName,
    String lastName,
    String email,
    String phone,
    String city,
    String state,
    String linkedin,
    String website,
    String github,
    boolean usCitizen,
    boolean needsSponsorship,
    boolean protectedVeteran,
    boolean hasDisability
) {
    public ApplicantAnswers {
        fullName = clean(fullName);
        String[] tokens = fullName.isEmpty() ? new String[0] : fullName.split("\\s+");
        firstName = clean(firstName).isEmpty() && tokens.length > 0 ? tokens[0] : clean(firstName);
        lastName = clean(lastName).isEmpty() && tokens.length > 0 ? tokens[tokens.length - 1] : clean(lastName);
        email = clean(email);
        phone = clean(phone);
        city = clean(city);
        state = clean(state);
        linkedin = blankToNull(linkedin);
        website = blankToNull(website);
        github = blankToNull(github);
    }

    public static ApplicantAnswers of(
        String fullName,
        String email,
        String phone,
        String city,
        String state,
        String linkedin,
        String website,
        String github,
        boolean usCitizen,
        boolean needsSponsorship,
        boolean protectedVeteran,
        boolean hasDisability
    ) {
        return new ApplicantAnswers(
            fullName,
            null,
            null,
            email,
            phone,
            city,
            state,
            linkedin,
            website,
            github,
            usCitizen,
            needsSponsorship,
            protectedVeteran,
            hasDisability
        );
    }

    /**
     * Value to type into the field, or an empty string when the applicant has none.
     */
    public String valueFor(FieldPurpose purpose) {
        String value = switch (purpose) {
            case FULL_NAME -> fullName;
            case FIRST_NAME -> firstName;
            case LAST_NAME -> lastName;
            case EMAIL -> email;
            case PHONE -> phone;
            case CITY -> city;
            case STATE -> state;
            case LINKEDIN -> linkedin;
            case WEBSITE -> website;
            case GITHUB -> github;
        };
        return value == null ? "" : value;
    }

    public AnswerIntent intentFor(ComplianceQuestion question) {
        return switch (question) {
            case WORK_AUTHORIZATION -> AnswerIntent.of(usCitizen);
            case SPONSORSHIP -> AnswerIntent.of(needsSponsorship);
            case VETERAN_STATUS -> AnswerIntent.of(protectedVeteran);
            case DISABILITY_STATUS -> AnswerIntent.of(hasDisability);
        };
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
