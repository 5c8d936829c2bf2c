package com.delta.autoapply.run.api;

public record StartRunRequest(
    String applyUrl,
    String jobUrl,
    String jobTitle,
    String company,
    String jobDescription,
    String baseResume,
    String resumePath,
    String tailoredOutput,
    Applicant applicant
) {
    /**
     * Per-run applicant answers. Anything left out falls back to the configured defaults.
     */
    public record Applicant(
        String fullName,
        String email,
        String phone,
        String city,
        String state,
        String linkedin,
        String website,
        String github,
        Boolean usCitizen,
        Boolean needsSponsorship,
        Boolean protectedVeteran,
        Boolean hasDisability
    ) {
    }
}
