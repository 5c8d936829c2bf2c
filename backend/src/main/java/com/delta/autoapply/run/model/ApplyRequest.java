package com.delta.autoapply.run.model;

/**
 * Everything one run needs. {@code tailoredOutput} short-circuits the tailoring call with a
 * result the human already produced elsewhere.
 */
public record ApplyRequest(
    String applyUrl,
    String jobUrl,
    String jobTitle,
    String company,
    String jobDescription,
    String baseResume,
    String resumePath,
    String tailoredOutput,
    ApplicantAnswers applicant
) {
    public String jobUrlOrApplyUrl() {
        return jobUrl == null || jobUrl.isBlank() ? applyUrl : jobUrl;
    }
}
