package com.delta.autoapply.run.tailor;

import com.delta.autoapply.run.model.JobContext;
import com.delta.autoapply.run.model.TailorResult;

import java.util.Map;

/**
 * Produces a job-specific version of the applicant's resume. Implementations never throw;
 * an unavailable model yields a degraded result.
 */
public interface ResumeTailoringClient {
    TailorResult tailor(JobContext job, String baseResume, Map<String, Object> constraints);
}
