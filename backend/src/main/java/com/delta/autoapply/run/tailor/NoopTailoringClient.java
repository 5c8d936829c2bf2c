package com.delta.autoapply.run.tailor;

import com.delta.autoapply.run.model.JobContext;
import com.delta.autoapply.run.model.TailorResult;

import java.util.Map;

public class NoopTailoringClient implements ResumeTailoringClient {

    @Override
    public TailorResult tailor(JobContext job, String baseResume, Map<String, Object> constraints) {
        return TailorResult.fallback("no tailoring provider configured");
    }
}
