package com.delta.autoapply.run.model;

import java.util.Map;

/**
 * What a prefill pass managed to do. {@code resumeUpload} is null when no resume file was
 * available to upload.
 */
public record PrefillReport(
    String strategy,
    Map<FieldPurpose, TacticOutcome> fields,
    TacticOutcome resumeUpload,
    Map<ComplianceQuestion, TacticOutcome> compliance
) {
    public PrefillReport {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
        compliance = compliance == null ? Map.of() : Map.copyOf(compliance);
    }

    public long filledFieldCount() {
        return fields.values().stream().filter(TacticOutcome::isFound).count();
    }

    public long answeredQuestionCount() {
        return compliance.values().stream().filter(TacticOutcome::isFound).count();
    }

    public boolean resumeUploaded() {
        return resumeUpload != null && resumeUpload.isFound();
    }
}
