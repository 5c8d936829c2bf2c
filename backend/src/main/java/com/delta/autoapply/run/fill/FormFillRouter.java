package com.delta.autoapply.run.fill;

import com.delta.autoapply.run.browser.BrowserPage;
import com.delta.autoapply.run.events.RunEventSink;
import com.delta.autoapply.run.model.ApplicantAnswers;
import com.delta.autoapply.run.model.ComplianceQuestion;
import com.delta.autoapply.run.model.EventEnvelope;
import com.delta.autoapply.run.model.FieldPurpose;
import com.delta.autoapply.run.model.PrefillReport;
import com.delta.autoapply.run.model.TacticOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

@Service
public class FormFillRouter {
    private static final Logger log = LoggerFactory.getLogger(FormFillRouter.class);

    private final ProfileFieldFiller fieldFiller;
    private final ResumeUploader resumeUploader;
    private final ComplianceAnswerer complianceAnswerer;

    public FormFillRouter(
        ProfileFieldFiller fieldFiller,
        ResumeUploader resumeUploader,
        ComplianceAnswerer complianceAnswerer
    ) {
        this.fieldFiller = fieldFiller;
        this.resumeUploader = resumeUploader;
        this.complianceAnswerer = complianceAnswerer;
    }

    public FormFillStrategy resolve(String url) {
        for (FormFillStrategy strategy : FormFillStrategy.values()) {
            if (strategy.matches(url)) {
                return strategy;
            }
        }
        return FormFillStrategy.GENERIC;
    }

    /**
     * Best-effort prefill of the visible step. Individual misses are reported, never thrown.
     */
    public PrefillReport prefill(
        FormFillStrategy strategy,
        BrowserPage page,
        String resumePath,
        ApplicantAnswers answers,
        RunEventSink run
    ) {
        run.emit(EventEnvelope.info(strategy.detectionMessage()));

        Map<FieldPurpose, TacticOutcome> fields = fieldFiller.fillAll(page, answers);

        TacticOutcome upload = null;
        Path resume = resumePath == null || resumePath.isBlank() ? null : Paths.get(resumePath);
        if (resume != null && Files.isRegularFile(resume)) {
            upload = resumeUploader.upload(page, resume);
            run.emit(EventEnvelope.info("Resume upload " + (upload.isFound() ? "OK" : "not found")));
        } else if (resume != null) {
            log.debug("Run {} resume {} does not exist, skipping upload", run.runId(), resume);
        }

        Map<ComplianceQuestion, TacticOutcome> compliance = complianceAnswerer.answerAll(page, answers);

        PrefillReport report = new PrefillReport(strategy.name(), fields, upload, compliance);
        log.info(
            "Run {} prefill via {}: fields={}/{} resume={} compliance={}/{}",
            run.runId(),
            strategy,
            report.filledFieldCount(),
            fields.size(),
            report.resumeUploaded(),
            report.answeredQuestionCount(),
            compliance.size()
        );
        run.emit(EventEnvelope.info("Prefill complete, pausing for human review."));
        return report;
    }
}
