package com.delta.autoapply.run.fill;

import com.delta.autoapply.run.browser.FakeBrowserPage;
import com.delta.autoapply.run.browser.FakeElement;
import com.delta.autoapply.run.events.RunEventSink;
import com.delta.autoapply.run.model.ApplicantAnswers;
import com.delta.autoapply.run.model.EventEnvelope;
import com.delta.autoapply.run.model.FieldPurpose;
import com.delta.autoapply.run.model.PrefillReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class FormFillRouterTest {
    private final FormFillRouter router = new FormFillRouter(
        new ProfileFieldFiller(),
        new ResumeUploader(),
        new ComplianceAnswerer()
    );

    @Test
    void resolvesVendorStrategies() {
        assertEquals(FormFillStrategy.GREENHOUSE, router.resolve("https://boards.greenhouse.io/acme/jobs/1"));
        assertEquals(FormFillStrategy.LEVER, router.resolve("https://jobs.lever.co/acme/abc/apply"));
        assertEquals(FormFillStrategy.WORKDAY, router.resolve("https://acme.wd5.myworkdayjobs.com/en-US/External/apply"));
        assertEquals(FormFillStrategy.ASHBY, router.resolve("https://jobs.ashbyhq.com/acme/123/application"));
    }

    @Test
    void fallsBackToGenericForEveryOtherInput() {
        assertEquals(FormFillStrategy.GENERIC, router.resolve("https://careers.example.com/apply"));
        assertEquals(FormFillStrategy.GENERIC, router.resolve(""));
        assertEquals(FormFillStrategy.GENERIC, router.resolve(null));
        assertEquals(FormFillStrategy.GENERIC, router.resolve("not a url at all %%%"));
    }

    @Test
    void resolutionIsDeterministic() {
        String url = "https://boards.greenhouse.io/acme/jobs/1";
        FormFillStrategy first = router.resolve(url);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, router.resolve(url));
        }
    }

    @Test
    void genericMatchesEverything() {
        assertThat(FormFillStrategy.GENERIC.matches(null)).isTrue();
        assertThat(FormFillStrategy.GENERIC.matches("https://example.com")).isTrue();
    }

    @Test
    void prefillFillsFieldsUploadsResumeAndReportsProgress(@TempDir Path tempDir) throws Exception {
        Path resume = Files.writeString(tempDir.resolve("resume.pdf"), "pdf");
        FakeElement email = FakeElement.of("").labelled("Email");
        FakeElement fileInput = FakeElement.of("").labelled("Resume/CV");
        FakeBrowserPage page = new FakeBrowserPage("https://boards.greenhouse.io/acme/jobs/1")
            .addLabelled(email)
            .add(ResumeUploader.FILE_INPUT, fileInput);
        RecordingSink sink = new RecordingSink();

        PrefillReport report = router.prefill(
            FormFillStrategy.GREENHOUSE,
            page,
            resume.toString(),
            ApplicantAnswers.of("Ada Lovelace", "ada@example.com", "", "", "", null, null, null, true, false, false, false),
            sink
        );

        assertThat(email.filledValue()).isEqualTo("ada@example.com");
        assertThat(fileInput.uploadedFile()).isEqualTo(resume);
        assertThat(report.resumeUploaded()).isTrue();
        assertThat(report.fields().get(FieldPurpose.EMAIL).isFound()).isTrue();
        assertThat(report.fields()).doesNotContainKey(FieldPurpose.PHONE);
        assertThat(sink.messages()).containsExactly(
            "Detected Greenhouse",
            "Resume upload OK",
            "Prefill complete, pausing for human review."
        );
    }

    @Test
    void prefillSkipsUploadWhenResumeFileIsMissing() {
        FakeBrowserPage page = new FakeBrowserPage("https://careers.example.com/apply");
        RecordingSink sink = new RecordingSink();

        PrefillReport report = router.prefill(
            FormFillStrategy.GENERIC,
            page,
            "/definitely/not/here.pdf",
            ApplicantAnswers.of("", "", "", "", "", null, null, null, true, false, false, false),
            sink
        );

        assertThat(report.resumeUpload()).isNull();
        assertThat(sink.messages()).containsExactly(
            "Unknown ATS, using generic strategy",
            "Prefill complete, pausing for human review."
        );
    }

    static class RecordingSink implements RunEventSink {
        final List<EventEnvelope> events = new ArrayList<>();

        @Override
        public String runId() {
            return "run-test";
        }

        @Override
        public void emit(EventEnvelope envelope) {
            events.add(envelope);
        }

        List<String> messages() {
            return events.stream().map(EventEnvelope::message).toList();
        }
    }
}
