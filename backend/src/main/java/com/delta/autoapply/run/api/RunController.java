package com.delta.autoapply.run.api;

import com.delta.autoapply.config.AutoApplyProperties;
import com.delta.autoapply.run.events.EventFrames;
import com.delta.autoapply.run.events.RunEventSubscription;
import com.delta.autoapply.run.model.ApplicantAnswers;
import com.delta.autoapply.run.model.ApplyRequest;
import com.delta.autoapply.run.model.EventEnvelope;
import com.delta.autoapply.run.model.RunStatusResponse;
import com.delta.autoapply.run.model.StartRunResponse;
import com.delta.autoapply.run.service.ApplicationRunService;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/runs")
public class RunController {
    private static final Duration KEEP_ALIVE_INTERVAL = Duration.ofSeconds(15);

    private final ApplicationRunService runService;
    private final EventFrames eventFrames;
    private final AutoApplyProperties properties;

    public RunController(ApplicationRunService runService, EventFrames eventFrames, AutoApplyProperties properties) {
        this.runService = runService;
        this.eventFrames = eventFrames;
        this.properties = properties;
    }

    @PostMapping
    public StartRunResponse startRun(@RequestBody(required = false) StartRunRequest request) {
        if (request == null || request.applyUrl() == null || request.applyUrl().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "applyUrl is required");
        }
        return runService.start(toApplyRequest(request));
    }

    @GetMapping("/{runId}")
    public RunStatusResponse getRun(@PathVariable("runId") String runId) {
        return runService.status(runId);
    }

    @PostMapping("/{runId}/continue")
    public Map<String, Object> continueRun(@PathVariable("runId") String runId) {
        runService.signalGate(runId);
        return Map.of("ok", true);
    }

    @PostMapping("/{runId}/cancel")
    public RunStatusResponse cancelRun(@PathVariable("runId") String runId) {
        return runService.cancel(runId);
    }

    @GetMapping(value = "/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<StreamingResponseBody> streamEvents(@PathVariable("runId") String runId) {
        RunEventSubscription subscription = runService.events(runId);
        StreamingResponseBody body = out -> {
            try (subscription) {
                out.write(eventFrames.toFrameBytes(EventEnvelope.info("connected")));
                out.flush();
                while (!subscription.isFinished()) {
                    Optional<EventEnvelope> next = subscription.next(KEEP_ALIVE_INTERVAL);
                    if (next.isPresent()) {
                        out.write(eventFrames.toFrameBytes(next.get()));
                    } else if (subscription.isFinished()) {
                        break;
                    } else {
                        out.write(eventFrames.keepAliveBytes());
                    }
                    out.flush();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        return ResponseEntity.ok()
            .contentType(MediaType.TEXT_EVENT_STREAM)
            .cacheControl(CacheControl.noCache())
            .header("X-Accel-Buffering", "no")
            .body(body);
    }

    private ApplyRequest toApplyRequest(StartRunRequest request) {
        return new ApplyRequest(
            request.applyUrl().trim(),
            request.jobUrl(),
            request.jobTitle(),
            request.company(),
            request.jobDescription(),
            request.baseResume(),
            request.resumePath(),
            request.tailoredOutput(),
            toAnswers(request.applicant())
        );
    }

    private ApplicantAnswers toAnswers(StartRunRequest.Applicant applicant) {
        AutoApplyProperties.Applicant defaults = properties.getApplicant();
        if (applicant == null) {
            return defaults.toAnswers();
        }
        return ApplicantAnswers.of(
            firstNonBlank(applicant.fullName(), defaults.getFullName()),
            firstNonBlank(applicant.email(), defaults.getEmail()),
            firstNonBlank(applicant.phone(), defaults.getPhone()),
            firstNonBlank(applicant.city(), defaults.getCity()),
            firstNonBlank(applicant.state(), defaults.getState()),
            firstNonBlank(applicant.linkedin(), defaults.getLinkedin()),
            firstNonBlank(applicant.website(), defaults.getWebsite()),
            firstNonBlank(applicant.github(), defaults.getGithub()),
            applicant.usCitizen() == null ? defaults.isUsCitizen() : applicant.usCitizen(),
            applicant.needsSponsorship() == null ? defaults.isNeedsSponsorship() : applicant.needsSponsorship(),
            applicant.protectedVeteran() == null ? defaults.isProtectedVeteran() : applicant.protectedVeteran(),
            applicant.hasDisability() == null ? defaults.isHasDisability() : applicant.hasDisability()
        );
    }

    private static String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
