package com.llmcommittee.controller;

import com.llmcommittee.config.CommitteeJudgeProperties;
import com.llmcommittee.config.CommitteeRuntimeProperties;
import com.llmcommittee.dto.CommitteeRequests;
import com.llmcommittee.dto.CommitteeResponses;
import com.llmcommittee.mapper.CommitteeMapper;
import com.llmcommittee.model.CommitteeEvaluation;
import com.llmcommittee.service.CommitteeOrchestrator;
import com.llmcommittee.service.CommitteeRun;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.ExecutorService;

@RestController
@RequestMapping("/api/committee")
public class CommitteeController {

    private static final Logger log = LoggerFactory.getLogger(CommitteeController.class);

    private final CommitteeOrchestrator committeeOrchestrator;
    private final CommitteeMapper committeeMapper;
    private final ExecutorService committeeDispatchExecutor;
    private final CommitteeRuntimeProperties committeeRuntimeProperties;
    private final CommitteeJudgeProperties committeeJudgeProperties;
    private final String applicationName;

    public CommitteeController(
            CommitteeOrchestrator committeeOrchestrator,
            CommitteeMapper committeeMapper,
            ExecutorService committeeDispatchExecutor,
            CommitteeRuntimeProperties committeeRuntimeProperties,
            CommitteeJudgeProperties committeeJudgeProperties,
            @Value("${spring.application.name:llm-committee}") String applicationName
    ) {
        this.committeeOrchestrator = committeeOrchestrator;
        this.committeeMapper = committeeMapper;
        this.committeeDispatchExecutor = committeeDispatchExecutor;
        this.committeeRuntimeProperties = committeeRuntimeProperties;
        this.committeeJudgeProperties = committeeJudgeProperties;
        this.applicationName = applicationName;
    }

    /**
     * Streams committee output as server-sent events. An invalid committee is answered with status
     * 400 and a single error event.
     */
    @PostMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamCommittee(@RequestBody CommitteeRequests.StreamCommitteeRequest request) {
        SseEmitter emitter = new SseEmitter(committeeRuntimeProperties.getStream().getEmitterTimeoutMs());
        CommitteeRun run;
        try {
            run = committeeOrchestrator.startStream(request.prompt(), request.backendIds());
        } catch (IllegalArgumentException ex) {
            log.info("Rejected committee stream: {}", ex.getMessage());
            send(emitter, committeeMapper.toStreamError(ex.getMessage()));
            emitter.complete();
            return ResponseEntity.badRequest().body(emitter);
        }

        // Cancel open backend calls if the SSE connection times out or the client disconnects.
        emitter.onTimeout(run::cancel);
        emitter.onError(ex -> run.cancel());

        committeeDispatchExecutor.execute(() -> {
            try {
                run.drain(event -> send(emitter, committeeMapper.toStreamChunk(event)));
                emitter.complete();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                run.cancel();
                emitter.completeWithError(ex);
            } catch (UncheckedIOException | IllegalStateException ex) {
                log.debug("Committee stream closed before completion: {}", ex.getMessage());
                run.cancel();
                emitter.completeWithError(ex);
            }
        });
        return ResponseEntity.ok(emitter);
    }

    @PostMapping("/evaluate")
    public ResponseEntity<CommitteeResponses.EvaluationResponse> evaluate(
            @Valid @RequestBody CommitteeRequests.EvaluateCommitteeRequest request
    ) {
        CommitteeEvaluation evaluation = committeeOrchestrator.evaluate(
                request.prompt(),
                request.backendIds(),
                request.mode(),
                request.judgeBackendIds(),
                committeeMapper.toCriteria(request.criteria())
        );
        return ResponseEntity.ok(committeeMapper.toEvaluationResponse(evaluation));
    }

    @GetMapping("/health")
    public ResponseEntity<CommitteeResponses.HealthResponse> health() {
        return ResponseEntity.ok(new CommitteeResponses.HealthResponse(
                applicationName,
                committeeRuntimeProperties.isMockProvider() ? "mock" : "live",
                committeeJudgeProperties.getDefaultJudge(),
                committeeJudgeProperties.getDefaultSynthesizer()
        ));
    }

    private static void send(SseEmitter emitter, CommitteeResponses.StreamChunk chunk) {
        try {
            emitter.send(SseEmitter.event().data(chunk, MediaType.APPLICATION_JSON));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
