package com.llmcommittee.controller;

import com.llmcommittee.config.CommitteeJudgeProperties;
import com.llmcommittee.dto.CommitteeRequests;
import com.llmcommittee.mapper.CommitteeMapper;
import com.llmcommittee.model.JudgingRequest;
import com.llmcommittee.model.Verdict;
import com.llmcommittee.provider.CancellationToken;
import com.llmcommittee.service.JudgingEngine;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@RestController
@RequestMapping("/api/judge")
public class JudgeController {

    private static final Logger log = LoggerFactory.getLogger(JudgeController.class);

    private final JudgingEngine judgingEngine;
    private final CommitteeMapper committeeMapper;
    private final ExecutorService committeeDispatchExecutor;
    private final CommitteeJudgeProperties committeeJudgeProperties;

    public JudgeController(
            JudgingEngine judgingEngine,
            CommitteeMapper committeeMapper,
            ExecutorService committeeDispatchExecutor,
            CommitteeJudgeProperties committeeJudgeProperties
    ) {
        this.judgingEngine = judgingEngine;
        this.committeeMapper = committeeMapper;
        this.committeeDispatchExecutor = committeeDispatchExecutor;
        this.committeeJudgeProperties = committeeJudgeProperties;
    }

    /**
     * Judges asynchronously. A request timeout or a dropped connection cancels the in-flight judges.
     */
    @PostMapping
    public DeferredResult<ResponseEntity<Verdict>> judge(@Valid @RequestBody CommitteeRequests.JudgeRequest request) {
        JudgingRequest judgingRequest = committeeMapper.toJudgingRequest(request);
        CancellationToken cancellation = new CancellationToken();
        DeferredResult<ResponseEntity<Verdict>> result =
                new DeferredResult<>(committeeJudgeProperties.getRequestTimeoutMs());
        result.onTimeout(cancellation::cancel);
        result.onError(ex -> cancellation.cancel());

        try {
            committeeDispatchExecutor.execute(() -> {
                try {
                    result.setResult(ResponseEntity.ok(judgingEngine.judge(judgingRequest, cancellation)));
                } catch (RuntimeException ex) {
                    result.setErrorResult(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.error("Dispatch executor rejected judging request", ex);
            result.setErrorResult(ex);
        }
        return result;
    }
}
