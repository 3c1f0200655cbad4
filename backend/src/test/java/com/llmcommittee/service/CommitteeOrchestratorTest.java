package com.llmcommittee.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmcommittee.config.CommitteeJudgeProperties;
import com.llmcommittee.config.CommitteeRuntimeProperties;
import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.CommitteeEvaluation;
import com.llmcommittee.model.JudgingMode;
import com.llmcommittee.model.TokenDeltaEvent;
import com.llmcommittee.provider.MockBackendClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommitteeOrchestratorTest {

    private ExecutorService executor;
    private CommitteeRuntimeProperties runtimeProperties;
    private CommitteeOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        runtimeProperties = new CommitteeRuntimeProperties();
        runtimeProperties.getDispatch().setMaxCommitteeSize(3);
        CommitteeJudgeProperties judgeProperties = new CommitteeJudgeProperties();
        judgeProperties.setDefaultJudge("mock/judge");
        judgeProperties.setDefaultSynthesizer("mock/synth");

        MockBackendClient backendClient = new MockBackendClient();
        BackendLabelResolver labels = backendId -> "Label " + backendId;
        Clock clock = Clock.systemUTC();
        JudgingEngine judgingEngine = new JudgingEngine(
                backendClient,
                executor,
                new VerdictParser(new ObjectMapper()),
                new VerdictAggregator(judgeProperties),
                labels,
                judgeProperties
        );
        orchestrator = new CommitteeOrchestrator(
                new FanOutAggregator(backendClient, executor, clock),
                judgingEngine,
                labels,
                runtimeProperties,
                clock
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void committeeIsTrimmedAndDeduplicated() {
        assertEquals(
                List.of("mock/a", "mock/b"),
                orchestrator.validateCommittee("Hi", Arrays.asList(" mock/a", "mock/b", "mock/a", null, " "))
        );
    }

    @Test
    void committeeSizeIsEnforced() {
        IllegalArgumentException tooFew = assertThrows(
                IllegalArgumentException.class,
                () -> orchestrator.validateCommittee("Hi", List.of("mock/a", "mock/a"))
        );
        assertEquals(CommitteeOrchestrator.COMMITTEE_REQUIRED_MESSAGE, tooFew.getMessage());

        assertThrows(IllegalArgumentException.class, () -> orchestrator.validateCommittee(" ", List.of("a", "b")));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.validateCommittee("Hi", null));

        IllegalArgumentException tooMany = assertThrows(
                IllegalArgumentException.class,
                () -> orchestrator.validateCommittee("Hi", List.of("a", "b", "c", "d"))
        );
        assertEquals("At most 3 models per committee", tooMany.getMessage());
    }

    @Test
    void streamDeliversOneTerminalPerBackend() throws InterruptedException {
        CommitteeRun run = orchestrator.startStream("Explain caching", List.of("mock/a", "mock/fail-1"));
        List<TokenDeltaEvent> events = new ArrayList<>();

        run.drain(events::add);

        assertTrue(run.isComplete());
        assertEquals(1, events.stream().filter(e -> e.backendId().equals("mock/a") && e.isFinal()).count());
        assertEquals(1, events.stream().filter(e -> e.backendId().equals("mock/fail-1") && e.isFinal()).count());
        assertTrue(events.stream().anyMatch(e -> e.backendId().equals("mock/fail-1") && e.isFailure()));
    }

    @Test
    void evaluateAssemblesResponsesAndJudgesThem() {
        CommitteeEvaluation evaluation = orchestrator.evaluate(
                "Explain caching",
                List.of("mock/a", "mock/b", "mock/fail-1"),
                JudgingMode.SINGLE,
                List.of(),
                null
        );

        assertEquals(3, evaluation.responses().size());
        AssembledResponse first = evaluation.responses().get(0);
        assertEquals("mock/a", first.backendId());
        assertEquals("Label mock/a", first.label());
        assertTrue(first.content().startsWith("[mock/a] "));
        assertNotNull(first.latencyMs());
        assertNotNull(evaluation.responses().get(2).errorMessage());

        assertTrue(List.of("mock/a", "mock/b").contains(evaluation.verdict().winnerBackendId()));
        assertEquals(2, evaluation.verdict().scores().size());
        assertEquals(1, evaluation.verdict().votes().size());
    }

    @Test
    void consensusEvaluationHasNoWinner() {
        CommitteeEvaluation evaluation = orchestrator.evaluate(
                "Explain caching",
                List.of("mock/a", "mock/b"),
                JudgingMode.CONSENSUS,
                null,
                null
        );

        assertNull(evaluation.verdict().winnerBackendId());
        assertNotNull(evaluation.verdict().consensus());
        assertEquals(2, evaluation.verdict().consensus().attributions().size());
    }

    @Test
    void judgingFailureCarriesEveryAssembledResponse() {
        JudgingFailureException ex = assertThrows(
                JudgingFailureException.class,
                () -> orchestrator.evaluate(
                        "Explain caching",
                        List.of("mock/a", "mock/fail-1", "mock/fail-2"),
                        JudgingMode.SINGLE,
                        null,
                        null
                )
        );

        assertEquals(JudgingFailureType.PRECONDITION_FAILED, ex.getType());
        assertEquals(JudgingEngine.TOO_FEW_RESPONSES_MESSAGE, ex.getMessage());
        assertEquals(3, ex.getResponses().size());
    }

    @Test
    void failingJudgeIsReportedAsAllJudgesFailed() {
        JudgingFailureException ex = assertThrows(
                JudgingFailureException.class,
                () -> orchestrator.evaluate(
                        "Explain caching",
                        List.of("mock/a", "mock/b"),
                        JudgingMode.EXECUTIVE,
                        List.of("mock/fail-judge"),
                        null
                )
        );

        assertEquals(JudgingFailureType.ALL_JUDGES_FAILED, ex.getType());
        assertEquals(2, ex.getResponses().size());
    }
}
