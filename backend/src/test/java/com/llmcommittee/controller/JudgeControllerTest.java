package com.llmcommittee.controller;

import com.llmcommittee.config.CommitteeDispatchConfig;
import com.llmcommittee.config.CommitteeJudgeProperties;
import com.llmcommittee.config.CommitteeRuntimeProperties;
import com.llmcommittee.mapper.CommitteeMapper;
import com.llmcommittee.model.JudgingMode;
import com.llmcommittee.model.JudgingRequest;
import com.llmcommittee.model.ScoreEntry;
import com.llmcommittee.model.Verdict;
import com.llmcommittee.provider.CancellationToken;
import com.llmcommittee.service.BackendLabelResolver;
import com.llmcommittee.service.JudgingEngine;
import com.llmcommittee.service.JudgingFailureException;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockAsyncContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(JudgeController.class)
@Import({
        CommitteeMapper.class,
        CommitteeDispatchConfig.class,
        CommitteeRuntimeProperties.class,
        CommitteeJudgeProperties.class
})
class JudgeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private JudgingEngine judgingEngine;

    @MockitoBean
    private BackendLabelResolver backendLabelResolver;

    @Test
    void judgesSubmittedResponses() throws Exception {
        when(backendLabelResolver.labelFor("openai/gpt-4o")).thenReturn("GPT-4o");
        when(judgingEngine.judge(any(JudgingRequest.class), any(CancellationToken.class))).thenReturn(new Verdict(
                "openai/gpt-4o",
                "GPT-4o",
                "More precise.",
                List.of(new ScoreEntry("openai/gpt-4o", 91, List.of("precise"), List.of())),
                JudgingMode.SINGLE,
                List.of(),
                Map.of("openai/gpt-4o", 1),
                null
        ));

        MvcResult started = mockMvc.perform(post("/api/judge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "prompt": "What is 2+2?",
                                  "mode": "judge",
                                  "responses": [
                                    {"backendId": " openai/gpt-4o ", "content": "4"},
                                    {"backendId": "x/y", "label": "XY", "content": "", "error": "timeout"}
                                  ],
                                  "criteria": {
                                    "label": "Math",
                                    "items": [{"name": " Correctness ", "weight": 5, "description": "Right answer"}]
                                  }
                                }
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.winnerBackendId").value("openai/gpt-4o"))
                .andExpect(jsonPath("$.scores[0].score").value(91))
                .andExpect(jsonPath("$.mode").value("single"));

        ArgumentCaptor<JudgingRequest> captor = ArgumentCaptor.forClass(JudgingRequest.class);
        ArgumentCaptor<CancellationToken> token = ArgumentCaptor.forClass(CancellationToken.class);
        verify(judgingEngine).judge(captor.capture(), token.capture());
        JudgingRequest request = captor.getValue();
        assertEquals(JudgingMode.SINGLE, request.mode());
        assertEquals("openai/gpt-4o", request.responses().get(0).backendId());
        assertEquals("GPT-4o", request.responses().get(0).label());
        assertNull(request.responses().get(0).errorMessage());
        assertEquals("timeout", request.responses().get(1).errorMessage());
        assertEquals("custom", request.criteria().id());
        assertEquals("Correctness", request.criteria().items().get(0).name());
        assertFalse(token.getValue().isCancelled());
    }

    @Test
    void rejectsOutOfRangeCriterionWeight() throws Exception {
        mockMvc.perform(post("/api/judge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "prompt": "p",
                                  "responses": [{"backendId": "a", "content": "x"}],
                                  "criteria": {"items": [{"name": "Speed", "weight": 9}]}
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_fields"))
                .andExpect(jsonPath("$.fieldErrors['criteria.items[0].weight']").value("criterion weight must be at most 5"));

        verifyNoInteractions(judgingEngine);
    }

    @Test
    void rejectsNullJudgeId() throws Exception {
        mockMvc.perform(post("/api/judge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "prompt": "p",
                                  "mode": "executive",
                                  "judgeBackendIds": [null, "j"],
                                  "responses": [{"backendId": "a", "content": "x"}, {"backendId": "b", "content": "y"}]
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors['judgeBackendIds[0]']").value("judge backend id must not be blank"));

        verifyNoInteractions(judgingEngine);
    }

    @Test
    void rejectsNullResponseEntry() throws Exception {
        mockMvc.perform(post("/api/judge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prompt": "p", "responses": [null, {"backendId": "a", "content": "x"}]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors['responses[0]']").value("response entry is required"));

        verifyNoInteractions(judgingEngine);
    }

    @Test
    void rejectsNullCriterionEntry() throws Exception {
        mockMvc.perform(post("/api/judge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "prompt": "p",
                                  "responses": [{"backendId": "a", "content": "x"}],
                                  "criteria": {"items": [null]}
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors['criteria.items[0]']").value("criterion entry is required"));

        verifyNoInteractions(judgingEngine);
    }

    @Test
    void allJudgesFailedMapsToBadGateway() throws Exception {
        when(judgingEngine.judge(any(JudgingRequest.class), any(CancellationToken.class)))
                .thenThrow(JudgingFailureException.allJudgesFailed("No judge returned a usable verdict", List.of()));

        MvcResult started = mockMvc.perform(post("/api/judge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prompt": "p", "mode": "committee", "responses": [{"backendId": "a", "content": "x"}]}
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("all_judges_failed"))
                .andExpect(jsonPath("$.responses.length()").value(0));
    }

    @Test
    void requestTimeoutCancelsInFlightJudging() throws Exception {
        CountDownLatch judging = new CountDownLatch(1);
        AtomicReference<CancellationToken> inFlight = new AtomicReference<>();
        when(judgingEngine.judge(any(JudgingRequest.class), any(CancellationToken.class))).thenAnswer(invocation -> {
            CancellationToken cancellation = invocation.getArgument(1);
            inFlight.set(cancellation);
            CountDownLatch cancelled = new CountDownLatch(1);
            cancellation.onCancel(cancelled::countDown);
            judging.countDown();
            cancelled.await(5, TimeUnit.SECONDS);
            throw JudgingFailureException.cancelled(List.of());
        });

        MvcResult started = mockMvc.perform(post("/api/judge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prompt": "p", "responses": [{"backendId": "a", "content": "x"}]}
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();
        assertTrue(judging.await(5, TimeUnit.SECONDS));

        MockAsyncContext asyncContext = (MockAsyncContext) started.getRequest().getAsyncContext();
        for (AsyncListener listener : asyncContext.getListeners()) {
            listener.onTimeout(new AsyncEvent(asyncContext));
        }

        assertTrue(inFlight.get().isCancelled());
    }
}
