package com.llmcommittee.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmcommittee.config.CommitteeJudgeProperties;
import com.llmcommittee.model.ChatMessage;
import com.llmcommittee.model.Criteria;
import com.llmcommittee.model.CriteriaPresets;
import com.llmcommittee.provider.BackendClient;
import com.llmcommittee.provider.BackendCompletion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CriteriaGenerationServiceTest {

    @Mock
    private BackendClient backendClient;

    private CriteriaGenerationService service;

    @BeforeEach
    void setUp() {
        service = new CriteriaGenerationService(backendClient, new ObjectMapper(), new CommitteeJudgeProperties());
    }

    @Test
    void sanitizesGeneratedRubric() {
        when(backendClient.complete(eq("openai/gpt-4o"), anyList(), any(), any())).thenReturn(
                BackendCompletion.success("openai/gpt-4o", """
                        ```json
                        {
                          "name": "  ",
                          "description": "Security review",
                          "criteria": [
                            {"name": " Threat Coverage ", "weight": 7.2, "description": " Covers attack paths "},
                            {"name": "Fixes", "weight": 0.2, "description": "Actionable fixes"},
                            {"name": "", "weight": 3, "description": "dropped"},
                            {"name": "No weight", "description": "dropped"},
                            {"name": "Clarity", "weight": 2.5, "description": "Readable"}
                          ]
                        }
                        ```
                        """, 20)
        );

        Criteria criteria = service.generate("Review code for security issues", "openai/gpt-4o");

        assertEquals(CriteriaPresets.CUSTOM_CRITERIA_ID, criteria.id());
        assertEquals(CriteriaGenerationService.DEFAULT_NAME, criteria.label());
        assertEquals("Security review", criteria.description());
        assertEquals(3, criteria.items().size());
        assertEquals(new Criteria.Item("Threat Coverage", 5, "Covers attack paths"), criteria.items().get(0));
        assertEquals(1, criteria.items().get(1).weight());
        assertEquals(3, criteria.items().get(2).weight());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
        verify(backendClient).complete(eq("openai/gpt-4o"), messages.capture(), any(), any());
        assertTrue(messages.getValue().get(0).content().contains("\"Review code for security issues\""));
    }

    @Test
    void rejectsInvalidInputBeforeCallingBackend() {
        assertThrows(IllegalArgumentException.class, () -> service.generate(" ", "openai/gpt-4o"));
        assertThrows(IllegalArgumentException.class, () -> service.generate("x".repeat(1001), "openai/gpt-4o"));
        assertThrows(IllegalArgumentException.class, () -> service.generate("Security", ""));
        verifyNoInteractions(backendClient);
    }

    @Test
    void unusableModelOutputRaisesGenerationFailure() {
        when(backendClient.complete(eq("m"), anyList(), any(), any())).thenReturn(
                BackendCompletion.failure("m", "API error: 401 - unauthorized", 5),
                BackendCompletion.success("m", "not json at all", 5),
                BackendCompletion.success("m", "{\"name\":\"n\",\"description\":\"d\",\"criteria\":[]}", 5),
                BackendCompletion.success("m", "{\"name\":\"n\",\"description\":\"d\",\"criteria\":[{\"name\":\"x\"}]}", 5)
        );

        assertEquals("API error: 401 - unauthorized",
                assertThrows(CriteriaGenerationException.class, () -> service.generate("d", "m")).getMessage());
        assertEquals("Failed to parse model response",
                assertThrows(CriteriaGenerationException.class, () -> service.generate("d", "m")).getMessage());
        assertEquals("Invalid criteria structure from model",
                assertThrows(CriteriaGenerationException.class, () -> service.generate("d", "m")).getMessage());
        assertEquals("No valid criteria generated",
                assertThrows(CriteriaGenerationException.class, () -> service.generate("d", "m")).getMessage());
    }
}
