package com.bo.knowledge.controller;

import com.bo.knowledge.model.AnswerResult;
import com.bo.knowledge.model.CacheStats;
import com.bo.knowledge.model.QuestionType;
import com.bo.knowledge.model.RoutingDecision;
import com.bo.knowledge.model.ToolRecommendation;
import com.bo.knowledge.service.QueryRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    private static final String QUESTION = "How many universities are in Dhaka?";

    @Mock
    private QueryRouter queryRouter;

    @InjectMocks
    private AgentController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    private static AnswerResult answer() {
        return new AnswerResult(QUESTION, "Found 9 institutions matching your criteria.", "institutions",
                0.95, 0.94, "High confidence - Simple deterministic query", QuestionType.COUNT, "Dhaka",
                "SELECT COUNT(*) FROM institutions WHERE location = 'Dhaka'", false, 0, 12);
    }

    @Test
    void askReturnsTheAnswer() throws Exception {
        when(queryRouter.answer(QUESTION)).thenReturn(answer());

        mockMvc.perform(post("/api/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"" + QUESTION + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.toolUsed").value("institutions"))
                .andExpect(jsonPath("$.data.questionType").value("count"))
                .andExpect(jsonPath("$.data.resultConfidence").value(0.94));
    }

    @Test
    void askHonoursTimeout() throws Exception {
        when(queryRouter.answer(QUESTION, Duration.ofSeconds(5))).thenReturn(answer());

        mockMvc.perform(post("/api/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"" + QUESTION + "\",\"timeoutSeconds\":5}"))
                .andExpect(jsonPath("$.success").value(true));

        verify(queryRouter).answer(QUESTION, Duration.ofSeconds(5));
    }

    @Test
    void blankQueryIsRejected() throws Exception {
        mockMvc.perform(post("/api/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"   \"}"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(400));

        mockMvc.perform(get("/api/route").param("q", ""))
                .andExpect(jsonPath("$.code").value(400));

        verifyNoInteractions(queryRouter);
    }

    @Test
    void unexpectedErrorsAreWrapped() throws Exception {
        when(queryRouter.answer(anyString())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"" + QUESTION + "\"}"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(500));
    }

    @Test
    void batchAnswersEveryQuestion() throws Exception {
        when(queryRouter.answerAll(anyString())).thenReturn(List.of(answer(), answer()));

        mockMvc.perform(post("/api/ask/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"a? b?\"}"))
                .andExpect(jsonPath("$.data.length()").value(2));
    }

    @Test
    void routeEndpoints() throws Exception {
        RoutingDecision decision = new RoutingDecision("institutions", 0.95, QuestionType.COUNT, true, "Dhaka",
                Map.of("institutions", 1.0), Map.of("institutions", List.of("universities")),
                "how many universities are in dhaka");
        when(queryRouter.route(QUESTION)).thenReturn(decision);
        when(queryRouter.explainRouting(QUESTION)).thenReturn("Primary tool: institutions");
        when(queryRouter.recommendTools(QUESTION)).thenReturn(List.of(new ToolRecommendation("institutions", 1.0, 1.0)));

        mockMvc.perform(get("/api/route").param("q", QUESTION))
                .andExpect(jsonPath("$.data.primaryTool").value("institutions"))
                .andExpect(jsonPath("$.data.location").value("Dhaka"));
        mockMvc.perform(get("/api/route/explain").param("q", QUESTION))
                .andExpect(jsonPath("$.data").value("Primary tool: institutions"));
        mockMvc.perform(get("/api/route/recommendations").param("q", QUESTION))
                .andExpect(jsonPath("$.data[0].tool").value("institutions"));
    }

    @Test
    void cacheEndpoints() throws Exception {
        when(queryRouter.cacheStats()).thenReturn(new CacheStats(2, 1, 1.5, 3, 1, 0, 1000, 3600, List.of()));
        when(queryRouter.cacheClearAll()).thenReturn(2);
        when(queryRouter.cacheClearExpired()).thenReturn(1);
        when(queryRouter.cacheInvalidate(QUESTION, "institutions")).thenReturn(true);

        mockMvc.perform(get("/api/cache/stats"))
                .andExpect(jsonPath("$.data.totalEntries").value(2))
                .andExpect(jsonPath("$.data.hitRate").value(0.75));
        mockMvc.perform(delete("/api/cache"))
                .andExpect(jsonPath("$.data").value(2));
        mockMvc.perform(delete("/api/cache/expired"))
                .andExpect(jsonPath("$.data").value(1));
        mockMvc.perform(delete("/api/cache/entry").param("q", QUESTION).param("tool", "institutions"))
                .andExpect(jsonPath("$.data").value(true));
    }
}
