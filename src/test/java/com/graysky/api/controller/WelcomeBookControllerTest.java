package com.graysky.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.graysky.api.MutableClock;
import com.graysky.api.TestClockConfig;
import com.graysky.api.model.dto.VisitRequest;
import com.graysky.api.repository.AnswerRepository;
import com.graysky.api.repository.VisitorRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for WelcomeBookController against the relational store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class WelcomeBookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    @Autowired
    private VisitorRepository visitorRepository;

    @Autowired
    private AnswerRepository answerRepository;

    @BeforeEach
    void reset() {
        answerRepository.deleteAllInBatch();
        visitorRepository.deleteAllInBatch();
        clock.set(Instant.parse("2025-03-01T10:00:00Z"));
    }

    @Test
    void signWelcomeBook_returnsRecordInSnakeCase() throws Exception {
        sign(VisitRequest.builder()
                .name("Ada")
                .agentType("GPT")
                .purpose("Exploring")
                .answers(Map.of("favorite_color", "blue"))
                .build())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").isNotEmpty())
            .andExpect(jsonPath("$.name").value("Ada"))
            .andExpect(jsonPath("$.agent_type").value("GPT"))
            .andExpect(jsonPath("$.purpose").value("Exploring"))
            .andExpect(jsonPath("$.visit_time").value(startsWith("2025-03-01T10:00")))
            .andExpect(jsonPath("$.visit_count").value(1))
            .andExpect(jsonPath("$.answers.favorite_color").value("blue"));
    }

    @Test
    void signWelcomeBook_trailingSlashIsAccepted() throws Exception {
        mockMvc.perform(post("/welcome-book/")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Grace\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.visit_count").value(1));
    }

    @Test
    void signWelcomeBook_secondVisitWithinHourIsRateLimited() throws Exception {
        sign(VisitRequest.builder().name("Ada").agentType("GPT").build())
            .andExpect(status().isOk());

        clock.advance(Duration.ofMinutes(10));

        sign(VisitRequest.builder().name("Ada").agentType("Claude").build())
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value(containsString("Rate limit exceeded")));
    }

    @Test
    void signWelcomeBook_returningVisitorKeepsIdAndCounts() throws Exception {
        String body = sign(VisitRequest.builder().name("Ada").agentType("GPT").build())
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        String id = objectMapper.readTree(body).get("id").asText();

        clock.advance(Duration.ofMinutes(61));

        sign(VisitRequest.builder().name("Ada").agentType("GPT").answers(Map.of("q", "y")).build())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id))
            .andExpect(jsonPath("$.visit_count").value(2))
            .andExpect(jsonPath("$.answers.q").value("y"));
    }

    @Test
    void signWelcomeBook_invalidNameIsRejectedWithFieldInMessage() throws Exception {
        sign(VisitRequest.builder().name("x".repeat(101)).build())
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value(containsString("name")));

        mockMvc.perform(get("/welcome-book"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void signWelcomeBook_missingNameIsRejected() throws Exception {
        mockMvc.perform(post("/welcome-book")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"purpose\":\"no name\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value(containsString("Name is required")));
    }

    @Test
    void signWelcomeBook_escapesMarkup() throws Exception {
        sign(VisitRequest.builder().name("<script>").build())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("&lt;script&gt;"));
    }

    @Test
    void getVisitors_newestFirstAndLimited() throws Exception {
        for (String name : new String[]{"First", "Second", "Third"}) {
            sign(VisitRequest.builder().name(name).build()).andExpect(status().isOk());
            clock.advance(Duration.ofMinutes(1));
        }

        mockMvc.perform(get("/welcome-book").param("limit", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[0].name").value("Third"))
            .andExpect(jsonPath("$[1].name").value("Second"));
    }

    @Test
    void getVisitors_limitOutOfRangeIsRejected() throws Exception {
        mockMvc.perform(get("/welcome-book").param("limit", "0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("limit must be between 1 and 100"));

        mockMvc.perform(get("/welcome-book").param("limit", "101"))
            .andExpect(status().isBadRequest());
    }

    private ResultActions sign(VisitRequest request) throws Exception {
        return mockMvc.perform(post("/welcome-book")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }
}
