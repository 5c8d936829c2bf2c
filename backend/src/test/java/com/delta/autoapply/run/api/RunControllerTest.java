package com.delta.autoapply.run.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class RunControllerTest {
    private static final String START_BODY = """
        {"applyUrl": "https://boards.greenhouse.io/acme/jobs/1",
         "jobDescription": "Backend engineer, Java",
         "baseResume": "Ada Lovelace, engineer"}
        """;

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/runs/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("run_not_found"))
            .andExpect(jsonPath("$.message").value("Run not found: does-not-exist"));

        mockMvc.perform(post("/api/runs/does-not-exist/continue"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("run_not_found"));

        mockMvc.perform(post("/api/runs/does-not-exist/cancel"))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/runs/does-not-exist/events"))
            .andExpect(status().isNotFound());
    }

    @Test
    void startRequiresApplyUrl() throws Exception {
        mockMvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON).content("{\"jobTitle\": \"x\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON).content("{\"applyUrl\": \"  \"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void runWithoutTailoringProviderHaltsForManualResume() throws Exception {
        String runId = startRun();

        awaitStatus(runId, "halted");

        mockMvc.perform(get("/api/runs/" + runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value(runId))
            .andExpect(jsonPath("$.applyUrl").value("https://boards.greenhouse.io/acme/jobs/1"))
            .andExpect(jsonPath("$.gateSignalled").value(false));

        MvcResult pending = mockMvc.perform(get("/api/runs/" + runId + "/events"))
            .andExpect(request().asyncStarted())
            .andReturn();
        String stream = mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();

        assertThat(stream).startsWith("data: {\"type\":\"log\",\"level\":\"info\",\"message\":\"connected\"}\n\n");
        assertThat(stream).contains("Starting one-click tailor+apply");
        assertThat(stream).contains("\"type\":\"gate\"");
        assertThat(stream).contains("\"message\":\"halted\"");
    }

    @Test
    void continueAcknowledgesAndMarksTheGate() throws Exception {
        String runId = startRun();
        awaitStatus(runId, "halted");

        mockMvc.perform(post("/api/runs/" + runId + "/continue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ok").value(true));

        mockMvc.perform(get("/api/runs/" + runId))
            .andExpect(jsonPath("$.gateSignalled").value(true));

        mockMvc.perform(post("/api/runs/" + runId + "/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("halted"));
    }

    private String startRun() throws Exception {
        String body = mockMvc.perform(post("/api/runs").contentType(MediaType.APPLICATION_JSON).content(START_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").isNotEmpty())
            .andReturn()
            .getResponse()
            .getContentAsString();
        return objectMapper.readTree(body).path("runId").asText();
    }

    private void awaitStatus(String runId, String expected) throws Exception {
        long deadline = System.currentTimeMillis() + 5000;
        String current = null;
        while (System.currentTimeMillis() < deadline) {
            String body = mockMvc.perform(get("/api/runs/" + runId)).andReturn().getResponse().getContentAsString();
            JsonNode node = objectMapper.readTree(body);
            current = node.path("status").asText();
            if (expected.equals(current)) {
                return;
            }
            Thread.sleep(20);
        }
        assertThat(current).isEqualTo(expected);
    }
}
