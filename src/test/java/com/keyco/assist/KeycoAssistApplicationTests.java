package com.keyco.assist;

import com.keyco.assist.service.orchestration.AssistSessionRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "assist.debounce.quiet-interval-ms=50")
@AutoConfigureMockMvc
class KeycoAssistApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private AssistSessionRegistry registry;

    @Test
    void contextLoads() {
        assertThat(registry).isNotNull();
    }

    @Test
    void shouldResolveSnippetSessionEndToEnd() throws Exception {
        String created = mvc.perform(post("/api/sessions").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"snippet\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String sessionId = new JSONObject(created).getString("sessionId");

        mvc.perform(put("/api/sessions/{id}/text", sessionId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"regards\"}"))
                .andExpect(status().isAccepted());

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                mvc.perform(get("/api/sessions/{id}/outcome", sessionId))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.status").value("success"))
                        .andExpect(jsonPath("$.mode").value("snippet"))
                        .andExpect(jsonPath("$.text").value("Kind regards,\nThe Keyco Team")));

        mvc.perform(get("/api/resilience/circuits")).andExpect(status().isOk());

        mvc.perform(delete("/api/sessions/{id}", sessionId)).andExpect(status().isNoContent());
        mvc.perform(get("/api/sessions/{id}/outcome", sessionId)).andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectUnknownSession() throws Exception {
        mvc.perform(post("/api/sessions/{id}/refresh", "does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("SessionNotFoundException"));
    }
}
