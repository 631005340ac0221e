package com.studentnotes.notes_api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.studentnotes.notes_api.support.SteppingClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 빈 저장소에서 시작하는 생성 -> 삭제 -> 목록 -> 수정 시나리오
 */
@SpringBootTest
@AutoConfigureMockMvc
class NoteScenarioIntegrationTest {

    @TempDir
    static Path storageDir;

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("notes.storage.file", () -> storageDir.resolve("scenario-notes.json").toString());
    }

    @TestConfiguration
    static class SteppingClockConfig {

        @Bean
        @Primary
        Clock steppingClock() {
            return new SteppingClock(Instant.parse("2025-03-01T09:00:00Z"), Duration.ofSeconds(1));
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("POST 두 번 -> 1번 삭제 -> 목록에는 2번만 -> 2번 수정 시 updatedAt 만 증가")
    void fullScenario() throws Exception {
        // 1. 첫 번째 노트
        JsonNode first = readJson(mockMvc.perform(post("/notes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"A\",\"content\":\"B\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.title").value("A"))
                .andExpect(jsonPath("$.content").value("B"))
                .andExpect(jsonPath("$.tags").isEmpty())
                .andReturn().getResponse().getContentAsString());
        assertThat(first.get("createdAt").asText()).isEqualTo(first.get("updatedAt").asText());

        // 2. 두 번째 노트
        JsonNode second = readJson(mockMvc.perform(post("/notes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"C\",\"content\":\"D\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(2))
                .andReturn().getResponse().getContentAsString());

        // 3. 1번 삭제
        mockMvc.perform(delete("/notes/1"))
                .andExpect(status().isNoContent());

        // 4. 목록에는 2번만
        mockMvc.perform(get("/notes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(2));

        // 5. 2번 수정
        JsonNode updated = readJson(mockMvc.perform(put("/notes/2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"E\",\"content\":\"F\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(2))
                .andExpect(jsonPath("$.title").value("E"))
                .andExpect(jsonPath("$.content").value("F"))
                .andReturn().getResponse().getContentAsString());

        assertThat(updated.get("createdAt")).isEqualTo(second.get("createdAt"));
        assertThat(Instant.parse(updated.get("updatedAt").asText()))
                .isAfter(Instant.parse(second.get("updatedAt").asText()));

        // 6. 파일에도 2번만 남아 있음
        JsonNode persisted = objectMapper.readTree(
                Files.readString(storageDir.resolve("scenario-notes.json"), StandardCharsets.UTF_8));
        assertThat(persisted).hasSize(1);
        assertThat(persisted.get(0).get("id").asLong()).isEqualTo(2L);
        assertThat(persisted.get(0).get("title").asText()).isEqualTo("E");
    }

    private JsonNode readJson(String body) throws Exception {
        return objectMapper.readTree(body);
    }
}
