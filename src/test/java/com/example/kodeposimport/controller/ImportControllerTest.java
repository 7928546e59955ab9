package com.example.kodeposimport.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ImportControllerTest {

    private static final String RECORD = "{\"kodepos\":\"10110\",\"provinsi\":\"DKI Jakarta\",\"kota\":\"Jakarta Pusat\","
            + "\"kecamatan\":\"Menteng\",\"kelurahan\":\"Menteng\",\"lat\":-6.1944,\"lng\":106.8229}";

    @Autowired private MockMvc mockMvc;
    @Autowired private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanUp() {
        jdbcTemplate.update("DELETE FROM postal_codes");
    }

    private static MockMultipartFile file(String name, String contentType, String content) {
        return new MockMultipartFile("file", name, contentType, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("上传 JSON: 同步执行，返回汇总")
    void uploadJson() throws Exception {
        mockMvc.perform(multipart("/api/v1/import/upload")
                        .file(file("kodepos.json", "application/json", "[" + RECORD + "]"))
                        .param("configuration", "{\"duplicate_strategy\":\"update\",\"batch_size\":50}")
                        .header("X-User-Id", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.total_records").value(1))
                .andExpect(jsonPath("$.successful_records").value(1))
                .andExpect(jsonPath("$.phase_timings_ms.insertion").exists());
    }

    @Test
    void uploadCsv() throws Exception {
        String csv = "kodepos,province,city,district,village,latitude,longitude\n"
                + "10110,DKI Jakarta,Jakarta Pusat,Menteng,Menteng,-6.1944,106.8229\n"
                + "99999,Papua,Jayapura,Abepura,Abepura,-2.6,140.6\n";

        mockMvc.perform(multipart("/api/v1/import/upload").file(file("kodepos.csv", "text/csv", csv)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successful_records").value(2));
    }

    @Test
    @DisplayName("不支持的文件类型")
    void uploadUnsupportedType() throws Exception {
        mockMvc.perform(multipart("/api/v1/import/upload").file(file("kodepos.txt", "text/plain", "hello")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_CONTENT_TYPE"));
    }

    @Test
    void uploadMalformedJson() throws Exception {
        mockMvc.perform(multipart("/api/v1/import/upload").file(file("kodepos.json", "application/json", "[{")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_PAYLOAD"));
    }

    @Test
    @DisplayName("非 UTF-8 文件: MALFORMED_PAYLOAD")
    void uploadNonUtf8() throws Exception {
        byte[] latin1 = "kodepos,village\n10110,Caf\u00e9\n".getBytes(StandardCharsets.ISO_8859_1);

        mockMvc.perform(multipart("/api/v1/import/upload")
                        .file(new MockMultipartFile("file", "kodepos.csv", "text/csv", latin1)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_PAYLOAD"));
    }

    @Test
    void uploadInvalidConfiguration() throws Exception {
        mockMvc.perform(multipart("/api/v1/import/upload")
                        .file(file("kodepos.json", "application/json", "[" + RECORD + "]"))
                        .param("configuration", "{\"batch_size\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_CONFIGURATION"));
    }

    @Test
    @DisplayName("未知作业: 404")
    void unknownJob() throws Exception {
        mockMvc.perform(get("/api/v1/import/status/{id}", "no-such-job"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("JOB_NOT_FOUND"));
        mockMvc.perform(delete("/api/v1/import/cancel/{id}", "no-such-job"))
                .andExpect(status().isNotFound());
    }

    @Test
    void historyRejectsUnknownSortField() throws Exception {
        mockMvc.perform(get("/api/v1/import/history").param("sort_by", "filename"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void historyListsJobs() throws Exception {
        mockMvc.perform(multipart("/api/v1/import/upload")
                        .file(file("kodepos.json", "application/json", "[" + RECORD + "]"))
                        .header("X-User-Id", "history-user"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/import/history")
                        .param("created_by", "history-user")
                        .param("status", "completed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.jobs[0].filename").value("kodepos.json"))
                .andExpect(jsonPath("$.page").value(1));
    }

    @Test
    @DisplayName("dry-run 校验")
    void validate() throws Exception {
        mockMvc.perform(post("/api/v1/import/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":[" + RECORD + ",{\"kodepos\":\"123\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_records").value(2))
                .andExpect(jsonPath("$.valid_records").value(1))
                .andExpect(jsonPath("$.invalid_records").value(1))
                .andExpect(jsonPath("$.results[1].valid").value(false))
                .andExpect(jsonPath("$.results[1].errors", not(empty())));
    }

    @Test
    void validateRejectsEmptyData() throws Exception {
        mockMvc.perform(post("/api/v1/import/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void configAndTemplates() throws Exception {
        mockMvc.perform(get("/api/v1/import/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaults.duplicate_strategy").value("skip"))
                .andExpect(jsonPath("$.defaults.batch_size").value(1000))
                .andExpect(jsonPath("$.limits.max_batch_size").value(10000));

        mockMvc.perform(get("/api/v1/import/templates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.csv.headers", hasItem("kodepos")))
                .andExpect(jsonPath("$.json.example[0].kodepos").value("10110"));
    }

    @Test
    void statistics() throws Exception {
        mockMvc.perform(get("/api/v1/import/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_jobs").isNumber());
    }
}
