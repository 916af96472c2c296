package tech.yump.auditlog.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.auditlog.config.OpenApiConfig;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class RootControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("GET / returns the welcome message")
    void root() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Welcome to LiteAudit API"))
                .andExpect(jsonPath("$.status").value("OK"));
    }

    @Test
    @DisplayName("GET /sys/audit-status reports the configured level and sink")
    void auditStatus() throws Exception {
        mockMvc.perform(get("/sys/audit-status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value("Metadata"))
                .andExpect(jsonPath("$.sink").value("slf4j"));
    }

    @Test
    @DisplayName("GET /v3/api-docs documents the bearer token scheme")
    void apiDocs() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.info.title").value("LiteAudit API"))
                .andExpect(jsonPath("$.components.securitySchemes." + OpenApiConfig.SECURITY_SCHEME_NAME + ".scheme")
                        .value("bearer"));
    }
}
