package com.olympiadregistration.integration;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.anonymous;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RegistrationApiSecurityIntegrationTest {

    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("registration")
            .withUsername("registration")
            .withPassword("changeme");

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @AfterAll
    void tearDown() {
        postgres.stop();
    }

    @Autowired
    MockMvc mockMvc;

    private static MockMultipartFile countryPart(String code, String name) {
        String json = "{\"code\":\"" + code + "\",\"name\":\"" + name + "\",\"contactEmails\":\""
            + code.toLowerCase() + "@example.org\"}";
        return new MockMultipartFile("country", "", MediaType.APPLICATION_JSON_VALUE, json.getBytes(UTF_8));
    }

    @Test
    void api_requires_basic_authentication() throws Exception {
        mockMvc.perform(get("/api/v1/countries").with(anonymous()))
            .andExpect(status().isUnauthorized())
            .andExpect(header().exists("WWW-Authenticate"));

        mockMvc.perform(get("/api/v1/countries").with(httpBasic("admin", "wrong")))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void configured_account_authenticates_with_basic_credentials() throws Exception {
        mockMvc.perform(get("/api/v1/countries").with(httpBasic("admin", "admin")))
            .andExpect(status().isOk());
    }

    @Test
    void exports_and_results_are_public() throws Exception {
        mockMvc.perform(get("/api/v1/exports/countries.csv").with(anonymous()))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/scores/results").with(anonymous()))
            .andExpect(status().isOk());
    }

    @Test
    @WithMockUser(username = "delegate", roles = "REGISTER")
    void delegate_account_cannot_create_countries() throws Exception {
        mockMvc.perform(multipart("/api/v1/countries").file(countryPart("SEC", "Securia")))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.kind").value("PERMISSION_DENIED"));
    }

    @Test
    @WithMockUser(username = "organiser", roles = "ADMIN")
    void administrator_account_creates_countries() throws Exception {
        mockMvc.perform(multipart("/api/v1/countries").file(countryPart("ADM", "Adminia")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.code").value("ADM"));
    }
}
