package com.rms.restaurantservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.restaurantservice.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AuthFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private UserRepository userRepository;

    @MockBean
    private JavaMailSender mailSender;

    @BeforeEach
    void cleanUsers() {
        userRepository.deleteAll();
    }

    @Test
    void registeredStaffCanLogInAndReadTheDashboard() throws Exception {
        mockMvc.perform(post("/api/register").contentType(MediaType.APPLICATION_JSON).content("""
                        {"username": "maria", "email": "maria@example.com", "password": "secret1", "role": "staff"}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").isNumber());

        String body = mockMvc.perform(post("/api/login").contentType(MediaType.APPLICATION_JSON).content("""
                        {"username": "maria", "password": "secret1"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.username").value("maria"))
                .andExpect(jsonPath("$.user.role").value("staff"))
                .andExpect(jsonPath("$.user.password").doesNotExist())
                .andReturn().getResponse().getContentAsString();
        JsonNode login = objectMapper.readTree(body);
        String token = login.get("token").asText();
        assertThat(token).isNotBlank();

        assertThat(userRepository.findByUsername("maria").orElseThrow().getPassword()).isNotEqualTo("secret1");

        mockMvc.perform(get("/api/dashboard").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOrders").isNumber())
                .andExpect(jsonPath("$.totalRevenue").isNumber())
                .andExpect(jsonPath("$.pendingOrders").isNumber())
                .andExpect(jsonPath("$.menuItems").isNumber())
                .andExpect(jsonPath("$.lowStock").isNumber())
                .andExpect(jsonPath("$.todayOrders").isNumber());
    }

    @Test
    void responsesCarryHardeningAndRateLimitHeaders() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                .andExpect(header().string("X-Frame-Options", "DENY"))
                .andExpect(header().exists("Cache-Control"))
                .andExpect(header().exists("RateLimit-Remaining"));
    }

    @Test
    void duplicateRegistrationIsRejected() throws Exception {
        String user = """
                {"username": "sam", "email": "sam@example.com", "password": "secret1"}
                """;
        mockMvc.perform(post("/api/register").contentType(MediaType.APPLICATION_JSON).content(user))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/register").contentType(MediaType.APPLICATION_JSON).content(user))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("User already exists"));
    }

    @Test
    void shortPasswordIsRejected() throws Exception {
        mockMvc.perform(post("/api/register").contentType(MediaType.APPLICATION_JSON).content("""
                        {"username": "lee", "email": "lee@example.com", "password": "123"}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("password must be at least 6 characters"));
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/register").contentType(MediaType.APPLICATION_JSON).content("""
                        {"username": "kim", "email": "kim@example.com", "password": "secret1"}
                        """))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/login").contentType(MediaType.APPLICATION_JSON).content("""
                        {"username": "kim", "password": "wrong-one"}
                        """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid credentials"));
    }

    @Test
    void dashboardNeedsALogin() throws Exception {
        mockMvc.perform(get("/api/dashboard"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }
}
