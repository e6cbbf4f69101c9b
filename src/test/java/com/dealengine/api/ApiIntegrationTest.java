package com.dealengine.api;

import com.dealengine.activation.ActivationStore;
import com.dealengine.api.controller.ApiHeaders;
import com.dealengine.deal.Deal;
import com.dealengine.deal.DealRepository;
import com.dealengine.deal.DealStatus;
import com.dealengine.evidence.EvidenceRepository;
import com.dealengine.evidence.ValidationReviewRepository;
import com.dealengine.security.PrincipalBinding;
import com.dealengine.security.PrincipalBindingRepository;
import com.dealengine.security.Role;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP-level tests for the REST controllers and error mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ApiIntegrationTest {

    private static final String HOME_WIN_FACT = "{\"gameId\":\"game-42\",\"teamId\":\"team-1\",\"home\":true,"
        + "\"complete\":true,\"teamScore\":6,\"opponentScore\":4,\"countedStats\":{\"runs\":6}}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PrincipalBindingRepository principalRepository;

    @Autowired
    private DealRepository dealRepository;

    @Autowired
    private ActivationStore activationStore;

    @Autowired
    private EvidenceRepository evidenceRepository;

    @Autowired
    private ValidationReviewRepository reviewRepository;

    @BeforeEach
    void setUp() {
        principalRepository.save(PrincipalBinding.system());
        principalRepository.save(PrincipalBinding.of("admin-1", Role.ADMIN));
        principalRepository.save(PrincipalBinding.of("rev-1", Role.REVIEWER));
        principalRepository.save(PrincipalBinding.of("user-1", Role.USER));
        dealRepository.save(new Deal("deal-1", "rest-1", "team-1", "Free fries", "home win and 6+ runs", DealStatus.PUBLISHED));
    }

    @AfterEach
    void tearDown() {
        activationStore.reset();
        evidenceRepository.deleteAll();
        reviewRepository.deleteAll();
        dealRepository.deleteAll();
    }

    private String submitHomeWin() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/games/facts")
                .header(ApiHeaders.PRINCIPAL_ID, PrincipalBinding.SYSTEM_PRINCIPAL_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content(HOME_WIN_FACT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.evaluations[0].outcome").value("TRIGGERED"))
            .andReturn();
        JsonNode report = objectMapper.readTree(result.getResponse().getContentAsString());
        return report.path("evaluations").path(0).path("activationKey").asText();
    }

    @Test
    void testValidateCondition() throws Exception {
        mockMvc.perform(post("/api/v1/conditions/validate")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"condition\":\"Home Win and 6+ Runs\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.normalized").value("home win and 6+ runs"))
            .andExpect(jsonPath("$.description").value(containsString("runs >= 6")));
    }

    @Test
    void testValidateConditionParseError() throws Exception {
        mockMvc.perform(post("/api/v1/conditions/validate")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"condition\":\"6+ touchdowns\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.offendingToken").value("touchdowns"));
    }

    @Test
    void testMissingOrUnknownPrincipal() throws Exception {
        mockMvc.perform(get("/api/v1/activations/active"))
            .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/v1/activations/active").header(ApiHeaders.PRINCIPAL_ID, "ghost"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void testUserCannotSubmitFacts() throws Exception {
        mockMvc.perform(post("/api/v1/games/facts")
                .header(ApiHeaders.PRINCIPAL_ID, "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(HOME_WIN_FACT))
            .andExpect(status().isForbidden());
    }

    @Test
    void testInvalidFactRejected() throws Exception {
        mockMvc.perform(post("/api/v1/games/facts")
                .header(ApiHeaders.PRINCIPAL_ID, PrincipalBinding.SYSTEM_PRINCIPAL_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"teamId\":\"team-1\",\"teamScore\":-1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.gameId").exists());
    }

    @Test
    void testActivationLifecycleOverHttp() throws Exception {
        String key = submitHomeWin();

        mockMvc.perform(get("/api/v1/activations/" + key).header(ApiHeaders.PRINCIPAL_ID, "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("TRIGGERED"));
        mockMvc.perform(get("/api/v1/activations/active").header(ApiHeaders.PRINCIPAL_ID, "user-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));
        mockMvc.perform(get("/api/v1/activations/status").header(ApiHeaders.PRINCIPAL_ID, "user-1")
                .param("dealId", "deal-1").param("gameId", "game-42"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("TRIGGERED"));

        String reverseBody = "{\"reason\":\"final score revised\"}";
        mockMvc.perform(post("/api/v1/activations/" + key + "/reverse")
                .header(ApiHeaders.PRINCIPAL_ID, "rev-1")
                .contentType(MediaType.APPLICATION_JSON).content(reverseBody))
            .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/v1/activations/" + key + "/reverse")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON).content(reverseBody))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("REVERSED"))
            .andExpect(jsonPath("$.reversedBy").value("admin-1"));
        mockMvc.perform(post("/api/v1/activations/" + key + "/reverse")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON).content(reverseBody))
            .andExpect(status().isConflict());
    }

    @Test
    void testDenialAndNotFoundAreDistinct() throws Exception {
        String body = "{\"reason\":\"test\"}";
        mockMvc.perform(post("/api/v1/activations/activation:doesnotexist/reverse")
                .header(ApiHeaders.PRINCIPAL_ID, "user-1")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/v1/activations/activation:doesnotexist/reverse")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isNotFound());
    }

    @Test
    void testForceTrigger() throws Exception {
        String body = "{\"dealId\":\"deal-1\",\"gameId\":\"game-77\",\"reason\":\"feed outage\"}";

        mockMvc.perform(post("/api/v1/activations/force-trigger")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.created").value(true))
            .andExpect(jsonPath("$.activation.triggeredBy").value("admin-1"));
        mockMvc.perform(post("/api/v1/activations/force-trigger")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.created").value(false));
        mockMvc.perform(post("/api/v1/activations/force-trigger")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"dealId\":\"deal-9\",\"gameId\":\"game-77\",\"reason\":\"x\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testEvidenceAndReviews() throws Exception {
        String key = submitHomeWin();

        mockMvc.perform(get("/api/v1/activations/" + key + "/evidence").header(ApiHeaders.PRINCIPAL_ID, "rev-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].kind").value("TRIGGER"))
            .andExpect(jsonPath("$[0].evidenceKey").value(startsWith("evidence:")));
        mockMvc.perform(get("/api/v1/activations/" + key + "/evidence").header(ApiHeaders.PRINCIPAL_ID, "user-1"))
            .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/activations/" + key + "/evidence")
                .header(ApiHeaders.PRINCIPAL_ID, "rev-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"BOX_SCORE\",\"payload\":{\"source\":\"league feed\"}}"))
            .andExpect(status().isForbidden());
        mockMvc.perform(post("/api/v1/activations/" + key + "/evidence")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"kind\":\"BOX_SCORE\",\"payload\":{\"source\":\"league feed\"}}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.storedBy").value("admin-1"));

        mockMvc.perform(post("/api/v1/activations/" + key + "/reviews")
                .header(ApiHeaders.PRINCIPAL_ID, "rev-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"outcome\":\"CONFIRMED\",\"notes\":\"box score matches\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.reviewerId").value("rev-1"));
        mockMvc.perform(get("/api/v1/activations/" + key + "/reviews").header(ApiHeaders.PRINCIPAL_ID, "rev-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void testPrincipalBinding() throws Exception {
        mockMvc.perform(put("/api/v1/principals/rev-2")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"role\":\"REVIEWER\",\"explicitPermissions\":[\"WRITE_EVIDENCE\"]}"))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/principals/me/permissions").header(ApiHeaders.PRINCIPAL_ID, "rev-2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasItems("evidence:read", "evidence:write")))
            .andExpect(jsonPath("$", not(hasItem("validation:override"))));
        mockMvc.perform(put("/api/v1/principals/rev-3")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"role\":\"SYSTEM\"}"))
            .andExpect(status().isForbidden());
    }

    @Test
    void testPrincipalBindingAcceptsWireCodes() throws Exception {
        mockMvc.perform(put("/api/v1/principals/rev-4")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"role\":\"reviewer\",\"explicitPermissions\":[\"evidence:write\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.role").value("REVIEWER"));
        mockMvc.perform(get("/api/v1/principals/me/permissions").header(ApiHeaders.PRINCIPAL_ID, "rev-4"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasItem("evidence:write")));
    }

    @Test
    void testPrincipalBindingRejectsUnknownNames() throws Exception {
        mockMvc.perform(put("/api/v1/principals/rev-5")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"role\":\"REVIEWER\",\"explicitPermissions\":[\"evidence:burn\"]}"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/v1/principals/rev-5")
                .header(ApiHeaders.PRINCIPAL_ID, "admin-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"role\":\"superuser\"}"))
            .andExpect(status().isBadRequest());
    }
}
