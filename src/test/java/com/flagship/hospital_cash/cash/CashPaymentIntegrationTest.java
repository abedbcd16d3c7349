package com.flagship.hospital_cash.cash;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.hospital_cash.db.BinaryUuid;
import com.flagship.hospital_cash.topic.Topic;
import com.flagship.hospital_cash.topic.TopicEvent;
import com.flagship.hospital_cash.topic.TopicPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Cash intake end to end against MySQL with the posting procedures installed.
 *
 * These tests verify:
 * - An invoice payment is written with its items and posted to the journal
 * - Item amounts come from the balance procedure, not the client
 * - Project and user are taken from the logged-in session
 * - A failing step rolls back every step before it
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class CashPaymentIntegrationTest {

    private static final String DEBTOR_UUID = "3be232f9-a4b9-4af6-984c-5d3f87d5c107";
    private static final String INVOICE_A = "957e4e79-a6bb-4b4d-a8f7-c42152b2c2f6";
    private static final String INVOICE_B = "c44619e0-3683-4457-9a5b-38f2a2c1e19c";

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("hospital_test")
            .withUsername("test")
            .withPassword("test")
            .withInitScript("db/cash-schema.sql");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private TopicPublisher topicPublisher;

    private MockHttpSession session;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() throws Exception {
        MvcResult login = mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"superuser\", \"password\": \"superuser\", \"project\": 1}"))
            .andExpect(status().isOk())
            .andReturn();

        session = (MockHttpSession) login.getRequest().getSession(false);
        assertNotNull(session, "Login must open a session");
    }

    private UUID createCash(String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/cash")
                .session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn();

        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(json.get("uuid").asText());
    }

    private int count(String sql, UUID uuid) {
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, (Object) BinaryUuid.toBytes(uuid));
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Invoice payment is written, balanced and posted")
    void testInvoicePayment_EndToEnd() throws Exception {
        printTestHeader("Invoice payment end to end");

        String body = """
            {"payment": {
              "amount": 100, "currency_id": 2, "cashbox_id": 3,
              "debtor_uuid": "%s", "project_id": 2, "user_id": 99,
              "is_caution": false, "description": "Two invoices",
              "items": [
                {"invoice_uuid": "%s", "reference": "TPA.IV.1"},
                {"invoice_uuid": "%s", "cash_uuid": "%s"}
              ]}}
            """.formatted(DEBTOR_UUID, INVOICE_A, INVOICE_B, UUID.randomUUID());

        UUID cashUuid = createCash(body);
        printOutput("Cash UUID", cashUuid);

        Map<String, Object> cash = jdbcTemplate.queryForMap(
            "SELECT project_id, user_id, is_caution FROM cash WHERE uuid = ?", (Object) BinaryUuid.toBytes(cashUuid));
        assertEquals(1, ((Number) cash.get("project_id")).intValue(), "Project comes from the session");
        assertEquals(1, ((Number) cash.get("user_id")).intValue(), "User comes from the session");

        List<BigDecimal> amounts = jdbcTemplate.queryForList(
            "SELECT amount FROM cash_item WHERE cash_uuid = ? ORDER BY amount", BigDecimal.class,
            (Object) BinaryUuid.toBytes(cashUuid));
        assertEquals(2, amounts.size());
        assertEquals(0, new BigDecimal("25").compareTo(amounts.get(0)));
        assertEquals(0, new BigDecimal("75").compareTo(amounts.get(1)));

        assertEquals(1, count("SELECT COUNT(*) FROM posting_journal WHERE record_uuid = ?", cashUuid));

        ArgumentCaptor<TopicEvent> event = ArgumentCaptor.forClass(TopicEvent.class);
        verify(topicPublisher, times(1)).publish(eq(Topic.Channel.FINANCE), event.capture());
        assertEquals(cashUuid, event.getValue().getUuid());
        assertEquals("Super User", event.getValue().getUser());

        printSuccess("Payment written with 2 items, posted once, one event published");
    }

    @Test
    @DisplayName("Caution payment is written without items")
    void testCautionPayment_EndToEnd() throws Exception {
        printTestHeader("Caution payment end to end");

        UUID clientUuid = UUID.randomUUID();
        String body = """
            {"payment": {
              "uuid": "%s", "amount": 50, "currency_id": 2, "cashbox_id": 3,
              "debtor_uuid": "%s", "is_caution": 1, "date": "2026-01-15T10:30:00Z"}}
            """.formatted(clientUuid, DEBTOR_UUID);

        UUID cashUuid = createCash(body);

        assertEquals(clientUuid, cashUuid);
        assertEquals(1, count("SELECT COUNT(*) FROM cash WHERE uuid = ? AND is_caution = 1", cashUuid));
        assertEquals(0, count("SELECT COUNT(*) FROM cash_item WHERE cash_uuid = ?", cashUuid));

        mockMvc.perform(get("/api/cash/{uuid}", cashUuid).session(session))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.uuid").value(cashUuid.toString()))
            .andExpect(jsonPath("$.is_caution").value(true))
            .andExpect(jsonPath("$.debtor_uuid").value(DEBTOR_UUID))
            .andExpect(jsonPath("$.items").isEmpty());

        printSuccess("Caution payment readable through the API");
    }

    @Test
    @DisplayName("Unknown invoice fails the item write and rolls back every step")
    void testUnknownInvoice_RollsBack() throws Exception {
        printTestHeader("Failed posting rolls back");

        UUID cashUuid = UUID.randomUUID();
        String body = """
            {"payment": {
              "uuid": "%s", "amount": 10, "currency_id": 2, "cashbox_id": 3,
              "debtor_uuid": "%s", "is_caution": false,
              "items": [{"invoice_uuid": "%s"}]}}
            """.formatted(cashUuid, DEBTOR_UUID, UUID.randomUUID());

        mockMvc.perform(post("/api/cash")
                .session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isInternalServerError());

        assertEquals(0, count("SELECT COUNT(*) FROM stage_cash WHERE uuid = ?", cashUuid));
        assertEquals(0, count("SELECT COUNT(*) FROM cash WHERE uuid = ?", cashUuid));
        assertEquals(0, count("SELECT COUNT(*) FROM posting_journal WHERE record_uuid = ?", cashUuid));
        verifyNoInteractions(topicPublisher);

        printSuccess("No partial writes, no event");
    }

    @Test
    @DisplayName("Invoice payment without items writes nothing")
    void testMissingItems_NoWrites() throws Exception {
        UUID cashUuid = UUID.randomUUID();
        String body = """
            {"payment": {
              "uuid": "%s", "amount": 10, "currency_id": 2, "cashbox_id": 3,
              "debtor_uuid": "%s", "items": []}}
            """.formatted(cashUuid, DEBTOR_UUID);

        mockMvc.perform(post("/api/cash")
                .session(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(CashPaymentService.MISSING_ITEMS_MESSAGE));

        assertEquals(0, count("SELECT COUNT(*) FROM stage_cash WHERE uuid = ?", cashUuid));
        verifyNoInteractions(topicPublisher);
    }

    @Test
    @DisplayName("Login to a project without permission is refused")
    void testLogin_NoProjectPermission() throws Exception {
        mockMvc.perform(post("/auth/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\": \"superuser\", \"password\": \"superuser\", \"project\": 2}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.message").value("No permissions for that project."));
    }
}
