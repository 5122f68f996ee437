package com.flagship.nft_marketplace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.nft_marketplace.marketplace.MarketplaceLedger;
import com.flagship.nft_marketplace.outbox.OutboxEvent;
import com.flagship.nft_marketplace.outbox.OutboxService;
import com.flagship.nft_marketplace.receipt.ReceiptRecorder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end flow against PostgreSQL and Redis: the HTTP API, the ledger,
 * receipts, idempotency keys and outbox rows.
 *
 * The ledger bean lives for the whole context, so each test works on its own
 * token and with freshly funded buyers.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class MarketplaceIntegrationTest {

    private static final BigInteger ETHER = BigInteger.TEN.pow(18);
    private static final BigInteger ROYALTY_FEE = BigInteger.TEN.pow(16);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("nft_marketplace_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // No broker: events stay in the outbox
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("marketplace.funding.enabled", () -> "true");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MarketplaceLedger ledger;

    @Autowired
    private OutboxService outboxService;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static String newAccount() {
        String hex = UUID.randomUUID().toString().replace("-", "") + UUID.randomUUID().toString().replace("-", "");
        return "0x" + hex.substring(0, 40);
    }

    private String fundedAccount(BigInteger amount) throws Exception {
        String account = newAccount();
        mockMvc.perform(post("/api/marketplace/accounts/" + account + "/funding")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":" + amount + "}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.type").value("FUNDING"));
        return account;
    }

    private MvcResult purchase(long tokenId, String buyer, BigInteger value, String idempotencyKey) throws Exception {
        var request = post("/api/marketplace/items/" + tokenId + "/purchase")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"buyer\":\"" + buyer + "\",\"value\":" + value + "}");
        if (idempotencyKey != null) {
            request.header("Idempotency-Key", idempotencyKey);
        }
        return mockMvc.perform(request).andReturn();
    }

    @Test
    @DisplayName("A purchase pays the seller, stores a receipt and writes a bought event")
    void testPurchaseFlow() throws Exception {
        printTestHeader("Purchase Flow");

        String buyer = fundedAccount(ETHER.multiply(BigInteger.TEN));
        String key = "purchase-" + UUID.randomUUID();

        // When
        MvcResult result = purchase(0, buyer, ETHER, key);

        // Then
        assertEquals(201, result.getResponse().getStatus());
        JsonNode receipt = objectMapper.readTree(result.getResponse().getContentAsString());
        long sequence = receipt.get("sequence_number").asLong();
        printOutput("Receipt", receipt);

        assertEquals("PURCHASE", receipt.get("type").asText());
        assertEquals(buyer, ledger.ownerOf(0).toString().toLowerCase());
        assertEquals(key, jdbcTemplate.queryForObject(
            "SELECT idempotency_key FROM transaction_receipts WHERE sequence_number = ?", String.class, sequence));

        List<OutboxEvent> events = outboxService.getEventsForToken(ReceiptRecorder.AGGREGATE_TYPE, "0");
        assertTrue(events.stream().anyMatch(e -> e.getEventType().equals("MarketItemBought")));
        assertTrue(outboxService.countUnpublished() > 0);

        mockMvc.perform(get("/api/marketplace/accounts/" + buyer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.token_count").value(1));
        mockMvc.perform(get("/api/marketplace/items/0/receipts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].type").value("PURCHASE"));
    }

    @Test
    @DisplayName("Repeating a purchase with the same key returns the original receipt")
    void testIdempotentPurchase() throws Exception {
        printTestHeader("Idempotent Purchase");

        String buyer = fundedAccount(ETHER.multiply(BigInteger.TEN));
        String key = "purchase-" + UUID.randomUUID();

        MvcResult first = purchase(1, buyer, ETHER.multiply(BigInteger.TWO), key);
        long sequenceAfterFirst = ledger.getSequenceNumber();
        MvcResult second = purchase(1, buyer, ETHER.multiply(BigInteger.TWO), key);

        assertEquals(201, first.getResponse().getStatus());
        assertEquals(200, second.getResponse().getStatus());
        JsonNode original = objectMapper.readTree(first.getResponse().getContentAsString());
        JsonNode replayed = objectMapper.readTree(second.getResponse().getContentAsString());
        assertEquals(original.get("sequence_number"), replayed.get("sequence_number"));
        assertTrue(replayed.get("replayed").asBoolean());
        assertEquals(sequenceAfterFirst, ledger.getSequenceNumber());

        Integer rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transaction_receipts WHERE idempotency_key = ?", Integer.class, key);
        assertEquals(1, rows);
    }

    @Test
    @DisplayName("A rejected purchase changes nothing and leaves no receipt")
    void testRejectedPurchase() throws Exception {
        printTestHeader("Rejected Purchase");

        String buyer = fundedAccount(ETHER.multiply(BigInteger.TEN));
        long sequenceBefore = ledger.getSequenceNumber();

        MvcResult wrongValue = purchase(2, buyer, ETHER, null);
        assertEquals(402, wrongValue.getResponse().getStatus());
        assertEquals(sequenceBefore, ledger.getSequenceNumber());
        assertTrue(ledger.getItem(2).isListed());

        String poor = fundedAccount(ETHER);
        MvcResult insufficient = purchase(2, poor, ETHER.multiply(BigInteger.valueOf(3)), null);
        assertEquals(402, insufficient.getResponse().getStatus());

        Integer rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transaction_receipts WHERE token_id = 2", Integer.class);
        assertEquals(0, rows);
    }

    @Test
    @DisplayName("A bought token can be relisted and bought by someone else")
    void testRelistAndResale() throws Exception {
        printTestHeader("Relist and Resale");

        String first = fundedAccount(ETHER.multiply(BigInteger.TEN));
        String second = fundedAccount(ETHER.multiply(BigInteger.TEN));
        assertEquals(201, purchase(3, first, ETHER.multiply(BigInteger.valueOf(4)), null).getResponse().getStatus());

        mockMvc.perform(post("/api/marketplace/items/3/listing")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"seller\":\"" + first + "\",\"price\":" + ETHER + ",\"value\":" + ROYALTY_FEE + "}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.type").value("RELIST"));

        assertEquals(201, purchase(3, second, ETHER, null).getResponse().getStatus());
        assertEquals(second, ledger.ownerOf(3).toString().toLowerCase());

        mockMvc.perform(get("/api/marketplace/items/3/receipts"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3));
        assertTrue(ledger.verifyInvariants().isEmpty());
    }

    @Test
    @DisplayName("The plain health endpoint reports the database and ledger sequence")
    void testHealthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.database").value("UP"));
    }
}
