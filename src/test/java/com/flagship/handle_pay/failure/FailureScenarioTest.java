package com.flagship.handle_pay.failure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.dispatch.TransferDispatcher;
import com.flagship.handle_pay.dispatch.TransferResult;
import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import com.flagship.handle_pay.outbox.OutboxPublisher;
import com.flagship.handle_pay.outbox.OutboxService;
import com.flagship.handle_pay.receipt.ReceiptService;
import com.flagship.handle_pay.receipt.TransferReceipt;
import com.flagship.handle_pay.vault.EscrowVault;
import com.flagship.handle_pay.vault.VaultBalanceStore;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.flagship.handle_pay.support.TestAddresses.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Failure Scenario Tests
 *
 * Value must never move twice or go missing when a collaborator fails:
 *
 * 1. REDIS FAILURES
 *    - idempotency falls back to the receipts table
 *    - a failed cache write after commit does not fail the request
 *
 * 2. KAFKA FAILURES
 *    - events stay in the outbox and record the error
 *    - events past the retry limit are left alone
 *    - events are delivered once Kafka recovers
 *
 * 3. DATABASE
 *    - a duplicate idempotency key rolls back the transfer it came with
 *    - concurrent senders cannot overdraw their holdings
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class FailureScenarioTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("handle_pay_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Kafka is mocked; publisher runs only when triggered
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private TransferDispatcher dispatcher;

    @Autowired
    private EscrowVault vault;

    @Autowired
    private VaultBalanceStore balanceStore;

    @Autowired
    private ReceiptService receiptService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    @MockBean
    private KafkaTemplate<String, String> kafkaTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("TRUNCATE asset_holdings, handle_registrations, vault_balances, fee_pools, " +
            "transfer_receipts, outbox_events");
        fund(SENDER, units(100));

        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("FAILURE SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private void printInvariant(String invariant) {
        System.out.println("🔒 INVARIANT MAINTAINED: " + invariant);
    }

    // ========================================================================
    // REDIS FAILURE SCENARIOS
    // ========================================================================

    @Nested
    @DisplayName("1. Redis Failure Scenarios")
    class RedisFailureTests {

        @Test
        @DisplayName("1.1 Replay is detected via the database when Redis is down")
        void testRedisDown_ReplayDetectedByDatabase() throws Exception {
            printTestHeader("Redis Completely Unavailable");

            // GIVEN: Redis throws on every operation
            when(valueOperations.get(anyString()))
                    .thenThrow(new RuntimeException("Redis connection refused"));
            doThrow(new RuntimeException("Redis connection refused"))
                    .when(valueOperations).set(anyString(), anyString(), any());

            String key = "redis-down-" + UUID.randomUUID();
            String body = "{\"handle\":\"alice\",\"amount\":" + units(1) + "}";

            // WHEN: the same request is sent twice
            MvcResult first = mockMvc.perform(post("/api/transfers")
                    .header("X-Caller-Address", SENDER.getValue())
                    .header("Idempotency-Key", key)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
                .andExpect(status().isCreated())
                .andReturn();

            String receiptId = objectMapper.readTree(first.getResponse().getContentAsString()).get("id").asText();

            mockMvc.perform(post("/api/transfers")
                    .header("X-Caller-Address", SENDER.getValue())
                    .header("Idempotency-Key", key)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(receiptId));

            // THEN: one transfer, one receipt
            assertEquals(1, count("transfer_receipts"));
            assertEquals(units(99), holding(SENDER));
            assertEquals(units(1), vault.balanceOf("alice", AssetId.NATIVE));

            printSuccess("Second request replayed from the receipts table");
            printInvariant("Database is the source of truth, Redis is just cache");
        }

        @Test
        @DisplayName("1.2 Failed cache write after commit does not fail the transfer")
        void testRedisWriteFails_TransferStillCommitted() throws Exception {
            printTestHeader("Redis Fails Mid-Operation");

            when(valueOperations.get(anyString())).thenReturn(null);
            doThrow(new RuntimeException("Redis write failed"))
                    .when(valueOperations).set(anyString(), anyString(), any());

            mockMvc.perform(post("/api/transfers")
                    .header("X-Caller-Address", SENDER.getValue())
                    .header("Idempotency-Key", "redis-write-" + UUID.randomUUID())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"handle\":\"alice\",\"amount\":" + units(1) + "}"))
                .andExpect(status().isCreated());

            assertEquals(1, count("transfer_receipts"));
            printSuccess("Transfer committed; cache miss will be repaired on next lookup");
        }
    }

    // ========================================================================
    // KAFKA FAILURE SCENARIOS
    // ========================================================================

    @Nested
    @DisplayName("2. Kafka Failure Scenarios")
    class KafkaFailureTests {

        @Test
        @DisplayName("2.1 Events remain in the outbox with the error recorded")
        void testKafkaUnavailable_EventsRemainInOutbox() {
            printTestHeader("Kafka Unavailable - Events in Outbox");

            when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                    .thenReturn(CompletableFuture.failedFuture(new RuntimeException("Broker not available")));

            dispatcher.transfer(SENDER, "alice", units(1), AssetId.NATIVE);
            outboxPublisher.triggerPublish();

            assertEquals(2, outboxService.countUnpublished());
            assertEquals(2, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM outbox_events WHERE retry_count = 1 AND last_error IS NOT NULL", Integer.class));

            printInvariant("Transactional outbox guarantees event durability");
        }

        @Test
        @DisplayName("2.2 Events past the retry limit are not sent again")
        void testDeadLetteredEventsSkipped() {
            dispatcher.transfer(SENDER, "alice", units(1), AssetId.NATIVE);
            jdbcTemplate.update("UPDATE outbox_events SET retry_count = 5");

            outboxPublisher.triggerPublish();

            verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
            assertEquals(2, outboxService.countUnpublished());
        }

        @Test
        @DisplayName("2.3 Events are delivered after Kafka recovers")
        void testEventsPublishedAfterRecovery() {
            when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                    .thenReturn(CompletableFuture.failedFuture(new RuntimeException("Broker not available")));
            dispatcher.transfer(SENDER, "alice", units(1), AssetId.NATIVE);
            outboxPublisher.triggerPublish();
            assertEquals(2, outboxService.countUnpublished());

            // Kafka is back
            when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                    .thenAnswer(invocation -> CompletableFuture.completedFuture(sent(
                        invocation.getArgument(0), invocation.getArgument(1), invocation.getArgument(2))));
            outboxPublisher.triggerPublish();

            assertEquals(0, outboxService.countUnpublished());
            printSuccess("Backlog drained once the broker recovered");
        }
    }

    // ========================================================================
    // DATABASE SCENARIOS
    // ========================================================================

    @Nested
    @DisplayName("3. Database Scenarios")
    class DatabaseTests {

        @Test
        @DisplayName("3.1 A duplicate idempotency key rolls back the transfer it arrived with")
        void testDuplicateKeyRollsBackTransfer() {
            printTestHeader("Duplicate Idempotency Key at the Database");

            String key = "dup-" + UUID.randomUUID();
            transactionTemplate.executeWithoutResult(status -> {
                TransferResult result = dispatcher.transfer(SENDER, "alice", units(1), AssetId.NATIVE);
                receiptService.save(TransferReceipt.forTransfer(result), key);
            });

            // Application check bypassed: only the unique constraint stands in the way
            assertThrows(DataIntegrityViolationException.class, () ->
                transactionTemplate.executeWithoutResult(status -> {
                    TransferResult result = dispatcher.transfer(SENDER, "alice", units(1), AssetId.NATIVE);
                    receiptService.save(TransferReceipt.forTransfer(result), key);
                }));

            assertEquals(units(99), holding(SENDER));
            assertEquals(units(1), vault.balanceOf("alice", AssetId.NATIVE));
            assertEquals(1, count("transfer_receipts"));
            printInvariant("A transfer is never committed without its receipt");
        }

        @Test
        @DisplayName("3.2 Concurrent transfers cannot overdraw the sender")
        void testConcurrentTransfersCannotOverdraw() throws Exception {
            printTestHeader("Concurrent Senders");

            jdbcTemplate.update("TRUNCATE asset_holdings");
            Address sender = SENDER;
            fund(sender, units(5));

            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                String handle = "user-" + i;
                executor.submit(() -> {
                    try {
                        start.await();
                        dispatcher.transfer(sender, handle, units(1), AssetId.NATIVE);
                        succeeded.incrementAndGet();
                    } catch (ProtocolException e) {
                        if (e.getError() == ProtocolError.TRANSFER_FAILED) {
                            rejected.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(5, succeeded.get());
            assertEquals(5, rejected.get());
            assertEquals(BigInteger.ZERO, holding(sender));
            assertEquals(units(5), balanceStore.totalOf(AssetId.NATIVE));
            assertEquals(units(5), holding(VAULT_CUSTODY));
            printInvariant("Vault entries always sum to the vault's custody holdings");
        }
    }

    private void fund(Address holder, BigInteger amount) {
        jdbcTemplate.update("INSERT INTO asset_holdings (holder, asset, amount) VALUES (?, ?, ?)",
            holder.getValue(), AssetId.NATIVE.toString(), new BigDecimal(amount));
    }

    private BigInteger holding(Address holder) {
        return jdbcTemplate.queryForList(
                "SELECT amount FROM asset_holdings WHERE holder = ? AND asset = ?",
                BigDecimal.class, holder.getValue(), AssetId.NATIVE.toString())
            .stream().findFirst().map(BigDecimal::toBigIntegerExact).orElse(BigInteger.ZERO);
    }

    private int count(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    private static SendResult<String, String> sent(String topic, String key, String value) {
        return new SendResult<>(new ProducerRecord<>(topic, key, value),
            new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, System.currentTimeMillis(), 0, 0));
    }
}
