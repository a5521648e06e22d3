package com.flagship.handle_pay.observability;

import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.asset.AssetTransferGateway;
import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.config.ProtocolProperties;
import com.flagship.handle_pay.outbox.OutboxEventRepository;
import com.flagship.handle_pay.vault.VaultBalanceStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Actuator health indicators for handle-pay.
 *
 * Readiness is driven by the outbox backlog, Redis, Kafka and vault solvency.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis backs the idempotency fast path. Losing it degrades, never fails:
     * receipts fall back to the database.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency falls back to the transfer_receipts table";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : Health.down().withDetail("response", String.valueOf(result)).build();
                }

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Down if the vault owes more of an asset than its custody holds. Checks the
     * native coin and every configured tracked token.
     */
    @Component("vaultSolvencyHealth")
    public static class VaultSolvencyHealthIndicator implements HealthIndicator {

        private final VaultBalanceStore balanceStore;
        private final AssetTransferGateway gateway;
        private final ProtocolProperties properties;

        public VaultSolvencyHealthIndicator(VaultBalanceStore balanceStore,
                                            AssetTransferGateway gateway,
                                            ProtocolProperties properties) {
            this.balanceStore = balanceStore;
            this.gateway = gateway;
            this.properties = properties;
        }

        @Override
        public Health health() {
            try {
                Address custody = Address.of(properties.getVault().getCustody());
                List<AssetId> assets = new ArrayList<>();
                assets.add(AssetId.NATIVE);
                properties.getTrackedTokens().forEach(token -> assets.add(AssetId.of(token)));

                Map<String, Object> shortfalls = new LinkedHashMap<>();
                for (AssetId asset : assets) {
                    BigInteger owed = balanceStore.totalOf(asset);
                    BigInteger held = gateway.balanceOf(asset, custody);
                    if (owed.compareTo(held) > 0) {
                        shortfalls.put(asset.toString(), owed.subtract(held).toString());
                    }
                }

                Health.Builder builder = shortfalls.isEmpty() ? Health.up() : Health.down();
                return builder
                        .withDetail("assetsChecked", assets.size())
                        .withDetail("shortfalls", shortfalls)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
