package com.meterline.engine.store;

import com.meterline.core.error.PersistenceWriteException;
import com.meterline.core.model.Business;
import com.meterline.core.model.Customer;
import com.meterline.core.model.MetricKind;
import com.meterline.core.model.MetricRecord;
import com.meterline.core.model.PlanLimit;
import com.meterline.core.redis.Keys;
import com.meterline.core.util.JsonUtils;
import io.lettuce.core.RedisClient;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reactive Redis persistence for metrics, plan limits and tenant documents.
 * <p>
 * <b>Writes:</b>
 * <ul>
 *   <li>Checkpoints: one Lua script per write, so the HINCRBYFLOAT on {@code ckpt:*}, its
 *       bookkeeping fields and the history entry on the business stream apply together</li>
 *   <li>Billing resets: the stored total is overwritten by a script of the same shape</li>
 *   <li>Plain records: one XADD per record on {@code metrics:{businessId}}</li>
 * </ul>
 * </p>
 */
public class RedisMetricStore implements IMetricStore {
    private static final Logger log = LoggerFactory.getLogger(RedisMetricStore.class);

    // KEYS: checkpoint hash, history stream. ARGV: 4 field names, delta, now, tags json, history pairs.
    private static final String INCREMENT_SCRIPT = String.join("\n",
        "redis.call('HINCRBYFLOAT', KEYS[1], ARGV[1], ARGV[5])",
        "redis.call('HINCRBY', KEYS[1], ARGV[2], 1)",
        "redis.call('HSET', KEYS[1], ARGV[3], ARGV[6], ARGV[4], ARGV[7])",
        "redis.call('XADD', KEYS[2], '*', unpack(ARGV, 8))",
        "return 1");

    // KEYS: checkpoint hash, history stream. ARGV: 2 field names, value, now, history pairs.
    private static final String RESET_SCRIPT = String.join("\n",
        "redis.call('HSET', KEYS[1], ARGV[1], ARGV[3], ARGV[2], ARGV[4])",
        "redis.call('XADD', KEYS[2], '*', unpack(ARGV, 5))",
        "return 1");

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisMetricStore(String redisUrl) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Metric store connected to Redis: {}", redisUrl);
    }

    @Override
    public Mono<Void> atomicIncrement(String businessId, String customerId, String metricName,
                                      double delta, String scope, Map<String, String> tags) {
        String key = Keys.checkpoint(businessId, customerId, scope, metricName);
        long now = System.currentTimeMillis();

        List<String> args = new ArrayList<>(List.of(
            Keys.CKPT_VALUE, Keys.CKPT_OPERATIONS, Keys.CKPT_UPDATED_AT, Keys.CKPT_TAGS,
            String.valueOf(delta), String.valueOf(now),
            JsonUtils.writeValueAsString(tags != null ? tags : Map.of())));
        appendHistory(args, MetricKind.CHECKPOINT.wireName(), scope, customerId, metricName, now);
        args.add("delta");
        args.add(String.valueOf(delta));

        return runScript(INCREMENT_SCRIPT, key, Keys.metricsStream(businessId), args)
            .onErrorMap(err -> !(err instanceof PersistenceWriteException),
                err -> new PersistenceWriteException("Checkpoint increment failed for " + key, err))
            .doOnError(err -> log.error("Failed to increment checkpoint {}", key, err));
    }

    @Override
    public Mono<Void> resetCheckpoint(String businessId, String customerId, String metricName,
                                      double value, String scope) {
        String key = Keys.checkpoint(businessId, customerId, scope, metricName);
        long now = System.currentTimeMillis();

        List<String> args = new ArrayList<>(List.of(
            Keys.CKPT_VALUE, Keys.CKPT_UPDATED_AT, String.valueOf(value), String.valueOf(now)));
        appendHistory(args, "reset", scope, customerId, metricName, now);
        args.add("value");
        args.add(String.valueOf(value));

        return runScript(RESET_SCRIPT, key, Keys.metricsStream(businessId), args)
            .onErrorMap(err -> !(err instanceof PersistenceWriteException),
                err -> new PersistenceWriteException("Checkpoint reset failed for " + key, err))
            .doOnSuccess(v -> log.info("Checkpoint {} reset to {}", key, value))
            .doOnError(err -> log.error("Failed to reset checkpoint {}", key, err));
    }

    private Mono<Void> runScript(String script, String key, String stream, List<String> args) {
        return commands.<Long>eval(script, ScriptOutputType.INTEGER, new String[]{key, stream},
                args.toArray(new String[0]))
            .then();
    }

    private static void appendHistory(List<String> args, String type, String scope, String customerId,
                                      String metricName, long ts) {
        args.addAll(List.of(
            "type", type,
            "scope", scope,
            "customerId", customerId != null ? customerId : "",
            "metricName", metricName,
            "ts", String.valueOf(ts)));
    }

    @Override
    public Mono<Void> batchInsert(List<MetricRecord> records) {
        if (records.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(records)
            .concatMap(record -> commands.xadd(Keys.metricsStream(record.getBusinessId()), toEntry(record)))
            .then()
            .onErrorMap(err -> !(err instanceof PersistenceWriteException),
                err -> new PersistenceWriteException("Batch insert of " + records.size() + " records failed", err))
            .doOnSuccess(v -> log.debug("Inserted {} metric records", records.size()))
            .doOnError(err -> log.error("Failed to insert {} metric records", records.size(), err));
    }

    private Map<String, String> toEntry(MetricRecord record) {
        Map<String, String> entry = new HashMap<>();
        entry.put("type", record.getMetricType().wireName());
        entry.put("scope", record.getScope());
        entry.put("customerId", record.getCustomerId() != null ? record.getCustomerId() : "");
        entry.put("metricName", record.getMetricName());
        entry.put("value", String.valueOf(record.getValue()));
        entry.put("operations", String.valueOf(record.getOperationCount()));
        entry.put("windowStart", String.valueOf(record.getWindowStart()));
        entry.put("windowEnd", String.valueOf(record.getWindowEnd()));
        entry.put("flushedAt", String.valueOf(record.getFlushedAt()));
        entry.put("tags", JsonUtils.writeValueAsString(record.getTags() != null ? record.getTags() : Map.of()));
        return entry;
    }

    @Override
    public Mono<Double> checkpointValue(String businessId, String customerId, String scope, String metricName) {
        return commands.hget(Keys.checkpoint(businessId, customerId, scope, metricName), Keys.CKPT_VALUE)
            .map(Double::parseDouble);
    }

    @Override
    public Mono<Customer> getCustomer(String businessId, String customerId) {
        return commands.get(Keys.customer(businessId, customerId))
            .map(json -> JsonUtils.readValue(json, Customer.class))
            .doOnError(err -> log.error("Failed to load customer {}/{}", businessId, customerId, err));
    }

    @Override
    public Mono<Business> getBusiness(String businessId) {
        return commands.get(Keys.business(businessId))
            .map(json -> JsonUtils.readValue(json, Business.class))
            .doOnError(err -> log.error("Failed to load business {}", businessId, err));
    }

    @Override
    public Flux<PlanLimit> planLimits(String planId) {
        return limits(Keys.planLimits(planId));
    }

    @Override
    public Mono<String> planIdForPrice(String stripePriceId) {
        return commands.hget(Keys.planByPrice(), stripePriceId);
    }

    @Override
    public Flux<PlanLimit> businessLimits(String businessId) {
        return limits(Keys.businessLimits(businessId));
    }

    @Override
    public Flux<PlanLimit> customerLimits(String businessId, String customerId) {
        return limits(Keys.customerLimits(businessId, customerId));
    }

    private Flux<PlanLimit> limits(String key) {
        return commands.hvals(key)
            .map(json -> JsonUtils.readValue(json, PlanLimit.class))
            .doOnError(err -> log.error("Failed to load limits from {}", key, err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Metric store Redis connection closed");
    }
}
