package com.meterline.provisioner.store;

import com.meterline.core.model.Business;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.MachineStatus;
import com.meterline.core.model.ProvisioningStatus;
import com.meterline.core.model.ProvisioningTask;
import com.meterline.core.redis.Keys;
import com.meterline.core.util.JsonUtils;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reactive Redis storage for provisioning tasks and machines.
 * <p>
 * Layout (see {@link Keys}):
 * <ul>
 *   <li>Task documents as JSON strings, indexed by a pending set scored by {@code nextRetryAt}
 *       and a dead-letter set scored by {@code deadLetterAt}</li>
 *   <li>Idempotency keys holding the owning task id, claimed in the same script that writes
 *       and indexes the task, so a failed insert leaves no claim behind</li>
 *   <li>Machines in a hash per customer, with live expiring machines in a sorted set</li>
 * </ul>
 * </p>
 */
public class RedisProvisioningStore implements IProvisioningStore {
    private static final Logger log = LoggerFactory.getLogger(RedisProvisioningStore.class);

    // KEYS: idempotency key, task document, pending set. ARGV: task id, task json, due time, task key prefix.
    // A claim whose task document is gone is taken over. Returns the owning task id.
    private static final String INSERT_SCRIPT = String.join("\n",
        "local owner = redis.call('GET', KEYS[1])",
        "if owner and redis.call('EXISTS', ARGV[4] .. owner) == 1 then return owner end",
        "redis.call('SET', KEYS[2], ARGV[2])",
        "redis.call('ZADD', KEYS[3], ARGV[3], ARGV[1])",
        "redis.call('SET', KEYS[1], ARGV[1])",
        "return ARGV[1]");

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisProvisioningStore(String redisUrl) {
        this.client = RedisClient.create(redisUrl);
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Provisioning store connected to Redis: {}", redisUrl);
    }

    @Override
    public Mono<ProvisioningTask> insertTaskIfAbsent(ProvisioningTask task) {
        String[] keys = {Keys.idempotency(task.getIdempotencyKey()), Keys.task(task.getId()), Keys.pendingTasks()};
        return commands.<String>eval(INSERT_SCRIPT, ScriptOutputType.VALUE, keys,
                task.getId(), JsonUtils.writeValueAsString(task), String.valueOf(task.getNextRetryAt()),
                Keys.task(""))
            .next()
            .flatMap(owner -> {
                if (owner.equals(task.getId())) {
                    return Mono.just(task);
                }
                return getTask(owner)
                    .doOnNext(existing -> log.debug("Idempotency key {} already owned by task {}",
                        task.getIdempotencyKey(), existing.getId()));
            })
            .doOnError(err -> log.error("Failed to enqueue task {}", task.getIdempotencyKey(), err));
    }

    @Override
    public Mono<Void> saveTask(ProvisioningTask task) {
        String id = task.getId();
        Mono<?> index;
        if (task.getStatus() == ProvisioningStatus.PENDING) {
            index = commands.zadd(Keys.pendingTasks(), (double) task.getNextRetryAt(), id);
        } else if (task.getStatus() == ProvisioningStatus.DEAD_LETTER) {
            index = commands.zrem(Keys.pendingTasks(), id)
                .then(commands.zadd(Keys.deadLetterTasks(), (double) task.getDeadLetterAt(), id));
        } else {
            index = commands.zrem(Keys.pendingTasks(), id);
        }
        return commands.set(Keys.task(id), JsonUtils.writeValueAsString(task))
            .then(index)
            .then()
            .doOnError(err -> log.error("Failed to save task {}", id, err));
    }

    @Override
    public Mono<ProvisioningTask> getTask(String taskId) {
        return commands.get(Keys.task(taskId))
            .map(json -> JsonUtils.readValue(json, ProvisioningTask.class))
            .doOnError(err -> log.error("Failed to load task {}", taskId, err));
    }

    @Override
    public Flux<ProvisioningTask> dueTasks(long now, int limit) {
        return commands.zrangebyscore(Keys.pendingTasks(), Range.create(0L, now), Limit.create(0, limit))
            .concatMap(this::getTask)
            .filter(task -> task.isDue(now))
            .doOnError(err -> log.error("Failed to load due tasks", err));
    }

    @Override
    public Mono<Business> getBusiness(String businessId) {
        return commands.get(Keys.business(businessId))
            .map(json -> JsonUtils.readValue(json, Business.class))
            .doOnError(err -> log.error("Failed to load business {}", businessId, err));
    }

    @Override
    public Mono<Void> saveMachine(CustomerMachine machine) {
        String member = Keys.machineExpiryMember(machine.getBusinessId(), machine.getCustomerId(), machine.getMachineId());
        Long expiryScore = expiryScore(machine);
        Mono<?> index = expiryScore != null
            ? commands.zadd(Keys.machineExpiry(), (double) expiryScore, member)
            : commands.zrem(Keys.machineExpiry(), member);

        return commands.hset(Keys.machines(machine.getBusinessId(), machine.getCustomerId()),
                machine.getMachineId(), JsonUtils.writeValueAsString(machine))
            .then(index)
            .then()
            .doOnError(err -> log.error("Failed to save machine {}", machine.getMachineId(), err));
    }

    @Override
    public Flux<CustomerMachine> machines(String businessId, String customerId) {
        return commands.hvals(Keys.machines(businessId, customerId))
            .map(json -> JsonUtils.readValue(json, CustomerMachine.class))
            .doOnError(err -> log.error("Failed to load machines of {}/{}", businessId, customerId, err));
    }

    @Override
    public Flux<CustomerMachine> expiringMachines(long now, int limit) {
        return commands.zrangebyscore(Keys.machineExpiry(), Range.create(0L, now), Limit.create(0, limit))
            .concatMap(member -> {
                String[] parts = member.split(":", 3);
                if (parts.length != 3) {
                    log.warn("Ignoring malformed expiry member {}", member);
                    return Mono.empty();
                }
                return commands.hget(Keys.machines(parts[0], parts[1]), parts[2])
                    .map(json -> JsonUtils.readValue(json, CustomerMachine.class));
            })
            .filter(CustomerMachine::isLive)
            .doOnError(err -> log.error("Failed to load expiring machines", err));
    }

    /**
     * Grace end once in grace, else the expiry; {@code null} removes the machine from the sweep.
     */
    static Long expiryScore(CustomerMachine machine) {
        if (!machine.isLive()) {
            return null;
        }
        if (machine.getStatus() == MachineStatus.GRACE_PERIOD && machine.getGracePeriodEnds() != null) {
            return machine.getGracePeriodEnds();
        }
        return machine.getExpiresAt();
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Provisioning store Redis connection closed");
    }
}
