package com.meterline.provisioner;

import com.meterline.core.error.ProviderException;
import com.meterline.core.metrics.MetricsNames;
import com.meterline.core.metrics.MetricsTags;
import com.meterline.core.model.Business;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.MachineStatus;
import com.meterline.core.model.ProvisioningAction;
import com.meterline.core.model.ProvisioningStatus;
import com.meterline.core.model.ProvisioningTask;
import com.meterline.core.model.TickEvent;
import com.meterline.core.msg.ControlMessages.DeadLetterNotice;
import com.meterline.core.msg.Topics;
import com.meterline.core.runtime.Actor;
import com.meterline.core.runtime.ActorSystem;
import com.meterline.core.util.RetryBackoff;
import com.meterline.provisioner.config.ProvisioningConfig;
import com.meterline.provisioner.fly.IMachineProvider;
import com.meterline.provisioner.store.IProvisioningStore;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Drains the durable provisioning queue.
 * <p>
 * <b>Triggers:</b>
 * <ul>
 *   <li>Poll tick (default {@code 30s}): up to {@code pollBatchSize} due tasks, one at a time</li>
 *   <li>Expiry tick (default {@code 1h}): expired machines enter their grace period, machines past
 *       grace get an idempotent terminate task</li>
 * </ul>
 * </p>
 * <p>
 * <b>Failure handling:</b> every failed attempt increments {@code attemptCount}. Once it reaches
 * {@code maxAttempts} the task is dead-lettered (terminal); otherwise it is retried after
 * {@code retryStep * attemptCount}.
 * </p>
 */
public class ProvisioningProcessor extends Actor<ProvisioningMessage> {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningProcessor.class);

    public static final String KEY = "provisioner";

    static final String PAYLOAD_IMAGE = "docker_image";
    static final String PAYLOAD_SIZE = "machine_size";
    static final String PAYLOAD_REGION = "region";
    static final String PAYLOAD_APP = "app_name";
    static final String PAYLOAD_MACHINE_ID = "machine_id";

    private final IProvisioningStore store;
    private final IMachineProvider provider;
    private final ProvisioningQueue queue;
    private final ProvisioningConfig config;
    private final MachineListener machineListener;
    private final DeadLetterSink deadLetterSink;

    private boolean polling;
    private boolean sweeping;

    public ProvisioningProcessor(ActorSystem system, IProvisioningStore store, IMachineProvider provider,
                                 ProvisioningQueue queue, ProvisioningConfig config,
                                 MachineListener machineListener, DeadLetterSink deadLetterSink) {
        super(KEY, ProvisioningMessage.class, system);
        this.store = store;
        this.provider = provider;
        this.queue = queue;
        this.config = config;
        this.machineListener = machineListener;
        this.deadLetterSink = deadLetterSink;
    }

    @Override
    public String kind() {
        return "provisioner";
    }

    @Override
    protected void preStart() {
        subscribe(Topics.tick(config.getPollInterval()), TickEvent.class, tick -> new ProvisioningMessage.Poll());
        subscribe(Topics.tick(config.getExpirySweepInterval()), TickEvent.class,
            tick -> new ProvisioningMessage.ExpirySweep());
        log.info("Provisioning processor started: poll every {}, expiry sweep every {}",
            config.getPollInterval(), config.getExpirySweepInterval());
    }

    @Override
    protected void onMessage(ProvisioningMessage message) {
        if (message instanceof ProvisioningMessage.Poll) {
            if (polling) {
                log.debug("Poll skipped, previous poll still running");
                return;
            }
            polling = true;
            processDue()
                .onErrorResume(err -> {
                    log.warn("Provisioning poll failed: {}", err.getMessage(), err);
                    return Mono.just(0L);
                })
                .subscribe(count -> tell(new ProvisioningMessage.PollFinished(count)));
        } else if (message instanceof ProvisioningMessage.PollFinished finished) {
            polling = false;
            if (finished.processed() > 0) {
                log.debug("Processed {} provisioning tasks", finished.processed());
            }
        } else if (message instanceof ProvisioningMessage.ExpirySweep) {
            if (sweeping) {
                return;
            }
            sweeping = true;
            sweepExpired()
                .onErrorResume(err -> {
                    log.warn("Expiry sweep failed: {}", err.getMessage(), err);
                    return Mono.just(0L);
                })
                .subscribe(count -> tell(new ProvisioningMessage.SweepFinished(count)));
        } else if (message instanceof ProvisioningMessage.SweepFinished finished) {
            sweeping = false;
            if (finished.swept() > 0) {
                log.info("Expiry sweep handled {} machines", finished.swept());
            }
        }
    }

    /**
     * Processes up to {@code pollBatchSize} due tasks sequentially.
     *
     * @return number of tasks attempted
     */
    public Mono<Long> processDue() {
        return Flux.defer(() -> store.dueTasks(now(), config.getPollBatchSize()))
            .concatMap(this::process)
            .count();
    }

    /**
     * One attempt at a task; the returned task is already persisted.
     */
    Mono<ProvisioningTask> process(ProvisioningTask task) {
        long startedAt = now();
        ProvisioningTask attempt = task.withLastAttemptAt(startedAt);
        log.debug("Attempting {} task {} ({}/{})", task.getAction().wireName(), task.getId(),
            attempt.getAttemptCount() + 1, attempt.getMaxAttempts());

        return Mono.defer(() -> execute(attempt))
            .then(Mono.defer(() -> complete(attempt)))
            .onErrorResume(err -> fail(attempt, err));
    }

    private Mono<Void> execute(ProvisioningTask task) {
        switch (task.getAction()) {
            case PROVISION:
                return provision(task);
            case TERMINATE:
                return transition(task, CustomerMachine::isLive, MachineStatus.TERMINATED);
            case SUSPEND:
                return transition(task, m -> m.getStatus() == MachineStatus.RUNNING, MachineStatus.SUSPENDED);
            case RESUME:
                return transition(task, m -> m.getStatus() == MachineStatus.SUSPENDED
                    || m.getStatus() == MachineStatus.GRACE_PERIOD, MachineStatus.RUNNING);
            default:
                return Mono.error(new IllegalArgumentException("Unsupported action " + task.getAction()));
        }
    }

    private Mono<Void> provision(ProvisioningTask task) {
        return loadBusiness(task.getBusinessId())
            .flatMap(business -> {
                String image = firstNonBlank(task.payloadValue(PAYLOAD_IMAGE), business.getDefaultDockerImage());
                if (image == null) {
                    return Mono.error(new ProviderException("No docker image for business " + business.getBusinessId()));
                }
                String size = firstNonBlank(task.payloadValue(PAYLOAD_SIZE), business.getDefaultMachineSize());
                String region = firstNonBlank(task.payloadValue(PAYLOAD_REGION), business.getDefaultRegion());
                String appName = firstNonBlank(task.payloadValue(PAYLOAD_APP), business.appNameFor(task.getCustomerId()));

                return provider.createMachine(apiToken(business), orgSlug(business), appName, region, size, image)
                    .flatMap(info -> {
                        long createdAt = now();
                        CustomerMachine machine = CustomerMachine.builder()
                            .machineId(info.id())
                            .businessId(task.getBusinessId())
                            .customerId(task.getCustomerId())
                            .appName(appName)
                            .provider(task.getProvider())
                            .status(MachineStatus.RUNNING)
                            .ipAddress(info.privateIp())
                            .region(info.region())
                            .size(size)
                            .dockerImage(image)
                            .expiresAt(expiryFrom(createdAt))
                            .createdAt(createdAt)
                            .build();
                        return store.saveMachine(machine);
                    });
            })
            .then(Mono.defer(() -> notifyMachines(task)));
    }

    /**
     * Applies a provider action to every matching machine of the customer (or only the one
     * named in the payload) and records the new status.
     */
    private Mono<Void> transition(ProvisioningTask task, Predicate<CustomerMachine> eligible,
                                  MachineStatus target) {
        String onlyMachine = task.payloadValue(PAYLOAD_MACHINE_ID);
        return store.getBusiness(task.getBusinessId())
            .defaultIfEmpty(Business.builder().businessId(task.getBusinessId()).build())
            .flatMap(business -> store.machines(task.getBusinessId(), task.getCustomerId())
                .filter(eligible)
                .filter(m -> onlyMachine == null || onlyMachine.equals(m.getMachineId()))
                .concatMap(m -> providerCall(business, m, target).then(store.saveMachine(updated(m, target))))
                .then())
            .then(Mono.defer(() -> notifyMachines(task)));
    }

    private Mono<Void> providerCall(Business business, CustomerMachine machine, MachineStatus target) {
        String token = apiToken(business);
        switch (target) {
            case TERMINATED:
                return provider.terminateMachine(token, machine.getAppName(), machine.getMachineId());
            case SUSPENDED:
                return provider.stopMachine(token, machine.getAppName(), machine.getMachineId());
            case RUNNING:
                // a machine in grace was never stopped
                return machine.getStatus() == MachineStatus.SUSPENDED
                    ? provider.startMachine(token, machine.getAppName(), machine.getMachineId())
                    : Mono.empty();
            default:
                return Mono.error(new IllegalArgumentException("No provider call for " + target));
        }
    }

    private CustomerMachine updated(CustomerMachine machine, MachineStatus target) {
        long at = now();
        switch (target) {
            case TERMINATED:
                return machine.withStatus(MachineStatus.TERMINATED).withTerminatedAt(at);
            case RUNNING:
                if (machine.getStatus() == MachineStatus.GRACE_PERIOD) {
                    return machine.withStatus(MachineStatus.RUNNING)
                        .withGracePeriodEnds(null)
                        .withExpiresAt(expiryFrom(at));
                }
                return machine.withStatus(MachineStatus.RUNNING);
            default:
                return machine.withStatus(target);
        }
    }

    private Mono<ProvisioningTask> complete(ProvisioningTask task) {
        long at = now();
        ProvisioningTask completed = task.toBuilder()
            .attemptCount(task.getAttemptCount() + 1)
            .status(ProvisioningStatus.COMPLETED)
            .completedAt(at)
            .errorMessage(null)
            .build();
        return store.saveTask(completed)
            .doOnSuccess(v -> {
                count(task.getAction(), "completed");
                log.info("Completed {} task {} for {}/{}", task.getAction().wireName(), task.getId(),
                    task.getBusinessId(), task.getCustomerId());
            })
            .thenReturn(completed);
    }

    private Mono<ProvisioningTask> fail(ProvisioningTask task, Throwable error) {
        long at = now();
        int attempts = task.getAttemptCount() + 1;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        if (attempts >= task.getMaxAttempts()) {
            ProvisioningTask dead = task.toBuilder()
                .attemptCount(attempts)
                .status(ProvisioningStatus.DEAD_LETTER)
                .deadLetterAt(at)
                .errorMessage(message)
                .build();
            return store.saveTask(dead)
                .doOnSuccess(v -> deadLetter(dead))
                .thenReturn(dead)
                .onErrorResume(err -> {
                    log.error("Failed to persist dead letter for task {}", task.getId(), err);
                    return Mono.just(dead);
                });
        }

        ProvisioningTask retry = task.toBuilder()
            .attemptCount(attempts)
            .nextRetryAt(RetryBackoff.nextRetryAt(at, attempts, config.getRetryStep()))
            .errorMessage(message)
            .build();
        return store.saveTask(retry)
            .doOnSuccess(v -> {
                count(task.getAction(), "retry");
                log.warn("Task {} ({}) failed on attempt {}/{}, retrying at {}: {}", task.getId(),
                    task.getAction().wireName(), attempts, task.getMaxAttempts(), retry.getNextRetryAt(), message);
            })
            .thenReturn(retry)
            .onErrorResume(err -> {
                log.error("Failed to persist retry state for task {}", task.getId(), err);
                return Mono.just(retry);
            });
    }

    private void deadLetter(ProvisioningTask task) {
        count(task.getAction(), "dead_letter");
        Counter.builder(MetricsNames.PROVISIONING_DEAD_LETTER_TOTAL)
            .tag(MetricsTags.ACTION, task.getAction().wireName())
            .register(system.getMeterRegistry())
            .increment();
        log.error("Task {} ({}) for {}/{} dead-lettered after {} attempts: {}", task.getId(),
            task.getAction().wireName(), task.getBusinessId(), task.getCustomerId(),
            task.getAttemptCount(), task.getErrorMessage());
        try {
            deadLetterSink.accept(DeadLetterNotice.builder()
                .taskId(task.getId())
                .businessId(task.getBusinessId())
                .customerId(task.getCustomerId())
                .action(task.getAction())
                .attemptCount(task.getAttemptCount())
                .errorMessage(task.getErrorMessage())
                .ts(task.getDeadLetterAt())
                .build());
        } catch (RuntimeException e) {
            log.warn("Dead letter sink rejected notice for task {}", task.getId(), e);
        }
    }

    /**
     * Expired machines enter {@code grace_period}; machines past their grace end get a
     * terminate task keyed {@code expire:{machineId}}.
     *
     * @return number of machines handled
     */
    public Mono<Long> sweepExpired() {
        return Flux.defer(() -> store.expiringMachines(now(), config.getExpirySweepBatchSize()))
            .concatMap(this::sweep)
            .count();
    }

    private Mono<CustomerMachine> sweep(CustomerMachine machine) {
        long at = now();
        if (machine.getStatus() == MachineStatus.GRACE_PERIOD) {
            if (machine.getGracePeriodEnds() != null && machine.getGracePeriodEnds() > at) {
                return Mono.empty();
            }
            return scheduleTermination(machine).thenReturn(machine);
        }
        if (machine.getExpiresAt() == null || machine.getExpiresAt() > at) {
            return Mono.empty();
        }
        return store.getBusiness(machine.getBusinessId())
            .defaultIfEmpty(Business.builder().businessId(machine.getBusinessId()).build())
            .flatMap(business -> {
                long graceEnds = machine.getExpiresAt() + business.getMachineGracePeriodDays() * 86_400_000L;
                CustomerMachine inGrace = machine.withStatus(MachineStatus.GRACE_PERIOD).withGracePeriodEnds(graceEnds);
                Counter.builder(MetricsNames.MACHINES_EXPIRED_TOTAL).register(system.getMeterRegistry()).increment();
                log.info("Machine {} of {}/{} expired, grace period until {}", machine.getMachineId(),
                    machine.getBusinessId(), machine.getCustomerId(), graceEnds);
                Mono<Void> saved = store.saveMachine(inGrace);
                return graceEnds <= at ? saved.then(scheduleTermination(inGrace)) : saved;
            })
            .thenReturn(machine);
    }

    private Mono<ProvisioningTask> scheduleTermination(CustomerMachine machine) {
        return queue.enqueue(machine.getBusinessId(), machine.getCustomerId(), ProvisioningAction.TERMINATE,
            "expire:" + machine.getMachineId(), Map.of(PAYLOAD_MACHINE_ID, machine.getMachineId()));
    }

    private Mono<Void> notifyMachines(ProvisioningTask task) {
        return store.machines(task.getBusinessId(), task.getCustomerId())
            .collectList()
            .doOnNext(machines -> {
                try {
                    machineListener.onMachinesChanged(task.getBusinessId(), task.getCustomerId(), machines);
                } catch (RuntimeException e) {
                    log.warn("Machine listener failed for {}/{}", task.getBusinessId(), task.getCustomerId(), e);
                }
            })
            .then();
    }

    private Mono<Business> loadBusiness(String businessId) {
        return store.getBusiness(businessId)
            .switchIfEmpty(Mono.error(() -> new ProviderException("Unknown business " + businessId)));
    }

    private String apiToken(Business business) {
        return firstNonBlank(business.getFlyApiToken(), config.getDefaultFlyApiToken());
    }

    private String orgSlug(Business business) {
        return firstNonBlank(business.getFlyOrgSlug(), config.getDefaultFlyOrg());
    }

    private Long expiryFrom(long at) {
        return config.getMachineLifetime().isZero() ? null : at + config.getMachineLifetime().toMillis();
    }

    private void count(ProvisioningAction action, String outcome) {
        Counter.builder(MetricsNames.PROVISIONING_ATTEMPTS_TOTAL)
            .tag(MetricsTags.ACTION, action.wireName())
            .tag(MetricsTags.OUTCOME, outcome)
            .register(system.getMeterRegistry())
            .increment();
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }
}
