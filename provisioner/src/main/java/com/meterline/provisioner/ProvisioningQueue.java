package com.meterline.provisioner;

import com.meterline.core.model.ProvisioningAction;
import com.meterline.core.model.ProvisioningStatus;
import com.meterline.core.model.ProvisioningTask;
import com.meterline.core.msg.ControlMessages.ProvisioningRequest;
import com.meterline.provisioner.config.ProvisioningConfig;
import com.meterline.provisioner.store.IProvisioningStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for new provisioning work. Enqueueing is idempotent on the idempotency key.
 */
public class ProvisioningQueue {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningQueue.class);

    private final IProvisioningStore store;
    private final ProvisioningConfig config;
    private final Clock clock;

    public ProvisioningQueue(IProvisioningStore store, ProvisioningConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Enqueues a task due immediately.
     *
     * @return the new task, or the existing one owning the same idempotency key
     */
    public Mono<ProvisioningTask> enqueue(ProvisioningRequest request) {
        if (request.getBusinessId() == null || request.getCustomerId() == null || request.getAction() == null) {
            return Mono.error(new IllegalArgumentException("businessId, customerId and action are required"));
        }
        long now = clock.millis();
        String id = UUID.randomUUID().toString();
        String idempotencyKey = request.getIdempotencyKey() != null
            ? request.getIdempotencyKey()
            : request.getAction().wireName() + ":" + request.getBusinessId() + ":" + request.getCustomerId() + ":" + id;

        ProvisioningTask task = ProvisioningTask.builder()
            .id(id)
            .businessId(request.getBusinessId())
            .customerId(request.getCustomerId())
            .action(request.getAction())
            .status(ProvisioningStatus.PENDING)
            .maxAttempts(request.getMaxAttempts() != null ? request.getMaxAttempts() : config.getMaxAttempts())
            .nextRetryAt(now)
            .idempotencyKey(idempotencyKey)
            .payload(request.getPayload() != null ? request.getPayload() : Map.of())
            .createdAt(now)
            .build();

        return store.insertTaskIfAbsent(task)
            .doOnNext(stored -> {
                if (stored.getId().equals(id)) {
                    log.info("Enqueued {} task {} for {}/{}", stored.getAction().wireName(), id,
                        stored.getBusinessId(), stored.getCustomerId());
                } else {
                    log.debug("Task for key {} already exists: {}", idempotencyKey, stored.getId());
                }
            });
    }

    public Mono<ProvisioningTask> enqueue(String businessId, String customerId, ProvisioningAction action,
                                          String idempotencyKey, Map<String, String> payload) {
        return enqueue(ProvisioningRequest.builder()
            .businessId(businessId)
            .customerId(customerId)
            .action(action)
            .idempotencyKey(idempotencyKey)
            .payload(payload != null ? payload : Map.of())
            .build());
    }
}
