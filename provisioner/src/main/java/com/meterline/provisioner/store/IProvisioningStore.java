package com.meterline.provisioner.store;

import com.meterline.core.model.Business;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.ProvisioningTask;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable storage for provisioning tasks and customer machines.
 */
public interface IProvisioningStore {

    /**
     * Stores the task unless its idempotency key is already claimed. Claiming the key and
     * storing the task happen together: when the insert fails the key stays free for a retry.
     *
     * @return the stored task, or the task that owns the idempotency key
     */
    Mono<ProvisioningTask> insertTaskIfAbsent(ProvisioningTask task);

    /**
     * Persists a task transition.
     */
    Mono<Void> saveTask(ProvisioningTask task);

    Mono<ProvisioningTask> getTask(String taskId);

    /**
     * Pending tasks with {@code nextRetryAt <= now}, oldest first.
     */
    Flux<ProvisioningTask> dueTasks(long now, int limit);

    Mono<Business> getBusiness(String businessId);

    Mono<Void> saveMachine(CustomerMachine machine);

    Flux<CustomerMachine> machines(String businessId, String customerId);

    /**
     * Live machines whose expiry (or grace end, once in grace) is at or before {@code now}.
     */
    Flux<CustomerMachine> expiringMachines(long now, int limit);

    default void close() {
    }
}
