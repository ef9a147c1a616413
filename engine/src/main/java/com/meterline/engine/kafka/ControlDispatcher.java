package com.meterline.engine.kafka;

import com.meterline.core.msg.ControlMessages.BillingCycleReset;
import com.meterline.core.msg.ControlMessages.PlanChanged;
import com.meterline.core.msg.ControlMessages.PlanLimitChanged;
import com.meterline.core.msg.ControlMessages.ProvisioningRequest;
import com.meterline.core.msg.ControlMessages.RecordMetric;
import com.meterline.core.msg.Topics;
import com.meterline.core.util.JsonUtils;
import com.meterline.engine.MeterRouter;
import com.meterline.provisioner.ProvisioningQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Maps one inbound Kafka record onto the router or the provisioning queue.
 */
public class ControlDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ControlDispatcher.class);

    public static final List<String> INBOUND_TOPICS = List.of(
        Topics.METRICS_RECORD,
        Topics.CONTROL_PLAN_LIMITS,
        Topics.CONTROL_PLANS,
        Topics.CONTROL_BILLING,
        Topics.CONTROL_PROVISIONING
    );

    private final MeterRouter router;
    private final ProvisioningQueue queue;

    public ControlDispatcher(MeterRouter router, ProvisioningQueue queue) {
        this.router = router;
        this.queue = queue;
    }

    /**
     * @return Mono completing once the message was handed over; errors on malformed payloads
     */
    public Mono<Void> dispatch(String topic, String value) {
        return Mono.defer(() -> {
            switch (topic) {
                case Topics.METRICS_RECORD: {
                    RecordMetric command = JsonUtils.readValue(value, RecordMetric.class);
                    if (!router.record(command)) {
                        log.warn("Sample {} for {} was not enqueued", command.getMetricName(), command.tenantKey());
                    }
                    return Mono.empty();
                }
                case Topics.CONTROL_PLAN_LIMITS: {
                    PlanLimitChanged change = JsonUtils.readValue(value, PlanLimitChanged.class);
                    if (change.getLimit() == null) {
                        return Mono.error(new IllegalArgumentException("plan limit change without a limit"));
                    }
                    router.applyPlanLimit(change);
                    return Mono.empty();
                }
                case Topics.CONTROL_PLANS: {
                    PlanChanged change = JsonUtils.readValue(value, PlanChanged.class);
                    router.planChanged(change);
                    return Mono.empty();
                }
                case Topics.CONTROL_BILLING: {
                    BillingCycleReset reset = JsonUtils.readValue(value, BillingCycleReset.class);
                    router.billingReset(reset);
                    return Mono.empty();
                }
                case Topics.CONTROL_PROVISIONING: {
                    ProvisioningRequest request = JsonUtils.readValue(value, ProvisioningRequest.class);
                    return queue.enqueue(request)
                        .doOnNext(task -> log.info("Provisioning task {} ({}) queued for {}/{}",
                            task.getId(), task.getAction().wireName(), task.getBusinessId(), task.getCustomerId()))
                        .then();
                }
                default:
                    log.warn("Ignoring message on unexpected topic {}", topic);
                    return Mono.empty();
            }
        });
    }
}
