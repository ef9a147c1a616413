package com.meterline.engine.worker;

import com.meterline.core.model.CheckResult;
import com.meterline.core.model.CustomerMachine;
import com.meterline.core.model.LimitStatus;
import com.meterline.core.model.PlanLimit;
import com.meterline.core.model.TenantKey;
import com.meterline.core.msg.ControlMessages.BillingCycleReset;
import com.meterline.core.msg.ControlMessages.PlanChanged;
import com.meterline.core.msg.ControlMessages.PlanLimitChanged;
import com.meterline.core.msg.ControlMessages.RecordMetric;
import reactor.core.publisher.MonoSink;

import java.util.List;

/**
 * Mailbox messages of {@link TenantWorker}.
 */
public interface TenantMessage {

    /**
     * Messages addressed to a metric of a tenant. A business worker forwards the ones
     * addressed to one of its customers.
     */
    interface MetricCommand extends TenantMessage {
        TenantKey tenant();
    }

    record RecordSample(RecordMetric command) implements MetricCommand {
        @Override
        public TenantKey tenant() {
            return command.tenantKey();
        }
    }

    record CheckMetric(RecordMetric command, MonoSink<CheckResult> reply) implements MetricCommand {
        @Override
        public TenantKey tenant() {
            return command.tenantKey();
        }
    }

    record QueryMetric(TenantKey tenant, String metricName, MonoSink<LimitStatus> reply) implements MetricCommand {
    }

    /**
     * Result of the asynchronous limit load, fed back through the mailbox.
     */
    record LimitsLoaded(String planId, List<LoadedLimit> limits) implements TenantMessage {
    }

    record LimitsLoadFailed(Throwable error) implements TenantMessage {
    }

    /**
     * @param restoredValue persisted checkpoint total of the metric, {@code null} when not restored
     */
    record LoadedLimit(PlanLimit limit, Double restoredValue) {
    }

    record ApplyPlanLimit(PlanLimitChanged change) implements TenantMessage {
    }

    record ChangePlan(PlanChanged change) implements TenantMessage {
    }

    record UpdateMachines(List<CustomerMachine> machines) implements TenantMessage {
    }

    /**
     * Routed like a metric command so a tenant that is not live is spawned to apply it.
     */
    record ResetBillingCycle(BillingCycleReset reset) implements MetricCommand {
        @Override
        public TenantKey tenant() {
            return reset.tenantKey();
        }
    }

    record Describe(MonoSink<TenantSnapshot> reply) implements TenantMessage {
    }

    record CleanupTick(long timestamp) implements TenantMessage {
    }

    /**
     * Cascades {@code Shutdown} to every child, then stops.
     */
    record Shutdown() implements TenantMessage {
    }
}
