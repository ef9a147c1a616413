package com.meterline.core.model;

/**
 * Identity of a live metric worker: {@code (scopeKey, metricName)}.
 *
 * @param scopeKey   rendering of the owning scope (a {@link TenantKey} or {@code ip:<addr>})
 * @param metricName metric name, unique within the scope
 */
public record MetricIdentity(String scopeKey, String metricName) {

    public MetricIdentity {
        if (scopeKey == null || scopeKey.isBlank()) {
            throw new IllegalArgumentException("scopeKey is required");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName is required");
        }
    }

    public static MetricIdentity of(TenantKey tenant, String metricName) {
        return new MetricIdentity(tenant.render(), metricName);
    }

    /**
     * Registry key of the metric worker.
     */
    public String render() {
        return "metric:" + scopeKey + ":" + metricName;
    }

    @Override
    public String toString() {
        return render();
    }
}
