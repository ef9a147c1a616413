package com.meterline.engine.worker;

import com.meterline.core.model.MetricIdentity;
import com.meterline.core.model.TenantKey;

/**
 * Registry keys of engine workers.
 * <ul>
 *   <li>{@code business:{b}} and {@code customer:{b}:{c}}: tenant workers</li>
 *   <li>{@code metric:{scopeKey}:{name}}: metric workers</li>
 *   <li>{@code ip:{addr}}: rate-limit counters</li>
 * </ul>
 */
public final class WorkerKeys {
    private WorkerKeys() {
    }

    public static final String BUSINESS_PREFIX = TenantKey.BUSINESS_SCOPE + ":";
    public static final String CUSTOMER_PREFIX = TenantKey.CUSTOMER_SCOPE + ":";
    public static final String METRIC_PREFIX = "metric:";
    public static final String IP_PREFIX = "ip:";

    public static String tenant(TenantKey tenant) {
        return tenant.render();
    }

    public static String metric(TenantKey tenant, String metricName) {
        return MetricIdentity.of(tenant, metricName).render();
    }

    public static String ip(String address) {
        return IP_PREFIX + address;
    }
}
