package com.meterline.core.model;

/**
 * Outcome of an atomic add-and-check. A denial is a normal result, not an error.
 *
 * @param allowed   whether the delta was kept
 * @param value     aggregate after the call (unchanged when denied)
 * @param attempted aggregate the delta would have produced
 * @param limit     limit evaluated, or {@code null}
 * @param timedOut  decided by the timeout policy instead of the worker
 */
public record CheckResult(boolean allowed, double value, double attempted, PlanLimit limit, boolean timedOut) {

    public static CheckResult allowed(double value, PlanLimit limit) {
        return new CheckResult(true, value, value, limit, false);
    }

    public static CheckResult denied(double value, double attempted, PlanLimit limit) {
        return new CheckResult(false, value, attempted, limit, false);
    }

    public static CheckResult timedOut(boolean allowed) {
        return new CheckResult(allowed, Double.NaN, Double.NaN, null, true);
    }
}
