package com.meterline.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanLimitTest {

    private static final TenantKey BUSINESS = TenantKey.business("b1");
    private static final TenantKey CUSTOMER = TenantKey.customer("b1", "c1");

    @Test
    void testDenyOnlyWhenActionIsDeny() {
        PlanLimit deny = PlanLimit.builder().metricName("api_calls").limitValue(100).build();
        PlanLimit webhook = deny.withBreachAction(BreachAction.WEBHOOK);

        assertFalse(deny.denies(99));
        assertTrue(deny.denies(100));
        assertTrue(webhook.isBreached(100));
        assertFalse(webhook.denies(100));
    }

    @Test
    void testOverageIsAllowedButAnnounced() {
        PlanLimit overage = PlanLimit.builder().metricName("api_calls").limitValue(100)
            .breachAction(BreachAction.ALLOW_OVERAGE).build();

        assertTrue(overage.isBreached(150));
        assertFalse(overage.denies(150));
        assertTrue(BreachAction.ALLOW_OVERAGE.notifies());
        assertTrue(BreachAction.WEBHOOK.notifies());
        assertFalse(BreachAction.DENY.notifies());
        assertFalse(BreachAction.ALLOW.notifies());
    }

    @Test
    void testBreachActionParsing() {
        assertEquals(BreachAction.DENY, BreachAction.parse(null));
        assertEquals(BreachAction.ALLOW_OVERAGE, BreachAction.parse(" allow_overage "));
        assertEquals("webhook", BreachAction.WEBHOOK.wireName());
    }

    @Test
    void testOperatorsCompareAgainstLimit() {
        PlanLimit gt = PlanLimit.builder().metricName("m").limitValue(10).breachOperator(BreachOperator.GT).build();
        PlanLimit lt = gt.withBreachOperator(BreachOperator.LT);

        assertFalse(gt.isBreached(10));
        assertTrue(gt.isBreached(10.5));
        assertTrue(lt.isBreached(9));
        assertFalse(lt.isBreached(10));
    }

    @Test
    void testPlanScopedLimitMatchesTenantsOnThatPlan() {
        PlanLimit limit = PlanLimit.builder().metricName("m").limitValue(1).planId("pro").build();

        assertTrue(limit.appliesTo(BUSINESS, "pro"));
        assertTrue(limit.appliesTo(CUSTOMER, "pro"));
        assertFalse(limit.appliesTo(BUSINESS, "free"));
        assertFalse(limit.appliesTo(BUSINESS, null));
    }

    @Test
    void testCustomerScopedLimitMatchesOnlyThatCustomer() {
        PlanLimit limit = PlanLimit.builder().metricName("m").limitValue(1)
            .businessId("b1").customerId("c1").planId("pro").build();

        assertTrue(limit.appliesTo(CUSTOMER, "free"));
        assertFalse(limit.appliesTo(BUSINESS, "pro"));
        assertFalse(limit.appliesTo(TenantKey.customer("b2", "c1"), "pro"));
    }

    @Test
    void testBusinessScopedLimitSkipsCustomers() {
        PlanLimit limit = PlanLimit.builder().metricName("m").limitValue(1).businessId("b1").build();

        assertTrue(limit.appliesTo(BUSINESS, null));
        assertFalse(limit.appliesTo(CUSTOMER, null));
    }

    @Test
    void testOperatorParsingDefaultsToGte() {
        assertTrue(BreachOperator.parse(null) == BreachOperator.GTE);
        assertTrue(BreachOperator.parse("lt") == BreachOperator.LT);
    }
}
