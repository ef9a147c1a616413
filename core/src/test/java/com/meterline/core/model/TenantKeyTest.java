package com.meterline.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TenantKeyTest {

    @Test
    void testRenderingAndScope() {
        TenantKey customer = TenantKey.customer("b1", "c1");

        assertEquals("customer:b1:c1", customer.render());
        assertEquals("customer", customer.scope());
        assertEquals("business:b1", customer.businessKey().render());
        assertEquals(TenantKey.business("b1"), customer.businessKey());
    }

    @Test
    void testBlankCustomerMeansBusiness() {
        TenantKey key = new TenantKey("b1", " ");

        assertFalse(key.isCustomer());
        assertTrue(key.customer().isEmpty());
    }

    @Test
    void testBusinessIdIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> TenantKey.business(""));
    }
}
