package com.meterline.provisioner;

import com.meterline.core.model.CustomerMachine;

import java.util.List;

/**
 * Notified after provisioning work changed the machines of a customer.
 */
@FunctionalInterface
public interface MachineListener {
    void onMachinesChanged(String businessId, String customerId, List<CustomerMachine> machines);

    MachineListener NOOP = (businessId, customerId, machines) -> {
    };
}
