package com.meterline.provisioner.fly;

import reactor.core.publisher.Mono;

/**
 * VM provider used by the provisioning processor.
 * Every failure surfaces as {@link com.meterline.core.error.ProviderException}.
 */
public interface IMachineProvider {

    /**
     * Creates the app when missing, then a machine inside it.
     */
    Mono<MachineInfo> createMachine(String apiToken, String orgSlug, String appName,
                                    String region, String size, String image);

    Mono<Void> terminateMachine(String apiToken, String appName, String machineId);

    Mono<Void> stopMachine(String apiToken, String appName, String machineId);

    Mono<Void> startMachine(String apiToken, String appName, String machineId);
}
