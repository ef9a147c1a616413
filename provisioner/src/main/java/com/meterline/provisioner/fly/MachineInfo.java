package com.meterline.provisioner.fly;

/**
 * Provider view of a created machine.
 */
public record MachineInfo(String id, String privateIp, String state, String region) {
}
