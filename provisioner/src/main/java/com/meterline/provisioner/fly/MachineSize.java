package com.meterline.provisioner.fly;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guest resources parsed from a size preset such as {@code shared-cpu-1x} or {@code performance-2x}.
 * <p>
 * Shared presets get 256 MB per CPU, performance presets 2048 MB per CPU.
 * </p>
 */
public record MachineSize(String cpuKind, int cpus, int memoryMb) {
    private static final Pattern PRESET = Pattern.compile("(shared|performance)(?:-cpu)?-(\\d+)x");

    public static final MachineSize DEFAULT = new MachineSize("shared", 1, 256);

    public static MachineSize parse(String preset) {
        if (preset == null || preset.isBlank()) {
            return DEFAULT;
        }
        Matcher m = PRESET.matcher(preset.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new IllegalArgumentException("Unknown machine size: " + preset);
        }
        String kind = m.group(1);
        int cpus = Integer.parseInt(m.group(2));
        int memoryPerCpu = "performance".equals(kind) ? 2048 : 256;
        return new MachineSize(kind, cpus, cpus * memoryPerCpu);
    }
}
