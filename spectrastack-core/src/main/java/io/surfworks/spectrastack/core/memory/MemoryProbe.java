package io.surfworks.spectrastack.core.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.OptionalLong;

/**
 * Source of the number of bytes currently available for chunk buffers.
 *
 * <p>An empty result means "unknown"; {@link MemoryBudget} then falls back to the
 * caller's minimum row capacity.
 */
@FunctionalInterface
public interface MemoryProbe {

    /**
     * Available memory in bytes, or empty if it cannot be determined.
     */
    OptionalLong availableBytes();

    /**
     * Free JVM heap: the maximum heap size minus what is currently in use.
     * Chunk buffers are heap arrays, so this is the default probe.
     */
    static MemoryProbe heap() {
        return HEAP;
    }

    MemoryProbe HEAP = () -> {
        Runtime runtime = Runtime.getRuntime();
        long max = runtime.maxMemory();
        if (max == Long.MAX_VALUE) {
            return OptionalLong.empty();
        }
        long used = runtime.totalMemory() - runtime.freeMemory();
        return OptionalLong.of(Math.max(0, max - used));
    };

    /**
     * Free physical memory reported by the operating system, when the platform MXBean
     * exposes it.
     */
    static MemoryProbe physical() {
        return PHYSICAL;
    }

    MemoryProbe PHYSICAL = () -> {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            long free = sun.getFreeMemorySize();
            return free >= 0 ? OptionalLong.of(free) : OptionalLong.empty();
        }
        return OptionalLong.empty();
    };

    /**
     * A probe always reporting {@code bytes}.
     */
    static MemoryProbe fixed(long bytes) {
        return new Fixed(bytes);
    }

    /**
     * A probe that never knows.
     */
    static MemoryProbe unknown() {
        return UNKNOWN;
    }

    MemoryProbe UNKNOWN = OptionalLong::empty;

    /**
     * Probe reporting a constant figure.
     */
    record Fixed(long bytes) implements MemoryProbe {
        @Override
        public OptionalLong availableBytes() {
            return OptionalLong.of(bytes);
        }
    }
}
