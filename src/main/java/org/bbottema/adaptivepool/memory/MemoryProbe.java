package org.bbottema.adaptivepool.memory;

/**
 * Source of memory figures for the {@link MemoryPressureMonitor}. Implementations may throw a
 * {@link RuntimeException} when introspection is not available; the monitor then stops pressure-driven resizing.
 */
public interface MemoryProbe {
	long usedBytes();

	long peakBytes();

	/**
	 * @return the memory limit in bytes, or zero or less when the runtime cannot tell
	 */
	long limitBytes();
}
