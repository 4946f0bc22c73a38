package org.bbottema.adaptivepool.memory;

import org.jetbrains.annotations.NotNull;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;

/**
 * Reads heap usage from the platform MX beans. The limit is the maximum heap size, which the JVM may report as
 * undefined ({@code -1}).
 */
public class JvmMemoryProbe implements MemoryProbe {

	@NotNull private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

	@Override
	public long usedBytes() {
		return memoryBean.getHeapMemoryUsage().getUsed();
	}

	@Override
	public long peakBytes() {
		long peak = 0;
		for (MemoryPoolMXBean pool : ManagementFactory.getMemoryPoolMXBeans()) {
			if (pool.getType() == MemoryType.HEAP && pool.getPeakUsage() != null) {
				peak += pool.getPeakUsage().getUsed();
			}
		}
		return peak;
	}

	@Override
	public long limitBytes() {
		return memoryBean.getHeapMemoryUsage().getMax();
	}
}
