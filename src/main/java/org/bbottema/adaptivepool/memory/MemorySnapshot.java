package org.bbottema.adaptivepool.memory;

import lombok.Value;

/**
 * One memory sample, as kept in the monitor's rolling history.
 */
@Value
public class MemorySnapshot {
	private final long timestamp;
	private final long usedBytes;
	private final long peakBytes;
	private final long limitBytes;

	public double getUsageRatio() {
		return limitBytes > 0 ? (double) usedBytes / limitBytes : 0;
	}
}
