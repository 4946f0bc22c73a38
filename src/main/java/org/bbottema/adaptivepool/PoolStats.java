package org.bbottema.adaptivepool;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.jetbrains.annotations.NotNull;

/**
 * Point-in-time copy of a {@link LocalPool}'s counters and gauges. At the moment it was taken,
 * {@code borrowed - returned == inUseCount} and {@code inUseCount <= currentSize + overflowOutstanding}.
 */
@Builder
@NonFinal@Value
public class PoolStats {
	@NotNull private final String kind;
	private final long borrowed;
	private final long returned;
	private final long created;
	private final long destroyed;
	private final long expanded;
	private final long shrunk;
	private final long overflowCreated;
	private final long emergencyActivations;
	private final int currentSize;
	private final int freeCount;
	/**
	 * Everything currently handed out, pooled slots and overflow objects alike.
	 */
	private final int inUseCount;
	private final int overflowOutstanding;
	private final int maxSize;
	private final int emergencyLimit;
	private final double peakUtilization;

	/**
	 * @return Share of pooled slots currently borrowed, overflow objects excluded.
	 */
	public double getUtilization() {
		return currentSize == 0 ? 0 : (double) (inUseCount - overflowOutstanding) / currentSize;
	}
}
