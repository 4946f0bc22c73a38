package org.bbottema.adaptivepool.memory;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Read-only view of the monitor, for health and metrics endpoints. Timestamps are epoch milliseconds, zero when the
 * event never happened.
 */
@Builder
@NonFinal@Value
public class MemoryPressureState {
	@NotNull private final MemoryPressureTier tier;
	private final long lastTierChangeAt;
	private final long lastGcAt;
	private final double usageRatio;
	@NotNull private final List<MemorySnapshot> history;
	private final long tierChanges;
	private final long gcRuns;
	private final double averageGcDurationMs;
	private final int trackedObjects;
	private final boolean pressureMonitoringEnabled;
	@NotNull private final GcStrategy gcStrategy;
}
