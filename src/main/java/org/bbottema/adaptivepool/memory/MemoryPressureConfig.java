package org.bbottema.adaptivepool.memory;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.bbottema.adaptivepool.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Tier boundaries, pool adjustment factors, garbage collection schedule and tracked-object lifetimes for the
 * {@link MemoryPressureMonitor}. Every property is optional in the builder.
 */
@NonFinal@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class MemoryPressureConfig {
	/**
	 * Minimum time between two samples. Default 5 seconds.
	 */
	@NotNull private final Timeout checkInterval;
	/**
	 * Usage ratios from which pressure is medium, high and critical. Defaults 0.5, 0.7 and 0.9.
	 */
	private final double mediumRatio;
	private final double highRatio;
	private final double criticalRatio;
	/**
	 * Pool adjustment factor per tier. Defaults 1.2, 1.0, 0.7 and 0.5.
	 */
	private final double lowFactor;
	private final double mediumFactor;
	private final double highFactor;
	private final double criticalFactor;
	/**
	 * Minimum time between routine garbage collections per tier. Defaults 60, 30 and 10 seconds.
	 */
	@NotNull private final Timeout lowGcInterval;
	@NotNull private final Timeout mediumGcInterval;
	@NotNull private final Timeout highGcInterval;
	@NotNull private final GcStrategy gcStrategy;
	/**
	 * Number of samples kept in the rolling history. Default 100.
	 */
	private final int historySize;
	/**
	 * Overrides the limit reported by the {@link MemoryProbe} when positive.
	 */
	private final long memoryLimitBytes;
	/**
	 * Maximum lifetime of tracked objects per kind before they are reported as possible leaks. Defaults 300 seconds
	 * for {@code request} and {@code response}, 60 seconds for {@code buffer}.
	 */
	@NotNull private final Map<String, Timeout> trackedLifetimes;
	/**
	 * Lifetime for kinds without an entry in {@link #trackedLifetimes}. Default 300 seconds.
	 */
	@NotNull private final Timeout defaultTrackedLifetime;

	@Builder
	@SuppressWarnings("unused")
	private MemoryPressureConfig(@Nullable Timeout checkInterval, @Nullable Double mediumRatio, @Nullable Double highRatio,
			@Nullable Double criticalRatio, @Nullable Double lowFactor, @Nullable Double mediumFactor,
			@Nullable Double highFactor, @Nullable Double criticalFactor, @Nullable Timeout lowGcInterval,
			@Nullable Timeout mediumGcInterval, @Nullable Timeout highGcInterval, @Nullable GcStrategy gcStrategy,
			@Nullable Integer historySize, @Nullable Long memoryLimitBytes, @Nullable Map<String, Timeout> trackedLifetimes,
			@Nullable Timeout defaultTrackedLifetime) {
		this.checkInterval = checkInterval != null ? checkInterval : new Timeout(5, SECONDS);
		this.mediumRatio = mediumRatio != null ? mediumRatio : 0.5;
		this.highRatio = highRatio != null ? highRatio : 0.7;
		this.criticalRatio = criticalRatio != null ? criticalRatio : 0.9;
		this.lowFactor = lowFactor != null ? lowFactor : 1.2;
		this.mediumFactor = mediumFactor != null ? mediumFactor : 1.0;
		this.highFactor = highFactor != null ? highFactor : 0.7;
		this.criticalFactor = criticalFactor != null ? criticalFactor : 0.5;
		this.lowGcInterval = lowGcInterval != null ? lowGcInterval : new Timeout(60, SECONDS);
		this.mediumGcInterval = mediumGcInterval != null ? mediumGcInterval : new Timeout(30, SECONDS);
		this.highGcInterval = highGcInterval != null ? highGcInterval : new Timeout(10, SECONDS);
		this.gcStrategy = gcStrategy != null ? gcStrategy : GcStrategy.ADAPTIVE;
		this.historySize = historySize != null ? historySize : 100;
		this.memoryLimitBytes = memoryLimitBytes != null ? memoryLimitBytes : 0;
		this.defaultTrackedLifetime = defaultTrackedLifetime != null ? defaultTrackedLifetime : new Timeout(300, SECONDS);

		final Map<String, Timeout> lifetimes = new HashMap<>();
		lifetimes.put("request", new Timeout(300, SECONDS));
		lifetimes.put("response", new Timeout(300, SECONDS));
		lifetimes.put("buffer", new Timeout(60, SECONDS));
		if (trackedLifetimes != null) {
			lifetimes.putAll(trackedLifetimes);
		}
		this.trackedLifetimes = Collections.unmodifiableMap(lifetimes);

		if (!(0 < this.mediumRatio && this.mediumRatio < this.highRatio && this.highRatio < this.criticalRatio)) {
			throw new IllegalArgumentException("Tier ratios should be ascending: 0 < medium < high < critical");
		}
		if (this.lowFactor <= 0 || this.mediumFactor <= 0 || this.highFactor <= 0 || this.criticalFactor <= 0) {
			throw new IllegalArgumentException("Pool adjustment factors should be positive");
		}
		if (this.historySize < 1) {
			throw new IllegalArgumentException("History should keep at least one sample");
		}
	}

	@NotNull
	public static MemoryPressureConfig defaults() {
		return builder().build();
	}

	@NotNull
	public MemoryPressureTier classify(double usageRatio) {
		if (usageRatio >= criticalRatio) {
			return MemoryPressureTier.CRITICAL;
		} else if (usageRatio >= highRatio) {
			return MemoryPressureTier.HIGH;
		} else if (usageRatio >= mediumRatio) {
			return MemoryPressureTier.MEDIUM;
		}
		return MemoryPressureTier.LOW;
	}

	public double getAdjustmentFactor(@NotNull MemoryPressureTier tier) {
		switch (tier) {
			case CRITICAL: return criticalFactor;
			case HIGH: return highFactor;
			case MEDIUM: return mediumFactor;
			default: return lowFactor;
		}
	}

	/**
	 * @return the routine garbage collection interval for a non-critical tier
	 */
	@NotNull
	public Timeout getGcInterval(@NotNull MemoryPressureTier tier) {
		switch (tier) {
			case CRITICAL: return Timeout.NONE;
			case HIGH: return highGcInterval;
			case MEDIUM: return mediumGcInterval;
			default: return lowGcInterval;
		}
	}

	@NotNull
	public Timeout getTrackedLifetime(@NotNull String kind) {
		final Timeout lifetime = trackedLifetimes.get(kind);
		return lifetime != null ? lifetime : defaultTrackedLifetime;
	}
}
