package org.bbottema.adaptivepool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.bbottema.adaptivepool.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.TimeUnit;

/**
 * Sizing and scaling rules for one {@link LocalPool}. Every property is optional in the builder; omitted ones get
 * the defaults documented per field.
 */
@NonFinal@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class PoolConfig {
	public static final int DEFAULT_INITIAL_SIZE = 10;
	public static final int DEFAULT_MAX_SIZE = 100;
	public static final int DEFAULT_EMERGENCY_LIMIT = 200;
	public static final double DEFAULT_SCALE_THRESHOLD = 0.8;
	public static final double DEFAULT_GROWTH_FACTOR = 1.5;
	public static final Timeout DEFAULT_COOLDOWN_PERIOD = new Timeout(60, TimeUnit.SECONDS);
	public static final double DEFAULT_SHRINK_THRESHOLD = 0.2;
	public static final double DEFAULT_SHRINK_FACTOR = 0.7;

	/**
	 * Number of slots created up front. Default 10.
	 */
	private final int initialSize;
	/**
	 * Largest {@code currentSize} that borrow-triggered expansion may reach. Default 100.
	 */
	private final int maxSize;
	/**
	 * Cap on pooled slots plus outstanding overflow objects. Beyond it borrows fail with {@link PoolExhaustedException}.
	 * Default 200.
	 */
	private final int emergencyLimit;
	/**
	 * Utilization ratio ({@code inUse / currentSize}) from which an empty pool is allowed to grow. Default 0.8.
	 */
	private final double scaleThreshold;
	/**
	 * Multiplier applied to {@code currentSize} on expansion, capped at {@link #maxSize}. Default 1.5.
	 */
	private final double growthFactor;
	/**
	 * Minimum time between two consecutive scaling events. Default 60 seconds.
	 */
	@NotNull private final Timeout cooldownPeriod;
	/**
	 * Lower bound when resizing. Default 1.
	 */
	private final int minSize;
	/**
	 * Upper bound when resizing, also when limits are scaled along. Default unbounded.
	 */
	private final int hardCeiling;
	/**
	 * Utilization at or below which a return triggers an automatic shrink (never below {@link #initialSize}). Default 0.2.
	 */
	private final double shrinkThreshold;
	/**
	 * Multiplier applied to {@code currentSize} on automatic shrink. Default 0.7.
	 */
	private final double shrinkFactor;
	/**
	 * Enables automatic shrinking on return. Expansion on borrow is part of the pool contract and is not affected.
	 */
	private final boolean autoScale;

	@Builder
	@SuppressWarnings("unused")
	private PoolConfig(@Nullable Integer initialSize, @Nullable Integer maxSize, @Nullable Integer emergencyLimit,
			@Nullable Double scaleThreshold, @Nullable Double growthFactor, @Nullable Timeout cooldownPeriod,
			@Nullable Integer minSize, @Nullable Integer hardCeiling, @Nullable Double shrinkThreshold,
			@Nullable Double shrinkFactor, @Nullable Boolean autoScale) {
		this.initialSize = initialSize != null ? initialSize : DEFAULT_INITIAL_SIZE;
		this.maxSize = maxSize != null ? maxSize : Math.max(DEFAULT_MAX_SIZE, this.initialSize);
		this.emergencyLimit = emergencyLimit != null ? emergencyLimit : Math.max(DEFAULT_EMERGENCY_LIMIT, this.maxSize);
		this.scaleThreshold = scaleThreshold != null ? scaleThreshold : DEFAULT_SCALE_THRESHOLD;
		this.growthFactor = growthFactor != null ? growthFactor : DEFAULT_GROWTH_FACTOR;
		this.cooldownPeriod = cooldownPeriod != null ? cooldownPeriod : DEFAULT_COOLDOWN_PERIOD;
		this.minSize = minSize != null ? minSize : 1;
		this.hardCeiling = hardCeiling != null ? hardCeiling : Integer.MAX_VALUE;
		this.shrinkThreshold = shrinkThreshold != null ? shrinkThreshold : DEFAULT_SHRINK_THRESHOLD;
		this.shrinkFactor = shrinkFactor != null ? shrinkFactor : DEFAULT_SHRINK_FACTOR;
		this.autoScale = autoScale != null ? autoScale : true;

		if (this.initialSize < 0) {
			throw new IllegalArgumentException("Initial size cannot be negative");
		}
		if (this.maxSize <= 0) {
			throw new IllegalArgumentException("Pool should have a max size of at least one");
		}
		if (this.initialSize > this.maxSize) {
			throw new IllegalArgumentException("Initial size cannot be bigger than the pool's max size");
		}
		if (this.maxSize > this.emergencyLimit) {
			throw new IllegalArgumentException("Max size cannot be bigger than the pool's emergency limit");
		}
		if (this.scaleThreshold <= 0 || this.scaleThreshold > 1) {
			throw new IllegalArgumentException("Scale threshold should be in (0, 1]");
		}
		if (this.growthFactor <= 1) {
			throw new IllegalArgumentException("Growth factor should be greater than 1");
		}
		if (this.shrinkFactor <= 0 || this.shrinkFactor >= 1) {
			throw new IllegalArgumentException("Shrink factor should be in (0, 1)");
		}
		if (this.shrinkThreshold < 0 || this.shrinkThreshold >= this.scaleThreshold) {
			throw new IllegalArgumentException("Shrink threshold should be in [0, scaleThreshold)");
		}
		if (this.minSize < 1 || this.minSize > this.hardCeiling) {
			throw new IllegalArgumentException("Min size should be at least one and not exceed the hard ceiling");
		}
	}

	@NotNull
	public static PoolConfig defaults() {
		return builder().build();
	}
}
