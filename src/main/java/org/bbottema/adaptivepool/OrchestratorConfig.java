package org.bbottema.adaptivepool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.bbottema.adaptivepool.memory.MemoryPressureConfig;
import org.bbottema.adaptivepool.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Maintenance schedule and cluster participation of a {@link PoolOrchestrator}. Every property is optional.
 */
@NonFinal@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class OrchestratorConfig {
	/**
	 * Identity in the cluster. Default {@code {hostname}_{random}_{pid}}.
	 */
	@NotNull private final String instanceId;
	/**
	 * Period of the maintenance loop started by {@link PoolOrchestrator#start()}. Default 1 second.
	 */
	@NotNull private final Timeout tickInterval;
	/**
	 * Minimum time between two coordinator synchronizations. Default 5 seconds.
	 */
	@NotNull private final Timeout syncInterval;
	/**
	 * Whether this instance competes for leadership. Default true.
	 */
	private final boolean leaderElection;
	/**
	 * Lease on the leadership key, renewed on every sync. Default 30 seconds.
	 */
	@NotNull private final Timeout leaderTtl;
	/**
	 * Age after which the leader drops another instance from its cache. Default 60 seconds.
	 */
	@NotNull private final Timeout instanceTtl;
	/**
	 * Minimum time between two capacity-based rebalancing rounds run by the leader. Default 60 seconds.
	 */
	@NotNull private final Timeout rebalanceInterval;
	/**
	 * How far, in objects, a pool's rebalancing target has to be from its current size before the pool is resized
	 * towards it. Default 10.
	 */
	private final int rebalanceThreshold;
	/**
	 * Whether memory pressure resizes also scale {@code maxSize} and {@code emergencyLimit}. Default false.
	 */
	private final boolean resizeLimits;
	/**
	 * Creates the maintenance thread, which is always marked daemon. Default {@link Executors#defaultThreadFactory()}.
	 */
	@NotNull private final ThreadFactory threadFactory;
	@NotNull private final MemoryPressureConfig memoryPressureConfig;

	@Builder
	@SuppressWarnings("unused")
	private OrchestratorConfig(@Nullable String instanceId, @Nullable Timeout tickInterval, @Nullable Timeout syncInterval,
			@Nullable Boolean leaderElection, @Nullable Timeout leaderTtl, @Nullable Timeout instanceTtl,
			@Nullable Timeout rebalanceInterval, @Nullable Integer rebalanceThreshold, @Nullable Boolean resizeLimits, @Nullable ThreadFactory threadFactory,
			@Nullable MemoryPressureConfig memoryPressureConfig) {
		this.instanceId = instanceId != null ? instanceId : InstanceIdGenerator.generate();
		this.tickInterval = tickInterval != null ? tickInterval : new Timeout(1, SECONDS);
		this.syncInterval = syncInterval != null ? syncInterval : new Timeout(5, SECONDS);
		this.leaderElection = leaderElection != null ? leaderElection : true;
		this.leaderTtl = leaderTtl != null ? leaderTtl : new Timeout(30, SECONDS);
		this.instanceTtl = instanceTtl != null ? instanceTtl : new Timeout(60, SECONDS);
		this.rebalanceInterval = rebalanceInterval != null ? rebalanceInterval : new Timeout(60, SECONDS);
		this.rebalanceThreshold = rebalanceThreshold != null ? rebalanceThreshold : 10;
		this.resizeLimits = resizeLimits != null ? resizeLimits : false;
		this.threadFactory = threadFactory != null ? threadFactory : Executors.defaultThreadFactory();
		this.memoryPressureConfig = memoryPressureConfig != null ? memoryPressureConfig : MemoryPressureConfig.defaults();

		if (this.instanceId.trim().isEmpty()) {
			throw new IllegalArgumentException("instanceId cannot be blank");
		}
		if (this.tickInterval.getDurationMs() <= 0) {
			throw new IllegalArgumentException("tickInterval must be positive");
		}
		if (this.leaderTtl.toSecondsRoundedUp() < 1) {
			throw new IllegalArgumentException("leaderTtl must be at least one second");
		}
		if (this.syncInterval.getDurationMs() >= this.leaderTtl.getDurationMs()) {
			throw new IllegalArgumentException("syncInterval must be shorter than leaderTtl, or leadership lapses between renewals");
		}
		if (this.syncInterval.getDurationMs() >= this.instanceTtl.getDurationMs()) {
			throw new IllegalArgumentException("syncInterval must be shorter than instanceTtl, or instance records expire between heartbeats");
		}
		if (this.rebalanceThreshold < 0) {
			throw new IllegalArgumentException("rebalanceThreshold cannot be negative");
		}
	}

	@NotNull
	public static OrchestratorConfig defaults() {
		return builder().build();
	}
}
