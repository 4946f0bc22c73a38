package org.bbottema.adaptivepool;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.bbottema.adaptivepool.memory.MemoryPressureState;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Snapshot of everything a {@link PoolOrchestrator} manages.
 */
@Builder
@NonFinal@Value
public class OrchestratorStats {
	@NotNull private final String instanceId;
	@NotNull private final Map<String, PoolStats> perKind;
	@NotNull private final MemoryPressureState memory;
	@NotNull private final CoordinatorStatus coordinator;
	/**
	 * Number of {@link PoolOrchestrator#resizeAll(double)} runs.
	 */
	private final long poolAdjustments;
	private final long syncOperations;
	/**
	 * Number of times this instance became leader.
	 */
	private final long leaderElections;
	/**
	 * Leader rounds that published capacity-based pool targets.
	 */
	private final long rebalances;
	private final long objectsContributed;
	private final long objectsBorrowed;
	/**
	 * Calls to {@link PoolOrchestrator#borrowFromCluster(String, int)} that got fewer objects than asked for.
	 */
	private final long failedBorrows;

	/**
	 * Coordinator view as of the last sync. Reading it never contacts the coordinator.
	 */
	@Builder
	@NonFinal@Value
	public static class CoordinatorStatus {
		private final boolean connected;
		/**
		 * Epoch milliseconds of the sync this status was taken at, zero before the first sync.
		 */
		private final long lastSyncAt;
		@Nullable private final String leader;
		@NotNull private final LeadershipState leadershipState;
		/**
		 * As last seen by the leader's cache, or reported by the backend for followers.
		 */
		private final int activeInstances;
		@NotNull private final Map<String, Long> globalPoolSizes;
	}
}
