/*
 * Copyright (C) 2019 Benny Bottema (benny@bennybottema.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.bbottema.adaptivepool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.adaptivepool.coordinator.CoordinatorBackend;
import org.bbottema.adaptivepool.coordinator.InstanceRecord;
import org.bbottema.adaptivepool.memory.MemoryPressureListener;
import org.bbottema.adaptivepool.memory.MemoryPressureMonitor;
import org.bbottema.adaptivepool.memory.MemoryPressureTier;
import org.bbottema.adaptivepool.util.Ticker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.String.format;
import static org.bbottema.adaptivepool.LeadershipState.LEADER;
import static org.bbottema.adaptivepool.LeadershipState.NOT_LEADER;

/**
 * Owns one {@link LocalPool} per object kind, resizes them on memory pressure and keeps this instance known to the
 * cluster through a {@link CoordinatorBackend}.
 * <p>
 * Borrowing and returning never touch the coordinator. All cluster work happens in {@link #tick()}, either driven by
 * the caller or by the maintenance thread started with {@link #start()}. When the coordinator is unreachable the
 * pools keep working with their local sizing rules.
 */
@Slf4j
public class PoolOrchestrator implements MemoryPressureListener {

	private static final long NEVER = Long.MIN_VALUE;

	static final String PREFIX_REBALANCE = "rebalance:";
	static final String PREFIX_HANDOFF = "handoff:";

	private static final long CAPACITY_UNIT_BYTES = 128L * 1024 * 1024;
	private static final long DEFAULT_MEMORY_LIMIT_BYTES = 2L * 1024 * 1024 * 1024;
	private static final double MIN_CAPACITY = 0.1;

	@NotNull @Getter private final OrchestratorConfig config;
	@NotNull private final CoordinatorBackend coordinator;
	@NotNull @Getter private final MemoryPressureMonitor memoryPressureMonitor;
	@NotNull private final Ticker ticker;
	@NotNull private final String hostname;
	private final long pid;

	@NotNull private final Map<String, LocalPool<?>> pools = new ConcurrentHashMap<>();

	private final AtomicLong poolAdjustments = new AtomicLong();
	private final AtomicLong syncOperations = new AtomicLong();
	private final AtomicLong leaderElections = new AtomicLong();
	private final AtomicLong rebalances = new AtomicLong();
	private final AtomicLong objectsContributed = new AtomicLong();
	private final AtomicLong objectsBorrowed = new AtomicLong();
	private final AtomicLong failedBorrows = new AtomicLong();

	@NotNull private final ObjectMapper objectMapper = new ObjectMapper();

	// guarded by syncLock, except for clearing the instance cache under critical memory pressure
	private final Object syncLock = new Object();
	private final Map<String, InstanceRecord> knownInstances = new ConcurrentHashMap<>();
	private long lastSyncAtMs = NEVER;
	private long lastRebalanceAtMs = NEVER;
	private long lastAppliedRebalanceRound = NEVER;
	@NotNull private volatile LeadershipState leadershipState = NOT_LEADER;
	@NotNull private volatile OrchestratorStats.CoordinatorStatus coordinatorStatus = disconnectedStatus(0);

	// guarded by this
	@Nullable private ScheduledExecutorService maintenance;
	private boolean shutDown;

	public PoolOrchestrator(@NotNull OrchestratorConfig config, @NotNull CoordinatorBackend coordinator) {
		this(config, coordinator, new MemoryPressureMonitor(config.getMemoryPressureConfig()), Ticker.SYSTEM);
	}

	public PoolOrchestrator(@NotNull OrchestratorConfig config, @NotNull CoordinatorBackend coordinator,
			@NotNull MemoryPressureMonitor memoryPressureMonitor, @NotNull Ticker ticker) {
		this.config = config;
		this.coordinator = coordinator;
		this.memoryPressureMonitor = memoryPressureMonitor;
		this.ticker = ticker;
		this.hostname = InstanceIdGenerator.hostname();
		this.pid = InstanceIdGenerator.pid();
		memoryPressureMonitor.addListener(this);
	}

	/**
	 * Creates and warms up the pool for a new kind.
	 *
	 * @throws IllegalArgumentException if the kind is already registered
	 */
	@NotNull
	public <T> LocalPool<T> registerKind(@NotNull String kind, @NotNull PoolConfig poolConfig, @NotNull PoolSlotFactory<T> slotFactory) {
		synchronized (pools) {
			if (pools.containsKey(kind)) {
				throw new IllegalArgumentException(format("Pool kind '%s' is already registered", kind));
			}
			final LocalPool<T> pool = new LocalPool<>(kind, poolConfig, slotFactory, ticker);
			pools.put(kind, pool);
			log.info("Registered pool '{}' with {} objects (max {}, emergency limit {})", kind, pool.getCurrentSize(), poolConfig.getMaxSize(), poolConfig.getEmergencyLimit());
			return pool;
		}
	}

	/**
	 * @throws UnknownPoolKindException if no pool was registered for the kind
	 * @see LocalPool#borrow()
	 */
	@NotNull
	public <T> PooledObject<T> borrow(@NotNull String kind) throws PoolExhaustedException, SlotFactoryException {
		return this.<T>getPool(kind).borrow();
	}

	/**
	 * @throws UnknownPoolKindException if no pool was registered for the kind
	 * @see LocalPool#returnObject(PooledObject)
	 */
	public <T> void returnObject(@NotNull String kind, @NotNull PooledObject<T> pooledObject) {
		this.<T>getPool(kind).returnObject(pooledObject);
	}

	@NotNull
	@SuppressWarnings("unchecked")
	public <T> LocalPool<T> getPool(@NotNull String kind) {
		final LocalPool<?> pool = pools.get(kind);
		if (pool == null) {
			throw new UnknownPoolKindException(kind);
		}
		return (LocalPool<T>) pool;
	}

	/**
	 * Resizes every pool by the same factor. A pool failing to resize does not stop the others.
	 */
	public void resizeAll(double factor) {
		for (LocalPool<?> pool : pools.values()) {
			try {
				pool.resize(factor, config.isResizeLimits());
			} catch (RuntimeException e) {
				log.error("Not able to resize pool '{}' by factor {}", pool.getKind(), factor, e);
			}
		}
		poolAdjustments.incrementAndGet();
	}

	public void trackObject(@NotNull String kind, @NotNull Object object) {
		memoryPressureMonitor.trackObject(kind, object);
	}

	@Override
	public void onPoolResize(double factor, @NotNull MemoryPressureTier newTier) {
		log.info("Applying {} memory pressure resize factor {} to {} pools", newTier, factor, pools.size());
		resizeAll(factor);
	}

	@Override
	public void onCriticalPressure() {
		knownInstances.clear();
	}

	/**
	 * One maintenance round: a memory pressure check followed by a coordinator sync. Failures are logged, never thrown.
	 */
	public void tick() {
		try {
			memoryPressureMonitor.check();
		} catch (RuntimeException e) {
			log.error("Memory pressure check failed", e);
		}
		try {
			syncWithCoordinator();
		} catch (RuntimeException e) {
			log.error("Coordinator synchronization failed", e);
		}
	}

	/**
	 * Refreshes this instance's record and competes for leadership. As leader, also refreshes the cache of known
	 * instances, publishes the per-kind global pool sizes and, once per rebalance interval, publishes a capacity-based
	 * target size for every instance. Every instance then applies a newly published target of its own. Does nothing
	 * within the sync interval of the previous run.
	 * <p>
	 * When the heartbeat can't be written the rest of the round is skipped, so an unreachable coordinator costs one
	 * call per sync. The outcome is kept as the coordinator status reported by {@link #getStats()}.
	 *
	 * @return whether a sync took place
	 */
	public boolean syncWithCoordinator() {
		synchronized (syncLock) {
			final long now = ticker.currentTimeMillis();
			if (lastSyncAtMs != NEVER && !config.getSyncInterval().hasElapsed(lastSyncAtMs, now)) {
				return false;
			}
			lastSyncAtMs = now;

			if (!coordinator.updateInstance(config.getInstanceId(), createInstanceRecord(now))) {
				log.debug("Instance record of '{}' not refreshed, skipping coordination until the coordinator is back", config.getInstanceId());
				updateLeadership(false);
				coordinatorStatus = disconnectedStatus(now);
				syncOperations.incrementAndGet();
				return true;
			}
			if (config.isLeaderElection()) {
				updateLeadership(coordinator.acquireLeadership(config.getInstanceId(), config.getLeaderTtl().toSecondsRoundedUp()));
			}
			final Map<String, Long> globalPoolSizes;
			final int activeInstances;
			if (leadershipState == LEADER) {
				refreshKnownInstances(now);
				globalPoolSizes = publishGlobalPoolSizes();
				rebalanceIfDue(now, globalPoolSizes);
				activeInstances = knownInstances.size();
			} else {
				globalPoolSizes = readGlobalPoolSizes();
				activeInstances = coordinator.getActiveInstances().size();
			}
			applyRebalanceTarget();
			coordinatorStatus = OrchestratorStats.CoordinatorStatus.builder()
					.connected(coordinator.isConnected())
					.lastSyncAt(now)
					.leader(leadershipState == LEADER ? config.getInstanceId() : coordinator.getCurrentLeader())
					.leadershipState(leadershipState)
					.activeInstances(activeInstances)
					.globalPoolSizes(Collections.unmodifiableMap(globalPoolSizes))
					.build();
			syncOperations.incrementAndGet();
			return true;
		}
	}

	@NotNull
	private OrchestratorStats.CoordinatorStatus disconnectedStatus(long now) {
		return OrchestratorStats.CoordinatorStatus.builder()
				.connected(false)
				.lastSyncAt(now)
				.leader(null)
				.leadershipState(leadershipState)
				.activeInstances(0)
				.globalPoolSizes(Collections.<String, Long>emptyMap())
				.build();
	}

	private void updateLeadership(boolean acquired) {
		if (acquired && leadershipState == NOT_LEADER) {
			leadershipState = LEADER;
			leaderElections.incrementAndGet();
			log.info("Instance '{}' became pool coordination leader", config.getInstanceId());
		} else if (!acquired && leadershipState == LEADER) {
			leadershipState = NOT_LEADER;
			knownInstances.clear();
			lastRebalanceAtMs = NEVER;
			log.warn("Instance '{}' lost pool coordination leadership", config.getInstanceId());
		}
	}

	private void refreshKnownInstances(long now) {
		final List<InstanceRecord> active = coordinator.getActiveInstances();
		final long ttlSeconds = config.getInstanceTtl().toSecondsRoundedUp();
		final Map<String, InstanceRecord> reported = new HashMap<>();
		for (InstanceRecord record : active) {
			reported.put(record.getInstanceId(), record);
		}
		knownInstances.putAll(reported);
		int pruned = 0;
		for (Iterator<InstanceRecord> it = knownInstances.values().iterator(); it.hasNext(); ) {
			final InstanceRecord record = it.next();
			if (!reported.containsKey(record.getInstanceId()) || record.isStale(now / 1000, ttlSeconds)) {
				it.remove();
				pruned++;
			}
		}
		if (pruned > 0) {
			log.info("Dropped {} stale instances, {} instances remain active", pruned, knownInstances.size());
		}
	}

	/**
	 * Writes the summed pool sizes of all known instances, conditional on still holding leadership.
	 *
	 * @return the totals per kind
	 */
	@NotNull
	private Map<String, Long> publishGlobalPoolSizes() {
		final Map<String, Long> totals = new TreeMap<>();
		for (String kind : pools.keySet()) {
			totals.put(kind, 0L);
		}
		for (InstanceRecord record : knownInstances.values()) {
			for (Map.Entry<String, Integer> poolSize : record.getPoolSizesByKind().entrySet()) {
				totals.merge(poolSize.getKey(), (long) poolSize.getValue(), Long::sum);
			}
		}
		for (Map.Entry<String, Long> total : totals.entrySet()) {
			if (!coordinator.publishGlobalPoolSize(config.getInstanceId(), total.getKey(), total.getValue())) {
				log.debug("Global pool size of '{}' not published, leadership no longer held", total.getKey());
			}
		}
		return totals;
	}

	@NotNull
	private Map<String, Long> readGlobalPoolSizes() {
		final Map<String, Long> sizes = new TreeMap<>();
		for (String kind : pools.keySet()) {
			sizes.put(kind, coordinator.getGlobalPoolSize(kind));
		}
		return sizes;
	}

	/**
	 * Splits every kind's global pool size over the known instances in proportion to their capacity and publishes
	 * each instance's share. Needs at least two instances.
	 */
	private void rebalanceIfDue(long now, @NotNull Map<String, Long> globalPoolSizes) {
		if (lastRebalanceAtMs != NEVER && !config.getRebalanceInterval().hasElapsed(lastRebalanceAtMs, now)) {
			return;
		}
		lastRebalanceAtMs = now;
		final List<InstanceRecord> instances = new ArrayList<>(knownInstances.values());
		if (instances.size() < 2) {
			return;
		}
		double totalCapacity = 0;
		final Map<String, Double> capacities = new HashMap<>();
		for (InstanceRecord instance : instances) {
			final double capacity = capacity(instance);
			capacities.put(instance.getInstanceId(), capacity);
			totalCapacity += capacity;
		}
		final int ttlSeconds = 2 * config.getRebalanceInterval().toSecondsRoundedUp();
		for (InstanceRecord instance : instances) {
			final double share = capacities.get(instance.getInstanceId()) / totalCapacity;
			final Map<String, Integer> targets = new TreeMap<>();
			for (String kind : instance.getPoolSizesByKind().keySet()) {
				final Long globalSize = globalPoolSizes.get(kind);
				targets.put(kind, (int) Math.min(Integer.MAX_VALUE, Math.round((globalSize != null ? globalSize : 0L) * share)));
			}
			try {
				final String json = objectMapper.writeValueAsString(new RebalanceTarget(now, share, targets));
				coordinator.set(PREFIX_REBALANCE + instance.getInstanceId(), json, ttlSeconds);
			} catch (JsonProcessingException e) {
				log.warn("Not able to publish rebalance target for '{}': {}", instance.getInstanceId(), e.getOriginalMessage());
			}
		}
		rebalances.incrementAndGet();
		log.info("Pool rebalancing published across {} instances", instances.size());
	}

	/**
	 * Memory limit relative to 128 MiB, times CPU cores, times health score. Unknown limits count as 2 GiB and unknown
	 * core counts as one.
	 */
	static double capacity(@NotNull InstanceRecord instance) {
		final long memoryLimit = instance.getMemoryLimit() > 0 ? instance.getMemoryLimit() : DEFAULT_MEMORY_LIMIT_BYTES;
		final int cpuCores = Math.max(1, instance.getCpuCores());
		return Math.max(MIN_CAPACITY, (double) memoryLimit / CAPACITY_UNIT_BYTES * cpuCores * instance.getHealthScore());
	}

	private void applyRebalanceTarget() {
		final String json = coordinator.get(PREFIX_REBALANCE + config.getInstanceId());
		if (json == null) {
			return;
		}
		final RebalanceTarget target;
		try {
			target = objectMapper.readValue(json, RebalanceTarget.class);
		} catch (JsonProcessingException e) {
			log.warn("Ignoring unreadable rebalance target for '{}': {}", config.getInstanceId(), e.getOriginalMessage());
			return;
		}
		if (target.getRound() == lastAppliedRebalanceRound) {
			return;
		}
		lastAppliedRebalanceRound = target.getRound();
		for (Map.Entry<String, Integer> targetSize : target.getTargetSizesByKind().entrySet()) {
			final LocalPool<?> pool = pools.get(targetSize.getKey());
			if (pool == null) {
				continue;
			}
			final int currentSize = pool.getCurrentSize();
			if (Math.abs(targetSize.getValue() - currentSize) > config.getRebalanceThreshold()) {
				log.info("Rebalancing pool '{}': current={}, target={} ({}% of global)", targetSize.getKey(), currentSize,
						targetSize.getValue(), Math.round(target.getShare() * 1000) / 10.0);
				pool.resizeTo(targetSize.getValue());
			}
		}
	}

	/**
	 * Hands up to {@code count} free objects of this kind over to other instances: the local pool shrinks by what it
	 * can free and the released capacity is queued for {@link #borrowFromCluster(String, int)} elsewhere. Objects
	 * themselves never cross process boundaries; the borrower creates its own.
	 *
	 * @return how many objects were contributed, zero when nothing was free or the coordinator is unreachable
	 * @throws UnknownPoolKindException if no pool was registered for the kind
	 */
	public int contribute(@NotNull String kind, int count) {
		final LocalPool<?> pool = getPool(kind);
		if (count <= 0) {
			return 0;
		}
		final int previousSize = pool.getCurrentSize();
		final int released = previousSize - pool.resizeTo(previousSize - count);
		if (released <= 0) {
			return 0;
		}
		final Map<String, Object> contribution = new LinkedHashMap<>();
		contribution.put("instance_id", config.getInstanceId());
		contribution.put("kind", kind);
		contribution.put("count", released);
		contribution.put("timestamp", ticker.currentTimeMillis());
		if (!coordinator.push(PREFIX_HANDOFF + kind, contribution)) {
			log.warn("Not able to hand {} '{}' objects over to the cluster, keeping them", released, kind);
			pool.resizeTo(previousSize);
			return 0;
		}
		objectsContributed.addAndGet(released);
		log.info("Contributed {} '{}' objects to the cluster", released, kind);
		return released;
	}

	/**
	 * Takes up to {@code count} objects of capacity contributed by other instances and grows the local pool by that
	 * much, staying within its maximum size. Never blocks: only contributions already queued are considered. Own
	 * contributions are left for others, and the unused part of a contribution goes back on the queue.
	 *
	 * @return how many objects were added to the local pool
	 * @throws UnknownPoolKindException if no pool was registered for the kind
	 */
	public int borrowFromCluster(@NotNull String kind, int count) {
		final LocalPool<?> pool = getPool(kind);
		if (count <= 0) {
			return 0;
		}
		final PoolStats stats = pool.getStats();
		final int headroom = Math.min(stats.getMaxSize(), pool.getPoolConfig().getHardCeiling()) - stats.getCurrentSize();
		final int wanted = Math.min(count, Math.max(0, headroom));
		final String queue = PREFIX_HANDOFF + kind;
		final List<Map<String, Object>> putBack = new ArrayList<>();
		int taken = 0;
		while (taken < wanted) {
			final Map<String, Object> popped = coordinator.pop(queue, 0);
			if (popped == null) {
				break;
			}
			final Map<String, Object> contribution = new LinkedHashMap<>(popped);
			final Object contributed = contribution.get("count");
			final int available = contributed instanceof Number ? ((Number) contributed).intValue() : 0;
			if (available <= 0) {
				log.warn("Dropping malformed '{}' contribution: {}", kind, contribution);
			} else if (config.getInstanceId().equals(contribution.get("instance_id"))) {
				putBack.add(contribution);
			} else {
				final int used = Math.min(available, wanted - taken);
				taken += used;
				if (available > used) {
					contribution.put("count", available - used);
					putBack.add(contribution);
				}
			}
		}
		for (Map<String, Object> contribution : putBack) {
			coordinator.push(queue, contribution);
		}
		if (taken > 0) {
			final int previousSize = pool.getCurrentSize();
			final int grown = pool.resizeTo(previousSize + taken) - previousSize;
			objectsBorrowed.addAndGet(Math.max(0, grown));
			log.info("Borrowed {} '{}' objects from the cluster", grown, kind);
			taken = Math.max(0, grown);
		}
		if (taken < count) {
			failedBorrows.incrementAndGet();
		}
		return taken;
	}

	@NotNull
	private InstanceRecord createInstanceRecord(long now) {
		final Map<String, Integer> poolSizes = new LinkedHashMap<>();
		boolean overflowing = false;
		for (String kind : new TreeSet<>(pools.keySet())) {
			final PoolStats stats = pools.get(kind).getStats();
			poolSizes.put(kind, stats.getCurrentSize());
			overflowing |= stats.getOverflowOutstanding() > 0;
		}
		return new InstanceRecord(config.getInstanceId(), hostname, pid, poolSizes, now / 1000, healthScore(overflowing),
				Runtime.getRuntime().availableProcessors(), memoryPressureMonitor.getMemoryLimitBytes());
	}

	private double healthScore(boolean overflowing) {
		double score;
		switch (memoryPressureMonitor.getTier()) {
			case CRITICAL: score = 0.4; break;
			case HIGH: score = 0.7; break;
			case MEDIUM: score = 0.9; break;
			default: score = 1.0;
		}
		return overflowing ? Math.max(0, score - 0.2) : score;
	}

	/**
	 * Runs {@link #tick()} every tick interval on a daemon thread from the configured thread factory.
	 *
	 * @throws IllegalStateException if already started or shut down
	 */
	public synchronized void start() {
		if (shutDown) {
			throw new IllegalStateException("Orchestrator has been shut down");
		}
		if (maintenance != null) {
			throw new IllegalStateException("Orchestrator already started");
		}
		maintenance = Executors.newSingleThreadScheduledExecutor(runnable -> {
			final Thread thread = config.getThreadFactory().newThread(runnable);
			thread.setDaemon(true);
			return thread;
		});
		final long intervalMs = config.getTickInterval().getDurationMs();
		maintenance.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
		log.info("Pool orchestrator '{}' started, maintenance every {} ms", config.getInstanceId(), intervalMs);
	}

	/**
	 * Stops maintenance, leaves the cluster, shuts down every pool and closes the coordinator. Safe to call twice.
	 */
	public synchronized void shutdown() {
		if (shutDown) {
			return;
		}
		shutDown = true;
		if (maintenance != null) {
			maintenance.shutdownNow();
			try {
				if (!maintenance.awaitTermination(Math.max(1000, config.getTickInterval().getDurationMs()), TimeUnit.MILLISECONDS)) {
					log.warn("Maintenance thread did not stop in time");
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
		memoryPressureMonitor.removeListener(this);
		synchronized (syncLock) {
			coordinator.unregisterInstance(config.getInstanceId());
			if (leadershipState == LEADER) {
				coordinator.releaseLeadership(config.getInstanceId());
				leadershipState = NOT_LEADER;
			}
			knownInstances.clear();
			coordinatorStatus = disconnectedStatus(ticker.currentTimeMillis());
		}
		for (LocalPool<?> pool : pools.values()) {
			pool.shutdown();
		}
		coordinator.close();
		log.info("Pool orchestrator '{}' shut down", config.getInstanceId());
	}

	@NotNull
	public LeadershipState getLeadershipState() {
		return leadershipState;
	}

	/**
	 * Local pool and memory figures are live; the coordinator part is what the last sync saw.
	 */
	@NotNull
	public OrchestratorStats getStats() {
		final Map<String, PoolStats> perKind = new TreeMap<>();
		for (Map.Entry<String, LocalPool<?>> pool : pools.entrySet()) {
			perKind.put(pool.getKey(), pool.getValue().getStats());
		}
		return OrchestratorStats.builder()
				.instanceId(config.getInstanceId())
				.perKind(perKind)
				.memory(memoryPressureMonitor.getState())
				.coordinator(coordinatorStatus)
				.poolAdjustments(poolAdjustments.get())
				.syncOperations(syncOperations.get())
				.leaderElections(leaderElections.get())
				.rebalances(rebalances.get())
				.objectsContributed(objectsContributed.get())
				.objectsBorrowed(objectsBorrowed.get())
				.failedBorrows(failedBorrows.get())
				.build();
	}
}
