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
package org.bbottema.adaptivepool.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.adaptivepool.util.Ticker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.WeakReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.bbottema.adaptivepool.memory.MemoryPressureTier.CRITICAL;
import static org.bbottema.adaptivepool.memory.MemoryPressureTier.LOW;

/**
 * Classifies memory usage into pressure tiers and drives pool-wide adjustments.
 * <ol>
 *     <li>{@link #check()} samples memory at most once per check interval and tells every
 *     {@link MemoryPressureListener} to resize pools whenever the tier changes</li>
 *     <li>entering {@link MemoryPressureTier#CRITICAL} clears caches and forces a garbage collection right away,
 *     otherwise collections follow the {@link GcStrategy}</li>
 *     <li>objects registered with {@link #trackObject(String, Object)} are held weakly and reported when they outlive
 *     their kind's maximum lifetime</li>
 * </ol>
 * When the runtime cannot report a memory limit the monitor stays at {@link MemoryPressureTier#LOW} for good and
 * never emits resize directives.
 */
@Slf4j
public class MemoryPressureMonitor {

	private static final long NEVER = Long.MIN_VALUE;

	@NotNull @Getter private final MemoryPressureConfig config;
	@NotNull private final MemoryProbe probe;
	@NotNull private final Runnable garbageCollector;
	@NotNull private final Ticker ticker;
	@NotNull private final List<MemoryPressureListener> listeners = new CopyOnWriteArrayList<>();
	@NotNull private final ConcurrentLinkedQueue<TrackedObject> trackedObjects = new ConcurrentLinkedQueue<>();
	@NotNull private final ArrayDeque<MemorySnapshot> history = new ArrayDeque<>();

	// guarded by this
	@NotNull private MemoryPressureTier tier = LOW;
	private boolean pressureMonitoringEnabled = true;
	private long lastCheckAtMs = NEVER;
	private long lastTierChangeAtMs;
	private long lastGcAtMs;
	private long gcBaselineMs;
	private double usageRatio;
	private long tierChanges;
	private long gcRuns;
	private long totalGcDurationMs;

	public MemoryPressureMonitor(@NotNull MemoryPressureConfig config) {
		this(config, new JvmMemoryProbe(), System::gc, Ticker.SYSTEM);
	}

	/**
	 * @param garbageCollector run for every garbage collection pass, usually {@code System::gc}
	 */
	public MemoryPressureMonitor(@NotNull MemoryPressureConfig config, @NotNull MemoryProbe probe,
			@NotNull Runnable garbageCollector, @NotNull Ticker ticker) {
		this.config = config;
		this.probe = probe;
		this.garbageCollector = garbageCollector;
		this.ticker = ticker;
		this.gcBaselineMs = ticker.currentTimeMillis();
	}

	public void addListener(@NotNull MemoryPressureListener listener) {
		listeners.add(listener);
	}

	public void removeListener(@NotNull MemoryPressureListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Samples memory and reacts to tier changes. Calls within the check interval of the previous sample return the
	 * current tier without sampling. Also sweeps the tracked objects.
	 *
	 * @return the pressure tier after this check
	 */
	@NotNull
	public synchronized MemoryPressureTier check() {
		final long now = ticker.currentTimeMillis();
		if (lastCheckAtMs != NEVER && !config.getCheckInterval().hasElapsed(lastCheckAtMs, now)) {
			return tier;
		}
		lastCheckAtMs = now;
		sweepTrackedObjects();

		final MemorySnapshot snapshot = pressureMonitoringEnabled ? sample(now) : null;
		if (snapshot == null) {
			return tier;
		}
		record(snapshot);
		usageRatio = snapshot.getUsageRatio();

		final MemoryPressureTier newTier = config.classify(usageRatio);
		boolean gcForced = false;
		if (newTier != tier) {
			final MemoryPressureTier previousTier = tier;
			tier = newTier;
			gcForced = handlePressureChange(previousTier, newTier, now);
		}
		if (!gcForced && shouldRunGc()) {
			runGc(now);
		}
		return tier;
	}

	/**
	 * @return whether the current tier's schedule calls for a garbage collection now
	 */
	public synchronized boolean shouldRunGc() {
		if (!pressureMonitoringEnabled) {
			return false;
		}
		switch (config.getGcStrategy()) {
			case DISABLED:
				return false;
			case CONSERVATIVE:
				return tier == CRITICAL;
			default:
				return tier == CRITICAL || config.getGcInterval(tier).hasElapsed(gcBaselineMs, ticker.currentTimeMillis());
		}
	}

	/**
	 * Runs a garbage collection pass regardless of tier or schedule.
	 */
	public synchronized void forceGc() {
		runGc(ticker.currentTimeMillis());
	}

	/**
	 * Holds the object weakly until it is collected or outlives the lifetime configured for its kind.
	 */
	public void trackObject(@NotNull String kind, @NotNull Object object) {
		final long lifetimeMs = config.getTrackedLifetime(kind).getDurationMs();
		trackedObjects.add(new TrackedObject(kind, new WeakReference<>(object), ticker.currentTimeMillis(), lifetimeMs));
	}

	/**
	 * Drops tracked references whose object has been collected or whose lifetime has expired. Expired objects that
	 * are still reachable are logged as possible leaks.
	 *
	 * @return the number of references dropped
	 */
	public int sweepTrackedObjects() {
		final long now = ticker.currentTimeMillis();
		int dropped = 0;
		for (Iterator<TrackedObject> it = trackedObjects.iterator(); it.hasNext(); ) {
			final TrackedObject tracked = it.next();
			if (tracked.isCollected()) {
				it.remove();
				dropped++;
			} else if (tracked.hasExpired(now)) {
				log.warn("Tracked {} object still reachable {} ms after registration, possible leak", tracked.getKind(), now - tracked.getTrackedSinceMs());
				it.remove();
				dropped++;
			}
		}
		return dropped;
	}

	public int getTrackedObjectCount() {
		return trackedObjects.size();
	}

	@NotNull
	public synchronized MemoryPressureTier getTier() {
		return tier;
	}

	/**
	 * @return the memory limit of the latest sample, zero before the first sample or once no limit is known
	 */
	public synchronized long getMemoryLimitBytes() {
		return pressureMonitoringEnabled && !history.isEmpty() ? history.getLast().getLimitBytes() : 0;
	}

	@NotNull
	public synchronized MemoryPressureState getState() {
		return MemoryPressureState.builder()
				.tier(tier)
				.lastTierChangeAt(lastTierChangeAtMs)
				.lastGcAt(lastGcAtMs)
				.usageRatio(usageRatio)
				.history(new ArrayList<>(history))
				.tierChanges(tierChanges)
				.gcRuns(gcRuns)
				.averageGcDurationMs(gcRuns == 0 ? 0 : (double) totalGcDurationMs / gcRuns)
				.trackedObjects(trackedObjects.size())
				.pressureMonitoringEnabled(pressureMonitoringEnabled)
				.gcStrategy(config.getGcStrategy())
				.build();
	}

	/**
	 * @return whether a garbage collection was forced as part of the transition
	 */
	private boolean handlePressureChange(@NotNull MemoryPressureTier from, @NotNull MemoryPressureTier to, long now) {
		tierChanges++;
		lastTierChangeAtMs = now;
		final double factor = config.getAdjustmentFactor(to);
		log.info("Memory pressure changed from {} to {} ({}% used), adjusting pools by factor {}", from, to, Math.round(usageRatio * 100), factor);
		if (from == CRITICAL) {
			log.info("Left critical memory pressure, pools regrow through the regular tier factors");
		}
		for (MemoryPressureListener listener : listeners) {
			try {
				listener.onPoolResize(factor, to);
			} catch (RuntimeException e) {
				log.error("Memory pressure listener failed to apply resize factor {}", factor, e);
			}
		}
		if (to == CRITICAL) {
			for (MemoryPressureListener listener : listeners) {
				try {
					listener.onCriticalPressure();
				} catch (RuntimeException e) {
					log.error("Memory pressure listener failed to clear caches", e);
				}
			}
			runGc(now);
			return true;
		}
		return false;
	}

	@Nullable
	private MemorySnapshot sample(long now) {
		final long used;
		final long peak;
		final long limit;
		try {
			used = probe.usedBytes();
			peak = probe.peakBytes();
			limit = config.getMemoryLimitBytes() > 0 ? config.getMemoryLimitBytes() : probe.limitBytes();
		} catch (RuntimeException e) {
			disablePressureMonitoring("memory introspection failed: " + e);
			return null;
		}
		if (limit <= 0) {
			disablePressureMonitoring("no memory limit could be determined");
			return null;
		}
		return new MemorySnapshot(now, used, peak, limit);
	}

	private void disablePressureMonitoring(@NotNull String reason) {
		pressureMonitoringEnabled = false;
		tier = LOW;
		log.warn("Memory pressure monitoring disabled, {}; pools keep their configured sizes", reason);
	}

	private void record(@NotNull MemorySnapshot snapshot) {
		if (history.size() >= config.getHistorySize()) {
			history.removeFirst();
		}
		history.addLast(snapshot);
	}

	private void runGc(long now) {
		final long start = System.nanoTime();
		try {
			garbageCollector.run();
		} catch (RuntimeException e) {
			log.warn("Garbage collection request failed", e);
		}
		final long durationMs = (System.nanoTime() - start) / 1_000_000;
		gcRuns++;
		totalGcDurationMs += durationMs;
		lastGcAtMs = now;
		gcBaselineMs = now;
		log.debug("Garbage collection pass #{} took {} ms at {} pressure", gcRuns, durationMs, tier);
	}
}
