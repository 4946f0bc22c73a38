package org.bbottema.adaptivepool.coordinator;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.adaptivepool.util.Ticker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Process-local coordination with the same semantics as {@link RedisCoordinatorBackend}, expiring entries by the
 * given {@link Ticker}. One instance can be shared by several orchestrators to simulate a cluster, and
 * {@link #setConnected(boolean)} simulates an outage during which every operation returns its neutral result.
 */
@Slf4j
public class InMemoryCoordinatorBackend implements CoordinatorBackend {

	private static final long NO_EXPIRY = Long.MAX_VALUE;

	@NotNull private final CoordinatorConfig config;
	@NotNull private final Ticker ticker;

	// guarded by this
	private final Map<String, Expiring<InstanceRecord>> instances = new LinkedHashMap<>();
	private final Map<String, LinkedList<Map<String, Object>>> queues = new HashMap<>();
	private final Map<String, Expiring<String>> values = new HashMap<>();
	private final Map<String, Expiring<Long>> globalPoolSizes = new HashMap<>();
	@Nullable private Expiring<String> leader;
	private boolean connected = true;

	public InMemoryCoordinatorBackend() {
		this(CoordinatorConfig.defaults(), Ticker.SYSTEM);
	}

	public InMemoryCoordinatorBackend(@NotNull CoordinatorConfig config, @NotNull Ticker ticker) {
		this.config = config;
		this.ticker = ticker;
	}

	public synchronized void setConnected(boolean connected) {
		if (this.connected != connected) {
			log.info("In-memory coordination {}", connected ? "reconnected" : "disconnected");
		}
		this.connected = connected;
		notifyAll();
	}

	@Override
	public synchronized boolean registerInstance(@NotNull String instanceId, @NotNull InstanceRecord record) {
		if (!connected) {
			return false;
		}
		final long now = ticker.currentTimeMillis();
		instances.put(instanceId, new Expiring<>(record.withLastSeen(now / 1000), now + config.getInstanceTtl().getDurationMs()));
		return true;
	}

	@Override
	public boolean updateInstance(@NotNull String instanceId, @NotNull InstanceRecord record) {
		return registerInstance(instanceId, record);
	}

	@Override
	public synchronized boolean unregisterInstance(@NotNull String instanceId) {
		return connected && instances.remove(instanceId) != null;
	}

	@NotNull
	@Override
	public synchronized List<InstanceRecord> getActiveInstances() {
		final List<InstanceRecord> active = new ArrayList<>();
		if (connected) {
			final long now = ticker.currentTimeMillis();
			instances.values().removeIf(entry -> entry.hasExpired(now));
			for (Expiring<InstanceRecord> entry : instances.values()) {
				if (!entry.getValue().isStale(now / 1000, config.getInstanceTtl().toSecondsRoundedUp())) {
					active.add(entry.getValue());
				}
			}
		}
		return active;
	}

	@Override
	public synchronized boolean push(@NotNull String key, @NotNull Map<String, Object> item) {
		if (!connected) {
			return false;
		}
		queues.computeIfAbsent(key, k -> new LinkedList<>()).addLast(new LinkedHashMap<>(item));
		notifyAll();
		return true;
	}

	@Nullable
	@Override
	public synchronized Map<String, Object> pop(@NotNull String key, int timeoutSeconds) {
		final long deadlineNanos = System.nanoTime() + TimeUnit.SECONDS.toNanos(Math.max(0, timeoutSeconds));
		while (connected) {
			final LinkedList<Map<String, Object>> queue = queues.get(key);
			if (queue != null && !queue.isEmpty()) {
				return queue.pollFirst();
			}
			final long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
			if (remainingMs <= 0) {
				return null;
			}
			try {
				wait(remainingMs);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return null;
			}
		}
		return null;
	}

	@Override
	public synchronized int getQueueLength(@NotNull String key) {
		final LinkedList<Map<String, Object>> queue = queues.get(key);
		return connected && queue != null ? queue.size() : 0;
	}

	@Override
	public synchronized boolean acquireLeadership(@NotNull String instanceId, int ttlSeconds) {
		if (!connected) {
			return false;
		}
		final long now = ticker.currentTimeMillis();
		if (leader == null || leader.hasExpired(now) || leader.getValue().equals(instanceId)) {
			leader = new Expiring<>(instanceId, now + TimeUnit.SECONDS.toMillis(ttlSeconds));
			return true;
		}
		return false;
	}

	@Override
	public synchronized boolean releaseLeadership(@NotNull String instanceId) {
		if (connected && leader != null && !leader.hasExpired(ticker.currentTimeMillis()) && leader.getValue().equals(instanceId)) {
			leader = null;
			return true;
		}
		return false;
	}

	@Nullable
	@Override
	public synchronized String getCurrentLeader() {
		return connected && leader != null && !leader.hasExpired(ticker.currentTimeMillis()) ? leader.getValue() : null;
	}

	@Override
	public synchronized long getGlobalPoolSize(@NotNull String kind) {
		final Expiring<Long> size = globalPoolSizes.get(kind);
		return connected && size != null && !size.hasExpired(ticker.currentTimeMillis()) ? size.getValue() : 0L;
	}

	@Override
	public synchronized void updateGlobalPoolSize(@NotNull String kind, long delta) {
		if (connected) {
			final long now = ticker.currentTimeMillis();
			globalPoolSizes.put(kind, new Expiring<>(getGlobalPoolSize(kind) + delta, now + config.getGlobalCounterTtl().getDurationMs()));
		}
	}

	@Override
	public synchronized boolean publishGlobalPoolSize(@NotNull String leaderId, @NotNull String kind, long size) {
		if (!leaderId.equals(getCurrentLeader())) {
			return false;
		}
		globalPoolSizes.put(kind, new Expiring<>(size, ticker.currentTimeMillis() + config.getGlobalCounterTtl().getDurationMs()));
		return true;
	}

	@Override
	public synchronized boolean set(@NotNull String key, @NotNull String value, int ttlSeconds) {
		if (!connected) {
			return false;
		}
		final long expiresAt = ttlSeconds > 0 ? ticker.currentTimeMillis() + TimeUnit.SECONDS.toMillis(ttlSeconds) : NO_EXPIRY;
		values.put(key, new Expiring<>(value, expiresAt));
		return true;
	}

	@Nullable
	@Override
	public synchronized String get(@NotNull String key) {
		final Expiring<String> value = values.get(key);
		return connected && value != null && !value.hasExpired(ticker.currentTimeMillis()) ? value.getValue() : null;
	}

	@Override
	public synchronized boolean delete(@NotNull String key) {
		return connected && values.remove(key) != null;
	}

	@Override
	public synchronized boolean isConnected() {
		return connected;
	}

	@Override
	public synchronized void close() {
		notifyAll();
	}

	@Value
	private static class Expiring<V> {
		@NotNull V value;
		long expiresAtMs;

		boolean hasExpired(long nowMs) {
			return expiresAtMs != NO_EXPIRY && nowMs >= expiresAtMs;
		}
	}
}
