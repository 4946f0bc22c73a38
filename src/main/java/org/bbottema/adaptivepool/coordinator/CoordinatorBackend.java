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
package org.bbottema.adaptivepool.coordinator;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Cross-instance visibility and a minimal leadership primitive. Purely an optimization layer: every operation fails
 * soft, returning {@code false}, {@code null}, zero or an empty list when the backend is unreachable, and callers
 * treat that the same as running as a single standalone instance.
 * <p>
 * Nothing returned here is suitable for correctness-critical decisions: instance lists and global counters are
 * eventually consistent, and leadership is advisory with TTL-bounded staleness.
 */
public interface CoordinatorBackend extends AutoCloseable {

	/**
	 * Upserts the instance's record with the instance TTL. Must be repeated within every TTL window.
	 */
	boolean registerInstance(@NotNull String instanceId, @NotNull InstanceRecord record);

	/**
	 * Heartbeat; same as {@link #registerInstance(String, InstanceRecord)}.
	 */
	boolean updateInstance(@NotNull String instanceId, @NotNull InstanceRecord record);

	/**
	 * Best-effort removal on graceful shutdown.
	 */
	boolean unregisterInstance(@NotNull String instanceId);

	/**
	 * @return a possibly stale enumeration of the instances that refreshed their record within the TTL
	 */
	@NotNull
	List<InstanceRecord> getActiveInstances();

	boolean push(@NotNull String key, @NotNull Map<String, Object> item);

	/**
	 * @param timeoutSeconds zero for a non-blocking pop; anything positive blocks and must only be used from
	 *                       dedicated background workers
	 * @return the oldest item, or null if none (arrived in time)
	 */
	@Nullable
	Map<String, Object> pop(@NotNull String key, int timeoutSeconds);

	int getQueueLength(@NotNull String key);

	/**
	 * Set-if-absent on the single leadership key. Calling it again as the current holder renews the TTL and succeeds.
	 *
	 * @return false if another instance holds a live lease
	 */
	boolean acquireLeadership(@NotNull String instanceId, int ttlSeconds);

	/**
	 * Deletes the leadership key only when held by {@code instanceId}.
	 */
	boolean releaseLeadership(@NotNull String instanceId);

	@Nullable
	String getCurrentLeader();

	/**
	 * @return the best-effort sum of all live instances' pool sizes for this kind
	 */
	long getGlobalPoolSize(@NotNull String kind);

	/**
	 * Adjusts the global counter for this kind by {@code delta} and refreshes its TTL, also when {@code delta} is zero.
	 */
	void updateGlobalPoolSize(@NotNull String kind, long delta);

	/**
	 * Overwrites the global counter for this kind with {@code size} and refreshes its TTL, atomically checking that
	 * {@code leaderId} still holds leadership. A deposed leader whose lease lapsed mid-sync can therefore never
	 * overwrite what the new leader published.
	 *
	 * @return false if {@code leaderId} is not the current leader or the backend is unreachable
	 */
	boolean publishGlobalPoolSize(@NotNull String leaderId, @NotNull String kind, long size);

	/**
	 * @param ttlSeconds zero or less for no expiry
	 */
	boolean set(@NotNull String key, @NotNull String value, int ttlSeconds);

	@Nullable
	String get(@NotNull String key);

	boolean delete(@NotNull String key);

	/**
	 * Liveness probe.
	 */
	boolean isConnected();

	@Override
	void close();
}
