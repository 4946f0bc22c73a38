package org.bbottema.adaptivepool.coordinator;

import lombok.NoArgsConstructor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static lombok.AccessLevel.PRIVATE;

/**
 * Standalone mode: there are no other instances. Writes succeed without effect, reads come back empty and this
 * instance is always its own leader.
 */
@NoArgsConstructor(access = PRIVATE)
public final class NoOpCoordinatorBackend implements CoordinatorBackend {

	public static final NoOpCoordinatorBackend INSTANCE = new NoOpCoordinatorBackend();

	@Override
	public boolean registerInstance(@NotNull String instanceId, @NotNull InstanceRecord record) {
		return true;
	}

	@Override
	public boolean updateInstance(@NotNull String instanceId, @NotNull InstanceRecord record) {
		return true;
	}

	@Override
	public boolean unregisterInstance(@NotNull String instanceId) {
		return true;
	}

	@NotNull
	@Override
	public List<InstanceRecord> getActiveInstances() {
		return Collections.emptyList();
	}

	@Override
	public boolean push(@NotNull String key, @NotNull Map<String, Object> item) {
		return true;
	}

	@Nullable
	@Override
	public Map<String, Object> pop(@NotNull String key, int timeoutSeconds) {
		return null;
	}

	@Override
	public int getQueueLength(@NotNull String key) {
		return 0;
	}

	@Override
	public boolean acquireLeadership(@NotNull String instanceId, int ttlSeconds) {
		return true;
	}

	@Override
	public boolean releaseLeadership(@NotNull String instanceId) {
		return true;
	}

	@Nullable
	@Override
	public String getCurrentLeader() {
		return null;
	}

	@Override
	public long getGlobalPoolSize(@NotNull String kind) {
		return 0;
	}

	@Override
	public void updateGlobalPoolSize(@NotNull String kind, long delta) {
		// nothing to share
	}

	@Override
	public boolean publishGlobalPoolSize(@NotNull String leaderId, @NotNull String kind, long size) {
		return true;
	}

	@Override
	public boolean set(@NotNull String key, @NotNull String value, int ttlSeconds) {
		return true;
	}

	@Nullable
	@Override
	public String get(@NotNull String key) {
		return null;
	}

	@Override
	public boolean delete(@NotNull String key) {
		return true;
	}

	@Override
	public boolean isConnected() {
		return false;
	}

	@Override
	public void close() {
		// nothing to close
	}
}
