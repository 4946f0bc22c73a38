package org.bbottema.adaptivepool.coordinator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and pool sizes of one process instance as published to the coordinator. Only the owning instance ever
 * writes its record; it expires when the instance stops refreshing it.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceRecord {
	@JsonProperty("id") @NotNull private final String instanceId;
	@JsonProperty("hostname") @Nullable private final String hostname;
	@JsonProperty("pid") private final long pid;
	@JsonProperty("pool_sizes") @NotNull private final Map<String, Integer> poolSizesByKind;
	/**
	 * Epoch seconds.
	 */
	@JsonProperty("last_seen") private final long lastSeen;
	/**
	 * 1.0 for a healthy instance, lower under memory pressure or while handing out overflow objects.
	 */
	@JsonProperty("health_score") private final double healthScore;
	/**
	 * Processors available to the instance, zero when unknown.
	 */
	@JsonProperty("cpu_cores") private final int cpuCores;
	/**
	 * Memory limit in bytes the instance's pressure monitor works against, zero when unknown.
	 */
	@JsonProperty("memory_limit") private final long memoryLimit;

	public InstanceRecord(@NotNull String instanceId, @Nullable String hostname, long pid,
			@Nullable Map<String, Integer> poolSizesByKind, long lastSeen, double healthScore) {
		this(instanceId, hostname, pid, poolSizesByKind, lastSeen, healthScore, 0, 0);
	}

	@JsonCreator
	public InstanceRecord(@JsonProperty("id") @NotNull String instanceId,
			@JsonProperty("hostname") @Nullable String hostname,
			@JsonProperty("pid") long pid,
			@JsonProperty("pool_sizes") @Nullable Map<String, Integer> poolSizesByKind,
			@JsonProperty("last_seen") long lastSeen,
			@JsonProperty("health_score") double healthScore,
			@JsonProperty("cpu_cores") int cpuCores,
			@JsonProperty("memory_limit") long memoryLimit) {
		this.instanceId = instanceId;
		this.hostname = hostname;
		this.pid = pid;
		this.poolSizesByKind = poolSizesByKind != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(poolSizesByKind))
				: Collections.<String, Integer>emptyMap();
		this.lastSeen = lastSeen;
		this.healthScore = healthScore;
		this.cpuCores = cpuCores;
		this.memoryLimit = memoryLimit;
	}

	@NotNull
	public InstanceRecord withLastSeen(long lastSeen) {
		return new InstanceRecord(instanceId, hostname, pid, poolSizesByKind, lastSeen, healthScore, cpuCores, memoryLimit);
	}

	/**
	 * @return whether this record was last refreshed longer than {@code ttlSeconds} before {@code nowSeconds}
	 */
	public boolean isStale(long nowSeconds, long ttlSeconds) {
		return nowSeconds - lastSeen > ttlSeconds;
	}

	@JsonIgnore
	public int getPoolSize(@NotNull String kind) {
		final Integer size = poolSizesByKind.get(kind);
		return size != null ? size : 0;
	}
}
