package org.bbottema.adaptivepool.coordinator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.adaptivepool.util.Ticker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.resps.ScanResult;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis-backed coordination. Key layout, all below {@code {namespace}:}:
 * <ul>
 *     <li>{@code instance:{id}}: JSON {@link InstanceRecord}, expiring after the instance TTL</li>
 *     <li>{@code queue:{key}}: list of JSON items, pushed left and popped right</li>
 *     <li>{@code leader}: id of the leadership holder, expiring after the TTL given on acquisition</li>
 *     <li>{@code global:{kind}:pool_size}: integer counter, expiring after the global counter TTL</li>
 * </ul>
 * Every operation borrows a connection from a {@link JedisPool} and gives up with the neutral result when Redis fails.
 * A broken connection is retried once on a fresh one, but only while Redis is considered available: a read timeout or
 * a call during an outage costs at most one connection timeout. Error replies from the server are logged and never
 * retried. An outage is logged once when it starts and once when it ends.
 */
@Slf4j
public class RedisCoordinatorBackend implements CoordinatorBackend {

	static final String PREFIX_INSTANCE = "instance:";
	static final String PREFIX_QUEUE = "queue:";
	static final String KEY_LEADER = "leader";
	static final String PREFIX_GLOBAL = "global:";
	static final String SUFFIX_POOL_SIZE = ":pool_size";

	static final String RENEW_IF_OWNER_SCRIPT =
			"if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('expire', KEYS[1], ARGV[2]) else return 0 end";
	static final String DELETE_IF_OWNER_SCRIPT =
			"if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end";
	static final String SET_IF_OWNER_SCRIPT =
			"if redis.call('get', KEYS[1]) == ARGV[1] then redis.call('set', KEYS[2], ARGV[2], 'EX', ARGV[3]) return 1 else return 0 end";

	private static final int MAX_ATTEMPTS = 2;
	private static final TypeReference<Map<String, Object>> ITEM_TYPE = new TypeReference<Map<String, Object>>() {};

	@NotNull @Getter private final CoordinatorConfig config;
	@NotNull private final JedisPool jedisPool;
	@NotNull private final Ticker ticker;
	@NotNull private final ObjectMapper objectMapper = new ObjectMapper();
	@NotNull private final AtomicBoolean available = new AtomicBoolean(true);

	public RedisCoordinatorBackend(@NotNull CoordinatorConfig config) {
		this(config, createJedisPool(config), Ticker.SYSTEM);
		log.info("Redis pool coordination configured for {}:{} (namespace '{}')", config.getHost(), config.getPort(), config.getNamespace());
	}

	RedisCoordinatorBackend(@NotNull CoordinatorConfig config, @NotNull JedisPool jedisPool, @NotNull Ticker ticker) {
		this.config = config;
		this.jedisPool = jedisPool;
		this.ticker = ticker;
	}

	@NotNull
	private static JedisPool createJedisPool(@NotNull CoordinatorConfig config) {
		final JedisPoolConfig poolConfig = new JedisPoolConfig();
		poolConfig.setMaxTotal(config.getMaxConnections());
		poolConfig.setMaxWait(Duration.ofMillis(config.getTimeout().getDurationMs()));
		final int timeoutMs = (int) Math.min(Integer.MAX_VALUE, config.getTimeout().getDurationMs());
		return new JedisPool(poolConfig, config.getHost(), config.getPort(), timeoutMs, config.getPassword(), config.getDatabase());
	}

	@Override
	public boolean registerInstance(@NotNull String instanceId, @NotNull InstanceRecord record) {
		final InstanceRecord stamped = record.withLastSeen(nowSeconds());
		return execute("registerInstance", false, jedis -> "OK".equals(jedis.setex(
				key(PREFIX_INSTANCE + instanceId),
				config.getInstanceTtl().toSecondsRoundedUp(),
				objectMapper.writeValueAsString(stamped))));
	}

	@Override
	public boolean updateInstance(@NotNull String instanceId, @NotNull InstanceRecord record) {
		return registerInstance(instanceId, record);
	}

	@Override
	public boolean unregisterInstance(@NotNull String instanceId) {
		return execute("unregisterInstance", false, jedis -> jedis.del(key(PREFIX_INSTANCE + instanceId)) > 0);
	}

	@NotNull
	@Override
	public List<InstanceRecord> getActiveInstances() {
		return execute("getActiveInstances", Collections.<InstanceRecord>emptyList(), jedis -> {
			final long now = nowSeconds();
			final long ttlSeconds = config.getInstanceTtl().toSecondsRoundedUp();
			final List<InstanceRecord> instances = new ArrayList<>();
			final ScanParams scanParams = new ScanParams().match(key(PREFIX_INSTANCE) + "*").count(100);
			String cursor = ScanParams.SCAN_POINTER_START;
			do {
				final ScanResult<String> page = jedis.scan(cursor, scanParams);
				for (String instanceKey : page.getResult()) {
					final InstanceRecord record = readInstance(instanceKey, jedis.get(instanceKey));
					if (record != null && !record.isStale(now, ttlSeconds)) {
						instances.add(record);
					}
				}
				cursor = page.getCursor();
			} while (!ScanParams.SCAN_POINTER_START.equals(cursor));
			return instances;
		});
	}

	@Nullable
	private InstanceRecord readInstance(@NotNull String instanceKey, @Nullable String json) {
		if (json == null) {
			return null;
		}
		try {
			return objectMapper.readValue(json, InstanceRecord.class);
		} catch (JsonProcessingException e) {
			log.warn("Skipping unreadable instance record under {}: {}", instanceKey, e.getOriginalMessage());
			return null;
		}
	}

	@Override
	public boolean push(@NotNull String key, @NotNull Map<String, Object> item) {
		return execute("push", false, jedis -> jedis.lpush(key(PREFIX_QUEUE + key), objectMapper.writeValueAsString(item)) > 0);
	}

	@Nullable
	@Override
	public Map<String, Object> pop(@NotNull String key, int timeoutSeconds) {
		final String queueKey = key(PREFIX_QUEUE + key);
		return execute("pop", null, jedis -> {
			final String json;
			if (timeoutSeconds > 0) {
				final List<String> popped = jedis.brpop(timeoutSeconds, queueKey);
				json = popped != null && popped.size() > 1 ? popped.get(1) : null;
			} else {
				json = jedis.rpop(queueKey);
			}
			return json != null ? objectMapper.readValue(json, ITEM_TYPE) : null;
		});
	}

	@Override
	public int getQueueLength(@NotNull String key) {
		return execute("getQueueLength", 0, jedis -> (int) jedis.llen(key(PREFIX_QUEUE + key)));
	}

	@Override
	public boolean acquireLeadership(@NotNull String instanceId, int ttlSeconds) {
		final String leaderKey = key(KEY_LEADER);
		return execute("acquireLeadership", false, jedis -> {
			if ("OK".equals(jedis.set(leaderKey, instanceId, SetParams.setParams().nx().ex(ttlSeconds)))) {
				return true;
			}
			final Object renewed = jedis.eval(RENEW_IF_OWNER_SCRIPT, Collections.singletonList(leaderKey), Arrays.asList(instanceId, String.valueOf(ttlSeconds)));
			return isOne(renewed);
		});
	}

	@Override
	public boolean releaseLeadership(@NotNull String instanceId) {
		final String leaderKey = key(KEY_LEADER);
		return execute("releaseLeadership", false,
				jedis -> isOne(jedis.eval(DELETE_IF_OWNER_SCRIPT, Collections.singletonList(leaderKey), Collections.singletonList(instanceId))));
	}

	@Nullable
	@Override
	public String getCurrentLeader() {
		return execute("getCurrentLeader", null, jedis -> jedis.get(key(KEY_LEADER)));
	}

	@Override
	public long getGlobalPoolSize(@NotNull String kind) {
		return execute("getGlobalPoolSize", 0L, jedis -> {
			final String size = jedis.get(globalPoolSizeKey(kind));
			try {
				return size != null ? Long.parseLong(size) : 0L;
			} catch (NumberFormatException e) {
				log.warn("Ignoring non-numeric global pool size '{}' for kind '{}'", size, kind);
				return 0L;
			}
		});
	}

	@Override
	public void updateGlobalPoolSize(@NotNull String kind, long delta) {
		final String counterKey = globalPoolSizeKey(kind);
		execute("updateGlobalPoolSize", false, jedis -> {
			if (delta > 0) {
				jedis.incrBy(counterKey, delta);
			} else if (delta < 0) {
				jedis.decrBy(counterKey, -delta);
			}
			return jedis.expire(counterKey, config.getGlobalCounterTtl().toSecondsRoundedUp()) > 0;
		});
	}

	@Override
	public boolean publishGlobalPoolSize(@NotNull String leaderId, @NotNull String kind, long size) {
		final List<String> keys = Arrays.asList(key(KEY_LEADER), globalPoolSizeKey(kind));
		final List<String> args = Arrays.asList(leaderId, String.valueOf(size), String.valueOf(config.getGlobalCounterTtl().toSecondsRoundedUp()));
		return execute("publishGlobalPoolSize", false, jedis -> isOne(jedis.eval(SET_IF_OWNER_SCRIPT, keys, args)));
	}

	@Override
	public boolean set(@NotNull String key, @NotNull String value, int ttlSeconds) {
		return execute("set", false, jedis -> "OK".equals(ttlSeconds > 0
				? jedis.setex(key(key), ttlSeconds, value)
				: jedis.set(key(key), value)));
	}

	@Nullable
	@Override
	public String get(@NotNull String key) {
		return execute("get", null, jedis -> jedis.get(key(key)));
	}

	@Override
	public boolean delete(@NotNull String key) {
		return execute("delete", false, jedis -> jedis.del(key(key)) > 0);
	}

	@Override
	public boolean isConnected() {
		return execute("ping", false, jedis -> "PONG".equalsIgnoreCase(jedis.ping()));
	}

	@Override
	public void close() {
		jedisPool.close();
	}

	@NotNull
	String key(@NotNull String key) {
		return config.getNamespace() + ":" + key;
	}

	@NotNull
	private String globalPoolSizeKey(@NotNull String kind) {
		return key(PREFIX_GLOBAL + kind + SUFFIX_POOL_SIZE);
	}

	private long nowSeconds() {
		return ticker.currentTimeMillis() / 1000;
	}

	private static boolean isOne(@Nullable Object scriptResult) {
		return scriptResult instanceof Long && (Long) scriptResult == 1L;
	}

	/**
	 * Runs the command on a pooled connection and returns {@code fallback} when Redis can't be reached, replies with
	 * an error or the payload can't be (de)serialized. A broken connection is retried once on a fresh connection as
	 * long as Redis is not known to be down.
	 */
	private <R> R execute(@NotNull String operation, R fallback, @NotNull RedisCommand<R> command) {
		final int attempts = available.get() ? MAX_ATTEMPTS : 1;
		JedisException failure = null;
		for (int attempt = 0; attempt < attempts; attempt++) {
			try (Jedis jedis = jedisPool.getResource()) {
				final R result = command.apply(jedis);
				markAvailable();
				return result;
			} catch (JedisDataException e) {
				log.warn("Redis {} rejected: {}", operation, e.getMessage());
				return fallback;
			} catch (JedisException e) {
				failure = e;
				if (isTimeout(e)) {
					break;
				}
			} catch (JsonProcessingException e) {
				log.warn("Redis {} skipped, payload could not be converted: {}", operation, e.getOriginalMessage());
				return fallback;
			}
		}
		markUnavailable(operation, failure);
		return fallback;
	}

	private static boolean isTimeout(@NotNull Throwable failure) {
		for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
			if (cause instanceof SocketTimeoutException) {
				return true;
			}
		}
		return false;
	}

	private void markAvailable() {
		if (available.compareAndSet(false, true)) {
			log.info("Redis pool coordination available again");
		}
	}

	private void markUnavailable(@NotNull String operation, @Nullable JedisException failure) {
		if (available.compareAndSet(true, false)) {
			log.warn("Redis pool coordination unavailable ({} failed: {}), continuing as a standalone instance",
					operation, failure != null ? failure.getMessage() : "unknown");
		} else {
			log.debug("Redis {} skipped, coordination still unavailable", operation);
		}
	}

	@FunctionalInterface
	interface RedisCommand<R> {
		R apply(@NotNull Jedis jedis) throws JsonProcessingException;
	}
}
