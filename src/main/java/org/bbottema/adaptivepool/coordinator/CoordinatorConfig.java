package org.bbottema.adaptivepool.coordinator;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.bbottema.adaptivepool.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Connection and key layout settings for the {@link RedisCoordinatorBackend}. TTLs also apply to the
 * {@link InMemoryCoordinatorBackend}.
 */
@NonFinal@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class CoordinatorConfig {
	@NotNull private final String host;
	private final int port;
	@ToString.Exclude
	@Nullable private final String password;
	private final int database;
	/**
	 * Prefix for every key, separated by a colon. Default {@code adaptivepool:pools}.
	 */
	@NotNull private final String namespace;
	/**
	 * Connect and socket timeout; a timed out operation counts as the backend being unavailable. Default 2 seconds.
	 */
	@NotNull private final Timeout timeout;
	/**
	 * Lifetime of an instance record without heartbeat. Default 60 seconds.
	 */
	@NotNull private final Timeout instanceTtl;
	/**
	 * Lifetime of a global pool size counter without refresh. Default 300 seconds.
	 */
	@NotNull private final Timeout globalCounterTtl;
	private final int maxConnections;

	@Builder
	@SuppressWarnings("unused")
	private CoordinatorConfig(@Nullable String host, @Nullable Integer port, @Nullable String password, @Nullable Integer database,
			@Nullable String namespace, @Nullable Timeout timeout, @Nullable Timeout instanceTtl,
			@Nullable Timeout globalCounterTtl, @Nullable Integer maxConnections) {
		this.host = host != null ? host : "127.0.0.1";
		this.port = port != null ? port : 6379;
		this.password = password;
		this.database = database != null ? database : 0;
		this.namespace = namespace != null ? namespace : "adaptivepool:pools";
		this.timeout = timeout != null ? timeout : new Timeout(2, SECONDS);
		this.instanceTtl = instanceTtl != null ? instanceTtl : new Timeout(60, SECONDS);
		this.globalCounterTtl = globalCounterTtl != null ? globalCounterTtl : new Timeout(300, SECONDS);
		this.maxConnections = maxConnections != null ? maxConnections : 8;

		if (this.port <= 0 || this.port > 65535) {
			throw new IllegalArgumentException("Invalid Redis port " + this.port);
		}
		if (this.instanceTtl.getDurationMs() < 1000 || this.globalCounterTtl.getDurationMs() < 1000) {
			throw new IllegalArgumentException("TTLs should be at least one second");
		}
		if (this.maxConnections < 1) {
			throw new IllegalArgumentException("At least one connection is needed");
		}
	}

	@NotNull
	public static CoordinatorConfig defaults() {
		return builder().build();
	}
}
