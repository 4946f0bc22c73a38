package org.bbottema.adaptivepool.coordinator;

import org.bbottema.adaptivepool.LeadershipState;
import org.bbottema.adaptivepool.OrchestratorConfig;
import org.bbottema.adaptivepool.OrchestratorStats;
import org.bbottema.adaptivepool.PoolConfig;
import org.bbottema.adaptivepool.PoolOrchestrator;
import org.bbottema.adaptivepool.PoolSlotFactory;
import org.bbottema.adaptivepool.memory.MemoryPressureConfig;
import org.bbottema.adaptivepool.memory.MemoryPressureMonitor;
import org.bbottema.adaptivepool.memory.MemoryProbe;
import org.bbottema.adaptivepool.util.ManualTicker;
import org.bbottema.adaptivepool.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs against a server that accepts connections but never replies, the way a hung Redis behaves.
 */
public class RedisCoordinatorBackendTimeoutTest {

	private static final long TIMEOUT_MS = 500;

	private final List<Socket> accepted = new CopyOnWriteArrayList<>();
	private ServerSocket silentServer;
	private RedisCoordinatorBackend backend;

	@Before
	public void setup() throws IOException {
		silentServer = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
		final Thread acceptor = new Thread(() -> {
			while (!silentServer.isClosed()) {
				try {
					accepted.add(silentServer.accept());
				} catch (IOException e) {
					return;
				}
			}
		}, "silent-redis");
		acceptor.setDaemon(true);
		acceptor.start();
		backend = new RedisCoordinatorBackend(CoordinatorConfig.builder()
				.host(InetAddress.getLoopbackAddress().getHostAddress())
				.port(silentServer.getLocalPort())
				.timeout(Timeout.ofMillis(TIMEOUT_MS))
				.build());
	}

	@After
	public void tearDown() throws IOException {
		backend.close();
		silentServer.close();
		for (Socket socket : accepted) {
			socket.close();
		}
	}

	@Test
	public void testOperationGivesUpAfterOneTimeout() {
		final long start = System.nanoTime();

		assertThat(backend.get("k")).isNull();
		assertThat(backend.isConnected()).isFalse();

		assertThat(elapsedMs(start)).isLessThan(3 * TIMEOUT_MS);
	}

	@Test
	public void testTickAndStatsDoNotHangOnSilentRedis() {
		final MemoryProbe probe = mock(MemoryProbe.class);
		when(probe.limitBytes()).thenReturn(1000L);
		when(probe.usedBytes()).thenReturn(100L);
		final ManualTicker ticker = new ManualTicker();
		final MemoryPressureMonitor monitor = new MemoryPressureMonitor(MemoryPressureConfig.builder().checkInterval(Timeout.NONE).build(), probe, () -> { }, ticker);
		final OrchestratorConfig config = OrchestratorConfig.builder().instanceId("a").syncInterval(Timeout.NONE).build();
		final PoolOrchestrator orchestrator = new PoolOrchestrator(config, backend, monitor, ticker);
		orchestrator.registerKind("request", PoolConfig.builder().initialSize(2).build(), new StringSlotFactory());

		long start = System.nanoTime();
		orchestrator.tick();
		assertThat(elapsedMs(start)).isLessThan(2 * TIMEOUT_MS);

		start = System.nanoTime();
		orchestrator.tick();
		assertThat(elapsedMs(start)).isLessThan(2 * TIMEOUT_MS);

		start = System.nanoTime();
		final OrchestratorStats stats = orchestrator.getStats();
		assertThat(elapsedMs(start)).isLessThan(TIMEOUT_MS);

		assertThat(stats.getSyncOperations()).isEqualTo(2);
		assertThat(stats.getCoordinator().isConnected()).isFalse();
		assertThat(stats.getCoordinator().getLeadershipState()).isEqualTo(LeadershipState.NOT_LEADER);
		assertThat(stats.getPerKind().get("request").getCurrentSize()).isEqualTo(2);
	}

	private static long elapsedMs(long startNanos) {
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
	}

	private static class StringSlotFactory extends PoolSlotFactory<String> {
		@NotNull
		@Override
		public String create(@NotNull String kind) {
			return kind;
		}
	}
}
