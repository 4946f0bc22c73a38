package org.bbottema.adaptivepool.coordinator;

import org.bbottema.adaptivepool.util.ManualTicker;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class InMemoryCoordinatorBackendTest {

	private ManualTicker ticker;
	private InMemoryCoordinatorBackend backend;

	@Before
	public void setup() {
		ticker = new ManualTicker();
		backend = new InMemoryCoordinatorBackend(CoordinatorConfig.defaults(), ticker);
	}

	@Test
	public void testOnlyOneInstanceHoldsLeadership() {
		assertThat(backend.acquireLeadership("a", 30)).isTrue();
		assertThat(backend.acquireLeadership("b", 30)).isFalse();
		assertThat(backend.acquireLeadership("a", 30)).isTrue();
		assertThat(backend.getCurrentLeader()).isEqualTo("a");

		assertThat(backend.releaseLeadership("b")).isFalse();
		assertThat(backend.getCurrentLeader()).isEqualTo("a");
		assertThat(backend.releaseLeadership("a")).isTrue();
		assertThat(backend.getCurrentLeader()).isNull();

		assertThat(backend.acquireLeadership("b", 30)).isTrue();
		assertThat(backend.getCurrentLeader()).isEqualTo("b");
	}

	@Test
	public void testLeadershipLapses() {
		assertThat(backend.acquireLeadership("a", 30)).isTrue();
		ticker.advanceSeconds(29);
		assertThat(backend.acquireLeadership("b", 30)).isFalse();
		ticker.advanceSeconds(1);
		assertThat(backend.getCurrentLeader()).isNull();
		assertThat(backend.acquireLeadership("b", 30)).isTrue();
	}

	@Test
	public void testRenewalExtendsLease() {
		backend.acquireLeadership("a", 30);
		ticker.advanceSeconds(20);
		backend.acquireLeadership("a", 30);
		ticker.advanceSeconds(20);
		assertThat(backend.acquireLeadership("b", 30)).isFalse();
		assertThat(backend.getCurrentLeader()).isEqualTo("a");
	}

	@Test
	public void testInstancesExpireWithoutHeartbeat() {
		backend.registerInstance("a", new InstanceRecord("a", "h", 1, Collections.singletonMap("request", 4), 0, 1.0));
		backend.registerInstance("b", new InstanceRecord("b", "h", 2, null, 0, 1.0));
		assertThat(backend.getActiveInstances()).extracting(InstanceRecord::getInstanceId).containsExactly("a", "b");
		assertThat(backend.getActiveInstances().get(0).getLastSeen()).isEqualTo(ticker.currentTimeMillis() / 1000);

		ticker.advanceSeconds(40);
		backend.updateInstance("b", new InstanceRecord("b", "h", 2, null, 0, 1.0));
		ticker.advanceSeconds(21);
		assertThat(backend.getActiveInstances()).extracting(InstanceRecord::getInstanceId).containsExactly("b");

		assertThat(backend.unregisterInstance("b")).isTrue();
		assertThat(backend.getActiveInstances()).isEmpty();
	}

	@Test
	public void testQueueIsFifo() {
		backend.push("jobs", Collections.<String, Object>singletonMap("n", 1));
		backend.push("jobs", Collections.<String, Object>singletonMap("n", 2));

		assertThat(backend.getQueueLength("jobs")).isEqualTo(2);
		assertThat(backend.pop("jobs", 0)).containsEntry("n", 1);
		assertThat(backend.pop("jobs", 0)).containsEntry("n", 2);
		assertThat(backend.pop("jobs", 0)).isNull();
	}

	@Test
	public void testBlockingPopReceivesLatePush() throws Exception {
		final CompletableFuture<Map<String, Object>> popped = CompletableFuture.supplyAsync(() -> backend.pop("jobs", 5));
		Thread.sleep(100);
		backend.push("jobs", Collections.<String, Object>singletonMap("n", 3));

		assertThat(popped.get(5, TimeUnit.SECONDS)).containsEntry("n", 3);
	}

	@Test
	public void testGlobalPoolSizeCounterExpires() {
		backend.updateGlobalPoolSize("request", 5);
		backend.updateGlobalPoolSize("request", -2);
		assertThat(backend.getGlobalPoolSize("request")).isEqualTo(3);

		ticker.advanceSeconds(300);
		assertThat(backend.getGlobalPoolSize("request")).isZero();
	}

	@Test
	public void testOnlyLeaderPublishesGlobalPoolSize() {
		backend.acquireLeadership("a", 30);

		assertThat(backend.publishGlobalPoolSize("b", "request", 30)).isFalse();
		assertThat(backend.getGlobalPoolSize("request")).isZero();
		assertThat(backend.publishGlobalPoolSize("a", "request", 12)).isTrue();
		assertThat(backend.getGlobalPoolSize("request")).isEqualTo(12);

		ticker.advanceSeconds(30);
		assertThat(backend.publishGlobalPoolSize("a", "request", 14)).isFalse();
		assertThat(backend.getGlobalPoolSize("request")).isEqualTo(12);
	}

	@Test
	public void testValuesWithAndWithoutExpiry() {
		backend.set("a", "1", 10);
		backend.set("b", "2", 0);
		ticker.advanceSeconds(10);

		assertThat(backend.get("a")).isNull();
		assertThat(backend.get("b")).isEqualTo("2");
		assertThat(backend.delete("b")).isTrue();
		assertThat(backend.get("b")).isNull();
	}

	@Test
	public void testDisconnectedBackendReturnsNeutralValues() {
		backend.acquireLeadership("a", 30);
		backend.setConnected(false);

		assertThat(backend.isConnected()).isFalse();
		assertThat(backend.registerInstance("a", new InstanceRecord("a", null, 1, null, 0, 1.0))).isFalse();
		assertThat(backend.getActiveInstances()).isEmpty();
		assertThat(backend.acquireLeadership("a", 30)).isFalse();
		assertThat(backend.getCurrentLeader()).isNull();
		assertThat(backend.push("jobs", Collections.<String, Object>emptyMap())).isFalse();
		assertThat(backend.pop("jobs", 1)).isNull();
		assertThat(backend.set("k", "v", 0)).isFalse();

		backend.setConnected(true);
		assertThat(backend.getCurrentLeader()).isEqualTo("a");
	}
}
