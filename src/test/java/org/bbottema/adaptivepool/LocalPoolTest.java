package org.bbottema.adaptivepool;

import org.bbottema.adaptivepool.PoolTestHelper.CountingSlotFactory;
import org.bbottema.adaptivepool.util.ManualTicker;
import org.bbottema.adaptivepool.util.Timeout;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bbottema.adaptivepool.PoolTestHelper.createSlotFactory;

public class LocalPoolTest {

	private ManualTicker ticker;
	private CountingSlotFactory slotFactory;

	@Before
	public void setup() {
		ticker = new ManualTicker();
		slotFactory = createSlotFactory();
	}

	@Test
	public void testExpandThenOverflowThenExhausted() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(2).maxSize(4).emergencyLimit(6).scaleThreshold(0.8).cooldownPeriod(Timeout.NONE).build());

		final List<PooledObject<StringBuilder>> borrowed = new ArrayList<>();
		for (int i = 0; i < 4; i++) {
			borrowed.add(pool.borrow());
		}
		assertThat(borrowed).noneMatch(PooledObject::isOverflow);
		assertThat(pool.getStats().getCurrentSize()).isEqualTo(4);
		assertThat(pool.getStats().getExpanded()).isEqualTo(2);

		borrowed.add(pool.borrow());
		borrowed.add(pool.borrow());
		assertThat(borrowed.subList(4, 6)).allMatch(PooledObject::isOverflow);

		assertThatThrownBy(pool::borrow)
				.isInstanceOf(PoolExhaustedException.class)
				.hasMessageContaining("emergency limit of 6");

		final PoolStats stats = pool.getStats();
		assertThat(stats.getBorrowed()).isEqualTo(6);
		assertThat(stats.getCreated()).isEqualTo(4);
		assertThat(stats.getOverflowCreated()).isEqualTo(2);
		assertThat(stats.getEmergencyActivations()).isEqualTo(2);
		assertThat(stats.getInUseCount()).isEqualTo(6);
		assertThat(stats.getOverflowOutstanding()).isEqualTo(2);
		assertThat(stats.getUtilization()).isEqualTo(1.0);
		assertThat(stats.getPeakUtilization()).isEqualTo(1.0);
	}

	@Test
	public void testExpansionWaitsForCooldown() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(1).maxSize(10).emergencyLimit(20).cooldownPeriod(Timeout.ofSeconds(60)).build());

		pool.borrow();
		assertThat(pool.borrow().isOverflow()).isFalse(); // first expansion, no earlier scaling event
		assertThat(pool.borrow().isOverflow()).isTrue();

		ticker.advanceSeconds(60);
		assertThat(pool.borrow().isOverflow()).isFalse();
		assertThat(pool.getStats().getExpanded()).isEqualTo(2);
	}

	@Test
	public void testBorrowReturnCountersStayConsistent() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(2).maxSize(4).emergencyLimit(6).cooldownPeriod(Timeout.NONE).autoScale(false).build());

		final PooledObject<StringBuilder> first = pool.borrow();
		final PooledObject<StringBuilder> second = pool.borrow();
		pool.borrow();
		assertCounterInvariant(pool.getStats());

		first.release();
		pool.returnObject(second);
		assertCounterInvariant(pool.getStats());

		assertThat(pool.getStats().getBorrowed()).isEqualTo(3);
		assertThat(pool.getStats().getReturned()).isEqualTo(2);
		assertThat(pool.getStats().getFreeCount()).isEqualTo(2);
		assertThat(slotFactory.resets.get()).isEqualTo(2);
	}

	@Test
	public void testCountersStayConsistentUnderConcurrency() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(5).maxSize(20).emergencyLimit(1000).cooldownPeriod(Timeout.NONE).build());

		final ExecutorService executor = Executors.newFixedThreadPool(8);
		final List<Future<?>> futures = new ArrayList<>();
		for (int t = 0; t < 8; t++) {
			futures.add(executor.submit(() -> {
				for (int i = 0; i < 200; i++) {
					try {
						pool.borrow().release();
					} catch (PoolException e) {
						throw new AssertionError(e);
					}
				}
			}));
		}
		for (Future<?> future : futures) {
			future.get(30, TimeUnit.SECONDS);
		}
		executor.shutdown();

		final PoolStats stats = pool.getStats();
		assertThat(stats.getBorrowed()).isEqualTo(1600);
		assertThat(stats.getReturned()).isEqualTo(1600);
		assertThat(stats.getInUseCount()).isZero();
		assertCounterInvariant(stats);
	}

	@Test
	public void testReturnedOverflowObjectIsDestroyed() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(1).maxSize(1).emergencyLimit(2).autoScale(false).build());

		pool.borrow();
		final PooledObject<StringBuilder> overflow = pool.borrow();
		assertThat(overflow.isOverflow()).isTrue();

		overflow.release();

		assertThat(overflow.getState()).isEqualTo(PooledObject.State.DESTROYED);
		assertThat(slotFactory.destructions.get()).isEqualTo(1);
		assertThat(pool.getStats().getCurrentSize()).isEqualTo(1);
		assertThat(pool.getStats().getOverflowOutstanding()).isZero();
		assertThatThrownBy(overflow::getObject).isInstanceOf(IllegalStateException.class);
	}

	@Test
	public void testDoubleReturnIsIgnored() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder().initialSize(1).maxSize(1).emergencyLimit(1).build());

		final PooledObject<StringBuilder> object = pool.borrow();
		object.release();
		object.release();

		assertThat(pool.getStats().getReturned()).isEqualTo(1);
		assertThat(pool.getStats().getFreeCount()).isEqualTo(1);
	}

	@Test
	public void testReturnToForeignPoolRejected() throws Exception {
		final LocalPool<StringBuilder> requests = createPool(PoolConfig.builder().initialSize(1).build());
		final LocalPool<StringBuilder> responses = new LocalPool<>("response", PoolConfig.builder().initialSize(1).build(), slotFactory, ticker);

		final PooledObject<StringBuilder> request = requests.borrow();

		assertThatThrownBy(() -> responses.returnObject(request))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("does not belong to pool 'response'");
	}

	@Test
	public void testFailingResetDestroysSlot() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder().initialSize(2).autoScale(false).build());
		slotFactory.failResets = true;

		pool.borrow().release();

		final PoolStats stats = pool.getStats();
		assertThat(stats.getReturned()).isEqualTo(1);
		assertThat(stats.getCurrentSize()).isEqualTo(1);
		assertThat(stats.getDestroyed()).isEqualTo(1);
		assertCounterInvariant(stats);
	}

	@Test
	public void testFactoryFailureDuringExpansionLeavesPoolUntouched() throws Exception {
		slotFactory = createSlotFactory(2);
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(2).maxSize(10).emergencyLimit(20).cooldownPeriod(Timeout.NONE).build());
		pool.borrow();
		pool.borrow();

		assertThatThrownBy(pool::borrow)
				.isInstanceOf(SlotFactoryException.class)
				.hasRootCauseInstanceOf(IllegalStateException.class);

		final PoolStats stats = pool.getStats();
		assertThat(stats.getCurrentSize()).isEqualTo(2);
		assertThat(stats.getCreated()).isEqualTo(2);
		assertThat(stats.getExpanded()).isZero();
		assertThat(stats.getBorrowed()).isEqualTo(2);
	}

	@Test
	public void testResizeGrowthRollsBackOnFactoryFailure() {
		slotFactory = createSlotFactory(3);
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder().initialSize(2).maxSize(10).emergencyLimit(20).build());

		assertThat(pool.resize(2.0, false)).isEqualTo(2);
		assertThat(pool.getStats().getCreated()).isEqualTo(2);
		assertThat(slotFactory.destructions.get()).isEqualTo(1);
	}

	@Test
	public void testResizeNeverDestroysBorrowedObjects() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder().initialSize(4).maxSize(10).emergencyLimit(20).build());
		final List<PooledObject<StringBuilder>> borrowed = new ArrayList<>();
		for (int i = 0; i < 3; i++) {
			borrowed.add(pool.borrow());
		}

		assertThat(pool.resize(0.5, false)).isEqualTo(3);

		for (PooledObject<StringBuilder> object : borrowed) {
			assertThat(object.getState()).isEqualTo(PooledObject.State.IN_USE);
			assertThat(object.getObject()).isNotNull();
		}
		final PoolStats stats = pool.getStats();
		assertThat(stats.getShrunk()).isEqualTo(1);
		assertThat(stats.getFreeCount()).isZero();
		assertThat(stats.getDestroyed()).isEqualTo(1);
		assertCounterInvariant(stats);
	}

	@Test
	public void testResizeClampsToLimits() {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(8).maxSize(10).emergencyLimit(20).minSize(3).build());

		assertThat(pool.resize(2.0, false)).isEqualTo(10);
		assertThat(pool.resize(0.1, false)).isEqualTo(3);
		assertThat(pool.resize(1.0, false)).isEqualTo(3);
		assertThat(pool.getStats().getShrunk()).isEqualTo(1);
		assertThat(pool.getStats().getExpanded()).isEqualTo(1);
	}

	@Test
	public void testResizeToAbsoluteSize() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(8).maxSize(10).emergencyLimit(20).minSize(3).build());
		final PooledObject<StringBuilder> borrowed = pool.borrow();

		assertThat(pool.resizeTo(12)).isEqualTo(10);
		assertThat(pool.resizeTo(1)).isEqualTo(3);
		assertThat(pool.resizeTo(3)).isEqualTo(3);

		assertThat(borrowed.getState()).isEqualTo(PooledObject.State.IN_USE);
		final PoolStats stats = pool.getStats();
		assertThat(stats.getExpanded()).isEqualTo(1);
		assertThat(stats.getShrunk()).isEqualTo(1);
		assertThat(stats.getFreeCount()).isEqualTo(2);
		assertCounterInvariant(stats);
	}

	@Test
	public void testResizeScalesLimits() {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(10).maxSize(20).emergencyLimit(40).build());

		pool.resize(0.5, true);

		final PoolStats stats = pool.getStats();
		assertThat(stats.getCurrentSize()).isEqualTo(5);
		assertThat(stats.getMaxSize()).isEqualTo(10);
		assertThat(stats.getEmergencyLimit()).isEqualTo(20);
	}

	@Test
	public void testResizeRejectsNonPositiveFactor() {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder().initialSize(1).build());
		assertThatThrownBy(() -> pool.resize(0, false)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	public void testUnderutilizedPoolShrinksBackToInitialSize() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder()
				.initialSize(2).maxSize(4).emergencyLimit(6).cooldownPeriod(Timeout.NONE).build());
		final List<PooledObject<StringBuilder>> borrowed = new ArrayList<>();
		for (int i = 0; i < 4; i++) {
			borrowed.add(pool.borrow());
		}
		assertThat(pool.getCurrentSize()).isEqualTo(4);

		for (PooledObject<StringBuilder> object : borrowed) {
			object.release();
		}

		final PoolStats stats = pool.getStats();
		assertThat(stats.getCurrentSize()).isEqualTo(2);
		assertThat(stats.getShrunk()).isEqualTo(1);
		assertThat(stats.getFreeCount()).isEqualTo(2);
	}

	@Test
	public void testShutdown() throws Exception {
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder().initialSize(3).build());
		final PooledObject<StringBuilder> outstanding = pool.borrow();

		pool.shutdown();

		assertThat(pool.isShutDown()).isTrue();
		assertThat(slotFactory.destructions.get()).isEqualTo(2);
		assertThatThrownBy(pool::borrow).isInstanceOf(IllegalStateException.class);

		outstanding.release();
		assertThat(slotFactory.destructions.get()).isEqualTo(3);
		assertThat(pool.getStats().getCurrentSize()).isZero();
	}

	@Test
	public void testFailingWarmUpStillServesBorrows() throws Exception {
		slotFactory = createSlotFactory(1);
		final LocalPool<StringBuilder> pool = createPool(PoolConfig.builder().initialSize(3).build());

		assertThat(pool.getCurrentSize()).isEqualTo(1);
		assertThat(pool.borrow().getObject().toString()).isEqualTo("request#1");
	}

	private LocalPool<StringBuilder> createPool(PoolConfig config) {
		return new LocalPool<>("request", config, slotFactory, ticker);
	}

	private static void assertCounterInvariant(PoolStats stats) {
		assertThat(stats.getBorrowed() - stats.getReturned()).isEqualTo(stats.getInUseCount());
		assertThat(stats.getInUseCount()).isLessThanOrEqualTo(stats.getCurrentSize() + stats.getOverflowOutstanding());
	}
}
