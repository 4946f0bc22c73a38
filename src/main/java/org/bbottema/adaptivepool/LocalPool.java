package org.bbottema.adaptivepool;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.adaptivepool.util.Ticker;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static org.bbottema.adaptivepool.PooledObject.State.FREE;
import static org.bbottema.adaptivepool.PooledObject.State.OVERFLOW;

/**
 * In-process pool for a single object kind. Never blocks waiting for capacity: a borrow is served from a free slot,
 * from a freshly expanded pool, from a one-off overflow object, or fails right away with
 * {@link PoolExhaustedException}.
 * <p>
 * All bookkeeping happens under one lock, so borrow and return may be called from many request threads while
 * {@link #resize(double, boolean)} runs from a maintenance thread.
 *
 * @param <T> the value type
 */
@Slf4j
public class LocalPool<T> {

	private static final long NEVER = Long.MIN_VALUE;

	@NotNull private final Lock lock = new ReentrantLock();
	@NotNull private final LinkedList<PooledObject<T>> free = new LinkedList<>();

	@NotNull @Getter private final String kind;
	@NotNull @Getter private final PoolConfig poolConfig;
	@NotNull @Getter private final PoolSlotFactory<T> slotFactory;
	@NotNull private final Ticker ticker;

	private int currentSize;
	private int inUse;
	private int overflowOutstanding;
	private int maxSize;
	private int emergencyLimit;
	private long lastScaleAtMs = NEVER;
	private double peakUtilization;
	private boolean shutDown;

	private long borrowed;
	private long returned;
	private long created;
	private long destroyed;
	private long expanded;
	private long shrunk;
	private long overflowCreated;
	private long emergencyActivations;

	public LocalPool(@NotNull String kind, @NotNull PoolConfig poolConfig, @NotNull PoolSlotFactory<T> slotFactory) {
		this(kind, poolConfig, slotFactory, Ticker.SYSTEM);
	}

	public LocalPool(@NotNull String kind, @NotNull PoolConfig poolConfig, @NotNull PoolSlotFactory<T> slotFactory, @NotNull Ticker ticker) {
		this.kind = kind;
		this.poolConfig = poolConfig;
		this.slotFactory = slotFactory;
		this.ticker = ticker;
		this.maxSize = poolConfig.getMaxSize();
		this.emergencyLimit = poolConfig.getEmergencyLimit();
		warmUp();
	}

	private void warmUp() {
		lock.lock();
		try {
			for (int i = 0; i < poolConfig.getInitialSize(); i++) {
				free.addLast(new PooledObject<>(this, kind, slotFactory.create(kind), ticker.currentTimeMillis(), FREE));
				currentSize++;
				created++;
			}
		} catch (RuntimeException e) {
			log.error("Not able to warm up pool '{}' beyond {} objects, it will grow on demand instead", kind, currentSize, e);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Will claim a free slot, expand the pool if utilization and cooldown allow it, or else hand out an overflow object
	 * as long as the emergency limit permits.
	 *
	 * @throws PoolExhaustedException if even the emergency limit has been reached
	 * @throws SlotFactoryException   if the factory failed to create a new object; the pool is unaffected
	 * @throws IllegalStateException  if the pool has been shut down
	 */
	@NotNull
	public PooledObject<T> borrow() throws PoolExhaustedException, SlotFactoryException {
		lock.lock();
		try {
			if (shutDown) {
				throw new IllegalStateException("Pool '" + kind + "' has been shut down");
			}
			final long now = ticker.currentTimeMillis();
			PooledObject<T> slot = free.pollFirst();
			if (slot == null && mayExpand(now)) {
				expand(now);
				slot = free.pollFirst();
			}
			return slot != null ? checkOut(slot, now) : createOverflowOrFail(now);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Takes back a borrowed object. Overflow objects are destroyed, pooled objects are reset and become free again.
	 * Returning an object twice is ignored.
	 *
	 * @throws IllegalArgumentException if the object was issued by another pool
	 */
	public void returnObject(@NotNull PooledObject<T> pooledObject) {
		if (pooledObject.getPool() != this) {
			throw new IllegalArgumentException("Object of kind '" + pooledObject.getKind() + "' does not belong to pool '" + kind + "'");
		}
		lock.lock();
		try {
			switch (pooledObject.getState()) {
				case OVERFLOW:
					overflowOutstanding--;
					returned++;
					destroySlot(pooledObject);
					break;
				case IN_USE:
					inUse--;
					returned++;
					recycle(pooledObject);
					break;
				default:
					log.warn("Ignoring return of {} object that is already {}", kind, pooledObject.getState());
			}
		} finally {
			lock.unlock();
		}
	}

	private void recycle(@NotNull PooledObject<T> pooledObject) {
		if (shutDown) {
			currentSize--;
			destroySlot(pooledObject);
			return;
		}
		try {
			slotFactory.reset(pooledObject.getObject());
		} catch (RuntimeException e) {
			log.warn("Resetting returned {} object failed, destroying it instead of putting it back", kind, e);
			currentSize--;
			destroySlot(pooledObject);
			return;
		}
		pooledObject.markFree();
		free.addLast(pooledObject);
		if (poolConfig.isAutoScale()) {
			shrinkIfUnderutilized(ticker.currentTimeMillis());
		}
	}

	/**
	 * Multiplies the current size by {@code factor}, clamped to {@code [minSize, min(maxSize, hardCeiling)]}.
	 * Shrinking only ever destroys free slots: with fewer free slots than the requested reduction the pool shrinks
	 * by what is available.
	 *
	 * @param factor      multiplier, must be positive
	 * @param scaleLimits whether {@code maxSize} and {@code emergencyLimit} are multiplied as well
	 * @return the size after resizing
	 */
	public int resize(double factor, boolean scaleLimits) {
		if (!(factor > 0) || Double.isInfinite(factor)) {
			throw new IllegalArgumentException("Resize factor should be a positive number, was " + factor);
		}
		lock.lock();
		try {
			if (shutDown || factor == 1.0) {
				return currentSize;
			}
			final int minSize = poolConfig.getMinSize();
			final int hardCeiling = poolConfig.getHardCeiling();
			if (scaleLimits) {
				maxSize = clamp(Math.round(maxSize * factor), minSize, hardCeiling);
				emergencyLimit = clamp(Math.round(emergencyLimit * factor), maxSize, Math.max(maxSize, hardCeiling));
			}
			final int clamped = clamp(Math.round(currentSize * factor), minSize, Math.min(maxSize, hardCeiling));
			final int target = factor < 1 ? Math.min(clamped, currentSize) : Math.max(clamped, currentSize);
			final int previousSize = currentSize;
			moveTowards(target);
			if (factor < 1) {
				shrunk++;
			}
			log.info("Resized pool '{}' by factor {}: {} -> {} (max {}, emergency limit {})", kind, factor, previousSize, currentSize, maxSize, emergencyLimit);
			return currentSize;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Moves the pool to an absolute size, clamped to {@code [minSize, min(maxSize, hardCeiling)]}. As with
	 * {@link #resize(double, boolean)}, only free slots are destroyed when shrinking and the cooldown is ignored.
	 *
	 * @return the size after resizing
	 */
	public int resizeTo(int targetSize) {
		lock.lock();
		try {
			if (shutDown) {
				return currentSize;
			}
			final int target = clamp(targetSize, poolConfig.getMinSize(), Math.min(maxSize, poolConfig.getHardCeiling()));
			final int previousSize = currentSize;
			if (target == previousSize) {
				return currentSize;
			}
			moveTowards(target);
			if (target < previousSize) {
				shrunk++;
			}
			log.info("Resized pool '{}' towards {} objects: {} -> {}", kind, targetSize, previousSize, currentSize);
			return currentSize;
		} finally {
			lock.unlock();
		}
	}

	private void moveTowards(int target) {
		final int previousSize = currentSize;
		if (target < currentSize) {
			currentSize -= destroyFreeSlots(currentSize - target);
		} else if (target > currentSize) {
			growTo(target);
		}
		if (currentSize != previousSize) {
			lastScaleAtMs = ticker.currentTimeMillis();
		}
	}

	private void growTo(int target) {
		try {
			final List<PooledObject<T>> added = createSlots(target - currentSize);
			free.addAll(added);
			currentSize = target;
			created += added.size();
			expanded++;
		} catch (SlotFactoryException e) {
			log.error("Not able to grow pool '{}' to {} objects, keeping it at {}", kind, target, currentSize, e);
		}
	}

	/**
	 * @see PoolStats
	 */
	@NotNull
	public PoolStats getStats() {
		lock.lock();
		try {
			return PoolStats.builder()
					.kind(kind)
					.borrowed(borrowed)
					.returned(returned)
					.created(created)
					.destroyed(destroyed)
					.expanded(expanded)
					.shrunk(shrunk)
					.overflowCreated(overflowCreated)
					.emergencyActivations(emergencyActivations)
					.currentSize(currentSize)
					.freeCount(free.size())
					.inUseCount(inUse + overflowOutstanding)
					.overflowOutstanding(overflowOutstanding)
					.maxSize(maxSize)
					.emergencyLimit(emergencyLimit)
					.peakUtilization(peakUtilization)
					.build();
		} finally {
			lock.unlock();
		}
	}

	public int getCurrentSize() {
		lock.lock();
		try {
			return currentSize;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Destroys all free slots and refuses new borrows. Objects still out are destroyed when they come back.
	 */
	public void shutdown() {
		lock.lock();
		try {
			if (!shutDown) {
				shutDown = true;
				currentSize -= destroyFreeSlots(free.size());
				log.info("Pool '{}' shut down, {} objects still borrowed", kind, inUse + overflowOutstanding);
			}
		} finally {
			lock.unlock();
		}
	}

	public boolean isShutDown() {
		lock.lock();
		try {
			return shutDown;
		} finally {
			lock.unlock();
		}
	}

	private boolean mayExpand(long now) {
		return currentSize < maxSize
				&& utilization() >= poolConfig.getScaleThreshold()
				&& cooldownElapsed(now);
	}

	private void expand(long now) throws SlotFactoryException {
		final int newSize = Math.min(Math.max(currentSize + 1, (int) Math.ceil(currentSize * poolConfig.getGrowthFactor())), maxSize);
		final List<PooledObject<T>> added = createSlots(newSize - currentSize);
		free.addAll(added);
		log.debug("Expanded pool '{}' from {} to {} objects", kind, currentSize, newSize);
		currentSize = newSize;
		created += added.size();
		expanded++;
		lastScaleAtMs = now;
	}

	private void shrinkIfUnderutilized(long now) {
		final int floor = Math.max(poolConfig.getMinSize(), poolConfig.getInitialSize());
		if (currentSize <= floor || utilization() > poolConfig.getShrinkThreshold() || !cooldownElapsed(now)) {
			return;
		}
		final int target = Math.max((int) Math.floor(currentSize * poolConfig.getShrinkFactor()), floor);
		final int removed = destroyFreeSlots(currentSize - target);
		if (removed > 0) {
			log.debug("Shrunk underutilized pool '{}' from {} to {} objects", kind, currentSize, currentSize - removed);
			currentSize -= removed;
			shrunk++;
			lastScaleAtMs = now;
		}
	}

	@NotNull
	private PooledObject<T> checkOut(@NotNull PooledObject<T> slot, long now) {
		slot.markInUse(now);
		inUse++;
		borrowed++;
		peakUtilization = Math.max(peakUtilization, utilization());
		return slot;
	}

	@NotNull
	private PooledObject<T> createOverflowOrFail(long now) throws PoolExhaustedException, SlotFactoryException {
		if (currentSize + overflowOutstanding >= emergencyLimit) {
			throw new PoolExhaustedException(kind, emergencyLimit);
		}
		final PooledObject<T> overflow = new PooledObject<>(this, kind, createObject(), now, OVERFLOW);
		if (overflowOutstanding == 0) {
			log.warn("Pool '{}' at {} of max {} objects, handing out overflow objects", kind, currentSize, maxSize);
		}
		overflowOutstanding++;
		overflowCreated++;
		emergencyActivations++;
		borrowed++;
		return overflow;
	}

	@NotNull
	private List<PooledObject<T>> createSlots(int count) throws SlotFactoryException {
		final List<PooledObject<T>> slots = new ArrayList<>(count);
		try {
			for (int i = 0; i < count; i++) {
				slots.add(new PooledObject<>(this, kind, createObject(), ticker.currentTimeMillis(), FREE));
			}
		} catch (SlotFactoryException e) {
			for (PooledObject<T> rolledBack : slots) {
				destroyQuietly(rolledBack.markDestroyed());
			}
			throw e;
		}
		return slots;
	}

	@NotNull
	private T createObject() throws SlotFactoryException {
		try {
			return slotFactory.create(kind);
		} catch (RuntimeException e) {
			throw new SlotFactoryException(kind, e);
		}
	}

	/**
	 * @return how many free slots were actually destroyed, at most {@code count}
	 */
	private int destroyFreeSlots(int count) {
		int removed = 0;
		while (removed < count && !free.isEmpty()) {
			destroySlot(free.removeLast());
			removed++;
		}
		return removed;
	}

	private void destroySlot(@NotNull PooledObject<T> slot) {
		destroyQuietly(slot.markDestroyed());
		destroyed++;
	}

	private void destroyQuietly(@Nullable T object) {
		if (object == null) {
			return;
		}
		try {
			slotFactory.destroy(object);
		} catch (RuntimeException e) {
			log.error("error destroying {} object already removed from the pool, ignoring it from now on...", kind, e);
		}
	}

	private double utilization() {
		return currentSize == 0 ? 1.0 : (double) inUse / currentSize;
	}

	private boolean cooldownElapsed(long now) {
		return lastScaleAtMs == NEVER || poolConfig.getCooldownPeriod().hasElapsed(lastScaleAtMs, now);
	}

	private static int clamp(long value, int min, int max) {
		return (int) Math.max(min, Math.min(max, value));
	}
}
