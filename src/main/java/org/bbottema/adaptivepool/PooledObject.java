package org.bbottema.adaptivepool;

import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Handle to a reusable object of a given kind. While {@link State#IN_USE} or {@link State#OVERFLOW} it is owned
 * exclusively by the borrower; after {@link #release()} it belongs to the pool again.
 *
 * @param <T> the value type
 */
@ToString
public class PooledObject<T> {
	
	public enum State {
		FREE, IN_USE, OVERFLOW, DESTROYED
	}
	
	@ToString.Exclude
	@NotNull private final LocalPool<T> pool;
	@NotNull @Getter private final String kind;
	/**
	 * Null only once the object has been destroyed.
	 */
	@ToString.Exclude
	@Nullable private T object;
	@Getter private final long createdAt;
	@Getter private volatile long lastUsedAt;
	/**
	 * Only ever written while holding the owning pool's lock.
	 */
	@NotNull @Getter private volatile State state;
	
	PooledObject(@NotNull LocalPool<T> pool, @NotNull String kind, @NotNull T object, long createdAt, @NotNull State state) {
		this.pool = pool;
		this.kind = kind;
		this.object = object;
		this.createdAt = createdAt;
		this.lastUsedAt = createdAt;
		this.state = state;
	}
	
	/**
	 * Returns this object to the pool that issued it. Same as {@code LocalPool.returnObject(this)}.
	 */
	public void release() {
		pool.returnObject(this);
	}
	
	@NotNull
	public T getObject() {
		final T current = object;
		if (state == State.DESTROYED || current == null) {
			throw new IllegalStateException("This " + kind + " object has already been destroyed, you can't use it anymore!");
		}
		return current;
	}
	
	public boolean isOverflow() {
		return state == State.OVERFLOW;
	}
	
	@NotNull
	LocalPool<T> getPool() {
		return pool;
	}
	
	void markInUse(long now) {
		lastUsedAt = now;
		state = State.IN_USE;
	}
	
	void markFree() {
		state = State.FREE;
	}
	
	/**
	 * @return the wrapped object so the caller can hand it to {@link PoolSlotFactory#destroy(Object)}, or null if this
	 * handle was destroyed before.
	 */
	@Nullable
	T markDestroyed() {
		final T destroyed = object;
		object = null;
		state = State.DESTROYED;
		return destroyed;
	}
}
