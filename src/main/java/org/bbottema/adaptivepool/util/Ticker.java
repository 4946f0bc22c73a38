package org.bbottema.adaptivepool.util;

/**
 * Millisecond time source. Pools, the memory monitor and the in-memory coordinator read time through this, so tests
 * can move time forward without sleeping.
 */
@FunctionalInterface
public interface Ticker {
	Ticker SYSTEM = System::currentTimeMillis;

	long currentTimeMillis();
}
