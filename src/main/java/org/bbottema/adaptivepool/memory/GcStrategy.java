package org.bbottema.adaptivepool.memory;

/**
 * When {@link MemoryPressureMonitor} requests garbage collection outside of the forced pass on entering
 * {@link MemoryPressureTier#CRITICAL}.
 */
public enum GcStrategy {
	/**
	 * Critical always, otherwise at most once per tier-specific interval.
	 */
	ADAPTIVE,
	/**
	 * Only while pressure is critical.
	 */
	CONSERVATIVE,
	/**
	 * Never, apart from the forced pass on entering critical pressure.
	 */
	DISABLED
}
