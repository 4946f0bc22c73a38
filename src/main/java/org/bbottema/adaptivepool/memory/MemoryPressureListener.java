package org.bbottema.adaptivepool.memory;

import org.jetbrains.annotations.NotNull;

/**
 * Receives the directives the {@link MemoryPressureMonitor} emits on tier transitions.
 */
public interface MemoryPressureListener {

	/**
	 * Called once per tier transition with the adjustment factor configured for the new tier.
	 */
	void onPoolResize(double factor, @NotNull MemoryPressureTier newTier);

	/**
	 * Called when entering {@link MemoryPressureTier#CRITICAL}, right before the forced garbage collection. Clear
	 * whatever caches can be rebuilt later.
	 */
	default void onCriticalPressure() {
		// overridable hook
	}
}
