package org.bbottema.adaptivepool;

import org.jetbrains.annotations.NotNull;

/**
 * Wraps a failure of {@link PoolSlotFactory#create(String)}. Creations that were part of the failed attempt are rolled
 * back before any counter is touched.
 */
public class SlotFactoryException extends PoolException {
	
	private static final long serialVersionUID = 1L;
	
	public SlotFactoryException(@NotNull String kind, @NotNull RuntimeException cause) {
		super(kind, "Unable to create pooled object of kind '" + kind + "': " + cause.getMessage(), cause);
	}
}
