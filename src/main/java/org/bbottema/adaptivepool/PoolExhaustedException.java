package org.bbottema.adaptivepool;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown immediately (never after waiting) when neither a free slot, nor expansion, nor an overflow object is
 * available. Callers should construct an unpooled object themselves or shed the unit of work.
 */
public class PoolExhaustedException extends PoolException {
	
	private static final long serialVersionUID = 1L;
	
	@Getter private final int emergencyLimit;
	
	public PoolExhaustedException(@NotNull String kind, int emergencyLimit) {
		super(kind, "Pool '" + kind + "' exhausted: emergency limit of " + emergencyLimit + " objects reached", null);
		this.emergencyLimit = emergencyLimit;
	}
}
