package org.bbottema.adaptivepool;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

/**
 * Borrowing or returning a kind that was never registered with the {@link PoolOrchestrator}. This is a
 * configuration error and should not be retried.
 */
public class UnknownPoolKindException extends IllegalArgumentException {
	
	private static final long serialVersionUID = 1L;
	
	@NotNull @Getter private final String kind;
	
	public UnknownPoolKindException(@NotNull String kind) {
		super("No pool registered for kind '" + kind + "'");
		this.kind = kind;
	}
}
