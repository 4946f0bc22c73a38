package org.bbottema.adaptivepool;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Recoverable, caller-visible outcome of a borrow. The pool itself is always left in a consistent state.
 */
public abstract class PoolException extends Exception {
	
	private static final long serialVersionUID = 1L;
	
	@NotNull @Getter private final String kind;
	
	PoolException(@NotNull String kind, @NotNull String message, @Nullable Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}
}
