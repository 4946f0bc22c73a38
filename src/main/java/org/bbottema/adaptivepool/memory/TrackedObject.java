package org.bbottema.adaptivepool.memory;

import lombok.Value;
import org.jetbrains.annotations.NotNull;

import java.lang.ref.WeakReference;

@Value
class TrackedObject {
	@NotNull private final String kind;
	@NotNull private final WeakReference<Object> reference;
	private final long trackedSinceMs;
	private final long maxLifetimeMs;

	boolean isCollected() {
		return reference.get() == null;
	}

	boolean hasExpired(long now) {
		return now - trackedSinceMs >= maxLifetimeMs;
	}
}
