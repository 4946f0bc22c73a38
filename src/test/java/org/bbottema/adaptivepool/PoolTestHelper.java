package org.bbottema.adaptivepool;

import lombok.experimental.UtilityClass;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

@UtilityClass
class PoolTestHelper {

	@NotNull
	static CountingSlotFactory createSlotFactory() {
		return new CountingSlotFactory(Integer.MAX_VALUE);
	}

	/**
	 * @param maxCreations creations beyond this number throw
	 */
	@NotNull
	static CountingSlotFactory createSlotFactory(int maxCreations) {
		return new CountingSlotFactory(maxCreations);
	}

	static class CountingSlotFactory extends PoolSlotFactory<StringBuilder> {
		final AtomicInteger creations = new AtomicInteger();
		final AtomicInteger resets = new AtomicInteger();
		final AtomicInteger destructions = new AtomicInteger();
		private final int maxCreations;
		volatile boolean failResets;

		CountingSlotFactory(int maxCreations) {
			this.maxCreations = maxCreations;
		}

		@NotNull
		@Override
		public StringBuilder create(@NotNull String kind) {
			if (creations.get() >= maxCreations) {
				throw new IllegalStateException("No more " + kind + " objects for you");
			}
			return new StringBuilder(kind + "#" + creations.incrementAndGet());
		}

		@Override
		public void reset(@NotNull StringBuilder object) {
			if (failResets) {
				throw new IllegalStateException("reset failed");
			}
			resets.incrementAndGet();
		}

		@Override
		public void destroy(@NotNull StringBuilder object) {
			destructions.incrementAndGet();
		}
	}
}
