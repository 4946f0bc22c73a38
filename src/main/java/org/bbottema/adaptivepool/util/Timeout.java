/*
 * Copyright (C) 2019 Benny Bottema (benny@bennybottema.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.bbottema.adaptivepool.util;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Value;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.TimeUnit;

/**
 * Duration value used throughout the pool configuration (cooldowns, check intervals, TTLs and socket timeouts).
 */
@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public final class Timeout {
	public static final Timeout NONE = new Timeout(0, TimeUnit.MILLISECONDS);

	private final long duration;
	@NotNull private final TimeUnit timeUnit;
	private final long durationMs;
	
	public Timeout(long duration, @NotNull TimeUnit timeUnit) {
		if (duration < 0) {
			throw new IllegalArgumentException("Timeout cannot be negative: " + duration);
		}
		this.duration = duration;
		this.timeUnit = timeUnit;
		this.durationMs = timeUnit.toMillis(duration);
	}

	@NotNull
	public static Timeout ofMillis(long millis) {
		return new Timeout(millis, TimeUnit.MILLISECONDS);
	}

	@NotNull
	public static Timeout ofSeconds(long seconds) {
		return new Timeout(seconds, TimeUnit.SECONDS);
	}

	/**
	 * @return The duration in whole seconds, rounded up so that sub-second values don't turn into "no expiry".
	 */
	public int toSecondsRoundedUp() {
		return (int) Math.min(Integer.MAX_VALUE, (durationMs + 999) / 1000);
	}

	/**
	 * @return Whether at least this much time has passed between the two millisecond stamps.
	 */
	public boolean hasElapsed(long sinceMs, long nowMs) {
		return nowMs - sinceMs >= durationMs;
	}
}
