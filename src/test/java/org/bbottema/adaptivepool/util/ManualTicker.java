package org.bbottema.adaptivepool.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when told to.
 */
public class ManualTicker implements Ticker {

	private final AtomicLong nowMs;

	public ManualTicker() {
		this(1_000_000L);
	}

	public ManualTicker(long startMs) {
		this.nowMs = new AtomicLong(startMs);
	}

	@Override
	public long currentTimeMillis() {
		return nowMs.get();
	}

	public void advanceMillis(long millis) {
		nowMs.addAndGet(millis);
	}

	public void advanceSeconds(long seconds) {
		advanceMillis(seconds * 1000);
	}
}
