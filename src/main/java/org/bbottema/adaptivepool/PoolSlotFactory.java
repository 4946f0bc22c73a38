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
package org.bbottema.adaptivepool;

import org.jetbrains.annotations.NotNull;

/**
 * Supplied by the hosting application for each pooled kind: knows how to build a fresh object (a request, a response,
 * a buffer) and how to scrub per-request state when the object comes back. The returned objects are wrapped in a
 * {@link PooledObject} by the {@link LocalPool} that owns them.
 * <p>
 * Implementations should be stateless; the pool may call them from any request-handling thread while holding its lock.
 *
 * @param <T> the value type
 */
public abstract class PoolSlotFactory<T> {
	
	/**
	 * @return A new object of the given kind to be inserted into the pool. Any {@link RuntimeException} thrown here is
	 * reported to the borrower as a {@link SlotFactoryException} and leaves the pool untouched.
	 */
	@NotNull
	public abstract T create(@NotNull String kind);
	
	/**
	 * Clears per-request state of an object that was returned to the pool, before it can be borrowed again. If this
	 * throws, the object is destroyed instead of recycled.
	 */
	public void reset(@NotNull T object) {
		// overridable hook
	}
	
	/**
	 * Clean up an object no longer needed by the pool: shrunk away, discarded overflow or pool shutdown.
	 */
	public void destroy(@NotNull T object) {
		// overridable hook
	}
}
