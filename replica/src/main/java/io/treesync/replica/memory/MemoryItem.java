/*
 * Copyright (C) 2015-2020 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.treesync.replica.memory;

import org.jetbrains.annotations.Nullable;

/**
 * One element of a sequence or one entry of a map. Items are never removed once integrated:
 * a deleted item stays in place as a tombstone, so concurrent changes can still refer to it.
 */
final class MemoryItem {
	final ItemId id;
	final MemoryContainer owner;
	/**
	 * Item this sequence element was inserted after, {@code null} for the head of the sequence.
	 */
	@Nullable
	final ItemId origin;
	@Nullable
	final String key;
	final Object value;

	boolean deleted;

	private MemoryItem(ItemId id, MemoryContainer owner, @Nullable ItemId origin, @Nullable String key, Object value) {
		this.id = id;
		this.owner = owner;
		this.origin = origin;
		this.key = key;
		this.value = value;
	}

	static MemoryItem element(ItemId id, MemorySequence owner, @Nullable ItemId origin, Object value) {
		return new MemoryItem(id, owner, origin, null, value);
	}

	static MemoryItem entry(ItemId id, MemoryMap owner, String key, Object value) {
		return new MemoryItem(id, owner, null, key, value);
	}

	@Nullable
	MemoryContainer nested() {
		return value instanceof MemoryContainer ? (MemoryContainer) value : null;
	}

	@Override
	public String toString() {
		return id + (key != null ? "[" + key + "]" : "") + (deleted ? "(deleted)" : "") + '=' + value;
	}
}
