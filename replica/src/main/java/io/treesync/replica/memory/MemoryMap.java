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

import io.treesync.replica.ReplicaMap;
import io.treesync.replica.event.KeyChange;
import io.treesync.replica.event.MapEvent;
import io.treesync.replica.event.ReplicaEvent;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static io.treesync.common.Preconditions.checkNotNull;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * Last-writer-wins map: of the entries written under a key, the one with the greatest id is current,
 * and the key is present while that entry is not deleted.
 */
final class MemoryMap extends MemoryContainer implements ReplicaMap {
	final Map<String, MemoryItem> current = new LinkedHashMap<>();
	final List<MemoryItem> entries = new ArrayList<>();

	MemoryMap(MemoryReplicaDocument document, @Nullable String rootName) {
		super(document, rootName);
	}

	@Nullable
	MemoryItem visibleEntry(String key) {
		MemoryItem entry = current.get(key);
		return entry != null && !entry.deleted ? entry : null;
	}

	@Nullable
	@Override
	public Object get(String key) {
		MemoryItem entry = visibleEntry(key);
		return entry != null ? entry.value : null;
	}

	@Override
	public boolean has(String key) {
		return visibleEntry(key) != null;
	}

	@Override
	public Set<String> keys() {
		return unmodifiableSet(new LinkedHashSet<>(toMap().keySet()));
	}

	@Override
	public Map<String, Object> toMap() {
		Map<String, Object> result = new LinkedHashMap<>();
		current.forEach((key, entry) -> {
			if (!entry.deleted) result.put(key, entry.value);
		});
		return unmodifiableMap(result);
	}

	@Override
	public void set(String key, Object value) {
		checkNotNull(key);
		Object checked = checkValue(value);
		document.perform(new MemoryOp.MapSet(this, MemoryItem.entry(document.nextId(), this, key, checked)));
	}

	@Override
	public void delete(String key) {
		MemoryItem entry = visibleEntry(key);
		if (entry == null) return;
		document.perform(new MemoryOp.MapDelete(this, entry));
	}

	/**
	 * Adds an entry to a detached map that is being built.
	 */
	MemoryItem put(String key, Object value) {
		MemoryItem entry = MemoryItem.entry(document.nextId(), this, key, value);
		MemoryItem previous = current.put(key, entry);
		if (previous != null) {
			previous.deleted = true;
		}
		entries.add(entry);
		document.register(entry);
		if (value instanceof MemoryContainer) {
			((MemoryContainer) value).holder = entry;
		}
		return entry;
	}

	@Override
	Object keyOf(MemoryItem item) {
		return checkNotNull(item.key);
	}

	@Override
	List<MemoryContainer> children() {
		List<MemoryContainer> result = new ArrayList<>();
		for (MemoryItem entry : current.values()) {
			if (!entry.deleted && entry.nested() != null) result.add(entry.nested());
		}
		return result;
	}

	@Override
	void snapshot(List<ReplicaUpdate.Op> out) {
		for (MemoryItem entry : entries) {
			encodeEntry(entry, out);
		}
		current.forEach((key, entry) -> {
			if (entry.deleted) out.add(ReplicaUpdate.Op.mapDelete(this, entry.id, key));
		});
	}

	void encodeEntry(MemoryItem entry, List<ReplicaUpdate.Op> out) {
		out.add(ReplicaUpdate.Op.mapSet(this, entry.id, checkNotNull(entry.key), ReplicaUpdateCodec.encodeValue(entry.value)));
		if (entry.nested() != null) {
			entry.nested().snapshot(out);
		}
	}

	@Override
	Object beforeImage() {
		return toMap();
	}

	@SuppressWarnings("unchecked")
	@Nullable
	@Override
	Object diff(Object beforeImage) {
		Map<String, Object> before = (Map<String, Object>) beforeImage;
		Map<String, Object> after = toMap();
		Map<String, KeyChange> changes = new LinkedHashMap<>();
		before.forEach((key, oldValue) -> {
			Object newValue = after.get(key);
			if (newValue == null) {
				changes.put(key, KeyChange.delete(oldValue));
			} else if (!sameValue(oldValue, newValue)) {
				changes.put(key, KeyChange.update(oldValue));
			}
		});
		for (String key : after.keySet()) {
			if (!before.containsKey(key)) {
				changes.put(key, KeyChange.add());
			}
		}
		return changes.isEmpty() ? null : changes;
	}

	@SuppressWarnings("unchecked")
	@Override
	ReplicaEvent toEvent(Object diff, List<Object> path) {
		return new MapEvent(this, path, (Map<String, KeyChange>) diff);
	}

	@Override
	MemoryMap copy(Map<MemoryItem, MemoryItem> copies) {
		MemoryMap clone = new MemoryMap(document, null);
		current.forEach((key, entry) -> {
			if (!entry.deleted) {
				copies.put(entry, clone.put(key, cloneValue(entry.value, copies)));
			}
		});
		return clone;
	}

	@Override
	public MemoryMap deepClone() {
		return copy(new IdentityHashMap<>());
	}

	@Override
	public String toString() {
		return toMap().toString();
	}
}
