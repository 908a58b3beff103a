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

import io.treesync.replica.ReplicaArray;
import io.treesync.replica.event.ArrayEvent;
import io.treesync.replica.event.Delta;
import io.treesync.replica.event.ReplicaEvent;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static io.treesync.common.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableList;

final class MemoryArray extends MemorySequence implements ReplicaArray {
	MemoryArray(MemoryReplicaDocument document, @Nullable String rootName) {
		super(document, rootName);
	}

	@Override
	public Object get(int index) {
		return visibleItem(index).value;
	}

	@Override
	public List<Object> toList() {
		List<Object> result = new ArrayList<>();
		for (MemoryItem item : items) {
			if (!item.deleted) result.add(item.value);
		}
		return unmodifiableList(result);
	}

	@Override
	public void insert(int index, List<?> values) {
		if (values.isEmpty()) return;
		List<Object> checked = new ArrayList<>(values.size());
		for (Object value : values) {
			Object checkedValue = checkValue(value);
			if (checkedValue instanceof MemoryContainer && checked.contains(checkedValue)) {
				throw new IllegalArgumentException("Container inserted twice");
			}
			checked.add(checkedValue);
		}
		document.perform(new MemoryOp.SequenceInsert(this, newElements(index, checked)));
	}

	@Override
	public void delete(int index, int length) {
		List<MemoryItem> range = visibleRange(index, length);
		if (range.isEmpty()) return;
		document.perform(new MemoryOp.SequenceDelete(this, range));
	}

	@Override
	ReplicaUpdate.Op encodeRun(List<MemoryItem> run) {
		List<Object> values = new ArrayList<>(run.size());
		for (MemoryItem item : run) {
			values.add(ReplicaUpdateCodec.encodeValue(item.value));
		}
		return ReplicaUpdate.Op.insertValues(this, run.get(0).id, run.get(0).origin, values);
	}

	@Override
	List<Object> decodeValues(ReplicaUpdate.Op op) {
		checkArgument(op.values != null, "Array insert without values: %s", op);
		List<Object> values = new ArrayList<>(op.values.size());
		for (Object value : op.values) {
			values.add(ReplicaUpdateCodec.decodeValue(document, value));
		}
		return values;
	}

	@Override
	Object beforeImage() {
		return toList();
	}

	@SuppressWarnings("unchecked")
	@Nullable
	@Override
	Object diff(Object beforeImage) {
		List<Delta> delta = SequenceDiff.diffArray((List<Object>) beforeImage, toList());
		return delta.isEmpty() ? null : delta;
	}

	@SuppressWarnings("unchecked")
	@Override
	ReplicaEvent toEvent(Object diff, List<Object> path) {
		return new ArrayEvent(this, path, (List<Delta>) diff);
	}

	@Override
	MemoryArray copy(Map<MemoryItem, MemoryItem> copies) {
		MemoryArray clone = new MemoryArray(document, null);
		for (MemoryItem item : items) {
			if (item.deleted) continue;
			copies.put(item, clone.append(cloneValue(item.value, copies)));
		}
		return clone;
	}

	@Override
	public MemoryArray deepClone() {
		return copy(new IdentityHashMap<>());
	}

	@Override
	public String toString() {
		return toList().toString();
	}
}
