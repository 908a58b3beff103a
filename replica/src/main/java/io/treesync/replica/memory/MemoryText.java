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

import io.treesync.replica.ReplicaText;
import io.treesync.replica.event.Delta;
import io.treesync.replica.event.ReplicaEvent;
import io.treesync.replica.event.TextEvent;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static io.treesync.common.Preconditions.checkArgument;
import static io.treesync.common.Preconditions.checkNotNull;
import static io.treesync.common.Preconditions.checkPositionIndex;

/**
 * Text as a sequence of characters, one item per UTF-16 unit.
 */
final class MemoryText extends MemorySequence implements ReplicaText {
	MemoryText(MemoryReplicaDocument document) {
		super(document, null);
	}

	@Override
	public void insert(int index, String text) {
		checkNotNull(text);
		if (text.isEmpty()) {
			checkPositionIndex(index, length(), "Text");
			return;
		}
		document.perform(new MemoryOp.SequenceInsert(this, newElements(index, chars(text))));
	}

	@Override
	public void delete(int index, int length) {
		List<MemoryItem> range = visibleRange(index, length);
		if (range.isEmpty()) return;
		document.perform(new MemoryOp.SequenceDelete(this, range));
	}

	static List<Object> chars(String text) {
		List<Object> result = new ArrayList<>(text.length());
		for (int i = 0; i < text.length(); i++) {
			result.add(text.charAt(i));
		}
		return result;
	}

	@Override
	ReplicaUpdate.Op encodeRun(List<MemoryItem> run) {
		StringBuilder text = new StringBuilder(run.size());
		for (MemoryItem item : run) {
			text.append((char) (Character) item.value);
		}
		return ReplicaUpdate.Op.insertText(this, run.get(0).id, run.get(0).origin, text.toString());
	}

	@Override
	List<Object> decodeValues(ReplicaUpdate.Op op) {
		checkArgument(op.text != null, "Text insert without text: %s", op);
		return chars(op.text);
	}

	@Override
	Object beforeImage() {
		return toString();
	}

	@Nullable
	@Override
	Object diff(Object beforeImage) {
		List<Delta> delta = SequenceDiff.diffText((String) beforeImage, toString());
		return delta.isEmpty() ? null : delta;
	}

	@SuppressWarnings("unchecked")
	@Override
	ReplicaEvent toEvent(Object diff, List<Object> path) {
		return new TextEvent(this, path, (List<Delta>) diff);
	}

	@Override
	MemoryText copy(Map<MemoryItem, MemoryItem> copies) {
		MemoryText clone = new MemoryText(document);
		for (MemoryItem item : items) {
			if (item.deleted) continue;
			copies.put(item, clone.append(item.value));
		}
		return clone;
	}

	@Override
	public MemoryText deepClone() {
		return copy(new IdentityHashMap<>());
	}

	@Override
	public String toString() {
		StringBuilder text = new StringBuilder();
		for (MemoryItem item : items) {
			if (!item.deleted) text.append((char) (Character) item.value);
		}
		return text.toString();
	}
}
