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

import java.util.ArrayList;
import java.util.List;

import static io.treesync.common.Preconditions.checkElementIndex;
import static io.treesync.common.Preconditions.checkPositionIndex;

/**
 * Replicated growable array: every element keeps the id of the element it was inserted after, and
 * elements inserted after the same one are ordered by descending id. Integrating a set of elements
 * in any order consistent with their origins yields the same sequence.
 */
abstract class MemorySequence extends MemoryContainer {
	final List<MemoryItem> items = new ArrayList<>();

	MemorySequence(MemoryReplicaDocument document, @Nullable String rootName) {
		super(document, rootName);
	}

	public int length() {
		int length = 0;
		for (MemoryItem item : items) {
			if (!item.deleted) length++;
		}
		return length;
	}

	List<MemoryItem> visibleItems() {
		List<MemoryItem> result = new ArrayList<>();
		for (MemoryItem item : items) {
			if (!item.deleted) result.add(item);
		}
		return result;
	}

	MemoryItem visibleItem(int index) {
		int remaining = checkElementIndex(index, length(), getClass().getSimpleName());
		for (MemoryItem item : items) {
			if (item.deleted) continue;
			if (remaining-- == 0) return item;
		}
		throw new AssertionError();
	}

	/**
	 * Creates elements for {@code values} to be inserted at visible {@code index}, chained one after another.
	 */
	List<MemoryItem> newElements(int index, List<?> values) {
		checkPositionIndex(index, length(), getClass().getSimpleName());
		ItemId origin = index == 0 ? null : visibleItem(index - 1).id;
		List<MemoryItem> elements = new ArrayList<>(values.size());
		for (Object value : values) {
			MemoryItem element = MemoryItem.element(document.nextId(), this, origin, value);
			elements.add(element);
			origin = element.id;
		}
		return elements;
	}

	List<MemoryItem> visibleRange(int index, int length) {
		checkPositionIndex(index, length(), getClass().getSimpleName());
		checkPositionIndex(index + length, length(), getClass().getSimpleName());
		return new ArrayList<>(visibleItems().subList(index, index + length));
	}

	void integrate(MemoryItem element) {
		int position = 0;
		if (element.origin != null) {
			position = indexOf(document.requireItem(element.origin)) + 1;
		}
		while (position < items.size() && items.get(position).id.compareTo(element.id) > 0) {
			position++;
		}
		items.add(position, element);
	}

	void remove(MemoryItem element) {
		items.remove(indexOf(element));
	}

	int indexOf(MemoryItem element) {
		for (int i = 0; i < items.size(); i++) {
			if (items.get(i) == element) return i;
		}
		throw new IllegalStateException("Element " + element.id + " is not in this sequence");
	}

	/**
	 * Appends a value to a detached sequence that is being built.
	 */
	MemoryItem append(Object value) {
		ItemId origin = items.isEmpty() ? null : items.get(items.size() - 1).id;
		MemoryItem element = MemoryItem.element(document.nextId(), this, origin, value);
		items.add(element);
		document.register(element);
		if (value instanceof MemoryContainer) {
			((MemoryContainer) value).holder = element;
		}
		return element;
	}

	/**
	 * Nearest element left of {@code element} in {@code source} that has a counterpart in this sequence,
	 * for placing a restored element. Returns {@code null} for the head.
	 */
	@Nullable
	ItemId counterpartOrigin(MemorySequence source, MemoryItem element) {
		for (int i = source.indexOf(element) - 1; i >= 0; i--) {
			MemoryItem counterpart = document.resolve(source.items.get(i));
			if (counterpart.owner == this) return counterpart.id;
		}
		return null;
	}

	@Override
	Object keyOf(MemoryItem item) {
		int index = 0;
		for (MemoryItem element : items) {
			if (element == item) return index;
			if (!element.deleted) index++;
		}
		throw new IllegalStateException("Child container not found");
	}

	@Override
	List<MemoryContainer> children() {
		List<MemoryContainer> result = new ArrayList<>();
		for (MemoryItem item : items) {
			if (!item.deleted && item.nested() != null) result.add(item.nested());
		}
		return result;
	}

	@Override
	void snapshot(List<ReplicaUpdate.Op> out) {
		encodeElements(items, out);
		List<ItemId> deleted = new ArrayList<>();
		for (MemoryItem item : items) {
			if (item.deleted) deleted.add(item.id);
		}
		if (!deleted.isEmpty()) {
			out.add(ReplicaUpdate.Op.delete(this, deleted));
		}
	}

	/**
	 * Appends insert ops for {@code elements}, one per run of consecutive ids chained by origin,
	 * each followed by the snapshots of the containers it nests.
	 */
	void encodeElements(List<MemoryItem> elements, List<ReplicaUpdate.Op> out) {
		int start = 0;
		while (start < elements.size()) {
			int end = start + 1;
			while (end < elements.size()) {
				MemoryItem previous = elements.get(end - 1);
				MemoryItem next = elements.get(end);
				if (!next.id.equals(previous.id.plus(1)) || !previous.id.equals(next.origin)) break;
				end++;
			}
			List<MemoryItem> run = elements.subList(start, end);
			out.add(encodeRun(run));
			for (MemoryItem element : run) {
				if (element.nested() != null) {
					element.nested().snapshot(out);
				}
			}
			start = end;
		}
	}

	abstract ReplicaUpdate.Op encodeRun(List<MemoryItem> run);

	/**
	 * Item values carried by a decoded insert op.
	 */
	abstract List<Object> decodeValues(ReplicaUpdate.Op op);
}
