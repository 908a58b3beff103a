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

import io.treesync.replica.DeepObserver;
import io.treesync.replica.ReplicaContainer;
import io.treesync.replica.event.ReplicaEvent;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static io.treesync.common.Preconditions.*;

abstract class MemoryContainer implements ReplicaContainer {
	final MemoryReplicaDocument document;
	@Nullable
	final String rootName;
	/**
	 * Item whose value this container is, set once the container is nested.
	 */
	@Nullable
	MemoryItem holder;

	MemoryContainer(MemoryReplicaDocument document, @Nullable String rootName) {
		this.document = document;
		this.rootName = rootName;
	}

	@Override
	public MemoryReplicaDocument getDocument() {
		return document;
	}

	@Nullable
	@Override
	public MemoryContainer getParent() {
		return holder != null && !holder.deleted ? holder.owner : null;
	}

	@Override
	public boolean isAttached() {
		return top().rootName != null;
	}

	/**
	 * Whether this container is part of the replicated state, possibly below a deleted item.
	 * Changes to such a container are replicated even though they are not visible.
	 */
	boolean isIntegrated() {
		MemoryContainer container = this;
		while (container.holder != null) {
			container = container.holder.owner;
		}
		return container.rootName != null;
	}

	MemoryItem requireHolder() {
		return checkNotNull(holder, "Container is not nested");
	}

	MemoryContainer top() {
		MemoryContainer container = this;
		for (MemoryContainer parent = getParent(); parent != null; parent = parent.getParent()) {
			container = parent;
		}
		return container;
	}

	/**
	 * This container followed by its ancestors, nearest first.
	 */
	List<MemoryContainer> lineage() {
		List<MemoryContainer> result = new ArrayList<>();
		for (MemoryContainer container = this; container != null; container = container.getParent()) {
			result.add(container);
		}
		return result;
	}

	/**
	 * Path from {@code ancestor} down to this container, or {@code null} if this container is not below it.
	 */
	@Nullable
	List<Object> pathFrom(MemoryContainer ancestor) {
		List<Object> path = new ArrayList<>();
		MemoryContainer container = this;
		while (container != ancestor) {
			MemoryContainer parent = container.getParent();
			if (parent == null) return null;
			path.add(parent.keyOf(container.requireHolder()));
			container = parent;
		}
		Collections.reverse(path);
		return path;
	}

	@Override
	public void observeDeep(DeepObserver observer) {
		document.addObserver(this, observer);
	}

	@Override
	public void unobserveDeep(DeepObserver observer) {
		document.removeObserver(this, observer);
	}

	/**
	 * Checks and canonicalizes a value about to be stored in this container.
	 */
	Object checkValue(Object value) {
		checkNotNull(value, "Null values are not supported");
		if (value instanceof MemoryContainer) {
			MemoryContainer container = (MemoryContainer) value;
			checkArgument(container.document == document, "Container belongs to another document");
			checkArgument(container.rootName == null, "Top-level containers cannot be nested");
			checkArgument(container.holder == null, "Container is already nested, insert a clone instead");
			checkArgument(!lineage().contains(container), "Container cannot be nested into itself");
			return container;
		}
		if (value instanceof String || value instanceof Boolean || value instanceof Long || value instanceof Double) {
			return value;
		}
		if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		}
		if (value instanceof Float) {
			return ((Float) value).doubleValue();
		}
		throw new IllegalArgumentException("Unsupported value: " + value + " (" + value.getClass().getName() + ')');
	}

	static boolean sameValue(@Nullable Object a, @Nullable Object b) {
		if (a instanceof MemoryContainer || b instanceof MemoryContainer) return a == b;
		return a == null ? b == null : a.equals(b);
	}

	static Object cloneValue(Object value, Map<MemoryItem, MemoryItem> copies) {
		return value instanceof MemoryContainer ? ((MemoryContainer) value).copy(copies) : value;
	}

	@Override
	public MemoryContainer deepClone() {
		return copy(new IdentityHashMap<>());
	}

	/**
	 * Detached copy of the visible content, with fresh item ids. Every copied item is recorded in
	 * {@code copies} against its original.
	 */
	abstract MemoryContainer copy(Map<MemoryItem, MemoryItem> copies);

	/**
	 * Key under which {@code item}, one of this container's visible items, is addressed in event paths.
	 */
	abstract Object keyOf(MemoryItem item);

	/**
	 * Visible nested containers.
	 */
	abstract List<MemoryContainer> children();

	/**
	 * Appends ops that rebuild the whole state of this container, tombstones included,
	 * to an empty container with the same address.
	 */
	abstract void snapshot(List<ReplicaUpdate.Op> out);

	/**
	 * Shallow copy of the visible state, taken before the first change within a transaction.
	 */
	abstract Object beforeImage();

	/**
	 * Difference between {@code beforeImage} and the current visible state, or {@code null} if there is none.
	 */
	@Nullable
	abstract Object diff(Object beforeImage);

	abstract ReplicaEvent toEvent(Object diff, List<Object> path);
}
