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

import io.treesync.replica.ReplicaTransaction;
import org.jetbrains.annotations.Nullable;

import java.util.*;

final class MemoryTransaction implements ReplicaTransaction {
	private final MemoryReplicaDocument document;
	@Nullable
	private final Object origin;

	final List<AppliedOp> ops = new ArrayList<>();
	final Map<MemoryContainer, Object> beforeImages = new IdentityHashMap<>();
	final List<MemoryContainer> touched = new ArrayList<>();
	/**
	 * Containers nested within this transaction; their content is part of the event of the op that nested them.
	 */
	final Set<MemoryContainer> inserted = Collections.newSetFromMap(new IdentityHashMap<>());
	final List<ReplicaUpdate.Op> updateOps = new ArrayList<>();
	/**
	 * Deleted items restored as copies within this transaction.
	 */
	final Map<MemoryItem, MemoryItem> redirects = new IdentityHashMap<>();

	MemoryTransaction(MemoryReplicaDocument document, @Nullable Object origin) {
		this.document = document;
		this.origin = origin;
	}

	@Override
	public MemoryReplicaDocument getDocument() {
		return document;
	}

	@Nullable
	@Override
	public Object getOrigin() {
		return origin;
	}

	void touch(MemoryContainer container) {
		if (!beforeImages.containsKey(container)) {
			beforeImages.put(container, container.beforeImage());
			touched.add(container);
		}
	}

	void markInserted(MemoryContainer container) {
		inserted.add(container);
		for (MemoryContainer child : container.children()) {
			markInserted(child);
		}
	}

	boolean isEmpty() {
		return ops.isEmpty();
	}

	void rollback() {
		for (int i = ops.size() - 1; i >= 0; i--) {
			ops.get(i).op.revert();
		}
	}

	/**
	 * Ops that touched one of the {@code scope} containers, in application order.
	 */
	List<MemoryOp> opsWithin(Collection<? extends MemoryContainer> scope) {
		List<MemoryOp> result = new ArrayList<>();
		for (AppliedOp applied : ops) {
			if (applied.lineage == null) continue;
			for (MemoryContainer container : scope) {
				if (applied.lineage.contains(container)) {
					result.add(applied.op);
					break;
				}
			}
		}
		return result;
	}

	static final class AppliedOp {
		final MemoryOp op;
		/**
		 * Target and its ancestors when the op was applied, {@code null} if the target was not visible.
		 */
		@Nullable
		final List<MemoryContainer> lineage;

		AppliedOp(MemoryOp op, @Nullable List<MemoryContainer> lineage) {
			this.op = op;
			this.lineage = lineage;
		}
	}

	@Override
	public String toString() {
		return "MemoryTransaction{origin=" + origin + ", ops=" + ops.size() + '}';
	}
}
