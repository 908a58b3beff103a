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

import io.treesync.replica.UndoHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Records the ops of tracked transactions as undo steps. Replaying a step undoes its ops, last first,
 * as one transaction with this history as its origin; the ops of that transaction land on the opposite stack.
 */
public final class MemoryUndoHistory implements UndoHistory {
	private static final Logger logger = LoggerFactory.getLogger(MemoryUndoHistory.class);

	private final MemoryReplicaDocument document;
	private final List<MemoryContainer> scope;
	private final Set<Object> trackedOrigins;
	private final long captureTimeout;

	private final Deque<StackItem> undoStack = new ArrayDeque<>();
	private final Deque<StackItem> redoStack = new ArrayDeque<>();

	private boolean undoing;
	private boolean redoing;
	private long lastChange;
	private boolean boundary = true;

	MemoryUndoHistory(MemoryReplicaDocument document, List<MemoryContainer> scope, Set<Object> trackedOrigins, long captureTimeout) {
		this.document = document;
		this.scope = scope;
		this.trackedOrigins = trackedOrigins;
		this.captureTimeout = captureTimeout;
	}

	void afterTransaction(MemoryTransaction tx) {
		boolean replay = tx.getOrigin() == this;
		if (!replay && !trackedOrigins.contains(tx.getOrigin())) return;
		List<MemoryOp> ops = tx.opsWithin(scope);
		if (ops.isEmpty()) return;

		if (replay && undoing) {
			redoStack.push(new StackItem(ops));
			return;
		}
		if (replay && redoing) {
			undoStack.push(new StackItem(ops));
			return;
		}

		redoStack.clear();
		long now = document.currentTimeMillis();
		StackItem last = undoStack.peek();
		if (last != null && !boundary && now - lastChange < captureTimeout) {
			List<MemoryOp> merged = new ArrayList<>(last.ops);
			merged.addAll(ops);
			undoStack.pop();
			undoStack.push(new StackItem(merged));
		} else {
			undoStack.push(new StackItem(ops));
		}
		lastChange = now;
		boundary = false;
		logger.trace("Captured {} ops, undo stack size {}", ops.size(), undoStack.size());
	}

	@Override
	public boolean undo() {
		StackItem item = undoStack.poll();
		if (item == null) return false;
		undoing = true;
		try {
			replay(item);
		} finally {
			undoing = false;
			boundary = true;
		}
		return true;
	}

	@Override
	public boolean redo() {
		StackItem item = redoStack.poll();
		if (item == null) return false;
		redoing = true;
		try {
			replay(item);
		} finally {
			redoing = false;
			boundary = true;
		}
		return true;
	}

	private void replay(StackItem item) {
		document.transact(this, () -> {
			for (int i = item.ops.size() - 1; i >= 0; i--) {
				item.ops.get(i).undo(document);
			}
		});
	}

	@Override
	public boolean canUndo() {
		return !undoStack.isEmpty();
	}

	@Override
	public boolean canRedo() {
		return !redoStack.isEmpty();
	}

	@Override
	public void stopCapturing() {
		boundary = true;
	}

	@Override
	public void clear() {
		undoStack.clear();
		redoStack.clear();
		boundary = true;
	}

	@Override
	public void destroy() {
		clear();
		document.removeUndoHistory(this);
	}

	private static final class StackItem {
		final List<MemoryOp> ops;

		StackItem(List<MemoryOp> ops) {
			this.ops = ops;
		}
	}

	@Override
	public String toString() {
		return "MemoryUndoHistory{undo=" + undoStack.size() + ", redo=" + redoStack.size() + '}';
	}
}
