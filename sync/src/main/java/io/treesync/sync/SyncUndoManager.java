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

package io.treesync.sync;

import io.treesync.replica.ReplicaContainer;
import io.treesync.replica.UndoHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.singleton;

/**
 * Undo and redo of local edits, backed by the replica's undo history. Only transactions tagged with
 * the session's local origin are captured, so remote edits are never undone. A replay runs under the
 * undo flag and is mirrored into the local tree without being sent back out.
 */
public final class SyncUndoManager {
	private static final Logger logger = LoggerFactory.getLogger(SyncUndoManager.class);

	private final SyncSession session;
	private final UndoHistory history;

	SyncUndoManager(SyncSession session, long captureTimeoutMillis) {
		this.session = session;
		List<ReplicaContainer> scope = new ArrayList<>();
		scope.add(session.getContent());
		if (session.getMetadata() != null) {
			scope.add(session.getMetadata());
		}
		this.history = session.getReplicaDocument().createUndoHistory(scope, singleton(session.getLocalOrigin()), captureTimeoutMillis);
	}

	public boolean undo() {
		boolean applied = session.getFlags().runAsUndo(history::undo);
		logger.debug("Undo {}", applied ? "applied" : "skipped, nothing to undo");
		return applied;
	}

	public boolean redo() {
		boolean applied = session.getFlags().runAsUndo(history::redo);
		logger.debug("Redo {}", applied ? "applied" : "skipped, nothing to redo");
		return applied;
	}

	public boolean canUndo() {
		return history.canUndo();
	}

	public boolean canRedo() {
		return history.canRedo();
	}

	public void stopCapturing() {
		history.stopCapturing();
	}

	public UndoHistory getHistory() {
		return history;
	}

	void destroy() {
		history.destroy();
	}
}
