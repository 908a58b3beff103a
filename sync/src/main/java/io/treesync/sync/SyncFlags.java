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

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Records which kind of translation pass is running, so that a pass never re-triggers itself:
 * a remote pass must not be mirrored back to the replica, and a local pass must not be mirrored
 * back into the tree it came from.
 * <p>
 * Flags are set for the duration of a scoped run, which returns what its body returns. A nested run of the same kind leaves the flag to
 * the outer one. The local and undo flags clear as soon as the run returns; the remote flag clears
 * through the post-transaction queue.
 */
public final class SyncFlags {
	private final Consumer<Runnable> postTransactionQueue;

	private boolean remote;
	private boolean local;
	private boolean undo;

	SyncFlags(Consumer<Runnable> postTransactionQueue) {
		this.postTransactionQueue = postTransactionQueue;
	}

	public boolean isRemote() {
		return remote;
	}

	public boolean isLocal() {
		return local;
	}

	public boolean isUndo() {
		return undo;
	}

	<T> T runAsRemote(Supplier<T> fn) {
		boolean wasRemote = remote;
		remote = true;
		try {
			return fn.get();
		} finally {
			if (!wasRemote) {
				postTransactionQueue.accept(() -> remote = false);
			}
		}
	}

	<T> T runAsLocal(Supplier<T> fn) {
		boolean wasLocal = local;
		local = true;
		try {
			return fn.get();
		} finally {
			if (!wasLocal) {
				local = false;
			}
		}
	}

	<T> T runAsUndo(Supplier<T> fn) {
		boolean wasUndo = undo;
		undo = true;
		try {
			return fn.get();
		} finally {
			if (!wasUndo) {
				undo = false;
			}
		}
	}

	@Override
	public String toString() {
		return "SyncFlags{remote=" + remote + ", local=" + local + ", undo=" + undo + '}';
	}
}
