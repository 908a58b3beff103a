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

import io.treesync.config.Config;
import org.jetbrains.annotations.Nullable;

import java.util.UUID;
import java.util.function.Consumer;

import static io.treesync.common.Preconditions.checkArgument;
import static io.treesync.common.Preconditions.checkNotNull;
import static io.treesync.config.ConfigConverters.*;

/**
 * Settings of one {@link SyncController} binding.
 */
public final class SyncOptions {
	public static final boolean DEFAULT_PULL_INITIAL_STATE = true;
	public static final boolean DEFAULT_UNDO_ENABLED = true;
	public static final long DEFAULT_UNDO_CAPTURE_TIMEOUT_MILLIS = 0;

	private boolean pullInitialState = DEFAULT_PULL_INITIAL_STATE;
	private boolean undoEnabled = DEFAULT_UNDO_ENABLED;
	private long undoCaptureTimeoutMillis = DEFAULT_UNDO_CAPTURE_TIMEOUT_MILLIS;
	private Object localOrigin = "local-" + UUID.randomUUID();
	private SyncErrorHandler errorHandler = SyncErrorHandler.IGNORE;
	@Nullable
	private Consumer<Runnable> postTransactionQueue;

	// region builders
	private SyncOptions() {
	}

	public static SyncOptions create() {
		return new SyncOptions();
	}

	public static SyncOptions fromConfig(Config config) {
		SyncOptions options = create()
				.withPullInitialState(config.get(ofBoolean(), "sync.pullInitialState", DEFAULT_PULL_INITIAL_STATE))
				.withUndoEnabled(config.get(ofBoolean(), "sync.undo.enabled", DEFAULT_UNDO_ENABLED))
				.withUndoCaptureTimeout(config.get(ofLong(), "sync.undo.captureTimeoutMillis", DEFAULT_UNDO_CAPTURE_TIMEOUT_MILLIS));
		String localOrigin = config.get(ofString(), "sync.localOrigin", null);
		if (localOrigin != null && !localOrigin.isEmpty()) {
			options.withLocalOrigin(localOrigin);
		}
		return options;
	}

	/**
	 * Whether to replace the local tree with the replica's content right after binding.
	 * When off, the local tree is taken as it is and the session is synchronized at once.
	 */
	public SyncOptions withPullInitialState(boolean pullInitialState) {
		this.pullInitialState = pullInitialState;
		return this;
	}

	public SyncOptions withUndoEnabled(boolean undoEnabled) {
		this.undoEnabled = undoEnabled;
		return this;
	}

	public SyncOptions withUndoCaptureTimeout(long captureTimeoutMillis) {
		checkArgument(captureTimeoutMillis >= 0, "Negative capture timeout %s", captureTimeoutMillis);
		this.undoCaptureTimeoutMillis = captureTimeoutMillis;
		return this;
	}

	/**
	 * Tag for the replica transactions produced by local edits. Must differ from the origin of
	 * every other writer of the same replica.
	 */
	public SyncOptions withLocalOrigin(Object localOrigin) {
		this.localOrigin = checkNotNull(localOrigin);
		return this;
	}

	public SyncOptions withErrorHandler(SyncErrorHandler errorHandler) {
		this.errorHandler = checkNotNull(errorHandler);
		return this;
	}

	/**
	 * Where the remote flag is cleared once a remote pass is over. Defaults to posting to the
	 * head of the session's eventloop queue.
	 */
	public SyncOptions withPostTransactionQueue(@Nullable Consumer<Runnable> postTransactionQueue) {
		this.postTransactionQueue = postTransactionQueue;
		return this;
	}
	// endregion

	public boolean isPullInitialState() {
		return pullInitialState;
	}

	public boolean isUndoEnabled() {
		return undoEnabled;
	}

	public long getUndoCaptureTimeoutMillis() {
		return undoCaptureTimeoutMillis;
	}

	public Object getLocalOrigin() {
		return localOrigin;
	}

	public SyncErrorHandler getErrorHandler() {
		return errorHandler;
	}

	@Nullable
	public Consumer<Runnable> getPostTransactionQueue() {
		return postTransactionQueue;
	}

	@Override
	public String toString() {
		return "SyncOptions{pullInitialState=" + pullInitialState +
				", undoEnabled=" + undoEnabled +
				", undoCaptureTimeoutMillis=" + undoCaptureTimeoutMillis +
				", localOrigin=" + localOrigin + '}';
	}
}
