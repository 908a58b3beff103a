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

import io.treesync.eventloop.Eventloop;
import io.treesync.replica.DeepObserver;
import io.treesync.replica.ReplicaArray;
import io.treesync.replica.ReplicaMap;
import io.treesync.replica.ReplicaTransaction;
import io.treesync.replica.event.ReplicaEvent;
import io.treesync.tree.ChangeListener;
import io.treesync.tree.DocumentSession;
import io.treesync.tree.Node;
import io.treesync.tree.operation.TreeOperation;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static io.treesync.common.Preconditions.checkArgument;
import static io.treesync.common.Preconditions.checkNotNull;

/**
 * Keeps a {@link DocumentSession} and a replica in sync in both directions.
 * <p>
 * Local edit batches are mirrored into the replica as one transaction tagged with the local origin.
 * Replica batches from any other origin are mirrored into the local tree. {@link SyncFlags} keep each
 * direction from echoing the other one. Undo and redo replay through the replica's undo history, and
 * their effect is mirrored locally only.
 * <p>
 * Until the session is synchronized with the replica, local edits are not sent out. The first of the
 * scheduled initial pull and the first remote batch replaces the local tree with the replica's content.
 */
public final class SyncController {
	private static final Logger logger = LoggerFactory.getLogger(SyncController.class);

	private final SyncSession session;
	private final SyncErrorHandler errorHandler;
	private final OperationTranslator operationTranslator = OperationTranslator.createDefault();
	private final EventTranslator eventTranslator = EventTranslator.createDefault();
	@Nullable
	private final SyncUndoManager undoManager;

	private final ChangeListener changeListener = this::onLocalEdit;
	private final DeepObserver observer = this::onRemoteBatch;

	@Nullable
	private ReplicaTransaction pulledTransaction;
	private boolean closed;

	private SyncController(SyncSession session, SyncOptions options) {
		this.session = session;
		this.errorHandler = options.getErrorHandler();
		this.undoManager = options.isUndoEnabled() ? new SyncUndoManager(session, options.getUndoCaptureTimeoutMillis()) : null;
	}

	/**
	 * Binds {@code document} to the replica containers {@code content} and, optionally, {@code metadata}.
	 *
	 * @throws BindingException if the document session is already bound
	 */
	public static SyncController bind(DocumentSession document, ReplicaArray content, @Nullable ReplicaMap metadata,
			SyncOptions options) {
		checkNotNull(document);
		checkNotNull(content);
		checkNotNull(options);
		if (document.getBinding() != null) {
			throw new BindingException("Document session is already bound to " + document.getBinding());
		}
		checkArgument(metadata == null || metadata.getDocument() == content.getDocument(),
				"Content and metadata belong to different replica documents");

		Eventloop eventloop = document.getEventloop();
		Consumer<Runnable> postTransactionQueue = options.getPostTransactionQueue() != null ?
				options.getPostTransactionQueue() :
				eventloop::post;
		SyncSession session = new SyncSession(document, content, metadata,
				new SyncFlags(postTransactionQueue), options.getLocalOrigin());
		SyncController controller = new SyncController(session, options);

		document.setBinding(controller);
		document.addChangeListener(controller.changeListener);
		content.observeDeep(controller.observer);
		if (metadata != null) {
			metadata.observeDeep(controller.observer);
		}

		if (options.isPullInitialState()) {
			session.setState(SyncState.INITIALIZING);
			eventloop.postLater(controller::initialPull);
		} else {
			session.setState(SyncState.SYNCHRONIZED);
		}
		logger.info("Bound {} with {}", document, options);
		return controller;
	}

	// region directions
	private void initialPull() {
		if (closed || session.getState() == SyncState.SYNCHRONIZED) {
			logger.debug("Initial pull skipped, session is {}", closed ? "closed" : "already synchronized");
			return;
		}
		pullFull();
	}

	/**
	 * Replaces the whole local tree and metadata with the replica's current content and marks the
	 * session synchronized. Also recovers the local tree after a failed remote pass.
	 */
	public void pullFull() {
		DocumentSession document = session.getDocument();
		List<Node> nodes;
		Map<String, Object> metadata;
		try {
			nodes = ReplicaNodes.toNodes(session.getContent());
			metadata = session.getMetadata() != null ?
					ReplicaNodes.toMetadata(session.getMetadata()) :
					Collections.<String, Object>emptyMap();
		} catch (TranslationException e) {
			report(TranslationResult.failure(ErrorKind.REMOTE_APPLY, e), "pull of the replica content");
			return;
		}
		boolean wasNormalizing = document.isNormalizing();
		document.setNormalizing(false);
		try {
			document.replaceContent(nodes);
			if (session.getMetadata() != null) {
				document.replaceMetadata(metadata);
			}
		} finally {
			document.setNormalizing(wasNormalizing);
		}
		session.setState(SyncState.SYNCHRONIZED);
		logger.info("Pulled {} nodes from the replica", nodes.size());
		document.flush();
	}

	private void onLocalEdit(List<TreeOperation> operations) {
		if (closed) return;
		SyncFlags flags = session.getFlags();
		if (flags.isRemote() || flags.isUndo()) {
			logger.trace("Skipping {} operations produced by a {} pass", operations.size(), flags.isRemote() ? "remote" : "undo");
			return;
		}
		if (session.getState() != SyncState.SYNCHRONIZED) {
			logger.debug("Skipping {} local operations, session is {}", operations.size(), session.getState());
			return;
		}
		List<TreeOperation> contentOperations = new ArrayList<>(operations.size());
		for (TreeOperation operation : operations) {
			if (!operation.isSelectionOperation()) {
				contentOperations.add(operation);
			}
		}
		if (contentOperations.isEmpty()) return;

		logger.debug("Mirroring {} local operations", contentOperations.size());
		TranslationResult result = flags.runAsLocal(() -> operationTranslator.apply(session, contentOperations));
		report(result, "local batch " + contentOperations);
	}

	private void onRemoteBatch(List<ReplicaEvent> events, ReplicaTransaction transaction) {
		if (closed) return;
		SyncFlags flags = session.getFlags();
		DocumentSession document = session.getDocument();
		if (flags.isUndo()) {
			logger.debug("Mirroring {} events of an undo pass", events.size());
			TranslationResult result = eventTranslator.apply(session, events, ErrorKind.UNDO_APPLY);
			document.flush();
			report(result, "undo batch " + events);
			return;
		}
		if (flags.isLocal()) return;
		if (session.getLocalOrigin().equals(transaction.getOrigin())) {
			logger.trace("Ignoring a batch of our own origin {}", transaction.getOrigin());
			return;
		}
		if (transaction == pulledTransaction) return;
		if (session.getState() != SyncState.SYNCHRONIZED) {
			logger.debug("First remote batch arrived before the initial pull, pulling the whole replica");
			pulledTransaction = transaction;
			flags.runAsRemote(() -> {
				pullFull();
				return null;
			});
			return;
		}
		logger.debug("Mirroring {} remote events", events.size());
		TranslationResult result = flags.runAsRemote(() -> {
			TranslationResult applied = eventTranslator.apply(session, events, ErrorKind.REMOTE_APPLY);
			document.flush();
			return applied;
		});
		report(result, "remote batch " + events);
	}
	// endregion

	private void report(TranslationResult result, String description) {
		if (result.isSuccess()) return;
		SyncError error = new SyncError(checkNotNull(result.getKind()), "Failed to translate " + description, result.getCause());
		logger.warn("{}", error);
		errorHandler.onError(error);
	}

	// region undo
	/**
	 * Reverts the most recent local edit step, both in the replica and in the local tree.
	 *
	 * @return {@code false} if undo is disabled or there is nothing to undo
	 */
	public boolean undo() {
		if (undoManager == null || closed) return false;
		session.getDocument().flush();
		return undoManager.undo();
	}

	public boolean redo() {
		if (undoManager == null || closed) return false;
		session.getDocument().flush();
		return undoManager.redo();
	}

	public boolean canUndo() {
		return undoManager != null && undoManager.canUndo();
	}

	public boolean canRedo() {
		return undoManager != null && undoManager.canRedo();
	}

	public void stopCapturing() {
		if (undoManager != null) {
			undoManager.stopCapturing();
		}
	}

	@Nullable
	public SyncUndoManager getUndoManager() {
		return undoManager;
	}
	// endregion

	// region state
	public boolean isRemote() {
		return session.getFlags().isRemote();
	}

	public boolean isLocal() {
		return session.getFlags().isLocal();
	}

	public boolean isUndo() {
		return session.getFlags().isUndo();
	}

	public boolean isInitialized() {
		return session.getState() == SyncState.SYNCHRONIZED;
	}

	public SyncState getState() {
		return session.getState();
	}

	public SyncSession getSession() {
		return session;
	}
	// endregion

	/**
	 * Stops syncing. The document session stays bound and cannot be bound again.
	 */
	public void close() {
		if (closed) return;
		closed = true;
		session.getDocument().removeChangeListener(changeListener);
		session.getContent().unobserveDeep(observer);
		if (session.getMetadata() != null) {
			session.getMetadata().unobserveDeep(observer);
		}
		if (undoManager != null) {
			undoManager.destroy();
		}
		logger.info("Closed {}", session);
	}

	@Override
	public String toString() {
		return "SyncController{" + session + (closed ? ", closed" : "") + '}';
	}
}
