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

import io.treesync.replica.ReplicaArray;
import io.treesync.replica.ReplicaDocument;
import io.treesync.replica.ReplicaMap;
import io.treesync.tree.DocumentSession;
import org.jetbrains.annotations.Nullable;

/**
 * Everything a translation pass needs to know about one binding: both sides, the flags and
 * the origin that tags local transactions.
 */
public final class SyncSession {
	private final DocumentSession document;
	private final ReplicaArray content;
	@Nullable
	private final ReplicaMap metadata;
	private final SyncFlags flags;
	private final Object localOrigin;

	private SyncState state = SyncState.UNBOUND;

	SyncSession(DocumentSession document, ReplicaArray content, @Nullable ReplicaMap metadata,
			SyncFlags flags, Object localOrigin) {
		this.document = document;
		this.content = content;
		this.metadata = metadata;
		this.flags = flags;
		this.localOrigin = localOrigin;
	}

	public DocumentSession getDocument() {
		return document;
	}

	public ReplicaDocument getReplicaDocument() {
		return content.getDocument();
	}

	public ReplicaArray getContent() {
		return content;
	}

	@Nullable
	public ReplicaMap getMetadata() {
		return metadata;
	}

	public SyncFlags getFlags() {
		return flags;
	}

	public Object getLocalOrigin() {
		return localOrigin;
	}

	public SyncState getState() {
		return state;
	}

	void setState(SyncState state) {
		this.state = state;
	}

	@Override
	public String toString() {
		return "SyncSession{" + state + ", origin=" + localOrigin + ", " + flags + '}';
	}
}
