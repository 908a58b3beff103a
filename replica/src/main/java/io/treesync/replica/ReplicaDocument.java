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

package io.treesync.replica;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Set;

/**
 * A replicated shared document. Top-level containers are addressed by name and created lazily;
 * nested containers are created detached and become part of the document when inserted
 * into an attached container.
 * <p>
 * Every mutation happens inside a transaction. Deep observers receive one batch of events per
 * transaction, synchronously, after the transaction has been committed.
 */
public interface ReplicaDocument {
	ReplicaArray getArray(String name);

	ReplicaMap getMap(String name);

	ReplicaArray createArray();

	ReplicaMap createMap();

	ReplicaText createText(String text);

	/**
	 * Runs {@code body} as one atomic transaction tagged with {@code origin}. If the body throws,
	 * every mutation it made is rolled back, no events are emitted and the exception is rethrown.
	 * A transaction started while another one is running joins the outer one.
	 */
	<E extends Exception> void transact(@Nullable Object origin, TransactionBody<E> body) throws E;

	/**
	 * Creates an undo history that captures changes to the {@code scope} containers made by
	 * transactions whose origin is one of {@code trackedOrigins}. Consecutive captures closer
	 * together than {@code captureTimeoutMillis} form a single undo step.
	 */
	UndoHistory createUndoHistory(Collection<? extends ReplicaContainer> scope, Set<?> trackedOrigins, long captureTimeoutMillis);
}
