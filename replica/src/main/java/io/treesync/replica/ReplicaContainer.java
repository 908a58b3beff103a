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

public interface ReplicaContainer {
	ReplicaDocument getDocument();

	@Nullable
	ReplicaContainer getParent();

	/**
	 * Whether this container is reachable from one of the document's top-level containers.
	 */
	boolean isAttached();

	/**
	 * Returns a detached copy of this container and everything below it.
	 * Containers cannot be re-parented, so moving content means inserting a clone.
	 */
	ReplicaContainer deepClone();

	/**
	 * Registers an observer for changes to this container and to every container below it.
	 */
	void observeDeep(DeepObserver observer);

	void unobserveDeep(DeepObserver observer);
}
