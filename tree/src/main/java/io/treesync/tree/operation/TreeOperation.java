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

package io.treesync.tree.operation;

import io.treesync.tree.Path;
import org.jetbrains.annotations.Nullable;

/**
 * Atomic edit of a document. Every operation that targets a node carries the node's path
 * as it is at the moment the operation is applied.
 */
public abstract class TreeOperation {
	TreeOperation() {
	}

	/**
	 * Path of the target node, or {@code null} for operations that are not addressed by path
	 * (selection and document metadata).
	 */
	@Nullable
	public abstract Path getPath();

	/**
	 * Whether the operation changes the document content, as opposed to the selection
	 * or the document-level metadata.
	 */
	public boolean isContentOperation() {
		return getPath() != null;
	}

	public boolean isSelectionOperation() {
		return false;
	}
}
