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

import io.treesync.tree.Node;
import io.treesync.tree.Path;

import static io.treesync.common.Preconditions.checkArgument;

public final class RemoveNodeOperation extends TreeOperation {
	private final Path path;
	private final Node node;

	public RemoveNodeOperation(Path path, Node node) {
		checkArgument(!path.isRoot(), "Cannot remove the root");
		this.path = path;
		this.node = node.copy();
	}

	@Override
	public Path getPath() {
		return path;
	}

	/**
	 * The node as it was before removal.
	 */
	public Node getNode() {
		return node.copy();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RemoveNodeOperation that = (RemoveNodeOperation) o;
		return path.equals(that.path) && node.equals(that.node);
	}

	@Override
	public int hashCode() {
		return 31 * path.hashCode() + node.hashCode();
	}

	@Override
	public String toString() {
		return "remove_node{" + path + ", " + node + '}';
	}
}
