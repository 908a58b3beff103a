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

import static io.treesync.common.Preconditions.checkArgument;

/**
 * Moves the node at {@code path} so that it ends up at {@code newPath}.
 * {@code newPath} must not lie inside the moved node.
 */
public final class MoveNodeOperation extends TreeOperation {
	private final Path path;
	private final Path newPath;

	public MoveNodeOperation(Path path, Path newPath) {
		checkArgument(!path.isRoot() && !newPath.isRoot(), "Cannot move the root");
		checkArgument(!path.isAncestorOf(newPath), "Cannot move %s into its own descendant %s", path, newPath);
		this.path = path;
		this.newPath = newPath;
	}

	@Override
	public Path getPath() {
		return path;
	}

	public Path getNewPath() {
		return newPath;
	}

	public boolean isNoop() {
		return path.equals(newPath);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		MoveNodeOperation that = (MoveNodeOperation) o;
		return path.equals(that.path) && newPath.equals(that.newPath);
	}

	@Override
	public int hashCode() {
		return 31 * path.hashCode() + newPath.hashCode();
	}

	@Override
	public String toString() {
		return "move_node{" + path + " -> " + newPath + '}';
	}
}
