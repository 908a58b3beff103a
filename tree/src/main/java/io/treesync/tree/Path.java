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

package io.treesync.tree;

import java.util.Arrays;
import java.util.List;

import static io.treesync.common.Preconditions.checkArgument;
import static io.treesync.common.Preconditions.checkState;

/**
 * Immutable address of a node: the child index at every level, starting from the document root.
 * The empty path denotes the root itself.
 */
public final class Path implements Comparable<Path> {
	public static final Path ROOT = new Path(new int[0]);

	private final int[] indices;

	private Path(int[] indices) {
		this.indices = indices;
	}

	public static Path of(int... indices) {
		for (int index : indices) {
			checkArgument(index >= 0, "Negative index in path %s", Arrays.toString(indices));
		}
		return indices.length == 0 ? ROOT : new Path(indices.clone());
	}

	public static Path of(List<Integer> indices) {
		int[] array = new int[indices.size()];
		for (int i = 0; i < array.length; i++) {
			array[i] = indices.get(i);
		}
		return of(array);
	}

	public int size() {
		return indices.length;
	}

	public boolean isRoot() {
		return indices.length == 0;
	}

	public int get(int level) {
		return indices[level];
	}

	public int last() {
		checkState(!isRoot(), "Root path has no last index");
		return indices[indices.length - 1];
	}

	public Path parent() {
		checkState(!isRoot(), "Root path has no parent");
		return new Path(Arrays.copyOf(indices, indices.length - 1));
	}

	public Path child(int index) {
		checkArgument(index >= 0, "Negative child index %s", index);
		int[] result = Arrays.copyOf(indices, indices.length + 1);
		result[indices.length] = index;
		return new Path(result);
	}

	public Path withLast(int index) {
		checkState(!isRoot(), "Root path has no last index");
		checkArgument(index >= 0, "Negative index %s", index);
		int[] result = indices.clone();
		result[result.length - 1] = index;
		return new Path(result);
	}

	public Path previous() {
		checkState(last() > 0, "Path %s has no previous sibling", this);
		return withLast(last() - 1);
	}

	public Path next() {
		return withLast(last() + 1);
	}

	public boolean isAncestorOf(Path other) {
		if (indices.length >= other.indices.length) return false;
		for (int i = 0; i < indices.length; i++) {
			if (indices[i] != other.indices[i]) return false;
		}
		return true;
	}

	public boolean isSiblingOf(Path other) {
		if (isRoot() || indices.length != other.indices.length) return false;
		for (int i = 0; i < indices.length - 1; i++) {
			if (indices[i] != other.indices[i]) return false;
		}
		return indices[indices.length - 1] != other.indices[indices.length - 1];
	}

	/**
	 * Whether this path ends before {@code other} at the level of this path's last index,
	 * i.e. removing this node shifts {@code other} (or one of its ancestors) one position left.
	 */
	public boolean endsBefore(Path other) {
		if (isRoot() || other.indices.length < indices.length) return false;
		int level = indices.length - 1;
		for (int i = 0; i < level; i++) {
			if (indices[i] != other.indices[i]) return false;
		}
		return indices[level] < other.indices[level];
	}

	/**
	 * Position a node moved from {@code from} to {@code newPath} actually lands at, once the
	 * node has been removed from its old place.
	 */
	public static Path movedPath(Path from, Path newPath) {
		if (from.endsBefore(newPath) && from.size() < newPath.size()) {
			int[] result = newPath.indices.clone();
			result[from.size() - 1]--;
			return new Path(result);
		}
		return newPath;
	}

	@Override
	public int compareTo(Path o) {
		int size = Math.min(indices.length, o.indices.length);
		for (int i = 0; i < size; i++) {
			int result = Integer.compare(indices[i], o.indices[i]);
			if (result != 0) return result;
		}
		return Integer.compare(indices.length, o.indices.length);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Arrays.equals(indices, ((Path) o).indices);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(indices);
	}

	@Override
	public String toString() {
		return Arrays.toString(indices);
	}
}
