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

import java.util.LinkedHashMap;
import java.util.Map;

import static io.treesync.common.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableMap;

/**
 * Splits the node at {@code path} at {@code position} (text offset or child index).
 * The right half becomes a new sibling at {@code path.next()} carrying {@code properties}.
 */
public final class SplitNodeOperation extends TreeOperation {
	private final Path path;
	private final int position;
	private final Map<String, Object> properties;

	public SplitNodeOperation(Path path, int position, Map<String, ?> properties) {
		checkArgument(!path.isRoot(), "Cannot split the root");
		checkArgument(position >= 0, "Negative position %s", position);
		this.path = path;
		this.position = position;
		this.properties = unmodifiableMap(new LinkedHashMap<>(properties));
	}

	@Override
	public Path getPath() {
		return path;
	}

	public int getPosition() {
		return position;
	}

	public Map<String, Object> getProperties() {
		return properties;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SplitNodeOperation that = (SplitNodeOperation) o;
		return position == that.position && path.equals(that.path) && properties.equals(that.properties);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * path.hashCode() + position) + properties.hashCode();
	}

	@Override
	public String toString() {
		return "split_node{" + path + ", position=" + position + ", " + properties + '}';
	}
}
