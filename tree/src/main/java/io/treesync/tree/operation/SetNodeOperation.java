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

import java.util.LinkedHashMap;
import java.util.Map;

import static io.treesync.common.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableMap;

/**
 * Changes node properties. A key mapped to {@code null} in {@code newProperties} is removed,
 * as is a key present in {@code properties} but absent from {@code newProperties}.
 */
public final class SetNodeOperation extends TreeOperation {
	private final Path path;
	private final Map<String, Object> properties;
	private final Map<String, Object> newProperties;

	public SetNodeOperation(Path path, Map<String, ?> properties, Map<String, ?> newProperties) {
		checkArgument(!path.isRoot(), "Cannot set properties of the root");
		for (String key : newProperties.keySet()) {
			checkArgument(!Node.isReservedKey(key), "Cannot set reserved property '%s'", key);
		}
		this.path = path;
		this.properties = unmodifiableMap(new LinkedHashMap<>(properties));
		this.newProperties = unmodifiableMap(new LinkedHashMap<>(newProperties));
	}

	@Override
	public Path getPath() {
		return path;
	}

	public Map<String, Object> getProperties() {
		return properties;
	}

	public Map<String, Object> getNewProperties() {
		return newProperties;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SetNodeOperation that = (SetNodeOperation) o;
		return path.equals(that.path) && properties.equals(that.properties) && newProperties.equals(that.newProperties);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * path.hashCode() + properties.hashCode()) + newProperties.hashCode();
	}

	@Override
	public String toString() {
		return "set_node{" + path + ", " + properties + " -> " + newProperties + '}';
	}
}
