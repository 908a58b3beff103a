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

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * Changes document-level metadata, such as the theme. Metadata lives next to the content
 * rather than in it, so the operation has no path. A {@code null} new value removes the key.
 */
public final class SetMetadataOperation extends TreeOperation {
	private final Map<String, Object> properties;
	private final Map<String, Object> newProperties;

	public SetMetadataOperation(Map<String, ?> properties, Map<String, ?> newProperties) {
		this.properties = unmodifiableMap(new LinkedHashMap<>(properties));
		this.newProperties = unmodifiableMap(new LinkedHashMap<>(newProperties));
	}

	@Nullable
	@Override
	public Path getPath() {
		return null;
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
		SetMetadataOperation that = (SetMetadataOperation) o;
		return properties.equals(that.properties) && newProperties.equals(that.newProperties);
	}

	@Override
	public int hashCode() {
		return 31 * properties.hashCode() + newProperties.hashCode();
	}

	@Override
	public String toString() {
		return "set_metadata{" + properties + " -> " + newProperties + '}';
	}
}
