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

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.treesync.common.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableMap;

/**
 * Node of a document tree: either an {@link Element} owning children or a {@link Text} run.
 * Both carry a small map of properties (attributes for elements, formatting marks for text).
 * Property values are JSON scalars; integral numbers are kept as {@code Long},
 * fractional ones as {@code Double}.
 */
public abstract class Node {
	public static final String CHILDREN = "children";
	public static final String TEXT = "text";

	final Map<String, Object> properties = new LinkedHashMap<>();

	Node() {
	}

	public abstract boolean isText();

	public abstract Node copy();

	public final Map<String, Object> getProperties() {
		return unmodifiableMap(properties);
	}

	@Nullable
	public final Object getProperty(String key) {
		return properties.get(key);
	}

	final void putProperty(String key, @Nullable Object value) {
		checkArgument(!isReservedKey(key), "Property key '%s' is reserved", key);
		if (value == null) {
			properties.remove(key);
		} else {
			properties.put(key, canonicalValue(value));
		}
	}

	final void putProperties(Map<String, ?> newProperties) {
		newProperties.forEach(this::putProperty);
	}

	public static boolean isReservedKey(String key) {
		return CHILDREN.equals(key) || TEXT.equals(key);
	}

	public static Object canonicalValue(Object value) {
		if (value instanceof String || value instanceof Boolean || value instanceof Long || value instanceof Double) {
			return value;
		}
		if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return ((Number) value).longValue();
		}
		if (value instanceof Float) {
			return ((Float) value).doubleValue();
		}
		throw new IllegalArgumentException("Unsupported property value: " + value + " (" + value.getClass().getName() + ')');
	}

	static void appendProperties(StringBuilder sb, Map<String, Object> properties) {
		for (Map.Entry<String, Object> entry : properties.entrySet()) {
			sb.append(',').append('"').append(entry.getKey()).append("\":");
			Object value = entry.getValue();
			if (value instanceof String) {
				sb.append('"').append(value).append('"');
			} else {
				sb.append(value);
			}
		}
	}

	static Map<String, Object> copyProperties(Map<String, ?> properties) {
		Map<String, Object> result = new LinkedHashMap<>();
		properties.forEach((key, value) -> {
			if (value != null) result.put(key, canonicalValue(value));
		});
		return result;
	}
}
