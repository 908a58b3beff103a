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

package io.treesync.replica.memory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static io.treesync.common.Preconditions.checkArgument;
import static java.util.Collections.singletonMap;

/**
 * JSON encoding of {@link ReplicaUpdate}s. A nested container travels as a single-key object
 * ({@code {"$container": "map"}}) and arrives empty: the ops that follow it in the same update fill it.
 * Numbers decode as {@code Long} or {@code Double}.
 */
final class ReplicaUpdateCodec {
	private static final String CONTAINER = "$container";
	private static final String MAP = "map";
	private static final String ARRAY = "array";
	private static final String TEXT = "text";

	private static final Gson GSON = new GsonBuilder()
			.setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
			.disableHtmlEscaping()
			.create();

	private ReplicaUpdateCodec() {
	}

	static byte[] encode(ReplicaUpdate update) {
		return GSON.toJson(update).getBytes(StandardCharsets.UTF_8);
	}

	static ReplicaUpdate decode(byte[] bytes) {
		ReplicaUpdate update;
		try {
			update = GSON.fromJson(new String(bytes, StandardCharsets.UTF_8), ReplicaUpdate.class);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Malformed update", e);
		}
		checkArgument(update != null && update.ops != null, "Empty update");
		for (ReplicaUpdate.Op op : update.ops) {
			checkArgument(op != null && op.type != null && (op.root == null) != (op.parent == null),
					"Malformed update op %s", op);
			switch (op.type) {
				case ReplicaUpdate.INSERT:
					checkArgument(op.id != null && op.size() != 0, "Malformed insert %s", op);
					break;
				case ReplicaUpdate.DELETE:
					checkArgument(op.ids != null && !op.ids.isEmpty(), "Malformed delete %s", op);
					break;
				case ReplicaUpdate.MAP_SET:
					checkArgument(op.id != null && op.key != null && op.value != null, "Malformed map set %s", op);
					break;
				case ReplicaUpdate.MAP_DELETE:
					checkArgument(op.id != null && op.key != null, "Malformed map delete %s", op);
					break;
				default:
					throw new IllegalArgumentException("Unknown update op " + op.type);
			}
		}
		return update;
	}

	static Object encodeValue(Object value) {
		if (value instanceof MemoryMap) return singletonMap(CONTAINER, MAP);
		if (value instanceof MemoryArray) return singletonMap(CONTAINER, ARRAY);
		if (value instanceof MemoryText) return singletonMap(CONTAINER, TEXT);
		return value;
	}

	/**
	 * Rebuilds a decoded value, creating a fresh empty container in {@code document} for a container marker.
	 */
	static Object decodeValue(MemoryReplicaDocument document, Object value) {
		if (!(value instanceof Map)) {
			checkArgument(value instanceof String || value instanceof Boolean || value instanceof Long || value instanceof Double,
					"Unsupported value %s", value);
			return value;
		}
		Object kind = ((Map<?, ?>) value).get(CONTAINER);
		checkArgument(((Map<?, ?>) value).size() == 1 && kind != null, "Malformed container %s", value);
		if (MAP.equals(kind)) return document.createMap();
		if (ARRAY.equals(kind)) return document.createArray();
		if (TEXT.equals(kind)) return document.createText("");
		throw new IllegalArgumentException("Unknown container kind " + kind);
	}
}
