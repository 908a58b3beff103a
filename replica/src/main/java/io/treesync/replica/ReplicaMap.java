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

import java.util.Map;
import java.util.Set;

/**
 * String-keyed map of scalars and nested containers. Scalars are strings, booleans,
 * {@code Long} and {@code Double}; other numbers are widened on the way in.
 */
public interface ReplicaMap extends ReplicaContainer {
	@Nullable
	Object get(String key);

	boolean has(String key);

	Set<String> keys();

	Map<String, Object> toMap();

	void set(String key, Object value);

	void delete(String key);

	@Override
	ReplicaMap deepClone();
}
