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

package io.treesync.replica.event;

import io.treesync.replica.ReplicaMap;

import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

public final class MapEvent extends ReplicaEvent {
	private final Map<String, KeyChange> keyChanges;

	public MapEvent(ReplicaMap target, List<Object> path, Map<String, KeyChange> keyChanges) {
		super(target, path);
		this.keyChanges = unmodifiableMap(keyChanges);
	}

	@Override
	public ReplicaMap getTarget() {
		return (ReplicaMap) super.getTarget();
	}

	public Map<String, KeyChange> getKeyChanges() {
		return keyChanges;
	}

	@Override
	public String toString() {
		return "MapEvent{" + getPath() + ", " + keyChanges + '}';
	}
}
