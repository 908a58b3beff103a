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

import io.treesync.replica.ReplicaContainer;

import java.util.List;

import static java.util.Collections.unmodifiableList;

/**
 * A change to exactly one container within one transaction.
 */
public abstract class ReplicaEvent {
	private final ReplicaContainer target;
	private final List<Object> path;

	ReplicaEvent(ReplicaContainer target, List<Object> path) {
		this.target = target;
		this.path = unmodifiableList(path);
	}

	public ReplicaContainer getTarget() {
		return target;
	}

	/**
	 * Location of the target relative to the observed container: {@code Integer} entries index
	 * into arrays, {@code String} entries are map keys. Empty when the target is the observed container.
	 */
	public List<Object> getPath() {
		return path;
	}
}
