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

import io.treesync.replica.ReplicaArray;

import java.util.List;

import static java.util.Collections.unmodifiableList;

public final class ArrayEvent extends ReplicaEvent {
	private final List<Delta> delta;

	public ArrayEvent(ReplicaArray target, List<Object> path, List<Delta> delta) {
		super(target, path);
		this.delta = unmodifiableList(delta);
	}

	@Override
	public ReplicaArray getTarget() {
		return (ReplicaArray) super.getTarget();
	}

	public List<Delta> getDelta() {
		return delta;
	}

	@Override
	public String toString() {
		return "ArrayEvent{" + getPath() + ", " + delta + '}';
	}
}
