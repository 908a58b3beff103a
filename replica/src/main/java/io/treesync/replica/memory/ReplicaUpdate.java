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

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire form of one committed transaction: its primitive ops in application order. A container is
 * addressed either by top-level name ({@code root}) or by the id of the item holding it ({@code parent}).
 * Items are addressed by id, never by position, so updates apply the same way in any order.
 */
final class ReplicaUpdate {
	static final String INSERT = "insert";
	static final String DELETE = "delete";
	static final String MAP_SET = "mapSet";
	static final String MAP_DELETE = "mapDelete";

	List<Op> ops = new ArrayList<>();

	ReplicaUpdate() {
	}

	ReplicaUpdate(List<Op> ops) {
		this.ops = ops;
	}

	static final class Op {
		String type;
		@Nullable
		String root;
		@Nullable
		ItemId parent;
		/**
		 * Id of the inserted item or of the first one of an inserted run; the rest follow clock by clock.
		 */
		@Nullable
		ItemId id;
		@Nullable
		ItemId origin;
		@Nullable
		List<Object> values;
		@Nullable
		String text;
		@Nullable
		List<ItemId> ids;
		@Nullable
		String key;
		@Nullable
		Object value;

		Op() {
		}

		private Op(String type, MemoryContainer container) {
			this.type = type;
			if (container.rootName != null) {
				this.root = container.rootName;
			} else {
				this.parent = container.requireHolder().id;
			}
		}

		static Op insertValues(MemoryContainer container, ItemId id, @Nullable ItemId origin, List<Object> values) {
			Op op = new Op(INSERT, container);
			op.id = id;
			op.origin = origin;
			op.values = values;
			return op;
		}

		static Op insertText(MemoryContainer container, ItemId id, @Nullable ItemId origin, String text) {
			Op op = new Op(INSERT, container);
			op.id = id;
			op.origin = origin;
			op.text = text;
			return op;
		}

		static Op delete(MemoryContainer container, List<ItemId> ids) {
			Op op = new Op(DELETE, container);
			op.ids = ids;
			return op;
		}

		static Op mapSet(MemoryContainer container, ItemId id, String key, Object value) {
			Op op = new Op(MAP_SET, container);
			op.id = id;
			op.key = key;
			op.value = value;
			return op;
		}

		static Op mapDelete(MemoryContainer container, ItemId target, String key) {
			Op op = new Op(MAP_DELETE, container);
			op.id = target;
			op.key = key;
			return op;
		}

		/**
		 * Number of items an insert op carries.
		 */
		int size() {
			if (values != null) return values.size();
			return text != null ? text.length() : 0;
		}

		@Override
		public String toString() {
			return type + '{' + (root != null ? root : parent) + (id != null ? ", " + id : "") + '}';
		}
	}
}
