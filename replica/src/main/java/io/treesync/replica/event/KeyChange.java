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

import org.jetbrains.annotations.Nullable;

public final class KeyChange {
	public enum Action {
		ADD, UPDATE, DELETE
	}

	private final Action action;
	@Nullable
	private final Object oldValue;

	private KeyChange(Action action, @Nullable Object oldValue) {
		this.action = action;
		this.oldValue = oldValue;
	}

	public static KeyChange add() {
		return new KeyChange(Action.ADD, null);
	}

	public static KeyChange update(Object oldValue) {
		return new KeyChange(Action.UPDATE, oldValue);
	}

	public static KeyChange delete(Object oldValue) {
		return new KeyChange(Action.DELETE, oldValue);
	}

	public Action getAction() {
		return action;
	}

	@Nullable
	public Object getOldValue() {
		return oldValue;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		KeyChange that = (KeyChange) o;
		return action == that.action && (oldValue != null ? oldValue.equals(that.oldValue) : that.oldValue == null);
	}

	@Override
	public int hashCode() {
		return 31 * action.hashCode() + (oldValue != null ? oldValue.hashCode() : 0);
	}

	@Override
	public String toString() {
		return action + (oldValue != null ? "(" + oldValue + ')' : "");
	}
}
