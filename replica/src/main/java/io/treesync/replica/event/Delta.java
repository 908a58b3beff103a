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

import java.util.ArrayList;
import java.util.List;

import static io.treesync.common.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableList;

/**
 * One step of a sequence delta. Steps are applied left to right with a cursor starting at 0:
 * retain moves the cursor, insert adds content at the cursor and moves past it, delete removes
 * content at the cursor.
 */
public final class Delta {
	public enum Kind {
		RETAIN, INSERT, DELETE
	}

	private final Kind kind;
	private final int length;
	@Nullable
	private final List<Object> values;
	@Nullable
	private final String text;

	private Delta(Kind kind, int length, @Nullable List<Object> values, @Nullable String text) {
		this.kind = kind;
		this.length = length;
		this.values = values;
		this.text = text;
	}

	public static Delta retain(int length) {
		checkArgument(length > 0, "Non-positive length %s", length);
		return new Delta(Kind.RETAIN, length, null, null);
	}

	public static Delta delete(int length) {
		checkArgument(length > 0, "Non-positive length %s", length);
		return new Delta(Kind.DELETE, length, null, null);
	}

	public static Delta insert(List<?> values) {
		checkArgument(!values.isEmpty(), "Nothing to insert");
		return new Delta(Kind.INSERT, values.size(), unmodifiableList(new ArrayList<Object>(values)), null);
	}

	public static Delta insertText(String text) {
		checkArgument(!text.isEmpty(), "Nothing to insert");
		return new Delta(Kind.INSERT, text.length(), null, text);
	}

	public Kind getKind() {
		return kind;
	}

	public int getLength() {
		return length;
	}

	/**
	 * Inserted array values, {@code null} for text deltas and non-insert steps.
	 */
	@Nullable
	public List<Object> getValues() {
		return values;
	}

	@Nullable
	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Delta that = (Delta) o;
		if (kind != that.kind || length != that.length) return false;
		if (values != null ? !values.equals(that.values) : that.values != null) return false;
		return text != null ? text.equals(that.text) : that.text == null;
	}

	@Override
	public int hashCode() {
		int result = kind.hashCode();
		result = 31 * result + length;
		result = 31 * result + (values != null ? values.hashCode() : 0);
		result = 31 * result + (text != null ? text.hashCode() : 0);
		return result;
	}

	@Override
	public String toString() {
		switch (kind) {
			case RETAIN:
				return "retain(" + length + ')';
			case DELETE:
				return "delete(" + length + ')';
			default:
				return "insert(" + (text != null ? '"' + text + '"' : values) + ')';
		}
	}
}
