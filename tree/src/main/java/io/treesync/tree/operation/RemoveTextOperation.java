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

import static io.treesync.common.Preconditions.checkArgument;
import static io.treesync.common.Preconditions.checkNotNull;

/**
 * Removes {@code text} starting at {@code offset}; the removed text itself is carried
 * so that the operation describes what was there.
 */
public final class RemoveTextOperation extends TreeOperation {
	private final Path path;
	private final int offset;
	private final String text;

	public RemoveTextOperation(Path path, int offset, String text) {
		checkArgument(offset >= 0, "Negative offset %s", offset);
		this.path = path;
		this.offset = offset;
		this.text = checkNotNull(text);
	}

	@Override
	public Path getPath() {
		return path;
	}

	public int getOffset() {
		return offset;
	}

	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RemoveTextOperation that = (RemoveTextOperation) o;
		return offset == that.offset && path.equals(that.path) && text.equals(that.text);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * path.hashCode() + offset) + text.hashCode();
	}

	@Override
	public String toString() {
		return "remove_text{" + path + ':' + offset + ", '" + text + "'}";
	}
}
