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

import static io.treesync.common.Preconditions.checkArgument;
import static io.treesync.common.Preconditions.checkNotNull;

public final class Point {
	private final Path path;
	private final int offset;

	private Point(Path path, int offset) {
		this.path = path;
		this.offset = offset;
	}

	public static Point of(Path path, int offset) {
		checkArgument(offset >= 0, "Negative offset %s", offset);
		return new Point(checkNotNull(path), offset);
	}

	public Path getPath() {
		return path;
	}

	public int getOffset() {
		return offset;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Point point = (Point) o;
		return offset == point.offset && path.equals(point.path);
	}

	@Override
	public int hashCode() {
		return 31 * path.hashCode() + offset;
	}

	@Override
	public String toString() {
		return path + ":" + offset;
	}
}
