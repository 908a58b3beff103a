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

import static io.treesync.common.Preconditions.checkNotNull;

public final class Selection {
	private final Point anchor;
	private final Point focus;

	private Selection(Point anchor, Point focus) {
		this.anchor = anchor;
		this.focus = focus;
	}

	public static Selection of(Point anchor, Point focus) {
		return new Selection(checkNotNull(anchor), checkNotNull(focus));
	}

	public static Selection collapsed(Point point) {
		return of(point, point);
	}

	public Point getAnchor() {
		return anchor;
	}

	public Point getFocus() {
		return focus;
	}

	public boolean isCollapsed() {
		return anchor.equals(focus);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Selection that = (Selection) o;
		return anchor.equals(that.anchor) && focus.equals(that.focus);
	}

	@Override
	public int hashCode() {
		return 31 * anchor.hashCode() + focus.hashCode();
	}

	@Override
	public String toString() {
		return "{anchor=" + anchor + ", focus=" + focus + '}';
	}
}
