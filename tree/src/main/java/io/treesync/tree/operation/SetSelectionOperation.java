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
import io.treesync.tree.Selection;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public final class SetSelectionOperation extends TreeOperation {
	@Nullable
	private final Selection selection;
	@Nullable
	private final Selection newSelection;

	public SetSelectionOperation(@Nullable Selection selection, @Nullable Selection newSelection) {
		this.selection = selection;
		this.newSelection = newSelection;
	}

	@Nullable
	@Override
	public Path getPath() {
		return null;
	}

	@Override
	public boolean isSelectionOperation() {
		return true;
	}

	@Nullable
	public Selection getSelection() {
		return selection;
	}

	@Nullable
	public Selection getNewSelection() {
		return newSelection;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SetSelectionOperation that = (SetSelectionOperation) o;
		return Objects.equals(selection, that.selection) && Objects.equals(newSelection, that.newSelection);
	}

	@Override
	public int hashCode() {
		return Objects.hash(selection, newSelection);
	}

	@Override
	public String toString() {
		return "set_selection{" + selection + " -> " + newSelection + '}';
	}
}
