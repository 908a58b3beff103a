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

import io.treesync.tree.operation.TreeOperation;

import java.util.List;

@FunctionalInterface
public interface ChangeListener {
	/**
	 * Called once per flushed batch with every operation applied since the previous flush.
	 * The batch is empty when the content was replaced wholesale rather than edited.
	 */
	void onChange(List<TreeOperation> operations);
}
