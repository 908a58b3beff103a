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

package io.treesync.replica;

/**
 * Origin-scoped undo/redo stacks over a set of replica containers.
 * Replays run as transactions whose origin is the history itself.
 */
public interface UndoHistory {
	/**
	 * Reverts the most recent undo step.
	 *
	 * @return {@code false} if there was nothing to undo
	 */
	boolean undo();

	boolean redo();

	boolean canUndo();

	boolean canRedo();

	/**
	 * Makes the next captured change start a new undo step, regardless of the capture timeout.
	 */
	void stopCapturing();

	void clear();

	/**
	 * Stops capturing changes for good.
	 */
	void destroy();
}
