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

package io.treesync.sync;

public enum ErrorKind {
	/**
	 * A local edit batch could not be mirrored into the replica; the replica transaction was rolled back.
	 */
	LOCAL_APPLY,
	/**
	 * An undo or redo replay could not be mirrored into the local tree.
	 */
	UNDO_APPLY,
	/**
	 * A remote batch could not be mirrored into the local tree.
	 */
	REMOTE_APPLY,
	BINDING_ERROR
}
