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

import org.jetbrains.annotations.Nullable;

public final class SyncError {
	private final ErrorKind kind;
	private final String description;
	@Nullable
	private final Throwable cause;

	public SyncError(ErrorKind kind, String description, @Nullable Throwable cause) {
		this.kind = kind;
		this.description = description;
		this.cause = cause;
	}

	public ErrorKind getKind() {
		return kind;
	}

	public String getDescription() {
		return description;
	}

	@Nullable
	public Throwable getCause() {
		return cause;
	}

	@Override
	public String toString() {
		return "SyncError{" + kind + ", " + description + (cause != null ? ", " + cause : "") + '}';
	}
}
