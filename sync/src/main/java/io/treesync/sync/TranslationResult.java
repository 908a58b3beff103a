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

import static io.treesync.common.Preconditions.checkNotNull;

/**
 * Outcome of one translation pass: success, or the kind of failure and what caused it.
 */
public final class TranslationResult {
	private static final TranslationResult SUCCESS = new TranslationResult(null, null);

	@Nullable
	private final ErrorKind kind;
	@Nullable
	private final Throwable cause;

	private TranslationResult(@Nullable ErrorKind kind, @Nullable Throwable cause) {
		this.kind = kind;
		this.cause = cause;
	}

	public static TranslationResult success() {
		return SUCCESS;
	}

	public static TranslationResult failure(ErrorKind kind, Throwable cause) {
		return new TranslationResult(checkNotNull(kind), checkNotNull(cause));
	}

	public boolean isSuccess() {
		return kind == null;
	}

	@Nullable
	public ErrorKind getKind() {
		return kind;
	}

	@Nullable
	public Throwable getCause() {
		return cause;
	}

	@Override
	public String toString() {
		return isSuccess() ? "success" : "failure{" + kind + ", " + cause + '}';
	}
}
