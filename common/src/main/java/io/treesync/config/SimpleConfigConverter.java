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

package io.treesync.config;

import org.jetbrains.annotations.Nullable;

import java.util.NoSuchElementException;

public abstract class SimpleConfigConverter<T> implements ConfigConverter<T> {
	@Override
	public final T get(Config config) throws NoSuchElementException {
		return fromString(config.get(Config.THIS));
	}

	@Nullable
	@Override
	public final T get(Config config, @Nullable T defaultValue) {
		String defaultString = defaultValue == null ? null : toString(defaultValue);
		String value = config.get(Config.THIS, defaultString);
		if (value == null) return null;
		try {
			return fromString(value.trim());
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Cannot convert '" + value + "'", e);
		}
	}

	protected abstract T fromString(String string);

	protected abstract String toString(T value);
}
