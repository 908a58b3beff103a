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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class ConfigConverters {
	private ConfigConverters() {}

	public static ConfigConverter<String> ofString() {
		return new ConfigConverter<String>() {
			@Nullable
			@Override
			public String get(Config config, @Nullable String defaultValue) {
				return config.getValue(defaultValue);
			}

			@NotNull
			@Override
			public String get(Config config) {
				return get(config, "");
			}
		};
	}

	public static ConfigConverter<Boolean> ofBoolean() {
		return new SimpleConfigConverter<Boolean>() {
			@Override
			protected Boolean fromString(String string) {
				if ("true".equalsIgnoreCase(string)) return true;
				if ("false".equalsIgnoreCase(string)) return false;
				throw new IllegalArgumentException("Not a boolean: " + string);
			}

			@Override
			protected String toString(Boolean value) {
				return Boolean.toString(value);
			}
		};
	}

	public static ConfigConverter<Long> ofLong() {
		return new SimpleConfigConverter<Long>() {
			@Override
			protected Long fromString(String string) {
				return Long.valueOf(string);
			}

			@Override
			protected String toString(Long value) {
				return Long.toString(value);
			}
		};
	}
}
