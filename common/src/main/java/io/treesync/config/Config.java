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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Properties;
import java.util.regex.Pattern;

import static io.treesync.common.Preconditions.checkArgument;
import static io.treesync.common.Preconditions.checkNotNull;
import static java.util.Collections.emptyMap;
import static java.util.Collections.singletonMap;
import static java.util.Collections.unmodifiableMap;

/**
 * Immutable tree of string values addressed by dotted paths, such as {@code sync.undo.enabled}.
 * Typed access goes through {@link ConfigConverter}s.
 */
public interface Config {
	Config EMPTY = new Config() {
		@Override
		public String getValue(@Nullable String defaultValue) {
			return defaultValue;
		}

		@Override
		public Map<String, Config> getChildren() {
			return emptyMap();
		}
	};

	String THIS = "";
	String DELIMITER = ".";
	Pattern DELIMITER_PATTERN = Pattern.compile(Pattern.quote(DELIMITER));
	Pattern PATH_PATTERN = Pattern.compile("([0-9a-zA-Z_-]+(\\.[0-9a-zA-Z_-]+)*)?");

	static void checkPath(String path) {
		checkArgument(PATH_PATTERN.matcher(path).matches(), "Invalid path %s", path);
	}

	String getValue(@Nullable String defaultValue);

	Map<String, Config> getChildren();

	default String get(String path) throws NoSuchElementException {
		String value = get(path, null);
		if (value == null) {
			throw new NoSuchElementException("No value at " + path);
		}
		return value;
	}

	default String get(String path, @Nullable String defaultValue) {
		return getChild(path).getValue(defaultValue);
	}

	default <T> T get(ConfigConverter<T> converter, String path) throws NoSuchElementException {
		return converter.get(getChild(path));
	}

	default <T> T get(ConfigConverter<T> converter, String path, @Nullable T defaultValue) {
		return converter.get(getChild(path), defaultValue);
	}

	default Config getChild(String path) {
		checkPath(path);
		Config config = this;
		for (String key : DELIMITER_PATTERN.split(path)) {
			if (key.isEmpty()) continue;
			Map<String, Config> children = config.getChildren();
			config = children.getOrDefault(key, EMPTY);
		}
		return config;
	}

	static Config create() {
		return EMPTY;
	}

	static Config ofMap(Map<String, String> map) {
		Config config = create();
		for (Map.Entry<String, String> entry : map.entrySet()) {
			config = config.with(entry.getKey(), entry.getValue());
		}
		return config;
	}

	static Config ofProperties(Properties properties) {
		Map<String, String> map = new LinkedHashMap<>();
		for (String key : properties.stringPropertyNames()) {
			map.put(key, properties.getProperty(key));
		}
		return ofMap(map);
	}

	default Config with(String path, String value) {
		checkPath(path);
		checkNotNull(value);
		return with(path, new Config() {
			@Override
			public String getValue(@Nullable String defaultValue) {
				return value;
			}

			@Override
			public Map<String, Config> getChildren() {
				return emptyMap();
			}
		});
	}

	default Config with(String path, Config config) {
		checkPath(path);
		checkNotNull(config);
		String[] keys = DELIMITER_PATTERN.split(path);
		for (int i = keys.length - 1; i >= 0; i--) {
			String key = keys[i];
			if (key.isEmpty()) continue;
			Map<String, Config> map = singletonMap(key, config);
			config = new Config() {
				@Override
				public String getValue(@Nullable String defaultValue) {
					return defaultValue;
				}

				@Override
				public Map<String, Config> getChildren() {
					return map;
				}
			};
		}
		return override(config);
	}

	default Config override(Config other) {
		String otherValue = other.getValue(null);
		Map<String, Config> otherChildren = other.getChildren();
		if (otherValue == null && otherChildren.isEmpty()) {
			return this;
		}
		String value = otherValue != null ? otherValue : getValue(null);
		Map<String, Config> children = new LinkedHashMap<>(getChildren());
		otherChildren.forEach((key, child) -> children.merge(key, child, Config::override));
		Map<String, Config> finalChildren = unmodifiableMap(children);
		return new Config() {
			@Override
			public String getValue(@Nullable String defaultValue) {
				return value != null ? value : defaultValue;
			}

			@Override
			public Map<String, Config> getChildren() {
				return finalChildren;
			}
		};
	}
}
