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

package io.treesync.test;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TestUtils {
	private TestUtils() {
	}

	public static void enableLogging(String name, Level level) {
		ch.qos.logback.classic.Logger logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(name);
		logger.setLevel(level);
	}

	public static void enableLogging(Class<?> cls) {
		enableLogging(cls.getName(), Level.TRACE);
	}

	public static void enableLogging(Level level) {
		enableLogging(Logger.ROOT_LOGGER_NAME, level);
	}

	public static void enableLogging() {
		enableLogging(Logger.ROOT_LOGGER_NAME, Level.TRACE);
	}
}
