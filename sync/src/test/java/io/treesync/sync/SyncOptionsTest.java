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

import io.treesync.config.Config;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.Assert.*;

public final class SyncOptionsTest {
	@Test
	public void testDefaults() {
		SyncOptions options = SyncOptions.fromConfig(Config.create());

		assertTrue(options.isPullInitialState());
		assertTrue(options.isUndoEnabled());
		assertEquals(0, options.getUndoCaptureTimeoutMillis());
		assertTrue(options.getLocalOrigin().toString().startsWith("local-"));
		assertNull(options.getPostTransactionQueue());
	}

	@Test
	public void testFromProperties() {
		Properties properties = new Properties();
		properties.setProperty("sync.pullInitialState", "false");
		properties.setProperty("sync.undo.enabled", "false");
		properties.setProperty("sync.undo.captureTimeoutMillis", "500");
		properties.setProperty("sync.localOrigin", "editor-1");

		SyncOptions options = SyncOptions.fromConfig(Config.ofProperties(properties));

		assertFalse(options.isPullInitialState());
		assertFalse(options.isUndoEnabled());
		assertEquals(500, options.getUndoCaptureTimeoutMillis());
		assertEquals("editor-1", options.getLocalOrigin());
	}

	@Test
	public void testGeneratedOriginsDiffer() {
		Map<String, String> map = new HashMap<>();
		map.put("sync.undo.captureTimeoutMillis", "20");
		SyncOptions first = SyncOptions.fromConfig(Config.ofMap(map));
		SyncOptions second = SyncOptions.fromConfig(Config.ofMap(map));

		assertEquals(20, first.getUndoCaptureTimeoutMillis());
		assertNotEquals(first.getLocalOrigin(), second.getLocalOrigin());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeCaptureTimeout() {
		SyncOptions.create().withUndoCaptureTimeout(-1);
	}
}
