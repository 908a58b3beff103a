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

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public final class SyncFlagsTest {
	private final List<Runnable> queue = new ArrayList<>();
	private final SyncFlags flags = new SyncFlags(queue::add);

	@Test
	public void testLocalClearsSynchronously() {
		String result = flags.runAsLocal(() -> {
			assertTrue(flags.isLocal());
			assertFalse(flags.isRemote());
			assertFalse(flags.isUndo());
			return "done";
		});
		assertEquals("done", result);
		assertFalse(flags.isLocal());
		assertTrue(queue.isEmpty());
	}

	@Test
	public void testUndoClearsSynchronously() {
		assertTrue(flags.runAsUndo(flags::isUndo));
		assertFalse(flags.isUndo());
	}

	@Test
	public void testRemoteClearIsDeferred() {
		assertTrue(flags.runAsRemote(flags::isRemote));
		assertTrue(flags.isRemote());
		assertEquals(1, queue.size());

		queue.get(0).run();
		assertFalse(flags.isRemote());
	}

	@Test
	public void testNestedRunKeepsOuterFlag() {
		boolean outerAfterInner = flags.runAsLocal(() -> {
			assertTrue(flags.runAsLocal(flags::isLocal));
			return flags.isLocal();
		});
		assertTrue(outerAfterInner);
		assertFalse(flags.isLocal());

		flags.runAsRemote(() -> flags.runAsRemote(() -> 1));
		assertEquals(1, queue.size());
	}

	@Test
	public void testFlagClearsWhenRunFails() {
		try {
			flags.runAsUndo(() -> {
				throw new IllegalStateException("failed");
			});
			fail();
		} catch (IllegalStateException e) {
			assertEquals("failed", e.getMessage());
		}
		assertFalse(flags.isUndo());
	}
}
