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

package io.treesync.eventloop;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static io.treesync.eventloop.FatalErrorHandlers.rethrowOnAnyError;
import static java.util.Arrays.asList;
import static org.junit.Assert.*;

public final class EventloopTest {
	@Test
	public void testPostRunsBeforeQueuedTasks() {
		Eventloop eventloop = Eventloop.create().withCurrentThread();
		List<String> order = new ArrayList<>();

		eventloop.postLater(() -> order.add("later"));
		eventloop.post(() -> {
			order.add("first");
			eventloop.post(() -> order.add("nested"));
		});
		eventloop.run();

		assertEquals(asList("first", "nested", "later"), order);
		assertFalse(eventloop.hasPendingTasks());
	}

	@Test
	public void testCurrentEventloop() {
		Eventloop eventloop = Eventloop.create().withCurrentThread();
		assertSame(eventloop, Eventloop.getCurrentEventloop());
	}

	@Test
	public void testTimestampComesFromTimeProvider() {
		long[] now = {100};
		Eventloop eventloop = Eventloop.create(() -> now[0]);
		assertEquals(100, eventloop.currentTimeMillis());

		now[0] = 200;
		eventloop.post(() -> assertEquals(200, eventloop.currentTimeMillis()));
		eventloop.run();
	}

	@Test
	public void testFatalErrorsGoToHandler() {
		List<Throwable> errors = new ArrayList<>();
		Eventloop eventloop = Eventloop.create().withFatalErrorHandler((error, context) -> errors.add(error));
		List<String> order = new ArrayList<>();

		eventloop.post(() -> {
			throw new IllegalStateException("failed");
		});
		eventloop.postLater(() -> order.add("next"));
		eventloop.run();

		assertEquals(1, errors.size());
		assertEquals("failed", errors.get(0).getMessage());
		assertEquals(asList("next"), order);
	}

	@Test(expected = IllegalStateException.class)
	public void testRethrowOnAnyError() {
		Eventloop eventloop = Eventloop.create().withFatalErrorHandler(rethrowOnAnyError());
		eventloop.post(() -> {
			throw new IllegalStateException("failed");
		});
		eventloop.run();
	}
}
