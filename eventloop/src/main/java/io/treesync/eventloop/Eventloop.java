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

import io.treesync.common.time.CurrentTimeProvider;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;

import static io.treesync.common.Preconditions.checkNotNull;

/**
 * Single-threaded cooperative task loop. One document session is driven by one
 * {@code Eventloop}; every task runs to completion before the next one starts,
 * so code running in the loop never needs locks.
 * <p>
 * {@link #post(Runnable)} schedules a task ahead of everything already queued,
 * {@link #postLater(Runnable)} schedules it behind. {@link #run()} executes tasks
 * until the queue is empty.
 */
public final class Eventloop implements CurrentTimeProvider {
	private static final Logger logger = LoggerFactory.getLogger(Eventloop.class);

	private static final ThreadLocal<Eventloop> CURRENT_EVENTLOOP = new ThreadLocal<>();

	private static final String NO_CURRENT_EVENTLOOP_ERROR = "Trying to start async operations prior eventloop.run(), " +
			"or from outside of eventloop.run(). Use Eventloop.create().withCurrentThread() before scheduling tasks";

	private final ArrayDeque<Runnable> localTasks = new ArrayDeque<>();

	private final CurrentTimeProvider timeProvider;

	private FatalErrorHandler fatalErrorHandler = FatalErrorHandlers.ignoreAllErrors();

	@Nullable
	private Thread eventloopThread;

	private long timestamp;

	// region builders
	private Eventloop(CurrentTimeProvider timeProvider) {
		this.timeProvider = timeProvider;
		refreshTimestamp();
	}

	public static Eventloop create() {
		return create(CurrentTimeProvider.ofSystem());
	}

	public static Eventloop create(CurrentTimeProvider timeProvider) {
		return new Eventloop(timeProvider);
	}

	public Eventloop withFatalErrorHandler(FatalErrorHandler fatalErrorHandler) {
		this.fatalErrorHandler = checkNotNull(fatalErrorHandler);
		return this;
	}

	public Eventloop withCurrentThread() {
		CURRENT_EVENTLOOP.set(this);
		return this;
	}
	// endregion

	public static Eventloop getCurrentEventloop() {
		Eventloop eventloop = CURRENT_EVENTLOOP.get();
		if (eventloop != null) {
			return eventloop;
		}
		throw new IllegalStateException(NO_CURRENT_EVENTLOOP_ERROR);
	}

	public boolean inEventloopThread() {
		return eventloopThread == null || eventloopThread == Thread.currentThread();
	}

	/**
	 * Executes queued tasks until the queue is empty, including tasks posted by the tasks themselves.
	 */
	public void run() {
		Thread previousThread = eventloopThread;
		eventloopThread = Thread.currentThread();
		Eventloop previousEventloop = CURRENT_EVENTLOOP.get();
		CURRENT_EVENTLOOP.set(this);
		try {
			while (true) {
				Runnable runnable = localTasks.poll();
				if (runnable == null) {
					break;
				}
				refreshTimestamp();
				try {
					runnable.run();
				} catch (Throwable e) {
					recordFatalError(e, runnable);
				}
			}
		} finally {
			eventloopThread = previousThread;
			if (previousEventloop == null) {
				CURRENT_EVENTLOOP.remove();
			} else {
				CURRENT_EVENTLOOP.set(previousEventloop);
			}
		}
	}

	/**
	 * Posts a task to the beginning of the local queue, it runs before anything already queued.
	 */
	public void post(Runnable runnable) {
		assert inEventloopThread();
		localTasks.addFirst(runnable);
	}

	/**
	 * Posts a task to the end of the local queue.
	 */
	public void postLater(Runnable runnable) {
		assert inEventloopThread();
		localTasks.addLast(runnable);
	}

	public boolean hasPendingTasks() {
		return !localTasks.isEmpty();
	}

	private void refreshTimestamp() {
		timestamp = timeProvider.currentTimeMillis();
	}

	@Override
	public long currentTimeMillis() {
		return timestamp;
	}

	public void recordFatalError(Throwable e, @Nullable Object context) {
		logger.error("Fatal Error in " + context, e);
		fatalErrorHandler.handle(e, context);
	}

	@Override
	public String toString() {
		return "Eventloop{localTasks=" + localTasks.size() + '}';
	}
}
