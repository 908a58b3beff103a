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

package io.treesync.replica.memory;

import io.treesync.replica.event.Delta;
import org.junit.Test;

import java.util.Collections;

import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static org.junit.Assert.assertEquals;

public final class SequenceDiffTest {

	@Test
	public void testTextInsertAndDelete() {
		assertEquals(asList(Delta.retain(5), Delta.insertText(" World")), SequenceDiff.diffText("Hello", "Hello World"));
		assertEquals(singletonList(Delta.delete(6)), SequenceDiff.diffText("Hello World", "World"));
		assertEquals(asList(Delta.retain(1), Delta.delete(3), Delta.insertText("EL")), SequenceDiff.diffText("Hello", "HELo"));
		assertEquals(Collections.emptyList(), SequenceDiff.diffText("same", "same"));
	}

	@Test
	public void testArrayDiff() {
		assertEquals(asList(Delta.retain(1), Delta.delete(1), Delta.retain(1), Delta.insert(singletonList("x"))),
				SequenceDiff.diffArray(asList("a", "b", "c", "d"), asList("a", "c", "x", "d")));
		assertEquals(singletonList(Delta.insert(asList(1L, 2L))),
				SequenceDiff.diffArray(Collections.emptyList(), asList(1L, 2L)));
		assertEquals(asList(Delta.retain(2), Delta.delete(1)),
				SequenceDiff.diffArray(asList("a", "b", "c"), asList("a", "b")));
	}

	@Test
	public void testContainersAreComparedByIdentity() {
		MemoryReplicaDocument document = MemoryReplicaDocument.create();
		MemoryMap first = document.createMap();
		MemoryMap second = document.createMap();
		assertEquals(asList(Delta.delete(1), Delta.insert(singletonList(second))),
				SequenceDiff.diffArray(singletonList(first), singletonList(second)));
	}
}
