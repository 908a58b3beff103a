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

import io.treesync.replica.ReplicaMap;
import io.treesync.replica.ReplicaTransaction;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static java.util.Arrays.asList;
import static java.util.Collections.singleton;
import static java.util.Collections.singletonList;
import static org.junit.Assert.*;

public final class MemoryUndoHistoryTest {
	private static final String LOCAL = "local";
	private static final String REMOTE = "remote";

	private long now = 1000;
	private MemoryReplicaDocument document;
	private MemoryArray content;
	private MemoryUndoHistory history;

	@Before
	public void setUp() {
		document = MemoryReplicaDocument.create(() -> now);
		content = document.getArray("content");
		document.transact(REMOTE, () -> content.insert(0, asList(leaf("first"), leaf("second"))));
		history = document.createUndoHistory(singletonList(content), singleton(LOCAL), 0);
	}

	@Test
	public void testUndoRevertsOnlyTrackedOrigin() {
		document.transact(LOCAL, () -> text(0).insert(5, "!"));
		document.transact(REMOTE, () -> text(1).insert(0, ">"));

		assertTrue(history.canUndo());
		assertTrue(history.undo());

		assertEquals("first", text(0).toString());
		assertEquals(">second", text(1).toString());
		assertFalse(history.canUndo());
		assertTrue(history.canRedo());

		assertTrue(history.redo());
		assertEquals("first!", text(0).toString());
		assertEquals(">second", text(1).toString());
	}

	@Test
	public void testReplayIsTaggedWithHistory() {
		List<ReplicaTransaction> transactions = new ArrayList<>();
		content.observeDeep((events, transaction) -> transactions.add(transaction));

		document.transact(LOCAL, () -> text(0).delete(0, 1));
		history.undo();

		assertEquals(2, transactions.size());
		assertSame(history, transactions.get(1).getOrigin());
	}

	@Test
	public void testUndoStructuralChange() {
		document.transact(LOCAL, () -> {
			content.delete(0, 1);
			content.insert(1, singletonList(leaf("third")));
		});
		assertEquals(2, content.length());

		history.undo();
		assertEquals(2, content.length());
		assertEquals("first", text(0).toString());
		assertEquals("second", text(1).toString());

		history.redo();
		assertEquals("second", text(0).toString());
		assertEquals("third", text(1).toString());
	}

	@Test
	public void testUndoFindsNodesMovedByRemoteChanges() {
		document.transact(LOCAL, () -> content.insert(2, singletonList(leaf("mine"))));
		document.transact(REMOTE, () -> content.delete(0, 1));

		history.undo();
		assertEquals(1, content.length());
		assertEquals("second", text(0).toString());
	}

	@Test
	public void testUndoRemovesOwnTextAfterRemoteInsertBefore() {
		document.transact(REMOTE, () -> {
			text(0).delete(0, 5);
			text(0).insert(0, "abQ");
		});
		MemoryReplicaDocument peer = MemoryReplicaDocument.create();
		peer.applyUpdate(document.encodeStateAsUpdate(), REMOTE);
		List<byte[]> fromPeer = new ArrayList<>();
		peer.addUpdateListener((update, origin) -> fromPeer.add(update));

		document.transact(LOCAL, () -> text(0).insert(3, "ab"));
		MemoryText peerText = (MemoryText) ((ReplicaMap) peer.getArray("content").get(0)).get("text");
		peerText.insert(0, "Z");
		document.applyUpdate(fromPeer.get(0), REMOTE);
		assertEquals("ZabQab", text(0).toString());

		history.undo();
		assertEquals("ZabQ", text(0).toString());
		history.redo();
		assertEquals("ZabQab", text(0).toString());
	}

	@Test
	public void testUndoKeepsConcurrentRemoteEditsInsideRange() {
		document.transact(LOCAL, () -> text(0).insert(5, "xyz"));
		document.transact(REMOTE, () -> text(0).insert(6, "+"));
		assertEquals("firstx+yz", text(0).toString());

		history.undo();
		assertEquals("first+", text(0).toString());
	}

	@Test
	public void testUndoDoesNotRestoreOverwrittenValue() {
		MemoryMap node = (MemoryMap) content.get(0);
		document.transact(LOCAL, () -> node.set("bold", true));
		document.transact(REMOTE, () -> node.set("bold", false));

		history.undo();
		assertEquals(false, node.get("bold"));
	}

	@Test
	public void testCaptureTimeoutMergesSteps() {
		history = document.createUndoHistory(singletonList(content), singleton(LOCAL), 500);
		document.transact(LOCAL, () -> text(0).insert(5, "a"));
		now += 100;
		document.transact(LOCAL, () -> text(0).insert(6, "b"));
		now += 1000;
		document.transact(LOCAL, () -> text(0).insert(7, "c"));

		history.undo();
		assertEquals("firstab", text(0).toString());
		history.undo();
		assertEquals("first", text(0).toString());
		assertFalse(history.undo());
	}

	@Test
	public void testStopCapturingForcesNewStep() {
		history = document.createUndoHistory(singletonList(content), singleton(LOCAL), 500);
		document.transact(LOCAL, () -> text(0).insert(5, "a"));
		history.stopCapturing();
		document.transact(LOCAL, () -> text(0).insert(6, "b"));

		history.undo();
		assertEquals("firsta", text(0).toString());
	}

	@Test
	public void testNewChangeClearsRedo() {
		document.transact(LOCAL, () -> text(0).insert(0, "x"));
		history.undo();
		assertTrue(history.canRedo());

		document.transact(LOCAL, () -> text(0).insert(0, "y"));
		assertFalse(history.canRedo());
		assertFalse(history.redo());
	}

	@Test
	public void testChangesOutsideScopeAreIgnored() {
		ReplicaMap theme = document.getMap("theme");
		document.transact(LOCAL, () -> theme.set("color", "dark"));

		assertFalse(history.canUndo());
	}

	@Test
	public void testDestroyedHistoryStopsCapturing() {
		history.destroy();
		document.transact(LOCAL, () -> text(0).insert(0, "x"));
		assertFalse(history.canUndo());
	}

	private MemoryText text(int index) {
		return (MemoryText) ((ReplicaMap) content.get(index)).get("text");
	}

	private MemoryMap leaf(String text) {
		MemoryMap node = document.createMap();
		node.set("text", document.createText(text));
		return node;
	}
}
