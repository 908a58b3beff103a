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

import io.treesync.eventloop.Eventloop;
import io.treesync.replica.ReplicaArray;
import io.treesync.replica.ReplicaMap;
import io.treesync.replica.ReplicaText;
import io.treesync.replica.memory.MemoryReplicaDocument;
import io.treesync.test.EventloopRule;
import io.treesync.tree.*;
import io.treesync.tree.operation.TreeOperation;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static io.treesync.test.TestUtils.enableLogging;
import static java.util.Arrays.asList;
import static java.util.Collections.*;
import static org.junit.Assert.*;

public final class SyncControllerTest {
	private static final String LOCAL = "local";
	private static final String REMOTE = "remote";

	@Rule
	public final EventloopRule eventloopRule = new EventloopRule();

	private Eventloop eventloop;
	private MemoryReplicaDocument replica;
	private ReplicaArray content;
	private ReplicaMap metadata;
	private DocumentSession document;
	private final List<SyncError> errors = new ArrayList<>();
	private final List<List<TreeOperation>> localBatches = new ArrayList<>();
	private final List<Object> replicaOrigins = new ArrayList<>();

	@BeforeClass
	public static void beforeClass() {
		enableLogging(SyncController.class);
	}

	@Before
	public void setUp() {
		eventloop = Eventloop.getCurrentEventloop();
		replica = MemoryReplicaDocument.create();
		content = replica.getArray("content");
		metadata = replica.getMap("metadata");
		content.observeDeep((events, transaction) -> replicaOrigins.add(transaction.getOrigin()));
		document = DocumentSession.create(eventloop).withChangeListener(localBatches::add);
	}

	@Test
	public void testLocalInsertReachesReplica() throws Exception {
		SyncController controller = bind(false);
		assertEquals(SyncState.SYNCHRONIZED, controller.getState());
		assertTrue(controller.isInitialized());

		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();

		assertEquals(1, content.length());
		assertEquals("Hello", replicaText(0, 0).toString());
		assertEquals("paragraph", node(0).get("type"));
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));
		assertEquals(singletonList(LOCAL), replicaOrigins);
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testRemoteDeleteScenario() {
		SyncController controller = bind(false);
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();

		Transforms.insertText(document, Path.of(0, 0), 5, " World");
		eventloop.run();
		assertEquals("Hello World", replicaText(0, 0).toString());

		replica.transact(REMOTE, () -> replicaText(0, 0).delete(0, 6));

		assertEquals("World", document.getText(Path.of(0, 0)).getText());
		assertEquals("World", replicaText(0, 0).toString());
		assertTrue(controller.isRemote());
		eventloop.run();
		assertFalse(controller.isRemote());
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testLocalEditIsNotEchoed() throws Exception {
		bind(false);
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();
		localBatches.clear();
		replicaOrigins.clear();

		Transforms.insertText(document, Path.of(0, 0), 5, " World");
		eventloop.run();

		assertEquals(1, localBatches.size());
		assertEquals(singletonList(LOCAL), replicaOrigins);
		assertEquals(singletonList(paragraph("Hello World")), document.getChildren());
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));
	}

	@Test
	public void testRemoteEditIsNotSentBack() {
		SyncController controller = bind(false);
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();
		replicaOrigins.clear();

		replica.transact(REMOTE, () -> replicaText(0, 0).insert(5, "!"));
		assertTrue(controller.isRemote());
		eventloop.run();

		assertEquals(singletonList(REMOTE), replicaOrigins);
		assertEquals("Hello!", replicaText(0, 0).toString());
		assertEquals(singletonList(paragraph("Hello!")), document.getChildren());
	}

	@Test
	public void testRemoteFlagClearsThroughPostTransactionQueue() {
		List<Runnable> queue = new ArrayList<>();
		SyncController controller = SyncController.bind(document, content, metadata, options()
				.withPullInitialState(false)
				.withPostTransactionQueue(queue::add));
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();

		replica.transact(REMOTE, () -> replicaText(0, 0).insert(0, ">"));
		eventloop.run();
		assertTrue(controller.isRemote());
		assertEquals(1, queue.size());

		// a local edit while the remote flag is still set is not mirrored
		Transforms.insertText(document, Path.of(0, 0), 0, "x");
		eventloop.run();
		assertEquals(">Hello", replicaText(0, 0).toString());

		queue.get(0).run();
		assertFalse(controller.isRemote());
		Transforms.insertText(document, Path.of(0, 0), 0, "y");
		eventloop.run();
		assertEquals("y>Hello", replicaText(0, 0).toString());
	}

	@Test
	public void testStructuralEditsRoundTrip() throws Exception {
		bind(false);
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		Transforms.insertNode(document, Path.of(1), Element.ofType("quote", Text.of("Quote").withMark("bold", true)));
		eventloop.run();
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));

		document.withoutNormalizing(() -> {
			Transforms.splitNode(document, Path.of(0, 0), 2);
			Transforms.splitNode(document, Path.of(0), 1);
		});
		eventloop.run();
		assertEquals(asList(paragraph("He"), paragraph("llo"), Element.ofType("quote", Text.of("Quote").withMark("bold", true))),
				document.getChildren());
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));

		Transforms.mergeNode(document, Path.of(1));
		eventloop.run();
		assertEquals(paragraph("Hello"), document.getNode(Path.of(0)));
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));

		Transforms.moveNode(document, Path.of(0), Path.of(1));
		eventloop.run();
		assertEquals("quote", node(0).get("type"));
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));

		Transforms.setNode(document, Path.of(0), "align", "center");
		Transforms.deleteText(document, Path.of(0, 0), 0, 2);
		eventloop.run();
		assertEquals("center", node(0).get("align"));
		assertEquals("ote", replicaText(0, 0).toString());

		Transforms.setNode(document, Path.of(0), "align", null);
		Transforms.removeNode(document, Path.of(1));
		eventloop.run();
		assertFalse(node(0).has("align"));
		assertEquals(1, content.length());
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testRemoteStructuralEditsReachLocalTree() throws Exception {
		bind(false);
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();

		replica.transact(REMOTE, () -> {
			content.insert(1, singletonList(ReplicaNodes.toReplica(replica, paragraph("World"))));
			node(0).set("align", "right");
		});
		eventloop.run();
		assertEquals(asList(paragraph("Hello").withProperty("align", "right"), paragraph("World")), document.getChildren());

		replica.transact(REMOTE, () -> {
			content.delete(0, 1);
			replicaText(0, 0).insert(5, "!");
		});
		eventloop.run();
		assertEquals(singletonList(paragraph("World!")), document.getChildren());
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testMetadataSync() {
		bind(false);
		Transforms.setMetadata(document, "theme", "dark");
		eventloop.run();
		assertEquals("dark", metadata.get("theme"));

		replica.transact(REMOTE, () -> {
			metadata.set("theme", "light");
			metadata.set("zoom", 2);
		});
		eventloop.run();
		assertEquals("light", document.getMetadata().get("theme"));
		assertEquals(2L, document.getMetadata().get("zoom"));

		Transforms.setMetadata(document, "zoom", null);
		eventloop.run();
		assertFalse(metadata.has("zoom"));
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testSelectionOnlyBatchIsIgnored() {
		bind(false);
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();
		replicaOrigins.clear();

		Transforms.select(document, Selection.collapsed(Point.of(Path.of(0, 0), 2)));
		eventloop.run();

		assertTrue(replicaOrigins.isEmpty());
		assertNotNull(document.getSelection());
	}

	@Test
	public void testInitialPull() throws Exception {
		replica.transact(null, () -> {
			content.insert(0, singletonList(ReplicaNodes.toReplica(replica, paragraph("Shared"))));
			metadata.set("theme", "dark");
		});
		document = DocumentSession.create(eventloop).withChildren(paragraph("Local"));

		SyncController controller = bind(true);
		assertEquals(SyncState.INITIALIZING, controller.getState());
		Transforms.insertText(document, Path.of(0, 0), 0, "x");
		eventloop.run();

		assertEquals(SyncState.SYNCHRONIZED, controller.getState());
		assertEquals(singletonList(paragraph("Shared")), document.getChildren());
		assertEquals(singletonMap("theme", "dark"), document.getMetadata());
		assertEquals("Shared", replicaText(0, 0).toString());
	}

	@Test
	public void testRemoteBatchBeforeInitialPullInitializes() {
		replica.transact(null, () -> content.insert(0, singletonList(ReplicaNodes.toReplica(replica, paragraph("Shared")))));
		document = DocumentSession.create(eventloop)
				.withChildren(paragraph("Local"))
				.withChangeListener(localBatches::add);

		SyncController controller = bind(true);
		replica.transact(REMOTE, () -> replicaText(0, 0).insert(6, "!"));

		assertEquals(SyncState.SYNCHRONIZED, controller.getState());
		assertEquals(singletonList(paragraph("Shared!")), document.getChildren());
		assertEquals(1, localBatches.size());

		eventloop.run();
		assertEquals(1, localBatches.size());

		Transforms.insertText(document, Path.of(0, 0), 7, "?");
		eventloop.run();
		assertEquals(singletonList(paragraph("Shared!?")), document.getChildren());
		assertEquals("Shared!?", replicaText(0, 0).toString());
	}

	@Test
	public void testUndoOnlyRevertsLocalEdits() throws Exception {
		SyncController controller = bind(false);
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();
		Transforms.insertText(document, Path.of(0, 0), 5, " World");
		eventloop.run();
		replica.transact(REMOTE, () -> replicaText(0, 0).insert(11, "!"));
		eventloop.run();
		assertEquals(singletonList(paragraph("Hello World!")), document.getChildren());
		replicaOrigins.clear();

		assertTrue(controller.undo());
		assertFalse(controller.isUndo());
		assertEquals(singletonList(paragraph("Hello!")), document.getChildren());
		assertEquals("Hello!", replicaText(0, 0).toString());
		assertEquals(1, replicaOrigins.size());

		assertTrue(controller.undo());
		assertTrue(document.getChildren().isEmpty());
		assertEquals(0, content.length());
		assertFalse(controller.canUndo());
		assertFalse(controller.undo());

		assertTrue(controller.redo());
		assertEquals(singletonList(paragraph("Hello!")), document.getChildren());
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));
		assertTrue(controller.canRedo());

		// the undo replays are not captured again as local edits
		eventloop.run();
		assertEquals(3, replicaOrigins.size());
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testUndoDisabled() {
		SyncController controller = SyncController.bind(document, content, metadata, options()
				.withPullInitialState(false)
				.withUndoEnabled(false));
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();

		assertNull(controller.getUndoManager());
		assertFalse(controller.canUndo());
		assertFalse(controller.undo());
		assertEquals(1, content.length());
	}

	@Test
	public void testMetadataWithoutMetadataRootFails() {
		SyncController.bind(document, content, null, options().withPullInitialState(false));
		Transforms.setMetadata(document, "theme", "dark");
		eventloop.run();

		assertEquals(1, errors.size());
		assertEquals(ErrorKind.LOCAL_APPLY, errors.get(0).getKind());
		assertTrue(errors.get(0).getCause() instanceof TranslationException);
		assertFalse(metadata.has("theme"));
	}

	@Test
	public void testFailedLocalBatchIsRolledBack() {
		document = DocumentSession.create(eventloop).withChildren(paragraph("Hello"));
		bind(false);

		Transforms.insertNode(document, Path.of(0), paragraph("New"));
		Transforms.insertText(document, Path.of(1, 0), 5, "!");
		eventloop.run();

		assertEquals(0, content.length());
		assertTrue(replicaOrigins.isEmpty());
		assertEquals(1, errors.size());
		assertEquals(ErrorKind.LOCAL_APPLY, errors.get(0).getKind());
	}

	@Test
	public void testDesyncedRemoteBatchIsReportedAndRecovered() throws Exception {
		replica.transact(null, () -> content.insert(0, singletonList(ReplicaNodes.toReplica(replica, paragraph("Shared")))));
		SyncController controller = bind(false);

		replica.transact(REMOTE, () -> replicaText(0, 0).insert(0, ">"));
		eventloop.run();

		assertEquals(1, errors.size());
		assertEquals(ErrorKind.REMOTE_APPLY, errors.get(0).getKind());
		assertTrue(document.getChildren().isEmpty());

		controller.pullFull();
		assertEquals(singletonList(paragraph(">Shared")), document.getChildren());
		assertEquals(document.getChildren(), ReplicaNodes.toNodes(content));
	}

	@Test
	public void testDoubleBindFails() {
		bind(false);
		try {
			bind(false);
			fail();
		} catch (BindingException e) {
			assertTrue(e.getMessage().contains("already bound"));
		}
	}

	@Test
	public void testClose() {
		SyncController controller = bind(false);
		Transforms.insertNode(document, Path.of(0), paragraph("Hello"));
		eventloop.run();

		controller.close();
		Transforms.insertText(document, Path.of(0, 0), 5, "!");
		replica.transact(REMOTE, () -> replicaText(0, 0).insert(0, ">"));
		eventloop.run();

		assertEquals(">Hello", replicaText(0, 0).toString());
		assertEquals(singletonList(paragraph("Hello!")), document.getChildren());
		assertFalse(controller.undo());
		assertSame(controller, document.getBinding());
	}

	@Test
	public void testTwoSessionsConverge() throws Exception {
		Object peer = "peer";
		MemoryReplicaDocument replicaA = MemoryReplicaDocument.create();
		MemoryReplicaDocument replicaB = MemoryReplicaDocument.create();
		replicaA.addUpdateListener((update, origin) -> {
			if (origin != peer) replicaB.applyUpdate(update, peer);
		});
		replicaB.addUpdateListener((update, origin) -> {
			if (origin != peer) replicaA.applyUpdate(update, peer);
		});

		DocumentSession alice = DocumentSession.create(eventloop);
		DocumentSession bob = DocumentSession.create(eventloop).withChildren(paragraph("Stale"));
		SyncController.bind(alice, replicaA.getArray("content"), replicaA.getMap("metadata"),
				options().withLocalOrigin("alice").withPullInitialState(false));
		SyncController bobController = SyncController.bind(bob, replicaB.getArray("content"), replicaB.getMap("metadata"),
				options().withLocalOrigin("bob"));

		Transforms.insertNode(alice, Path.of(0), paragraph("Hello"));
		eventloop.run();
		assertTrue(bobController.isInitialized());
		assertEquals(singletonList(paragraph("Hello")), bob.getChildren());

		Transforms.insertText(bob, Path.of(0, 0), 5, " World");
		Transforms.setMetadata(bob, "theme", "dark");
		eventloop.run();
		Transforms.setNode(alice, Path.of(0), "align", "center");
		Transforms.insertNode(alice, Path.of(1), paragraph("Second"));
		eventloop.run();
		Transforms.moveNode(bob, Path.of(1), Path.of(0));
		eventloop.run();

		List<Node> expected = asList(paragraph("Second"), paragraph("Hello World").withProperty("align", "center"));
		assertEquals(expected, alice.getChildren());
		assertEquals(expected, bob.getChildren());
		assertEquals(expected, ReplicaNodes.toNodes(replicaA.getArray("content")));
		assertEquals(expected, ReplicaNodes.toNodes(replicaB.getArray("content")));
		assertEquals(singletonMap("theme", "dark"), alice.getMetadata());
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testConcurrentEditsConvergeWhenDeliveredCrosswise() throws Exception {
		Object peer = "peer";
		MemoryReplicaDocument replicaA = MemoryReplicaDocument.create();
		MemoryReplicaDocument replicaB = MemoryReplicaDocument.create();
		List<byte[]> fromA = new ArrayList<>();
		List<byte[]> fromB = new ArrayList<>();
		replicaA.addUpdateListener((update, origin) -> {
			if (origin != peer) fromA.add(update);
		});
		replicaB.addUpdateListener((update, origin) -> {
			if (origin != peer) fromB.add(update);
		});

		DocumentSession alice = DocumentSession.create(eventloop);
		DocumentSession bob = DocumentSession.create(eventloop);
		SyncController.bind(alice, replicaA.getArray("content"), replicaA.getMap("metadata"),
				options().withLocalOrigin("alice").withPullInitialState(false));
		SyncController.bind(bob, replicaB.getArray("content"), replicaB.getMap("metadata"),
				options().withLocalOrigin("bob").withPullInitialState(false));

		Transforms.insertNode(alice, Path.of(0), paragraph("x"));
		eventloop.run();
		deliver(fromA, replicaB, peer);
		assertEquals(singletonList(paragraph("x")), bob.getChildren());

		// both edits are made before either side hears of the other
		Transforms.insertText(alice, Path.of(0, 0), 0, "A");
		Transforms.insertText(bob, Path.of(0, 0), 0, "B");
		eventloop.run();
		deliver(fromA, replicaB, peer);
		deliver(fromB, replicaA, peer);
		eventloop.run();

		assertEquals(alice.getChildren(), bob.getChildren());
		assertTrue(alice.getChildren().equals(singletonList(paragraph("ABx")))
				|| alice.getChildren().equals(singletonList(paragraph("BAx"))));
		assertEquals(alice.getChildren(), ReplicaNodes.toNodes(replicaA.getArray("content")));
		assertEquals(bob.getChildren(), ReplicaNodes.toNodes(replicaB.getArray("content")));
		assertTrue(errors.isEmpty());
	}

	@Test
	public void testUndoAfterRemoteInsertBeforeOwnText() throws Exception {
		replica.transact(null, () -> content.insert(0, singletonList(ReplicaNodes.toReplica(replica, paragraph("abQ")))));
		SyncController controller = bind(true);
		eventloop.run();
		assertEquals(singletonList(paragraph("abQ")), document.getChildren());

		Transforms.insertText(document, Path.of(0, 0), 3, "ab");
		eventloop.run();
		replica.transact(REMOTE, () -> replicaText(0, 0).insert(0, "Z"));
		eventloop.run();
		assertEquals(singletonList(paragraph("ZabQab")), document.getChildren());

		assertTrue(controller.undo());
		assertEquals(singletonList(paragraph("ZabQ")), document.getChildren());
		assertEquals("ZabQ", replicaText(0, 0).toString());
		assertTrue(errors.isEmpty());
	}

	private static void deliver(List<byte[]> updates, MemoryReplicaDocument target, Object origin) {
		for (byte[] update : updates) {
			target.applyUpdate(update, origin);
		}
		updates.clear();
	}

	private SyncController bind(boolean pullInitialState) {
		return SyncController.bind(document, content, metadata, options().withPullInitialState(pullInitialState));
	}

	private SyncOptions options() {
		return SyncOptions.create()
				.withLocalOrigin(LOCAL)
				.withErrorHandler(errors::add);
	}

	private ReplicaMap node(int... path) {
		ReplicaArray siblings = content;
		ReplicaMap node = null;
		for (int index : path) {
			if (node != null) siblings = (ReplicaArray) node.get("children");
			node = (ReplicaMap) siblings.get(index);
		}
		return node;
	}

	private ReplicaText replicaText(int... path) {
		return (ReplicaText) node(path).get("text");
	}

	private static Element paragraph(String text) {
		return Element.ofType("paragraph", Text.of(text));
	}
}
