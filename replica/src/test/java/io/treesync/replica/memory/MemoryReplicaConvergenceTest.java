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
import org.junit.Before;
import org.junit.Test;

import java.util.*;

import static io.treesync.replica.memory.MemoryReplicaDocumentTest.toPlain;
import static java.util.Collections.singletonList;
import static org.junit.Assert.*;

public final class MemoryReplicaConvergenceTest {
	private static final int RANDOM_SEED = 42;
	private static final int SITES = 3;
	private static final int RUNS = 10;
	private static final int EDITS_PER_RUN = 60;
	private static final int PERMUTATIONS_PER_RUN = 5;
	private static final List<String> KEYS = Arrays.asList("bold", "italic", "size");

	private final Random random = new Random(RANDOM_SEED);

	private MemoryReplicaDocument alice;
	private MemoryReplicaDocument bob;
	private final List<byte[]> fromAlice = new ArrayList<>();
	private final List<byte[]> fromBob = new ArrayList<>();

	@Before
	public void setUp() {
		alice = MemoryReplicaDocument.create().withClientId(1);
		bob = MemoryReplicaDocument.create().withClientId(2);
		alice.transact(null, () -> alice.getArray("content").insert(0, singletonList(leaf(alice, "x"))));
		bob.applyUpdate(alice.encodeStateAsUpdate(), "sync");
		alice.addUpdateListener((update, origin) -> {
			if (origin == null) fromAlice.add(update);
		});
		bob.addUpdateListener((update, origin) -> {
			if (origin == null) fromBob.add(update);
		});
	}

	@Test
	public void testConcurrentInsertsAtSamePosition() {
		text(alice, 0).insert(0, "A");
		text(bob, 0).insert(0, "B");
		exchange();

		assertEquals(text(alice, 0).toString(), text(bob, 0).toString());
		assertEquals(3, text(alice, 0).length());
		assertTrue(text(alice, 0).toString().endsWith("x"));
	}

	@Test
	public void testConcurrentRunsDoNotInterleave() {
		text(alice, 0).insert(1, "abc");
		text(bob, 0).insert(1, "123");
		exchange();

		String merged = text(alice, 0).toString();
		assertEquals(merged, text(bob, 0).toString());
		assertTrue(merged, merged.equals("xabc123") || merged.equals("x123abc"));
	}

	@Test
	public void testConcurrentMapSetsAgreeOnWinner() {
		node(alice, 0).set("size", 12);
		node(bob, 0).set("size", 14);
		exchange();

		assertEquals(node(alice, 0).get("size"), node(bob, 0).get("size"));
	}

	@Test
	public void testMapDeleteDoesNotRemoveConcurrentSet() {
		node(alice, 0).set("bold", true);
		bob.applyUpdate(fromAlice.remove(0), "alice");
		node(alice, 0).set("bold", false);
		node(bob, 0).delete("bold");
		exchange();

		assertEquals(false, node(alice, 0).get("bold"));
		assertEquals(false, node(bob, 0).get("bold"));
	}

	@Test
	public void testInsertIntoConcurrentlyDeletedText() {
		text(alice, 0).insert(1, "yz");
		bob.transact(null, () -> bob.getArray("content").delete(0, 1));
		exchange();

		assertEquals(0, alice.getArray("content").length());
		assertEquals(0, bob.getArray("content").length());
	}

	@Test
	public void testDeleteOfConcurrentlyDeletedRange() {
		text(alice, 0).insert(1, "abc");
		bob.applyUpdate(fromAlice.remove(0), "alice");
		text(alice, 0).delete(1, 2);
		text(bob, 0).delete(2, 2);
		exchange();

		assertEquals("x", text(alice, 0).toString());
		assertEquals("x", text(bob, 0).toString());
	}

	@Test
	public void testUpdatesDeliveredInReverseOrder() {
		text(alice, 0).insert(1, "a");
		text(alice, 0).insert(2, "b");
		alice.transact(null, () -> alice.getArray("content").insert(1, singletonList(leaf(alice, "second"))));
		node(alice, 1).set("bold", true);

		for (int i = fromAlice.size() - 1; i >= 0; i--) {
			bob.applyUpdate(fromAlice.get(i), "alice");
		}

		assertFalse(bob.hasPendingUpdates());
		assertEquals(toPlain(alice.getArray("content")), toPlain(bob.getArray("content")));
	}

	@Test
	public void testRandomEditsConvergeInAnyDeliveryOrder() {
		for (int run = 0; run < RUNS; run++) {
			List<MemoryReplicaDocument> sites = new ArrayList<>();
			List<byte[]> log = new ArrayList<>();
			for (int i = 0; i < SITES; i++) {
				MemoryReplicaDocument site = MemoryReplicaDocument.create().withClientId(10 + i);
				site.addUpdateListener((update, origin) -> {
					if (origin == null) log.add(update);
				});
				sites.add(site);
			}
			MemoryReplicaDocument first = sites.get(0);
			first.transact(null, () -> first.getArray("content").insert(0, singletonList(leaf(first, "seed"))));

			for (int edit = 0; edit < EDITS_PER_RUN; edit++) {
				MemoryReplicaDocument site = sites.get(random.nextInt(SITES));
				if (random.nextInt(4) == 0) {
					// catch up on a random part of what others did so far
					for (byte[] update : shuffledCopy(log)) {
						if (random.nextBoolean()) site.applyUpdate(update, "peer");
					}
				}
				randomEdit(site);
			}

			Object expected = null;
			for (MemoryReplicaDocument site : sites) {
				for (byte[] update : shuffledCopy(log)) {
					site.applyUpdate(update, "peer");
				}
				assertFalse(site.hasPendingUpdates());
				Object state = snapshot(site);
				if (expected == null) expected = state;
				assertEquals(expected, state);
			}
			for (int i = 0; i < PERMUTATIONS_PER_RUN; i++) {
				MemoryReplicaDocument late = MemoryReplicaDocument.create();
				for (byte[] update : shuffledCopy(log)) {
					late.applyUpdate(update, "peer");
				}
				assertEquals(expected, snapshot(late));
			}
		}
	}

	private void randomEdit(MemoryReplicaDocument site) {
		MemoryArray content = site.getArray("content");
		int choice = random.nextInt(10);
		if (content.length() == 0 || choice == 0) {
			site.transact(null, () -> content.insert(random.nextInt(content.length() + 1), singletonList(leaf(site, "n" + random.nextInt(10)))));
			return;
		}
		int index = random.nextInt(content.length());
		MemoryMap node = (MemoryMap) content.get(index);
		MemoryText text = (MemoryText) node.get("text");
		if (choice == 1 && content.length() > 1) {
			site.transact(null, () -> content.delete(index, 1));
		} else if (choice <= 3) {
			String key = KEYS.get(random.nextInt(KEYS.size()));
			if (node.has(key) && random.nextBoolean()) {
				node.delete(key);
			} else {
				node.set(key, random.nextInt(3));
			}
		} else if (choice <= 5 && text.length() > 0) {
			int start = random.nextInt(text.length());
			text.delete(start, 1 + random.nextInt(text.length() - start));
		} else {
			text.insert(random.nextInt(text.length() + 1), randomWord());
		}
	}

	private String randomWord() {
		StringBuilder sb = new StringBuilder();
		for (int i = 1 + random.nextInt(3); i > 0; i--) {
			sb.append((char) ('a' + random.nextInt(26)));
		}
		return sb.toString();
	}

	private List<byte[]> shuffledCopy(List<byte[]> updates) {
		List<byte[]> copy = new ArrayList<>(updates);
		Collections.shuffle(copy, new Random(random.nextLong()));
		return copy;
	}

	private void exchange() {
		for (byte[] update : fromBob) {
			alice.applyUpdate(update, "bob");
		}
		for (byte[] update : fromAlice) {
			bob.applyUpdate(update, "alice");
		}
		fromAlice.clear();
		fromBob.clear();
	}

	private static Object snapshot(MemoryReplicaDocument document) {
		return toPlain(document.getArray("content"));
	}

	private static MemoryMap node(MemoryReplicaDocument document, int index) {
		return (MemoryMap) document.getArray("content").get(index);
	}

	private static MemoryText text(MemoryReplicaDocument document, int index) {
		return (MemoryText) ((ReplicaMap) node(document, index)).get("text");
	}

	private static MemoryMap leaf(MemoryReplicaDocument document, String text) {
		MemoryMap node = document.createMap();
		node.set("text", document.createText(text));
		return node;
	}
}
