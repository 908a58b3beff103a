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
import io.treesync.replica.event.*;
import io.treesync.replica.memory.MemoryReplicaDocument;
import io.treesync.test.EventloopRule;
import io.treesync.tree.DocumentSession;
import io.treesync.tree.Element;
import io.treesync.tree.Text;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static org.junit.Assert.*;

public final class EventTranslatorTest {
	@Rule
	public final EventloopRule eventloopRule = new EventloopRule();

	private final EventTranslator translator = EventTranslator.createDefault();
	private MemoryReplicaDocument replica;
	private ReplicaArray content;
	private DocumentSession document;
	private SyncSession session;

	@Before
	public void setUp() {
		replica = MemoryReplicaDocument.create();
		content = replica.getArray("content");
		replica.transact(null, () -> content.insert(0, singletonList(ReplicaNodes.toReplica(replica, paragraph("Hello")))));
		document = DocumentSession.create(Eventloop.getCurrentEventloop()).withChildren(paragraph("Hello"));
		session = new SyncSession(document, content, null, new SyncFlags(Runnable::run), "local");
	}

	@Test
	public void testTextDelta() {
		TextEvent event = new TextEvent(replica.createText(""), Arrays.<Object>asList(0, "children", 0, "text"),
				asList(Delta.retain(1), Delta.delete(3), Delta.insertText("ipp")));

		TranslationResult result = translator.apply(session, singletonList(event), ErrorKind.REMOTE_APPLY);

		assertTrue(result.isSuccess());
		assertEquals(singletonList(paragraph("Hippo")), document.getChildren());
	}

	@Test
	public void testNormalizationIsRestoredWithoutNormalizing() {
		ReplicaMap emptyParagraph = replica.createMap();
		emptyParagraph.set("children", replica.createArray());
		ArrayEvent event = new ArrayEvent(content, Collections.emptyList(),
				asList(Delta.retain(1), Delta.insert(singletonList(emptyParagraph))));

		TranslationResult result = translator.apply(session, singletonList(event), ErrorKind.REMOTE_APPLY);

		assertTrue(result.isSuccess());
		assertTrue(document.isNormalizing());
		assertEquals(asList(paragraph("Hello"), Element.create()), document.getChildren());
	}

	@Test
	public void testMissingLocalNodeFailsWithGivenKind() {
		TextEvent event = new TextEvent(replica.createText(""), Arrays.<Object>asList(3, "children", 0, "text"),
				singletonList(Delta.insertText("!")));

		TranslationResult result = translator.apply(session, singletonList(event), ErrorKind.UNDO_APPLY);

		assertFalse(result.isSuccess());
		assertEquals(ErrorKind.UNDO_APPLY, result.getKind());
		assertTrue(result.getCause() instanceof TranslationException);
	}

	@Test
	public void testFailureKeepsEarlierEvents() {
		List<ReplicaEvent> events = asList(
				new TextEvent(replica.createText(""), Arrays.<Object>asList(0, "children", 0, "text"), singletonList(Delta.insertText(">"))),
				new TextEvent(replica.createText(""), Arrays.<Object>asList(0, "children", 0, "text"), asList(Delta.retain(100), Delta.delete(1))));

		TranslationResult result = translator.apply(session, events, ErrorKind.REMOTE_APPLY);

		assertFalse(result.isSuccess());
		assertEquals(singletonList(paragraph(">Hello")), document.getChildren());
	}

	@Test
	public void testUnknownPathShape() {
		MapEvent event = new MapEvent(replica.createMap(), Arrays.<Object>asList(0, "children"), Collections.emptyMap());

		assertEquals(ErrorKind.REMOTE_APPLY, translator.apply(session, singletonList(event), ErrorKind.REMOTE_APPLY).getKind());
	}

	private static Element paragraph(String text) {
		return Element.ofType("paragraph", Text.of(text));
	}
}
