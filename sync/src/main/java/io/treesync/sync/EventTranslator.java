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

import io.treesync.replica.event.*;
import io.treesync.tree.DocumentSession;
import io.treesync.tree.Node;
import io.treesync.tree.Path;
import io.treesync.tree.operation.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.treesync.sync.ReplicaNodes.toNode;

/**
 * Mirrors a batch of replica events into the local tree as ordinary tree operations.
 * Normalization is off while the batch is applied, so the tree ends up exactly as the replica.
 * <p>
 * A failure leaves the operations applied so far in place.
 */
public final class EventTranslator {
	private static final Logger logger = LoggerFactory.getLogger(EventTranslator.class);

	@FunctionalInterface
	public interface EventHandler<E extends ReplicaEvent> {
		void apply(SyncSession session, E event) throws TranslationException;
	}

	private final Map<Class<?>, EventHandler<ReplicaEvent>> handlers = new HashMap<>();

	private EventTranslator() {
	}

	public static EventTranslator create() {
		return new EventTranslator();
	}

	public static EventTranslator createDefault() {
		return create()
				.withHandler(ArrayEvent.class, EventTranslator::applyArrayEvent)
				.withHandler(MapEvent.class, EventTranslator::applyMapEvent)
				.withHandler(TextEvent.class, EventTranslator::applyTextEvent);
	}

	@SuppressWarnings("unchecked")
	public <E extends ReplicaEvent> EventTranslator withHandler(Class<E> eventType, EventHandler<? super E> handler) {
		handlers.put(eventType, (EventHandler<ReplicaEvent>) handler);
		return this;
	}

	public TranslationResult apply(SyncSession session, List<ReplicaEvent> events, ErrorKind failureKind) {
		DocumentSession document = session.getDocument();
		boolean wasNormalizing = document.isNormalizing();
		document.setNormalizing(false);
		try {
			for (ReplicaEvent event : events) {
				EventHandler<ReplicaEvent> handler = handlers.get(event.getClass());
				if (handler == null) {
					throw new TranslationException(EventTranslator.class, "Unsupported event " + event);
				}
				logger.trace("Translating {}", event);
				handler.apply(session, event);
			}
			return TranslationResult.success();
		} catch (TranslationException | RuntimeException e) {
			return TranslationResult.failure(failureKind, e);
		} finally {
			document.setNormalizing(wasNormalizing);
		}
	}

	// region handlers
	private static void applyArrayEvent(SyncSession session, ArrayEvent event) throws TranslationException {
		List<Object> eventPath = event.getPath();
		if (eventPath.size() % 2 != 0 || (!eventPath.isEmpty() && !Node.CHILDREN.equals(eventPath.get(eventPath.size() - 1)))) {
			throw new TranslationException(EventTranslator.class, "Not a children sequence: " + eventPath);
		}
		Path parentPath = eventPath.isEmpty() ? Path.ROOT : toTreePath(eventPath, eventPath.size() - 1);
		DocumentSession document = session.getDocument();
		Node parent = document.findNode(parentPath);
		if (parent == null || parent.isText()) {
			throw new TranslationException(EventTranslator.class, "No local element at " + parentPath);
		}

		int index = 0;
		for (Delta delta : event.getDelta()) {
			switch (delta.getKind()) {
				case RETAIN:
					index += delta.getLength();
					break;
				case DELETE:
					for (int i = 0; i < delta.getLength(); i++) {
						Path path = parentPath.child(index);
						Node node = document.findNode(path);
						if (node == null) {
							throw new TranslationException(EventTranslator.class, "No local node to remove at " + path);
						}
						document.apply(new RemoveNodeOperation(path, node));
					}
					break;
				case INSERT:
					//noinspection ConstantConditions
					for (Object value : delta.getValues()) {
						document.apply(new InsertNodeOperation(parentPath.child(index), toNode(value)));
						index++;
					}
					break;
			}
		}
	}

	private static void applyMapEvent(SyncSession session, MapEvent event) throws TranslationException {
		if (event.getTarget() == session.getMetadata()) {
			applyMetadataEvent(session, event);
			return;
		}
		List<Object> eventPath = event.getPath();
		if (eventPath.size() % 2 != 1) {
			throw new TranslationException(EventTranslator.class, "Not a node: " + eventPath);
		}
		Path path = toTreePath(eventPath, eventPath.size());
		DocumentSession document = session.getDocument();
		Node node = document.findNode(path);
		if (node == null) {
			throw new TranslationException(EventTranslator.class, "No local node at " + path);
		}

		Map<String, KeyChange> keyChanges = event.getKeyChanges();
		if (keyChanges.containsKey(Node.CHILDREN) || keyChanges.containsKey(Node.TEXT)) {
			// the node changed its kind or its content was swapped, rebuild it
			Node replacement = toNode(event.getTarget());
			document.apply(new RemoveNodeOperation(path, node));
			document.apply(new InsertNodeOperation(path, replacement));
			return;
		}

		Map<String, Object> properties = new LinkedHashMap<>();
		Map<String, Object> newProperties = new LinkedHashMap<>();
		collectChanges(event, properties, newProperties);
		document.apply(new SetNodeOperation(path, properties, newProperties));
	}

	private static void applyMetadataEvent(SyncSession session, MapEvent event) {
		Map<String, Object> properties = new LinkedHashMap<>();
		Map<String, Object> newProperties = new LinkedHashMap<>();
		collectChanges(event, properties, newProperties);
		session.getDocument().apply(new SetMetadataOperation(properties, newProperties));
	}

	private static void applyTextEvent(SyncSession session, TextEvent event) throws TranslationException {
		List<Object> eventPath = event.getPath();
		if (eventPath.size() < 2 || eventPath.size() % 2 != 0 || !Node.TEXT.equals(eventPath.get(eventPath.size() - 1))) {
			throw new TranslationException(EventTranslator.class, "Not a text: " + eventPath);
		}
		Path path = toTreePath(eventPath, eventPath.size() - 1);
		DocumentSession document = session.getDocument();
		Node node = document.findNode(path);
		if (node == null || !node.isText()) {
			throw new TranslationException(EventTranslator.class, "No local text at " + path);
		}

		int offset = 0;
		for (Delta delta : event.getDelta()) {
			switch (delta.getKind()) {
				case RETAIN:
					offset += delta.getLength();
					break;
				case INSERT:
					String inserted = delta.getText();
					if (inserted == null) {
						throw new TranslationException(EventTranslator.class, "Text delta without text at " + path);
					}
					if (offset > document.getText(path).length()) {
						throw new TranslationException(EventTranslator.class, "Insert offset " + offset + " is out of bounds at " + path);
					}
					document.apply(new InsertTextOperation(path, offset, inserted));
					offset += inserted.length();
					break;
				case DELETE:
					String current = document.getText(path).getText();
					if (offset + delta.getLength() > current.length()) {
						throw new TranslationException(EventTranslator.class, "Deleted range is out of bounds at " + path);
					}
					document.apply(new RemoveTextOperation(path, offset, current.substring(offset, offset + delta.getLength())));
					break;
			}
		}
	}
	// endregion

	private static void collectChanges(MapEvent event, Map<String, Object> properties, Map<String, Object> newProperties) {
		event.getKeyChanges().forEach((key, change) -> {
			if (change.getAction() != KeyChange.Action.ADD) {
				properties.put(key, change.getOldValue());
			}
			newProperties.put(key, change.getAction() == KeyChange.Action.DELETE ? null : event.getTarget().get(key));
		});
	}

	/**
	 * Converts the first {@code size} entries of a replica path, which alternate between an index
	 * and the {@code children} key, into a tree path.
	 */
	private static Path toTreePath(List<Object> eventPath, int size) throws TranslationException {
		int[] indices = new int[(size + 1) / 2];
		for (int i = 0; i < size; i++) {
			Object entry = eventPath.get(i);
			if (i % 2 == 0) {
				if (!(entry instanceof Integer)) {
					throw new TranslationException(EventTranslator.class, "Unexpected path entry " + entry + " in " + eventPath);
				}
				indices[i / 2] = (Integer) entry;
			} else if (!Node.CHILDREN.equals(entry)) {
				throw new TranslationException(EventTranslator.class, "Unexpected path entry " + entry + " in " + eventPath);
			}
		}
		return Path.of(indices);
	}
}
