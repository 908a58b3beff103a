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

import io.treesync.replica.*;
import io.treesync.tree.Node;
import io.treesync.tree.Path;
import io.treesync.tree.operation.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.treesync.sync.ReplicaNodes.*;
import static java.util.Collections.singletonList;

/**
 * Mirrors a batch of local tree operations into the replica, one transaction per batch.
 * <p>
 * Each operation kind is handled by an {@link OperationHandler} registered for its class. Paths are
 * resolved against the live replica when the handler runs, so an operation sees the effect of the
 * operations before it in the same batch.
 */
public final class OperationTranslator {
	private static final Logger logger = LoggerFactory.getLogger(OperationTranslator.class);

	@FunctionalInterface
	public interface OperationHandler<O extends TreeOperation> {
		void apply(SyncSession session, O operation) throws TranslationException;
	}

	private final Map<Class<?>, OperationHandler<TreeOperation>> handlers = new HashMap<>();

	private OperationTranslator() {
	}

	public static OperationTranslator create() {
		return new OperationTranslator();
	}

	public static OperationTranslator createDefault() {
		return create()
				.withHandler(InsertTextOperation.class, OperationTranslator::insertText)
				.withHandler(RemoveTextOperation.class, OperationTranslator::removeText)
				.withHandler(InsertNodeOperation.class, OperationTranslator::insertNode)
				.withHandler(RemoveNodeOperation.class, OperationTranslator::removeNode)
				.withHandler(SplitNodeOperation.class, OperationTranslator::splitNode)
				.withHandler(MergeNodeOperation.class, OperationTranslator::mergeNode)
				.withHandler(MoveNodeOperation.class, OperationTranslator::moveNode)
				.withHandler(SetNodeOperation.class, OperationTranslator::setNode)
				.withHandler(SetSelectionOperation.class, (session, op) -> {})
				.withHandler(SetMetadataOperation.class, OperationTranslator::setMetadata);
	}

	@SuppressWarnings("unchecked")
	public <O extends TreeOperation> OperationTranslator withHandler(Class<O> operationType, OperationHandler<? super O> handler) {
		handlers.put(operationType, (OperationHandler<TreeOperation>) handler);
		return this;
	}

	/**
	 * Applies {@code operations} inside a single replica transaction tagged with the session's local
	 * origin. If any operation fails the transaction is rolled back and nothing reaches the replica.
	 */
	public TranslationResult apply(SyncSession session, List<? extends TreeOperation> operations) {
		try {
			session.getReplicaDocument().transact(session.getLocalOrigin(), () -> {
				for (TreeOperation operation : operations) {
					OperationHandler<TreeOperation> handler = handlers.get(operation.getClass());
					if (handler == null) {
						throw new TranslationException(OperationTranslator.class, "Unsupported operation " + operation);
					}
					logger.trace("Translating {}", operation);
					handler.apply(session, operation);
				}
			});
			return TranslationResult.success();
		} catch (TranslationException | RuntimeException e) {
			return TranslationResult.failure(ErrorKind.LOCAL_APPLY, e);
		}
	}

	// region handlers
	private static void insertText(SyncSession session, InsertTextOperation op) throws TranslationException {
		ReplicaText text = textAt(session.getContent(), op.getPath());
		if (op.getOffset() > text.length()) {
			throw new TranslationException(OperationTranslator.class,
					"Offset " + op.getOffset() + " is out of text bounds at " + op.getPath());
		}
		text.insert(op.getOffset(), op.getText());
	}

	private static void removeText(SyncSession session, RemoveTextOperation op) throws TranslationException {
		ReplicaText text = textAt(session.getContent(), op.getPath());
		if (op.getOffset() + op.getText().length() > text.length()) {
			throw new TranslationException(OperationTranslator.class,
					"Removed range is out of text bounds at " + op.getPath());
		}
		if (!op.getText().isEmpty()) {
			text.delete(op.getOffset(), op.getText().length());
		}
	}

	private static void insertNode(SyncSession session, InsertNodeOperation op) throws TranslationException {
		Path path = op.getPath();
		ReplicaArray siblings = childrenAt(session.getContent(), path.parent());
		if (path.last() > siblings.length()) {
			throw new TranslationException(OperationTranslator.class, "Cannot insert a node at " + path);
		}
		siblings.insert(path.last(), singletonList(toReplica(session.getReplicaDocument(), op.getNode())));
	}

	private static void removeNode(SyncSession session, RemoveNodeOperation op) throws TranslationException {
		Path path = op.getPath();
		nodeAt(session.getContent(), path);
		childrenAt(session.getContent(), path.parent()).delete(path.last(), 1);
	}

	private static void splitNode(SyncSession session, SplitNodeOperation op) throws TranslationException {
		Path path = op.getPath();
		ReplicaDocument document = session.getReplicaDocument();
		ReplicaMap node = nodeAt(session.getContent(), path);
		ReplicaMap newNode = document.createMap();
		op.getProperties().forEach(newNode::set);

		ReplicaText text = textOf(node);
		if (text != null) {
			int position = op.getPosition();
			if (position > text.length()) {
				throw new TranslationException(OperationTranslator.class, "Split position " + position + " is out of bounds at " + path);
			}
			String content = text.toString();
			newNode.set(Node.TEXT, document.createText(content.substring(position)));
			if (position < content.length()) {
				text.delete(position, content.length() - position);
			}
		} else {
			ReplicaArray children = childrenOf(node);
			if (children == null || op.getPosition() > children.length()) {
				throw new TranslationException(OperationTranslator.class, "Cannot split node at " + path);
			}
			ReplicaArray tail = document.createArray();
			List<Object> moved = new ArrayList<>();
			for (int i = op.getPosition(); i < children.length(); i++) {
				moved.add(cloneValue(children.get(i)));
			}
			if (!moved.isEmpty()) {
				tail.insert(0, moved);
				children.delete(op.getPosition(), moved.size());
			}
			newNode.set(Node.CHILDREN, tail);
		}
		childrenAt(session.getContent(), path.parent()).insert(path.last() + 1, singletonList(newNode));
	}

	private static void mergeNode(SyncSession session, MergeNodeOperation op) throws TranslationException {
		Path path = op.getPath();
		if (path.last() == 0) {
			throw new TranslationException(OperationTranslator.class, "Node at " + path + " has no previous sibling");
		}
		ReplicaMap node = nodeAt(session.getContent(), path);
		ReplicaMap previous = nodeAt(session.getContent(), path.previous());

		ReplicaText text = textOf(node);
		ReplicaText previousText = textOf(previous);
		ReplicaArray children = childrenOf(node);
		ReplicaArray previousChildren = childrenOf(previous);
		if (text != null && previousText != null) {
			previousText.insert(previousText.length(), text.toString());
		} else if (children != null && previousChildren != null) {
			List<Object> moved = new ArrayList<>(children.length());
			for (int i = 0; i < children.length(); i++) {
				moved.add(cloneValue(children.get(i)));
			}
			if (!moved.isEmpty()) {
				previousChildren.insert(previousChildren.length(), moved);
			}
		} else {
			throw new TranslationException(OperationTranslator.class, "Cannot merge nodes of different kinds at " + path);
		}
		childrenAt(session.getContent(), path.parent()).delete(path.last(), 1);
	}

	private static void moveNode(SyncSession session, MoveNodeOperation op) throws TranslationException {
		if (op.isNoop()) return;
		Path path = op.getPath();
		if (path.isAncestorOf(op.getNewPath())) {
			throw new TranslationException(OperationTranslator.class, "Cannot move node at " + path + " into itself");
		}
		ReplicaMap clone = nodeAt(session.getContent(), path).deepClone();
		childrenAt(session.getContent(), path.parent()).delete(path.last(), 1);

		Path newPath = Path.movedPath(path, op.getNewPath());
		ReplicaArray siblings = childrenAt(session.getContent(), newPath.parent());
		if (newPath.last() > siblings.length()) {
			throw new TranslationException(OperationTranslator.class, "Cannot move a node to " + op.getNewPath());
		}
		siblings.insert(newPath.last(), singletonList(clone));
	}

	private static void setNode(SyncSession session, SetNodeOperation op) throws TranslationException {
		applyProperties(nodeAt(session.getContent(), op.getPath()), op.getProperties(), op.getNewProperties());
	}

	private static void setMetadata(SyncSession session, SetMetadataOperation op) throws TranslationException {
		ReplicaMap metadata = session.getMetadata();
		if (metadata == null) {
			throw new TranslationException(OperationTranslator.class, "No metadata container is bound");
		}
		applyProperties(metadata, op.getProperties(), op.getNewProperties());
	}
	// endregion

	private static void applyProperties(ReplicaMap target, Map<String, Object> properties, Map<String, Object> newProperties) throws TranslationException {
		for (Map.Entry<String, Object> entry : newProperties.entrySet()) {
			String key = entry.getKey();
			if (Node.isReservedKey(key)) {
				throw new TranslationException(OperationTranslator.class, "Property key '" + key + "' is reserved");
			}
			if (entry.getValue() == null) {
				if (target.has(key)) target.delete(key);
			} else {
				target.set(key, entry.getValue());
			}
		}
		for (String key : properties.keySet()) {
			if (!newProperties.containsKey(key) && target.has(key)) {
				target.delete(key);
			}
		}
	}

	private static Object cloneValue(Object value) {
		return value instanceof ReplicaContainer ? ((ReplicaContainer) value).deepClone() : value;
	}
}
