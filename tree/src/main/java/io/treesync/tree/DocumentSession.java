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

package io.treesync.tree;

import io.treesync.eventloop.Eventloop;
import io.treesync.tree.operation.*;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.treesync.common.Preconditions.*;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Editable document: an ordered tree of elements and text runs, a selection and a map of
 * document-level metadata.
 * <p>
 * Every change goes through {@link #apply(TreeOperation)}. Applied operations accumulate into a
 * batch that is handed to the {@link ChangeListener}s once, from a task posted to the eventloop,
 * or earlier if someone calls {@link #flush()}. After each operation the tree is normalized
 * unless normalization is switched off.
 */
public final class DocumentSession {
	private static final Logger logger = LoggerFactory.getLogger(DocumentSession.class);

	private static final int MAX_NORMALIZE_ITERATIONS = 1000;

	private final Eventloop eventloop;

	private final Element root = Element.create();
	private final Map<String, Object> metadata = new LinkedHashMap<>();
	@Nullable
	private Selection selection;

	private List<TreeOperation> operations = new ArrayList<>();
	private boolean changed;
	private boolean flushScheduled;

	private boolean normalizing = true;
	private boolean normalizeInProgress;

	private final List<ChangeListener> changeListeners = new ArrayList<>();

	@Nullable
	private Object binding;

	// region builders
	private DocumentSession(Eventloop eventloop) {
		this.eventloop = eventloop;
	}

	public static DocumentSession create() {
		return create(Eventloop.getCurrentEventloop());
	}

	public static DocumentSession create(Eventloop eventloop) {
		return new DocumentSession(checkNotNull(eventloop));
	}

	public DocumentSession withChildren(Node... children) {
		return withChildren(Arrays.asList(children));
	}

	public DocumentSession withChildren(List<? extends Node> children) {
		for (Node child : children) {
			root.children.add(child.copy());
		}
		return this;
	}

	public DocumentSession withMetadata(Map<String, ?> metadata) {
		metadata.forEach((key, value) -> {
			if (value != null) this.metadata.put(key, Node.canonicalValue(value));
		});
		return this;
	}

	public DocumentSession withChangeListener(ChangeListener listener) {
		addChangeListener(listener);
		return this;
	}
	// endregion

	public Eventloop getEventloop() {
		return eventloop;
	}

	public List<Node> getChildren() {
		return unmodifiableList(root.children);
	}

	/**
	 * Deep copy of the top-level nodes.
	 */
	public List<Node> snapshot() {
		List<Node> result = new ArrayList<>(root.children.size());
		for (Node child : root.children) {
			result.add(child.copy());
		}
		return result;
	}

	public Map<String, Object> getMetadata() {
		return unmodifiableMap(metadata);
	}

	@Nullable
	public Selection getSelection() {
		return selection;
	}

	@Nullable
	public Node findNode(Path path) {
		Node node = root;
		for (int level = 0; level < path.size(); level++) {
			if (node.isText()) return null;
			Element element = (Element) node;
			int index = path.get(level);
			if (index >= element.children.size()) return null;
			node = element.children.get(index);
		}
		return node;
	}

	public Node getNode(Path path) {
		Node node = findNode(path);
		checkArgument(node != null, "Cannot find a node at path %s", path);
		return node;
	}

	public Text getText(Path path) {
		Node node = getNode(path);
		checkArgument(node.isText(), "Node at path %s is not a text node", path);
		return (Text) node;
	}

	private Element getElement(Path path) {
		Node node = getNode(path);
		checkArgument(!node.isText(), "Node at path %s is not an element", path);
		return (Element) node;
	}

	// region binding
	@Nullable
	public Object getBinding() {
		return binding;
	}

	/**
	 * Attaches the single owner that keeps this session in sync with something else.
	 * A session can be bound once for its whole lifetime.
	 */
	public void setBinding(Object binding) {
		checkNotNull(binding);
		checkState(this.binding == null, "Document session is already bound to %s", this.binding);
		this.binding = binding;
	}
	// endregion

	// region listeners
	public void addChangeListener(ChangeListener listener) {
		changeListeners.add(checkNotNull(listener));
	}

	public void removeChangeListener(ChangeListener listener) {
		changeListeners.remove(listener);
	}

	/**
	 * Delivers the pending batch to the change listeners right away instead of waiting
	 * for the posted flush task.
	 */
	public void flush() {
		if (!changed) return;
		changed = false;
		List<TreeOperation> batch = unmodifiableList(operations);
		operations = new ArrayList<>();
		logger.trace("Flushing {} operations", batch.size());
		for (ChangeListener listener : new ArrayList<>(changeListeners)) {
			listener.onChange(batch);
		}
	}

	private void scheduleFlush() {
		changed = true;
		if (flushScheduled) return;
		flushScheduled = true;
		eventloop.post(() -> {
			flushScheduled = false;
			flush();
		});
	}
	// endregion

	// region normalization
	public boolean isNormalizing() {
		return normalizing;
	}

	public void setNormalizing(boolean normalizing) {
		this.normalizing = normalizing;
	}

	/**
	 * Runs {@code fn} with normalization switched off, then restores the previous setting and
	 * normalizes once if it was on.
	 */
	public void withoutNormalizing(Runnable fn) {
		boolean wasNormalizing = normalizing;
		normalizing = false;
		try {
			fn.run();
		} finally {
			normalizing = wasNormalizing;
		}
		normalize();
	}

	/**
	 * Repairs the tree until it satisfies the structural rules: every element other than the root has
	 * at least one child, and adjacent text runs neither share the same marks nor include an empty run.
	 * Each repair is an ordinary operation and becomes part of the current batch.
	 */
	public void normalize() {
		if (!normalizing || normalizeInProgress) return;
		normalizeInProgress = true;
		try {
			for (int i = 0; i < MAX_NORMALIZE_ITERATIONS; i++) {
				TreeOperation fix = findFix(root, Path.ROOT);
				if (fix == null) return;
				logger.trace("Normalizing with {}", fix);
				apply(fix);
			}
			throw new IllegalStateException("Could not normalize document in " + MAX_NORMALIZE_ITERATIONS + " iterations");
		} finally {
			normalizeInProgress = false;
		}
	}

	@Nullable
	private TreeOperation findFix(Element element, Path path) {
		if (element != root && element.children.isEmpty()) {
			return new InsertNodeOperation(path.child(0), Text.of(""));
		}
		for (int i = 0; i < element.children.size(); i++) {
			Node child = element.children.get(i);
			if (i > 0 && child.isText() && element.children.get(i - 1).isText()) {
				Text previous = (Text) element.children.get(i - 1);
				Text text = (Text) child;
				if (text.hasSameMarks(previous)) {
					return new MergeNodeOperation(path.child(i), previous.length(), text.properties);
				}
				if (previous.length() == 0) {
					return new RemoveNodeOperation(path.child(i - 1), previous);
				}
				if (text.length() == 0) {
					return new RemoveNodeOperation(path.child(i), text);
				}
			}
			if (!child.isText()) {
				TreeOperation fix = findFix((Element) child, path.child(i));
				if (fix != null) return fix;
			}
		}
		return null;
	}
	// endregion

	/**
	 * Replaces the whole content without producing operations. Operations still pending delivery
	 * refer to the old content and are dropped; listeners are notified with an empty batch.
	 */
	public void replaceContent(List<? extends Node> children) {
		operations = new ArrayList<>();
		root.children.clear();
		for (Node child : children) {
			root.children.add(child.copy());
		}
		selection = null;
		scheduleFlush();
	}

	public void replaceMetadata(Map<String, ?> newMetadata) {
		metadata.clear();
		withMetadata(newMetadata);
		scheduleFlush();
	}

	public void apply(TreeOperation operation) {
		checkNotNull(operation);
		logger.trace("Applying {}", operation);
		applyOperation(operation);
		operations.add(operation);
		scheduleFlush();
		normalize();
	}

	public void applyAll(List<? extends TreeOperation> operations) {
		for (TreeOperation operation : operations) {
			apply(operation);
		}
	}

	private void applyOperation(TreeOperation operation) {
		if (operation instanceof InsertTextOperation) {
			InsertTextOperation op = (InsertTextOperation) operation;
			getText(op.getPath()).insertText(op.getOffset(), op.getText());
		} else if (operation instanceof RemoveTextOperation) {
			RemoveTextOperation op = (RemoveTextOperation) operation;
			getText(op.getPath()).removeText(op.getOffset(), op.getText().length());
		} else if (operation instanceof InsertNodeOperation) {
			InsertNodeOperation op = (InsertNodeOperation) operation;
			Element parent = getElement(op.getPath().parent());
			int index = checkPositionIndex(op.getPath().last(), parent.children.size(), "Child");
			parent.children.add(index, op.getNode());
		} else if (operation instanceof RemoveNodeOperation) {
			RemoveNodeOperation op = (RemoveNodeOperation) operation;
			Element parent = getElement(op.getPath().parent());
			parent.children.remove(checkElementIndex(op.getPath().last(), parent.children.size(), "Child"));
		} else if (operation instanceof MergeNodeOperation) {
			applyMerge((MergeNodeOperation) operation);
		} else if (operation instanceof SplitNodeOperation) {
			applySplit((SplitNodeOperation) operation);
		} else if (operation instanceof MoveNodeOperation) {
			applyMove((MoveNodeOperation) operation);
		} else if (operation instanceof SetNodeOperation) {
			SetNodeOperation op = (SetNodeOperation) operation;
			Node node = getNode(op.getPath());
			applyProperties(node.properties, op.getProperties(), op.getNewProperties());
		} else if (operation instanceof SetSelectionOperation) {
			selection = ((SetSelectionOperation) operation).getNewSelection();
		} else if (operation instanceof SetMetadataOperation) {
			SetMetadataOperation op = (SetMetadataOperation) operation;
			applyProperties(metadata, op.getProperties(), op.getNewProperties());
		} else {
			throw new IllegalArgumentException("Unsupported operation " + operation);
		}
	}

	private void applyMerge(MergeNodeOperation op) {
		Path path = op.getPath();
		Node node = getNode(path);
		Node previous = getNode(path.previous());
		if (node.isText() && previous.isText()) {
			Text previousText = (Text) previous;
			previousText.insertText(previousText.length(), ((Text) node).getText());
		} else if (!node.isText() && !previous.isText()) {
			((Element) previous).children.addAll(((Element) node).children);
		} else {
			throw new IllegalArgumentException("Cannot merge " + node + " into " + previous + " at " + path);
		}
		getElement(path.parent()).children.remove(path.last());
	}

	private void applySplit(SplitNodeOperation op) {
		Path path = op.getPath();
		Node node = getNode(path);
		Element parent = getElement(path.parent());
		Node newNode;
		if (node.isText()) {
			Text text = (Text) node;
			int position = checkPositionIndex(op.getPosition(), text.length(), "Text");
			String after = text.getText().substring(position);
			text.setText(text.getText().substring(0, position));
			newNode = Text.of(after, op.getProperties());
		} else {
			Element element = (Element) node;
			int position = checkPositionIndex(op.getPosition(), element.children.size(), "Child");
			List<Node> tail = element.children.subList(position, element.children.size());
			Element newElement = Element.create();
			newElement.putProperties(op.getProperties());
			newElement.children.addAll(tail);
			tail.clear();
			newNode = newElement;
		}
		parent.children.add(path.last() + 1, newNode);
	}

	private void applyMove(MoveNodeOperation op) {
		if (op.isNoop()) return;
		Path path = op.getPath();
		Element parent = getElement(path.parent());
		int index = checkElementIndex(path.last(), parent.children.size(), "Child");
		Node node = parent.children.remove(index);
		try {
			Path truePath = Path.movedPath(path, op.getNewPath());
			Element newParent = getElement(truePath.parent());
			newParent.children.add(checkPositionIndex(truePath.last(), newParent.children.size(), "Child"), node);
		} catch (RuntimeException e) {
			parent.children.add(index, node);
			throw e;
		}
	}

	private static void applyProperties(Map<String, Object> target, Map<String, Object> properties, Map<String, Object> newProperties) {
		newProperties.forEach((key, value) -> {
			checkArgument(!Node.isReservedKey(key), "Property key '%s' is reserved", key);
			if (value == null) {
				target.remove(key);
			} else {
				target.put(key, Node.canonicalValue(value));
			}
		});
		for (String key : properties.keySet()) {
			if (!newProperties.containsKey(key)) {
				target.remove(key);
			}
		}
	}

	@Override
	public String toString() {
		return "DocumentSession{" + root.children + (metadata.isEmpty() ? "" : ", metadata=" + metadata) + '}';
	}
}
