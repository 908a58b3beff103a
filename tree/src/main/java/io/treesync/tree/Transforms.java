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

import io.treesync.tree.operation.*;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.treesync.common.Preconditions.checkArgument;

/**
 * Editing commands that read the current state of a {@link DocumentSession} to build
 * fully populated operations and apply them.
 */
public final class Transforms {
	private Transforms() {
	}

	public static void insertText(DocumentSession session, Path path, int offset, String text) {
		if (text.isEmpty()) return;
		session.apply(new InsertTextOperation(path, offset, text));
	}

	public static void deleteText(DocumentSession session, Path path, int offset, int length) {
		if (length == 0) return;
		String text = session.getText(path).getText();
		checkArgument(offset >= 0 && offset + length <= text.length(),
				"Cannot delete %s characters at offset %s of '%s'", length, offset, text);
		session.apply(new RemoveTextOperation(path, offset, text.substring(offset, offset + length)));
	}

	public static void insertNode(DocumentSession session, Path path, Node node) {
		session.apply(new InsertNodeOperation(path, node));
	}

	public static void removeNode(DocumentSession session, Path path) {
		session.apply(new RemoveNodeOperation(path, session.getNode(path)));
	}

	/**
	 * Splits the node at {@code path}; the new right half keeps the properties of the original node.
	 */
	public static void splitNode(DocumentSession session, Path path, int position) {
		Node node = session.getNode(path);
		session.apply(new SplitNodeOperation(path, position, node.getProperties()));
	}

	/**
	 * Merges the node at {@code path} into its previous sibling.
	 */
	public static void mergeNode(DocumentSession session, Path path) {
		Node node = session.getNode(path);
		Node previous = session.getNode(path.previous());
		int position = previous.isText() ? ((Text) previous).length() : ((Element) previous).size();
		session.apply(new MergeNodeOperation(path, position, node.getProperties()));
	}

	public static void moveNode(DocumentSession session, Path path, Path newPath) {
		MoveNodeOperation operation = new MoveNodeOperation(path, newPath);
		if (operation.isNoop()) return;
		session.apply(operation);
	}

	/**
	 * Sets node properties; a {@code null} value removes the property.
	 */
	public static void setNode(DocumentSession session, Path path, Map<String, ?> newProperties) {
		Node node = session.getNode(path);
		session.apply(new SetNodeOperation(path, previousValues(node.getProperties(), newProperties), newProperties));
	}

	public static void setNode(DocumentSession session, Path path, String key, @Nullable Object value) {
		Map<String, Object> newProperties = new LinkedHashMap<>();
		newProperties.put(key, value);
		setNode(session, path, newProperties);
	}

	public static void setMetadata(DocumentSession session, Map<String, ?> newProperties) {
		session.apply(new SetMetadataOperation(previousValues(session.getMetadata(), newProperties), newProperties));
	}

	public static void setMetadata(DocumentSession session, String key, @Nullable Object value) {
		Map<String, Object> newProperties = new LinkedHashMap<>();
		newProperties.put(key, value);
		setMetadata(session, newProperties);
	}

	public static void select(DocumentSession session, @Nullable Selection selection) {
		session.apply(new SetSelectionOperation(session.getSelection(), selection));
	}

	private static Map<String, Object> previousValues(Map<String, Object> current, Map<String, ?> newProperties) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (String key : newProperties.keySet()) {
			result.put(key, current.get(key));
		}
		return result;
	}
}
