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
import io.treesync.tree.Element;
import io.treesync.tree.Node;
import io.treesync.tree.Path;
import io.treesync.tree.Text;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.singletonList;

/**
 * Conversion between tree nodes and their replica representation, and resolution of
 * tree paths against the live replica.
 * <p>
 * A node is a map. An element's map holds its children under {@code children}, a text run's map
 * holds a shared text under {@code text}. Every other key is an attribute or a mark.
 */
final class ReplicaNodes {
	private ReplicaNodes() {
	}

	static Node toNode(Object value) throws TranslationException {
		if (!(value instanceof ReplicaMap)) {
			throw new TranslationException(ReplicaNodes.class, "Not a node: " + value);
		}
		ReplicaMap map = (ReplicaMap) value;
		Map<String, Object> properties = new LinkedHashMap<>();
		for (String key : map.keys()) {
			if (Node.isReservedKey(key)) continue;
			Object property = map.get(key);
			if (property instanceof ReplicaContainer) {
				throw new TranslationException(ReplicaNodes.class, "Property '" + key + "' is not a scalar");
			}
			properties.put(key, property);
		}
		Object children = map.get(Node.CHILDREN);
		if (children instanceof ReplicaArray) {
			return Element.of(properties, toNodes((ReplicaArray) children));
		}
		Object text = map.get(Node.TEXT);
		if (text instanceof ReplicaText) {
			return Text.of(text.toString(), properties);
		}
		throw new TranslationException(ReplicaNodes.class, "Node has neither children nor text: " + map.toMap());
	}

	static List<Node> toNodes(ReplicaArray array) throws TranslationException {
		List<Node> result = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			result.add(toNode(array.get(i)));
		}
		return result;
	}

	static Map<String, Object> toMetadata(ReplicaMap map) throws TranslationException {
		Map<String, Object> result = new LinkedHashMap<>();
		for (String key : map.keys()) {
			Object value = map.get(key);
			if (value instanceof ReplicaContainer) {
				throw new TranslationException(ReplicaNodes.class, "Metadata '" + key + "' is not a scalar");
			}
			result.put(key, value);
		}
		return result;
	}

	/**
	 * Builds a detached replica map for {@code node}, filled in before it is attached.
	 */
	static ReplicaMap toReplica(ReplicaDocument document, Node node) {
		ReplicaMap map = document.createMap();
		node.getProperties().forEach(map::set);
		if (node.isText()) {
			map.set(Node.TEXT, document.createText(((Text) node).getText()));
		} else {
			ReplicaArray children = document.createArray();
			for (Node child : ((Element) node).getChildren()) {
				children.insert(children.length(), singletonList(toReplica(document, child)));
			}
			map.set(Node.CHILDREN, children);
		}
		return map;
	}

	static ReplicaMap nodeAt(ReplicaArray content, Path path) throws TranslationException {
		if (path.isRoot()) {
			throw new TranslationException(ReplicaNodes.class, "Root has no node map");
		}
		ReplicaArray siblings = childrenAt(content, path.parent());
		int index = path.last();
		if (index >= siblings.length()) {
			throw new TranslationException(ReplicaNodes.class, "No node at " + path);
		}
		Object value = siblings.get(index);
		if (!(value instanceof ReplicaMap)) {
			throw new TranslationException(ReplicaNodes.class, "Not a node at " + path);
		}
		return (ReplicaMap) value;
	}

	/**
	 * Children sequence of the element at {@code path}, the content root itself for the root path.
	 */
	static ReplicaArray childrenAt(ReplicaArray content, Path path) throws TranslationException {
		if (path.isRoot()) return content;
		ReplicaArray children = childrenOf(nodeAt(content, path));
		if (children == null) {
			throw new TranslationException(ReplicaNodes.class, "Not an element at " + path);
		}
		return children;
	}

	@Nullable
	static ReplicaArray childrenOf(ReplicaMap node) {
		Object children = node.get(Node.CHILDREN);
		return children instanceof ReplicaArray ? (ReplicaArray) children : null;
	}

	@Nullable
	static ReplicaText textOf(ReplicaMap node) {
		Object text = node.get(Node.TEXT);
		return text instanceof ReplicaText ? (ReplicaText) text : null;
	}

	static ReplicaText textAt(ReplicaArray content, Path path) throws TranslationException {
		ReplicaText text = textOf(nodeAt(content, path));
		if (text == null) {
			throw new TranslationException(ReplicaNodes.class, "Not a text node at " + path);
		}
		return text;
	}
}
