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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.treesync.common.Preconditions.checkArgument;
import static java.util.Arrays.asList;
import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableList;

public final class Element extends Node {
	final List<Node> children = new ArrayList<>();

	private Element() {
	}

	public static Element create() {
		return new Element();
	}

	public static Element of(Node... children) {
		return of(emptyMap(), asList(children));
	}

	public static Element of(Map<String, ?> properties, Node... children) {
		return of(properties, asList(children));
	}

	public static Element of(Map<String, ?> properties, List<? extends Node> children) {
		Element element = new Element();
		element.putProperties(properties);
		for (Node child : children) {
			element.children.add(child.copy());
		}
		return element;
	}

	/**
	 * Shortcut for the common {@code {"type": type, children}} element shape.
	 */
	public static Element ofType(String type, Node... children) {
		Element element = of(children);
		element.putProperty("type", type);
		return element;
	}

	public Element withProperty(String key, Object value) {
		putProperty(key, value);
		return this;
	}

	public List<Node> getChildren() {
		return unmodifiableList(children);
	}

	public int size() {
		return children.size();
	}

	public Node getChild(int index) {
		checkArgument(index >= 0 && index < children.size(), "No child at index %s", index);
		return children.get(index);
	}

	@Override
	public boolean isText() {
		return false;
	}

	@Override
	public Element copy() {
		return of(properties, children);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Element that = (Element) o;
		return children.equals(that.children) && properties.equals(that.properties);
	}

	@Override
	public int hashCode() {
		return 31 * children.hashCode() + properties.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{\"children\":").append(children);
		appendProperties(sb, properties);
		return sb.append('}').toString();
	}
}
