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

import java.util.Map;

import static io.treesync.common.Preconditions.checkNotNull;
import static io.treesync.common.Preconditions.checkPositionIndex;

public final class Text extends Node {
	private String text;

	private Text(String text) {
		this.text = checkNotNull(text);
	}

	public static Text of(String text) {
		return new Text(text);
	}

	public static Text of(String text, Map<String, ?> marks) {
		Text result = new Text(text);
		result.putProperties(marks);
		return result;
	}

	public Text withMark(String key, Object value) {
		putProperty(key, value);
		return this;
	}

	public String getText() {
		return text;
	}

	public int length() {
		return text.length();
	}

	public boolean hasSameMarks(Text other) {
		return properties.equals(other.properties);
	}

	void insertText(int offset, String inserted) {
		checkPositionIndex(offset, text.length(), "Text");
		text = text.substring(0, offset) + inserted + text.substring(offset);
	}

	void removeText(int offset, int length) {
		checkPositionIndex(offset, text.length(), "Text");
		checkPositionIndex(offset + length, text.length(), "Text");
		text = text.substring(0, offset) + text.substring(offset + length);
	}

	void setText(String text) {
		this.text = checkNotNull(text);
	}

	@Override
	public boolean isText() {
		return true;
	}

	@Override
	public Text copy() {
		return of(text, properties);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Text that = (Text) o;
		return text.equals(that.text) && properties.equals(that.properties);
	}

	@Override
	public int hashCode() {
		return 31 * text.hashCode() + properties.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{\"text\":\"").append(text).append('"');
		appendProperties(sb, properties);
		return sb.append('}').toString();
	}
}
