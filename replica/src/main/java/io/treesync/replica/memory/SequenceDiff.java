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

import io.treesync.replica.event.Delta;

import java.util.ArrayList;
import java.util.List;

import static io.treesync.replica.memory.MemoryContainer.sameValue;

/**
 * Computes retain/insert/delete deltas between two states of a sequence.
 * Nested containers are compared by identity, scalars by value.
 */
final class SequenceDiff {
	private SequenceDiff() {
	}

	static List<Delta> diffText(String before, String after) {
		int prefix = 0;
		int max = Math.min(before.length(), after.length());
		while (prefix < max && before.charAt(prefix) == after.charAt(prefix)) {
			prefix++;
		}
		int suffix = 0;
		while (suffix < max - prefix
				&& before.charAt(before.length() - 1 - suffix) == after.charAt(after.length() - 1 - suffix)) {
			suffix++;
		}
		List<Delta> result = new ArrayList<>();
		int deleted = before.length() - prefix - suffix;
		String inserted = after.substring(prefix, after.length() - suffix);
		if (deleted == 0 && inserted.isEmpty()) return result;
		if (prefix > 0) result.add(Delta.retain(prefix));
		if (deleted > 0) result.add(Delta.delete(deleted));
		if (!inserted.isEmpty()) result.add(Delta.insertText(inserted));
		return result;
	}

	static List<Delta> diffArray(List<Object> before, List<Object> after) {
		int prefix = 0;
		int max = Math.min(before.size(), after.size());
		while (prefix < max && sameValue(before.get(prefix), after.get(prefix))) {
			prefix++;
		}
		int suffix = 0;
		while (suffix < max - prefix
				&& sameValue(before.get(before.size() - 1 - suffix), after.get(after.size() - 1 - suffix))) {
			suffix++;
		}
		List<Object> b = before.subList(prefix, before.size() - suffix);
		List<Object> a = after.subList(prefix, after.size() - suffix);

		List<Delta> result = new ArrayList<>();
		if (b.isEmpty() && a.isEmpty()) return result;
		DeltaBuilder builder = new DeltaBuilder(result);
		builder.retain(prefix);

		// longest common subsequence of the middle parts
		int[][] lcs = new int[b.size() + 1][a.size() + 1];
		for (int i = b.size() - 1; i >= 0; i--) {
			for (int j = a.size() - 1; j >= 0; j--) {
				lcs[i][j] = sameValue(b.get(i), a.get(j)) ?
						lcs[i + 1][j + 1] + 1 :
						Math.max(lcs[i + 1][j], lcs[i][j + 1]);
			}
		}
		int i = 0;
		int j = 0;
		while (i < b.size() || j < a.size()) {
			if (i < b.size() && j < a.size() && sameValue(b.get(i), a.get(j))) {
				builder.retain(1);
				i++;
				j++;
			} else if (i < b.size() && (j == a.size() || lcs[i + 1][j] >= lcs[i][j + 1])) {
				builder.delete();
				i++;
			} else {
				builder.insert(a.get(j));
				j++;
			}
		}
		builder.finish();
		return result;
	}

	private static final class DeltaBuilder {
		private final List<Delta> result;
		private int retained;
		private int deleted;
		private final List<Object> inserted = new ArrayList<>();

		DeltaBuilder(List<Delta> result) {
			this.result = result;
		}

		void retain(int length) {
			flushDeleted();
			flushInserted();
			retained += length;
		}

		void delete() {
			flushRetained();
			flushInserted();
			deleted++;
		}

		void insert(Object value) {
			flushRetained();
			flushDeleted();
			inserted.add(value);
		}

		// a trailing retain carries no information
		void finish() {
			flushDeleted();
			flushInserted();
		}

		private void flushRetained() {
			if (retained > 0) result.add(Delta.retain(retained));
			retained = 0;
		}

		private void flushDeleted() {
			if (deleted > 0) result.add(Delta.delete(deleted));
			deleted = 0;
		}

		private void flushInserted() {
			if (!inserted.isEmpty()) result.add(Delta.insert(inserted));
			inserted.clear();
		}
	}
}
