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

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

/**
 * Primitive mutation of a single container. An op can be reverted exactly, which is what rollback does,
 * and undone, which is what the undo history replays: undoing finds the affected items by identity and
 * compensates with new ops, leaving changes made since by others in place.
 */
abstract class MemoryOp {
	abstract MemoryContainer target();

	/**
	 * Mutates the target without any bookkeeping.
	 */
	abstract void apply();

	abstract void revert();

	abstract void encode(List<ReplicaUpdate.Op> out);

	/**
	 * Performs the ops that take back the effect of this op, if it still has any.
	 */
	abstract void undo(MemoryReplicaDocument document);

	/**
	 * Containers this op nests into its target.
	 */
	List<MemoryContainer> nestedContainers() {
		return emptyList();
	}

	static final class SequenceInsert extends MemoryOp {
		final MemorySequence sequence;
		final List<MemoryItem> elements;

		SequenceInsert(MemorySequence sequence, List<MemoryItem> elements) {
			this.sequence = sequence;
			this.elements = elements;
		}

		@Override
		MemorySequence target() {
			return sequence;
		}

		@Override
		void apply() {
			for (MemoryItem element : elements) {
				sequence.document.register(element);
				sequence.integrate(element);
				if (element.nested() != null) {
					element.nested().holder = element;
				}
			}
		}

		@Override
		void revert() {
			for (int i = elements.size() - 1; i >= 0; i--) {
				MemoryItem element = elements.get(i);
				sequence.remove(element);
				sequence.document.unregister(element);
				if (element.nested() != null) {
					element.nested().holder = null;
				}
			}
		}

		@Override
		void encode(List<ReplicaUpdate.Op> out) {
			sequence.encodeElements(elements, out);
		}

		@Override
		void undo(MemoryReplicaDocument document) {
			Map<MemorySequence, List<MemoryItem>> live = new LinkedHashMap<>();
			for (MemoryItem element : elements) {
				MemoryItem current = document.resolve(element);
				if (!current.deleted) {
					live.computeIfAbsent((MemorySequence) current.owner, $ -> new ArrayList<>()).add(current);
				}
			}
			live.forEach((owner, items) -> document.perform(new SequenceDelete(owner, items)));
		}

		@Override
		List<MemoryContainer> nestedContainers() {
			List<MemoryContainer> result = new ArrayList<>();
			for (MemoryItem element : elements) {
				if (element.nested() != null) result.add(element.nested());
			}
			return result;
		}

		@Override
		public String toString() {
			return "insert(" + elements + ')';
		}
	}

	static final class SequenceDelete extends MemoryOp {
		final MemorySequence sequence;
		final List<MemoryItem> elements;

		/**
		 * @param elements visible elements of {@code sequence}
		 */
		SequenceDelete(MemorySequence sequence, List<MemoryItem> elements) {
			this.sequence = sequence;
			this.elements = elements;
		}

		@Override
		MemorySequence target() {
			return sequence;
		}

		@Override
		void apply() {
			for (MemoryItem element : elements) {
				element.deleted = true;
			}
		}

		@Override
		void revert() {
			for (MemoryItem element : elements) {
				element.deleted = false;
			}
		}

		@Override
		void encode(List<ReplicaUpdate.Op> out) {
			List<ItemId> ids = new ArrayList<>(elements.size());
			for (MemoryItem element : elements) {
				ids.add(element.id);
			}
			out.add(ReplicaUpdate.Op.delete(sequence, ids));
		}

		@Override
		void undo(MemoryReplicaDocument document) {
			for (MemoryItem element : elements) {
				MemoryItem current = document.resolve(element);
				if (current.deleted) {
					restore(document, current);
				}
			}
		}

		/**
		 * Inserts a copy of a deleted element right after its tombstone, or, if its sequence has been
		 * restored as a copy since, after the nearest element that has a counterpart in that copy.
		 */
		private static void restore(MemoryReplicaDocument document, MemoryItem deleted) {
			MemorySequence owner = (MemorySequence) deleted.owner;
			MemorySequence target = (MemorySequence) document.resolveContainer(owner);
			ItemId origin = target == owner ? deleted.id : target.counterpartOrigin(owner, deleted);
			MemoryItem restored = MemoryItem.element(document.nextId(), target, origin, document.restoreValue(deleted.value));
			document.redirect(deleted, restored);
			document.perform(new SequenceInsert(target, singletonList(restored)));
		}

		@Override
		public String toString() {
			return "delete(" + elements.size() + ')';
		}
	}

	static final class MapSet extends MemoryOp {
		final MemoryMap map;
		final MemoryItem entry;

		@Nullable
		private MemoryItem previous;
		private boolean previousDeleted;
		private boolean won;

		MapSet(MemoryMap map, MemoryItem entry) {
			this.map = map;
			this.entry = entry;
		}

		@Override
		MemoryMap target() {
			return map;
		}

		@Override
		void apply() {
			map.document.register(entry);
			map.entries.add(entry);
			if (entry.nested() != null) {
				entry.nested().holder = entry;
			}
			String key = entry.key;
			previous = map.current.get(key);
			won = previous == null || entry.id.compareTo(previous.id) > 0;
			if (won) {
				map.current.put(key, entry);
				if (previous != null) {
					previousDeleted = previous.deleted;
					previous.deleted = true;
				}
			} else {
				entry.deleted = true;
			}
		}

		@Override
		void revert() {
			if (won) {
				if (previous != null) {
					map.current.put(entry.key, previous);
					previous.deleted = previousDeleted;
				} else {
					map.current.remove(entry.key);
				}
			} else {
				entry.deleted = false;
			}
			map.entries.remove(entry);
			map.document.unregister(entry);
			if (entry.nested() != null) {
				entry.nested().holder = null;
			}
		}

		@Override
		void encode(List<ReplicaUpdate.Op> out) {
			map.encodeEntry(entry, out);
		}

		@Override
		void undo(MemoryReplicaDocument document) {
			MemoryItem current = document.resolve(entry);
			if (current.deleted) return;
			MemoryMap owner = (MemoryMap) current.owner;
			if (won && previous != null && !previousDeleted) {
				MemoryItem restored = MemoryItem.entry(document.nextId(), owner, previous.key, document.restoreValue(previous.value));
				document.redirect(previous, restored);
				document.perform(new MapSet(owner, restored));
			} else {
				document.perform(new MapDelete(owner, current));
			}
		}

		@Override
		List<MemoryContainer> nestedContainers() {
			return entry.nested() != null ? singletonList(entry.nested()) : emptyList();
		}

		@Override
		public String toString() {
			return "mapSet(" + entry + ')';
		}
	}

	static final class MapDelete extends MemoryOp {
		final MemoryMap map;
		final MemoryItem entry;

		/**
		 * @param entry current visible entry of {@code map}
		 */
		MapDelete(MemoryMap map, MemoryItem entry) {
			this.map = map;
			this.entry = entry;
		}

		@Override
		MemoryMap target() {
			return map;
		}

		@Override
		void apply() {
			entry.deleted = true;
		}

		@Override
		void revert() {
			entry.deleted = false;
		}

		@Override
		void encode(List<ReplicaUpdate.Op> out) {
			out.add(ReplicaUpdate.Op.mapDelete(map, entry.id, entry.key));
		}

		@Override
		void undo(MemoryReplicaDocument document) {
			MemoryItem deleted = document.resolve(entry);
			MemoryMap owner = (MemoryMap) document.resolveContainer(deleted.owner);
			boolean untouched = owner == deleted.owner ?
					owner.current.get(deleted.key) == deleted && deleted.deleted :
					!owner.has(deleted.key);
			if (!untouched) return;
			MemoryItem restored = MemoryItem.entry(document.nextId(), owner, deleted.key, document.restoreValue(deleted.value));
			document.redirect(deleted, restored);
			document.perform(new MapSet(owner, restored));
		}

		@Override
		public String toString() {
			return "mapDelete(" + entry.key + ')';
		}
	}
}
