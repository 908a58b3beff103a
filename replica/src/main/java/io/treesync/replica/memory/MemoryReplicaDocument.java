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

import io.treesync.common.time.CurrentTimeProvider;
import io.treesync.replica.*;
import io.treesync.replica.event.ReplicaEvent;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

import static io.treesync.common.Preconditions.*;
import static java.util.Collections.unmodifiableList;
import static java.util.Comparator.comparingInt;

/**
 * In-memory {@link ReplicaDocument} that merges concurrent edits.
 * <p>
 * Every sequence element and map entry gets an id unique to this document's client, and updates address
 * items by id only. Sequences order concurrent inserts at the same place by id, maps keep the entry with
 * the greatest id, deletions leave tombstones. Documents that have applied the same set of updates hold
 * the same content, whatever the order the updates arrived in: an update that refers to items not seen
 * yet is held back until they arrive.
 */
public final class MemoryReplicaDocument implements ReplicaDocument {
	private static final Logger logger = LoggerFactory.getLogger(MemoryReplicaDocument.class);

	private final CurrentTimeProvider timeProvider;
	private long clientId = ThreadLocalRandom.current().nextLong();
	private long clock;

	private final Map<String, MemoryContainer> roots = new LinkedHashMap<>();
	private final Map<ItemId, MemoryItem> items = new HashMap<>();
	private final Map<MemoryItem, MemoryItem> redirects = new IdentityHashMap<>();

	@Nullable
	private MemoryTransaction transaction;

	private final List<ObserverRegistration> observers = new ArrayList<>();
	private final List<UpdateListener> updateListeners = new ArrayList<>();
	private final List<MemoryUndoHistory> undoHistories = new ArrayList<>();
	private final List<PendingUpdate> pendingUpdates = new ArrayList<>();

	// region builders
	private MemoryReplicaDocument(CurrentTimeProvider timeProvider) {
		this.timeProvider = timeProvider;
	}

	public static MemoryReplicaDocument create() {
		return new MemoryReplicaDocument(CurrentTimeProvider.ofSystem());
	}

	public static MemoryReplicaDocument create(CurrentTimeProvider timeProvider) {
		return new MemoryReplicaDocument(checkNotNull(timeProvider));
	}

	/**
	 * Sets the id of the client this document creates items for. Every replica needs its own.
	 */
	public MemoryReplicaDocument withClientId(long clientId) {
		checkState(items.isEmpty(), "Client id must be set before any content is created");
		this.clientId = clientId;
		return this;
	}

	public MemoryReplicaDocument withUpdateListener(UpdateListener listener) {
		addUpdateListener(listener);
		return this;
	}
	// endregion

	public long getClientId() {
		return clientId;
	}

	@Override
	public MemoryArray getArray(String name) {
		MemoryContainer root = roots.computeIfAbsent(name, $ -> new MemoryArray(this, name));
		checkState(root instanceof MemoryArray, "Top-level container '%s' is not an array", name);
		return (MemoryArray) root;
	}

	@Override
	public MemoryMap getMap(String name) {
		MemoryContainer root = roots.computeIfAbsent(name, $ -> new MemoryMap(this, name));
		checkState(root instanceof MemoryMap, "Top-level container '%s' is not a map", name);
		return (MemoryMap) root;
	}

	@Override
	public MemoryArray createArray() {
		return new MemoryArray(this, null);
	}

	@Override
	public MemoryMap createMap() {
		return new MemoryMap(this, null);
	}

	@Override
	public MemoryText createText(String text) {
		checkNotNull(text);
		MemoryText result = new MemoryText(this);
		for (int i = 0; i < text.length(); i++) {
			result.append(text.charAt(i));
		}
		return result;
	}

	public boolean inTransaction() {
		return transaction != null;
	}

	// region items
	ItemId nextId() {
		return new ItemId(clientId, clock++);
	}

	private void observe(ItemId id) {
		if (id.clock >= clock) {
			clock = id.clock + 1;
		}
	}

	void register(MemoryItem item) {
		items.put(item.id, item);
	}

	void unregister(MemoryItem item) {
		items.remove(item.id);
	}

	MemoryItem requireItem(ItemId id) {
		MemoryItem item = items.get(id);
		checkArgument(item != null, "Unknown item %s", id);
		return item;
	}

	/**
	 * The item that currently stands for {@code item}: the item itself, or, if it was deleted and restored
	 * as a copy, that copy.
	 */
	MemoryItem resolve(MemoryItem item) {
		while (true) {
			MemoryItem next = transaction != null ? transaction.redirects.get(item) : null;
			if (next == null) {
				next = redirects.get(item);
			}
			if (next == null) return item;
			item = next;
		}
	}

	MemoryContainer resolveContainer(MemoryContainer container) {
		if (container.holder == null) return container;
		MemoryItem holder = resolve(container.holder);
		MemoryContainer nested = holder.nested();
		return holder == container.holder || nested == null ? container : resolveContainer(nested);
	}

	/**
	 * Copies a deleted value for restoring it, remembering the copy of each item it contains.
	 */
	Object restoreValue(Object value) {
		if (!(value instanceof MemoryContainer)) return value;
		Map<MemoryItem, MemoryItem> copies = new IdentityHashMap<>();
		MemoryContainer copy = ((MemoryContainer) value).copy(copies);
		copies.forEach(this::redirect);
		return copy;
	}

	void redirect(MemoryItem from, MemoryItem to) {
		checkNotNull(transaction, "Not in a transaction").redirects.put(from, to);
	}
	// endregion

	@Override
	public <E extends Exception> void transact(@Nullable Object origin, TransactionBody<E> body) throws E {
		if (transaction != null) {
			body.run();
			return;
		}
		MemoryTransaction tx = new MemoryTransaction(this, origin);
		transaction = tx;
		try {
			body.run();
		} catch (Throwable e) {
			transaction = null;
			logger.debug("Rolling back {} after {}", tx, e.toString());
			tx.rollback();
			throw e;
		}
		transaction = null;
		commit(tx);
	}

	void perform(MemoryOp op) {
		MemoryTransaction tx = transaction;
		if (tx == null) {
			transact(null, () -> perform(op));
			return;
		}
		MemoryContainer target = op.target();
		boolean visible = target.isAttached();
		tx.touch(target);
		op.apply();
		tx.ops.add(new MemoryTransaction.AppliedOp(op, visible ? target.lineage() : null));
		if (target.isIntegrated()) {
			op.encode(tx.updateOps);
		}
		if (visible) {
			for (MemoryContainer nested : op.nestedContainers()) {
				tx.markInserted(nested);
			}
		}
		logger.trace("{} on {}", op, visible ? target.pathFrom(target.top()) : "invisible container");
	}

	private void commit(MemoryTransaction tx) {
		if (tx.isEmpty()) return;
		redirects.putAll(tx.redirects);

		Map<MemoryContainer, Object> diffs = new LinkedHashMap<>();
		for (MemoryContainer container : tx.touched) {
			if (tx.inserted.contains(container) || !container.isAttached()) continue;
			Object diff = container.diff(tx.beforeImages.get(container));
			if (diff != null) {
				diffs.put(container, diff);
			}
		}

		List<RuntimeException> errors = new ArrayList<>();
		if (!diffs.isEmpty()) {
			for (ObserverRegistration registration : new ArrayList<>(observers)) {
				List<ReplicaEvent> events = new ArrayList<>();
				diffs.forEach((container, diff) -> {
					List<Object> path = container.pathFrom(registration.container);
					if (path != null) {
						events.add(container.toEvent(diff, path));
					}
				});
				if (events.isEmpty()) continue;
				events.sort(comparingInt(event -> event.getPath().size()));
				try {
					registration.observer.onBatch(unmodifiableList(events), tx);
				} catch (RuntimeException e) {
					logger.error("Observer {} failed on {}", registration.observer, tx, e);
					errors.add(e);
				}
			}
		}

		for (MemoryUndoHistory history : new ArrayList<>(undoHistories)) {
			history.afterTransaction(tx);
		}

		if (!tx.updateOps.isEmpty() && !updateListeners.isEmpty()) {
			byte[] update = ReplicaUpdateCodec.encode(new ReplicaUpdate(tx.updateOps));
			for (UpdateListener listener : new ArrayList<>(updateListeners)) {
				listener.onUpdate(update, tx.getOrigin());
			}
		}

		if (!errors.isEmpty()) {
			RuntimeException first = errors.get(0);
			for (int i = 1; i < errors.size(); i++) {
				first.addSuppressed(errors.get(i));
			}
			throw first;
		}
	}

	// region updates
	public void addUpdateListener(UpdateListener listener) {
		updateListeners.add(checkNotNull(listener));
	}

	public void removeUpdateListener(UpdateListener listener) {
		updateListeners.remove(listener);
	}

	/**
	 * Applies an update produced by another document as one transaction tagged with {@code origin}.
	 * Applying an update twice changes nothing. An update that refers to items this document has not
	 * seen yet is held back and applied, with its own origin, as soon as the updates it depends on arrive.
	 *
	 * @throws IllegalArgumentException if the update is malformed or contradicts the current state,
	 *                                  in which case nothing is changed
	 */
	public void applyUpdate(byte[] update, @Nullable Object origin) {
		ReplicaUpdate decoded = ReplicaUpdateCodec.decode(update);
		if (!isApplicable(decoded)) {
			logger.debug("Holding back an update of {} ops from {} until the items it refers to arrive", decoded.ops.size(), origin);
			pendingUpdates.add(new PendingUpdate(decoded, origin));
			return;
		}
		apply(decoded, origin);
		applyPendingUpdates();
	}

	public boolean hasPendingUpdates() {
		return !pendingUpdates.isEmpty();
	}

	/**
	 * Encodes the whole current state, tombstones included, as an update that brings any replica up to date.
	 */
	public byte[] encodeStateAsUpdate() {
		List<ReplicaUpdate.Op> ops = new ArrayList<>();
		for (MemoryContainer root : roots.values()) {
			root.snapshot(ops);
		}
		return ReplicaUpdateCodec.encode(new ReplicaUpdate(ops));
	}

	private void applyPendingUpdates() {
		boolean progress = true;
		while (progress) {
			progress = false;
			for (Iterator<PendingUpdate> iterator = pendingUpdates.iterator(); iterator.hasNext(); ) {
				PendingUpdate pending = iterator.next();
				if (isApplicable(pending.update)) {
					iterator.remove();
					logger.debug("Applying a held back update from {}", pending.origin);
					apply(pending.update, pending.origin);
					progress = true;
					break;
				}
			}
		}
	}

	private void apply(ReplicaUpdate update, @Nullable Object origin) {
		logger.trace("Applying update of {} ops from {}", update.ops.size(), origin);
		transact(origin, () -> {
			for (ReplicaUpdate.Op op : update.ops) {
				applyUpdateOp(op);
			}
		});
	}

	/**
	 * Whether every item the update refers to is known here or created earlier in the update itself.
	 */
	private boolean isApplicable(ReplicaUpdate update) {
		Set<ItemId> created = new HashSet<>();
		for (ReplicaUpdate.Op op : update.ops) {
			if (op.parent != null && !isKnown(op.parent, created)) return false;
			switch (op.type) {
				case ReplicaUpdate.INSERT:
					if (op.origin != null && !isKnown(op.origin, created)) return false;
					for (int i = 0; i < op.size(); i++) {
						created.add(checkNotNull(op.id).plus(i));
					}
					break;
				case ReplicaUpdate.DELETE:
					for (ItemId id : checkNotNull(op.ids)) {
						if (!isKnown(id, created)) return false;
					}
					break;
				case ReplicaUpdate.MAP_SET:
					created.add(checkNotNull(op.id));
					break;
				case ReplicaUpdate.MAP_DELETE:
					if (!isKnown(checkNotNull(op.id), created)) return false;
					break;
				default:
					throw new IllegalArgumentException("Unknown update op " + op.type);
			}
		}
		return true;
	}

	private boolean isKnown(ItemId id, Set<ItemId> created) {
		return items.containsKey(id) || created.contains(id);
	}

	private void applyUpdateOp(ReplicaUpdate.Op op) {
		switch (op.type) {
			case ReplicaUpdate.INSERT: {
				MemorySequence sequence = resolve(op, MemorySequence.class);
				ItemId first = checkNotNull(op.id);
				if (op.origin != null) {
					checkArgument(requireItem(op.origin).owner == sequence, "Origin of %s is in another container", op);
				}
				List<Object> values = sequence.decodeValues(op);
				List<MemoryItem> fresh = new ArrayList<>();
				ItemId origin = op.origin;
				for (int i = 0; i < values.size(); i++) {
					ItemId id = first.plus(i);
					if (!items.containsKey(id)) {
						fresh.add(MemoryItem.element(id, sequence, origin, values.get(i)));
					}
					origin = id;
				}
				observe(first.plus(values.size() - 1));
				if (!fresh.isEmpty()) {
					perform(new MemoryOp.SequenceInsert(sequence, fresh));
				}
				break;
			}
			case ReplicaUpdate.DELETE: {
				MemorySequence sequence = resolve(op, MemorySequence.class);
				List<MemoryItem> visible = new ArrayList<>();
				for (ItemId id : checkNotNull(op.ids)) {
					MemoryItem element = requireItem(id);
					checkArgument(element.owner == sequence, "Item %s is in another container", id);
					if (!element.deleted) visible.add(element);
				}
				if (!visible.isEmpty()) {
					perform(new MemoryOp.SequenceDelete(sequence, visible));
				}
				break;
			}
			case ReplicaUpdate.MAP_SET: {
				MemoryMap map = resolve(op, MemoryMap.class);
				ItemId id = checkNotNull(op.id);
				if (items.containsKey(id)) break;
				observe(id);
				Object value = ReplicaUpdateCodec.decodeValue(this, checkNotNull(op.value));
				perform(new MemoryOp.MapSet(map, MemoryItem.entry(id, map, checkNotNull(op.key), value)));
				break;
			}
			case ReplicaUpdate.MAP_DELETE: {
				MemoryMap map = resolve(op, MemoryMap.class);
				MemoryItem entry = requireItem(checkNotNull(op.id));
				checkArgument(entry.owner == map && Objects.equals(entry.key, op.key), "Entry %s is not under key %s", op.id, op.key);
				if (map.visibleEntry(checkNotNull(op.key)) == entry) {
					perform(new MemoryOp.MapDelete(map, entry));
				}
				break;
			}
			default:
				throw new IllegalArgumentException("Unknown update op " + op.type);
		}
	}

	private <T extends MemoryContainer> T resolve(ReplicaUpdate.Op op, Class<T> type) {
		MemoryContainer container;
		if (op.root != null) {
			container = roots.get(op.root);
			if (container == null) {
				container = type == MemoryMap.class ? getMap(op.root) : getArray(op.root);
			}
		} else {
			container = requireItem(checkNotNull(op.parent)).nested();
		}
		checkArgument(type.isInstance(container), "Cannot resolve %s", op);
		return type.cast(container);
	}

	private static final class PendingUpdate {
		final ReplicaUpdate update;
		@Nullable
		final Object origin;

		PendingUpdate(ReplicaUpdate update, @Nullable Object origin) {
			this.update = update;
			this.origin = origin;
		}
	}
	// endregion

	// region observers
	void addObserver(MemoryContainer container, DeepObserver observer) {
		observers.add(new ObserverRegistration(container, checkNotNull(observer)));
	}

	void removeObserver(MemoryContainer container, DeepObserver observer) {
		observers.removeIf(registration -> registration.container == container && registration.observer == observer);
	}

	private static final class ObserverRegistration {
		final MemoryContainer container;
		final DeepObserver observer;

		ObserverRegistration(MemoryContainer container, DeepObserver observer) {
			this.container = container;
			this.observer = observer;
		}
	}
	// endregion

	// region undo
	@Override
	public MemoryUndoHistory createUndoHistory(Collection<? extends ReplicaContainer> scope, Set<?> trackedOrigins, long captureTimeoutMillis) {
		checkArgument(!scope.isEmpty(), "Empty undo scope");
		checkArgument(captureTimeoutMillis >= 0, "Negative capture timeout");
		List<MemoryContainer> containers = new ArrayList<>();
		for (ReplicaContainer container : scope) {
			checkArgument(container instanceof MemoryContainer && ((MemoryContainer) container).document == this,
					"Container %s belongs to another document", container);
			containers.add((MemoryContainer) container);
		}
		MemoryUndoHistory history = new MemoryUndoHistory(this, containers, new HashSet<Object>(trackedOrigins), captureTimeoutMillis);
		undoHistories.add(history);
		return history;
	}

	void removeUndoHistory(MemoryUndoHistory history) {
		undoHistories.remove(history);
	}

	long currentTimeMillis() {
		return timeProvider.currentTimeMillis();
	}
	// endregion

	@Override
	public String toString() {
		return "MemoryReplicaDocument{client=" + clientId + ", roots=" + roots + '}';
	}
}
