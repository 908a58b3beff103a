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

/**
 * Identity of an item, unique across all replicas of a document: the client that created it and
 * that client's logical clock. Clocks follow every id a document has seen, so an item always
 * compares greater than the items its creator knew about.
 */
final class ItemId implements Comparable<ItemId> {
	final long client;
	final long clock;

	ItemId(long client, long clock) {
		this.client = client;
		this.clock = clock;
	}

	ItemId plus(int offset) {
		return new ItemId(client, clock + offset);
	}

	@Override
	public int compareTo(ItemId other) {
		int result = Long.compare(clock, other.clock);
		return result != 0 ? result : Long.compare(client, other.client);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ItemId itemId = (ItemId) o;
		return client == itemId.client && clock == itemId.clock;
	}

	@Override
	public int hashCode() {
		return 31 * Long.hashCode(client) + Long.hashCode(clock);
	}

	@Override
	public String toString() {
		return client + ":" + clock;
	}
}
