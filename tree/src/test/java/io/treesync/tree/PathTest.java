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

import org.junit.Test;

import static java.util.Arrays.asList;
import static org.junit.Assert.*;

public final class PathTest {

	@Test
	public void testNavigation() {
		Path path = Path.of(1, 2, 3);
		assertEquals(3, path.size());
		assertEquals(3, path.last());
		assertEquals(Path.of(1, 2), path.parent());
		assertEquals(Path.of(1, 2, 3, 0), path.child(0));
		assertEquals(Path.of(1, 2, 2), path.previous());
		assertEquals(Path.of(1, 2, 4), path.next());
		assertEquals(Path.ROOT, Path.of(5).parent());
		assertEquals(Path.of(0, 1), Path.of(asList(0, 1)));
		assertEquals("[1, 2, 3]", path.toString());
	}

	@Test(expected = IllegalStateException.class)
	public void testRootHasNoParent() {
		Path.ROOT.parent();
	}

	@Test(expected = IllegalStateException.class)
	public void testFirstChildHasNoPrevious() {
		Path.of(2, 0).previous();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeIndex() {
		Path.of(0, -1);
	}

	@Test
	public void testRelations() {
		assertTrue(Path.of(0).isAncestorOf(Path.of(0, 3)));
		assertTrue(Path.ROOT.isAncestorOf(Path.of(0)));
		assertFalse(Path.of(0).isAncestorOf(Path.of(0)));
		assertFalse(Path.of(1).isAncestorOf(Path.of(0, 1)));

		assertTrue(Path.of(0, 1).isSiblingOf(Path.of(0, 4)));
		assertFalse(Path.of(0, 1).isSiblingOf(Path.of(1, 1)));
		assertFalse(Path.of(0, 1).isSiblingOf(Path.of(0, 1)));

		assertTrue(Path.of(0).endsBefore(Path.of(2, 5)));
		assertTrue(Path.of(1, 0).endsBefore(Path.of(1, 1)));
		assertFalse(Path.of(1, 0).endsBefore(Path.of(2, 1)));
		assertFalse(Path.of(2).endsBefore(Path.of(1, 7)));
	}

	@Test
	public void testOrder() {
		assertTrue(Path.of(0, 5).compareTo(Path.of(1)) < 0);
		assertTrue(Path.of(1).compareTo(Path.of(1, 0)) < 0);
		assertEquals(0, Path.of(3, 3).compareTo(Path.of(3, 3)));
	}

	@Test
	public void testMovedPath() {
		// siblings: the target already names the final position
		assertEquals(Path.of(2), Path.movedPath(Path.of(0), Path.of(2)));
		assertEquals(Path.of(0), Path.movedPath(Path.of(2), Path.of(0)));
		// moving into a later sibling's subtree shifts that sibling left
		assertEquals(Path.of(1, 0), Path.movedPath(Path.of(0), Path.of(2, 0)));
		// moving into an earlier sibling's subtree changes nothing
		assertEquals(Path.of(0, 3), Path.movedPath(Path.of(2), Path.of(0, 3)));
	}
}
