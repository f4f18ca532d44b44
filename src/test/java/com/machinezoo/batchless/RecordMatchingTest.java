// Part of Batchless
package com.machinezoo.batchless;

import static java.util.stream.Collectors.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.*;
import org.junit.jupiter.params.provider.*;

public class RecordMatchingTest {
	@Test
	public void exact() {
		// Output follows the keys, not the records. Keys without record map to null.
		List<Integer> matched = RecordMatching.exact(List.of(1, 2, 3), List.of(6, 4), x -> x / 2);
		assertEquals(Arrays.asList(null, 4, 6), matched);
	}
	@Test
	public void exactRepeatedKeys() {
		// Every occurrence of a key gets the same record.
		List<Integer> matched = RecordMatching.exact(List.of(2, 2, 1), List.of(4), x -> x / 2);
		assertEquals(Arrays.asList(4, 4, null), matched);
	}
	@Test
	public void exactLastWins() {
		// When records share a key, the last one is used.
		Page first = new Page(1, "a", 1);
		Page second = new Page(1, "b", 2);
		List<Page> matched = RecordMatching.exact(List.of(1), List.of(first, second), p -> p.id);
		assertSame(second, matched.get(0));
	}
	@Test
	public void exactEmpty() {
		assertEquals(List.of(), RecordMatching.exact(List.<Integer>of(), List.of(1, 2), x -> x));
		assertEquals(Arrays.asList(null, null), RecordMatching.exact(List.of(1, 2), List.<Integer>of(), x -> x));
	}
	@Test
	public void exactExtractorFault() {
		// Extractor exceptions are not swallowed.
		assertThrows(ArithmeticException.class, () -> RecordMatching.exact(List.of(1), List.of(0), x -> 1 / x));
	}
	@Test
	public void grouped() {
		List<List<String>> grouped = RecordMatching.grouped(
			List.of("1", "2", "3", "4"),
			List.of("1 one", "2 two", "1 uno", "2 dos", "3 three"),
			s -> s.substring(0, 1),
			s -> s.substring(2));
		assertEquals(List.of(List.of("1 one", "1 uno"), List.of("2 dos", "2 two"), List.of("3 three"), List.of()), grouped);
	}
	@Test
	public void groupedStable() {
		// Records with equal sort keys keep their fetched order.
		Page a = new Page(1, "a", 7);
		Page b = new Page(2, "b", 7);
		Page c = new Page(3, "c", 7);
		List<List<Page>> grouped = RecordMatching.grouped(List.of(7), List.of(c, a, b), p -> p.userId, p -> p.userId);
		assertEquals(List.of(c, a, b), grouped.get(0));
	}
	@Test
	public void groupedComparator() {
		Comparator<Page> descending = Comparator.comparingInt((Page p) -> p.id).reversed();
		List<Page> pages = List.of(new Page(1, "a", 1), new Page(3, "c", 1), new Page(2, "b", 1));
		List<List<Page>> grouped = RecordMatching.grouped(List.of(1), pages, p -> p.userId, descending);
		assertEquals(List.of(3, 2, 1), grouped.get(0).stream().map(p -> p.id).collect(toList()));
	}
	@ParameterizedTest
	@ValueSource(ints = { 0, 1, 2, 3, 4 })
	public void groupedPartition(int seed) {
		// Every record lands in exactly one group under its own key.
		List<Page> pages = new ArrayList<>();
		for (int i = 0; i < 20; ++i)
			pages.add(new Page(i, "p" + i, i % 3));
		Collections.shuffle(pages, new Random(seed));
		List<List<Page>> grouped = RecordMatching.grouped(List.of(0, 1, 2, 3), pages, p -> p.userId, p -> p.id);
		assertEquals(4, grouped.size());
		assertEquals(20, grouped.stream().mapToInt(List::size).sum());
		for (int key = 0; key < 4; ++key) {
			List<Page> group = grouped.get(key);
			for (Page page : group)
				assertEquals(key, page.userId);
			List<Integer> ids = group.stream().map(p -> p.id).collect(toList());
			List<Integer> sorted = new ArrayList<>(ids);
			Collections.sort(sorted);
			assertEquals(sorted, ids);
		}
		assertThat(grouped.get(3), empty());
	}
	@Test
	public void groupedUnmodifiable() {
		List<List<Integer>> grouped = RecordMatching.grouped(List.of(1, 2), List.of(1), x -> x, x -> x);
		assertThrows(UnsupportedOperationException.class, () -> grouped.get(0).add(1));
		assertThrows(UnsupportedOperationException.class, () -> grouped.get(1).add(1));
	}
	@Test
	public void groupedExtractorFault() {
		// Sort key is extracted only when there is something to sort.
		assertThrows(ArithmeticException.class, () -> RecordMatching.grouped(List.of(0), List.of(0, 0), x -> x, x -> 1 / x));
	}
}
