// Part of Batchless
package com.machinezoo.batchless;

import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Fetch functions behind views return records in arbitrary order, with missing and duplicate keys.
 * Batch cache however needs one value per requested key, in request order.
 * The two methods below align fetched records onto the requested key list.
 * Output is always indexed by the key list, never by the record list.
 *
 * Exceptions thrown by extractors propagate to the caller. Batch cache turns them into failure of the whole window.
 */
/**
 * Alignment of fetched records onto requested keys.
 */
@StubDocs
public class RecordMatching {
	private RecordMatching() {
	}
	/*
	 * When several records share a key, the last one wins, because it overwrites earlier ones in the index.
	 * Callers may rely on this, so it must stay that way.
	 */
	/**
	 * Finds record for every key.
	 * Keys without matching record map to {@code null}.
	 *
	 * @param <K>
	 *            type of keys
	 * @param <T>
	 *            type of records
	 * @param keys
	 *            requested keys in request order
	 * @param records
	 *            fetched records in any order
	 * @param keyOf
	 *            extracts key from a record
	 * @return list of the same length as {@code keys} with matching record or {@code null} at every position
	 */
	public static <K, T> List<T> exact(List<? extends K> keys, Collection<? extends T> records, Function<? super T, ? extends K> keyOf) {
		Objects.requireNonNull(keys);
		Objects.requireNonNull(records);
		Objects.requireNonNull(keyOf);
		Map<K, T> index = new HashMap<>();
		for (T record : records)
			index.put(keyOf.apply(record), record);
		List<T> matched = new ArrayList<>(keys.size());
		for (K key : keys)
			matched.add(index.get(key));
		return Collections.unmodifiableList(matched);
	}
	/*
	 * Sorting only makes the output deterministic. Fetch functions make no promises about record order.
	 * List.sort() is stable, so records with equal sort keys keep their fetched order.
	 */
	/**
	 * Collects records for every key into a sorted group.
	 * Keys without matching records map to an empty list.
	 *
	 * @param <K>
	 *            type of keys
	 * @param <T>
	 *            type of records
	 * @param keys
	 *            requested keys in request order
	 * @param records
	 *            fetched records in any order
	 * @param keyOf
	 *            extracts group key from a record
	 * @param order
	 *            ordering of records within a group
	 * @return list of the same length as {@code keys} with a (possibly empty) group at every position
	 */
	public static <K, T> List<List<T>> grouped(List<? extends K> keys, Collection<? extends T> records, Function<? super T, ? extends K> keyOf, Comparator<? super T> order) {
		Objects.requireNonNull(keys);
		Objects.requireNonNull(records);
		Objects.requireNonNull(keyOf);
		Objects.requireNonNull(order);
		Map<K, List<T>> groups = new HashMap<>();
		for (T record : records)
			groups.computeIfAbsent(keyOf.apply(record), k -> new ArrayList<>()).add(record);
		for (List<T> group : groups.values())
			group.sort(order);
		List<List<T>> grouped = new ArrayList<>(keys.size());
		for (K key : keys) {
			List<T> group = groups.get(key);
			grouped.add(group != null ? Collections.unmodifiableList(group) : Collections.emptyList());
		}
		return Collections.unmodifiableList(grouped);
	}
	/**
	 * Collects records for every key into a group sorted by sort key.
	 *
	 * @param <K>
	 *            type of keys
	 * @param <T>
	 *            type of records
	 * @param <U>
	 *            type of sort keys
	 * @param keys
	 *            requested keys in request order
	 * @param records
	 *            fetched records in any order
	 * @param keyOf
	 *            extracts group key from a record
	 * @param sortKey
	 *            extracts sort key from a record
	 * @return list of the same length as {@code keys} with a (possibly empty) group at every position
	 * @see #grouped(List, Collection, Function, Comparator)
	 */
	public static <K, T, U extends Comparable<? super U>> List<List<T>> grouped(
		List<? extends K> keys, Collection<? extends T> records, Function<? super T, ? extends K> keyOf, Function<? super T, ? extends U> sortKey) {
		Objects.requireNonNull(sortKey);
		return grouped(keys, records, keyOf, Comparator.comparing(sortKey));
	}
}
