// Part of Batchless
package com.machinezoo.batchless;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;

/**
 * View returning all records with the given key, sorted.
 * Keys without records load as an empty list.
 *
 * @param <K>
 *            type of keys
 * @param <T>
 *            type of records
 */
public class GroupView<K, T> extends QueryView<K, T, List<T>> {
	private final Function<? super T, ? extends K> keyOf;
	private final Comparator<? super T> order;
	private final Function<List<K>, CompletableFuture<List<List<T>>>> source;
	<A> GroupView(Query<A, T> query, Function<? super T, ? extends K> keyOf, Comparator<? super T> order, Function<? super List<K>, ? extends A> arguments) {
		super(query);
		Objects.requireNonNull(keyOf);
		Objects.requireNonNull(order);
		Objects.requireNonNull(arguments);
		this.keyOf = keyOf;
		this.order = order;
		source = keys -> query.execute(arguments.apply(keys), this, records -> RecordMatching.grouped(keys, records, keyOf, order));
	}
	@Override
	CompletableFuture<List<List<T>>> fetch(List<K> keys) {
		return source.apply(keys);
	}
	/*
	 * Records seen by other views may be only part of a group. Only the query run by this view can prove a group complete.
	 */
	@Override
	Runnable stage(Collection<? extends T> records) {
		return () -> {
		};
	}
}
