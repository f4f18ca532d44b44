// Part of Batchless
package com.machinezoo.batchless;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;

/**
 * View expecting at most one record per key.
 * Keys without record load as {@code null}.
 *
 * @param <K>
 *            type of keys
 * @param <T>
 *            type of records
 */
public class ExactView<K, T> extends QueryView<K, T, T> {
	private final Function<? super T, ? extends K> keyOf;
	private final Function<List<K>, CompletableFuture<List<T>>> source;
	<A> ExactView(Query<A, T> query, Function<? super T, ? extends K> keyOf, Function<? super List<K>, ? extends A> arguments) {
		super(query);
		Objects.requireNonNull(keyOf);
		Objects.requireNonNull(arguments);
		this.keyOf = keyOf;
		source = keys -> query.execute(arguments.apply(keys), this, records -> RecordMatching.exact(keys, records, keyOf));
	}
	@Override
	CompletableFuture<List<T>> fetch(List<K> keys) {
		return source.apply(keys);
	}
	/*
	 * Records carry their own key, so they can be cached as if this view fetched them.
	 */
	@Override
	Runnable stage(Collection<? extends T> records) {
		Map<K, T> keyed = cache.keyed(records, keyOf);
		return () -> cache.installAll(keyed);
	}
}
