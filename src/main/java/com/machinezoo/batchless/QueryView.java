// Part of Batchless
package com.machinezoo.batchless;

import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;

/*
 * There are exactly two kinds of views: exact and grouped.
 * Constructor is package-private, so that applications cannot add views with their own priming rules.
 */
/**
 * Keyed, cached access path into records of one {@link Query}.
 *
 * @param <K>
 *            type of keys
 * @param <T>
 *            type of records
 * @param <V>
 *            type of values returned for one key
 */
@StubDocs
public abstract class QueryView<K, T, V> {
	final Query<?, T> query;
	final BatchCache<K, V> cache;
	QueryView(Query<?, T> query) {
		this.query = query;
		cache = new BatchCache<>(this::fetch);
	}
	/*
	 * Called by the cache with the distinct keys of one window.
	 */
	abstract CompletableFuture<List<V>> fetch(List<K> keys);
	public Query<?, T> query() {
		return query;
	}
	/*
	 * Exposed mostly for configuration. Applications shouldn't prime the cache directly.
	 */
	public BatchCache<K, V> cache() {
		return cache;
	}
	public CompletableFuture<V> load(K key) {
		return cache.load(key);
	}
	public CompletableFuture<List<V>> loadMany(Collection<? extends K> keys) {
		return cache.loadMany(keys);
	}
	public CloseableScope hold() {
		return cache.hold();
	}
	public CompletableFuture<Void> dispatch() {
		return cache.dispatch();
	}
	/*
	 * Priming is split in two phases, so that the query can run extractors of all views before it writes to any cache.
	 * Extractor faults are thrown from this method. The returned action only installs the records.
	 */
	abstract Runnable stage(Collection<? extends T> records);
	/**
	 * Offers records returned by the query to this view's cache.
	 *
	 * @param records
	 *            records returned by the query on behalf of some other view
	 */
	public void primeMany(Collection<? extends T> records) {
		stage(records).run();
	}
}
