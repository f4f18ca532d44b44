// Part of Batchless
package com.machinezoo.batchless;

import java.util.*;
import java.util.concurrent.*;

/**
 * Batch fetch function backing {@link BatchCache}.
 * 
 * @param <K>
 *            type of keys
 * @param <V>
 *            type of values
 */
@FunctionalInterface
public interface BatchFunction<K, V> {
	/**
	 * Fetches values for a batch of keys.
	 * Keys are unique and in the order they were first requested.
	 * The returned list must contain exactly one value per key in the same order.
	 * 
	 * @param keys
	 *            non-empty list of distinct keys
	 * @return future list of values aligned with {@code keys}
	 */
	CompletableFuture<List<V>> load(List<K> keys);
}
