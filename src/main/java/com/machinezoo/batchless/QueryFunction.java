// Part of Batchless
package com.machinezoo.batchless;

import java.util.*;
import java.util.concurrent.*;

/**
 * Source query shared by all views of one {@link Query}.
 * 
 * @param <A>
 *            type of query arguments
 * @param <T>
 *            type of records
 */
@FunctionalInterface
public interface QueryFunction<A, T> {
	/**
	 * Runs the query.
	 * Records may come in any order. Any number of them may share the same key.
	 * 
	 * @param arguments
	 *            application-defined query arguments
	 * @return future list of matching records
	 */
	CompletableFuture<List<T>> query(A arguments);
}
