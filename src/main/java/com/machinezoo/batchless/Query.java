// Part of Batchless
package com.machinezoo.batchless;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;

/*
 * Query binds one source query to several views keyed by different properties of the same records.
 * Views fetch their misses by running the query with arguments derived from the miss keys.
 * Whatever records the query returns are then offered to all other views, which keeps the views coherent.
 * Exact views cache the records, so lookups by another key of an already seen record don't hit the source again.
 * Group views ignore the offer, because a partial sighting cannot prove that a group is complete.
 *
 * Views must be registered before the first execution. Late registration would leave the new view
 * without records that were already broadcast to its siblings, which is harmless, but it is almost certainly a bug.
 *
 * Applications typically create one query with all its views per unit of work (request, session)
 * and keep them in final fields of some service object.
 */
/**
 * Source query with a set of cache-coherent keyed views.
 *
 * @param <A>
 *            type of query arguments
 * @param <T>
 *            type of records
 */
@DraftApi("views keyed by a projection other than a single extracted key")
public class Query<A, T> {
	private static final Logger logger = LoggerFactory.getLogger(Query.class);
	private static final Counter executionCount = Metrics.counter("batchless.query.executions");
	private final QueryFunction<? super A, T> function;
	private final List<QueryView<?, T, ?>> views = new ArrayList<>();
	private boolean executed;
	public Query(QueryFunction<? super A, T> function) {
		Objects.requireNonNull(function);
		this.function = function;
	}
	private void ensureNotExecuted() {
		if (executed)
			throw new IllegalStateException("Views cannot be registered after the query has been executed.");
	}
	/**
	 * Registers view that expects at most one record per key.
	 *
	 * @param <K>
	 *            type of keys
	 * @param keyOf
	 *            extracts key from a record
	 * @param arguments
	 *            builds query arguments that select records for the given keys
	 * @return new view
	 */
	public synchronized <K> ExactView<K, T> exact(Function<? super T, ? extends K> keyOf, Function<? super List<K>, ? extends A> arguments) {
		ensureNotExecuted();
		ExactView<K, T> view = new ExactView<>(this, keyOf, arguments);
		views.add(view);
		return view;
	}
	/**
	 * Registers view that groups records by key and orders every group.
	 *
	 * @param <K>
	 *            type of keys
	 * @param keyOf
	 *            extracts group key from a record
	 * @param order
	 *            ordering of records within a group
	 * @param arguments
	 *            builds query arguments that select all records of the given groups
	 * @return new view
	 */
	public synchronized <K> GroupView<K, T> group(Function<? super T, ? extends K> keyOf, Comparator<? super T> order, Function<? super List<K>, ? extends A> arguments) {
		ensureNotExecuted();
		GroupView<K, T> view = new GroupView<>(this, keyOf, order, arguments);
		views.add(view);
		return view;
	}
	/**
	 * Registers view that groups records by key and sorts every group by sort key.
	 *
	 * @param <K>
	 *            type of keys
	 * @param <U>
	 *            type of sort keys
	 * @param keyOf
	 *            extracts group key from a record
	 * @param sortKey
	 *            extracts sort key from a record
	 * @param arguments
	 *            builds query arguments that select all records of the given groups
	 * @return new view
	 */
	public <K, U extends Comparable<? super U>> GroupView<K, T> group(
		Function<? super T, ? extends K> keyOf, Function<? super T, ? extends U> sortKey, Function<? super List<K>, ? extends A> arguments) {
		Objects.requireNonNull(sortKey);
		return group(keyOf, Comparator.comparing(sortKey), arguments);
	}
	public synchronized List<QueryView<?, T, ?>> views() {
		return Collections.unmodifiableList(new ArrayList<>(views));
	}
	/**
	 * Runs the query and offers returned records to all views.
	 * Views are primed before the returned future completes.
	 *
	 * @param arguments
	 *            query arguments
	 * @return future records returned by the query function
	 */
	public CompletableFuture<List<T>> execute(A arguments) {
		return execute(arguments, null, records -> records);
	}
	/*
	 * The view that triggered the execution settles its own window from the matched records, so it is not primed.
	 * Matching and all priming extractors run before any cache is written. Fault in any of them fails the whole execution
	 * and leaves all caches untouched.
	 */
	<R> CompletableFuture<R> execute(A arguments, QueryView<?, T, ?> origin, Function<List<T>, R> match) {
		List<QueryView<?, T, ?>> targets;
		synchronized (this) {
			executed = true;
			targets = new ArrayList<>(views);
		}
		executionCount.increment();
		CompletableFuture<List<T>> queried;
		try {
			queried = Objects.requireNonNull(function.query(arguments), "Query function returned null future.");
		} catch (Throwable ex) {
			queried = CompletableFuture.failedFuture(ex);
		}
		return queried.thenApply(records -> {
			Objects.requireNonNull(records, "Query function returned null list.");
			logger.debug("Query returned {} records.", records.size());
			R matched = match.apply(records);
			List<Runnable> installers = new ArrayList<>();
			for (QueryView<?, T, ?> view : targets)
				if (view != origin)
					installers.add(view.stage(records));
			for (Runnable installer : installers)
				installer.run();
			return matched;
		});
	}
	/**
	 * Holds automatic dispatch in all views.
	 *
	 * @return scope that releases all the holds when closed
	 * @see BatchCache#hold()
	 */
	public CloseableScope hold() {
		List<CloseableScope> holds = new ArrayList<>();
		for (QueryView<?, T, ?> view : views())
			holds.add(view.hold());
		return () -> {
			for (CloseableScope hold : holds)
				hold.close();
		};
	}
	/**
	 * Dispatches pending windows of all views.
	 *
	 * @return future that completes when all the dispatched windows are settled
	 */
	public CompletableFuture<Void> dispatch() {
		List<CompletableFuture<Void>> dispatches = new ArrayList<>();
		for (QueryView<?, T, ?> view : views())
			dispatches.add(view.dispatch());
		return CompletableFuture.allOf(dispatches.toArray(new CompletableFuture<?>[0]));
	}
	@Override
	public synchronized String toString() {
		return "Query(" + views.size() + " views)";
	}
}
