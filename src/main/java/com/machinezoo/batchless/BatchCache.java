// Part of Batchless
package com.machinezoo.batchless;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;
import org.slf4j.*;
import com.google.common.collect.*;
import com.machinezoo.closeablescope.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;

/*
 * Batch cache lets many independent call sites request single values while the fetch function sees whole batches.
 *
 * Requests are collected in a window. The first miss after the cache goes quiet schedules a dispatch.
 * Every miss that arrives before the dispatch actually runs joins the same window.
 * Dispatch closes the window, calls the fetch function exactly once with all the window's keys,
 * stores results in the cache, and completes the pending futures.
 * Misses arriving while the fetch is in flight open a new window. They never join the in-flight one.
 *
 * There is no event loop in Java that would tell us when all logically concurrent requests have been issued.
 * We approximate the boundary with a short batching interval. The window stays open for the interval
 * after its first miss and then it is dispatched on the executor. Zero interval dispatches on the next turn
 * of the executor, which gives no coalescing guarantee, because a free pool thread may close the window
 * between two consecutive loads. Callers that need a hard guarantee can open a hold,
 * which defers automatic dispatch until the last hold is closed. Manual mode disables automatic dispatch altogether.
 * Requests made in one call to loadMany() always end up in one window.
 *
 * Every key has at most one pending request at a time. Requests for a key that is already in flight join it.
 * Resolved values are cached for the lifetime of the cache. There is no eviction.
 * Failures are not cached. Failed window releases its keys, so the next load retries.
 *
 * Window, pending requests, and scheduling state are guarded by the cache's monitor.
 * Resolved entries live in a concurrent map, so that cache hits don't need the lock.
 */
/**
 * Cache that coalesces individual key requests into batched fetches.
 *
 * @param <K>
 *            type of keys
 * @param <V>
 *            type of values, possibly {@code null}
 */
@DraftDocs("diagram of window lifecycle")
public class BatchCache<K, V> {
	private static final Logger logger = LoggerFactory.getLogger(BatchCache.class);
	private static final Counter hitCount = Metrics.counter("batchless.cache.hits");
	private static final Counter missCount = Metrics.counter("batchless.cache.misses");
	private static final Counter primeCount = Metrics.counter("batchless.cache.primes");
	private static final Counter failureCount = Metrics.counter("batchless.cache.failures");
	private static final DistributionSummary batchSizes = Metrics.summary("batchless.cache.batches");
	private static final Timer fetchTimer = Metrics.timer("batchless.cache.fetches");
	private static final Duration DEFAULT_DELAY = Duration.ofMillis(10);
	private final BatchFunction<K, V> function;
	public BatchCache(BatchFunction<K, V> function) {
		Objects.requireNonNull(function);
		this.function = function;
	}
	/*
	 * Configuration can be changed only until the first load. Windows would otherwise observe inconsistent settings.
	 */
	private boolean started;
	private void ensureNotStarted() {
		if (started)
			throw new IllegalStateException("Batch cache cannot be reconfigured after the first load.");
	}
	private Executor executor = BatchExecutor.common();
	public synchronized Executor executor() {
		return executor;
	}
	public synchronized BatchCache<K, V> executor(Executor executor) {
		Objects.requireNonNull(executor);
		ensureNotStarted();
		this.executor = executor;
		return this;
	}
	private Duration delay = DEFAULT_DELAY;
	public synchronized Duration delay() {
		return delay;
	}
	/**
	 * Sets how long the window stays open after the first miss. Default is 10ms.
	 * Zero delay dispatches on the next turn of the executor.
	 * Consecutive loads may then land in separate windows unless they are issued under {@link #hold()}.
	 *
	 * @param delay
	 *            non-negative batching interval
	 * @return {@code this}
	 */
	public synchronized BatchCache<K, V> delay(Duration delay) {
		Objects.requireNonNull(delay);
		if (delay.isNegative())
			throw new IllegalArgumentException("Batching delay cannot be negative.");
		ensureNotStarted();
		this.delay = delay;
		return this;
	}
	private boolean manual;
	public synchronized boolean manual() {
		return manual;
	}
	/**
	 * Disables automatic dispatch. Windows are then flushed only by {@link #dispatch()}.
	 * Futures returned from loads stay incomplete until the next dispatch.
	 *
	 * @param manual
	 *            {@code true} to disable automatic dispatch
	 * @return {@code this}
	 */
	public synchronized BatchCache<K, V> manual(boolean manual) {
		ensureNotStarted();
		this.manual = manual;
		return this;
	}
	/*
	 * Null is a legitimate value (absent record), so map values are wrapped.
	 */
	private static class Entry<V> {
		final V value;
		Entry(V value) {
			this.value = value;
		}
	}
	private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
	/*
	 * Pending requests of all windows, collecting and in flight. Keys are removed when their window settles.
	 */
	private final Map<K, CompletableFuture<V>> pending = new HashMap<>();
	/*
	 * Linked map keeps keys in the order they were first requested.
	 */
	private Map<K, CompletableFuture<V>> window = new LinkedHashMap<>();
	private boolean scheduled;
	private int holds;
	/**
	 * Loads value for one key.
	 * Cached values are returned immediately. Misses join the current window.
	 * Cancelling the returned future does not cancel the shared request.
	 *
	 * @param key
	 *            non-null key
	 * @return future value, {@code null} if the fetch function returned {@code null} for the key
	 */
	public CompletableFuture<V> load(K key) {
		Objects.requireNonNull(key);
		Entry<V> entry = entries.get(key);
		if (entry != null) {
			hitCount.increment();
			return CompletableFuture.completedFuture(entry.value);
		}
		CompletableFuture<V> future;
		boolean schedule;
		synchronized (this) {
			future = enqueue(key);
			schedule = claimSchedule();
		}
		if (schedule)
			schedule();
		return future.copy();
	}
	/**
	 * Loads values for several keys. All misses join the same window.
	 * Repeated keys are requested only once.
	 *
	 * @param keys
	 *            non-null keys
	 * @return future list of values in the order of {@code keys}
	 */
	public CompletableFuture<List<V>> loadMany(Collection<? extends K> keys) {
		Objects.requireNonNull(keys);
		for (K key : keys)
			Objects.requireNonNull(key);
		List<CompletableFuture<V>> futures = new ArrayList<>(keys.size());
		boolean schedule;
		synchronized (this) {
			for (K key : keys)
				futures.add(enqueue(key));
			schedule = claimSchedule();
		}
		if (schedule)
			schedule();
		return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).thenApply(done -> {
			List<V> values = new ArrayList<>(futures.size());
			for (CompletableFuture<V> future : futures)
				values.add(future.join());
			return Collections.unmodifiableList(values);
		});
	}
	private CompletableFuture<V> enqueue(K key) {
		started = true;
		/*
		 * Check the cache again. The entry might have been written since the lock-free check.
		 */
		Entry<V> entry = entries.get(key);
		if (entry != null) {
			hitCount.increment();
			return CompletableFuture.completedFuture(entry.value);
		}
		CompletableFuture<V> future = pending.get(key);
		if (future != null)
			return future;
		missCount.increment();
		future = new CompletableFuture<>();
		pending.put(key, future);
		window.put(key, future);
		return future;
	}
	private boolean claimSchedule() {
		if (scheduled || manual || holds > 0 || window.isEmpty())
			return false;
		scheduled = true;
		return true;
	}
	private void schedule() {
		Executor target;
		Duration wait;
		synchronized (this) {
			target = executor;
			wait = delay;
		}
		Runnable task = ExceptionLogging.log(logger).runnable(this::dispatch);
		if (wait.isZero())
			submit(target, task);
		else {
			/*
			 * Timer only forwards the task to the executor. Rejection is then handled in submit() like without delay.
			 */
			Executor timer = CompletableFuture.delayedExecutor(wait.toNanos(), TimeUnit.NANOSECONDS);
			timer.execute(ExceptionLogging.log(logger).runnable(() -> submit(target, task)));
		}
	}
	private void submit(Executor target, Runnable task) {
		try {
			target.execute(task);
		} catch (RejectedExecutionException ex) {
			/*
			 * The window must be dispatched somewhere or its futures would never complete.
			 */
			logger.debug("Executor rejected batch dispatch. Dispatching on the current thread.", ex);
			dispatch();
		}
	}
	/**
	 * Closes the current window and fetches its keys.
	 * Does nothing if there are no new misses.
	 *
	 * @return future that completes when all requests of the window are settled
	 */
	public CompletableFuture<Void> dispatch() {
		Map<K, CompletableFuture<V>> batch;
		synchronized (this) {
			scheduled = false;
			if (window.isEmpty())
				return CompletableFuture.completedFuture(null);
			batch = window;
			window = new LinkedHashMap<>();
		}
		return fetch(batch);
	}
	private CompletableFuture<Void> fetch(Map<K, CompletableFuture<V>> batch) {
		List<K> keys = ImmutableList.copyOf(batch.keySet());
		batchSizes.record(keys.size());
		logger.debug("Dispatching batch of {} keys.", keys.size());
		Timer.Sample sample = Timer.start();
		CompletableFuture<List<V>> fetched;
		try {
			fetched = Objects.requireNonNull(function.load(keys), "Batch function returned null future.");
		} catch (Throwable ex) {
			fetched = CompletableFuture.failedFuture(ex);
		}
		return fetched.<Void>handle((values, exception) -> {
			sample.stop(fetchTimer);
			settle(batch, values, exception);
			return null;
		});
	}
	private void settle(Map<K, CompletableFuture<V>> batch, List<V> values, Throwable exception) {
		if (exception == null) {
			if (values == null)
				exception = new NullPointerException("Batch function returned null list.");
			else if (values.size() != batch.size())
				exception = new IllegalStateException("Batch function returned " + values.size() + " values for " + batch.size() + " keys.");
		}
		if (exception != null) {
			Throwable cause = exception instanceof CompletionException && exception.getCause() != null ? exception.getCause() : exception;
			failureCount.increment();
			logger.debug("Batch of {} keys failed.", batch.size(), cause);
			synchronized (this) {
				for (Map.Entry<K, CompletableFuture<V>> request : batch.entrySet())
					pending.remove(request.getKey(), request.getValue());
			}
			for (CompletableFuture<V> future : batch.values())
				future.completeExceptionally(cause);
			return;
		}
		List<V> aligned = new ArrayList<>(values);
		synchronized (this) {
			int index = 0;
			for (Map.Entry<K, CompletableFuture<V>> request : batch.entrySet()) {
				entries.put(request.getKey(), new Entry<>(aligned.get(index++)));
				pending.remove(request.getKey(), request.getValue());
			}
		}
		/*
		 * Complete futures outside of the lock. Their continuations may call back into this cache.
		 */
		int index = 0;
		for (CompletableFuture<V> future : batch.values())
			future.complete(aligned.get(index++));
	}
	/**
	 * Opens a hold that defers automatic dispatch.
	 * Misses issued while any hold is open join one window, which is dispatched when the last hold closes.
	 * Explicit {@link #dispatch()} works regardless of holds.
	 *
	 * @return scope that releases the hold when closed
	 */
	public CloseableScope hold() {
		synchronized (this) {
			++holds;
		}
		AtomicBoolean closed = new AtomicBoolean();
		return () -> {
			if (!closed.compareAndSet(false, true))
				return;
			boolean schedule;
			synchronized (this) {
				--holds;
				schedule = claimSchedule();
			}
			if (schedule)
				schedule();
		};
	}
	/*
	 * Priming only proves that some value exists. It therefore never overwrites cached values,
	 * never touches keys with pending requests, and never caches null.
	 */
	/**
	 * Installs value for a key without fetching it.
	 * Keys that are already cached or requested are left alone.
	 *
	 * @param key
	 *            non-null key
	 * @param value
	 *            non-null value
	 * @return {@code true} if the value was installed
	 */
	public boolean prime(K key, V value) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(value);
		synchronized (this) {
			return install(key, value);
		}
	}
	/**
	 * Installs several values keyed by an extractor.
	 * When several values share a key, the last one is used.
	 * Values with {@code null} key are skipped.
	 * Keys are extracted before anything is installed, so failing extractor leaves the cache unchanged.
	 *
	 * @param values
	 *            non-null values
	 * @param keyOf
	 *            extracts key from a value
	 * @return number of installed values
	 */
	public int primeMany(Collection<? extends V> values, Function<? super V, ? extends K> keyOf) {
		return installAll(keyed(values, keyOf));
	}
	/*
	 * First phase of priming. Runs all extractors without touching the cache.
	 */
	Map<K, V> keyed(Collection<? extends V> values, Function<? super V, ? extends K> keyOf) {
		Objects.requireNonNull(values);
		Objects.requireNonNull(keyOf);
		Map<K, V> keyed = new LinkedHashMap<>();
		for (V value : values) {
			Objects.requireNonNull(value);
			K key = keyOf.apply(value);
			if (key != null)
				keyed.put(key, value);
		}
		return keyed;
	}
	synchronized int installAll(Map<K, V> keyed) {
		int count = 0;
		for (Map.Entry<K, V> entry : keyed.entrySet())
			if (install(entry.getKey(), entry.getValue()))
				++count;
		return count;
	}
	private boolean install(K key, V value) {
		if (entries.containsKey(key) || pending.containsKey(key))
			return false;
		entries.put(key, new Entry<>(value));
		primeCount.increment();
		return true;
	}
	public boolean contains(K key) {
		Objects.requireNonNull(key);
		return entries.containsKey(key);
	}
	public int size() {
		return entries.size();
	}
	@Override
	public synchronized String toString() {
		return "BatchCache(" + entries.size() + " cached, " + pending.size() + " pending)";
	}
}
