// Part of Batchless
/**
 * Batchless coalesces individual key lookups issued from many call sites into batched fetches
 * and keeps several keyed views over one shared query cache-coherent.
 * <p>
 * {@link com.machinezoo.batchless.BatchCache} is the coalescing batch loader with its per-key cache.
 * {@link com.machinezoo.batchless.Query} binds one query function to exact and grouped views
 * and primes sibling views whenever the query runs.
 */
module com.machinezoo.batchless {
	exports com.machinezoo.batchless;
	requires com.machinezoo.stagean;
	requires com.machinezoo.noexception;
	requires com.machinezoo.noexception.slf4j;
	/*
	 * Hold scopes are part of the public API.
	 */
	requires transitive com.machinezoo.closeablescope;
	requires org.slf4j;
	requires com.google.common;
	requires micrometer.core;
}
