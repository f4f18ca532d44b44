// Part of Batchless
/*
 * Conventions followed by all classes in this package:
 * - Null check is performed on method parameters where appropriate.
 * - Exceptions from application-defined functions (fetch functions, queries, extractors) are never swallowed.
 *   They complete the affected futures exceptionally. Only tasks submitted to executors log what escapes them.
 * - There's no other logging above debug level.
 * - Metrics go to micrometer's global registry.
 * - Method toString() is defined on stateful objects.
 */
/**
 * Coalescing batch loaders and cache-coherent keyed views over shared queries.
 */
package com.machinezoo.batchless;
