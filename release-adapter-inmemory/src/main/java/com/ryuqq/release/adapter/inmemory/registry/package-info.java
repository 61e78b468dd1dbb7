/**
 * In-memory ReleaseRegistry adapter.
 *
 * <p>Thread-safe, non-durable registry for tests and for embedding the coordinator
 * in processes that keep release history elsewhere.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.release.adapter.inmemory.registry;
