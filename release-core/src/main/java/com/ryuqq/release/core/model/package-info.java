/**
 * Core domain model package containing value objects and release records.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.release.core.model.ServiceName} - Service key within one release request</li>
 *   <li>{@link com.ryuqq.release.core.model.ReleaseId} - Release unique identifier</li>
 *   <li>{@link com.ryuqq.release.core.model.ServiceDeclaration} - Service, version, dependencies and opaque config</li>
 *   <li>{@link com.ryuqq.release.core.model.ServiceResult} - Per-service outcome</li>
 * </ul>
 *
 * <h2>Release Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.release.core.model.ReleaseRecord} - Durable record of one release</li>
 *   <li>{@link com.ryuqq.release.core.model.ReleaseUpdate} - Partial update applied by the registry</li>
 *   <li>{@link com.ryuqq.release.core.model.ReleaseStatistics} - Derived, read-only statistics</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records with defensive copies of collections</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.release.core.model;
