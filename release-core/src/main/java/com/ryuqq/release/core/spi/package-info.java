/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that infrastructure adapters implement so the
 * release coordinator can deploy services, record releases and produce release notes
 * without depending on any concrete technology.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.release.core.spi.DeploymentExecutor} - Deploys and rolls back a single service</li>
 *   <li>{@link com.ryuqq.release.core.spi.ReleaseRegistry} - Durable release history and statistics</li>
 *   <li>{@link com.ryuqq.release.core.spi.ReleaseNotesGenerator} - Release notes path for a finished release</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (release-adapter-inmemory, release-adapter-filestore) provide the registry
 * implementations. Deployment executors are supplied by the embedding application.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.release.core.spi;
