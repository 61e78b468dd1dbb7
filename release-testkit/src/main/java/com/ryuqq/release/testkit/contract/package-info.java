/**
 * Contract tests shared by every {@link com.ryuqq.release.core.spi.ReleaseRegistry} adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.release.testkit.contract;
