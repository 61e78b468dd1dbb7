/**
 * 테스트용 DeploymentExecutor 구현.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.release.testkit.executor;
