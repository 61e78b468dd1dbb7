/**
 * Release error taxonomy.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.release.core.exception.ValidationException} - pre-deployment, aborts the whole release</li>
 *   <li>{@link com.ryuqq.release.core.exception.DeploymentException} - per-service, folded into a ServiceResult</li>
 *   <li>{@link com.ryuqq.release.core.exception.RegistryException} - persistence failure, reported but non-blocking</li>
 * </ul>
 *
 * <p>All three are unchecked. Argument checks elsewhere use {@link java.lang.IllegalArgumentException}
 * and illegal state transitions use {@link java.lang.IllegalStateException}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.release.core.exception;
