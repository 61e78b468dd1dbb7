package com.ryuqq.release.core.spi;

import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.model.ReleaseStatistics;
import com.ryuqq.release.core.model.ReleaseUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Release history storage SPI.
 *
 * <p>Keeps one {@link ReleaseRecord} per release id and serves the queries the coordinator
 * and operators need: single lookup, latest per environment, per-environment history and
 * derived statistics.</p>
 *
 * <p><strong>Lifecycle of a stored record:</strong></p>
 * <pre>
 * 1. addRelease(record)            → IN_PROGRESS record stored
 * 2. updateRelease(id, update) * N → results appended batch by batch
 * 3. updateRelease(id, terminal)   → SUCCESS / FAILED / ROLLED_BACK (immutable afterwards)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: writes are serialized internally, reads never observe a half-applied update</li>
 *   <li>Fidelity: a stored record is returned field-for-field equal to what was written</li>
 *   <li>Statistics are derived from stored records and never persisted</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ReleaseRegistry {

    /**
     * Ensures the backing store exists, creating an empty one if needed.
     *
     * <p>Calling it more than once is harmless; existing records are kept.</p>
     *
     * @throws com.ryuqq.release.core.exception.RegistryException if the store cannot be created or read
     */
    void initialize();

    /**
     * Stores a new release record.
     *
     * @param record the record to store
     * @throws IllegalArgumentException if record is null
     * @throws com.ryuqq.release.core.exception.RegistryException if the id already exists or the write fails
     */
    void addRelease(ReleaseRecord record);

    /**
     * Applies a partial update to a stored release.
     *
     * <p>Status changes follow {@link com.ryuqq.release.core.statemachine.StateTransition}:
     * a record in a terminal state is never changed.</p>
     *
     * @param releaseId the release id
     * @param update fields to change (null fields are left as they are)
     * @return the updated record
     * @throws IllegalArgumentException if releaseId or update is null
     * @throws com.ryuqq.release.core.exception.RegistryException if the id is unknown, the record is
     *         already terminal, or the write fails
     */
    ReleaseRecord updateRelease(ReleaseId releaseId, ReleaseUpdate update);

    /**
     * Looks up a release by id.
     *
     * @param releaseId the release id
     * @return the record, or empty if unknown
     */
    Optional<ReleaseRecord> getRelease(ReleaseId releaseId);

    /**
     * Returns the release with the newest timestamp for an environment.
     *
     * @param environment the environment
     * @return the newest record, or empty if the environment has none
     */
    Optional<ReleaseRecord> getLatestRelease(Environment environment);

    /**
     * Returns every release of an environment, newest first.
     *
     * @param environment the environment
     * @return records ordered by timestamp descending
     */
    List<ReleaseRecord> getReleasesByEnvironment(Environment environment);

    /**
     * Returns releases that finished with SUCCESS, newest first.
     *
     * @param environment the environment to filter by, or null for all environments
     * @return successful records ordered by timestamp descending
     */
    List<ReleaseRecord> getSuccessfulReleases(Environment environment);

    /**
     * Computes statistics over every stored release.
     *
     * @return derived statistics
     */
    ReleaseStatistics getStatistics();

    /**
     * Computes statistics over one environment's releases.
     *
     * @param environment the environment
     * @return derived statistics
     */
    ReleaseStatistics getStatistics(Environment environment);
}
