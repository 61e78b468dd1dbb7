package com.ryuqq.release.adapter.inmemory.registry;

import com.ryuqq.release.core.exception.RegistryException;
import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.model.ReleaseStatistics;
import com.ryuqq.release.core.model.ReleaseUpdate;
import com.ryuqq.release.core.spi.ReleaseRegistry;
import com.ryuqq.release.core.statemachine.ReleaseState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ReleaseRegistry SPI.
 *
 * <p>This implementation uses ConcurrentHashMap for record storage and keeps
 * insertion order in a separate list so that ties on timestamp resolve to the
 * most recently added release.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Reads are lock-free against ConcurrentHashMap</li>
 *   <li>add/update are synchronized so duplicate checks and terminal checks are atomic</li>
 * </ul>
 *
 * <p><strong>Note:</strong> Records are lost when the JVM exits. Use the file-store adapter
 * for durable history.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryReleaseRegistry implements ReleaseRegistry {

    private static final Comparator<Sequenced> NEWEST_FIRST = Comparator
        .comparing((Sequenced entry) -> entry.record.timestamp())
        .thenComparingInt(entry -> entry.sequence)
        .reversed();

    private final ConcurrentHashMap<ReleaseId, Sequenced> releases = new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<ReleaseId> insertionOrder = new CopyOnWriteArrayList<>();

    @Override
    public void initialize() {
        // nothing to create
    }

    @Override
    public synchronized void addRelease(ReleaseRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (releases.containsKey(record.releaseId())) {
            throw new RegistryException("Release already exists: " + record.releaseId().getValue());
        }
        releases.put(record.releaseId(), new Sequenced(record, insertionOrder.size()));
        insertionOrder.add(record.releaseId());
    }

    @Override
    public synchronized ReleaseRecord updateRelease(ReleaseId releaseId, ReleaseUpdate update) {
        if (releaseId == null) {
            throw new IllegalArgumentException("releaseId cannot be null");
        }
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }

        Sequenced current = releases.get(releaseId);
        if (current == null) {
            throw new RegistryException("Release not found: " + releaseId.getValue());
        }

        ReleaseRecord updated;
        try {
            updated = current.record.apply(update);
        } catch (IllegalStateException e) {
            throw new RegistryException("Cannot update release " + releaseId.getValue() + ": " + e.getMessage(), e);
        }
        releases.put(releaseId, new Sequenced(updated, current.sequence));
        return updated;
    }

    @Override
    public Optional<ReleaseRecord> getRelease(ReleaseId releaseId) {
        if (releaseId == null) {
            throw new IllegalArgumentException("releaseId cannot be null");
        }
        Sequenced entry = releases.get(releaseId);
        return entry == null ? Optional.empty() : Optional.of(entry.record);
    }

    @Override
    public Optional<ReleaseRecord> getLatestRelease(Environment environment) {
        List<ReleaseRecord> releasesOfEnvironment = getReleasesByEnvironment(environment);
        return releasesOfEnvironment.isEmpty() ? Optional.empty() : Optional.of(releasesOfEnvironment.get(0));
    }

    @Override
    public List<ReleaseRecord> getReleasesByEnvironment(Environment environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        return newestFirst(entry -> entry.record.environment() == environment);
    }

    @Override
    public List<ReleaseRecord> getSuccessfulReleases(Environment environment) {
        return newestFirst(entry -> entry.record.status() == ReleaseState.SUCCESS
            && (environment == null || entry.record.environment() == environment));
    }

    @Override
    public ReleaseStatistics getStatistics() {
        return ReleaseStatistics.from(snapshot());
    }

    @Override
    public ReleaseStatistics getStatistics(Environment environment) {
        return ReleaseStatistics.from(getReleasesByEnvironment(environment));
    }

    /**
     * 모든 기록 삭제 (테스트 격리용).
     */
    public synchronized void clear() {
        releases.clear();
        insertionOrder.clear();
    }

    /**
     * 저장된 기록 수.
     *
     * @return 기록 수
     */
    public int size() {
        return releases.size();
    }

    private Collection<ReleaseRecord> snapshot() {
        List<ReleaseRecord> records = new ArrayList<>();
        for (ReleaseId releaseId : insertionOrder) {
            Sequenced entry = releases.get(releaseId);
            if (entry != null) {
                records.add(entry.record);
            }
        }
        return records;
    }

    private List<ReleaseRecord> newestFirst(Predicate<Sequenced> filter) {
        return releases.values().stream()
            .filter(filter)
            .sorted(NEWEST_FIRST)
            .map(entry -> entry.record)
            .collect(Collectors.toList());
    }

    /**
     * Record paired with its insertion sequence.
     */
    private static final class Sequenced {
        final ReleaseRecord record;
        final int sequence;

        Sequenced(ReleaseRecord record, int sequence) {
            this.record = record;
            this.sequence = sequence;
        }
    }
}
