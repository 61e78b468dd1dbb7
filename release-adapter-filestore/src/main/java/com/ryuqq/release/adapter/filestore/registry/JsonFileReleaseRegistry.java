package com.ryuqq.release.adapter.filestore.registry;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ryuqq.release.adapter.filestore.registry.RegistryDocument.ReleaseEntry;
import com.ryuqq.release.core.exception.RegistryException;
import com.ryuqq.release.core.exception.ValidationException;
import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.model.ReleaseStatistics;
import com.ryuqq.release.core.model.ReleaseUpdate;
import com.ryuqq.release.core.spi.ReleaseRegistry;
import com.ryuqq.release.core.statemachine.ReleaseState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 단일 JSON 문서 기반 ReleaseRegistry 구현.
 *
 * <p>모든 릴리스를 {@code <projectPath>/.deployment-registry/releases.json} 한 파일에 보관합니다.
 * 매 조회마다 파일을 다시 읽으므로 같은 파일을 가리키는 여러 인스턴스가 서로의 쓰기를 봅니다.</p>
 *
 * <p><strong>쓰기 절차:</strong></p>
 * <pre>
 * 1. 경로별 lock 획득 (같은 JVM의 모든 인스턴스가 공유)
 * 2. releases.json.lock 파일에 FileChannel lock 획득 (다른 프로세스와 공유)
 * 3. 현재 문서 읽기 → 변경 적용
 * 4. 같은 디렉토리에 고유한 임시 파일(releases.json.*.tmp)을 만들어 전체 문서 기록
 * 5. Files.move(ATOMIC_MOVE, REPLACE_EXISTING)로 교체
 *    (원자적 이동을 지원하지 않는 파일시스템이면 REPLACE_EXISTING만 사용)
 * </pre>
 *
 * <p>I/O 실패와 손상된 문서는 {@link RegistryException}으로 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonFileReleaseRegistry implements ReleaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(JsonFileReleaseRegistry.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private static final Comparator<ReleaseRecord> NEWEST_FIRST =
        Comparator.comparing(ReleaseRecord::timestamp).reversed();

    // 정규화된 레지스트리 경로별 lock
    private static final ConcurrentMap<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final FileRegistryConfig config;
    private final Clock clock;
    private final ReentrantLock lock;

    /**
     * 생성자.
     *
     * @param config 파일 위치 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public JsonFileReleaseRegistry(FileRegistryConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자 (lastUpdated 기록용 Clock 주입).
     *
     * @param config 파일 위치 설정
     * @param clock 시각 기준
     * @throws IllegalArgumentException config 또는 clock이 null인 경우
     */
    public JsonFileReleaseRegistry(FileRegistryConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.lock = LOCKS.computeIfAbsent(
            config.registryPath().toAbsolutePath().normalize(), path -> new ReentrantLock());
    }

    @Override
    public void initialize() {
        underWriteLock(() -> {
            Path registryPath = config.registryPath();
            if (Files.exists(registryPath)) {
                List<ReleaseRecord> records = decode(read());
                log.info("Release registry loaded from {} ({} releases)", registryPath, records.size());
                return null;
            }
            write(RegistryDocument.empty(config.projectPath().toString(), clock.instant()));
            log.info("Release registry created at {}", registryPath);
            return null;
        });
    }

    @Override
    public void addRelease(ReleaseRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        underWriteLock(() -> {
            RegistryDocument document = read();
            List<ReleaseRecord> records = decode(document);
            boolean exists = records.stream().anyMatch(existing -> existing.releaseId().equals(record.releaseId()));
            if (exists) {
                throw new RegistryException("Release already exists: " + record.releaseId().getValue());
            }
            List<ReleaseEntry> releases = new ArrayList<>(document.releases());
            releases.add(ReleaseEntry.from(record));
            write(document.withReleases(releases, clock.instant()));
            log.debug("Release {} added to registry ({})", record.releaseId().getValue(), record.status().value());
            return null;
        });
    }

    @Override
    public ReleaseRecord updateRelease(ReleaseId releaseId, ReleaseUpdate update) {
        if (releaseId == null) {
            throw new IllegalArgumentException("releaseId cannot be null");
        }
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        return underWriteLock(() -> {
            RegistryDocument document = read();
            List<ReleaseRecord> records = decode(document);
            for (int i = 0; i < records.size(); i++) {
                if (!records.get(i).releaseId().equals(releaseId)) {
                    continue;
                }
                ReleaseRecord updated;
                try {
                    updated = records.get(i).apply(update);
                } catch (IllegalStateException e) {
                    throw new RegistryException("Cannot update release " + releaseId.getValue() + ": " + e.getMessage(), e);
                }
                List<ReleaseEntry> releases = new ArrayList<>(document.releases());
                releases.set(i, ReleaseEntry.from(updated));
                write(document.withReleases(releases, clock.instant()));
                log.debug("Release {} updated in registry ({})", releaseId.getValue(), updated.status().value());
                return updated;
            }
            throw new RegistryException("Release not found: " + releaseId.getValue());
        });
    }

    @Override
    public Optional<ReleaseRecord> getRelease(ReleaseId releaseId) {
        if (releaseId == null) {
            throw new IllegalArgumentException("releaseId cannot be null");
        }
        return records().stream()
            .filter(record -> record.releaseId().equals(releaseId))
            .findFirst();
    }

    @Override
    public Optional<ReleaseRecord> getLatestRelease(Environment environment) {
        return getReleasesByEnvironment(environment).stream().findFirst();
    }

    @Override
    public List<ReleaseRecord> getReleasesByEnvironment(Environment environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        return newestFirst(record -> record.environment() == environment);
    }

    @Override
    public List<ReleaseRecord> getSuccessfulReleases(Environment environment) {
        return newestFirst(record -> record.status() == ReleaseState.SUCCESS
            && (environment == null || record.environment() == environment));
    }

    @Override
    public ReleaseStatistics getStatistics() {
        return ReleaseStatistics.from(records());
    }

    @Override
    public ReleaseStatistics getStatistics(Environment environment) {
        return ReleaseStatistics.from(getReleasesByEnvironment(environment));
    }

    /**
     * 레지스트리 파일 경로.
     *
     * @return releases.json 경로
     */
    public Path registryPath() {
        return config.registryPath();
    }

    // 파일 순서는 추가 순서이므로 같은 시각이면 나중에 추가된 기록이 앞에 온다
    private List<ReleaseRecord> newestFirst(Predicate<ReleaseRecord> filter) {
        List<ReleaseRecord> matched = new ArrayList<>();
        List<ReleaseRecord> all = records();
        for (int i = all.size() - 1; i >= 0; i--) {
            if (filter.test(all.get(i))) {
                matched.add(all.get(i));
            }
        }
        matched.sort(NEWEST_FIRST);
        return matched;
    }

    private List<ReleaseRecord> records() {
        lock.lock();
        try {
            return decode(read());
        } finally {
            lock.unlock();
        }
    }

    private <T> T underWriteLock(Supplier<T> action) {
        lock.lock();
        try {
            Path lockPath = config.lockPath();
            Files.createDirectories(lockPath.getParent());
            try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.get();
            }
        } catch (IOException e) {
            throw new RegistryException("Failed to lock registry file: " + config.registryPath(), e);
        } finally {
            lock.unlock();
        }
    }

    private List<ReleaseRecord> decode(RegistryDocument document) {
        List<ReleaseRecord> records = new ArrayList<>();
        try {
            for (ReleaseEntry entry : document.releases()) {
                records.add(entry.toRecord());
            }
        } catch (IllegalArgumentException | ValidationException | NullPointerException | DateTimeParseException e) {
            throw new RegistryException("Registry file contains an invalid release: " + config.registryPath(), e);
        }
        return records;
    }

    private RegistryDocument read() {
        Path registryPath = config.registryPath();
        if (!Files.exists(registryPath)) {
            return RegistryDocument.empty(config.projectPath().toString(), clock.instant());
        }
        try {
            RegistryDocument document = MAPPER.readValue(registryPath.toFile(), RegistryDocument.class);
            if (document == null) {
                throw new RegistryException("Registry file is empty: " + registryPath);
            }
            return document;
        } catch (IOException e) {
            throw new RegistryException("Failed to read registry file: " + registryPath, e);
        }
    }

    private void write(RegistryDocument document) {
        Path registryPath = config.registryPath();
        Path tempPath = null;
        try {
            Files.createDirectories(registryPath.getParent());
            tempPath = Files.createTempFile(registryPath.getParent(), config.tempFilePrefix(), config.tempSuffix());
            MAPPER.writeValue(tempPath.toFile(), document);
            moveAtomically(tempPath, registryPath);
            tempPath = null;
        } catch (IOException e) {
            throw new RegistryException("Failed to write registry file: " + registryPath, e);
        } finally {
            if (tempPath != null) {
                deleteQuietly(tempPath);
            }
        }
    }

    private static void deleteQuietly(Path tempPath) {
        try {
            Files.deleteIfExists(tempPath);
        } catch (IOException e) {
            log.warn("Failed to delete temporary registry file {}: {}", tempPath, e.getMessage());
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
