package com.ryuqq.release.adapter.filestore.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.release.core.exception.RegistryException;
import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.model.ReleaseUpdate;
import com.ryuqq.release.core.statemachine.ReleaseState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static com.ryuqq.release.testkit.fixture.ReleaseFixtures.inProgress;
import static com.ryuqq.release.testkit.fixture.ReleaseFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonFileReleaseRegistry 파일 동작 테스트.
 *
 * <p>문서 형식, 원자적 교체, 손상 파일 처리, 인스턴스 간 영속성을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JsonFileReleaseRegistryTest {

    private static final Instant NOW = Instant.parse("2026-02-01T12:00:00Z");

    @TempDir
    Path projectPath;

    private FileRegistryConfig config;
    private JsonFileReleaseRegistry registry;

    @BeforeEach
    void setUp() {
        config = new FileRegistryConfig(projectPath);
        registry = new JsonFileReleaseRegistry(config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void initialize는_빈_문서를_기본_위치에_만든다() throws IOException {
        // when
        registry.initialize();

        // then
        Path file = projectPath.resolve(".deployment-registry/releases.json");
        assertThat(registry.registryPath()).isEqualTo(file);
        JsonNode document = new ObjectMapper().readTree(file.toFile());
        assertThat(document.get("version").asText()).isEqualTo("1.0.0");
        assertThat(document.get("projectPath").asText()).isEqualTo(projectPath.toString());
        assertThat(document.get("lastUpdated").asText()).isEqualTo("2026-02-01T12:00:00Z");
        assertThat(document.get("releases").isArray()).isTrue();
        assertThat(document.get("releases")).isEmpty();
    }

    @Test
    void 기록은_wire_값과_ISO_시각으로_저장된다() throws IOException {
        // given
        registry.initialize();

        // when
        registry.addRelease(record("release-wire", Environment.PRODUCTION, 0, ReleaseState.ROLLED_BACK));

        // then
        JsonNode release = new ObjectMapper().readTree(registry.registryPath().toFile()).get("releases").get(0);
        assertThat(release.get("releaseId").asText()).isEqualTo("release-wire");
        assertThat(release.get("environment").asText()).isEqualTo("production");
        assertThat(release.get("status").asText()).isEqualTo("rolled-back");
        assertThat(release.get("timestamp").asText()).isEqualTo("2026-01-15T10:00:00Z");
        assertThat(release.get("serviceResults").get(1).get("status").asText()).isEqualTo("failed");
        assertThat(release.get("serviceResults").get(1).get("message").asText()).isEqualTo("readiness probe failed");
    }

    @Test
    void 쓰기_후_임시_파일이_남지_않는다() throws IOException {
        // given
        registry.initialize();

        // when
        registry.addRelease(inProgress("release-tmp", Environment.STAGING, 0));
        registry.updateRelease(ReleaseId.of("release-tmp"), ReleaseUpdate.builder().status(ReleaseState.SUCCESS).build());

        // then
        assertThat(temporaryFiles(config)).isEmpty();
        assertThat(Files.exists(config.registryPath())).isTrue();
    }

    @Test
    void 다른_인스턴스에서도_저장된_기록을_읽는다() {
        // given
        ReleaseRecord original = record("release-persist", Environment.STAGING, 5, ReleaseState.SUCCESS);
        registry.initialize();
        registry.addRelease(original);

        // when
        JsonFileReleaseRegistry reopened = new JsonFileReleaseRegistry(config);
        reopened.initialize();

        // then
        assertThat(reopened.getRelease(original.releaseId())).contains(original);
        assertThat(reopened.getStatistics().successful()).isEqualTo(1);
    }

    @Test
    void 손상된_파일은_RegistryException() throws IOException {
        // given
        Files.createDirectories(config.registryPath().getParent());
        Files.writeString(config.registryPath(), "{ not json");

        // when & then
        assertThatThrownBy(() -> registry.initialize())
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("Failed to read registry file");
        assertThatThrownBy(() -> registry.getStatistics())
            .isInstanceOf(RegistryException.class);
    }

    @Test
    void 알수없는_상태_값은_RegistryException() throws IOException {
        // given
        writeSingleRelease("release-bad", "exploded", "2026-02-01T12:00:00Z");

        // when & then
        assertThatThrownBy(() -> registry.getRelease(ReleaseId.of("release-bad")))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("invalid release");
    }

    @Test
    void 손상된_기록이_있으면_추가도_RegistryException이고_파일은_그대로다() throws IOException {
        // given
        writeSingleRelease("release-bad", "exploded", "2026-02-01T12:00:00Z");
        String before = Files.readString(config.registryPath());

        // when & then
        assertThatThrownBy(() -> registry.addRelease(inProgress("release-new", Environment.STAGING, 0)))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("invalid release");
        assertThat(Files.readString(config.registryPath())).isEqualTo(before);
    }

    @Test
    void 손상된_기록은_갱신도_RegistryException이다() throws IOException {
        // given
        writeSingleRelease("release-bad", "in-progress", "yesterday");
        ReleaseUpdate update = ReleaseUpdate.builder().status(ReleaseState.SUCCESS).build();

        // when & then
        assertThatThrownBy(() -> registry.updateRelease(ReleaseId.of("release-bad"), update))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("invalid release");
    }

    @Test
    void 손상된_기록은_initialize에서_RegistryException이다() throws IOException {
        // given
        writeSingleRelease("", "success", "2026-02-01T12:00:00Z");

        // when & then
        assertThatThrownBy(() -> registry.initialize())
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("invalid release");
    }

    @Test
    void 초기화_전_조회는_빈_결과() {
        assertThat(registry.getLatestRelease(Environment.PRODUCTION)).isEmpty();
        assertThat(Files.exists(config.registryPath())).isFalse();
    }

    @Test
    void 동시_쓰기도_하나도_잃지_않는다() throws InterruptedException {
        // given
        registry.initialize();
        ExecutorService pool = Executors.newFixedThreadPool(4);

        // when
        for (int i = 0; i < 20; i++) {
            String id = "release-" + i;
            int minutes = i;
            pool.submit(() -> registry.addRelease(record(id, Environment.PRODUCTION, minutes, ReleaseState.SUCCESS)));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(registry.getReleasesByEnvironment(Environment.PRODUCTION)).hasSize(20);
    }

    @Test
    void 같은_파일을_가리키는_두_인스턴스가_동시에_써도_하나도_잃지_않는다() throws Exception {
        // given
        registry.initialize();
        FileRegistryConfig sameFile = new FileRegistryConfig(projectPath.resolve("."));
        JsonFileReleaseRegistry other = new JsonFileReleaseRegistry(sameFile, Clock.fixed(NOW, ZoneOffset.UTC));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < 40; i++) {
            String id = "release-" + i;
            int minutes = i;
            JsonFileReleaseRegistry target = i % 2 == 0 ? registry : other;
            futures.add(pool.submit(() -> target.addRelease(record(id, Environment.PRODUCTION, minutes, ReleaseState.SUCCESS))));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // then
        for (Future<?> future : futures) {
            future.get();
        }
        assertThat(registry.getReleasesByEnvironment(Environment.PRODUCTION)).hasSize(40);
        assertThat(other.getReleasesByEnvironment(Environment.PRODUCTION)).hasSize(40);
        assertThat(temporaryFiles(config)).isEmpty();
    }

    @Test
    void 두_인스턴스의_갱신이_서로를_덮어쓰지_않는다() throws InterruptedException, ExecutionException {
        // given
        registry.initialize();
        JsonFileReleaseRegistry other = new JsonFileReleaseRegistry(new FileRegistryConfig(projectPath));
        for (int i = 0; i < 10; i++) {
            registry.addRelease(inProgress("release-" + i, Environment.STAGING, i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        ReleaseUpdate success = ReleaseUpdate.builder().status(ReleaseState.SUCCESS).build();

        // when
        for (int i = 0; i < 10; i++) {
            ReleaseId id = ReleaseId.of("release-" + i);
            JsonFileReleaseRegistry target = i % 2 == 0 ? registry : other;
            futures.add(pool.submit(() -> target.updateRelease(id, success)));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        // then
        for (Future<?> future : futures) {
            future.get();
        }
        assertThat(registry.getSuccessfulReleases(Environment.STAGING)).hasSize(10);
    }

    @Test
    void 사용자_지정_파일_위치를_따른다() {
        // given
        FileRegistryConfig custom = config.withRegistryFile("state/history.json").withTempSuffix(".writing");
        JsonFileReleaseRegistry customRegistry = new JsonFileReleaseRegistry(custom);

        // when
        customRegistry.initialize();

        // then
        assertThat(Files.exists(projectPath.resolve("state/history.json"))).isTrue();
        assertThat(custom.tempFilePrefix()).isEqualTo("history.json.");
        assertThat(custom.lockPath()).isEqualTo(projectPath.resolve("state/history.json.lock"));
    }

    @Test
    void 절대_경로_registryFile은_거부된다() {
        assertThatThrownBy(() -> config.withRegistryFile(projectPath.resolve("abs.json").toString()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private void writeSingleRelease(String releaseId, String status, String timestamp) throws IOException {
        Files.createDirectories(config.registryPath().getParent());
        Files.writeString(config.registryPath(), """
            {
              "version": "1.0.0",
              "projectPath": "/tmp/x",
              "lastUpdated": "2026-02-01T12:00:00Z",
              "releases": [ {
                "releaseId": "%s",
                "releaseName": "bad",
                "environment": "production",
                "timestamp": "%s",
                "status": "%s",
                "services": [],
                "deploymentOrder": [],
                "serviceResults": [],
                "durationMs": 0,
                "overallHealth": "healthy",
                "releaseNotesPath": null
              } ]
            }
            """.formatted(releaseId, timestamp, status));
    }

    private static List<Path> temporaryFiles(FileRegistryConfig config) throws IOException {
        try (Stream<Path> files = Files.list(config.registryPath().getParent())) {
            return files
                .filter(file -> file.getFileName().toString().endsWith(config.tempSuffix()))
                .toList();
        }
    }
}
