package com.ryuqq.release.adapter.filestore.notes;

import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.model.ServiceName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ConventionalReleaseNotesGenerator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConventionalReleaseNotesGeneratorTest {

    private final Path projectPath = Path.of("/srv/shop");
    private final ConventionalReleaseNotesGenerator generator = new ConventionalReleaseNotesGenerator(projectPath);

    private static ReleaseRecord release(String name, Environment environment, String timestamp) {
        return ReleaseRecord.pending(ReleaseId.of("release-1"), name, environment,
            Instant.parse(timestamp), List.of(ServiceName.of("api")));
    }

    @Test
    void 환경별_디렉터리와_정규화된_이름_날짜로_경로를_만든다() {
        // when
        String path = generator.generate(release("Spring Release 2.0", Environment.PRODUCTION, "2026-01-15T10:00:00Z"));

        // then
        assertThat(path).isEqualTo(projectPath
            .resolve(".deployment-registry/release-notes/production/spring-release-2-0-2026-01-15.md").toString());
    }

    @Test
    void 날짜는_UTC_기준이다() {
        // when
        String path = generator.generate(release("hotfix", Environment.STAGING, "2026-03-31T23:30:00Z"));

        // then
        assertThat(path).endsWith("staging" + projectPath.getFileSystem().getSeparator() + "hotfix-2026-03-31.md");
    }

    @Test
    void 파일은_만들지_않는다() {
        // when
        String path = generator.generate(release("hotfix", Environment.STAGING, "2026-03-31T23:30:00Z"));

        // then
        assertThat(Files.exists(Path.of(path))).isFalse();
    }

    @Test
    void null_입력은_거부된다() {
        assertThatThrownBy(() -> new ConventionalReleaseNotesGenerator(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.generate(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
