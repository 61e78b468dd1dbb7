package com.ryuqq.release.adapter.filestore.notes;

import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.spi.ReleaseNotesGenerator;

import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 관례적인 위치의 릴리스 노트 경로를 돌려주는 생성기.
 *
 * <pre>
 * &lt;projectPath&gt;/.deployment-registry/release-notes/&lt;environment&gt;/&lt;정규화된 릴리스명&gt;-&lt;yyyy-MM-dd&gt;.md
 * 예: /srv/shop/.deployment-registry/release-notes/production/spring-release-2026-01-15.md
 * </pre>
 *
 * <p>경로만 계산하며 노트 내용은 쓰지 않습니다. 날짜는 릴리스 시작 시각의 UTC 날짜입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConventionalReleaseNotesGenerator implements ReleaseNotesGenerator {

    static final String NOTES_DIRECTORY = ".deployment-registry/release-notes";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final Path projectPath;

    public ConventionalReleaseNotesGenerator(Path projectPath) {
        if (projectPath == null) {
            throw new IllegalArgumentException("projectPath cannot be null");
        }
        this.projectPath = projectPath;
    }

    @Override
    public String generate(ReleaseRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        String fileName = ReleaseId.sanitize(record.releaseName()) + "-" + DATE.format(record.timestamp()) + ".md";
        return projectPath.resolve(NOTES_DIRECTORY)
            .resolve(record.environment().value())
            .resolve(fileName)
            .toString();
    }
}
