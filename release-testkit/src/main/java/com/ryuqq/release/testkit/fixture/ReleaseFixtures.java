package com.ryuqq.release.testkit.fixture;

import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.HealthStatus;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.model.ServiceDeclaration;
import com.ryuqq.release.core.model.ServiceName;
import com.ryuqq.release.core.model.ServiceResult;
import com.ryuqq.release.core.model.ServiceStatus;
import com.ryuqq.release.core.statemachine.ReleaseState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 테스트용 릴리스 데이터 생성기.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReleaseFixtures {

    public static final Instant BASE_TIME = Instant.parse("2026-01-15T10:00:00Z");

    // Utility class - prevent instantiation
    private ReleaseFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 다이아몬드 의존성 (A → B, C → D).
     *
     * @return A, B, C, D 선언
     */
    public static List<ServiceDeclaration> diamond() {
        return List.of(
            ServiceDeclaration.of("A", "1.0.0", "B", "C"),
            ServiceDeclaration.of("B", "1.0.0", "D"),
            ServiceDeclaration.of("C", "1.0.0", "D"),
            ServiceDeclaration.of("D", "1.0.0")
        );
    }

    /**
     * 3단계 스택: db, cache → api, worker → web.
     *
     * <p>배치 1 [db, cache], 배치 2 [api, worker], 배치 3 [web]</p>
     *
     * @return 5개 서비스 선언
     */
    public static List<ServiceDeclaration> threeTierStack() {
        return List.of(
            ServiceDeclaration.of("db", "14.2.0"),
            ServiceDeclaration.of("cache", "7.2.4"),
            ServiceDeclaration.of("api", "2.3.0", "db", "cache"),
            ServiceDeclaration.of("worker", "2.3.0", "db"),
            ServiceDeclaration.of("web", "5.0.1", "api")
        );
    }

    /**
     * 모든 필드가 채워진 종료 상태 기록 (왕복 충실도 검증용).
     *
     * @param id 릴리스 ID
     * @param environment 환경
     * @param minutesAfterBase BASE_TIME 이후 분
     * @param status 상태
     * @return ReleaseRecord
     */
    public static ReleaseRecord record(String id, Environment environment, int minutesAfterBase, ReleaseState status) {
        ServiceName db = ServiceName.of("db");
        ServiceName api = ServiceName.of("api");
        List<ServiceResult> results = List.of(
            ServiceResult.success(db, "dep-" + id + "-db", "14.2.0", 1200, HealthStatus.HEALTHY),
            new ServiceResult(api, status == ReleaseState.SUCCESS ? ServiceStatus.SUCCESS : ServiceStatus.FAILED,
                "dep-" + id + "-api", "2.3.0", 850,
                status == ReleaseState.SUCCESS ? HealthStatus.DEGRADED : HealthStatus.UNHEALTHY,
                status == ReleaseState.SUCCESS ? null : "readiness probe failed")
        );
        HealthStatus overall = status == ReleaseState.SUCCESS ? HealthStatus.DEGRADED : HealthStatus.UNHEALTHY;
        return new ReleaseRecord(
            ReleaseId.of(id),
            "release " + id,
            environment,
            BASE_TIME.plus(Duration.ofMinutes(minutesAfterBase)),
            status,
            List.of(db, api),
            List.of(db, api),
            results,
            2050,
            overall,
            status.isTerminal() ? "/notes/" + environment.value() + "/" + id + ".md" : null
        );
    }

    /**
     * IN_PROGRESS 상태 기록 (진행 결과 없음).
     *
     * @param id 릴리스 ID
     * @param environment 환경
     * @param minutesAfterBase BASE_TIME 이후 분
     * @return ReleaseRecord
     */
    public static ReleaseRecord inProgress(String id, Environment environment, int minutesAfterBase) {
        return new ReleaseRecord(ReleaseId.of(id), "release " + id, environment,
            BASE_TIME.plus(Duration.ofMinutes(minutesAfterBase)), ReleaseState.IN_PROGRESS,
            List.of(ServiceName.of("db"), ServiceName.of("api")), List.of(), List.of(), 0,
            HealthStatus.HEALTHY, null);
    }

    /**
     * config가 있는 서비스 선언.
     *
     * @param name 서비스 이름
     * @param dependencies 의존 서비스
     * @return ServiceDeclaration
     */
    public static ServiceDeclaration configured(String name, String... dependencies) {
        return ServiceDeclaration.of(name, "1.0.0", dependencies)
            .withConfig(Map.of("replicas", 3, "region", "ap-northeast-2"));
    }
}
