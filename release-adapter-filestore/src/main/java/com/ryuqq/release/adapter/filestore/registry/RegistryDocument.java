package com.ryuqq.release.adapter.filestore.registry;

import com.ryuqq.release.core.model.Environment;
import com.ryuqq.release.core.model.HealthStatus;
import com.ryuqq.release.core.model.ReleaseId;
import com.ryuqq.release.core.model.ReleaseRecord;
import com.ryuqq.release.core.model.ServiceName;
import com.ryuqq.release.core.model.ServiceResult;
import com.ryuqq.release.core.model.ServiceStatus;
import com.ryuqq.release.core.statemachine.ReleaseState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * releases.json 문서 형식.
 *
 * <pre>
 * { "version": "1.0.0", "projectPath": "...", "lastUpdated": "2026-01-15T10:00:00Z", "releases": [ ... ] }
 * </pre>
 *
 * <p>시각은 ISO-8601 문자열, 열거형은 소문자 wire 값으로 저장합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
record RegistryDocument(
    String version,
    String projectPath,
    String lastUpdated,
    List<ReleaseEntry> releases
) {

    static final String FORMAT_VERSION = "1.0.0";

    RegistryDocument {
        releases = releases == null ? new ArrayList<>() : new ArrayList<>(releases);
    }

    static RegistryDocument empty(String projectPath, Instant now) {
        return new RegistryDocument(FORMAT_VERSION, projectPath, now.toString(), List.of());
    }

    RegistryDocument withReleases(List<ReleaseEntry> releases, Instant now) {
        return new RegistryDocument(FORMAT_VERSION, projectPath, now.toString(), releases);
    }

    /**
     * 저장된 릴리스 한 건.
     */
    record ReleaseEntry(
        String releaseId,
        String releaseName,
        String environment,
        String timestamp,
        String status,
        List<String> services,
        List<String> deploymentOrder,
        List<ServiceResultEntry> serviceResults,
        long durationMs,
        String overallHealth,
        String releaseNotesPath
    ) {

        static ReleaseEntry from(ReleaseRecord record) {
            return new ReleaseEntry(
                record.releaseId().getValue(),
                record.releaseName(),
                record.environment().value(),
                record.timestamp().toString(),
                record.status().value(),
                names(record.services()),
                names(record.deploymentOrder()),
                record.serviceResults().stream().map(ServiceResultEntry::from).toList(),
                record.durationMs(),
                record.overallHealth().value(),
                record.releaseNotesPath()
            );
        }

        ReleaseRecord toRecord() {
            return new ReleaseRecord(
                ReleaseId.of(releaseId),
                releaseName,
                Environment.fromValue(environment),
                Instant.parse(timestamp),
                ReleaseState.fromValue(status),
                serviceNames(services),
                serviceNames(deploymentOrder),
                serviceResults == null ? List.of() : serviceResults.stream().map(ServiceResultEntry::toResult).toList(),
                durationMs,
                HealthStatus.fromValue(overallHealth),
                releaseNotesPath
            );
        }

        private static List<String> names(List<ServiceName> names) {
            return names.stream().map(ServiceName::getValue).toList();
        }

        private static List<ServiceName> serviceNames(List<String> names) {
            return names == null ? List.of() : names.stream().map(ServiceName::of).toList();
        }
    }

    /**
     * 서비스별 결과 한 건.
     */
    record ServiceResultEntry(
        String service,
        String status,
        String deploymentId,
        String version,
        long durationMs,
        String healthStatus,
        String message
    ) {

        static ServiceResultEntry from(ServiceResult result) {
            return new ServiceResultEntry(
                result.service().getValue(),
                result.status().value(),
                result.deploymentId(),
                result.version(),
                result.durationMs(),
                result.healthStatus().value(),
                result.message()
            );
        }

        ServiceResult toResult() {
            return new ServiceResult(
                ServiceName.of(service),
                ServiceStatus.fromValue(status),
                deploymentId,
                version,
                durationMs,
                HealthStatus.fromValue(healthStatus),
                message
            );
        }
    }
}
