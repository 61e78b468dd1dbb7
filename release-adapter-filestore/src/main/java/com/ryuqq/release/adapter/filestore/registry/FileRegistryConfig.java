package com.ryuqq.release.adapter.filestore.registry;

import java.nio.file.Path;

/**
 * JSON 파일 레지스트리 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>registryFile: .deployment-registry/releases.json (projectPath 기준 상대 경로)</li>
 *   <li>tempSuffix: .tmp (쓰기마다 새로 만드는 임시 파일의 접미사)</li>
 * </ul>
 *
 * @param projectPath 프로젝트 루트 경로
 * @param registryFile 레지스트리 파일 상대 경로
 * @param tempSuffix 임시 파일 접미사
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record FileRegistryConfig(
    Path projectPath,
    String registryFile,
    String tempSuffix
) {

    public static final String DEFAULT_REGISTRY_FILE = ".deployment-registry/releases.json";
    public static final String DEFAULT_TEMP_SUFFIX = ".tmp";

    public FileRegistryConfig {
        if (projectPath == null) {
            throw new IllegalArgumentException("projectPath cannot be null");
        }
        if (registryFile == null || registryFile.isBlank()) {
            throw new IllegalArgumentException("registryFile cannot be null or blank");
        }
        if (Path.of(registryFile).isAbsolute()) {
            throw new IllegalArgumentException("registryFile must be relative to projectPath (current: " + registryFile + ")");
        }
        if (tempSuffix == null || tempSuffix.isBlank()) {
            throw new IllegalArgumentException("tempSuffix cannot be null or blank");
        }
    }

    /**
     * 기본 파일 위치를 사용하는 설정.
     *
     * @param projectPath 프로젝트 루트 경로
     */
    public FileRegistryConfig(Path projectPath) {
        this(projectPath, DEFAULT_REGISTRY_FILE, DEFAULT_TEMP_SUFFIX);
    }

    /**
     * 레지스트리 파일 절대 경로.
     *
     * @return projectPath/registryFile
     */
    public Path registryPath() {
        return projectPath.resolve(registryFile);
    }

    /**
     * 쓰기 중 사용하는 임시 파일 이름 접두사.
     *
     * <p>임시 파일은 registryPath와 같은 디렉토리에 {@code <prefix><random><tempSuffix>} 형태로 만들어집니다.</p>
     *
     * @return 레지스트리 파일 이름 + "."
     */
    public String tempFilePrefix() {
        return registryPath().getFileName() + ".";
    }

    /**
     * 프로세스 간 쓰기 잠금에 사용하는 파일 경로.
     *
     * @return registryPath + ".lock"
     */
    public Path lockPath() {
        Path registryPath = registryPath();
        return registryPath.resolveSibling(registryPath.getFileName() + ".lock");
    }

    public FileRegistryConfig withRegistryFile(String registryFile) {
        return new FileRegistryConfig(projectPath, registryFile, tempSuffix);
    }

    public FileRegistryConfig withTempSuffix(String tempSuffix) {
        return new FileRegistryConfig(projectPath, registryFile, tempSuffix);
    }
}
