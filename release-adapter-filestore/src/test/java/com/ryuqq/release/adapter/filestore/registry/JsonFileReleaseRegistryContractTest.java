package com.ryuqq.release.adapter.filestore.registry;

import com.ryuqq.release.core.spi.ReleaseRegistry;
import com.ryuqq.release.testkit.contract.AbstractReleaseRegistryContractTest;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * JsonFileReleaseRegistry 계약 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JsonFileReleaseRegistryContractTest extends AbstractReleaseRegistryContractTest {

    @TempDir
    Path projectPath;

    @Override
    protected ReleaseRegistry createRegistry() {
        return new JsonFileReleaseRegistry(new FileRegistryConfig(projectPath));
    }
}
