/**
 * JSON file backed release registry.
 *
 * <p>{@link com.ryuqq.release.adapter.filestore.registry.JsonFileReleaseRegistry} keeps the whole
 * release history in one pretty-printed document and replaces it atomically on every write.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.release.adapter.filestore.registry;
