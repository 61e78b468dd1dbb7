/**
 * 릴리스 노트 경로 생성기.
 *
 * @since 1.0.0
 */
package com.ryuqq.release.adapter.filestore.notes;
