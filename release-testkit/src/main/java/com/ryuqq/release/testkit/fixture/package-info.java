/**
 * 테스트 데이터 생성기.
 *
 * @since 1.0.0
 */
package com.ryuqq.release.testkit.fixture;
