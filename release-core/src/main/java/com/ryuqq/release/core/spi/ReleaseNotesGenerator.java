package com.ryuqq.release.core.spi;

import com.ryuqq.release.core.model.ReleaseRecord;

/**
 * 종료된 릴리스 기록에서 릴리스 노트를 만드는 외부 생성기.
 *
 * <p>반환된 경로 문자열은 결과와 레지스트리에 그대로 기록됩니다.
 * 노트 내용의 형식은 이 인터페이스의 관심사가 아닙니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReleaseNotesGenerator {

    /**
     * 릴리스 노트 생성.
     *
     * @param record 종료 상태의 릴리스 기록
     * @return 릴리스 노트 경로
     */
    String generate(ReleaseRecord record);
}
