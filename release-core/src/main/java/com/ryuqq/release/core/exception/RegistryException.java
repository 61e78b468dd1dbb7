package com.ryuqq.release.core.exception;

/**
 * 릴리스 레지스트리 영속화 실패.
 *
 * <p>저장소 초기화, 읽기, 쓰기 실패 또는 존재하지 않는 릴리스 갱신 시도 시 발생합니다.
 * 코디네이터는 이 예외를 로그로 남기고, 이미 계산된 배포 결과는 그대로 호출자에게 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
