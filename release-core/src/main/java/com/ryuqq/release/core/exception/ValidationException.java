package com.ryuqq.release.core.exception;

import java.util.List;

/**
 * 배포 전 검증 실패.
 *
 * <p>순환 의존성, 존재하지 않는 의존성 참조, 중복/자기참조 서비스명, 허용되지 않는 환경 값 등
 * 릴리스 전체를 중단시켜야 하는 오류를 나타냅니다. 이 예외가 발생하면 어떤 배포 호출도
 * 일어나지 않았음이 보장됩니다.</p>
 *
 * <p>메시지에는 발견된 <strong>모든</strong> 오류가 포함됩니다 (첫 번째 오류만이 아님).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    /**
     * 단일 오류로 생성.
     *
     * @param error 오류 메시지
     */
    public ValidationException(String error) {
        this(List.of(error));
    }

    /**
     * 여러 오류로 생성.
     *
     * @param errors 오류 메시지 목록 (1개 이상)
     * @throws IllegalArgumentException errors가 null이거나 비어있는 경우
     */
    public ValidationException(List<String> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * 검증 오류 목록 조회.
     *
     * @return 불변 오류 목록
     */
    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        if (errors.size() == 1) {
            return "Release validation failed: " + errors.get(0);
        }
        return "Release validation failed:\n - " + String.join("\n - ", errors);
    }
}
