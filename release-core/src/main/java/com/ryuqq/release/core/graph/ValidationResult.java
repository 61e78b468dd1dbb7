package com.ryuqq.release.core.graph;

import com.ryuqq.release.core.exception.ValidationException;

import java.util.List;

/**
 * 의존성 검증 결과.
 *
 * <p>검증은 예외를 던지지 않고 한 번의 순회로 모든 오류를 수집합니다.
 * 같은 입력에 대해서는 항상 같은 순서의 같은 오류를 반환합니다.</p>
 *
 * @param errors 오류 목록 (비어 있으면 유효)
 * @param warnings 경고 목록 (검증 통과 여부에 영향 없음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ValidationResult(
    List<DependencyError> errors,
    List<String> warnings
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * 오류가 없으면 true.
     */
    public boolean valid() {
        return errors.isEmpty();
    }

    /**
     * 오류 메시지 목록.
     *
     * @return 메시지 목록 (errors와 같은 순서)
     */
    public List<String> errorMessages() {
        return errors.stream().map(DependencyError::message).toList();
    }

    /**
     * 오류가 있으면 모든 오류를 담은 ValidationException을 던짐.
     *
     * @throws ValidationException 오류가 하나라도 있는 경우
     */
    public void throwIfInvalid() {
        if (!valid()) {
            throw new ValidationException(errorMessages());
        }
    }
}
