package com.ryuqq.release.core.model;

/**
 * 배포 단위(서비스)의 이름.
 *
 * <p>한 릴리스 요청 안에서 서비스를 식별하는 키이며, 의존성 선언도 이 이름으로 참조합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ServiceName implements Comparable<ServiceName> {

    private final String value;

    private ServiceName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ServiceName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ServiceName length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * ServiceName 생성.
     *
     * @param value 서비스 이름
     * @return ServiceName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ServiceName of(String value) {
        return new ServiceName(value);
    }

    /**
     * 서비스 이름 조회.
     *
     * @return 서비스 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ServiceName other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceName that = (ServiceName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
