package com.ryuqq.release.core.model;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 릴리스의 전역 고유 식별자.
 *
 * <p>coordinateRelease 호출마다 새로 생성되며, 레지스트리의 기본 키로 사용됩니다.
 * 동일한 ReleaseId로 동시에 두 개의 릴리스가 진행되어서는 안 됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * <p><strong>생성 규칙 ({@link #generate(String)}):</strong></p>
 * <pre>
 * release-{정규화된 릴리스명(최대 20자)}-{epoch millis}-{난수 6자리}
 * 예: release-checkout-v2-1718000000000-k3f9zq
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReleaseId {

    private static final int MAX_NAME_LENGTH = 20;
    private static final String RANDOM_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final String value;

    private ReleaseId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ReleaseId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ReleaseId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ReleaseId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ReleaseId 생성.
     *
     * @param value ReleaseId 값
     * @return ReleaseId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ReleaseId of(String value) {
        return new ReleaseId(value);
    }

    /**
     * 릴리스명 기반으로 새 ReleaseId 생성.
     *
     * @param releaseName 릴리스명
     * @return 새 ReleaseId
     * @throws IllegalArgumentException releaseName이 null이거나 빈 문자열인 경우
     */
    public static ReleaseId generate(String releaseName) {
        if (releaseName == null || releaseName.isBlank()) {
            throw new IllegalArgumentException("releaseName cannot be null or blank");
        }
        String name = sanitize(releaseName);
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }
        return new ReleaseId("release-" + name + "-" + System.currentTimeMillis() + "-" + randomSuffix(6));
    }

    /**
     * 이름을 소문자로 바꾸고 [a-z0-9-] 이외의 문자를 하이픈으로 치환.
     *
     * @param name 원본 이름
     * @return 정규화된 이름
     */
    public static String sanitize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
    }

    private static String randomSuffix(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(RANDOM_ALPHABET.charAt(random.nextInt(RANDOM_ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * ReleaseId 값 조회.
     *
     * @return ReleaseId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReleaseId releaseId = (ReleaseId) o;
        return value.equals(releaseId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ReleaseId{" + value + '}';
    }
}
