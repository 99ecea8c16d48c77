package com.ryuqq.decider.core.model;

/**
 * Version 토큰이 붙은 값.
 *
 * <p>Optimistic Locking 저장소는 저장된 상태, 또는 스트림의 각 이벤트에
 * 단조 증가하는 Version을 함께 반환합니다. 다음 저장 시 마지막으로 읽은 Version을
 * 전달해야 하며, 그 사이 다른 writer가 Version을 올렸다면 저장은 실패합니다.</p>
 *
 * @param value 저장된 값 (null 불가)
 * @param version Version 토큰 (null 불가)
 * @param <T> 값 타입
 * @param <V> Version 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public record Versioned<T, V>(T value, V version) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value 또는 version이 null인 경우
     */
    public Versioned {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
    }

    /**
     * Versioned 생성.
     *
     * @param value 저장된 값
     * @param version Version 토큰
     * @param <T> 값 타입
     * @param <V> Version 타입
     * @return Versioned 인스턴스
     */
    public static <T, V> Versioned<T, V> of(T value, V version) {
        return new Versioned<>(value, version);
    }
}
