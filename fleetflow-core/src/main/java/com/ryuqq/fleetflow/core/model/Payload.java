package com.ryuqq.fleetflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 메시지에 실리는 업무 데이터.
 *
 * <p>Payload는 협력 컴포넌트(분석, 고객 응대, 예약 등)가 주고받는 데이터를
 * 키-값 형태로 담습니다. 오케스트레이터는 내용을 해석하지 않고 전달만 하며,
 * 해석은 {@code DecisionPolicy} 같은 외부 정책이 담당합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>분석 결과: Payload.of(Map.of("predicted_days_to_failure", 3, "failure_probability", 0.82))</li>
 *   <li>고객 응답: Payload.of(Map.of("decision", "accepted"))</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시 입력 맵을 복사하며 이후 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 맵은 빈 Payload로 취급</li>
 *   <li>null 키 불가, null 값 불가</li>
 * </ul>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Map.of());

    private final Map<String, Object> values;

    private Payload(Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Payload key cannot be null or blank");
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Payload value cannot be null (key: " + entry.getKey() + ")");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Payload 생성.
     *
     * @param values 키-값 데이터 (null이면 빈 Payload)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException null 키 또는 null 값이 포함된 경우
     */
    public static Payload of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new Payload(new LinkedHashMap<>(values));
    }

    /**
     * 빈 Payload 생성.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 키 하나를 추가(또는 교체)한 새 Payload 생성.
     *
     * @param key 키
     * @param value 값
     * @return 새 Payload
     */
    public Payload with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new Payload(copy);
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * 문자열 값 조회.
     *
     * <p>값이 문자열이 아니면 {@code toString()} 결과를 반환합니다.</p>
     *
     * @param key 키
     * @return 문자열 값 (없으면 empty)
     */
    public Optional<String> getString(String key) {
        return get(key).map(Object::toString);
    }

    /**
     * 숫자 값 조회.
     *
     * <p>숫자 타입이면 그대로, 숫자 형식 문자열이면 파싱합니다.</p>
     *
     * @param key 키
     * @return double 값 (없거나 숫자가 아니면 empty)
     */
    public Optional<Double> getNumber(String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * 키 존재 여부.
     *
     * @param key 키
     * @return 존재하면 true
     */
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * 읽기 전용 맵 뷰.
     *
     * @return 변경 불가능한 맵
     */
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return values.equals(payload.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + values.size() + " keys}";
    }
}
