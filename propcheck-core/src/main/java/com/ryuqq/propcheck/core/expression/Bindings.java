package com.ryuqq.propcheck.core.expression;

import com.ryuqq.propcheck.core.exception.UsageException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 한정된 변수 이름과 현재 값의 불변 매핑.
 *
 * <p>선언 순서(바깥 → 안쪽)를 유지합니다. 값은 null일 수 있습니다.
 * 바인더의 입력이자, 실패 시 보고되는 증인(witness)입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Bindings bindings = Bindings.empty().with("x", 3).with("y", 2);
 * int x = bindings.get("x", Integer.class);
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class Bindings {

    private static final Bindings EMPTY = new Bindings(new LinkedHashMap<>());

    private final Map<String, Object> values;

    private Bindings(LinkedHashMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * 빈 Bindings.
     *
     * @return 빈 인스턴스
     */
    public static Bindings empty() {
        return EMPTY;
    }

    /**
     * 변수 하나를 추가한 새 Bindings 생성.
     *
     * @param name 변수 이름
     * @param value 값 (null 허용)
     * @return 새 Bindings
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     * @throws UsageException 이미 바인딩된 변수인 경우 (shadowing)
     */
    public Bindings with(String name, Object value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (values.containsKey(name)) {
            throw new UsageException("Variable " + name + " is already bound (shadowing)");
        }
        LinkedHashMap<String, Object> next = new LinkedHashMap<>(values);
        next.put(name, value);
        return new Bindings(next);
    }

    /**
     * 변수 값 조회.
     *
     * @param name 변수 이름
     * @return 값 (null 가능)
     * @throws UsageException 바인딩되지 않은 변수인 경우
     */
    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new UsageException("Variable " + name + " is not bound (bound: " + values.keySet() + ")");
        }
        return values.get(name);
    }

    /**
     * 기대 타입으로 변수 값 조회.
     *
     * @param name 변수 이름
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 값 (null 가능)
     * @throws UsageException 바인딩되지 않았거나 값의 타입이 다른 경우
     */
    public <T> T get(String name, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Object value = get(name);
        if (value != null && !type.isInstance(value)) {
            throw new UsageException(
                "Variable " + name + " is " + value.getClass().getName() + ", not " + type.getName()
            );
        }
        return type.cast(value);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * 주어진 이름만 남긴 Bindings 생성.
     *
     * @param names 남길 변수 이름
     * @return 제한된 Bindings (원래 순서 유지)
     * @throws UsageException 바인딩되지 않은 이름이 있는 경우
     */
    public Bindings restrictTo(Collection<String> names) {
        for (String name : names) {
            if (!values.containsKey(name)) {
                throw new UsageException("Free variable " + name + " is not bound (bound: " + values.keySet() + ")");
            }
        }
        LinkedHashMap<String, Object> restricted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (names.contains(entry.getKey())) {
                restricted.put(entry.getKey(), entry.getValue());
            }
        }
        return new Bindings(restricted);
    }

    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    /**
     * 불변 Map 뷰 (선언 순서 유지).
     *
     * @return 변수 이름 → 값
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Bindings bindings = (Bindings) o;
        return values.equals(bindings.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
