package com.ryuqq.propcheck.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 한 번의 draw 동안 전달되는 불변 컨텍스트.
 *
 * <p>현재 전개 중인 재귀 도메인 선언의 경로를 담습니다.
 * 자기 참조 핸들을 거치지 않고 이미 전개 중인 선언에 다시 들어가면
 * 상호 재귀로 판단합니다.</p>
 *
 * <p>경로는 draw 호출 트리를 따라 복사되며, 형제 컴포넌트 간에 공유되지 않습니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class DrawContext {

    private static final DrawContext ROOT = new DrawContext(List.of());

    private final List<Object> expanding;

    private DrawContext(List<Object> expanding) {
        this.expanding = expanding;
    }

    /**
     * 빈 컨텍스트.
     *
     * @return 루트 DrawContext
     */
    public static DrawContext root() {
        return ROOT;
    }

    boolean isExpanding(Object declaration) {
        for (Object each : expanding) {
            if (each == declaration) {
                return true;
            }
        }
        return false;
    }

    DrawContext enter(Object declaration) {
        List<Object> next = new ArrayList<>(expanding.size() + 1);
        next.addAll(expanding);
        next.add(declaration);
        return new DrawContext(Collections.unmodifiableList(next));
    }

    /**
     * 현재 전개 중인 재귀 선언 수.
     *
     * @return 전개 깊이
     */
    public int depth() {
        return expanding.size();
    }

    @Override
    public String toString() {
        return "DrawContext{depth=" + expanding.size() + '}';
    }
}
