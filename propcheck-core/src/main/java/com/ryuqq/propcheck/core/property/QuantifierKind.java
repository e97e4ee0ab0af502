package com.ryuqq.propcheck.core.property;

/**
 * 한정자 종류.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public enum QuantifierKind {

    /**
     * 전칭 한정 (모든 샘플에 대해 성립).
     */
    FORALL,

    /**
     * 존재 한정 (exhaustive 도메인의 어떤 원소에 대해 성립).
     */
    EXISTS
}
