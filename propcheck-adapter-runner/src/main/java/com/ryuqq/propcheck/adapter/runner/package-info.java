/**
 * Runner Adapter Layer - PropertyChecker 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.propcheck.adapter.runner.QuantifierEngine} - 전칭/존재 한정 평가 엔진</li>
 *   <li>{@link com.ryuqq.propcheck.adapter.runner.EngineConfig} - 엔진 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (QuantifierEngine)
 *   ↓ implements
 * application (PropertyChecker interface)
 *   ↓ depends on
 * core (Domain, Property, Outcome, EvaluationState)
 * </pre>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
package com.ryuqq.propcheck.adapter.runner;
