/**
 * PropCheck Application Layer - 속성 검사 API.
 *
 * <p>이 패키지는 속성 검사의 포트(인터페이스)와 검사 옵션을 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.propcheck.application.checker.PropertyChecker} - 속성 검사기</li>
 *   <li>{@link com.ryuqq.propcheck.application.checker.CheckOptions} - 시드와 샘플 수 옵션</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>재현성:</strong> 모든 결과는 사용된 시드를 포함</li>
 * </ul>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
package com.ryuqq.propcheck.application.checker;
