package com.ryuqq.propcheck.adapter.runner;

import com.ryuqq.propcheck.application.checker.CheckOptions;
import com.ryuqq.propcheck.application.checker.PropertyChecker;
import com.ryuqq.propcheck.core.outcome.Fail;
import com.ryuqq.propcheck.core.outcome.Outcome;
import com.ryuqq.propcheck.core.property.Property;
import com.ryuqq.propcheck.core.seed.Seed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 전칭/존재 한정을 평가하는 PropertyChecker 구현체.
 *
 * <p><strong>평가 규칙:</strong></p>
 * <ul>
 *   <li>전칭 (forAll): exhaustive 도메인은 전체 열거, 아니면 샘플 수만큼 draw.
 *       첫 반례에서 종료</li>
 *   <li>존재 (exists): exhaustive 도메인만 허용. 첫 만족 바인딩에서 Pass,
 *       모두 실패하면 Fail(EXISTENTIAL_UNSATISFIED)</li>
 *   <li>조건이 예외를 던지면 Fail(PREDICATE_ERROR)</li>
 * </ul>
 *
 * <p><strong>비용:</strong> 중첩 전칭의 조건 평가 횟수는 각 레벨 샘플 수의 곱입니다
 * (N1 × N2 × ...).</p>
 *
 * <p><strong>스레드 안전성:</strong> 검사별 상태는 {@link Evaluation}에만 있으므로
 * 하나의 엔진을 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * <p><strong>로깅:</strong></p>
 * <ul>
 *   <li>INFO: 검사 시작, 완료 (속성 이름, 시드, 평가 횟수)</li>
 *   <li>DEBUG: 상태 전이</li>
 *   <li>ERROR: 사용 오류나 생성 실패로 검사가 중단된 경우 (재실행용 시드 포함)</li>
 * </ul>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
public final class QuantifierEngine implements PropertyChecker {

    private static final Logger log = LoggerFactory.getLogger(QuantifierEngine.class);

    private final EngineConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public QuantifierEngine() {
        this(new EngineConfig());
    }

    /**
     * 생성자.
     *
     * @param config 엔진 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public QuantifierEngine(EngineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public Outcome check(Property property, CheckOptions options) {
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        Seed seed = options.resolveSeed();
        int sampleCount = options.sampleCount() != null ? options.sampleCount() : config.defaultSampleCount();
        log.info("Property check started: {} (seed: {}, samples: {})", property.getName(), seed.getValue(), sampleCount);

        Evaluation evaluation = new Evaluation(property, seed, sampleCount);
        Outcome outcome;
        try {
            outcome = evaluation.run();
        } catch (RuntimeException e) {
            log.error("Property check aborted: {} (seed: {}, evaluations: {})",
                property.getName(), seed.getValue(), evaluation.getEvaluations(), e);
            throw e;
        }

        if (outcome instanceof Fail fail) {
            log.info("Property check failed: {} {} (seed: {}, evaluations: {}, witness: {})",
                property.getName(), fail.kind(), seed.getValue(), fail.evaluations(), fail.witness());
        } else {
            log.info("Property check passed: {} (seed: {}, evaluations: {})",
                property.getName(), seed.getValue(), outcome.evaluations());
        }
        return outcome;
    }

    public EngineConfig getConfig() {
        return config;
    }
}
