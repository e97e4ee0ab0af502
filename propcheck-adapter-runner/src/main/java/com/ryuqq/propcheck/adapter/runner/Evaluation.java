package com.ryuqq.propcheck.adapter.runner;

import com.ryuqq.propcheck.core.domain.Domain;
import com.ryuqq.propcheck.core.exception.PropertyCheckException;
import com.ryuqq.propcheck.core.exception.UsageException;
import com.ryuqq.propcheck.core.expression.Bindings;
import com.ryuqq.propcheck.core.outcome.Fail;
import com.ryuqq.propcheck.core.outcome.FailureKind;
import com.ryuqq.propcheck.core.outcome.Outcome;
import com.ryuqq.propcheck.core.outcome.Pass;
import com.ryuqq.propcheck.core.property.Property;
import com.ryuqq.propcheck.core.property.Quantifier;
import com.ryuqq.propcheck.core.property.QuantifierKind;
import com.ryuqq.propcheck.core.seed.Seed;
import com.ryuqq.propcheck.core.statemachine.EvaluationState;
import com.ryuqq.propcheck.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;

/**
 * 속성 검사 한 번의 평가 상태.
 *
 * <p>검사마다 새로 만들어지며 재사용되지 않습니다. 상태 머신과 평가 횟수를 보관하고,
 * 한정자를 바깥에서 안쪽으로 재귀 평가합니다.</p>
 *
 * <p><strong>레벨 시드:</strong> 루트 레벨 시드는 검사 시드이고, 샘플 i 아래의 중첩 레벨은
 * {@code levelSeed.child(-(i + 1))}을 사용합니다. 샘플 i의 값은 {@code levelSeed.child(i)}로
 * 뽑으므로 둘은 겹치지 않습니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class Evaluation {

    private static final Logger log = LoggerFactory.getLogger(Evaluation.class);

    private final Property property;
    private final Seed seed;
    private final int fallbackSampleCount;
    private final List<Quantifier> quantifiers;

    private EvaluationState state = EvaluationState.INIT;
    private long evaluations;

    Evaluation(Property property, Seed seed, int fallbackSampleCount) {
        this.property = property;
        this.seed = seed;
        this.fallbackSampleCount = fallbackSampleCount;
        this.quantifiers = property.getQuantifiers();
    }

    /**
     * 평가 실행.
     *
     * @return Pass 또는 Fail
     * @throws IllegalStateException 이미 실행된 경우
     */
    Outcome run() {
        transition(EvaluationState.SAMPLING);
        Verdict verdict = evaluate(0, Bindings.empty(), seed);

        if (verdict.holds()) {
            transition(EvaluationState.PASS);
            return new Pass(seed, verdict.witness(), evaluations);
        }
        transition(EvaluationState.FAIL);
        return new Fail(seed, verdict.kind(), verdict.witness(), evaluations, verdict.message(), verdict.cause());
    }

    EvaluationState getState() {
        return state;
    }

    long getEvaluations() {
        return evaluations;
    }

    private Verdict evaluate(int level, Bindings bindings, Seed levelSeed) {
        if (level == quantifiers.size()) {
            return checkPredicate(bindings);
        }
        Quantifier quantifier = quantifiers.get(level);
        Domain<?> domain = quantifier.expression().resolve(bindings);

        if (quantifier.kind() == QuantifierKind.FORALL) {
            return forAll(level, quantifier, domain, bindings, levelSeed);
        }
        return exists(level, quantifier, domain, bindings, levelSeed);
    }

    private Verdict forAll(int level, Quantifier quantifier, Domain<?> domain, Bindings bindings, Seed levelSeed) {
        if (domain.isExhaustive()) {
            Iterator<?> values = domain.enumerate().iterator();
            int index = 0;
            while (values.hasNext()) {
                Verdict inner = evaluate(level + 1, bindings.with(quantifier.variable(), values.next()), nested(levelSeed, index++));
                if (!inner.holds()) {
                    return inner;
                }
            }
            return Verdict.held(Bindings.empty());
        }

        int sampleCount = quantifier.effectiveSampleCount(fallbackSampleCount);
        for (int i = 0; i < sampleCount; i++) {
            Object value = domain.draw(levelSeed.child(i));
            Verdict inner = evaluate(level + 1, bindings.with(quantifier.variable(), value), nested(levelSeed, i));
            if (!inner.holds()) {
                return inner;
            }
        }
        return Verdict.held(Bindings.empty());
    }

    private Verdict exists(int level, Quantifier quantifier, Domain<?> domain, Bindings bindings, Seed levelSeed) {
        if (!domain.isExhaustive()) {
            throw new UsageException(String.format(
                "Existential quantifier over %s requires an exhaustive domain: %s", quantifier.variable(), domain));
        }
        Iterator<?> values = domain.enumerate().iterator();
        int index = 0;
        while (values.hasNext()) {
            Bindings next = bindings.with(quantifier.variable(), values.next());
            Verdict inner = evaluate(level + 1, next, nested(levelSeed, index++));
            if (inner.holds()) {
                return Verdict.held(inner.witness().isEmpty() ? next : inner.witness());
            }
            if (inner.kind() == FailureKind.PREDICATE_ERROR) {
                return inner;
            }
        }
        return Verdict.failed(
            FailureKind.EXISTENTIAL_UNSATISFIED,
            bindings,
            String.format("No value of %s satisfies %s", quantifier.variable(), property.getName()),
            null
        );
    }

    private Verdict checkPredicate(Bindings bindings) {
        transition(EvaluationState.PREDICATE_CHECK);
        evaluations++;
        Verdict verdict;
        try {
            verdict = property.getPredicate().test(bindings)
                ? Verdict.held(Bindings.empty())
                : Verdict.failed(FailureKind.COUNTEREXAMPLE, bindings,
                    String.format("Counterexample for %s: %s", property.getName(), bindings), null);
        } catch (PropertyCheckException e) {
            throw e;
        } catch (Exception | AssertionError e) {
            verdict = Verdict.failed(FailureKind.PREDICATE_ERROR, bindings,
                String.format("Predicate of %s threw %s at %s", property.getName(), e, bindings), e);
        }
        transition(EvaluationState.SAMPLING);
        return verdict;
    }

    private static Seed nested(Seed levelSeed, int index) {
        return levelSeed.child(-(index + 1));
    }

    private void transition(EvaluationState next) {
        EvaluationState previous = state;
        state = StateTransition.transition(state, next);
        if (log.isDebugEnabled()) {
            log.debug("{} {} → {} (evaluations: {})", property.getName(), previous, next, evaluations);
        }
    }

    /**
     * 한 레벨의 평가 결과.
     *
     * @param holds 성립 여부
     * @param kind 실패 종류 (성립 시 null)
     * @param witness 증인 바인딩
     * @param message 실패 메시지 (성립 시 null)
     * @param cause 원인 (PREDICATE_ERROR에서만)
     */
    private record Verdict(boolean holds, FailureKind kind, Bindings witness, String message, Throwable cause) {

        static Verdict held(Bindings witness) {
            return new Verdict(true, null, witness, null, null);
        }

        static Verdict failed(FailureKind kind, Bindings witness, String message, Throwable cause) {
            return new Verdict(false, kind, witness, message, cause);
        }
    }
}
