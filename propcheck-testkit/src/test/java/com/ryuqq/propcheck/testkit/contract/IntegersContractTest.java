package com.ryuqq.propcheck.testkit.contract;

import com.ryuqq.propcheck.core.domain.Domain;
import com.ryuqq.propcheck.core.domain.Domains;

/**
 * Contract Test for bounded integers (not exhaustive).
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class IntegersContractTest extends AbstractDomainContractTest<Integer> {

    @Override
    protected Domain<Integer> domain() {
        return Domains.integers(-50, 50);
    }
}
