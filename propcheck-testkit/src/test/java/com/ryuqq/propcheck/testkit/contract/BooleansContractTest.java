package com.ryuqq.propcheck.testkit.contract;

import com.ryuqq.propcheck.core.domain.Domain;
import com.ryuqq.propcheck.core.domain.Domains;

/**
 * Contract Test for booleans (exhaustive by construction).
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class BooleansContractTest extends AbstractDomainContractTest<Boolean> {

    @Override
    protected Domain<Boolean> domain() {
        return Domains.booleans();
    }
}
