package com.ryuqq.propcheck.testkit.contract;

import com.ryuqq.propcheck.core.domain.Domain;
import com.ryuqq.propcheck.core.domain.Domains;

/**
 * Contract Test for a mapped exhaustive domain.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class MappedContractTest extends AbstractDomainContractTest<String> {

    @Override
    protected Domain<String> domain() {
        return Domains.integers(0, 20).exhaustive().map(x -> "v" + x);
    }
}
