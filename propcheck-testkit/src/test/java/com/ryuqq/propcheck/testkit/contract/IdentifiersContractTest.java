package com.ryuqq.propcheck.testkit.contract;

import com.ryuqq.propcheck.core.domain.Domain;
import com.ryuqq.propcheck.core.domain.Domains;

/**
 * Contract Test for identifier-shaped strings.
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
class IdentifiersContractTest extends AbstractDomainContractTest<String> {

    @Override
    protected Domain<String> domain() {
        return Domains.identifiers(1, 12);
    }
}
