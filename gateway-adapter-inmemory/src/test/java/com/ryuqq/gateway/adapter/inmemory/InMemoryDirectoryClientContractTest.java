package com.ryuqq.gateway.adapter.inmemory;

import com.ryuqq.gateway.core.spi.DirectoryClient;
import com.ryuqq.gateway.testkit.contract.AbstractDirectoryClientContractTest;

/**
 * Contract Tests for {@link InMemoryDirectoryClient}.
 *
 * @author Gateway Team
 * @since 1.0.0
 */
class InMemoryDirectoryClientContractTest extends AbstractDirectoryClientContractTest {

    @Override
    protected DirectoryClient createClient() {
        return new InMemoryDirectoryClient();
    }

    @Override
    protected String registerApplication(DirectoryClient directoryClient) {
        ((InMemoryDirectoryClient) directoryClient).registerApplication("0oa-contract");
        return "0oa-contract";
    }

    @Override
    protected String unsupportedOperatorToken() {
        return "ew";
    }

    @Override
    protected void cleanUp(DirectoryClient directoryClient) {
        ((InMemoryDirectoryClient) directoryClient).clear();
    }
}
