package com.delta.digest;

import com.delta.digest.aggregate.model.SourceType;
import com.delta.digest.aggregate.source.SourceAdapterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@ActiveProfiles("test")
class DigestApplicationTest {

    @Autowired
    private SourceAdapterRegistry registry;

    @Test
    void everySourceTypeHasAnAdapter() {
        for (SourceType type : SourceType.values()) {
            assertNotNull(registry.forType(type), type.code());
        }
    }
}
