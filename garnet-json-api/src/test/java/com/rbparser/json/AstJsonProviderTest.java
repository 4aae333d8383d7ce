package com.rbparser.json;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonProviderTest {

    @Test
    void noProviderWithoutImplementation() {
        assertFalse(AstJsonProvider.isProviderAvailable());
        IllegalStateException error = assertThrows(IllegalStateException.class, AstJsonProvider::getProvider);
        assertTrue(error.getMessage().contains("garnet-jackson"));
    }

    @Test
    void unknownNameIsReported() {
        IllegalStateException error =
            assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
        assertTrue(error.getMessage().contains("gson"));
    }
}
