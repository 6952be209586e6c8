package com.pagewatch.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashingUtilsTest {
    @Test
    void sha256IsDeterministicAndHexEncoded() {
        String hash = HashingUtils.sha256("hello");

        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", hash);
        assertEquals(hash, HashingUtils.sha256("hello"));
        assertTrue(hash.matches("[0-9a-f]{64}"));
    }

    @Test
    void sha256ProducesDifferentHashesForDifferentInputs() {
        assertNotEquals(HashingUtils.sha256("Hello"), HashingUtils.sha256("Hello World"));
    }

    @Test
    void sha256HashesUtf8Bytes() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", HashingUtils.sha256(""));
        assertNotEquals(HashingUtils.sha256("cafe"), HashingUtils.sha256("café"));
    }
}
