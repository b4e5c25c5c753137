package com.prism.service.core.apikey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ApiKeyCodecTest {

    private final ApiKeyCodec codec = new ApiKeyCodec("test-salt");

    @Test
    void generatedKeyVerifiesAgainstItsHash() {
        ApiKeyCodec.GeneratedKey key = codec.generate();

        assertThat(key.plaintext()).matches("prk_[0-9a-f]{8}_[0-9a-f]{48}");
        assertEquals(key.prefix(), ApiKeyCodec.parse(key.plaintext()).prefix());
        assertTrue(codec.verify(key.plaintext(), key.secretHash()));
        assertThat(key.secretHash()).doesNotContain(ApiKeyCodec.parse(key.plaintext()).secret());
    }

    @Test
    void hashDependsOnSalt() {
        ApiKeyCodec.GeneratedKey key = codec.generate();

        assertFalse(new ApiKeyCodec("other-salt").verify(key.plaintext(), key.secretHash()));
        assertFalse(codec.verify(key.plaintext() + "0", key.secretHash()));
    }

    @Test
    void parseRejectsMalformedKeys() {
        assertNull(ApiKeyCodec.parse(null));
        assertNull(ApiKeyCodec.parse("abc"));
        assertNull(ApiKeyCodec.parse("key_0a1b2c3d_secret"));
        assertNull(ApiKeyCodec.parse("prk__secret"));
        assertNull(ApiKeyCodec.parse("prk_0a1b2c3d_"));
        assertNull(ApiKeyCodec.parse("prk_0a1b_2c3d_secret"));
        assertEquals(new ApiKeyCodec.ParsedKey("0a1b2c3d", "s3cr3t"), ApiKeyCodec.parse(" prk_0a1b2c3d_s3cr3t "));
    }

    @Test
    void emptySaltIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ApiKeyCodec(""));
    }
}
