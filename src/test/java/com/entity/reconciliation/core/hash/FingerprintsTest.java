package com.entity.reconciliation.core.hash;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fingerprints Tests")
class FingerprintsTest {

    @Test
    @DisplayName("Fingerprint is the MD5 of values joined by '|'")
    void fingerprintMatchesJoinedMd5() {
        // md5("") is a well-known constant
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", Fingerprints.md5Hex(""));
        assertEquals(Fingerprints.md5Hex("JOHN|DOE|50"), Fingerprints.fingerprint(List.of("JOHN", "DOE", 50L)));
    }

    @Test
    @DisplayName("Null renders as empty string")
    void nullRendersEmpty() {
        assertEquals(Fingerprints.md5Hex("JOHN||DOE"), Fingerprints.fingerprint(Arrays.asList("JOHN", null, "DOE")));
        assertEquals("", Fingerprints.render(null));
    }

    @Test
    @DisplayName("Value order matters")
    void orderMatters() {
        assertNotEquals(Fingerprints.fingerprint(List.of("A", "B")), Fingerprints.fingerprint(List.of("B", "A")));
    }

    @Test
    @DisplayName("Decimals render without exponent")
    void decimalRendering() {
        assertEquals("1000", Fingerprints.render(new BigDecimal("1E+3")));
    }

    @Test
    @DisplayName("Attribute digest ignores map insertion order")
    void attributeDigestOrderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", "1");
        first.put("b", null);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", null);
        second.put("a", "1");

        assertEquals(Fingerprints.attributeDigest(first), Fingerprints.attributeDigest(second));
    }
}
