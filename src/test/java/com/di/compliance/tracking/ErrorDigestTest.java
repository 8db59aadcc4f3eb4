package com.di.compliance.tracking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorDigest Tests")
class ErrorDigestTest {

    @Test
    @DisplayName("Empty digest renders as null")
    void testRender_Empty() {
        ErrorDigest digest = new ErrorDigest(3, 100);
        assertNull(digest.render());
        assertTrue(digest.isEmpty());
        assertEquals("", digest.toString());
    }

    @Test
    @DisplayName("Only the first entries are enumerated, the rest are counted")
    void testRender_RemainderCounted() {
        ErrorDigest digest = new ErrorDigest(2, 200);
        digest.add("first");
        digest.add("second");
        digest.add("third");
        digest.add("fourth");

        assertEquals("first; second (+2 more)", digest.render());
        assertEquals(4, digest.getTotal());
    }

    @Test
    @DisplayName("Rendered text never exceeds the length bound")
    void testRender_Truncated() {
        ErrorDigest digest = new ErrorDigest(5, 30);
        digest.add("Row 1: Missing required field 'site'");
        digest.add("Row 2: Missing required field 'site'");

        String text = digest.render();
        assertTrue(text.length() <= 30, text);
        assertTrue(text.endsWith("..."), text);
    }

    @Test
    @DisplayName("addFirst puts a fatal reason in front")
    void testAddFirst() {
        ErrorDigest digest = new ErrorDigest(2, 200);
        digest.add("row failure");
        digest.add("other failure");
        digest.addFirst("rolled back");

        assertEquals("rolled back; row failure (+1 more)", digest.render());
    }

    @Test
    @DisplayName("Should reject unusable bounds")
    void testConstructor_InvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ErrorDigest(0, 100));
        assertThrows(IllegalArgumentException.class, () -> new ErrorDigest(3, 5));
    }
}
