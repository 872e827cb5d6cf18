package com.tribune.aggregator.util;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @Test
    void resolveAgainstOrigin_absoluteUnchanged() {
        assertEquals("https://a.example.com/x", UrlUtils.resolveAgainstOrigin("https://a.example.com/x", "https://b.example.com/feed"));
        assertEquals("HTTP://A.example.com/x", UrlUtils.resolveAgainstOrigin("HTTP://A.example.com/x", "https://b.example.com"));
    }

    @Test
    void resolveAgainstOrigin_relativeUsesSchemeAndHostOnly() {
        assertEquals("https://b.example.com/news/1", UrlUtils.resolveAgainstOrigin("/news/1", "https://b.example.com/section/feed.xml?x=1"));
        assertEquals("https://b.example.com/news/1", UrlUtils.resolveAgainstOrigin("news/1", "https://b.example.com/section/"));
        assertEquals("http://b.example.com:8080/p", UrlUtils.resolveAgainstOrigin("/p", "http://b.example.com:8080/feed"));
    }

    @Test
    void resolveAgainstOrigin_unresolvable_returnsRaw() {
        assertEquals("/news/1", UrlUtils.resolveAgainstOrigin("/news/1", "not a base"));
        assertEquals("/news/1", UrlUtils.resolveAgainstOrigin("/news/1", "relative/base"));
    }

    @Test
    void host_lowercasesAndHandlesGarbage() {
        assertEquals(Optional.of("www.example.com"), UrlUtils.host("https://WWW.Example.com/a"));
        assertTrue(UrlUtils.host("bad url").isEmpty());
        assertTrue(UrlUtils.host(null).isEmpty());
    }

    @Test
    void sha256Hex_isStableAndHex() {
        String a = UrlHasher.sha256Hex("https://example.com/a");
        assertEquals(a, UrlHasher.sha256Hex("https://example.com/a"));
        assertNotEquals(a, UrlHasher.sha256Hex("https://example.com/b"));
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", UrlHasher.sha256Hex(""));
    }
}
