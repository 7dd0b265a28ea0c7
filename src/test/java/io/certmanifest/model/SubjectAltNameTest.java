package io.certmanifest.model;

import io.certmanifest.exception.InvalidSanException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubjectAltNameTest {

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("should parse DNS names")
        void shouldParseDns() {
            SubjectAltName san = SubjectAltName.parse("DNS:www.example.com");

            assertEquals(SubjectAltName.Type.DNS, san.getType());
            assertEquals("www.example.com", san.getValue());
            assertEquals("DNS:www.example.com", san.toString());
        }

        @Test
        @DisplayName("should parse IP addresses into an InetAddress")
        void shouldParseIp() {
            SubjectAltName san = SubjectAltName.parse("IP:127.0.0.1");

            assertEquals(SubjectAltName.Type.IP, san.getType());
            assertArrayEquals(new byte[] {127, 0, 0, 1}, san.getAddress().getAddress());
        }

        @Test
        @DisplayName("should parse IPv6 addresses")
        void shouldParseIpv6() {
            SubjectAltName san = SubjectAltName.parse("IP:::1");

            assertEquals(16, san.getAddress().getAddress().length);
        }

        @Test
        @DisplayName("should parse URIs")
        void shouldParseUri() {
            SubjectAltName san = SubjectAltName.parse("URI:spiffe://myworkload");

            assertEquals(SubjectAltName.Type.URI, san.getType());
            assertEquals("spiffe", san.getUri().getScheme());
            assertEquals("myworkload", san.getUri().getHost());
        }

        @Test
        @DisplayName("should match the prefix case-insensitively")
        void shouldIgnorePrefixCase() {
            assertEquals(SubjectAltName.dns("host"), SubjectAltName.parse("dns:host"));
        }

        @Test
        @DisplayName("should reject values without a prefix")
        void shouldRejectMissingPrefix() {
            InvalidSanException e = assertThrows(InvalidSanException.class,
                () -> SubjectAltName.parse("www.example.com"));
            assertEquals("www.example.com", e.getValue());
        }

        @Test
        @DisplayName("should reject unknown prefixes")
        void shouldRejectUnknownPrefix() {
            assertThrows(InvalidSanException.class, () -> SubjectAltName.parse("EMAIL:a@example.com"));
        }

        @Test
        @DisplayName("should reject host names in IP entries")
        void shouldRejectHostnameAsIp() {
            assertThrows(InvalidSanException.class, () -> SubjectAltName.parse("IP:localhost"));
            assertThrows(InvalidSanException.class, () -> SubjectAltName.parse("IP:300.1.1.1"));
        }

        @Test
        @DisplayName("should reject malformed URIs")
        void shouldRejectBadUri() {
            assertThrows(InvalidSanException.class, () -> SubjectAltName.parse("URI:http://exa mple.com"));
        }
    }

    @Test
    @DisplayName("should sort by textual form")
    void shouldSort() {
        List<SubjectAltName> sans = new ArrayList<>(List.of(
            SubjectAltName.parse("URI:spiffe://a"),
            SubjectAltName.parse("DNS:b.example.com"),
            SubjectAltName.parse("IP:10.0.0.1")));

        Collections.sort(sans);

        assertEquals("DNS:b.example.com", sans.get(0).toString());
        assertEquals("IP:10.0.0.1", sans.get(1).toString());
        assertEquals("URI:spiffe://a", sans.get(2).toString());
    }
}
