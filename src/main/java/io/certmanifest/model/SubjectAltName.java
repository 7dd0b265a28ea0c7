package io.certmanifest.model;

import io.certmanifest.exception.InvalidSanException;
import org.bouncycastle.util.IPAddress;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Objects;

/**
 * Subject alternative name parsed from a type-prefixed manifest value such as
 * {@code DNS:www.example.com}, {@code IP:127.0.0.1} or {@code URI:spiffe://workload}.
 *
 * <p>The value is parsed once, here; certificate building only switches on {@link #getType()}.
 */
public final class SubjectAltName implements Comparable<SubjectAltName> {

    public enum Type {
        DNS("DNS"),
        IP("IP"),
        URI("URI");

        private final String prefix;

        Type(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    private final Type type;
    private final String value;
    private final InetAddress address;
    private final URI uri;

    private SubjectAltName(Type type, String value, InetAddress address, URI uri) {
        this.type = type;
        this.value = value;
        this.address = address;
        this.uri = uri;
    }

    public static SubjectAltName dns(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidSanException("Empty DNS name", name);
        }
        return new SubjectAltName(Type.DNS, name, null, null);
    }

    public static SubjectAltName ip(String literal) {
        if (literal == null || !IPAddress.isValid(literal)) {
            throw new InvalidSanException("Invalid IP address: " + literal, literal);
        }
        try {
            // literal addresses are never looked up
            InetAddress address = InetAddress.getByName(literal);
            return new SubjectAltName(Type.IP, address.getHostAddress(), address, null);
        } catch (UnknownHostException e) {
            throw new InvalidSanException("Invalid IP address: " + literal, literal, e);
        }
    }

    public static SubjectAltName uri(String text) {
        if (text == null || text.isEmpty()) {
            throw new InvalidSanException("Empty URI", text);
        }
        try {
            URI uri = new URI(text);
            return new SubjectAltName(Type.URI, uri.toString(), null, uri);
        } catch (URISyntaxException e) {
            throw new InvalidSanException("Invalid URI: " + text, text, e);
        }
    }

    /**
     * Parse a prefixed value. The prefix is matched case-insensitively.
     *
     * @param entry manifest value, e.g. {@code DNS:host.example.com}
     * @return parsed name
     * @throws InvalidSanException if the prefix is unknown or the value cannot be parsed
     */
    public static SubjectAltName parse(String entry) {
        if (entry == null) {
            throw new InvalidSanException("Missing subject alternative name", null);
        }
        int colon = entry.indexOf(':');
        if (colon <= 0) {
            throw new InvalidSanException("Subject alternative name without type prefix: " + entry, entry);
        }
        String prefix = entry.substring(0, colon).trim().toUpperCase(Locale.ROOT);
        String value = entry.substring(colon + 1).trim();

        switch (prefix) {
            case "DNS":
                return dns(value);
            case "IP":
                return ip(value);
            case "URI":
                return uri(value);
            default:
                throw new InvalidSanException("Unknown subject alternative name type: " + prefix, entry);
        }
    }

    public Type getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the parsed address, only for {@link Type#IP}
     */
    public InetAddress getAddress() {
        return address;
    }

    /**
     * @return the parsed URI, only for {@link Type#URI}
     */
    public URI getUri() {
        return uri;
    }

    @Override
    public int compareTo(SubjectAltName other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubjectAltName that = (SubjectAltName) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type.getPrefix() + ":" + value;
    }
}
