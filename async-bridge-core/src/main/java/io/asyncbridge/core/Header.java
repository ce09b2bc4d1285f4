package io.asyncbridge.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single header as a name/value byte pair.
 *
 * <p>Bytes are carried as-is; {@link #of(String, String)} and the {@code *AsString} accessors use
 * ISO-8859-1 so that every byte value survives a round trip.
 */
public record Header(byte[] name, byte[] value) {

    public Header {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        name = name.clone();
        value = value.clone();
    }

    public static Header of(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        return new Header(name.getBytes(StandardCharsets.ISO_8859_1), value.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Override
    public byte[] name() {
        return name.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    public String nameAsString() {
        return new String(name, StandardCharsets.ISO_8859_1);
    }

    public String valueAsString() {
        return new String(value, StandardCharsets.ISO_8859_1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Header other)) return false;
        return Arrays.equals(name, other.name) && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(name) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return nameAsString() + ": " + valueAsString();
    }
}
