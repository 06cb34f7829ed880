package rc.core.normalize;

import java.util.Arrays;
import java.util.Objects;

/**
 * Bytes passed through untouched, for content types the normalizer does not decode.
 *
 * @param contentType the declared content type verbatim, null when absent
 * @param bytes payload
 */
public record RawBody(String contentType, byte[] bytes) implements CanonicalBody {

    public static final RawBody EMPTY = new RawBody(null, new byte[0]);

    public RawBody {
        bytes = bytes == null ? new byte[0] : bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public Kind kind() {
        return Kind.RAW;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawBody other)) return false;
        return Objects.equals(contentType, other.contentType) && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(contentType) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RawBody[contentType=" + contentType + ", length=" + bytes.length + "]";
    }
}
