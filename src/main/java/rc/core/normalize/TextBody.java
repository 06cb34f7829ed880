package rc.core.normalize;

/**
 * Decoded character payload (text/plain, text/html, application/jwt).
 *
 * @param mediaType normalized media type the text was declared as
 * @param text decoded content
 */
public record TextBody(String mediaType, String text) implements CanonicalBody {

    public TextBody {
        if (mediaType == null) throw new IllegalArgumentException("mediaType cannot be null");
        if (text == null) throw new IllegalArgumentException("text cannot be null");
    }

    @Override
    public Kind kind() {
        return Kind.TEXT;
    }
}
