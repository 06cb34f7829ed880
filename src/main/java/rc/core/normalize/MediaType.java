package rc.core.normalize;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;

/**
 * A Content-Type header reduced to what decoding needs: lower-cased type/subtype and charset.
 * Every other parameter is dropped.
 */
record MediaType(String essence, Charset charset) {

    static final MediaType NONE = new MediaType("", StandardCharsets.UTF_8);

    static MediaType parse(String header) {
        if (header == null || header.isBlank()) return NONE;

        String[] parts = header.split(";");
        String essence = parts[0].trim().toLowerCase(Locale.ROOT);
        Charset charset = StandardCharsets.UTF_8;
        for (int i = 1; i < parts.length; i++) {
            String param = parts[i].trim();
            int eq = param.indexOf('=');
            if (eq <= 0) continue;
            if (!param.substring(0, eq).trim().equalsIgnoreCase("charset")) continue;
            String name = param.substring(eq + 1).trim().replace("\"", "");
            try {
                charset = Charset.forName(name);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                // unknown charset: keep UTF-8
                charset = StandardCharsets.UTF_8;
            }
        }
        return new MediaType(essence, charset);
    }

    boolean isJson() {
        return essence.equals("application/json")
            || essence.endsWith("+json")
            || essence.equals("application/javascript")
            || essence.equals("text/javascript");
    }

    boolean isXml() {
        return essence.equals("application/xml")
            || essence.equals("text/xml")
            || essence.endsWith("+xml");
    }

    boolean isForm() {
        return essence.equals("application/x-www-form-urlencoded");
    }

    boolean isText() {
        return essence.equals("text/plain")
            || essence.equals("text/html")
            || essence.equals("application/jwt");
    }
}
