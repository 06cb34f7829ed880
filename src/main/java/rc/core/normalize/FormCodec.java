package rc.core.normalize;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * application/x-www-form-urlencoded encoding and decoding with order preserved.
 */
public final class FormCodec {

    public static final String CONTENT_TYPE = "application/x-www-form-urlencoded";

    private FormCodec() {
    }

    public static byte[] encode(List<FormField> fields) {
        return encode(fields, StandardCharsets.UTF_8);
    }

    public static byte[] encode(List<FormField> fields, Charset charset) {
        StringBuilder sb = new StringBuilder();
        for (FormField field : fields) {
            if (sb.length() > 0) sb.append('&');
            sb.append(URLEncoder.encode(field.name(), charset))
                .append('=')
                .append(URLEncoder.encode(field.value(), charset));
        }
        return sb.toString().getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Decodes a form payload. A pair without '=' maps to an empty value; empty segments are skipped.
     *
     * @throws IllegalArgumentException on an invalid percent escape
     */
    public static List<FormField> decode(String payload, Charset charset) {
        List<FormField> fields = new ArrayList<>();
        if (payload == null || payload.isEmpty()) return fields;

        for (String pair : payload.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            fields.add(new FormField(URLDecoder.decode(name, charset), URLDecoder.decode(value, charset)));
        }
        return fields;
    }
}
