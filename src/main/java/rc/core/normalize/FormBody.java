package rc.core.normalize;

import java.util.List;
import java.util.Optional;

/**
 * Ordered multi-map decoded from application/x-www-form-urlencoded.
 * Keys may repeat; document order is preserved.
 */
public record FormBody(List<FormField> fields) implements CanonicalBody {

    public FormBody {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    @Override
    public Kind kind() {
        return Kind.FORM;
    }

    public Optional<String> first(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).map(FormField::value).findFirst();
    }

    public List<String> all(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).map(FormField::value).toList();
    }
}
