package rc.core.normalize;

public record FormField(String name, String value) {

    public FormField {
        if (name == null) throw new IllegalArgumentException("name cannot be null");
        if (value == null) throw new IllegalArgumentException("value cannot be null");
    }
}
