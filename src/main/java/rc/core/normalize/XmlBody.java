package rc.core.normalize;

public record XmlBody(XmlElement root) implements CanonicalBody {

    public XmlBody {
        if (root == null) throw new IllegalArgumentException("root cannot be null");
    }

    @Override
    public Kind kind() {
        return Kind.XML;
    }
}
