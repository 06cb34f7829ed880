package rc.core.normalize;

/**
 * Content-type independent representation of a response payload.
 *
 * The set of variants is closed; consumers dispatch with a switch over {@link #kind()} and the
 * compiler checks the switch is exhaustive.
 */
public sealed interface CanonicalBody permits JsonBody, XmlBody, FormBody, TextBody, RawBody {

    enum Kind {
        JSON,
        XML,
        FORM,
        TEXT,
        RAW
    }

    Kind kind();
}
