package rc.java.transport;

import rc.core.model.FailureClassification;
import rc.core.model.FailureClassification.Exposure;
import rc.core.model.FailureClassification.Reason;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.ProtocolException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps transport exceptions onto the failure taxonomy.
 *
 * <pre>
 * connect timeout, refused, unknown host   TRANSIENT  NOT_SENT
 * request timeout                          TRANSIENT  AMBIGUOUS
 * reset / EOF / other I/O                  TRANSIENT  AMBIGUOUS
 * TLS failure                              FATAL      NOT_SENT
 * HTTP protocol violation                  FATAL      AMBIGUOUS
 * request rejected by the transport        FATAL      NOT_SENT
 * </pre>
 */
public final class NetworkErrorClassifier {

    private NetworkErrorClassifier() {
    }

    public static FailureClassification classify(Throwable error) {
        Throwable t = unwrap(error);

        if (t instanceof HttpConnectTimeoutException) {
            return FailureClassification.transientNetwork(Reason.TIMEOUT, Exposure.NOT_SENT);
        }
        if (t instanceof HttpTimeoutException) {
            return FailureClassification.transientNetwork(Reason.TIMEOUT, Exposure.AMBIGUOUS);
        }
        if (t instanceof ConnectException || t instanceof NoRouteToHostException
            || t instanceof UnknownHostException) {
            return FailureClassification.transientNetwork(Reason.CONNECTION_REFUSED, Exposure.NOT_SENT);
        }
        if (t instanceof SSLException) {
            return FailureClassification.fatalNetwork(Reason.PROTOCOL_VIOLATION, Exposure.NOT_SENT);
        }
        if (t instanceof ProtocolException) {
            return FailureClassification.fatalNetwork(Reason.PROTOCOL_VIOLATION, Exposure.AMBIGUOUS);
        }
        if (t instanceof IOException) {
            return FailureClassification.transientNetwork(Reason.CONNECTION_RESET, Exposure.AMBIGUOUS);
        }
        if (t instanceof IllegalArgumentException) {
            return FailureClassification.fatalNetwork(Reason.MALFORMED_REQUEST, Exposure.NOT_SENT);
        }
        return FailureClassification.fatalNetwork(Reason.PROTOCOL_VIOLATION, Exposure.AMBIGUOUS);
    }

    /**
     * Whether the connection that produced this failure can no longer be trusted for reuse.
     */
    public static boolean breaksConnection(FailureClassification failure) {
        return switch (failure.reason()) {
            case TIMEOUT, CONNECTION_RESET, CONNECTION_REFUSED, PROTOCOL_VIOLATION -> true;
            default -> false;
        };
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
