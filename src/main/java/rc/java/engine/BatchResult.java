package rc.java.engine;

import rc.core.error.ApiException;
import rc.core.model.Request;
import rc.core.model.Response;

import java.util.List;

/**
 * Outcome of {@link RequestExecutor#executeAll}: successes and failures, each in submission order.
 */
public record BatchResult(List<Response> successes, List<Failure> failures) {

    public BatchResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public record Failure(Request request, ApiException error) {
    }

    public boolean allSucceeded() {
        return failures.isEmpty();
    }
}
