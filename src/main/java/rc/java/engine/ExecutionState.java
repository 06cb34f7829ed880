package rc.java.engine;

/**
 * Lifecycle of one logical request inside {@link RequestExecutor}.
 *
 * <pre>
 * PENDING -> LIMITING -> DISPATCHING -> DECODING -> SUCCEEDED
 *               ^            |              |
 *               |            +--------------+--> FAILED
 *               |                           |
 *               +-------- RETRYING <--------+
 * </pre>
 */
public enum ExecutionState {
    PENDING,
    LIMITING,
    DISPATCHING,
    DECODING,
    RETRYING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
