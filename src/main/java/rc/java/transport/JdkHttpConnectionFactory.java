package rc.java.transport;

import java.time.Duration;

public final class JdkHttpConnectionFactory implements ConnectionFactory {

    private final Duration connectTimeout;

    public JdkHttpConnectionFactory(Duration connectTimeout) {
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
        this.connectTimeout = connectTimeout;
    }

    @Override
    public Connection open(String target) {
        return new JdkHttpConnection(target, connectTimeout);
    }
}
