package rc.java.transport;

@FunctionalInterface
public interface ConnectionFactory {
    Connection open(String target);
}
