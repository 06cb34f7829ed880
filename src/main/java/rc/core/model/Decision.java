package rc.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
