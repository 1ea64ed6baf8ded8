package net.spookly.rpcgate;

/**
 * Process exit codes, one per startup failure kind.
 */
public enum ExitCode {
    CONFIG(11),
    BOOTSTRAP(12),
    HTTP_SERVER(13);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitCode forFailure(StartupFailure failure) {
        switch (failure) {
            case CONFIG:
                return CONFIG;
            case BOOTSTRAP:
                return BOOTSTRAP;
            case HTTP_SERVER:
                return HTTP_SERVER;
            default:
                throw new IllegalArgumentException("unknown startup failure " + failure);
        }
    }
}
