class Delegating {
    static final String x = "unchecked";

    Delegating() {
        this(x);
    }

    Delegating(String mode) {
    }

    @SuppressWarnings(x)
    void run() {
    }
}
