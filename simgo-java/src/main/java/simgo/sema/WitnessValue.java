package simgo.sema;

public record WitnessValue(String name, String type, String value) {

    // type of := declarations; the generator infers it from the value
    public static final String AUTO = "auto";

    public boolean isDeferred() {
        return AUTO.equals(type);
    }
}
