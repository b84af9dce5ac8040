package simgo.parser;

public class ParseException extends RuntimeException {
    public ParseException(String message) {
        super(message);
    }
}
