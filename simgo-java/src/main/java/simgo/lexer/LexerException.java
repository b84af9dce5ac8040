package simgo.lexer;

public class LexerException extends RuntimeException {
    public LexerException(String message) {
        super(message);
    }
}
