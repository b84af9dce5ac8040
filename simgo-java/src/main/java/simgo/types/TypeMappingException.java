package simgo.types;

public class TypeMappingException extends RuntimeException {
    public TypeMappingException(String message) {
        super(message);
    }

    public TypeMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
