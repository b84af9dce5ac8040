package simgo.lexer;

public enum TokenType {

    // literals
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    CHAR_LITERAL,
    BOOL_LITERAL,

    // keywords
    PACKAGE,
    IMPORT,
    FUNC,
    VAR,
    CONST,
    TYPE,
    STRUCT,
    INTERFACE,
    MAP,
    CHAN,
    IF,
    ELSE,
    FOR,
    RANGE,
    RETURN,
    GO,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    AMP, PIPE, CARET, SHL, SHR, AND_NOT,
    ASSIGN, DEFINE,
    ADD_ASSIGN, SUB_ASSIGN, MUL_ASSIGN, DIV_ASSIGN, MOD_ASSIGN,
    INC, DEC,
    EQ, NEQ,
    LT, LE,
    GT, GE,
    AND, OR, NOT,
    ARROW,

    // symbols
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COLON, SEMICOLON, COMMA,
    DOT, ELLIPSIS,

    EOF
}
