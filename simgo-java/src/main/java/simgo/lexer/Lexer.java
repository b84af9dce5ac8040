package simgo.lexer;

import java.util.*;

/**
 * Scanner for the Go subset accepted by simgo.
 *
 * Follows Go's automatic semicolon rule: a newline (or the end of input)
 * directly after an identifier, a literal, {@code return}, {@code ++},
 * {@code --}, {@code )}, {@code ]} or {@code }} becomes a SEMICOLON token
 * whose lexeme is {@code "\n"}.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("package", TokenType.PACKAGE),
            Map.entry("import", TokenType.IMPORT),
            Map.entry("func", TokenType.FUNC),
            Map.entry("var", TokenType.VAR),
            Map.entry("const", TokenType.CONST),
            Map.entry("type", TokenType.TYPE),
            Map.entry("struct", TokenType.STRUCT),
            Map.entry("interface", TokenType.INTERFACE),
            Map.entry("map", TokenType.MAP),
            Map.entry("chan", TokenType.CHAN),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("for", TokenType.FOR),
            Map.entry("range", TokenType.RANGE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("go", TokenType.GO),
            Map.entry("true", TokenType.BOOL_LITERAL),
            Map.entry("false", TokenType.BOOL_LITERAL)
    );

    private static final Set<TokenType> endsStatement = EnumSet.of(
            TokenType.IDENTIFIER,
            TokenType.INT_LITERAL,
            TokenType.FLOAT_LITERAL,
            TokenType.STRING_LITERAL,
            TokenType.CHAR_LITERAL,
            TokenType.BOOL_LITERAL,
            TokenType.RETURN,
            TokenType.INC,
            TokenType.DEC,
            TokenType.RPAREN,
            TokenType.RBRACKET,
            TokenType.RBRACE
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            char c = advance();

            switch (c) {
                case '\n' -> {
                    newline(startLine, startCol);
                }
                case '+' -> {
                    if (match('+')) add(TokenType.INC, "++", startLine, startCol);
                    else if (match('=')) add(TokenType.ADD_ASSIGN, "+=", startLine, startCol);
                    else add(TokenType.PLUS, "+", startLine, startCol);
                }
                case '-' -> {
                    if (match('-')) add(TokenType.DEC, "--", startLine, startCol);
                    else if (match('=')) add(TokenType.SUB_ASSIGN, "-=", startLine, startCol);
                    else add(TokenType.MINUS, "-", startLine, startCol);
                }
                case '*' -> {
                    boolean asg = match('=');
                    add(asg ? TokenType.MUL_ASSIGN : TokenType.STAR, asg ? "*=" : "*", startLine, startCol);
                }
                case '%' -> {
                    boolean asg = match('=');
                    add(asg ? TokenType.MOD_ASSIGN : TokenType.PERCENT, asg ? "%=" : "%", startLine, startCol);
                }
                case '^' -> add(TokenType.CARET, "^", startLine, startCol);

                case '=' -> {
                    boolean eq = match('=');
                    add(eq ? TokenType.EQ : TokenType.ASSIGN, eq ? "==" : "=", startLine, startCol);
                }
                case '!' -> {
                    boolean neq = match('=');
                    add(neq ? TokenType.NEQ : TokenType.NOT, neq ? "!=" : "!", startLine, startCol);
                }
                case ':' -> {
                    boolean def = match('=');
                    add(def ? TokenType.DEFINE : TokenType.COLON, def ? ":=" : ":", startLine, startCol);
                }

                case '<' -> {
                    if (match('-')) add(TokenType.ARROW, "<-", startLine, startCol);
                    else if (match('<')) add(TokenType.SHL, "<<", startLine, startCol);
                    else {
                        boolean le = match('=');
                        add(le ? TokenType.LE : TokenType.LT, le ? "<=" : "<", startLine, startCol);
                    }
                }

                case '>' -> {
                    if (match('>')) add(TokenType.SHR, ">>", startLine, startCol);
                    else {
                        boolean ge = match('=');
                        add(ge ? TokenType.GE : TokenType.GT, ge ? ">=" : ">", startLine, startCol);
                    }
                }

                case '&' -> {
                    if (match('&')) add(TokenType.AND, "&&", startLine, startCol);
                    else if (match('^')) add(TokenType.AND_NOT, "&^", startLine, startCol);
                    else add(TokenType.AMP, "&", startLine, startCol);
                }

                case '|' -> {
                    if (match('|')) add(TokenType.OR, "||", startLine, startCol);
                    else add(TokenType.PIPE, "|", startLine, startCol);
                }

                case '/' -> {
                    if (match('/')) {
                        skipComment();
                    } else if (match('*')) {
                        skipBlockComment(startLine, startCol);
                    } else if (match('=')) {
                        add(TokenType.DIV_ASSIGN, "/=", startLine, startCol);
                    } else {
                        add(TokenType.SLASH, "/", startLine, startCol);
                    }
                }

                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
                case ';' -> add(TokenType.SEMICOLON, ";", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);

                case '.' -> {
                    if (peek() == '.' && peekNext() == '.') {
                        advance();
                        advance();
                        add(TokenType.ELLIPSIS, "...", startLine, startCol);
                    } else if (isDigit(peek())) {
                        numberLiteral(c, startLine, startCol);
                    } else {
                        add(TokenType.DOT, ".", startLine, startCol);
                    }
                }

                case '"' -> stringLiteral(startLine, startCol);
                case '`' -> rawStringLiteral(startLine, startCol);
                case '\'' -> charLiteral(startLine, startCol);

                default -> {
                    if (isDigit(c)) numberLiteral(c, startLine, startCol);
                    else if (isAlpha(c)) identifier(c, startLine, startCol);
                    else error("Unexpected character: " + c);
                }
            }
        }

        if (needsSemicolon()) add(TokenType.SEMICOLON, "\n", line, col);
        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    private void newline(int line, int col) {
        if (needsSemicolon()) add(TokenType.SEMICOLON, "\n", line, col);
        this.line++;
        this.col = 1;
    }

    private boolean needsSemicolon() {
        if (tokens.isEmpty()) return false;
        return endsStatement.contains(tokens.get(tokens.size() - 1).type());
    }

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        boolean isFloat = first == '.';

        if (first == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'b' || peek() == 'B'
                || peek() == 'o' || peek() == 'O')) {
            sb.append(advance());
            while (!isAtEnd() && (isHexDigit(peek()) || peek() == '_')) {
                sb.append(advance());
            }
            add(TokenType.INT_LITERAL, sb.toString(), line, col);
            return;
        }

        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            sb.append(advance());
        }

        if (!isFloat && !isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        add(isFloat ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL,
                sb.toString(), line, col);
    }

    private void identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);

        add(type, text, line, col);
    }

    // string and char literals keep their quotes: the raw text is what ends up in the output
    private void stringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder("\"");

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') error("Unterminated string");
            sb.append(c);
            if (c == '\\' && !isAtEnd()) sb.append(advance());
        }

        if (isAtEnd()) error("Unterminated string");

        advance(); // closing "
        sb.append('"');
        add(TokenType.STRING_LITERAL, sb.toString(), line, col);
    }

    private void rawStringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder("`");

        while (!isAtEnd() && peek() != '`') {
            char c = advance();
            if (c == '\n') {
                this.line++;
                this.col = 1;
            }
            sb.append(c);
        }

        if (isAtEnd()) error("Unterminated raw string");

        advance();
        sb.append('`');
        add(TokenType.STRING_LITERAL, sb.toString(), line, col);
    }

    private void charLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder("'");

        while (!isAtEnd() && peek() != '\'') {
            char c = advance();
            if (c == '\n') error("Unterminated rune literal");
            sb.append(c);
            if (c == '\\' && !isAtEnd()) sb.append(advance());
        }

        if (isAtEnd()) error("Unterminated rune literal");
        if (sb.length() == 1) error("Empty rune literal");

        advance();
        sb.append('\'');
        add(TokenType.CHAR_LITERAL, sb.toString(), line, col);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r' -> advance();
                default -> { return; }
            }
        }
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    // a block comment spanning lines acts like a newline
    private void skipBlockComment(int startLine, int startCol) {
        boolean sawNewline = false;
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                if (sawNewline && needsSemicolon()) add(TokenType.SEMICOLON, "\n", startLine, startCol);
                return;
            }
            if (advance() == '\n') {
                sawNewline = true;
                line++;
                col = 1;
            }
        }
        error("Unterminated comment");
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    // Go letters and digits are Unicode classes, not just ASCII
    private boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || Character.isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private void error(String message) {
        throw new LexerException("[" + line + ":" + col + "] " + message);
    }
}
