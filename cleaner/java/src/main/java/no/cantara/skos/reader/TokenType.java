package no.cantara.skos.reader;

public enum TokenType {
    IRI,
    STRING,
    LANGTAG,
    DATATYPE_MARKER,
    PREFIXED_NAME,
    WORD,
    BLANK_NODE,
    BASE_DIRECTIVE,
    PREFIX_DIRECTIVE,
    SEMICOLON,
    COMMA,
    DOT,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    OPEN_PAREN,
    CLOSE_PAREN,
    /** Unreadable input; the text is the reason. */
    ERROR,
    EOF
}
