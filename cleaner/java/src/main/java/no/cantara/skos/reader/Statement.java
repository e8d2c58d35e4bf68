package no.cantara.skos.reader;

/**
 * One top-level statement of a Turtle document.
 */
public interface Statement {

    /** 1-based line the statement starts on. */
    int line();
}
