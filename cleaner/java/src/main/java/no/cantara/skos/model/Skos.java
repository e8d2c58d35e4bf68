package no.cantara.skos.model;

/**
 * Namespace and term IRIs of the vocabularies the cleaner understands.
 */
public final class Skos {

    private Skos() {}

    public static final String NS = "http://www.w3.org/2004/02/skos/core#";
    public static final String XL_NS = "http://www.w3.org/2008/05/skos-xl#";
    public static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

    public static final String RDF_TYPE = RDF_NS + "type";

    public static final String XL_PREF_LABEL = XL_NS + "prefLabel";
    public static final String XL_ALT_LABEL = XL_NS + "altLabel";
    public static final String XL_HIDDEN_LABEL = XL_NS + "hiddenLabel";
    public static final String XL_LITERAL_FORM = XL_NS + "literalForm";
}
