package octave.java17.core;

import java.util.Locale;

/// The fixed, numbered error codes of the OCTAVE toolchain.
/// Every code carries a message template and a one-line rationale explaining
/// why the input is refused rather than guessed at.
public enum OctaveError {

    // lexical
    SINGLE_COLON_ASSIGNMENT("E001", "Single colon assignment detected: '%s'. Use '::' for assignments",
        "':' opens a block, so a value on the same line could be either a block or an assignment"),
    TAB_CHARACTER("E002", "Tab character is not allowed, use 2 spaces for indentation",
        "a tab has no fixed width, so the indentation depth of the line cannot be determined"),
    ILLEGAL_CHARACTER("E003", "Unexpected character '%s'",
        "the character has no meaning in the notation and no alias maps it to one"),
    UNTERMINATED_STRING("E004", "Unterminated string literal",
        "the end of the value cannot be located without guessing"),
    UNTERMINATED_LITERAL_ZONE("E005", "Literal zone opened with '%s' is never closed",
        "verbatim content cannot be bounded without its closing fence"),
    NESTED_LITERAL_ZONE("E006", "Fence '%s' opens inside a literal zone opened with '%s'",
        "matching nested fences would mean guessing which fence closes which zone"),
    UNBALANCED_BRACKET("E007", "Unbalanced bracket '%s'",
        "the extent of the list cannot be inferred"),
    INVALID_ENVELOPE_NAME("E008", "Invalid envelope name '%s'",
        "envelope names must be identifiers so documents can be addressed by name"),

    // structural
    UNEXPECTED_TOKEN("E010", "Unexpected '%s' %s",
        "the token cannot start or continue the construct being read"),
    MISSING_ENVELOPE("E011", "Document has no ===NAME=== envelope",
        "strict parsing does not synthesize envelopes"),
    UNTERMINATED_ENVELOPE("E012", "Envelope '%s' is never closed with ===END===",
        "strict parsing does not synthesize the end of an envelope"),
    CONTENT_OUTSIDE_ENVELOPE("E013", "Content outside an envelope: '%s'",
        "content before or between envelopes belongs to no document"),
    META_NOT_FIRST("E014", "META block must be the first element of the envelope",
        "moving the block would restructure the document"),
    BARE_LINE("E015", "Line '%s' has no operator",
        "a bare word could be a key missing its value or a value missing its key"),
    ORPHAN_SECTION_MARKER("E016", "Section marker is not followed by a name or number",
        "the section it refers to cannot be inferred"),
    INCONSISTENT_INDENTATION("E017", "Indentation of %d spaces does not match any open level",
        "the parent of the line cannot be determined"),
    DUPLICATE_KEY("E018", "Duplicate key '%s'",
        "choosing which value wins would discard author data"),
    MIXED_LIST("E019", "List mixes key::value pairs with plain items",
        "it is neither a list nor an inline map"),
    NESTED_INLINE_MAP("E020", "Inline map value for '%s' must be an atom",
        "inline maps hold atoms only, nesting belongs in blocks"),
    MISSING_VALUE("E021", "Assignment '%s::' has no value",
        "an empty value must be written explicitly as null or \"\""),
    AMBIGUOUS_VALUE("E022", "Value '%s' cannot be read as a single value",
        "joining quoted and bare parts would change what the author wrote"),
    MALFORMED_BLOCK_TARGET("E023", "Block target for '%s' must read [→§TARGET]",
        "the routing target cannot be inferred"),
    TRAILING_CONTENT("E024", "Content after ===END===: '%s'",
        "a single document ends at its envelope, streams are read with parseAll"),
    MISSING_SCHEMA_SELECTOR("E025", "No schema name given and the document has no envelope",
        "a schema cannot be selected by an inferred envelope name"),

    // schema
    UNKNOWN_CONSTRAINT("E030", "Unknown constraint '%s'",
        "unrecognized constraints would silently validate nothing"),
    MALFORMED_PATTERN("E031", "Malformed holographic pattern for '%s': %s",
        "the example, constraints and target cannot be told apart"),
    MALFORMED_SCHEMA("E032", "Schema '%s' is malformed: %s",
        "a schema that cannot be read exactly cannot be enforced"),

    // validation
    REQUIRED_FIELD_MISSING("E040", "Field '%s' is required but missing",
        "required values are reported, never invented"),
    CONST_MISMATCH("E041", "Field '%s' must equal %s but was %s",
        "the schema fixes this value"),
    PATTERN_MISMATCH("E042", "Field '%s' value '%s' does not match pattern %s",
        "the schema restricts the shape of this value"),
    ENUM_MISMATCH("E043", "Field '%s' value '%s' is not one of %s",
        "the schema restricts this value to a closed set"),
    TYPE_MISMATCH("E044", "Field '%s' expected %s but found %s",
        "the schema declares the type of this value"),
    NOT_A_DIRECTORY("E045", "Field '%s' value '%s' is not a directory path",
        "the schema declares this value as a directory path"),
    APPEND_ONLY_VIOLATION("E046", "Field '%s' may only append to its previous items",
        "existing entries of an append-only list are never rewritten"),
    OUT_OF_RANGE("E047", "Field '%s' value %s is outside [%s,%s]",
        "the schema bounds this value"),
    TOO_LONG("E048", "Field '%s' length %d exceeds %d",
        "the schema bounds the length of this value"),
    TOO_SHORT("E049", "Field '%s' length %d is below %d",
        "the schema bounds the length of this value"),
    INVALID_DATE("E050", "Field '%s' value '%s' is not a YYYY-MM-DD date",
        "the schema declares this value as a calendar date"),
    INVALID_ISO8601("E051", "Field '%s' value '%s' is not an ISO 8601 timestamp",
        "the schema declares this value as a timestamp"),
    UNKNOWN_FIELD("E052", "Field '%s' is not declared in schema '%s'",
        "the schema policy rejects undeclared fields"),
    INVALID_TARGET("E053", "Field '%s' routes to undeclared target '§%s'",
        "routing targets must be declared, they are never inferred"),

    // repair
    AMBIGUOUS_ENUM_REPAIR("E060", "Field '%s' value '%s' matches %s ignoring case",
        "picking one of several candidates would be a guess"),
    FORBIDDEN_REPAIR("E061", "Forbidden repair %s for '%s'",
        "the fix would add or restructure content instead of resolving an existing value"),

    // boundary
    INVALID_INPUT("E070", "Invalid input: %s",
        "the request does not say unambiguously what to do"),
    HASH_MISMATCH("E071", "base_hash %s does not match current content hash %s",
        "the file changed since it was read, overwriting it would lose that change"),
    IO_FAILURE("E072", "I/O failure on '%s': %s",
        "the file system refused the operation");

    private final String code;
    private final String messageTemplate;
    private final String rationale;

    OctaveError(String code, String messageTemplate, String rationale) {
        this.code = code;
        this.messageTemplate = messageTemplate;
        this.rationale = rationale;
    }

    /// The fixed code, for example `E001`.
    public String code() {
        return code;
    }

    /// One line explaining why the input is refused.
    public String rationale() {
        return rationale;
    }

    /// Formats the message template with the given arguments.
    public String message(Object... args) {
        return String.format(Locale.ROOT, messageTemplate, args);
    }
}
