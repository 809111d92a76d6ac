package WFST.Ops;

/**
 * What an arc mapping does with a symbol table of its input.
 */
public enum MapSymbolsAction {
    /** The result has no table. */
    CLEAR,
    /** The result gets a copy of the input's table. */
    COPY,
    /** The result's table is left alone. */
    NOOP
}
