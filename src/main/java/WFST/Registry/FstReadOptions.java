package WFST.Registry;

/**
 * Options for reading a transducer body.
 */
public class FstReadOptions {
    private final String source;
    private final FstHeader header;
    private final boolean readSymbols;

    /**
     * @param source name of the input, for diagnostics
     * @param header header already consumed from the input, or null if the reader must read it
     * @param readSymbols whether symbol tables in the input are kept (they are always consumed)
     */
    public FstReadOptions(String source, FstHeader header, boolean readSymbols) {
        this.source = source;
        this.header = header;
        this.readSymbols = readSymbols;
    }

    public FstReadOptions(String source) {
        this(source, null, true);
    }

    public FstReadOptions() {
        this("<unspecified>");
    }

    public String getSource() {
        return source;
    }

    public FstHeader getHeader() {
        return header;
    }

    public boolean isReadSymbols() {
        return readSymbols;
    }

    public FstReadOptions withHeader(FstHeader header) {
        return new FstReadOptions(source, header, readSymbols);
    }
}
