package WFST.Registry;

public class FstWriteOptions {
    private final String source;
    private final boolean writeISymbols;
    private final boolean writeOSymbols;

    public FstWriteOptions(String source, boolean writeISymbols, boolean writeOSymbols) {
        this.source = source;
        this.writeISymbols = writeISymbols;
        this.writeOSymbols = writeOSymbols;
    }

    public FstWriteOptions(String source) {
        this(source, true, true);
    }

    public FstWriteOptions() {
        this("<unspecified>");
    }

    public String getSource() {
        return source;
    }

    public boolean isWriteISymbols() {
        return writeISymbols;
    }

    public boolean isWriteOSymbols() {
        return writeOSymbols;
    }
}
