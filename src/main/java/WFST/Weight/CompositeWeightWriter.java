package WFST.Weight;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes a composite weight as its component texts joined by the separator,
 * enclosed in the configured parentheses (if any):
 * <pre>
 *   writer.writeBegin();
 *   writer.writeElement(first);
 *   writer.writeElement(second);
 *   writer.writeEnd();
 * </pre>
 * Once bad, every operation is a no-op.
 */
public class CompositeWeightWriter extends CompositeWeightIO {
    private final Appendable out;
    private int elements = 0;
    private boolean bad;

    public CompositeWeightWriter(Appendable out) {
        super();
        this.out = out;
        this.bad = error();
    }

    public CompositeWeightWriter(Appendable out, CompositeWeightIO config) {
        super(config.separator, config.openParen, config.closeParen);
        this.out = out;
        this.bad = error() || config.error();
    }

    public void writeBegin() {
        if (!bad && openParen != NO_PAREN) {
            append(openParen);
        }
    }

    public void writeElement(String element) {
        if (bad) {
            return;
        }
        if (elements++ > 0) {
            append(separator);
        }
        append(element);
    }

    public void writeEnd() {
        if (!bad && closeParen != NO_PAREN) {
            append(closeParen);
        }
    }

    public boolean bad() {
        return bad;
    }

    private void append(CharSequence s) {
        try {
            out.append(s);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void append(char c) {
        try {
            out.append(c);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
