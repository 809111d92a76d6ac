package WFST.Weight;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads a composite weight written by {@link CompositeWeightWriter}:
 * <pre>
 *   reader.readBegin();
 *   String first = reader.readElement(false);
 *   String second = reader.readElement(true);
 *   reader.readEnd();
 *   if (reader.bad()) ...
 * </pre>
 * Elements are returned as text and parsed by the component semiring, so nested composite
 * weights are handled by tracking parenthesis depth. Once bad, every operation is a no-op.
 */
public class CompositeWeightReader extends CompositeWeightIO {
    private static final Logger logger = LogManager.getLogger(CompositeWeightReader.class.getSimpleName());
    private static final int EOF = -1;

    private final CharSequence in;
    private int pos = 0;
    private int c = EOF; // current character
    private int depth = 0;
    private boolean bad;

    public CompositeWeightReader(CharSequence in) {
        super();
        this.in = in;
        this.bad = error();
    }

    public CompositeWeightReader(CharSequence in, CompositeWeightIO config) {
        super(config.separator, config.openParen, config.closeParen);
        this.in = in;
        this.bad = error() || config.error();
    }

    private int get() {
        return pos < in.length() ? in.charAt(pos++) : EOF;
    }

    private static boolean isSpace(int ch) {
        return ch != EOF && Character.isWhitespace(ch);
    }

    public void readBegin() {
        if (bad) {
            return;
        }
        do {
            c = get();
        } while (isSpace(c));
        if (openParen != NO_PAREN) {
            if (c != openParen) {
                logger.error("CompositeWeightReader: Open paren missing: is the weight parentheses flag set correctly?");
                bad = true;
                return;
            }
            ++depth;
            c = get();
        }
    }

    /**
     * Read the text of the next element.
     * @param last whether this is the final element; separators inside it are kept
     * @return element text, or null if the reader is (or just became) bad
     */
    public String readElement(boolean last) {
        if (bad) {
            return null;
        }
        final StringBuilder s = new StringBuilder();
        final boolean hasParens = openParen != NO_PAREN;
        while (c != EOF && !isSpace(c)
            && (c != separator || depth > 1 || last)
            && (c != closeParen || depth != 1)) {
            s.append((char) c);
            // parentheses met before the separator must match
            if (hasParens && c == openParen) {
                ++depth;
            } else if (hasParens && c == closeParen) {
                if (depth == 0) {
                    logger.error("CompositeWeightReader: Unmatched close paren: is the weight parentheses flag set correctly?");
                    bad = true;
                    return null;
                }
                --depth;
            }
            c = get();
        }
        if (s.length() == 0) {
            logger.error("CompositeWeightReader: Empty element: is the weight parentheses flag set correctly?");
            bad = true;
            return null;
        }
        // skip separator or close paren
        if (hasParens && c == closeParen && depth == 1) {
            depth = 0;
        }
        if (c != EOF && !isSpace(c)) {
            c = get();
        }
        return s.toString();
    }

    /**
     * Whether input remains after the last element read.
     */
    public boolean hasMore() {
        return !bad && c != EOF && !isSpace(c);
    }

    public void readEnd() {
        if (bad) {
            return;
        }
        // a reader holds exactly one weight, so only whitespace may follow
        while (isSpace(c)) {
            c = get();
        }
        if (openParen != NO_PAREN && depth != 0) {
            logger.error("CompositeWeightReader: Close paren missing: is the weight parentheses flag set correctly?");
            bad = true;
            return;
        }
        if (c != EOF) {
            logger.error("CompositeWeightReader: excess character: '{}': is the weight parentheses flag set correctly?", (char) c);
            bad = true;
        }
    }

    public boolean bad() {
        return bad;
    }
}
