package WFST.Weight;

import WFST.FstFlags;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Separator and parenthesis configuration shared by composite weight readers and writers.
 * A misconfiguration is detected here, logged once, and remembered in error();
 * readers and writers built on an errored configuration start out bad.
 */
public class CompositeWeightIO {
    private static final Logger logger = LogManager.getLogger(CompositeWeightIO.class.getSimpleName());

    /** Marks an unset parenthesis. */
    public static final char NO_PAREN = '\0';

    protected final char separator;
    protected final char openParen;
    protected final char closeParen;
    private boolean error;

    /**
     * Configuration from FstFlags.
     */
    public CompositeWeightIO() {
        this(FstFlags.WEIGHT_SEPARATOR, FstFlags.WEIGHT_PARENTHESES);
    }

    /**
     * @param separator exactly one character
     * @param parentheses empty, or exactly two characters (open then close)
     */
    public CompositeWeightIO(String separator, String parentheses) {
        this(separator.isEmpty() ? NO_PAREN : separator.charAt(0),
            parentheses.isEmpty() ? NO_PAREN : parentheses.charAt(0),
            parentheses.length() < 2 ? NO_PAREN : parentheses.charAt(1));
        if (separator.length() != 1) {
            logger.error("CompositeWeight: weight separator \"{}\" must be a single character", separator);
            error = true;
        }
        if (!parentheses.isEmpty() && parentheses.length() != 2) {
            logger.error("CompositeWeight: weight parentheses \"{}\" must have size 0 or 2", parentheses);
            error = true;
        }
    }

    public CompositeWeightIO(char separator, char openParen, char closeParen) {
        this.separator = separator;
        this.openParen = openParen;
        this.closeParen = closeParen;
        if ((openParen == NO_PAREN || closeParen == NO_PAREN) && openParen != closeParen) {
            logger.error("Invalid configuration of weight parentheses: {} {}", (int) openParen, (int) closeParen);
            error = true;
        }
    }

    public boolean error() {
        return error;
    }

    public char getSeparator() {
        return separator;
    }

    public boolean hasParentheses() {
        return openParen != NO_PAREN;
    }

    public char getOpenParen() {
        return openParen;
    }

    public char getCloseParen() {
        return closeParen;
    }
}
