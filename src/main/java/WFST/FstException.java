package WFST;

/**
 * Single unchecked exception for the library. The code tells callers what kind of failure occurred;
 * the registry read path reports failures by logging and returning null instead.
 */
public final class FstException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final Code code;

    public FstException(final Code code) {
        super(code.getDescription());
        this.code = code;
    }

    public FstException(final Code code, final String message) {
        super(message);
        this.code = code;
    }

    public FstException(final Code code, final String message, final Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Code getCode() {
        return code;
    }

    public enum Code {
        CONFIGURATION("Weight I/O configuration is invalid"),
        MALFORMED_WEIGHT("Weight text could not be parsed"),
        BAD_HEADER("Transducer header is missing or corrupt"),
        UNKNOWN_TYPE("Transducer type is not registered"),
        ARC_TYPE_MISMATCH("Arc type of the input does not match the expected arc type"),
        NOT_MUTABLE("Transducer is not mutable"),
        IO_FAILURE("Transducer could not be read or written");

        private final String description;

        Code(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
