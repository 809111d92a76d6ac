package WFST.Registry;

import WFST.Fst;
import WFST.FstException;
import WFST.MutableFst;
import WFST.Properties;
import WFST.Weight.Semiring;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads transducers of any registered representation, and writes and converts them.
 * <p>
 * Reads never throw for bad input: an unreadable header, an unregistered type, an arc type other
 * than the caller's, a non-mutable file read as mutable or a truncated body are logged with the
 * type, arc type and source, and the read returns null.
 */
public final class FstIO {
    private static final Logger logger = LogManager.getLogger(FstIO.class.getSimpleName());

    public static final String DEFAULT_CONVERT_TYPE = "vector";

    private FstIO() {
    }

    /**
     * @return the transducer, or null on failure
     */
    public static <W> Fst<W> read(FstRegistry registry, Semiring<W> semiring, InputStream in, FstReadOptions opts) {
        try {
            final DataInputStream din = new DataInputStream(in);
            return readBody(registry, semiring, din, readHeader(din, opts), opts);
        } catch (FstException e) {
            logFailure(e);
            return null;
        }
    }

    /**
     * Read a transducer that the header marks as mutable.
     * @return the transducer, or null on failure, including when the input is not mutable
     */
    public static <W> MutableFst<W> readMutable(FstRegistry registry, Semiring<W> semiring, InputStream in,
                                                FstReadOptions opts) {
        try {
            final DataInputStream din = new DataInputStream(in);
            final FstHeader hdr = readHeader(din, opts);
            requireMutable(hdr, opts.getSource());
            return asMutable(readBody(registry, semiring, din, hdr, opts), opts.getSource());
        } catch (FstException e) {
            logFailure(e);
            return null;
        }
    }

    public static <W> Fst<W> read(FstRegistry registry, Semiring<W> semiring, Path path) {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return read(registry, semiring, in, new FstReadOptions(path.toString()));
        } catch (IOException e) {
            logger.error("Fst::Read: Can't open file: {}", path, e);
            return null;
        }
    }

    /**
     * Read a mutable transducer from a file.
     * @param convert if set, a non-mutable file is converted to convertType instead of failing
     * @param convertType a mutable registered type; null means {@value #DEFAULT_CONVERT_TYPE}
     * @return the transducer, or null on failure
     */
    public static <W> MutableFst<W> readMutable(FstRegistry registry, Semiring<W> semiring, Path path,
                                                boolean convert, String convertType) {
        final String source = path.toString();
        final FstReadOptions opts = new FstReadOptions(source);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            final DataInputStream din = new DataInputStream(in);
            final FstHeader hdr = readHeader(din, opts);
            if (!convert) {
                requireMutable(hdr, source);
                return asMutable(readBody(registry, semiring, din, hdr, opts), source);
            }
            final Fst<W> fst = readBody(registry, semiring, din, hdr, opts);
            if (fst instanceof MutableFst) {
                return (MutableFst<W>) fst;
            }
            final String type = convertType == null ? DEFAULT_CONVERT_TYPE : convertType;
            final Fst<W> converted = convertOrThrow(registry, fst, type);
            if (!(converted instanceof MutableFst)) {
                throw new FstException(FstException.Code.NOT_MUTABLE,
                    "Fst::Read: Convert type \"" + type + "\" is not mutable");
            }
            return (MutableFst<W>) converted;
        } catch (FstException e) {
            logFailure(e);
            return null;
        } catch (IOException e) {
            logger.error("Fst::Read: Can't open file: {}", path, e);
            return null;
        }
    }

    /**
     * Rebuild fst as the registered representation fstType.
     * @return the converted transducer, or null (after logging) if fstType is not registered
     */
    public static <W> Fst<W> convert(FstRegistry registry, Fst<W> fst, String fstType) {
        try {
            return convertOrThrow(registry, fst, fstType);
        } catch (FstException e) {
            logFailure(e);
            return null;
        }
    }

    public static <W> boolean write(Fst<W> fst, OutputStream out, FstWriteOptions opts) {
        return fst.write(out, opts);
    }

    public static <W> boolean write(Fst<W> fst, Path path) {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            return fst.write(out, new FstWriteOptions(path.toString()));
        } catch (IOException e) {
            logger.error("Fst::Write: Can't open file: {}", path, e);
            return false;
        }
    }

    private static FstHeader readHeader(DataInput in, FstReadOptions opts) {
        if (opts.getHeader() != null) {
            return opts.getHeader();
        }
        final FstHeader hdr = new FstHeader();
        if (!hdr.read(in, opts.getSource())) {
            throw new FstException(FstException.Code.BAD_HEADER, "Fst::Read: Bad FST header: " + opts.getSource());
        }
        return hdr;
    }

    private static void requireMutable(FstHeader hdr, String source) {
        if ((hdr.getProperties() & Properties.MUTABLE) == 0) {
            throw new FstException(FstException.Code.NOT_MUTABLE,
                "Fst::Read: FST of type \"" + hdr.getFstType() + "\" is not mutable: " + source);
        }
    }

    private static <W> Fst<W> readBody(FstRegistry registry, Semiring<W> semiring, DataInput in,
                                       FstHeader hdr, FstReadOptions opts) {
        if (!hdr.getArcType().equals(semiring.arcType())) {
            throw new FstException(FstException.Code.ARC_TYPE_MISMATCH,
                "Fst::Read: FST not of type \"" + semiring.arcType() + "\" (arc type = \""
                    + hdr.getArcType() + "\"): " + opts.getSource());
        }
        final FstRegistration<W> registration = registry.registration(semiring, hdr.getFstType());
        if (registration == null) {
            throw new FstException(FstException.Code.UNKNOWN_TYPE,
                "Fst::Read: Unknown FST type \"" + hdr.getFstType() + "\" (arc type = \""
                    + hdr.getArcType() + "\"): " + opts.getSource());
        }
        final Fst<W> fst;
        try {
            fst = registration.getReader().read(in, opts.withHeader(hdr));
        } catch (IOException e) {
            throw new FstException(FstException.Code.IO_FAILURE,
                "Fst::Read: Read failed for FST type \"" + hdr.getFstType() + "\": " + opts.getSource(), e);
        }
        if (fst == null) {
            throw new FstException(FstException.Code.IO_FAILURE,
                "Fst::Read: Read failed for FST type \"" + hdr.getFstType() + "\": " + opts.getSource());
        }
        return fst;
    }

    private static <W> MutableFst<W> asMutable(Fst<W> fst, String source) {
        if (!(fst instanceof MutableFst)) {
            throw new FstException(FstException.Code.NOT_MUTABLE,
                "Fst::Read: FST of type \"" + fst.type() + "\" is not mutable: " + source);
        }
        return (MutableFst<W>) fst;
    }

    private static <W> Fst<W> convertOrThrow(FstRegistry registry, Fst<W> fst, String fstType) {
        final FstRegistration<W> registration = registry.registration(fst.semiring(), fstType);
        if (registration == null) {
            throw new FstException(FstException.Code.UNKNOWN_TYPE,
                "Fst::Convert: Unknown FST type \"" + fstType + "\" (arc type = \"" + fst.arcType() + "\")");
        }
        return registration.getConverter().convert(fst);
    }

    private static void logFailure(FstException e) {
        if (e.getCause() != null) {
            logger.error("{} [{}]", e.getMessage(), e.getCode(), e.getCause());
        } else {
            logger.error("{} [{}]", e.getMessage(), e.getCode());
        }
    }
}
