package WFST.Model;

import WFST.ArcIterator;
import WFST.Properties;
import WFST.StateIterator;
import WFST.SymbolTable;
import WFST.Registry.FstHeader;
import WFST.Registry.FstReadOptions;
import WFST.Registry.FstWriteOptions;
import WFST.Weight.Semiring;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State shared by every representation: semiring, type tag, stored properties and symbol tables,
 * plus the header half of binary I/O.
 * <p>
 * Stored properties are atomic: tested properties may be cached here by any handle sharing the implementation.
 * @param <W> weight type
 */
public abstract class FstImpl<W> {
    private static final Logger logger = LogManager.getLogger(FstImpl.class.getSimpleName());

    protected final Semiring<W> semiring;
    private final AtomicLong properties;
    private String type = "null";
    private SymbolTable isymbols;
    private SymbolTable osymbols;

    protected FstImpl(Semiring<W> semiring) {
        this.semiring = semiring;
        this.properties = new AtomicLong(0);
    }

    /**
     * Copies type, properties and (copies of) the symbol tables of impl.
     */
    protected FstImpl(FstImpl<W> impl) {
        this.semiring = impl.semiring;
        this.properties = new AtomicLong(impl.properties.get());
        this.type = impl.type;
        this.isymbols = impl.isymbols == null ? null : impl.isymbols.copy();
        this.osymbols = impl.osymbols == null ? null : impl.osymbols.copy();
    }

    public Semiring<W> semiring() {
        return semiring;
    }

    public String type() {
        return type;
    }

    protected void setType(String type) {
        this.type = type;
    }

    public long properties() {
        return properties.get();
    }

    public long properties(long mask) {
        return properties.get() & mask;
    }

    /**
     * Replace all properties; ERROR is sticky.
     */
    public void setProperties(long props) {
        properties.updateAndGet(p -> props | (p & Properties.ERROR));
    }

    /**
     * Replace the properties in mask; ERROR is sticky.
     */
    public void setProperties(long props, long mask) {
        properties.updateAndGet(p -> (p & ~(mask & ~Properties.ERROR)) | (props & mask));
    }

    /**
     * Record properties discovered by a scan: only bits of mask not already known are changed.
     */
    public void updateProperties(long props, long mask) {
        properties.updateAndGet(p -> {
            final long oldMask = Properties.knownProperties(p & mask);
            final long discovered = mask & ~oldMask;
            return p | (props & discovered);
        });
    }

    /** Properties fixed by the representation, e.g. EXPANDED. */
    protected long staticProperties() {
        return 0;
    }

    public SymbolTable inputSymbols() {
        return isymbols;
    }

    public SymbolTable outputSymbols() {
        return osymbols;
    }

    public void setInputSymbols(SymbolTable isymbols) {
        this.isymbols = isymbols;
    }

    public void setOutputSymbols(SymbolTable osymbols) {
        this.osymbols = osymbols;
    }

    public abstract int start();

    public abstract W finalWeight(int s);

    public abstract int numArcs(int s);

    public abstract int numInputEpsilons(int s);

    public abstract int numOutputEpsilons(int s);

    public abstract StateIterator states();

    public abstract ArcIterator<W> arcs(int s);

    /**
     * Representations that can be persisted override this.
     */
    public boolean write(OutputStream out, FstWriteOptions opts) {
        logger.error("Fst::Write: No write method for {} FST type", type);
        return false;
    }

    /**
     * Read (or take from opts) the header, check it against this representation, and read the symbol tables.
     * Properties are set from the header.
     * @return the header, or null (after logging) if the input is not of this type
     */
    protected FstHeader readHeader(DataInput in, FstReadOptions opts, int minVersion) throws IOException {
        FstHeader hdr = opts.getHeader();
        if (hdr == null) {
            hdr = new FstHeader();
            if (!hdr.read(in, opts.getSource())) {
                return null;
            }
        }
        if (!type.equals(hdr.getFstType())) {
            logger.error("FstImpl::ReadHeader: FST not of type {}, found {}: {}", type, hdr.getFstType(), opts.getSource());
            return null;
        }
        if (!semiring.arcType().equals(hdr.getArcType())) {
            logger.error("FstImpl::ReadHeader: Arc not of type {}, found {}: {}",
                semiring.arcType(), hdr.getArcType(), opts.getSource());
            return null;
        }
        if (hdr.getVersion() < minVersion) {
            logger.error("FstImpl::ReadHeader: Obsolete {} FST version {}, expected at least {}: {}",
                type, hdr.getVersion(), minVersion, opts.getSource());
            return null;
        }
        setProperties((hdr.getProperties() & Properties.COPY_PROPERTIES) | staticProperties());
        if ((hdr.getFlags() & FstHeader.HAS_ISYMBOLS) != 0) {
            final SymbolTable symbols = SymbolTable.read(in, opts.getSource());
            if (symbols == null) {
                return null;
            }
            isymbols = opts.isReadSymbols() ? symbols : null;
        }
        if ((hdr.getFlags() & FstHeader.HAS_OSYMBOLS) != 0) {
            final SymbolTable symbols = SymbolTable.read(in, opts.getSource());
            if (symbols == null) {
                return null;
            }
            osymbols = opts.isReadSymbols() ? symbols : null;
        }
        return hdr;
    }

    /**
     * Complete hdr (start and counts already filled in) and write it with the symbol tables.
     */
    protected void writeHeader(DataOutput out, FstWriteOptions opts, int version, FstHeader hdr) throws IOException {
        hdr.setFstType(type);
        hdr.setArcType(semiring.arcType());
        hdr.setVersion(version);
        hdr.setProperties(properties(Properties.COPY_PROPERTIES) | staticProperties());
        int flags = 0;
        if (isymbols != null && opts.isWriteISymbols()) {
            flags |= FstHeader.HAS_ISYMBOLS;
        }
        if (osymbols != null && opts.isWriteOSymbols()) {
            flags |= FstHeader.HAS_OSYMBOLS;
        }
        hdr.setFlags(flags);
        hdr.write(out);
        if ((flags & FstHeader.HAS_ISYMBOLS) != 0) {
            isymbols.write(out);
        }
        if ((flags & FstHeader.HAS_OSYMBOLS) != 0) {
            osymbols.write(out);
        }
    }
}
