package WFST.Registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Leading record of every serialized transducer: identifies the representation and arc type
 * so the registry can pick a reader, and records counts the body relies on.
 */
public class FstHeader {
    private static final Logger logger = LogManager.getLogger(FstHeader.class.getSimpleName());

    public static final int MAGIC_NUMBER = 2125659606;

    // Flags
    public static final int HAS_ISYMBOLS = 0x1;
    public static final int HAS_OSYMBOLS = 0x2;

    private String fstType = "";
    private String arcType = "";
    private int version = 0;
    private int flags = 0;
    private long properties = 0;
    private long start = -1;
    private long numStates = 0;
    private long numArcs = 0;

    public String getFstType() {
        return fstType;
    }

    public void setFstType(String fstType) {
        this.fstType = fstType;
    }

    public String getArcType() {
        return arcType;
    }

    public void setArcType(String arcType) {
        this.arcType = arcType;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public long getProperties() {
        return properties;
    }

    public void setProperties(long properties) {
        this.properties = properties;
    }

    public long getStart() {
        return start;
    }

    public void setStart(long start) {
        this.start = start;
    }

    public long getNumStates() {
        return numStates;
    }

    public void setNumStates(long numStates) {
        this.numStates = numStates;
    }

    public long getNumArcs() {
        return numArcs;
    }

    public void setNumArcs(long numArcs) {
        this.numArcs = numArcs;
    }

    /**
     * @return false (after logging) on a bad magic number or a truncated header
     */
    public boolean read(DataInput in, String source) {
        try {
            final int magic = in.readInt();
            if (magic != MAGIC_NUMBER) {
                logger.error("FstHeader::Read: Bad FST header: {}. Magic number not matched. Got: {}", source, magic);
                return false;
            }
            fstType = readString(in);
            arcType = readString(in);
            version = in.readInt();
            flags = in.readInt();
            properties = in.readLong();
            start = in.readLong();
            numStates = in.readLong();
            numArcs = in.readLong();
        } catch (IOException e) {
            logger.error("FstHeader::Read: Read failed: {}", source, e);
            return false;
        }
        return true;
    }

    public void write(DataOutput out) throws IOException {
        out.writeInt(MAGIC_NUMBER);
        writeString(out, fstType);
        writeString(out, arcType);
        out.writeInt(version);
        out.writeInt(flags);
        out.writeLong(properties);
        out.writeLong(start);
        out.writeLong(numStates);
        out.writeLong(numArcs);
    }

    /**
     * Strings are an int byte count followed by UTF-8 bytes.
     */
    public static String readString(DataInput in) throws IOException {
        final int length = in.readInt();
        if (length < 0) {
            throw new IOException("Negative string length: " + length);
        }
        final byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static void writeString(DataOutput out, String s) throws IOException {
        final byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    @Override
    public String toString() {
        return "FstHeader(fst_type=" + fstType + ", arc_type=" + arcType + ", version=" + version
            + ", flags=" + flags + ", properties=" + Long.toHexString(properties) + ", start=" + start
            + ", num_states=" + numStates + ", num_arcs=" + numArcs + ")";
    }
}
