package WFST;

import WFST.Registry.FstHeader;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Objects;

/**
 * Bidirectional mapping between labels and symbol strings. Transducers hold their tables
 * independently; operations replace or swap whole tables rather than editing entries.
 */
public class SymbolTable {
    private static final Logger logger = LogManager.getLogger(SymbolTable.class.getSimpleName());

    public static final int MAGIC_NUMBER = 2125658996;
    public static final int NO_SYMBOL = -1;

    private String name;
    private final Int2ObjectMap<String> keyToSymbol;
    private final Object2IntMap<String> symbolToKey;
    private int availableKey = 0;

    public SymbolTable(String name) {
        this.name = name;
        this.keyToSymbol = new Int2ObjectLinkedOpenHashMap<>();
        this.symbolToKey = new Object2IntOpenHashMap<>();
        this.symbolToKey.defaultReturnValue(NO_SYMBOL);
    }

    public SymbolTable() {
        this("<unspecified>");
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Adds symbol under the next available key, or returns its existing key.
     */
    public int addSymbol(String symbol) {
        final int key = symbolToKey.getInt(symbol);
        if (key != NO_SYMBOL) {
            return key;
        }
        return addSymbol(symbol, availableKey);
    }

    /**
     * Adds symbol under key. If the symbol is present already its existing key is returned.
     */
    public int addSymbol(String symbol, int key) {
        final int existing = symbolToKey.getInt(symbol);
        if (existing != NO_SYMBOL) {
            if (existing != key) {
                logger.debug("SymbolTable::AddSymbol: symbol = {} already in table with key = {} != {}",
                    symbol, existing, key);
            }
            return existing;
        }
        symbolToKey.put(symbol, key);
        keyToSymbol.put(key, symbol);
        if (key >= availableKey) {
            availableKey = key + 1;
        }
        return key;
    }

    /** @return key of symbol, or NO_SYMBOL */
    public int find(String symbol) {
        return symbolToKey.getInt(symbol);
    }

    /** @return symbol with the given key, or null */
    public String find(int key) {
        return keyToSymbol.get(key);
    }

    public boolean member(int key) {
        return keyToSymbol.containsKey(key);
    }

    public boolean member(String symbol) {
        return symbolToKey.containsKey(symbol);
    }

    public int numSymbols() {
        return keyToSymbol.size();
    }

    public int availableKey() {
        return availableKey;
    }

    public SymbolTable copy() {
        final SymbolTable copy = new SymbolTable(name);
        for (Int2ObjectMap.Entry<String> e : keyToSymbol.int2ObjectEntrySet()) {
            copy.addSymbol(e.getValue(), e.getIntKey());
        }
        copy.availableKey = availableKey;
        return copy;
    }

    public void write(DataOutput out) throws IOException {
        out.writeInt(MAGIC_NUMBER);
        FstHeader.writeString(out, name);
        out.writeLong(availableKey);
        out.writeLong(keyToSymbol.size());
        for (Int2ObjectMap.Entry<String> e : keyToSymbol.int2ObjectEntrySet()) {
            FstHeader.writeString(out, e.getValue());
            out.writeLong(e.getIntKey());
        }
    }

    /**
     * @return the table, or null (after logging) if the input is not a symbol table
     */
    public static SymbolTable read(DataInput in, String source) throws IOException {
        final int magic = in.readInt();
        if (magic != MAGIC_NUMBER) {
            logger.error("SymbolTable::Read: Read failed: {}", source);
            return null;
        }
        final SymbolTable table = new SymbolTable(FstHeader.readString(in));
        final long available = in.readLong();
        final long size = in.readLong();
        for (long i = 0; i < size; i++) {
            final String symbol = FstHeader.readString(in);
            final long key = in.readLong();
            table.addSymbol(symbol, (int) key);
        }
        table.availableKey = Math.max(table.availableKey, (int) available);
        return table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolTable)) {
            return false;
        }
        final SymbolTable other = (SymbolTable) o;
        return name.equals(other.name) && keyToSymbol.equals(other.keyToSymbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, keyToSymbol);
    }

    @Override
    public String toString() {
        return name + keyToSymbol;
    }
}
