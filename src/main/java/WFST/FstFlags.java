package WFST;

/**
 * Process-wide settings, read once from system properties.
 * Fields are public and mutable so tests and embedding applications can override them.
 */
public final class FstFlags {
    /** Separator between printed components of a composite weight; must be a single character. */
    public static String WEIGHT_SEPARATOR = System.getProperty("wfst.weight.separator", ",");

    /** Characters enclosing a printed composite weight; empty (none) or exactly two (open and close). */
    public static String WEIGHT_PARENTHESES = System.getProperty("wfst.weight.parentheses", "");

    /** Recompute properties on every tested query and check them against the stored bits. */
    public static boolean VERIFY_PROPERTIES = Boolean.getBoolean("wfst.verify.properties");

    /** Whether delayed transducers bound their state cache by default. */
    public static boolean CACHE_GC = Boolean.getBoolean("wfst.cache.gc");

    /** Maximum number of cached states of a delayed transducer when the cache is bounded. */
    public static long CACHE_GC_LIMIT = Long.getLong("wfst.cache.gc.limit", 1L << 16);

    private FstFlags() {
    }
}
