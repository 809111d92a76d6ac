package WFST.Registry;

import WFST.Model.ConstFst;
import WFST.Model.VectorFst;
import WFST.Weight.Semiring;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps (arc type, transducer type) to the reader and converter for that representation.
 * Nothing registers itself: the application builds a registry, typically with
 * {@link #withDefaults(Semiring[])}, and passes it to {@link FstIO}.
 * Populate a registry before sharing it between threads.
 */
public class FstRegistry {
    private static final Logger logger = LogManager.getLogger(FstRegistry.class.getSimpleName());

    // arc type -> fst type -> registration
    private final Map<String, Map<String, FstRegistration<?>>> registrations = new HashMap<>();

    /**
     * Registry knowing the "vector" and "const" representations for each of the given semirings.
     */
    public static FstRegistry withDefaults(Semiring<?>... semirings) {
        final FstRegistry registry = new FstRegistry();
        for (Semiring<?> semiring : semirings) {
            registry.registerDefaults(semiring);
        }
        return registry;
    }

    private <W> void registerDefaults(Semiring<W> semiring) {
        register(semiring, VectorFst.TYPE, (in, opts) -> VectorFst.read(semiring, in, opts), VectorFst::new);
        register(semiring, ConstFst.TYPE, (in, opts) -> ConstFst.read(semiring, in, opts), ConstFst::new);
    }

    /**
     * Register a representation; a later registration for the same key replaces the earlier one.
     */
    public <W> FstRegistry register(Semiring<W> semiring, String fstType, FstReader<W> reader,
                                    FstConverter<W> converter) {
        final FstRegistration<?> previous = registrations
            .computeIfAbsent(semiring.arcType(), k -> new HashMap<>())
            .put(fstType, new FstRegistration<>(semiring, fstType, reader, converter));
        if (previous != null) {
            logger.warn("FstRegistry: replacing registration of {}", previous);
        }
        return this;
    }

    /** @return the registration, or null if unknown */
    public FstRegistration<?> registration(String arcType, String fstType) {
        final Map<String, FstRegistration<?>> byType = registrations.get(arcType);
        return byType == null ? null : byType.get(fstType);
    }

    /**
     * Registration for fstType over the arc type of semiring.
     * @return the registration, or null if unknown
     */
    @SuppressWarnings("unchecked")
    public <W> FstRegistration<W> registration(Semiring<W> semiring, String fstType) {
        return (FstRegistration<W>) registration(semiring.arcType(), fstType);
    }

    public boolean isRegistered(String arcType, String fstType) {
        return registration(arcType, fstType) != null;
    }

    /** Transducer types registered for arcType, sorted. */
    public Set<String> types(String arcType) {
        final Map<String, FstRegistration<?>> byType = registrations.get(arcType);
        return byType == null ? Collections.emptySet() : Collections.unmodifiableSet(new TreeSet<>(byType.keySet()));
    }

    /** Arc types with at least one registration, sorted. */
    public Set<String> arcTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(registrations.keySet()));
    }
}
