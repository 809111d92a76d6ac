package WFST;

/**
 * Visits every state id once, in ascending order. Restartable with reset().
 * <pre>
 *   for (StateIterator siter = fst.states(); !siter.done(); siter.next()) {
 *     int s = siter.value();
 *   }
 * </pre>
 */
public interface StateIterator {
    boolean done();

    int value();

    void next();

    void reset();
}
