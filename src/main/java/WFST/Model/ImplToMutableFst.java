package WFST.Model;

import WFST.Arc;
import WFST.MutableArcIterator;
import WFST.MutableFst;
import WFST.Properties;
import WFST.SymbolTable;
import it.unimi.dsi.fastutil.ints.IntCollection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Mutable transducer handle with copy-on-write: every mutator first forks the implementation
 * if another handle shares it, so no other handle ever observes the change.
 * @param <I> implementation type
 * @param <W> weight type
 */
public abstract class ImplToMutableFst<I extends MutableFstImpl<W>, W> extends ImplToExpandedFst<I, W>
    implements MutableFst<W> {
    private static final Logger logger = LogManager.getLogger(ImplToMutableFst.class.getSimpleName());

    protected ImplToMutableFst(I impl) {
        super(impl);
    }

    protected ImplToMutableFst(ImplToMutableFst<I, W> fst, boolean safe) {
        super(fst, safe);
    }

    /**
     * An empty implementation of this representation.
     */
    protected abstract I emptyImpl();

    /**
     * Fork the implementation if it is shared.
     */
    protected void mutateCheck() {
        if (!unique()) {
            logger.debug("Forking shared {} implementation", type());
            setImpl(copyImpl());
        }
    }

    @Override
    public void setStart(int s) {
        mutateCheck();
        getImpl().setStart(s);
    }

    @Override
    public void setFinal(int s, W weight) {
        mutateCheck();
        getImpl().setFinal(s, weight);
    }

    /**
     * Intrinsic bits describe structure every sharing handle has in common, so they are set
     * without forking; a change to an extrinsic bit forks first.
     */
    @Override
    public void setProperties(long props, long mask) {
        final long exprops = Properties.EXTRINSIC_PROPERTIES & mask;
        if (getImpl().properties(exprops) != (props & exprops)) {
            mutateCheck();
        }
        getImpl().setProperties(props, mask);
    }

    @Override
    public int addState() {
        mutateCheck();
        return getImpl().addState();
    }

    @Override
    public void addStates(int n) {
        mutateCheck();
        getImpl().addStates(n);
    }

    @Override
    public void addArc(int s, Arc<W> arc) {
        mutateCheck();
        getImpl().addArc(s, arc);
    }

    @Override
    public void deleteStates(IntCollection states) {
        mutateCheck();
        getImpl().deleteStates(states);
    }

    /**
     * A shared implementation is not copied: this handle gets a new empty one keeping the symbol tables.
     */
    @Override
    public void deleteStates() {
        if (!unique()) {
            final SymbolTable isymbols = getImpl().inputSymbols();
            final SymbolTable osymbols = getImpl().outputSymbols();
            final I impl = emptyImpl();
            impl.setInputSymbols(isymbols == null ? null : isymbols.copy());
            impl.setOutputSymbols(osymbols == null ? null : osymbols.copy());
            setImpl(impl);
        } else {
            getImpl().deleteStates();
        }
    }

    @Override
    public void deleteArcs(int s, int n) {
        mutateCheck();
        getImpl().deleteArcs(s, n);
    }

    @Override
    public void deleteArcs(int s) {
        mutateCheck();
        getImpl().deleteArcs(s);
    }

    @Override
    public void reserveStates(int n) {
        mutateCheck();
        getImpl().reserveStates(n);
    }

    @Override
    public void reserveArcs(int s, int n) {
        mutateCheck();
        getImpl().reserveArcs(s, n);
    }

    @Override
    public void setInputSymbols(SymbolTable symbols) {
        mutateCheck();
        getImpl().setInputSymbols(symbols == null ? null : symbols.copy());
    }

    @Override
    public void setOutputSymbols(SymbolTable symbols) {
        mutateCheck();
        getImpl().setOutputSymbols(symbols == null ? null : symbols.copy());
    }

    /**
     * The iterator forks on its first setValue, not on creation, so reading through it never copies.
     */
    @Override
    public MutableArcIterator<W> mutableArcs(int s) {
        return new ImplMutableArcIterator<>(this, s);
    }

    Arc<W> arcAt(int s, int pos) {
        return getImpl().arc(s, pos);
    }

    void setArcAt(int s, int pos, Arc<W> arc) {
        mutateCheck();
        getImpl().setArc(s, pos, arc);
    }
}
