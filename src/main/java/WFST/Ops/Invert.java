package WFST.Ops;

import WFST.Fst;
import WFST.MutableFst;
import WFST.SymbolTable;

/**
 * Inversion exchanges input and output labels, and the input and output symbol tables.
 * Weights and topology are untouched, so inverting twice gives back the original.
 */
public final class Invert {
    private Invert() {
    }

    public static <W> void invert(MutableFst<W> fst) {
        final SymbolTable input = fst.inputSymbols();
        final SymbolTable output = fst.outputSymbols();
        ArcMap.map(fst, new InvertMapper<>());
        fst.setInputSymbols(output);
        fst.setOutputSymbols(input);
    }

    public static <W> void invert(Fst<W> ifst, MutableFst<W> ofst) {
        ArcMap.map(ifst, ofst, new InvertMapper<>());
        ofst.setInputSymbols(ifst.outputSymbols());
        ofst.setOutputSymbols(ifst.inputSymbols());
    }
}
