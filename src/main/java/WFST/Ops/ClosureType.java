package WFST.Ops;

public enum ClosureType {
    /** T*: zero or more repetitions; accepts the empty string with weight one. */
    CLOSURE_STAR,
    /** T+: one or more repetitions. */
    CLOSURE_PLUS
}
