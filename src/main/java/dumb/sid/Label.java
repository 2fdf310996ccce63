package dumb.sid;

/** Three-valued admissibility label: Is-admissible, Not-admissible, Unresolved. */
public enum Label {
    I, N, U
}
