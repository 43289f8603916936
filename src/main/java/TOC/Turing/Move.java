package TOC.Turing;

public enum Move {
    LEFT(-1),
    RIGHT(1),
    STAY(0);

    private final int delta;

    Move(int delta) {
        this.delta = delta;
    }

    public int apply(int head) {
        return head + delta;
    }
}
