package TOC.Turing;

import java.util.Objects;

import TOC.Model.Symbol;
import TOC.Model.ValidationException;

/**
 * What one transition does to one tape: an optional write followed by a head move.
 * @param write symbol to write, or null to leave the cell alone. {@link Symbol#BLANK} erases the cell.
 * @param move head move applied after the write
 */
public record Action(Symbol write, Move move) {

    public Action {
        Objects.requireNonNull(move, "move");
        if (write != null && write.isEpsilon()) {
            throw new ValidationException("Epsilon is not a writable tape symbol");
        }
    }

    public static Action move(Move move) {
        return new Action(null, move);
    }

    public static Action write(Symbol symbol, Move move) {
        return new Action(Objects.requireNonNull(symbol, "symbol"), move);
    }

    public static Action stay() {
        return new Action(null, Move.STAY);
    }

    public boolean hasWrite() {
        return write != null;
    }

    @Override
    public String toString() {
        String arrow = switch (move) {
            case LEFT -> "<-";
            case RIGHT -> "->";
            case STAY -> "";
        };
        if (write == null) {
            return arrow;
        }
        String w = write.isBlank() ? "#" : write.text();
        return move == Move.STAY ? w : w + arrow;
    }
}
