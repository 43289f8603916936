package TOC.Tape;

import java.util.ArrayList;
import java.util.List;

import TOC.Model.Symbol;
import TOC.Model.ValidationException;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Infinite tape backed by a sparse map. A position without an entry holds {@link Symbol#BLANK}; blanks are never
 * stored.
 */
public class SparseTape {
    private final Int2ObjectMap<Symbol> cells = new Int2ObjectOpenHashMap<>();

    /**
     * Clear the tape and write the given symbols from position 0 on, skipping blanks.
     */
    public void load(List<Symbol> symbols) {
        cells.clear();
        for (int pos = 0; pos < symbols.size(); pos++) {
            write(pos, symbols.get(pos));
        }
    }

    public Symbol read(int position) {
        Symbol symbol = cells.get(position);
        return symbol == null ? Symbol.BLANK : symbol;
    }

    public void write(int position, Symbol symbol) {
        if (symbol.isEpsilon()) {
            throw new ValidationException("Epsilon cannot be written to a tape");
        }
        if (symbol.isBlank()) {
            cells.remove(position);
        } else {
            cells.put(position, symbol);
        }
    }

    public void clear() {
        cells.clear();
    }

    /**
     * Cells in [from, to], blanks included.
     */
    public List<Symbol> window(int from, int to) {
        List<Symbol> result = new ArrayList<>(Math.max(0, to - from + 1));
        for (int pos = from; pos <= to; pos++) {
            result.add(read(pos));
        }
        return result;
    }

    /**
     * Number of non-blank cells.
     */
    public int size() {
        return cells.size();
    }

    public IntSortedSet positions() {
        return new IntRBTreeSet(cells.keySet());
    }

    /**
     * Contents from the leftmost to the rightmost non-blank cell, or an empty list for a blank tape.
     */
    public List<Symbol> contents() {
        if (cells.isEmpty()) {
            return List.of();
        }
        IntSortedSet positions = positions();
        return window(positions.firstInt(), positions.lastInt());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Symbol s : contents()) {
            sb.append(s.isBlank() ? "#" : s.text());
        }
        return sb.toString();
    }
}
