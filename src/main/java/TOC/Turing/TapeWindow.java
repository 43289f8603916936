package TOC.Turing;

import java.util.List;

import TOC.Model.Symbol;

/**
 * Cells around one head, for rendering.
 * @param head head position
 * @param from position of the first cell in {@code cells}
 * @param cells consecutive cells starting at {@code from}
 */
public record TapeWindow(int head, int from, List<Symbol> cells) {

    public TapeWindow {
        cells = List.copyOf(cells);
    }

    public Symbol underHead() {
        return cells.get(head - from);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            Symbol s = cells.get(i);
            String text = s.isBlank() ? "#" : s.text();
            sb.append(from + i == head ? "[" + text + "]" : " " + text + " ");
        }
        return sb.toString();
    }
}
