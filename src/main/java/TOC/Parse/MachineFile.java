package TOC.Parse;

import java.util.List;

import TOC.Model.Symbol;
import TOC.Turing.MultiTapeTuringMachine;
import TOC.Turing.TuringMachineDefinition;

/**
 * A parsed machine description: the validated machine plus its named initial tapes.
 */
public record MachineFile(TuringMachineDefinition definition, List<String> tapeNames, List<List<Symbol>> tapes) {

    public MachineFile {
        tapeNames = List.copyOf(tapeNames);
        tapes = tapes.stream().map(List::copyOf).toList();
    }

    public MultiTapeTuringMachine newMachine() {
        return new MultiTapeTuringMachine(definition, tapes);
    }
}
