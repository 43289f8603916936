package TOC.Turing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import TOC.Model.Symbol;
import TOC.Model.ValidationException;
import TOC.Tape.SparseTape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic multi-tape Turing machine, advanced one configuration per {@link #step()} call.
 * <p>
 * Each instance owns its tapes and configuration. Pacing is up to the caller: to pause or cancel a run, stop
 * calling {@link #step()}.
 */
public class MultiTapeTuringMachine {
    private static final Logger LOG = LoggerFactory.getLogger(MultiTapeTuringMachine.class);

    public static final int DEFAULT_WINDOW_RADIUS = 10;

    private final TuringMachineDefinition definition;
    private final List<List<Symbol>> initialTapes;
    private final SparseTape[] tapes;
    private final int[] heads;
    private final int windowRadius;

    private String currentState;
    private int stepCount;
    private boolean halted;
    private HaltReason haltReason;
    private TuringTransition lastTransition;

    public MultiTapeTuringMachine(TuringMachineDefinition definition, List<List<Symbol>> initialTapes) {
        this(definition, initialTapes, DEFAULT_WINDOW_RADIUS);
    }

    /**
     * @throws ValidationException if {@code windowRadius} is negative or the tapes do not fit the machine
     */
    public MultiTapeTuringMachine(TuringMachineDefinition definition, List<List<Symbol>> initialTapes, int windowRadius) {
        if (windowRadius < 0) {
            throw new ValidationException("Window radius must not be negative: " + windowRadius);
        }
        this.definition = definition;
        this.windowRadius = windowRadius;
        this.tapes = new SparseTape[definition.getTapeCount()];
        for (int i = 0; i < tapes.length; i++) {
            tapes[i] = new SparseTape();
        }
        this.heads = new int[definition.getTapeCount()];
        this.initialTapes = copyTapes(initialTapes);
        reset(this.initialTapes);
    }

    /**
     * Replay the tapes given at construction.
     */
    public void reset() {
        reset(initialTapes);
    }

    /**
     * Clear all tapes, load the given symbols (blanks are not stored), move every head to 0 and return to the
     * start state with a cleared step counter and halt status.
     * @throws ValidationException if the number of tapes differs from the machine's
     */
    public void reset(List<List<Symbol>> inputTapes) {
        if (inputTapes.size() != tapes.length) {
            throw new ValidationException("Expected " + tapes.length + " tapes, got " + inputTapes.size());
        }
        for (List<Symbol> tape : inputTapes) {
            if (tape.contains(Symbol.EPSILON)) {
                throw new ValidationException("Epsilon cannot be placed on a tape: " + tape);
            }
        }
        for (int i = 0; i < tapes.length; i++) {
            tapes[i].load(inputTapes.get(i));
        }
        Arrays.fill(heads, 0);
        currentState = definition.getStartState();
        stepCount = 0;
        halted = false;
        haltReason = HaltReason.NONE;
        lastTransition = null;
    }

    public Symbol read(int tapeIndex) {
        return tapes[tapeIndex].read(heads[tapeIndex]);
    }

    public void write(int tapeIndex, Symbol symbol) {
        tapes[tapeIndex].write(heads[tapeIndex], symbol);
    }

    public StepResult step() {
        if (halted) {
            return result(StepStatus.HALTED, haltReason.description());
        }

        if (definition.isAccepting(currentState)) {
            halt(HaltReason.ACCEPTED);
            return result(StepStatus.ACCEPT, "Reached an accept state.");
        }

        List<Symbol> read = new ArrayList<>(tapes.length);
        for (int i = 0; i < tapes.length; i++) {
            read.add(read(i));
        }
        TransitionKey key = new TransitionKey(currentState, read);
        TuringTransition transition = definition.getTransition(key);

        if (transition == null) {
            halt(HaltReason.NO_TRANSITION);
            lastTransition = null;
            return result(StepStatus.HALTED, "No transition for " + key + ".");
        }

        List<Action> actions = transition.actions();
        for (int i = 0; i < tapes.length; i++) {
            Action action = actions.get(i);
            if (action.hasWrite()) {
                write(i, action.write());
            }
            heads[i] = action.move().apply(heads[i]);
        }

        currentState = transition.nextState();
        stepCount++;
        lastTransition = transition;

        if (definition.isAccepting(currentState)) {
            halt(HaltReason.ACCEPTED);
            return result(StepStatus.ACCEPT, "The machine accepted the input.");
        }
        return result(StepStatus.RUNNING, "Step executed.");
    }

    /**
     * Step until the machine stops running or {@code maxSteps} calls have been made.
     * @return result of the last call
     */
    public StepResult run(int maxSteps) {
        StepResult last = step();
        int calls = 1;
        while (last.isRunning() && calls < maxSteps) {
            last = step();
            calls++;
        }
        if (last.isRunning()) {
            LOG.debug("Stopped after {} steps without halting in state {}", calls, currentState);
        }
        return last;
    }

    private void halt(HaltReason reason) {
        halted = true;
        haltReason = reason;
        LOG.debug("Halted in state {} after {} steps: {}", currentState, stepCount, reason);
    }

    private StepResult result(StepStatus status, String message) {
        return new StepResult(status, haltReason, message, currentState, stepCount, windows());
    }

    public TapeWindow window(int tapeIndex, int radius) {
        if (radius < 0) {
            throw new ValidationException("Window radius must not be negative: " + radius);
        }
        int head = heads[tapeIndex];
        return new TapeWindow(head, head - radius, tapes[tapeIndex].window(head - radius, head + radius));
    }

    public List<TapeWindow> windows() {
        List<TapeWindow> result = new ArrayList<>(tapes.length);
        for (int i = 0; i < tapes.length; i++) {
            result.add(window(i, windowRadius));
        }
        return result;
    }

    public TuringMachineDefinition getDefinition() {
        return definition;
    }

    public String getCurrentState() {
        return currentState;
    }

    public int getStepCount() {
        return stepCount;
    }

    public boolean isHalted() {
        return halted;
    }

    public HaltReason getHaltReason() {
        return haltReason;
    }

    /**
     * @return the transition fired by the last successful step, or null
     */
    public TuringTransition getLastTransition() {
        return lastTransition;
    }

    public int getHead(int tapeIndex) {
        return heads[tapeIndex];
    }

    public int getTapeCount() {
        return tapes.length;
    }

    /**
     * Non-blank span of a tape, leftmost to rightmost.
     */
    public List<Symbol> getTapeContents(int tapeIndex) {
        return tapes[tapeIndex].contents();
    }

    public String describeTape(int tapeIndex) {
        return tapes[tapeIndex].toString();
    }

    private static List<List<Symbol>> copyTapes(List<List<Symbol>> tapes) {
        return tapes.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }
}
