package TOC.Parse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import TOC.Model.Symbol;
import TOC.Model.ValidationException;
import TOC.Turing.Action;
import TOC.Turing.Move;
import TOC.Turing.TransitionKey;
import TOC.Turing.TuringMachineDefinition;
import TOC.Turing.TuringTransition;

/**
 * Reads the line-based machine description format.
 * <pre>
 * // unary copy
 * start e0
 * accept ef
 * tape1=[&gt;,1,1,#]
 * tape2=[&gt;,#,#,#]
 * e0 (&gt;,&gt;) -&gt; (-&gt;, -&gt;, e0)
 * e0 (1,#) -&gt; (-&gt;, 1-&gt;, e0)
 * e0 (#,#) -&gt; (, , ef)
 * </pre>
 * {@code #} (or an empty cell) is the blank symbol. Lines starting with {@code //} or {@code #} are comments.
 * An action token is empty (stay), {@code ->} / {@code <-} (move), {@code x->} / {@code x<-} (write and move),
 * {@code x|M} or {@code x&M} (write and move M) or {@code x} (write and stay).
 */
public class MachineFileParser {
    public static final String BLANK_TOKEN = "#";

    private static final Pattern TAPE = Pattern.compile("^([a-zA-Z][\\w-]*)\\s*=\\s*\\[(.*)]$");
    private static final Pattern TRANSITION =
        Pattern.compile("^([a-zA-Z][\\w-]*)\\s*\\(([^)]*)\\)\\s*->\\s*\\(([^)]*)\\)$");
    private static final Pattern START = Pattern.compile("^start\\s+([a-zA-Z][\\w-]*)$");
    private static final Pattern ACCEPT = Pattern.compile("^accept\\s+(.+)$");
    private static final Pattern STATE_NAME = Pattern.compile("^[a-zA-Z][\\w-]*$");

    public static MachineFile parse(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static MachineFile parse(String text) {
        return parse(text.lines().toList());
    }

    /**
     * @throws ValidationException on the first malformed line, or if the machine itself is invalid
     */
    public static MachineFile parse(List<String> lines) {
        String start = null;
        Set<String> states = new LinkedHashSet<>();
        Set<String> accept = new LinkedHashSet<>();
        List<String> tapeNames = new ArrayList<>();
        List<List<Symbol>> tapes = new ArrayList<>();
        List<TuringTransition> transitions = new ArrayList<>();

        for (int n = 0; n < lines.size(); n++) {
            String line = lines.get(n).trim();
            if (line.isEmpty() || line.startsWith("//") || line.startsWith("#")) {
                continue;
            }
            try {
                Matcher m;
                // before ACCEPT, which would also match a transition out of a state named "accept"
                if (TRANSITION.matcher(line).matches()) {
                    TuringTransition t = parseTransition(line);
                    states.add(t.key().state());
                    states.add(t.nextState());
                    transitions.add(t);
                } else if ((m = START.matcher(line)).matches()) {
                    if (start != null) {
                        throw new ValidationException("Exactly one start state is allowed");
                    }
                    start = m.group(1);
                    states.add(start);
                } else if ((m = ACCEPT.matcher(line)).matches()) {
                    for (String s : splitByComma(m.group(1))) {
                        accept.add(stateName(s));
                        states.add(s);
                    }
                } else if ((m = TAPE.matcher(line)).matches()) {
                    tapeNames.add(m.group(1));
                    tapes.add(parseTape(m.group(1), m.group(2)));
                } else {
                    throw new ValidationException("Unrecognized line. Use: e0 (>,>) -> (->, 1->, e1)");
                }
            } catch (ValidationException e) {
                throw new ValidationException("Line " + (n + 1) + ": " + e.getMessage(), e);
            }
        }

        if (tapes.isEmpty()) {
            throw new ValidationException("At least one tape must be defined");
        }
        TuringMachineDefinition.Builder builder = TuringMachineDefinition.builder(tapes.size())
                .state(states.toArray(new String[0]))
                .accept(accept.toArray(new String[0]))
                .start(start);
        transitions.forEach(builder::transition);
        return new MachineFile(builder.build(), tapeNames, tapes);
    }

    /**
     * Parse {@code from (r1,...,rn) -> (a1,...,an, next)}.
     */
    public static TuringTransition parseTransition(String line) {
        Matcher m = TRANSITION.matcher(line.trim());
        if (!m.matches()) {
            throw new ValidationException("Invalid transition '" + line + "'. Use: e0 (>,>) -> (->, 1->, e1)");
        }
        String from = m.group(1).trim();
        List<Symbol> read = new ArrayList<>();
        for (String token : splitByComma(m.group(2))) {
            read.add(symbol(token));
        }
        List<String> rhs = splitByComma(m.group(3));
        if (rhs.size() < 2) {
            throw new ValidationException("The right-hand side needs one action per tape and the next state");
        }
        String next = rhs.get(rhs.size() - 1);
        if (next.isEmpty()) {
            throw new ValidationException("The next state must close the right-hand side");
        }
        List<Action> actions = new ArrayList<>();
        for (String token : rhs.subList(0, rhs.size() - 1)) {
            actions.add(parseAction(token));
        }
        return new TuringTransition(new TransitionKey(from, read), stateName(next), actions);
    }

    public static Action parseAction(String rawToken) {
        String token = rawToken.trim();
        if (token.isEmpty()) {
            return Action.stay();
        }
        for (String separator : new String[] {"|", "&"}) {
            int idx = token.indexOf(separator);
            if (idx >= 0) {
                Symbol write = optionalSymbol(token.substring(0, idx));
                Move move = parseMove(token.substring(idx + 1));
                return new Action(write, move);
            }
        }
        if (token.equals("->")) {
            return Action.move(Move.RIGHT);
        }
        if (token.equals("<-")) {
            return Action.move(Move.LEFT);
        }
        if (token.endsWith("->")) {
            return new Action(optionalSymbol(token.substring(0, token.length() - 2)), Move.RIGHT);
        }
        if (token.endsWith("<-")) {
            return new Action(optionalSymbol(token.substring(0, token.length() - 2)), Move.LEFT);
        }
        return Action.write(symbol(token), Move.STAY);
    }

    public static Move parseMove(String raw) {
        String move = raw.trim().toUpperCase(Locale.ROOT);
        return switch (move) {
            case "R", "->", "RIGHT", "DERECHA" -> Move.RIGHT;
            case "L", "<-", "LEFT", "IZQUIERDA" -> Move.LEFT;
            case "S", "", "STAY", "QUIETO" -> Move.STAY;
            default -> throw new ValidationException("Invalid move: " + raw);
        };
    }

    static List<Symbol> parseTape(String name, String body) {
        List<String> tokens = splitByComma(body);
        if (tokens.size() == 1 && tokens.get(0).isEmpty()) {
            throw new ValidationException("Tape " + name + " cannot be empty");
        }
        List<Symbol> symbols = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            symbols.add(symbol(token));
        }
        return symbols;
    }

    static Symbol symbol(String token) {
        String t = token.trim();
        return t.isEmpty() || t.equals(BLANK_TOKEN) ? Symbol.BLANK : Symbol.of(t);
    }

    private static Symbol optionalSymbol(String token) {
        return token.trim().isEmpty() ? null : symbol(token);
    }

    private static String stateName(String raw) {
        String name = raw.trim();
        if (!STATE_NAME.matcher(name).matches()) {
            throw new ValidationException("Invalid state name: '" + raw + "'");
        }
        return name;
    }

    private static List<String> splitByComma(String value) {
        List<String> parts = new ArrayList<>();
        for (String part : value.split(",", -1)) {
            parts.add(part.trim());
        }
        return parts;
    }
}
