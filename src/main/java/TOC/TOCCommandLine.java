package TOC;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import TOC.Model.SearchBudget;
import TOC.Parse.MachineFile;
import TOC.Parse.MachineFileParser;
import TOC.Turing.MultiTapeTuringMachine;
import TOC.Turing.StepResult;
import TOC.Turing.TapeWindow;

public class TOCCommandLine {
    /**
     * Two-tape unary copy: copies the 1s of tape 1 onto tape 2, then accepts.
     */
    public static final String UNARY_COPY_EXAMPLE = String.join("\n",
        "start e0",
        "accept ef",
        "tape1=[>,1,1,1,1,1,#]",
        "tape2=[>,#,#,#,#,#,#]",
        "e0 (>,>) -> (->, ->, e0)",
        "e0 (1,#) -> (->, 1->, e0)",
        "e0 (#,#) -> (, , ef)");

    public static void main(String[] args) {
        boolean trace = false;
        int maxSteps = SearchBudget.DEFAULT_MAX_STEPS;
        List<String> positional = new ArrayList<>(1);

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--debug".equalsIgnoreCase(arg)) {
                // must happen before the first logger is created
                System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
            } else if ("--trace".equalsIgnoreCase(arg)) {
                trace = true;
            } else if ("--maxSteps".equalsIgnoreCase(arg)) {
                if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
                    System.err.println("Missing value for --maxSteps");
                    printUsageAndExit();
                }
                maxSteps = parsePositive(args[++i]);
            } else if (arg.startsWith("-")) {
                printUsageAndExit();
            } else {
                positional.add(arg);
            }
        }

        if (positional.size() != 1) {
            printUsageAndExit();
        }

        MachineFile file = load(positional.get(0));
        System.out.println("Tapes: " + file.tapeNames());
        System.out.println("Transitions: " + file.definition().getTransitions().size());

        long before = System.currentTimeMillis();
        StepResult result = run(file.newMachine(), maxSteps, trace);
        long after = System.currentTimeMillis();

        System.out.println("Final state: " + result.state());
        System.out.println("Steps: " + result.stepCount());
        System.out.println("Outcome: " + result.status() + " - " + result.message());
        printTapes(file.tapeNames(), result);
        System.out.println("duration: " + ((after - before) / 1000f) + "s");
    }

    /**
     * Drive the machine until it halts or {@code maxSteps} steps have been taken.
     */
    static StepResult run(MultiTapeTuringMachine machine, int maxSteps, boolean trace) {
        if (!trace) {
            return machine.run(maxSteps);
        }
        StepResult result;
        int calls = 0;
        do {
            result = machine.step();
            calls++;
            System.out.println(result.stepCount() + ": " + result.state() + " " + result.status());
        } while (result.isRunning() && calls < maxSteps);
        return result;
    }

    static MachineFile load(String source) {
        if ("example".equalsIgnoreCase(source)) {
            return MachineFileParser.parse(UNARY_COPY_EXAMPLE);
        }
        try {
            return MachineFileParser.parse(Path.of(source));
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private static void printTapes(List<String> names, StepResult result) {
        List<TapeWindow> windows = result.tapes();
        for (int i = 0; i < windows.size(); i++) {
            System.out.println(names.get(i) + ": " + windows.get(i));
        }
    }

    private static int parsePositive(String value) {
        try {
            int n = Integer.parseInt(value);
            if (n > 0) {
                return n;
            }
        } catch (NumberFormatException e) {
            System.err.println("Not a number: " + value);
        }
        printUsageAndExit();
        return -1;
    }

    private static void printUsageAndExit() {
        System.out.println("TOC [--debug] [--trace] [--maxSteps <n>] <machine file | example>");
        System.out.println("[--debug] : Engine debug logging");
        System.out.println("[--trace] : Print every step");
        System.out.println("[--maxSteps <n>] : Stop after n steps (default " + SearchBudget.DEFAULT_MAX_STEPS + ")");
        System.out.println();
        System.out.println("<machine file> : start/accept lines, tape lines like tape1=[>,1,#] and");
        System.out.println("  transition lines like e0 (1,#) -> (->, 1->, e0)");
        System.out.println("example : the built-in two-tape unary copy machine");
        System.exit(0);
    }
}
