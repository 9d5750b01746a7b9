package org.calista.formal.lang;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.formal.lang.core.FormalKernel;
import org.calista.formal.lang.core.FormalLanguage;
import org.calista.formal.lang.corpus.FormalCorpus;
import org.calista.formal.lang.export.Brain;
import org.calista.formal.lang.universe.HistoryEntry;
import org.calista.formal.lang.universe.TransitionResult;
import org.calista.formal.lang.universe.Universe;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Scanner;

/**
 * FormalApp: console runner.
 *
 * <pre>
 *   compile &lt;file&gt; [domain]   evaluate a source file and write its brain
 *   validate &lt;file&gt;           parse only, report the first error
 *   (no args)                 interactive loop: load, apply, history, root, export, corpus, exit
 * </pre>
 */
public final class FormalApp {

    private static final Logger log = LogManager.getLogger(FormalApp.class);

    private final Path configRoot;
    private final Path cfgPath;
    private final PrintStream out;
    private FormalKernel kernel;
    private Universe universe;

    public static void main(String[] args) throws Exception {
        int code = new FormalApp(Path.of("."), Path.of("config/formal.json"), System.out).run(args);
        if (code != 0) System.exit(code);
    }

    public FormalApp(Path configRoot, Path cfgPath, PrintStream out) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
        this.out = out;
    }

    /**
     * @return process exit code
     */
    public int run(String[] args) throws IOException {
        return run(args, System.in);
    }

    int run(String[] args, InputStream in) throws IOException {
        kernel = FormalKernel.builder()
                .configRoot(configRoot)
                .build(cfgPath);

        if (args == null || args.length == 0) {
            try (Scanner sc = new Scanner(in)) {
                runConsoleLoop(sc);
            }
            return 0;
        }

        String cmd = args[0].trim().toLowerCase(Locale.ROOT);
        switch (cmd) {
            case "compile":
                if (args.length < 2) return usage();
                return compile(Path.of(args[1]), args.length > 2 ? args[2] : kernel.config().export.defaultDomain);
            case "validate":
                if (args.length < 2) return usage();
                return validate(Path.of(args[1]));
            default:
                return usage();
        }
    }

    int compile(Path file, String domain) throws IOException {
        String source = readSource(file);
        try {
            Brain brain = kernel.language().compileToBrain(source, domain);
            Path written = kernel.brainStore().save(brain);
            out.println(brain.brain.id + " " + brain.brain.hash + " -> " + written);
            return 0;
        } catch (FormalException | IllegalArgumentException e) {
            log.error("compile failed for {}: {}", file, e.getMessage());
            out.println("error: " + e.getMessage());
            return 1;
        }
    }

    int validate(Path file) throws IOException {
        FormalLanguage.ValidationResult r = kernel.language().validateSource(readSource(file));
        out.println(r.valid ? "valid (" + r.program.declarations().size() + " declarations)" : "invalid: " + r.error);
        return r.valid ? 0 : 1;
    }

    private int usage() {
        out.println("usage: compile <file> [domain] | validate <file>");
        return 2;
    }

    /** Relative source paths resolve against the config root, like config and brain paths. */
    private String readSource(Path file) throws IOException {
        Path p = file.isAbsolute() ? file : configRoot.resolve(file);
        return kernel.externalIo().readString(kernel.externalIo().resolveExternal(p));
    }

    // ---------------------------------------------------------------------
    // Interactive
    // ---------------------------------------------------------------------

    private void runConsoleLoop(Scanner sc) {
        log.info("Formal console started. baseDir={}", kernel.io().baseDir());
        out.println("Commands: load <file> | apply <transition> | history | root | export [domain] | corpus | exit");

        while (true) {
            out.print("> ");
            if (!sc.hasNextLine()) break;
            String line = sc.nextLine().trim();
            if (line.equalsIgnoreCase("exit")) break;
            if (line.isEmpty()) continue;

            String[] parts = line.split("\\s+", 2);
            String arg = parts.length > 1 ? parts[1].trim() : "";
            try {
                handle(parts[0].toLowerCase(Locale.ROOT), arg);
            } catch (FormalException | IllegalArgumentException e) {
                out.println("error: " + e.getMessage());
            } catch (IOException e) {
                log.warn("I/O failure on '{}'", line, e);
                out.println("io error: " + e.getMessage());
            }
        }
        out.println("Bye.");
    }

    private void handle(String cmd, String arg) throws IOException {
        switch (cmd) {
            case "load": {
                if (arg.isEmpty()) throw new IllegalArgumentException("load needs a file");
                universe = kernel.language().evaluate(readSource(Path.of(arg)));
                out.println("loaded: states=" + universe.states().size()
                        + " transitions=" + universe.transitions().size()
                        + " constraints=" + universe.constraints().size()
                        + " fields=" + universe.fields().size());
                break;
            }
            case "apply": {
                TransitionResult r = requireUniverse().applyTransition(arg);
                out.println(r.valid
                        ? r.from + " -> " + r.to + " fingerprint=" + r.fingerprint
                        : "rejected: " + r.message);
                break;
            }
            case "history": {
                int i = 0;
                for (HistoryEntry h : requireUniverse().history()) {
                    out.println((++i) + ". " + h.transition + " " + h.from + " -> " + h.to + " " + h.fingerprint);
                }
                if (i == 0) out.println("(empty)");
                break;
            }
            case "root":
                out.println(requireUniverse().merkleRoot());
                break;
            case "export": {
                String domain = arg.isEmpty() ? kernel.config().export.defaultDomain : arg;
                Brain brain = requireUniverse().toBrain(domain);
                Path written = kernel.brainStore().save(brain);
                out.println(brain.brain.id + " " + brain.brain.hash + " -> " + written);
                break;
            }
            case "corpus":
                out.print(FormalCorpus.describe());
                break;
            default:
                out.println("unknown command: " + cmd);
        }
    }

    private Universe requireUniverse() {
        if (universe == null) throw new IllegalArgumentException("nothing loaded; use 'load <file>' first");
        return universe;
    }

    FormalKernel kernel() {
        return kernel;
    }
}
