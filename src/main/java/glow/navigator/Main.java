package glow.navigator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import glow.navigator.config.Settings;
import glow.navigator.config.SettingsException;
import glow.navigator.graph.AssemblyResult;
import glow.navigator.graph.GraphDiagnostics;
import glow.navigator.io.ConsoleFormatter;
import glow.navigator.query.NavigatorSession;
import glow.navigator.query.QueryOptions;
import glow.navigator.scan.FileRecordSource;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path sourceRoot = null;
        Path settingsFile = null;
        Path cacheFile = null;
        boolean rebuild = false;
        boolean missing = false;
        int maxLevel = QueryOptions.DEFAULT_DEPTH;
        boolean edges = false;
        final Set<String> ignore = new LinkedHashSet<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--settings=")) {
                    settingsFile = Paths.get(arg.substring("--settings=".length()));
                    continue;
                }
                if (arg.startsWith("--cache=")) {
                    cacheFile = Paths.get(arg.substring("--cache=".length()));
                    continue;
                }
                if ("--rebuild".equals(arg)) {
                    rebuild = true;
                    continue;
                }
                if ("--missing".equals(arg)) {
                    missing = true;
                    continue;
                }
                if (arg.startsWith("--maxLevel=")) {
                    maxLevel = Integer.parseInt(arg.substring("--maxLevel=".length()).trim());
                    if (maxLevel < 0) {
                        System.err.println("ERROR: --maxLevel must be >= 0");
                        return 2;
                    }
                    continue;
                }
                if (arg.startsWith("--edges=")) {
                    edges = Boolean.parseBoolean(arg.substring("--edges=".length()).trim());
                    continue;
                }
                if (arg.startsWith("--ignore=")) {
                    final String list = arg.substring("--ignore=".length()).trim();
                    if (!list.isEmpty()) {
                        Arrays.stream(list.split(","))
                                .map(String::trim)
                                .filter(s -> !s.isEmpty())
                                .forEach(ignore::add);
                    }
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (sourceRoot == null) {
                    sourceRoot = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (sourceRoot == null) {
                sourceRoot = Paths.get(".");
            }
            sourceRoot = sourceRoot.toAbsolutePath().normalize();
            if (cacheFile != null && !cacheFile.isAbsolute()) {
                cacheFile = sourceRoot.resolve(cacheFile).normalize();
            }

            final Settings settings = settingsFile == null ? Settings.loadDefault() : Settings.load(settingsFile);
            final QueryOptions options = new QueryOptions(maxLevel, ignore, edges);
            final NavigatorSession session = new NavigatorSession(
                    settings, new FileRecordSource(sourceRoot), cacheFile, options);

            final AssemblyResult result = session.open(rebuild);
            System.out.println();
            System.out.println(GraphDiagnostics.summary(result.graph()));
            if (result.graph().nodeCount() == 0) {
                System.out.println("Nothing was added to the graph - run again in the Glow source root");
                return 0;
            }

            final NavigatorConsole console = new NavigatorConsole(session, new ConsoleFormatter(settings),
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
            if (missing) {
                console.printMissing(result.graph());
            }
            console.run();
            return 0;
        } catch (NumberFormatException ex) {
            System.err.println("ERROR: invalid number: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (SettingsException ex) {
            System.err.println("ERROR: settings: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: navigator failed: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void printUsage() {
        System.out.println("Usage: glow-navigator [sourceRoot] [options]");
        System.out.println("Options:");
        System.out.println("  --settings=<path>       Artifact settings (default: bundled glow-settings.yaml)");
        System.out.println("  --cache=<path>          Graph cache; loaded when present, written after a build");
        System.out.println("  --rebuild               Ignore an existing cache and rebuild");
        System.out.println("  --maxLevel=<n>          Walk depth, 0 for unbounded (default: 1)");
        System.out.println("  --ignore=<t1,t2>        Comma-separated node types to leave out");
        System.out.println("  --edges=<bool>          Also match outgoing edge data (default: false)");
        System.out.println("  --missing               Report undefined nodes after the build");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
