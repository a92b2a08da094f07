package glow.navigator.query;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import glow.navigator.config.Settings;
import glow.navigator.graph.AssemblyResult;
import glow.navigator.graph.GraphAssembler;
import glow.navigator.graph.GraphDiagnostics;
import glow.navigator.io.GraphCache;
import glow.navigator.scan.RecordSource;

/**
 * Current graph and query options of one console session.
 * A rebuild assembles a complete new graph before it replaces the old one,
 * so a query never sees a half-built graph.
 */
public final class NavigatorSession {

    private static final Logger log = LoggerFactory.getLogger(NavigatorSession.class);

    private final Settings settings;
    private final RecordSource source;
    private final Path cacheFile;
    private final GraphCache cache = new GraphCache();
    private final AtomicReference<AssemblyResult> current = new AtomicReference<>();
    private final AtomicReference<QueryOptions> options;

    /**
     * @param cacheFile where the graph is cached, or null for no cache
     */
    public NavigatorSession(Settings settings, RecordSource source, Path cacheFile, QueryOptions options) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.source = Objects.requireNonNull(source, "source");
        this.cacheFile = cacheFile;
        this.options = new AtomicReference<>(Objects.requireNonNull(options, "options"));
    }

    /**
     * Loads the cached graph when there is one, otherwise builds.
     */
    public AssemblyResult open(boolean forceRebuild) throws IOException {
        if (cacheFile != null && !forceRebuild && Files.isRegularFile(cacheFile)) {
            final AssemblyResult cached = AssemblyResult.cached(cache.load(cacheFile));
            log.info("Loaded graph from {}: {}", cacheFile, GraphDiagnostics.summary(cached.graph()));
            current.set(cached);
            return cached;
        }
        return rebuild();
    }

    public AssemblyResult rebuild() throws IOException {
        final long started = System.nanoTime();
        final AssemblyResult result = new GraphAssembler(settings, source).build();
        log.info("Graph completed in {} ms: {}",
                (System.nanoTime() - started) / 1_000_000, GraphDiagnostics.summary(result.graph()));
        if (result.parseWarnings() > 0) {
            log.warn("Parse warnings: {}", result.parseWarnings());
        }
        if (cacheFile != null) {
            cache.save(result.graph(), cacheFile);
            log.info("Graph cached to {}", cacheFile);
        }
        current.set(result);
        return result;
    }

    public AssemblyResult current() {
        final AssemblyResult result = current.get();
        if (result == null) {
            throw new IllegalStateException("No graph loaded; call open() first");
        }
        return result;
    }

    public QueryOptions options() {
        return options.get();
    }

    public void options(QueryOptions updated) {
        options.set(Objects.requireNonNull(updated, "options"));
    }
}
