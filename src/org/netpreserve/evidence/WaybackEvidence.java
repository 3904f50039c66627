package org.netpreserve.evidence;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.evidence.archive.CdxClient;
import org.netpreserve.evidence.archive.ContentClient;
import org.netpreserve.evidence.archive.OEmbedLiveStatusChecker;
import org.netpreserve.evidence.config.ConfigException;
import org.netpreserve.evidence.config.ConfigLoader;
import org.netpreserve.evidence.config.EvidenceConfig;
import org.netpreserve.evidence.pacing.DiagnosticsListener;
import org.netpreserve.evidence.pacing.PacingProfile;
import org.netpreserve.evidence.pacing.Pacer;
import org.netpreserve.evidence.pacing.Surface;
import org.netpreserve.evidence.retry.Retrier;
import org.netpreserve.evidence.store.ContentStore;
import org.netpreserve.evidence.store.ContentStoreException;
import org.netpreserve.evidence.store.StoreVerification;
import org.netpreserve.evidence.util.NamedThreadFactory;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public class WaybackEvidence {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(WaybackEvidence.class);
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_FATAL = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Parsed command line.
     *
     * @param command   deleted-posts, check or verify-store
     * @param arguments the screen name, or the post identifiers
     * @param store     store directory given on the command line, null if none
     */
    record Options(
            String command,
            List<String> arguments,
            @Nullable Path configFile,
            @Nullable PacingProfile pacing,
            @Nullable Integer concurrency,
            @Nullable Integer indexConcurrency,
            boolean noExistenceCheck,
            boolean report,
            @Nullable String store,
            @Nullable Integer limit,
            boolean allCaptures,
            boolean dumpConfig,
            int verbosity) {

        /**
         * Evidence is retrieved when a report is wanted or a store was named.
         */
        boolean download() {
            return report || store != null;
        }
    }

    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = parseArgs(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println("Try --help for usage.");
            return EXIT_FATAL;
        }
        if (options == null) {
            printUsage(out);
            return EXIT_OK;
        }
        setVerbosity(options.verbosity());

        var loader = new ConfigLoader();
        EvidenceConfig config;
        try {
            config = loader.load(options.configFile(), overrides(loader, options));
        } catch (ConfigException e) {
            err.println(e.getMessage());
            return EXIT_FATAL;
        }
        if (options.dumpConfig()) {
            out.print(loader.dump(config));
            return EXIT_OK;
        }

        if (options.command().equals("verify-store")) {
            return verifyStore(config, out, err);
        }

        List<PostId> postIds = new ArrayList<>();
        if (options.command().equals("check")) {
            try {
                for (String argument : options.arguments()) {
                    postIds.add(PostId.parse(argument));
                }
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return EXIT_FATAL;
            }
        }

        return execute(options, config, postIds, out, err);
    }

    private static int execute(Options options, EvidenceConfig config, List<PostId> postIds, PrintStream out,
                               PrintStream err) {
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(config.archive().connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        ExecutorService storeExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("store"));
        ExecutorService workflowExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("workflow"));
        ContentStore store = null;
        var finished = new CountDownLatch(1);
        try (Pacer pacer = Pacer.create(config.pacing())) {
            DiagnosticsListener diagnostics = DiagnosticsListener.install(config.diagnostics().signal(),
                    pacer.scoreboard(), err);
            var retrier = new Retrier(config.archive().retry());
            var cdxClient = new CdxClient(httpClient, config.archive());

            DownloadPipeline pipeline = null;
            if (options.download()) {
                try {
                    store = ContentStore.open(Path.of(config.store().path()));
                } catch (ContentStoreException e) {
                    err.println(e.getMessage());
                    return EXIT_FATAL;
                }
                pipeline = new DownloadPipeline(store, new ContentClient(httpClient, config.archive()), retrier,
                        pacer.controller(Surface.CONTENT), config.download().concurrency(), storeExecutor);
            }

            LiveStatusChecker checker = null;
            if (config.existenceCheck().enabled()) {
                checker = new OEmbedLiveStatusChecker(httpClient, config.existenceCheck(), config.archive(), retrier);
            }

            var workflow = new DeletionWorkflow(cdxClient, retrier, pacer.controller(Surface.INDEX), checker,
                    pipeline, new DeletionWorkflow.Settings(config.download().indexConcurrency(),
                    config.existenceCheck().concurrency(), config.download().allCaptures()), workflowExecutor);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (finished.getCount() == 0) return;
                System.err.println("Interrupted, cancelling outstanding requests");
                workflow.cancel();
                try {
                    // let store writes in progress finish
                    finished.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-hook"));

            String subject;
            CompletableFuture<List<PostDeletionResult>> future;
            if (options.command().equals("deleted-posts")) {
                subject = options.arguments().get(0);
                future = workflow.runForUser(subject, options.limit());
            } else {
                subject = postIds.size() == 1 ? postIds.get(0).toString() : postIds.size() + " posts";
                future = workflow.run(postIds);
            }

            int status;
            try {
                List<PostDeletionResult> results = future.join();
                write(options, config, subject, results, out);
                status = DeletionWorkflow.exitStatus(results);
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof WorkflowAbortedException aborted) {
                    write(options, config, subject, aborted.partialResults(), out);
                    err.println(aborted.getMessage());
                    status = EXIT_FATAL;
                } else if (cause instanceof ContentStoreException) {
                    err.println(cause.getMessage());
                    status = EXIT_FATAL;
                } else {
                    err.println("Archive search failed: " + cause.getMessage());
                    status = EXIT_FAILED;
                }
            }
            log.info("Pacing at finish:\n{}", pacer.scoreboard().format());
            if (diagnostics != null) diagnostics.close();
            return status;
        } finally {
            finished.countDown();
            if (store != null) store.close();
            storeExecutor.shutdown();
            workflowExecutor.shutdown();
        }
    }

    private static int verifyStore(EvidenceConfig config, PrintStream out, PrintStream err) {
        StoreVerification result;
        try (var store = ContentStore.open(Path.of(config.store().path()))) {
            result = store.verify();
        } catch (ContentStoreException e) {
            err.println(e.getMessage());
            return EXIT_FATAL;
        }
        for (String digest : result.missing()) out.println("missing " + digest);
        for (String digest : result.corrupt()) out.println("corrupt " + digest);
        out.println(result.valid() + " valid, " + result.corrupt().size() + " corrupt, "
                + result.missing().size() + " missing");
        out.flush();
        return result.isClean() ? EXIT_OK : EXIT_FAILED;
    }

    private static void write(Options options, EvidenceConfig config, String subject,
                              List<PostDeletionResult> results, PrintStream out) {
        var report = new Report(config.archive());
        if (options.report()) {
            out.print(report.markdown(subject, results));
        } else {
            report.writeList(results, out);
        }
        out.flush();
    }

    static ObjectNode overrides(ConfigLoader loader, Options options) {
        ObjectNode root = loader.newOverrides();
        if (options.pacing() != null) root.putObject("pacing").put("profile", options.pacing().label());
        if (options.concurrency() != null || options.indexConcurrency() != null || options.allCaptures()) {
            ObjectNode download = root.putObject("download");
            if (options.concurrency() != null) download.put("concurrency", options.concurrency());
            if (options.indexConcurrency() != null) download.put("indexConcurrency", options.indexConcurrency());
            if (options.allCaptures()) download.put("allCaptures", true);
        }
        if (options.noExistenceCheck()) root.putObject("existenceCheck").put("enabled", false);
        if (options.store() != null) root.putObject("store").put("path", options.store());
        return root;
    }

    /**
     * @return null if help was requested
     */
    static @Nullable Options parseArgs(String[] args) throws UsageException {
        String command = null;
        var arguments = new ArrayList<String>();
        Path configFile = null;
        PacingProfile pacing = null;
        Integer concurrency = null;
        Integer indexConcurrency = null;
        boolean noExistenceCheck = false;
        boolean report = false;
        String store = null;
        Integer limit = null;
        boolean allCaptures = false;
        boolean dumpConfig = false;
        int verbosity = 0;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-h", "--help" -> {
                    return null;
                }
                case "-c", "--config" -> configFile = Path.of(value(args, ++i));
                case "--pacing" -> {
                    try {
                        pacing = PacingProfile.parse(value(args, ++i));
                    } catch (IllegalArgumentException e) {
                        throw new UsageException(e.getMessage());
                    }
                }
                case "--concurrency" -> concurrency = positive(args, ++i);
                case "--index-concurrency" -> indexConcurrency = positive(args, ++i);
                case "--no-existence-check" -> noExistenceCheck = true;
                case "-r", "--report" -> report = true;
                case "-s", "--store" -> store = value(args, ++i);
                case "-l", "--limit" -> limit = positive(args, ++i);
                case "--all-captures" -> allCaptures = true;
                case "--dump-config" -> dumpConfig = true;
                case "-v", "--verbose" -> verbosity++;
                case "-vv" -> verbosity += 2;
                default -> {
                    if (args[i].startsWith("-")) throw new UsageException("Unknown option: " + args[i]);
                    if (command == null) {
                        command = args[i];
                    } else {
                        arguments.add(args[i]);
                    }
                }
            }
        }

        if (!dumpConfig) {
            if (command == null) throw new UsageException("No command given");
            switch (command) {
                case "deleted-posts" -> {
                    if (arguments.size() != 1) throw new UsageException("deleted-posts takes exactly one screen name");
                }
                case "check" -> {
                    if (arguments.isEmpty()) throw new UsageException("check needs at least one post identifier");
                    if (limit != null) throw new UsageException("--limit only applies to deleted-posts");
                }
                case "verify-store" -> {
                    if (!arguments.isEmpty()) throw new UsageException("verify-store takes no arguments");
                    if (limit != null) throw new UsageException("--limit only applies to deleted-posts");
                }
                default -> throw new UsageException("Unknown command: " + command);
            }
        }
        return new Options(command, List.copyOf(arguments), configFile, pacing, concurrency, indexConcurrency,
                noExistenceCheck, report, store, limit, allCaptures, dumpConfig, verbosity);
    }

    private static String value(String[] args, int i) throws UsageException {
        if (i >= args.length) throw new UsageException("Option " + args[i - 1] + " requires a value");
        return args[i];
    }

    private static int positive(String[] args, int i) throws UsageException {
        String text = value(args, i);
        try {
            int n = Integer.parseInt(text);
            if (n < 1) throw new UsageException(args[i - 1] + " must be at least 1");
            return n;
        } catch (NumberFormatException e) {
            throw new UsageException(args[i - 1] + " expects a number, got " + text);
        }
    }

    private static void setVerbosity(int verbosity) {
        if (verbosity == 0) return;
        var logger = (Logger) LoggerFactory.getLogger("org.netpreserve.evidence");
        logger.setLevel(verbosity == 1 ? Level.DEBUG : Level.TRACE);
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: wayback-evidence [options] deleted-posts SCREEN-NAME");
        out.println("       wayback-evidence [options] check SCREEN/ID|URL...");
        out.println("       wayback-evidence [options] verify-store");
        out.println("Options:");
        out.println("  -c, --config FILE          YAML config merged over the built-in defaults");
        out.println("      --pacing PROFILE       conservative, default or adaptive (default: default)");
        out.println("      --concurrency N        content downloads in flight (default: 1)");
        out.println("      --index-concurrency N  CDX queries in flight (default: 2)");
        out.println("      --no-existence-check   don't check whether posts are still live");
        out.println("  -r, --report               print a Markdown report instead of a list of URLs");
        out.println("  -s, --store DIR            keep retrieved evidence in DIR (default: store)");
        out.println("  -l, --limit N              only the N most recently archived posts");
        out.println("      --all-captures         retrieve every capture, not only the earliest");
        out.println("      --dump-config          print the effective configuration and exit");
        out.println("  -v, --verbose              more logging (repeat for more)");
        out.println("  -h, --help");
        out.println("Send SIGUSR1 to print the pacing scoreboard.");
    }
}
