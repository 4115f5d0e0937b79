package com.imagemonitor.app.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.imagemonitor.app.Pipeline;
import com.imagemonitor.app.config.ScanSettings;
import com.imagemonitor.app.config.SettingsStore;
import com.imagemonitor.app.database.Database;
import com.imagemonitor.app.database.Database.ArchiveRecord;
import com.imagemonitor.app.database.Database.ScanHistoryRecord;
import com.imagemonitor.app.scan.DirectoryScanner.ScanProgress;
import com.imagemonitor.app.scan.IncrementalScanController.IncrementalResult;
import com.imagemonitor.app.scan.IncrementalScanController.ScanPlan;
import com.imagemonitor.app.thumbnail.ThumbnailService;

public final class cli {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private cli() {}

    public static void main(String[] args) {
        run(args);
    }

    public static void run(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 0;
        }

        String cmd = safeLower(args[0]);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        int exitCode;
        try {
            exitCode = switch (cmd) {
                case "scan" -> runScan(rest);
                case "incremental" -> runIncremental(rest);
                case "plan" -> runPlan(rest);
                case "history" -> runHistory(rest);
                case "search" -> runSearch(rest);
                case "thumbnails" -> runThumbnails(rest);
                case "settings" -> runSettings(rest);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield 0;
                }
                default -> {
                    System.err.println("Comando invalido: " + args[0]);
                    printUsage();
                    yield 2;
                }
            };
        } catch (Exception e) {
            System.err.println("Erro fatal: " + safeMsg(e));
            exitCode = 1;
        } finally {
            Database.shutdown();
        }
        return exitCode;
    }

    // ----------------- scan / incremental -----------------

    private static int runScan(String[] args) {
        ParseResult<DirArgs> parsed = DirArgs.parse(args);
        if (parsed.help()) {
            printScanUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printScanUsage();
            return 2;
        }

        ScanSettings settings = new SettingsStore().load();
        List<Path> dirs = resolveDirs(parsed.value(), settings);
        if (dirs.isEmpty()) {
            System.err.println("Nenhum diretorio: use --dir ou settings --add-dir");
            return 2;
        }
        for (Path d : dirs) {
            if (!Files.isDirectory(d)) {
                System.err.println("Pasta nao existe: " + d);
                return 2;
            }
        }

        return withCancel(cancel -> {
            try (Pipeline pipeline = Pipeline.open(settings)) {
                int processed = pipeline.scanner().scan(dirs, Database.SCAN_FULL, cli::printProgress, cancel);
                log("Scan concluido: " + processed + " arquivos processados");
                return 0;
            }
        });
    }

    private static int runIncremental(String[] args) {
        ParseResult<DirArgs> parsed = DirArgs.parse(args);
        if (parsed.help()) {
            printIncrementalUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printIncrementalUsage();
            return 2;
        }

        ScanSettings settings = new SettingsStore().load();
        List<Path> dirs = resolveDirs(parsed.value(), settings);
        if (dirs.isEmpty()) {
            // sem diretórios o plano removeria tudo
            System.err.println("Nenhum diretorio: use --dir ou settings --add-dir");
            return 2;
        }

        return withCancel(cancel -> {
            try (Pipeline pipeline = Pipeline.open(settings)) {
                IncrementalResult r = pipeline.incremental().runIncremental(dirs, cli::printProgress, cancel);
                log("Incremental concluido: " + r.plan().toScan().size() + " diretorios escaneados, "
                        + r.itemsPurged() + " itens removidos, " + r.filesProcessed() + " arquivos processados");
                return 0;
            }
        });
    }

    private static int runPlan(String[] args) {
        ParseResult<DirArgs> parsed = DirArgs.parse(args);
        if (parsed.help()) {
            printIncrementalUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printIncrementalUsage();
            return 2;
        }

        ScanSettings settings = new SettingsStore().load();
        List<Path> dirs = resolveDirs(parsed.value(), settings);
        try (Pipeline pipeline = Pipeline.open(settings)) {
            ScanPlan plan = pipeline.incremental().planScan(dirs);
            System.out.println("toScan:");
            if (plan.toScan().isEmpty()) System.out.println("  -");
            plan.toScan().forEach(p -> System.out.println("  " + p));
            System.out.println("toPurge:");
            if (plan.toPurge().isEmpty()) System.out.println("  -");
            plan.toPurge().forEach(p -> System.out.println("  " + p));
        }
        return 0;
    }

    @FunctionalInterface
    private interface CancellableCommand {
        int run(AtomicBoolean cancel) throws Exception;
    }

    private static int withCancel(CancellableCommand command) {
        AtomicBoolean cancel = new AtomicBoolean(false);

        // cancelamento via Ctrl+C / kill
        Thread cancelHook = new Thread(() -> {
            cancel.set(true);
            System.err.println("Cancelamento solicitado (shutdown hook) em " + Instant.now());
        }, "imagemonitor-cli-cancel");

        try {
            Runtime.getRuntime().addShutdownHook(cancelHook);
        } catch (IllegalStateException | SecurityException e) {
            // ok: sem hook
        }

        try {
            return command.run(cancel);
        } catch (CancellationException e) {
            System.err.println("Cancelado pelo usuario.");
            return 1;
        } catch (Exception e) {
            System.err.println("Falha no scan: " + safeMsg(e));
            return 1;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(cancelHook);
            } catch (IllegalStateException | SecurityException e) {
                // JVM já está desligando
            }
        }
    }

    // ----------------- history / search -----------------

    private static int runHistory(String[] args) {
        ParseResult<HistoryArgs> parsed = HistoryArgs.parse(args);
        if (parsed.help()) {
            printHistoryUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printHistoryUsage();
            return 2;
        }

        HistoryArgs a = parsed.value();
        String dir = Path.of(a.dir()).toAbsolutePath().normalize().toString();
        try (Pipeline pipeline = Pipeline.open(new SettingsStore().load())) {
            List<ScanHistoryRecord> rows = pipeline.gateway().getScanHistory(dir, a.limit());
            if (rows.isEmpty()) {
                System.out.println("Sem historico para " + dir);
                return 0;
            }
            System.out.println("data | tipo | arquivos | processados | inseridos | ms");
            for (ScanHistoryRecord row : rows) {
                System.out.printf("%s | %s | %d | %d | %d | %d%n",
                        TS.format(Instant.ofEpochMilli(row.scanMillis())),
                        row.scanType(),
                        row.fileCount(),
                        row.processedCount(),
                        row.insertedCount(),
                        row.elapsedMs());
            }
        }
        return 0;
    }

    private static int runSearch(String[] args) {
        ParseResult<SearchArgs> parsed = SearchArgs.parse(args);
        if (parsed.help()) {
            printSearchUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printSearchUsage();
            return 2;
        }

        SearchArgs a = parsed.value();
        try (Pipeline pipeline = Pipeline.open(new SettingsStore().load())) {
            List<ArchiveRecord> rows = pipeline.gateway().searchArchives(a.query(), a.limit());
            if (rows.isEmpty()) {
                System.out.println("Nenhum arquivo encontrado.");
                return 0;
            }
            System.out.println("arquivo | tipo | imagens/total | ratio | thumbnail");
            for (ArchiveRecord r : rows) {
                System.out.printf(Locale.ROOT, "%s | %s | %d/%d | %.2f | %s%n",
                        r.filePath(), r.archiveType(), r.imageFiles(), r.totalFiles(), r.imageRatio(),
                        safeText(r.thumbnailPath()));
            }
        }
        return 0;
    }

    // ----------------- thumbnails -----------------

    private static int runThumbnails(String[] args) {
        ParseResult<ThumbArgs> parsed = ThumbArgs.parse(args);
        if (parsed.help()) {
            printThumbnailsUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printThumbnailsUsage();
            return 2;
        }

        ThumbArgs a = parsed.value();
        try (Pipeline pipeline = Pipeline.open(new SettingsStore().load())) {
            ThumbnailService thumbs = pipeline.thumbnails();
            if (a.clear()) {
                thumbs.clearCache();
                log("Cache de thumbnails limpo.");
            }
            if (a.cleanupDays() != null) {
                int n = thumbs.cleanupOldThumbnails(a.cleanupDays());
                log("Removidos " + n + " thumbnails com mais de " + a.cleanupDays() + " dias.");
            }
            if (a.pruneOrphans()) {
                int n = thumbs.deleteOrphans(pipeline.gateway().getAllThumbnailPaths());
                log("Removidos " + n + " thumbnails orfaos.");
            }
            log("Cache: " + thumbs.cacheDir() + " (" + humanBytes(thumbs.getCacheSize()) + ")");
        } catch (java.io.IOException e) {
            System.err.println("Falha na manutencao de thumbnails: " + safeMsg(e));
            return 1;
        }
        return 0;
    }

    // ----------------- settings -----------------

    private static int runSettings(String[] args) {
        ParseResult<SettingsArgs> parsed = SettingsArgs.parse(args);
        if (parsed.help()) {
            printSettingsUsage();
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printSettingsUsage();
            return 2;
        }

        SettingsArgs a = parsed.value();
        SettingsStore store = new SettingsStore();
        ScanSettings settings = store.load();

        if (!a.add().isEmpty() || !a.remove().isEmpty()) {
            // preserva ordem e evita duplicatas
            Set<String> dirs = new LinkedHashSet<>(settings.scanDirectories());
            for (String d : a.add()) dirs.add(Path.of(d).toAbsolutePath().normalize().toString());
            for (String d : a.remove()) dirs.remove(Path.of(d).toAbsolutePath().normalize().toString());
            settings = settings.withScanDirectories(new ArrayList<>(dirs));
            try {
                store.save(settings);
            } catch (java.io.IOException e) {
                System.err.println("Falha ao salvar settings: " + safeMsg(e));
                return 1;
            }
            log("Settings salvos em " + store.file());
        }

        System.out.println("arquivo: " + store.file());
        System.out.println("diretorios:");
        if (settings.scanDirectories().isEmpty()) System.out.println("  -");
        settings.scanDirectories().forEach(d -> System.out.println("  " + d));
        System.out.printf(Locale.ROOT, "thumbnailSize=%d ratio=%.2f maxConcurrentScans=%d freshnessHours=%d archivesOnly=%s storage=%s%n",
                settings.thumbnailSize(), settings.imageRatioThreshold(), settings.maxConcurrentScans(),
                settings.freshnessHours(), settings.archivesOnly(), settings.storageProfile());
        return 0;
    }

    // ----------------- usage -----------------

    private static void printUsage() {
        System.out.println("""
                ImageMonitor CLI
                Comandos:
                  scan [--dir <pasta> ...]
                  incremental [--dir <pasta> ...]
                  plan [--dir <pasta> ...]
                  history --dir <pasta> [--limit <n>]
                  search [--query <texto>] [--limit <n>]
                  thumbnails [--clear] [--cleanup-days <n>] [--prune-orphans]
                  settings [--add-dir <pasta>] [--remove-dir <pasta>]
                  help
                """);
    }

    private static void printScanUsage() {
        System.out.println("""
                Uso:
                  scan [--dir <pasta> ...]

                Sem --dir usa os diretorios do settings.json.

                Exemplos:
                  scan --dir /mnt/comics
                  scan --dir D:\\Imagens --dir E:\\Arquivos
                """);
    }

    private static void printIncrementalUsage() {
        System.out.println("""
                Uso:
                  incremental [--dir <pasta> ...]
                  plan [--dir <pasta> ...]

                Escaneia diretorios novos ou com scan mais antigo que freshnessHours
                e remove os que sairam da configuracao ou nao existem mais.
                """);
    }

    private static void printHistoryUsage() {
        System.out.println("""
                Uso:
                  history --dir <pasta> [--limit <n>]

                Exemplo:
                  history --dir /mnt/comics --limit 50
                """);
    }

    private static void printSearchUsage() {
        System.out.println("""
                Uso:
                  search [--query <texto>] [--limit <n>]
                """);
    }

    private static void printThumbnailsUsage() {
        System.out.println("""
                Uso:
                  thumbnails [--clear] [--cleanup-days <n>] [--prune-orphans]
                """);
    }

    private static void printSettingsUsage() {
        System.out.println("""
                Uso:
                  settings [--add-dir <pasta>] [--remove-dir <pasta>]
                """);
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Valor ausente para " + opt);
            return next();
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    private record DirArgs(List<String> dirs) {
        static ParseResult<DirArgs> parse(String[] args) {
            List<String> dirs = new ArrayList<>();
            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--dir" -> dirs.add(c.requireNext("--dir"));
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new DirArgs(List.copyOf(dirs)));
        }
    }

    private record HistoryArgs(String dir, int limit) {
        static ParseResult<HistoryArgs> parse(String[] args) {
            String dir = null;
            int limit = 20;
            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--dir" -> dir = c.requireNext("--dir");
                        case "--limit" -> limit = parsePositive(c.requireNext("--limit"));
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Valor invalido para --limit");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            if (isBlank(dir)) return ParseResult.errorResult("Parametro obrigatorio: --dir");
            return ParseResult.okResult(new HistoryArgs(dir, limit));
        }
    }

    private record SearchArgs(String query, int limit) {
        static ParseResult<SearchArgs> parse(String[] args) {
            String query = "";
            int limit = 50;
            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--query" -> query = c.requireNext("--query");
                        case "--limit" -> limit = parsePositive(c.requireNext("--limit"));
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Valor invalido para --limit");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new SearchArgs(query, limit));
        }
    }

    private record ThumbArgs(boolean clear, Integer cleanupDays, boolean pruneOrphans) {
        static ParseResult<ThumbArgs> parse(String[] args) {
            boolean clear = false;
            boolean prune = false;
            Integer days = null;
            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--clear" -> clear = true;
                        case "--prune-orphans" -> prune = true;
                        case "--cleanup-days" -> days = parsePositive(c.requireNext("--cleanup-days"));
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (NumberFormatException e) {
                return ParseResult.errorResult("Valor invalido para --cleanup-days");
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new ThumbArgs(clear, days, prune));
        }
    }

    private record SettingsArgs(List<String> add, List<String> remove) {
        static ParseResult<SettingsArgs> parse(String[] args) {
            List<String> add = new ArrayList<>();
            List<String> remove = new ArrayList<>();
            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--add-dir" -> add.add(c.requireNext("--add-dir"));
                        case "--remove-dir" -> remove.add(c.requireNext("--remove-dir"));
                        default -> { return ParseResult.errorResult("Opcao invalida: " + t); }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }
            return ParseResult.okResult(new SettingsArgs(List.copyOf(add), List.copyOf(remove)));
        }
    }

    // ----------------- misc -----------------

    private static List<Path> resolveDirs(DirArgs a, ScanSettings settings) {
        if (a.dirs().isEmpty()) return settings.scanDirectoryPaths();
        return map(a.dirs(), d -> Path.of(d).toAbsolutePath().normalize());
    }

    private static <A, B> List<B> map(List<A> in, Function<A, B> f) {
        List<B> out = new ArrayList<>(in.size());
        for (A a : in) out.add(f.apply(a));
        return out;
    }

    private static int parsePositive(String v) {
        return Math.max(1, Integer.parseInt(v.trim()));
    }

    private static void printProgress(ScanProgress p) {
        if (p.isCompleted()) {
            log(p.message());
        } else if (p.processedCount() % 25 == 0 || p.processedCount() == p.totalCount()) {
            log("[" + p.processedCount() + "/" + p.totalCount() + "] " + p.currentFileName() + " - " + p.message());
        }
    }

    private static String humanBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        double kb = bytes / 1024.0;
        if (kb < 1024) return String.format(Locale.ROOT, "%.1f KB", kb);
        double mb = kb / 1024.0;
        if (mb < 1024) return String.format(Locale.ROOT, "%.1f MB", mb);
        return String.format(Locale.ROOT, "%.2f GB", mb / 1024.0);
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Erro" : t.getClass().getSimpleName())
                : m;
    }

    private static String safeText(String v) {
        return isBlank(v) ? "-" : v;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }

    private static void log(String msg) {
        if (!isBlank(msg)) System.out.println(msg);
    }
}
