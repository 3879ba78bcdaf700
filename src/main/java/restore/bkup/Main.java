package restore.bkup;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restore.bkup.impls.Archiver;
import restore.bkup.impls.BackupEngine;
import restore.bkup.impls.ConsolePasswordProvider;
import restore.bkup.impls.DirectoryChangeSource;
import restore.bkup.impls.EnvironmentPasswordProvider;
import restore.bkup.impls.RestoreEngine;
import restore.bkup.impls.RetentionManager;
import restore.bkup.impls.ShareLinkIssuer;
import restore.bkup.impls.StateStore;
import restore.bkup.impls.StaticPasswordProvider;
import restore.bkup.impls.WatchOrchestrator;
import restore.bkup.types.ArchiveFormat;
import restore.bkup.types.BackupRecord;
import restore.bkup.types.BackupTarget;
import restore.bkup.types.BackupType;
import restore.bkup.types.Config;
import restore.bkup.types.PasswordProvider;
import restore.bkup.types.RestoreReport;
import restore.bkup.types.RetentionPolicy;
import restore.bkup.types.ShareLink;
import restore.prim.ConfigurationException;
import restore.prim.QuietAutoCloseable;
import restore.prim.fs.PhysicalFilesystem;
import restore.prim.storage.StorageRegistry;
import restore.prim.time.UnreliableWallClock;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private static final String HOME = System.getProperty("user.home");
  private static final Path CFG_FILE = Paths.get(HOME, ".restore-config.json").toAbsolutePath();
  private static final long DEFAULT_SHARE_MINUTES = 60;

  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private static void showHelp(Options options) {
    new HelpFormatter().printHelp("restore [options]", options);
  }

  @VisibleForTesting
  static Options options() {
    Options options = new Options();

    // flags
    options.addOption("h", "help", false, "Show help and quit");
    options.addOption("s", "storage", true, "Storage type to use instead of the configured one");
    options.addOption("C", "config", true, "Config file (default " + CFG_FILE + ")");
    options.addOption(Option.builder().longOpt("target").hasArg().argName("DIR").desc("Where --restore puts files").build());
    options.addOption(Option.builder().longOpt("expires").hasArg().argName("MINUTES").desc("Lifetime of a --share link (default " + DEFAULT_SHARE_MINUTES + ")").build());
    options.addOption(Option.builder().longOpt("log").hasArg().argName("FILE").desc("Also write the log to FILE").build());

    // actions
    options.addOption(Option.builder("b").longOpt("backup").hasArg().argName("DIR").desc("Back up a directory").build());
    options.addOption(Option.builder("r").longOpt("restore").hasArg().argName("REMOTE").desc("Restore a backup, given its remote path").build());
    options.addOption(Option.builder().longOpt("share").hasArg().argName("FILE").desc("Upload a file and print a temporary link to it").build());
    options.addOption("w", "watch", false, "Back up configured directories whenever they change, until interrupted");
    return options;
  }

  public static void main(String[] args) {
    // A successful run returns normally.  Calling System.exit while a shutdown hook is
    // running (Ctrl+C during --watch) would block forever.
    int code = run(args);
    if (code != 0) {
      System.exit(code);
    }
  }

  @VisibleForTesting
  static int run(String[] args) {
    Options options = options();

    CommandLine cli;
    try {
      cli = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      System.err.println("Failed to parse options: " + e.getMessage());
      showHelp(options);
      return EXIT_USAGE;
    }

    if (cli.hasOption('h')) {
      showHelp(options);
      return 0;
    }

    final boolean backup = cli.hasOption("backup");
    final boolean restore = cli.hasOption("restore");
    final boolean share = cli.hasOption("share");
    final boolean watch = cli.hasOption("watch");
    int actions = (backup ? 1 : 0) + (restore ? 1 : 0) + (share ? 1 : 0) + (watch ? 1 : 0);
    if (actions != 1) {
      System.err.println(actions == 0
              ? "No action specified. Did you mean to pass '--backup DIR'?"
              : "Only one of --backup, --restore, --share and --watch may be given.");
      return EXIT_USAGE;
    }
    if (restore && !cli.hasOption("target")) {
      System.err.println("--restore needs --target DIR");
      return EXIT_USAGE;
    }
    Duration expiration = Duration.ofMinutes(DEFAULT_SHARE_MINUTES);
    if (cli.hasOption("expires")) {
      long minutes;
      try {
        minutes = Long.parseLong(cli.getOptionValue("expires"));
      } catch (NumberFormatException e) {
        minutes = -1;
      }
      if (minutes <= 0) {
        System.err.println("--expires needs a positive number of minutes");
        return EXIT_USAGE;
      }
      expiration = Duration.ofMinutes(minutes);
    }

    if (cli.hasOption("log")) {
      LogbackConfigurator.addFileAppender(Paths.get(cli.getOptionValue("log")));
    }

    final Path configFile = cli.hasOption("config") ? Paths.get(cli.getOptionValue("config")) : CFG_FILE;
    final @Nullable String storageOverride = cli.getOptionValue("storage");

    Config config;
    try {
      config = loadConfig(configFile);
    } catch (FileNotFoundException | NoSuchFileException e) {
      System.err.println("Config file '" + configFile + "' not found");
      return EXIT_FAILURE;
    } catch (IOException | IllegalArgumentException e) {
      LOG.error("cannot read config file {}", configFile, e);
      return EXIT_FAILURE;
    }

    final UnreliableWallClock clock = UnreliableWallClock.SYSTEM_CLOCK;
    final StorageRegistry registry = StorageRegistry.withDefaults();
    final StateStore state = new StateStore(config.getStateFile());
    state.load();
    final PasswordProvider passwords = passwords();
    final Archiver archiver = new Archiver(new PhysicalFilesystem());
    final @Nullable RetentionManager retention = config.getRetention().enabled()
            ? new RetentionManager(config.getRetention(), config, registry, state, clock)
            : null;

    try {
      if (backup) {
        BackupEngine engine = new BackupEngine(config, registry, state, passwords, archiver, clock, retention);
        BackupRecord record = engine.backupDirectory(expandHome(cli.getOptionValue("backup")), storageOverride);
        System.out.println(record.remotePath());
      } else if (restore) {
        RestoreEngine engine = new RestoreEngine(config, registry, state, passwords, archiver);
        RestoreReport report = engine.restoreFromBackup(cli.getOptionValue("restore"), expandHome(cli.getOptionValue("target")), storageOverride);
        System.out.println("Restored " + report.filesRestored() + " files (" + Util.formatSize(report.bytesRestored()) + ") to " + report.targetDir());
      } else if (share) {
        ShareLinkIssuer issuer = new ShareLinkIssuer(config, registry, clock);
        String storageType = storageOverride != null ? storageOverride : config.getDefaultStorageType();
        ShareLink link = issuer.shareFile(expandHome(cli.getOptionValue("share")), storageType, expiration);
        System.out.println(link.url());
        System.out.println("Expires " + link.expiresAt());
      } else {
        watch(config, registry, state, passwords, archiver, clock, retention, storageOverride);
      }
    } catch (IOException e) {
      LOG.error("{}", e.getMessage(), e);
      return EXIT_FAILURE;
    } finally {
      passwords.forget();
    }
    return 0;
  }

  private static void watch(
          Config config,
          StorageRegistry registry,
          StateStore state,
          PasswordProvider passwords,
          Archiver archiver,
          UnreliableWallClock clock,
          @Nullable RetentionManager retention,
          @Nullable String storageOverride) throws IOException {
    if (config.getTargets().isEmpty()) {
      throw new ConfigurationException("no directories to watch; add some to \"targets\" in the config file");
    }
    if (config.isEncryptionEnabled() && passwords.password() == null) {
      throw new ConfigurationException("encryption is enabled but no password is available");
    }
    BackupEngine engine = new BackupEngine(config, registry, state, passwords, archiver, clock, retention);
    List<Path> roots = new ArrayList<>();
    for (BackupTarget target : config.getTargets()) {
      roots.add(target.path());
    }
    WatchOrchestrator orchestrator = new WatchOrchestrator(
            roots,
            config.getDebounce(),
            config.exclusionMatchers(),
            dir -> engine.backupDirectory(dir, storageOverride),
            new DirectoryChangeSource(),
            state,
            new PhysicalFilesystem());
    try (QuietAutoCloseable ignored = Util.catchShutdown(orchestrator::stop)) {
      orchestrator.start();
      orchestrator.awaitShutdown();
    } finally {
      orchestrator.stop();
    }
  }

  private static PasswordProvider passwords() {
    PasswordProvider env = new EnvironmentPasswordProvider();
    @Nullable String password = env.password();
    return password != null ? new StaticPasswordProvider(password) : new ConsolePasswordProvider("Password");
  }

  private static class RawTarget {
    public @Nullable String path;
    public @Nullable String storageType;
  }

  private static class RawRetention {
    public @Nullable Boolean enabled;
    public @Nullable Integer keepLast;
    public @Nullable Long maxAgeDays;
  }

  private static class RawConfig {
    public @Nullable String defaultStorageType;
    public @Nullable List<RawTarget> targets;
    public @Nullable Map<String, String> componentStorageTypes;
    public @Nullable Map<String, Map<String, String>> storage;
    public @Nullable Boolean encryption;
    public @Nullable Boolean compression;
    public @Nullable String archiveFormat;
    public @Nullable String backupType;
    public @Nullable Long sizeThresholdMB;
    public @Nullable List<String> exclude;
    public @Nullable Long debounceSeconds;
    public @Nullable String stateFile;
    public @Nullable String tempDir;
    public @Nullable RawRetention retention;
  }

  @VisibleForTesting
  static Config loadConfig(Path target) throws IOException {

    JsonFactory f = new JsonFactory();
    f.enable(JsonParser.Feature.ALLOW_COMMENTS);
    ObjectMapper mapper = new ObjectMapper(f)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    RawConfig r;
    try (InputStream in = Files.newInputStream(target)) {
      r = mapper.readValue(in, RawConfig.class);
    }

    Config.ConfigBuilder builder = Config.builder();
    if (r.defaultStorageType != null) {
      builder.defaultStorageType(r.defaultStorageType);
    }
    if (r.targets != null) {
      for (RawTarget t : r.targets) {
        if (t.path == null) {
          throw new IllegalArgumentException("Config at " + target + " has a target without \"path\"");
        }
        builder.target(new BackupTarget(expandHome(t.path), t.storageType));
      }
    }
    if (r.componentStorageTypes != null) {
      builder.componentStorageTypes(r.componentStorageTypes);
    }
    if (r.storage != null) {
      builder.storageOptions(r.storage);
    }
    if (r.encryption != null) {
      builder.encryptionEnabled(r.encryption);
    }
    if (r.compression != null) {
      builder.compressionEnabled(r.compression);
    }
    if (r.archiveFormat != null) {
      builder.archiveFormat(archiveFormat(target, r.archiveFormat));
    }
    if (r.backupType != null) {
      try {
        builder.backupType(BackupType.named(r.backupType));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Config at " + target + " has unknown \"backupType\" '" + r.backupType + '\'', e);
      }
    }
    if (r.sizeThresholdMB != null) {
      if (r.sizeThresholdMB <= 0) {
        throw new IllegalArgumentException("Config at " + target + " has a non-positive \"sizeThresholdMB\"");
      }
      builder.sizeThresholdBytes(r.sizeThresholdMB * Util.ONE_MB);
    }
    if (r.exclude != null) {
      builder.excludePatterns(r.exclude);
    }
    if (r.debounceSeconds != null) {
      if (r.debounceSeconds < 0) {
        throw new IllegalArgumentException("Config at " + target + " has a negative \"debounceSeconds\"");
      }
      builder.debounce(Duration.ofSeconds(r.debounceSeconds));
    }
    if (r.stateFile != null) {
      builder.stateFile(expandHome(r.stateFile));
    }
    if (r.tempDir != null) {
      builder.tempDir(expandHome(r.tempDir));
    }
    if (r.retention != null) {
      RawRetention rr = r.retention;
      boolean enabled = rr.enabled == null || rr.enabled;
      builder.retention(new RetentionPolicy(
              enabled,
              rr.keepLast != null ? rr.keepLast : (enabled ? 10 : Integer.MAX_VALUE),
              rr.maxAgeDays != null ? Duration.ofDays(rr.maxAgeDays) : null));
    }
    return builder.build();
  }

  private static ArchiveFormat archiveFormat(Path configFile, String name) {
    for (ArchiveFormat format : ArchiveFormat.values()) {
      if (format.extension().equals(name.trim().toLowerCase(Locale.ROOT))) {
        return format;
      }
    }
    throw new IllegalArgumentException("Config at " + configFile + " has unknown \"archiveFormat\" '" + name + '\'');
  }

  private static Path expandHome(String path) {
    if (path.startsWith("~")) {
      path = path.replaceFirst(Pattern.quote("~"), Matcher.quoteReplacement(HOME));
    }
    return Paths.get(path);
  }

}
