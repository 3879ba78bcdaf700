package restore.bkup;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.layout.TTLLLayout;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import ch.qos.logback.core.spi.ContextAwareBase;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Console logging to stderr, so that stdout carries only command results (such as share
 * links).  Found by Logback through <code>META-INF/services</code>.
 */
public class LogbackConfigurator extends ContextAwareBase implements Configurator {

  public static final String APP_LOGGER = "restore";

  public LogbackConfigurator() {
  }

  @Override
  public ExecutionStatus configure(LoggerContext lc) {
    addInfo("Setting up default configuration.");

    ConsoleAppender<ILoggingEvent> consoleAppender = new ConsoleAppender<>();
    consoleAppender.setContext(lc);
    consoleAppender.setName("console");
    consoleAppender.setTarget("System.err");
    consoleAppender.setEncoder(encoder(lc));
    consoleAppender.start();

    Logger rootLogger = lc.getLogger(Logger.ROOT_LOGGER_NAME);
    rootLogger.setLevel(Level.INFO);
    rootLogger.addAppender(consoleAppender);
    lc.getLogger(APP_LOGGER).setLevel(Level.DEBUG);

    return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
  }

  /**
   * Also send everything to a file.  Does nothing if Logback is not the SLF4J binding.
   */
  public static void addFileAppender(Path file) {
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
      return;
    }
    LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
    FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
    fileAppender.setContext(lc);
    fileAppender.setName("file");
    fileAppender.setFile(file.toAbsolutePath().toString());
    fileAppender.setAppend(true);
    fileAppender.setEncoder(encoder(lc));
    fileAppender.start();
    lc.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(fileAppender);
  }

  private static LayoutWrappingEncoder<ILoggingEvent> encoder(LoggerContext lc) {
    TTLLLayout layout = new TTLLLayout();
    layout.setContext(lc);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(lc);
    encoder.setLayout(layout);
    encoder.start();
    return encoder;
  }

}
