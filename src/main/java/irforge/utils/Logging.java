package irforge.utils;

import java.io.IOException;
import java.io.InputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.ConfigurationSource;
import org.apache.logging.log4j.core.config.xml.XmlConfiguration;

/**
 * Logging facade used by every translation phase.
 * Messages are tagged with a prefix naming the component that emits them.
 */
public class Logging {

    private static final String DEFAULT_LOGGER_NAME = "IRForge";
    private static final String DEFAULT_CONFIG_FILE_PATH = "/log4j2_default.xml";
    private static volatile Logger defaultLogger = LogManager.getLogger(DEFAULT_LOGGER_NAME);

    /**
     * Load the bundled log4j2 configuration.
     * Before this is called, messages go to whatever configuration log4j2 discovers by itself.
     * @return true if init success, false otherwise.
     */
    public static boolean init() {
        InputStream in = Logging.class.getResourceAsStream(DEFAULT_CONFIG_FILE_PATH);
        if (in == null) {
            System.out.println("Cannot locate logging config file :" + DEFAULT_CONFIG_FILE_PATH);
            return false;
        }
        try (in) {
            Configuration configuration = new XmlConfiguration(new LoggerContext(DEFAULT_LOGGER_NAME),
                    new ConfigurationSource(in));
            LoggerContext context = (LoggerContext) LogManager.getContext(false);
            context.stop();
            context.start(configuration);
            defaultLogger = context.getLogger(DEFAULT_LOGGER_NAME);
        } catch (IOException e) {
            System.out.println("Cannot read logging config file :" + DEFAULT_CONFIG_FILE_PATH);
            return false;
        }
        return true;
    }

    public static void error(String prefix, String msg) {
        defaultLogger.error("[{}] - {}", prefix, msg);
    }

    public static void warn(String prefix, String msg) {
        defaultLogger.warn("[{}] - {}", prefix, msg);
    }

    public static void info(String prefix, String msg) {
        defaultLogger.info("[{}] - {}", prefix, msg);
    }

    public static void debug(String prefix, String msg) {
        defaultLogger.debug("[{}] - {}", prefix, msg);
    }

    /**
     * Generate a trace log, used for per-statement and per-edge events.
     */
    public static void trace(String prefix, String msg) {
        defaultLogger.trace("[{}] - {}", prefix, msg);
    }
}
