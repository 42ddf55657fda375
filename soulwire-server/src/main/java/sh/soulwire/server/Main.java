// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.SoulwireConfig;
import sh.soulwire.core.WireDebug;

/**
 * Command-line entry point.
 *
 * <pre>
 * java -jar soulwire-server.jar [--config soulwire.properties] [--trace]
 * </pre>
 *
 * Without {@code --config} the bundled {@code soulwire.properties} is used.
 * {@code --trace} turns on wire tracing in both directions. Keys for
 * server-side signing are read from {@code soulwire.keys-dir}.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String DEFAULT_RESOURCE = "soulwire.properties";

    private Main() {
    }

    public static void main(final String[] args) throws Exception {
        final SoulwireConfig config;
        try {
            config = SoulwireConfig.fromProperties(loadProperties(args));
        } catch (IllegalArgumentException | IOException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        for (String arg : args) {
            if ("--trace".equals(arg)) {
                WireDebug.setEnabled(true);
            }
        }

        final SoulwireNode node;
        try {
            node = SoulwireNode.create(config, Clock.systemUTC());
        } catch (IllegalArgumentException e) {
            log.error("Invalid signing key: {}", e.getMessage());
            System.exit(2);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(node::close, "soulwire-shutdown"));
        node.start();
        node.awaitClose();
    }

    /**
     * Reads the file named by {@code --config}, or the bundled defaults.
     */
    static Properties loadProperties(final String[] args) throws IOException {
        final Properties props = new Properties();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a path");
                }
                final Path path = Path.of(args[i + 1]);
                try (InputStream in = Files.newInputStream(path)) {
                    props.load(in);
                }
                log.info("Loaded configuration from {}", path.toAbsolutePath());
                return props;
            }
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        return props;
    }
}
