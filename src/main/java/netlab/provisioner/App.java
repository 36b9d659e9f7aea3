package netlab.provisioner;

import netlab.provisioner.config.Dependencies;
import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.server.ProvisionerNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point: {@code App [config.ini]}.
 *
 * Without an argument the configuration comes from NETLAB_* environment variables.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        ProvisionerConfig config = loadConfig(args);
        if (config == null) {
            System.exit(2);
            return;
        }

        Dependencies deps = Dependencies.create(config);
        if (!ProvisionerNettyServer.start(config.serverPort(), deps)) {
            log.error("Provisioner API did not start on port {}", config.serverPort());
            deps.close();
            System.exit(1);
            return;
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            ProvisionerNettyServer.stop();
            deps.close();
            shutdown.countDown();
        }, "netlab-shutdown"));

        shutdown.await();
    }

    static ProvisionerConfig loadConfig(String[] args) {
        if (args.length == 0) {
            return ProvisionerConfig.fromEnv();
        }
        File ini = new File(args[0]);
        if (!ini.isFile()) {
            log.error("Config file not found: {}", ini.getAbsolutePath());
            return null;
        }
        return ProvisionerConfig.fromIni(ini).orElse(null);
    }
}
