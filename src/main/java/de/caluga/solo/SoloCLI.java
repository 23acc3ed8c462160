package de.caluga.solo;

import de.caluga.solo.broadcast.MulticastBroadcastBus;
import de.caluga.solo.store.FileLeaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Runs a single participant against a lease directory until the process is
 * terminated. Start it several times with the same directory and namespace to watch
 * leadership move between processes.
 */
public class SoloCLI {
    private static final Logger log = LoggerFactory.getLogger(SoloCLI.class);

    public static void main(String[] args) throws Exception {
        Options opts;

        try {
            opts = parse(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            printHelp();
            System.exit(1);
            return;
        }

        if (opts.help) {
            printHelp();
            return;
        }

        log.info("Lease directory: {}", opts.directory.toAbsolutePath());
        log.info("Settings: {}", opts.config);

        opts.config
            .setOnBecomeLeader(() -> log.info("*** this process is now the ACTIVE owner"))
            .setOnLoseLeadership(() -> log.info("*** this process lost ownership"))
            .setOnOtherDetected(() -> log.debug("another process owns the lease"));

        FileLeaseStore store = new FileLeaseStore(opts.directory);
        Participant participant = new Participant(opts.config, store);

        if (opts.config.isUseBroadcastBus()) {
            participant.setBroadcastBusFactory(MulticastBroadcastBus.factory());
        }

        participant.start();
        log.info("Participant {} started - leader: {}, broadcast: {}", participant.getId(), participant.isLeader(), participant.isBroadcastConnected());

        if (opts.force) {
            participant.forceAcquire();
        }

        CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            participant.close();
            store.close();
            terminated.countDown();
        }, "solo-cli-shutdown"));

        terminated.await();
    }

    static Options parse(String[] args) {
        Options opts = new Options();
        int idx = 0;

        while (idx < args.length) {
            switch (args[idx]) {
                case "-h":
                case "--help":
                    opts.help = true;
                    idx++;
                    break;

                case "-d":
                case "--dir":
                    opts.directory = Path.of(value(args, idx));
                    idx += 2;
                    break;

                case "-n":
                case "--namespace":
                    opts.config.setNamespace(value(args, idx));
                    idx += 2;
                    break;

                case "-t":
                case "--timeout":
                    opts.config.setTimeoutMs(number(args, idx));
                    idx += 2;
                    break;

                case "-i":
                case "--interval":
                    opts.config.setIntervalMs(number(args, idx));
                    idx += 2;
                    break;

                case "--no-broadcast":
                    opts.config.setUseBroadcastBus(false);
                    idx++;
                    break;

                case "-f":
                case "--force":
                    opts.force = true;
                    idx++;
                    break;

                default:
                    throw new IllegalArgumentException("Unknown parameter " + args[idx]);
            }
        }

        opts.config.validate();
        return opts;
    }

    private static String value(String[] args, int idx) {
        if (idx + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[idx]);
        }

        return args[idx + 1];
    }

    private static long number(String[] args, int idx) {
        String v = value(args, idx);

        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Value for " + args[idx] + " is not a number: " + v);
        }
    }

    private static void printHelp() {
        System.out.println("Usage: SoloCLI [options]");
        System.out.println("  -d, --dir <path>        lease directory (default: ./solo-leases)");
        System.out.println("  -n, --namespace <name>  namespace to compete for (default: my-app)");
        System.out.println("  -t, --timeout <ms>      lease timeout (default: 15000)");
        System.out.println("  -i, --interval <ms>     reconciliation interval (default: 10000)");
        System.out.println("      --no-broadcast      do not use multicast notifications");
        System.out.println("  -f, --force             take over the lease right after start");
        System.out.println("  -h, --help              this text");
    }

    static class Options {
        Path directory = Path.of("solo-leases");
        ParticipantConfig config = new ParticipantConfig();
        boolean force = false;
        boolean help = false;
    }
}
