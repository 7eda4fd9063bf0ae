package org.dballot;

import org.dballot.config.BallotConfig;
import org.dballot.crypto.SignatureUtil;
import org.dballot.crypto.Wallet;
import org.dballot.governance.Ballot;
import org.dballot.identity.Identity;
import org.dballot.store.BallotStore;
import org.dballot.util.ConsolePrinter;
import org.dballot.web.BallotHandler;
import org.dballot.web.RequestAuthenticator;
import org.dballot.web.WebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Scanner;
import java.util.function.Supplier;

/**
 * Usage: {@code Main [serve|cli|keygen]}. Defaults to {@code serve}.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        String mode = args.length > 0 ? args[0] : "serve";

        switch (mode) {
            case "keygen" -> keygen();
            case "cli" -> cli(BallotConfig.load());
            case "serve" -> serve(BallotConfig.load());
            default -> {
                ConsolePrinter.printFail("Unknown mode '" + mode + "'. Use serve, cli or keygen.");
                System.exit(2);
            }
        }
    }

    private static void keygen() {
        Wallet wallet = new Wallet();
        ConsolePrinter.printInfo("Public key (identity):");
        System.out.println(wallet.identity().value());
        ConsolePrinter.printWarning("Private key (keep secret):");
        System.out.println(SignatureUtil.getStringFromKey(wallet.getKeyPair().getPrivate()));
    }

    private static void cli(BallotConfig config) {
        try (BallotStore store = config.openStore()) {
            Ballot ballot = openBallot(config, store, () -> Identity.of("admin"));
            new BallotCLI(ballot, new Scanner(System.in)).start();
        }
    }

    private static void serve(BallotConfig config) {
        BallotStore store = config.openStore();
        Ballot ballot = openBallot(config, store, Main::generateAdministrator);
        BallotHandler handler = new BallotHandler(ballot, new RequestAuthenticator(config.getSignatureWindowSeconds()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[Main] Shutting down");
            WebServer.shutdown();
            store.close();
        }));
        WebServer.start(config, handler);
        ConsolePrinter.printSuccess("dBallot serving " + ballot.proposalCount() + " proposals, administrator "
                + ballot.administrator());
    }

    private static Identity generateAdministrator() {
        Wallet wallet = new Wallet();
        ConsolePrinter.printWarning("No administrator configured; generated a key pair for this round.");
        ConsolePrinter.printWarning("Administrator private key: "
                + SignatureUtil.getStringFromKey(wallet.getKeyPair().getPrivate()));
        return wallet.identity();
    }

    /**
     * Opens the round held by {@code store}, or starts one. The configured administrator wins; without
     * one, a round already in the store keeps its own administrator and {@code newAdministrator} is only
     * asked for an empty store.
     */
    static Ballot openBallot(BallotConfig config, BallotStore store, Supplier<Identity> newAdministrator) {
        Identity administrator = config.getAdministrator();
        if (administrator == null) {
            administrator = store.getAdministrator();
            if (administrator != null)
                log.info("[Main] No administrator configured; resuming stored round of " + administrator);
            else
                administrator = newAdministrator.get();
        }
        return Ballot.create(administrator, config.getProposals(), config.getLabelPolicy(), store);
    }
}
