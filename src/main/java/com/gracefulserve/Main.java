package com.gracefulserve;

import Server.ApiServer;
import Server.ServerSession;
import Server.ServerSettings;
import Server.lifecycle.DrainResult;
import Server.lifecycle.LivenessFlag;
import Server.lifecycle.ShutdownOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerSettings settings;
        try {
            settings = ServerSettings.fromConfig();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        Config.printStatus();

        LivenessFlag liveness = new LivenessFlag();

        // 1) bind, no retry: the operator has to fix the address and restart
        ServerSession session;
        try {
            session = ApiServer.bind(settings, liveness);
        } catch (IOException e) {
            log.error("Could not listen on {}: {}", settings.listenAddress(), e.getMessage());
            System.exit(1);
            return;
        }

        // 2) SIGINT/SIGTERM handling before anything is served
        ShutdownOrchestrator orchestrator = new ShutdownOrchestrator(session, liveness, settings.shutdownTimeout());
        try {
            orchestrator.installSignalHandler();
        } catch (IllegalArgumentException | SecurityException e) {
            log.error("Could not register signal handler: {}", e.getMessage());
            System.exit(1);
            return;
        }

        // 3) serve until a signal drains and stops the session
        orchestrator.start();
        try {
            orchestrator.awaitStopped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            orchestrator.shutdown();
        }

        // a drain that had to cut requests off still exits 0; only a failed release is fatal
        DrainResult result = orchestrator.result();
        System.exit(result.failed() ? 1 : 0);
    }
}
