package com.tradebot.cli;

import com.tradebot.client.ClientConfig;
import com.tradebot.client.ConnectionStatus;
import com.tradebot.client.TradingServiceClient;
import com.tradebot.core.model.ServerInfo;
import com.tradebot.core.model.TotalBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Service Probe - checks that the trading service answers.
 *
 * Connects, then reads server info, total balance, sessions and available
 * symbols, and prints the resulting connection status. Exits non-zero when
 * the service is unreachable.
 */
public class ServiceProbeApp {
    private static final Logger LOG = LoggerFactory.getLogger(ServiceProbeApp.class);
    private static final long CALL_TIMEOUT_SECONDS = 60;

    public static void main(String[] args) {
        ClientConfig config;
        try {
            config = ClientConfig.load();
        } catch (IOException e) {
            LOG.error("Failed to load config from {}: {}", ClientConfig.defaultPath(), e.getMessage());
            System.exit(2);
            return;
        }
        if (args.length > 0) {
            config.setApiBaseUrl(args[0]);
        }
        if (args.length > 1) {
            config.setChannelUrl(args[1]);
        }

        int exitCode;
        try (TradingServiceClient client = new TradingServiceClient(config)) {
            exitCode = new ServiceProbeApp().run(client, System.out);
        }
        System.exit(exitCode);
    }

    /**
     * Run the probe against {@code client}.
     *
     * @return 0 if the service answered, 1 if server info could not be read
     */
    int run(TradingServiceClient client, PrintStream out) {
        out.println("Probing trading service...");
        client.connect().join();

        out.println();
        out.println("1. Server info");
        ServerInfo info;
        try {
            info = client.getServerInfo().get(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            out.println("   FAILED: service unreachable (" + describe(e) + ")");
            printStatus(client.getConnectionStatus(), out);
            return 1;
        }
        out.printf("   OK: %s on port %d (testnet=%s)%n", info.environment(), info.port(), info.binanceTestnet());

        out.println();
        out.println("2. Total balance");
        try {
            TotalBalance balance = client.getTotalBalance().get(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            out.printf("   OK: total=%.2f available=%.2f unrealized=%.2f%n",
                balance.totalBalance(), balance.availableBalance(), balance.unrealizedProfit());
        } catch (Exception e) {
            out.println("   FAILED: " + describe(e));
        }

        out.println();
        out.println("3. Sessions");
        try {
            int count = client.getAllSessions().get(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS).size();
            out.println("   OK: " + count + " session(s)");
        } catch (Exception e) {
            out.println("   FAILED: " + describe(e));
        }

        out.println();
        out.println("4. Available symbols");
        try {
            int count = client.getAvailableSymbols().get(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS).size();
            out.println("   OK: " + count + " symbol(s)");
        } catch (Exception e) {
            out.println("   FAILED: " + describe(e));
        }

        printStatus(client.getConnectionStatus(), out);
        return 0;
    }

    private static void printStatus(ConnectionStatus status, PrintStream out) {
        out.println();
        out.println("Connection status");
        out.println("   connected:          " + status.connected());
        out.println("   transport:          " + (status.usingChannel() ? "channel" : "HTTP fallback"));
        out.println("   reconnect attempts: " + status.reconnectAttempts());
        out.println("   subscriptions:      " + status.subscriptionCount());
    }

    private static String describe(Exception e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
