package org.netpreserve.evidence.pacing;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sun.misc.Signal;

import java.io.PrintStream;
import java.util.concurrent.Semaphore;

/**
 * Prints the scoreboard on request. The signal handler only releases a semaphore, the printing happens on a
 * dedicated daemon thread so a dump can never stall request pacing.
 */
public class DiagnosticsListener implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsListener.class);
    private final Scoreboard scoreboard;
    private final PrintStream out;
    private final Semaphore requests = new Semaphore(0);
    private final Thread thread;
    private volatile boolean closed;

    public DiagnosticsListener(Scoreboard scoreboard, PrintStream out) {
        this.scoreboard = scoreboard;
        this.out = out;
        this.thread = new Thread(this::run, "diagnostics");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Starts a listener that dumps the scoreboard whenever the process receives the named signal. Returns null with
     * a warning if the platform refuses the signal.
     */
    public static @Nullable DiagnosticsListener install(String signalName, Scoreboard scoreboard, PrintStream out) {
        Signal signal;
        try {
            signal = new Signal(signalName);
        } catch (IllegalArgumentException e) {
            log.warn("Diagnostics signal {} is not available on this platform: {}", signalName, e.getMessage());
            return null;
        }
        var listener = new DiagnosticsListener(scoreboard, out);
        try {
            Signal.handle(signal, sig -> listener.requestDump());
        } catch (IllegalArgumentException e) {
            log.warn("Unable to install handler for SIG{}: {}", signalName, e.getMessage());
            listener.close();
            return null;
        }
        log.debug("Send SIG{} to print the pacing scoreboard", signalName);
        return listener;
    }

    /**
     * Asks the listener thread to print the scoreboard. Never blocks.
     */
    public void requestDump() {
        requests.release();
    }

    private void run() {
        while (!closed) {
            try {
                requests.acquire();
            } catch (InterruptedException e) {
                return;
            }
            if (closed) return;
            out.print(scoreboard.format());
            out.flush();
        }
    }

    @Override
    public void close() {
        closed = true;
        thread.interrupt();
    }
}
