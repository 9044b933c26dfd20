package com.phillippitts.voicegraph.testutil;

import java.util.concurrent.Executor;

/**
 * Runs each task on a new daemon thread so receive loops never outlive the test JVM.
 */
public class DaemonThreadExecutor implements Executor {

    private final String threadName;

    public DaemonThreadExecutor(String threadName) {
        this.threadName = threadName;
    }

    @Override
    public void execute(Runnable command) {
        Thread thread = new Thread(command, threadName);
        thread.setDaemon(true);
        thread.start();
    }
}
