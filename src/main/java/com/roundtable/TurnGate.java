package com.roundtable;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Serializes access to the chat session so only one request works on it at a time.
 */
public class TurnGate {
    private final Semaphore semaphore = new Semaphore(1, true);

    public <T> T run(Callable<T> task) throws Exception {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
        try {
            return task.call();
        } finally {
            semaphore.release();
        }
    }
}
