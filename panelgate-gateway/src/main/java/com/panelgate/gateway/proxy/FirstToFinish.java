package com.panelgate.gateway.proxy;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs two tasks concurrently and returns once the first one ends. The other task is
 * then interrupted and awaited, so neither outlives the call.
 */
@Slf4j
public final class FirstToFinish {

    private FirstToFinish() {
    }

    /**
     * Which task ended first and how.
     *
     * @param winner 0 for {@code first}, 1 for {@code second}
     * @param error  exception the winner ended with, null on a normal return
     */
    public record Outcome(int winner, Throwable error) {
        public boolean failed() {
            return error != null;
        }
    }

    /**
     * @throws InterruptedException when the calling thread is interrupted; both tasks are
     *                              still cancelled and awaited
     */
    public static Outcome run(Executor executor, Callable<?> first, Callable<?> second)
            throws InterruptedException {
        CountDownLatch finished = new CountDownLatch(2);
        CompletableFuture<Outcome> firstDone = new CompletableFuture<>();
        Leg a = new Leg(0, first, finished, firstDone);
        Leg b = new Leg(1, second, finished, firstDone);
        executor.execute(a);
        executor.execute(b);

        Outcome outcome;
        try {
            outcome = firstDone.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("relay leg completion failed", e.getCause());
        } catch (InterruptedException e) {
            a.cancel();
            b.cancel();
            awaitUninterruptibly(finished);
            throw e;
        }

        (outcome.winner() == 0 ? b : a).cancel();
        awaitUninterruptibly(finished);
        return outcome;
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Leg implements Runnable {
        private final int index;
        private final Callable<?> body;
        private final CountDownLatch finished;
        private final CompletableFuture<Outcome> firstDone;

        private Thread runner;
        private boolean cancelled;

        Leg(int index, Callable<?> body, CountDownLatch finished, CompletableFuture<Outcome> firstDone) {
            this.index = index;
            this.body = body;
            this.finished = finished;
            this.firstDone = firstDone;
        }

        @Override
        public void run() {
            synchronized (this) {
                if (cancelled) {
                    finished.countDown();
                    return;
                }
                runner = Thread.currentThread();
            }
            Throwable error = null;
            try {
                body.call();
            } catch (InterruptedException e) {
                log.trace("relay leg {} interrupted", index);
            } catch (Exception | Error e) {
                error = e;
            } finally {
                synchronized (this) {
                    runner = null;
                }
                // an interrupt aimed at this leg must not leak into the pool thread
                Thread.interrupted();
                firstDone.complete(new Outcome(index, error));
                finished.countDown();
            }
        }

        synchronized void cancel() {
            cancelled = true;
            if (runner != null) {
                runner.interrupt();
            }
        }
    }
}
