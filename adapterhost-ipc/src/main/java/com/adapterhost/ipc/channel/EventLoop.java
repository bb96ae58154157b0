package com.adapterhost.ipc.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.SelectableChannel;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.util.Iterator;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Single selector thread. Channel registration and interest changes run as tasks on this thread;
 * other threads hand work over with {@link #execute(Runnable)}.
 */
public final class EventLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);
    private static final long JOIN_TIMEOUT_MS = 5_000;

    private final String name;
    private final Selector selector;
    private final Thread thread;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private volatile boolean running = true;

    public EventLoop(String name) throws IOException {
        this.name = name;
        this.selector = Selector.open();
        this.thread = new Thread(this::run, name);
        this.thread.setDaemon(true);
        this.thread.start();
    }

    public void execute(Runnable task) {
        tasks.add(task);
        selector.wakeup();
    }

    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    public boolean isRunning() {
        return running;
    }

    /** Registers {@code channel} (already non-blocking) with {@code handler} as attachment. */
    public CompletableFuture<SelectionKey> register(SelectableChannel channel, int ops, ChannelHandler handler) {
        CompletableFuture<SelectionKey> registered = new CompletableFuture<>();
        execute(() -> {
            try {
                registered.complete(channel.register(selector, ops, handler));
            } catch (IOException | RuntimeException e) {
                registered.completeExceptionally(e);
            }
        });
        return registered;
    }

    private void run() {
        try {
            while (running) {
                runTasks();
                selector.select();
                if (!running) break;
                Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
                while (keys.hasNext()) {
                    SelectionKey key = keys.next();
                    keys.remove();
                    if (!key.isValid()) continue;
                    ChannelHandler handler = (ChannelHandler) key.attachment();
                    try {
                        handler.onReady(key);
                    } catch (IOException | RuntimeException e) {
                        handler.onFailure(e);
                    }
                }
            }
        } catch (IOException e) {
            log.error("Event loop {} stopped: {}", name, e.getMessage(), e);
        } finally {
            running = false;
            runTasks();
            try {
                selector.close();
            } catch (IOException e) {
                log.debug("Error closing selector of {}", name, e);
            }
        }
    }

    private void runTasks() {
        Runnable task;
        while ((task = tasks.poll()) != null) {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Event loop {} task failed", name, e);
            }
        }
    }

    /** Stops the loop and waits briefly for the thread to exit. Channels are closed by their owners. */
    @Override
    public void close() {
        running = false;
        selector.wakeup();
        if (inEventLoop()) return;
        try {
            thread.join(JOIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
