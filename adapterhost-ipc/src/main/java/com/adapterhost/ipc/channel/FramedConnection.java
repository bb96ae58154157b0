package com.adapterhost.ipc.channel;

import com.adapterhost.ipc.protocol.FrameDecoder;
import com.adapterhost.ipc.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-blocking socket connection exchanging delimiter-terminated frames. Reads and writes happen on
 * the event loop; {@link #send} may be called from any thread and frames go out in call order.
 */
public final class FramedConnection implements ChannelHandler {

    private static final Logger log = LoggerFactory.getLogger(FramedConnection.class);
    private static final int READ_BUFFER_BYTES = 64 * 1024;

    /** Callbacks on the event loop thread. */
    public interface Listener {
        void onFrame(FramedConnection connection, byte[] frame);

        /** @param cause null for an orderly close */
        void onClosed(FramedConnection connection, Throwable cause);
    }

    private final String id;
    private final SocketChannel channel;
    private final EventLoop loop;
    private final FrameDecoder decoder;
    private final Listener listener;
    private final ByteBuffer readBuffer = ByteBuffer.allocate(READ_BUFFER_BYTES);
    private final Queue<PendingWrite> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile SelectionKey key;

    public FramedConnection(String id, SocketChannel channel, EventLoop loop, FrameDecoder decoder, Listener listener) {
        this.id = id;
        this.channel = channel;
        this.loop = loop;
        this.decoder = decoder;
        this.listener = listener;
    }

    public String getId() {
        return id;
    }

    /** Registers for reading; frames queued before registration are flushed once it completes. */
    public CompletableFuture<Void> start() {
        return loop.register(channel, SelectionKey.OP_READ, this)
                .thenAccept(registered -> {
                    key = registered;
                    flush();
                })
                .whenComplete((v, e) -> {
                    if (e != null) close(e);
                });
    }

    /** Queues a complete frame; the future completes once every byte is written. */
    public CompletableFuture<Void> send(byte[] frame) {
        PendingWrite write = new PendingWrite(ByteBuffer.wrap(frame));
        if (closed.get()) {
            write.done.completeExceptionally(new ClosedChannelException());
            return write.done;
        }
        outbound.add(write);
        loop.execute(this::flush);
        if (closed.get()) {
            failQueued(new ClosedChannelException());
        }
        return write.done;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void onReady(SelectionKey readyKey) throws IOException {
        if (readyKey.isReadable()) {
            read();
        }
        if (readyKey.isValid() && readyKey.isWritable()) {
            flush();
        }
    }

    @Override
    public void onFailure(Throwable cause) {
        close(cause);
    }

    public void close() {
        close(null);
    }

    private void read() throws IOException {
        readBuffer.clear();
        int n = channel.read(readBuffer);
        if (n < 0) {
            close(null);
            return;
        }
        if (n == 0) return;
        readBuffer.flip();
        List<byte[]> frames;
        try {
            frames = decoder.decode(readBuffer);
        } catch (ProtocolException e) {
            log.warn("Closing connection {}: {}", id, e.getMessage());
            close(e);
            return;
        }
        for (byte[] frame : frames) {
            try {
                listener.onFrame(this, frame);
            } catch (RuntimeException e) {
                log.warn("Frame handler failed on connection {}", id, e);
            }
        }
    }

    private void flush() {
        if (closed.get()) {
            failQueued(new ClosedChannelException());
            return;
        }
        SelectionKey k = key;
        if (k == null) return;
        try {
            PendingWrite write;
            while ((write = outbound.peek()) != null) {
                channel.write(write.buffer);
                if (write.buffer.hasRemaining()) {
                    k.interestOps(k.interestOps() | SelectionKey.OP_WRITE);
                    return;
                }
                outbound.poll();
                write.done.complete(null);
            }
            k.interestOps(k.interestOps() & ~SelectionKey.OP_WRITE);
        } catch (IOException | CancelledKeyException e) {
            close(e);
        }
    }

    private void close(Throwable cause) {
        if (!closed.compareAndSet(false, true)) return;
        SelectionKey k = key;
        if (k != null) k.cancel();
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Error closing connection {}", id, e);
        }
        failQueued(cause != null ? cause : new ClosedChannelException());
        try {
            listener.onClosed(this, cause);
        } catch (RuntimeException e) {
            log.warn("Close handler failed on connection {}", id, e);
        }
    }

    private void failQueued(Throwable cause) {
        PendingWrite write;
        while ((write = outbound.poll()) != null) {
            write.done.completeExceptionally(cause);
        }
    }

    private static final class PendingWrite {
        final ByteBuffer buffer;
        final CompletableFuture<Void> done = new CompletableFuture<>();

        PendingWrite(ByteBuffer buffer) {
            this.buffer = buffer;
        }
    }
}
