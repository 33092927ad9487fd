package net.spookly.prober.target;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import net.spookly.prober.probe.ProbeContext;
import net.spookly.prober.probe.ProbeFailedException;
import net.spookly.prober.probe.ProbeTarget;
import net.spookly.prober.util.HostPort;

import java.util.Objects;

/**
 * Probe that succeeds when a TCP connection to the target can be established within the timeout.
 */
public final class TcpConnectProbe implements ProbeTarget, AutoCloseable {
    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final HostPort target;
    private final int timeoutMs;

    /**
     * Create a probe with a dedicated single-threaded event loop.
     */
    public TcpConnectProbe(HostPort target, int timeoutMs) {
        this(new NioEventLoopGroup(1), true, target, timeoutMs);
    }

    /**
     * Create a probe sharing an event loop group owned by the caller.
     */
    public TcpConnectProbe(EventLoopGroup group, HostPort target, int timeoutMs) {
        this(group, false, target, timeoutMs);
    }

    private TcpConnectProbe(EventLoopGroup group, boolean ownsGroup, HostPort target, int timeoutMs) {
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
        this.target = Objects.requireNonNull(target, "target");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be greater than 0: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void execute(ProbeContext context) throws Exception {
        context.throwIfCancelled();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
                .handler(new ChannelInboundHandlerAdapter());
        ChannelFuture connect = bootstrap.connect(target.host(), target.port());
        try {
            connect.await();
        } catch (InterruptedException e) {
            connect.cancel(false);
            closeQuietly(connect);
            throw e;
        }
        if (!connect.isSuccess()) {
            Throwable cause = connect.cause();
            String reason;
            if (cause == null) {
                reason = "cancelled";
            } else {
                reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            }
            throw new ProbeFailedException("connect to " + target + " failed: " + reason, cause);
        }
        connect.channel().close().syncUninterruptibly();
    }

    @Override
    public void close() {
        if (!ownsGroup) {
            return;
        }
        group.shutdownGracefully();
    }

    private static void closeQuietly(ChannelFuture connect) {
        if (connect.isSuccess()) {
            connect.channel().close();
        }
    }

    @Override
    public String toString() {
        return "tcp://" + target;
    }
}
