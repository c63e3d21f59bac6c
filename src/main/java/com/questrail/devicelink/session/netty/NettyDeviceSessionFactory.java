package com.questrail.devicelink.session.netty;

import com.questrail.devicelink.api.DeviceEndpoint;
import com.questrail.devicelink.internal.time.WallClock;
import com.questrail.devicelink.observability.CommandObservabilitySink;
import com.questrail.devicelink.protocol.codec.FrameDecoder;
import com.questrail.devicelink.protocol.codec.impl.DefaultFrameDecoder;
import com.questrail.devicelink.session.DeviceSession;
import com.questrail.devicelink.session.DeviceSessionFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyDeviceSessionFactory
 * =============================================================================
 * Creates {@link NettyDeviceSession}s that share one event loop group.
 *
 * <h2>Lifecycle</h2>
 * The group is created with the factory and shut down by {@link #close()}.
 * Sessions created afterwards fail to connect.
 */
public final class NettyDeviceSessionFactory implements DeviceSessionFactory
{
    /** Frames buffered per session before inbound reads are paused. */
    public static final int DEFAULT_INBOX_CAPACITY = 16;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final FrameDecoder frameDecoder;
    private final int inboxCapacity;
    private final CommandObservabilitySink sink;
    private final WallClock wallClock;

    public NettyDeviceSessionFactory(int maxPayloadSize, CommandObservabilitySink sink, WallClock wallClock)
    {
        this(maxPayloadSize, DEFAULT_INBOX_CAPACITY, 1, sink, wallClock);
    }

    public NettyDeviceSessionFactory(int maxPayloadSize,
                                     int inboxCapacity,
                                     int ioThreads,
                                     CommandObservabilitySink sink,
                                     WallClock wallClock)
    {
        if (inboxCapacity <= 0) {
            throw new IllegalArgumentException("inboxCapacity must be > 0");
        }
        if (ioThreads <= 0) {
            throw new IllegalArgumentException("ioThreads must be > 0");
        }
        this.frameDecoder = new DefaultFrameDecoder(maxPayloadSize);
        this.inboxCapacity = inboxCapacity;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.group = new NioEventLoopGroup(ioThreads);
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true);
    }

    @Override
    public DeviceSession create(String deviceId, DeviceEndpoint endpoint)
    {
        return new NettyDeviceSession(deviceId, endpoint, bootstrap, frameDecoder, inboxCapacity, sink, wallClock);
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }
}
