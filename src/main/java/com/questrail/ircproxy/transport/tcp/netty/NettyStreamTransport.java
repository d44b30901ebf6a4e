package com.questrail.ircproxy.transport.tcp.netty;

import com.questrail.ircproxy.transport.DialCallback;
import com.questrail.ircproxy.transport.StreamAcceptor;
import com.questrail.ircproxy.transport.StreamEndpoint;
import com.questrail.ircproxy.transport.StreamTransport;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * NettyStreamTransport
 * =============================================================================
 * Netty NIO implementation of {@link StreamTransport}.
 *
 * <h2>Threading</h2>
 * Accepted connections are spread over the worker group. An outbound
 * connection dialed for an accepted one is registered on the
 * <em>same</em> event loop, so both legs of a relay pair are served by a
 * single thread and need no locking.
 *
 * <h2>Reading</h2>
 * Every channel starts with {@link ChannelOption#AUTO_READ} off. The relay
 * turns reading on once it has wired both legs.
 */
public final class NettyStreamTransport implements StreamTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyStreamTransport.class);

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final int connectTimeoutMillis;

    private volatile Channel serverChannel;

    /**
     * @param workerThreads  event loop threads; 0 selects the Netty default
     * @param connectTimeout limit for outbound connection attempts
     */
    public NettyStreamTransport(int workerThreads, Duration connectTimeout)
    {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(workerThreads);
        this.connectTimeoutMillis = (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis());
    }

    @Override
    public InetSocketAddress start(InetSocketAddress listenAddress, StreamAcceptor acceptor)
    {
        Objects.requireNonNull(listenAddress, "listenAddress");
        Objects.requireNonNull(acceptor, "acceptor");
        if (serverChannel != null) {
            throw new IllegalStateException("Transport is already started");
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyStreamEndpoint endpoint = new NettyStreamEndpoint(ch);
                        ch.pipeline().addLast(endpoint.handler());
                        // Hand over only once the channel is registered and active.
                        ch.eventLoop().execute(() -> {
                            if (ch.isActive()) {
                                acceptor.onAccepted(endpoint);
                            }
                        });
                    }
                });

        ChannelFuture bind = bootstrap.bind(listenAddress).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            throw new IllegalStateException("Cannot listen on " + listenAddress, bind.cause());
        }

        serverChannel = bind.channel();
        InetSocketAddress bound = (InetSocketAddress) serverChannel.localAddress();
        log.info("Listening on {}", bound);
        return bound;
    }

    @Override
    public void dial(StreamEndpoint origin, InetSocketAddress target, DialCallback callback)
    {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(callback, "callback");

        EventLoopGroup group = origin instanceof NettyStreamEndpoint
                ? ((NettyStreamEndpoint) origin).eventLoop()
                : workerGroup;

        final NettyStreamEndpoint[] created = new NettyStreamEndpoint[1];
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NettyStreamEndpoint endpoint = new NettyStreamEndpoint(ch);
                        ch.pipeline().addLast(endpoint.handler());
                        created[0] = endpoint;
                    }
                });

        bootstrap.connect(target).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess() && created[0] != null) {
                callback.onConnected(created[0]);
            }
            else {
                callback.onFailed(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    @Override
    public void awaitTermination() throws InterruptedException
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.closeFuture().sync();
        }
    }
}
