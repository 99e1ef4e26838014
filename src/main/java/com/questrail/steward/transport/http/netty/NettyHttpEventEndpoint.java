package com.questrail.steward.transport.http.netty;

import com.questrail.steward.transport.EventEndpoint;
import com.questrail.steward.transport.EventEndpointListener;
import com.questrail.steward.transport.IngressVerdict;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * NettyHttpEventEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link EventEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It accepts
 * {@code POST} requests on one path, hands the aggregated body to the listener,
 * and maps the returned {@link IngressVerdict} to a status:
 * <pre>
 *   ACCEPTED    → 202
 *   MALFORMED   → 400
 *   UNAVAILABLE → 503
 *   wrong path  → 404
 *   not POST    → 405
 * </pre>
 *
 * It MUST NOT decode event JSON, route events, or call the response channel.
 * A 202 means only that the event was queued.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Bodies are copied into
 * {@code byte[]} before they reach the listener.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the server socket and waits for the bind to finish.
 * - {@link #stop()} closes the server channel and shuts down both event loop groups.
 */
public final class NettyHttpEventEndpoint implements EventEndpoint
{
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 64 * 1024;

    private final InetSocketAddress bindAddress;
    private final String path;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile EventEndpointListener listener;
    private volatile Channel channel;

    public NettyHttpEventEndpoint(InetSocketAddress bindAddress, String path)
    {
        this(bindAddress, path, DEFAULT_MAX_CONTENT_LENGTH);
    }

    public NettyHttpEventEndpoint(InetSocketAddress bindAddress, String path, int maxContentLength)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.path = Objects.requireNonNull(path, "path");
        if (maxContentLength < 1) {
            throw new IllegalArgumentException("maxContentLength must be >= 1");
        }

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(maxContentLength));
                        p.addLast(new RequestHandler());
                    }
                });
    }

    @Override
    public void setListener(EventEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        EventEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (f.isSuccess()) {
            channel = f.channel();
            l.onEndpointUp();
        }
        else {
            l.onEndpointDown(f.cause());
        }
    }

    @Override
    public void stop()
    {
        EventEndpointListener l = listener;

        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();

        if (l != null && ch != null) {
            l.onEndpointDown(null);
        }
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = channel;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
    }

    private EventEndpointListener requireListener()
    {
        EventEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("EventEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * RequestHandler
     * -------------------------------------------------------------------------
     * Receives aggregated requests, forwards the body bytes to the port
     * listener and writes the status chosen by the listener.
     */
    private final class RequestHandler extends SimpleChannelInboundHandler<FullHttpRequest>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
        {
            if (!request.decoderResult().isSuccess()) {
                reply(ctx, request, HttpResponseStatus.BAD_REQUEST, "unreadable request");
                return;
            }
            if (!path.equals(new QueryStringDecoder(request.uri()).path())) {
                reply(ctx, request, HttpResponseStatus.NOT_FOUND, "");
                return;
            }
            if (!HttpMethod.POST.equals(request.method())) {
                reply(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, "");
                return;
            }

            EventEndpointListener l = listener;
            if (l == null) {
                reply(ctx, request, HttpResponseStatus.SERVICE_UNAVAILABLE, "");
                return;
            }

            // Copy the body into a plain byte[] (Netty containment rule).
            ByteBuf content = request.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            IngressVerdict verdict = l.onEventPayload(ctx.channel().remoteAddress(), bytes);
            HttpResponseStatus status = switch (verdict.kind()) {
                case ACCEPTED -> HttpResponseStatus.ACCEPTED;
                case MALFORMED -> HttpResponseStatus.BAD_REQUEST;
                case UNAVAILABLE -> HttpResponseStatus.SERVICE_UNAVAILABLE;
            };
            reply(ctx, request, status, verdict.detail());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // A single connection failing does not take the endpoint down.
            ctx.close();
        }

        private void reply(ChannelHandlerContext ctx, FullHttpRequest request, HttpResponseStatus status, String body)
        {
            ByteBuf content = Unpooled.copiedBuffer(body, StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
            response.headers()
                    .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.TEXT_PLAIN + "; charset=UTF-8")
                    .setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());

            boolean keepAlive = HttpUtil.isKeepAlive(request);
            if (keepAlive) {
                response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
                ctx.writeAndFlush(response);
            }
            else {
                ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
            }
        }
    }
}
