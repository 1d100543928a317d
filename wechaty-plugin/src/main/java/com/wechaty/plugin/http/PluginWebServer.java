package com.wechaty.plugin.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wechaty.common.WechatyException;
import com.wechaty.plugin.http.PluginHttpRegistry.HttpRouteRegistration;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Optional;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.METHOD_NOT_ALLOWED;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpResponseStatus.OK;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Netty HTTP server exposing the routes plugins contributed to a
 * {@link PluginHttpRegistry}. Every response body is JSON.
 */
@Slf4j
public class PluginWebServer {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final PluginHttpRegistry registry;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public PluginWebServer(PluginHttpRegistry registry) {
        this.registry = registry;
    }

    /**
     * Bind the listener. A scheme prefix on {@code host} is ignored; port 0
     * binds an ephemeral port.
     *
     * @return the bound port
     * @throws WechatyException if the address cannot be bound
     */
    public synchronized int start(String host, int port) {
        if (serverChannel != null) {
            log.debug("plugin web server already running");
            return port();
        }
        String bindHost = stripScheme(host);
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(
                                    new HttpServerCodec(),
                                    new HttpObjectAggregator(1048576), // 1MB
                                    new PluginRouteHandler());
                        }
                    });
            serverChannel = b.bind(bindHost, port).sync().channel();
            int boundPort = port();
            log.info("plugin web server listening on http://{}:{}/", bindHost, boundPort);
            return boundPort;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            throw new WechatyException("interrupted while binding " + bindHost + ":" + port, e);
        } catch (Exception e) {
            log.error("plugin web server failed to bind {}:{}: {}", bindHost, port, e.getMessage());
            shutdown();
            throw new WechatyException("failed to bind " + bindHost + ":" + port, e);
        }
    }

    public synchronized boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    /**
     * @return the bound port, or -1 when not running
     */
    public synchronized int port() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        shutdown();
        log.info("plugin web server stopped");
    }

    private void shutdown() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    static String stripScheme(String host) {
        if (host == null || host.isBlank()) {
            return "0.0.0.0";
        }
        int idx = host.indexOf("://");
        String stripped = idx >= 0 ? host.substring(idx + 3) : host;
        while (stripped.endsWith("/")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }

    // =========================================================================
    // Netty Handler
    // =========================================================================

    private class PluginRouteHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
            String path = decoder.path();
            String method = request.method().name();

            Optional<HttpRouteRegistration> route = registry.find(method, path);
            if (route.isEmpty()) {
                if (registry.hasPath(path)) {
                    sendJson(ctx, METHOD_NOT_ALLOWED, Map.of("ok", false, "error", "method not allowed"));
                } else {
                    sendJson(ctx, NOT_FOUND, Map.of("ok", false, "error", "not found: " + path));
                }
                return;
            }

            HttpRouteRegistration registration = route.get();
            try {
                PluginHttpRequest pluginRequest = new PluginHttpRequest(method, path,
                        decoder.parameters(), ByteBufUtil.getBytes(request.content()));
                Object result = registration.getHandler().handle(pluginRequest);
                sendJson(ctx, OK, result != null ? result : Map.of("ok", true));
            } catch (Exception e) {
                log.error("plugin <{}> route {} failed: {}", registration.getPluginName(), path, e.getMessage(), e);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                sendJson(ctx, INTERNAL_SERVER_ERROR, Map.of("ok", false, "error", message));
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Netty channel error: {}", cause.getMessage(), cause);
            ctx.close();
        }

        private void sendJson(ChannelHandlerContext ctx, HttpResponseStatus status, Object body) {
            try {
                byte[] bytes = mapper.writeValueAsBytes(body);
                FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status,
                        Unpooled.wrappedBuffer(bytes));
                response.headers().set(CONTENT_TYPE, "application/json");
                response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
                ctx.writeAndFlush(response);
            } catch (Exception e) {
                log.error("Failed to serialize response: {}", e.getMessage());
                ctx.close();
            }
        }
    }
}
