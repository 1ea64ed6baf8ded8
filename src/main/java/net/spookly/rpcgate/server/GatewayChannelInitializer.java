package net.spookly.rpcgate.server;

import java.util.Objects;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

/**
 * HTTP/1.1 pipeline for inbound gateway connections.
 */
final class GatewayChannelInitializer extends ChannelInitializer<SocketChannel> {
    private final GatewayServer server;
    private final int maxRequestBytes;

    GatewayChannelInitializer(GatewayServer server, int maxRequestBytes) {
        this.server = Objects.requireNonNull(server, "server");
        this.maxRequestBytes = maxRequestBytes;
    }

    @Override
    protected void initChannel(SocketChannel channel) {
        ChannelPipeline pipeline = channel.pipeline();
        pipeline.addLast("httpCodec", new HttpServerCodec());
        pipeline.addLast("aggregator", new HttpObjectAggregator(maxRequestBytes));
        pipeline.addLast("handler", new GatewayRequestHandler(server));
    }
}
