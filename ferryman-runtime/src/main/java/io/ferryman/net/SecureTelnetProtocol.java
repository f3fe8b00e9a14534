/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.net;

import java.util.Objects;

import javax.net.ssl.SSLException;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import io.ferryman.config.ConfigurationException;
import io.ferryman.config.TlsDefinition;

/**
 * {@link TelnetProtocol} behind TLS.
 */
public class SecureTelnetProtocol extends TelnetProtocol {

    public static final String NAME = "telnet-ssl";

    private final SslContext sslContext;

    public SecureTelnetProtocol(SslContext sslContext) {
        this.sslContext = Objects.requireNonNull(sslContext, "sslContext");
    }

    public static SecureTelnetProtocol fromDefinition(TlsDefinition tls) {
        try {
            SslContext context = SslContextBuilder.forServer(tls.certificateFile().toFile(), tls.keyFile().toFile(), tls.keyPassword())
                    .build();
            return new SecureTelnetProtocol(context);
        }
        catch (SSLException | IllegalArgumentException e) {
            throw new ConfigurationException("Couldn't load TLS certificate " + tls.certificateFile() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast("ssl", sslContext.newHandler(pipeline.channel().alloc()));
        super.configurePipeline(pipeline);
    }
}
