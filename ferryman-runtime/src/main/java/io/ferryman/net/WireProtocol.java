/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.net;

import io.netty.channel.ChannelPipeline;

import io.ferryman.session.Capabilities;

/**
 * A client-facing wire protocol the gateway can listen with.
 *
 * <p>An implementation decodes the raw socket into one {@link io.netty.buffer.ByteBuf} per
 * unit of client input (a line, a websocket frame) and encodes {@code ByteBuf} output back
 * onto the wire. The gateway appends its own session handler after whatever
 * {@link #configurePipeline(ChannelPipeline)} installs and never sees protocol framing.</p>
 *
 * <p>One instance is created per configured listener by {@link WireProtocolRegistry}, so
 * implementations may hold listener-scoped resources such as a TLS context.</p>
 */
public interface WireProtocol {

    /**
     * @return protocol name, recorded on every session created by this protocol
     */
    String name();

    /**
     * @return capabilities assumed for a new client before any negotiation
     */
    Capabilities defaultCapabilities();

    /**
     * Install the protocol's decoders and encoders on a freshly accepted client channel.
     *
     * @param pipeline the client channel's pipeline
     */
    void configurePipeline(ChannelPipeline pipeline);

    /**
     * @return true if a session may be created as soon as the socket is accepted; false if
     *         the protocol must first complete a handshake signalled by {@link #isReadyEvent(Object)}
     */
    default boolean readyOnActive() {
        return true;
    }

    /**
     * @param userEvent a user event fired through the client pipeline
     * @return true if the event completes the protocol handshake
     */
    default boolean isReadyEvent(Object userEvent) {
        return false;
    }

    /**
     * Render a gateway-originated notice, such as "server restarting", for this protocol.
     *
     * @param text notice text
     * @param capabilities the client's capabilities
     * @return encoded notice
     */
    default byte[] formatNotice(String text, Capabilities capabilities) {
        return (text + "\r\n").getBytes(capabilities.encoding());
    }
}
