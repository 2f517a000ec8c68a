package com.pulse.transport.webrtc;

import com.pulse.transport.DataChannel;
import com.pulse.transport.DataChannelObserver;
import com.pulse.transport.TransportException;
import dev.onvoid.webrtc.RTCDataChannel;
import dev.onvoid.webrtc.RTCDataChannelBuffer;
import dev.onvoid.webrtc.RTCDataChannelObserver;
import dev.onvoid.webrtc.RTCDataChannelState;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * {@link RTCDataChannel}을 텍스트 채널로 감싼다.
 */
class WebRtcDataChannel implements DataChannel {

    private final RTCDataChannel channel;

    WebRtcDataChannel(RTCDataChannel channel) {
        this.channel = channel;
    }

    @Override
    public String getLabel() {
        return channel.getLabel();
    }

    @Override
    public boolean isOpen() {
        return channel.getState() == RTCDataChannelState.OPEN;
    }

    @Override
    public void send(String text) {
        if (!isOpen()) {
            throw new TransportException("Data channel " + getLabel() + " is not open");
        }
        ByteBuffer data = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
        try {
            channel.send(new RTCDataChannelBuffer(data, false));
        } catch (Exception ex) {
            throw new TransportException("Failed to send on data channel " + getLabel(), ex);
        }
    }

    @Override
    public void registerObserver(DataChannelObserver observer) {
        channel.registerObserver(new RTCDataChannelObserver() {
            @Override
            public void onBufferedAmountChange(long previousAmount) {
            }

            @Override
            public void onStateChange() {
                RTCDataChannelState state = channel.getState();
                if (state == RTCDataChannelState.OPEN) {
                    observer.onOpen();
                } else if (state == RTCDataChannelState.CLOSED) {
                    observer.onClose();
                }
            }

            @Override
            public void onMessage(RTCDataChannelBuffer buffer) {
                if (buffer.binary) {
                    observer.onError("Unexpected binary frame on " + getLabel());
                    return;
                }
                ByteBuffer data = buffer.data;
                byte[] bytes = new byte[data.remaining()];
                data.get(bytes);
                observer.onMessage(new String(bytes, StandardCharsets.UTF_8));
            }
        });
    }

    @Override
    public void close() {
        channel.unregisterObserver();
        channel.close();
    }
}
