package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.model.Kline;

/**
 * One classified inbound stream frame. {@code kline} is set only for {@link FrameType#KLINE}.
 */
public record KlineFrame(FrameType type, Kline kline, String detail) {

    public enum FrameType {
        KLINE,
        SUBSCRIPTION_ACK,
        ERROR
    }

    public static KlineFrame kline(Kline kline) {
        return new KlineFrame(FrameType.KLINE, kline, null);
    }

    public static KlineFrame ack(String detail) {
        return new KlineFrame(FrameType.SUBSCRIPTION_ACK, null, detail);
    }

    public static KlineFrame error(String detail) {
        return new KlineFrame(FrameType.ERROR, null, detail);
    }
}
