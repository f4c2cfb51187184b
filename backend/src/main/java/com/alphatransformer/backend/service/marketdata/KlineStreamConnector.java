package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.exception.StreamConnectionException;

public interface KlineStreamConnector {

    KlineStreamConnection connect(String url) throws StreamConnectionException;
}
