package com.adinsight.anomaly.model;

/**
 * The three expected-change ranges the market calendar publishes per event.
 * Every metric maps onto one of them.
 */
public enum ExpectedChangeKey {
    SPEND,
    CONVERSION,
    CTR
}
