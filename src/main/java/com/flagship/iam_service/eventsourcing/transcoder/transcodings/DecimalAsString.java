package com.flagship.iam_service.eventsourcing.transcoder.transcodings;

import com.flagship.iam_service.eventsourcing.transcoder.Transcoding;

import java.math.BigDecimal;

/**
 * BigDecimal as its canonical string, keeping scale.
 */
public class DecimalAsString implements Transcoding<BigDecimal> {

    @Override
    public Class<BigDecimal> type() {
        return BigDecimal.class;
    }

    @Override
    public String name() {
        return "decimal_str";
    }

    @Override
    public Object encode(BigDecimal value) {
        return value.toString();
    }

    @Override
    public BigDecimal decode(Object data) {
        return new BigDecimal((String) data);
    }
}
