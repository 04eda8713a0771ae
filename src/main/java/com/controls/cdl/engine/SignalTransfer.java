package com.controls.cdl.engine;

import com.controls.cdl.model.DataType;
import com.controls.cdl.model.SignalKey;

/**
 * A resolved connection: copy the value at {@code source} to
 * {@code destination}, converting when the connector types differ (only when
 * the validator allowed that conversion).
 */
record SignalTransfer(SignalKey source, DataType sourceType, SignalKey destination, DataType destinationType) {

    Object transfer(Object value) {
        return sourceType == destinationType ? value : sourceType.convert(value, destinationType);
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
