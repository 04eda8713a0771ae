package com.controls.cdl.model;

/** Direction of a connector relative to the block that declares it. */
public enum Causality {
    INPUT,
    OUTPUT
}
