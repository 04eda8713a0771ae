package com.controls.cdl.validation;

/** How serious a validation finding is. Only errors block initialization. */
public enum Severity {
    ERROR,
    WARNING
}
