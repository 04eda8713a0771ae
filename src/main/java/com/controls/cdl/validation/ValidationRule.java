package com.controls.cdl.validation;

/** The structural and semantic rules the validator checks. */
public enum ValidationRule {
    /** A child input is the destination of no connection. */
    UNCONNECTED_INPUT,
    /** A connector is the destination of more than one connection. */
    MULTIPLE_ASSIGNMENT,
    /** Connected connectors have different types and no allowed conversion. */
    TYPE_MISMATCH,
    /** Children depend on each other in a cycle. */
    ALGEBRAIC_LOOP,
    /** An elementary block type has no registered implementation. */
    UNKNOWN_BLOCK_TYPE,
    /** A required parameter has neither a default nor an override. */
    MISSING_PARAMETER,
    /** A connection or override names an instance, connector or parameter that does not exist. */
    DANGLING_REFERENCE,
    /** Two children, connectors or parameters of one block share a name. */
    DUPLICATE_NAME,
    /** A connection has a shape or causality the language does not allow. */
    ILLEGAL_CONNECTION,
    /** A composite output is not driven by a child output. */
    UNDRIVEN_OUTPUT,
    /** A parameter value does not have the parameter's type. */
    PARAMETER_TYPE,
    /** A parameter value lies outside the declared bounds. */
    PARAMETER_BOUNDS,
    /** A connector start value has the wrong type, is out of bounds, or is not an allowed literal. */
    START_VALUE,
    /** An input and an output of one block share a name. */
    NAME_CONFLICT,
    /** A composite input feeds nothing. */
    UNUSED_INPUT
}
