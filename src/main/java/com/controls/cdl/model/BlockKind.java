package com.controls.cdl.model;

/**
 * Discriminates blocks whose behavior comes from a registered implementation
 * from blocks defined by a wired sub-graph of child instances.
 */
public enum BlockKind {
    ELEMENTARY,
    COMPOSITE
}
