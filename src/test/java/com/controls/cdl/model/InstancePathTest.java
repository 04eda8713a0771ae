package com.controls.cdl.model;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class InstancePathTest {

    @Test
    public void testParseAndChild() {
        InstancePath p = InstancePath.parse("model.controller.gain");
        assertEquals(3, p.depth());
        assertEquals("gain", p.name());
        assertEquals(List.of("model", "controller", "gain"), p.segments());
        assertEquals(InstancePath.root("model").child("controller").child("gain"), p);
        assertEquals("model.controller.gain", p.toString());
    }

    @Test
    public void testParent() {
        InstancePath p = InstancePath.parse("a.b.c");
        assertEquals(InstancePath.parse("a.b"), p.parent());
        assertNull(InstancePath.root("a").parent());
        assertTrue(InstancePath.root("a").isRoot());
        assertFalse(p.isRoot());
    }

    @Test
    public void testContains() {
        InstancePath a = InstancePath.parse("a");
        InstancePath ab = InstancePath.parse("a.b");
        InstancePath abc = InstancePath.parse("a.b.c");
        assertTrue(a.contains(abc));
        assertTrue(ab.contains(ab));
        assertFalse(abc.contains(ab));
        assertFalse(InstancePath.parse("a.bb").contains(abc));
        assertEquals("b", a.childSegmentTowards(abc));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testChildSegmentTowardsSelfRejected() {
        InstancePath a = InstancePath.root("a");
        a.childSegmentTowards(a);
    }

    @Test
    public void testSameDefinitionDifferentPathsDoNotAlias() {
        InstancePath left = InstancePath.parse("m.left.acc");
        InstancePath right = InstancePath.parse("m.right.acc");
        assertNotEquals(left, right);
        assertEquals(left.name(), right.name());
    }

    @Test
    public void testInvalidNames() {
        for (String bad : new String[] { "", " ", "a..b" }) {
            try {
                InstancePath.parse(bad);
                fail("Expected IllegalArgumentException for '" + bad + "'");
            } catch (IllegalArgumentException expected) {
                // rejected
            }
        }
        try {
            InstancePath.root("a").child("b.c");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // dots are separators
        }
    }
}
