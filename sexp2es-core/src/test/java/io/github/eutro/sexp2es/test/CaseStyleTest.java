package io.github.eutro.sexp2es.test;

import io.github.eutro.sexp2es.core.support.CaseStyle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CaseStyleTest {
    @Test
    void testKebabToCamel() {
        assertEquals("aBC", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, "a-b-c"));
        assertEquals("createServer", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, "create-server"));
    }

    @Test
    void testEmptyWords() {
        assertEquals("fooBar", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, "foo--bar"));
        assertEquals("fooBar", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, "foo-bar-"));
        assertEquals("", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, ""));
    }

    @Test
    void testLeadingEmptyWordIsTheFirst() {
        // only the word at index 0 is left alone, even when it is empty
        assertEquals("Foo", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, "-foo"));
        assertEquals("ToX", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, "-to-x"));
    }

    @Test
    void testFirstWordUnchanged() {
        assertEquals("FooBar", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, "Foo-bar"));
        assertEquals("fooBAR", CaseStyle.KEBAB.convertTo(CaseStyle.CAMEL, "foo-bAR"));
    }

    @Test
    void testSplitKeepsTrailingWords() {
        assertArrayEquals(new String[]{"a", "", ""}, CaseStyle.KEBAB.splitToWords("a--"));
    }

    @Test
    void testSameStyleIsIdentity() {
        assertEquals("any-THING_", CaseStyle.KEBAB.convertTo(CaseStyle.KEBAB, "any-THING_"));
    }

    @Test
    void testCamelDoesNotSplit() {
        assertThrows(UnsupportedOperationException.class, () -> CaseStyle.CAMEL.convertTo(CaseStyle.KEBAB, "fooBar"));
    }
}
