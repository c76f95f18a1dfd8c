package com.sentrius.props;

import com.sentrius.props.model.NamedRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleSpecParserTest {

    @Test
    void testParseNameOnly() throws RuleParseException {
        NamedRule rule = RuleSpecParser.parse("numeric");

        assertEquals("numeric", rule.getName());
        assertEquals("Numeric", rule.getNormalizedName());
        assertTrue(rule.getArguments().isEmpty());
    }

    @Test
    void testParseArguments() throws RuleParseException {
        NamedRule rule = RuleSpecParser.parse("in:a,b,c");

        assertEquals("in", rule.getName());
        assertEquals(List.of("a", "b", "c"), rule.getArguments());
    }

    @Test
    void testParseSingleArgument() throws RuleParseException {
        NamedRule rule = RuleSpecParser.parse("date_format:Y-m-d");

        assertEquals("date_format", rule.getName());
        assertEquals("DateFormat", rule.getNormalizedName());
        assertEquals(List.of("Y-m-d"), rule.getArguments());
    }

    @Test
    void testLaterColonsBelongToArgument() throws RuleParseException {
        NamedRule rule = RuleSpecParser.parse("dateFormat:H:i:s");

        assertEquals(List.of("H:i:s"), rule.getArguments());
    }

    @Test
    void testEmptyArgumentsArePreserved() throws RuleParseException {
        NamedRule rule = RuleSpecParser.parse("in:a,,b");

        assertEquals(List.of("a", "", "b"), rule.getArguments());
    }

    @Test
    void testTrailingColonGivesOneEmptyArgument() throws RuleParseException {
        NamedRule rule = RuleSpecParser.parse("in:");

        assertEquals(List.of(""), rule.getArguments());
    }

    @Test
    void testArgumentsAreNotTrimmed() throws RuleParseException {
        NamedRule rule = RuleSpecParser.parse(" in :a, b");

        assertEquals("in", rule.getName());
        assertEquals(List.of("a", " b"), rule.getArguments());
    }

    @Test
    void testMarkers() throws RuleParseException {
        assertTrue(RuleSpecParser.parse("required").isRequired());
        assertTrue(RuleSpecParser.parse("Required").isMarker());
        assertTrue(RuleSpecParser.parse("nullable").isNullable());
        assertFalse(RuleSpecParser.parse("notNull").isMarker());
    }

    @Test
    void testEmptyNotationFails() {
        RuleParseException e = assertThrows(RuleParseException.class, () -> RuleSpecParser.parse(""));
        assertEquals("", e.getNotation());
    }

    @Test
    void testMissingNameFails() {
        assertThrows(RuleParseException.class, () -> RuleSpecParser.parse(":a,b"));
    }

    @Test
    void testBlankNameFails() {
        assertThrows(RuleParseException.class, () -> RuleSpecParser.parse("   :a"));
    }

    @Test
    void testNullNotationFails() {
        assertThrows(RuleParseException.class, () -> RuleSpecParser.parse(null));
    }
}
