package com.sentrius.props.profiles;

import com.sentrius.props.RuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class StandardRuleProfileTest {

    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = StandardRuleProfile.createRegistry();
    }

    @Test
    void testRegistryHasAllRules() {
        assertEquals(14, registry.size());
    }

    @Test
    void testRegistryContainsEachRule() {
        for (String rule : StandardRuleProfile.getRuleNames()) {
            assertTrue(registry.has(rule), "Missing rule: " + rule);
        }
    }

    @Test
    void testCreateRegistryReturnsNewInstance() {
        RuleRegistry r1 = StandardRuleProfile.createRegistry();
        RuleRegistry r2 = StandardRuleProfile.createRegistry();
        assertNotSame(r1, r2);
    }

    static Stream<Arguments> passingValues() {
        return Stream.of(
            Arguments.of("numeric", List.of(), 12),
            Arguments.of("numeric", List.of(), 12.5),
            Arguments.of("numeric", List.of(), "12.52"),
            Arguments.of("numeric", List.of(), "-1e3"),
            Arguments.of("numeric", List.of(), new BigDecimal("0.1")),
            Arguments.of("int", List.of(), 100),
            Arguments.of("int", List.of(), 100L),
            Arguments.of("int", List.of(), 100.0),
            Arguments.of("int", List.of(), "42"),
            Arguments.of("notNull", List.of(), 0),
            Arguments.of("notNull", List.of(), ""),
            Arguments.of("notEmpty", List.of(), "x"),
            Arguments.of("notEmpty", List.of(), 0),
            Arguments.of("date", List.of(), "2021-01-01 01:00:00"),
            Arguments.of("date", List.of(), "1970-01-01"),
            Arguments.of("date", List.of(), LocalDate.of(2021, 1, 1)),
            Arguments.of("dateFormat", List.of("Y-m-d"), "2021-10-01"),
            Arguments.of("dateFormat", List.of("d/m/Y H:i"), "01/10/2021 13:45"),
            Arguments.of("string", List.of(), "text"),
            Arguments.of("string", List.of(), ""),
            Arguments.of("email", List.of(), "testing@email.com"),
            Arguments.of("email", List.of(), "first.last+tag@sub.example.org"),
            Arguments.of("in", List.of("a", "b", "c"), "a"),
            Arguments.of("in", List.of("1", "2", "3"), 1),
            Arguments.of("in", List.of("1", "2", "3"), "2"),
            Arguments.of("in", List.of("1", "2", "3"), 3.0),
            Arguments.of("greaterThan", List.of("0"), 1),
            Arguments.of("greaterThan", List.of("0"), 1.1),
            Arguments.of("greaterThan", List.of("0"), "0.5"),
            Arguments.of("greaterThanEqual", List.of("10"), 10),
            Arguments.of("lessThan", List.of("10"), 9.99),
            Arguments.of("lessThanEqual", List.of("10"), 10),
            Arguments.of("lessThanEqual", List.of("-1"), -5),
            Arguments.of("uuid", List.of(), "123e4567-e89b-12d3-a456-426614174000"),
            Arguments.of("uuid", List.of(), "123E4567-E89B-12D3-A456-426614174000"),
            Arguments.of("in", List.of("1e9999999999", "a"), "a")
        );
    }

    @ParameterizedTest
    @MethodSource("passingValues")
    void testRulePasses(String rule, List<String> args, Object value) {
        assertTrue(registry.resolve(rule).test(value, args),
            "Expected rule " + rule + args + " to accept " + value);
    }

    static Stream<Arguments> failingValues() {
        return Stream.of(
            Arguments.of("numeric", List.of(), "abc"),
            Arguments.of("numeric", List.of(), "12abc"),
            Arguments.of("numeric", List.of(), List.of("123", "abc")),
            Arguments.of("numeric", List.of(), true),
            Arguments.of("numeric", List.of(), null),
            Arguments.of("numeric", List.of(), Double.NaN),
            Arguments.of("numeric", List.of(), "1e9999999999"),
            Arguments.of("int", List.of(), 125.25),
            Arguments.of("int", List.of(), "12.5"),
            Arguments.of("int", List.of(), "abc"),
            Arguments.of("int", List.of(), null),
            Arguments.of("int", List.of(), "1e9999999999"),
            Arguments.of("notNull", List.of(), null),
            Arguments.of("notEmpty", List.of(), ""),
            Arguments.of("notEmpty", List.of(), null),
            Arguments.of("date", List.of(), "Not a date"),
            Arguments.of("date", List.of(), null),
            Arguments.of("date", List.of(), 12),
            Arguments.of("dateFormat", List.of("Y-m-d"), "01-10-2021"),
            Arguments.of("dateFormat", List.of("Y-m-d"), "2021-1-1"),
            Arguments.of("dateFormat", List.of("Y-m-d"), "2021-02-30"),
            Arguments.of("dateFormat", List.of("Y-m-d"), 20211001),
            Arguments.of("string", List.of(), 123),
            Arguments.of("string", List.of(), null),
            Arguments.of("email", List.of(), "testingemail.com"),
            Arguments.of("email", List.of(), "user@localhost"),
            Arguments.of("email", List.of(), "a..b@example.com"),
            Arguments.of("email", List.of(), 42),
            Arguments.of("in", List.of("a", "b", "c"), "d"),
            Arguments.of("in", List.of("1", "2", "3"), 4),
            Arguments.of("in", List.of(), "a"),
            Arguments.of("in", List.of("1e9999999999"), "1"),
            Arguments.of("greaterThan", List.of("0"), 0),
            Arguments.of("greaterThan", List.of("0"), "test"),
            Arguments.of("greaterThan", List.of("0"), null),
            Arguments.of("greaterThan", List.of("zero"), 5),
            Arguments.of("greaterThan", List.of("0"), "1e9999999999"),
            Arguments.of("greaterThanEqual", List.of("10"), 9),
            Arguments.of("lessThan", List.of("10"), 10),
            Arguments.of("lessThan", List.of("10"), "test"),
            Arguments.of("lessThanEqual", List.of("10"), 10.01),
            Arguments.of("uuid", List.of(), "123e4567e89b12d3a456426614174000"),
            Arguments.of("uuid", List.of(), "123e4567-e89b-12d3-a456-42661417400g"),
            Arguments.of("uuid", List.of(), null)
        );
    }

    @ParameterizedTest
    @MethodSource("failingValues")
    void testRuleFails(String rule, List<String> args, Object value) {
        assertFalse(registry.resolve(rule).test(value, args),
            "Expected rule " + rule + args + " to reject " + value);
    }

    @Test
    void testComparisonWithoutArgumentIsAConfigurationError() {
        assertThrows(IllegalArgumentException.class,
            () -> registry.resolve("greaterThan").test(1, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class,
            () -> registry.resolve("dateFormat").test("2021-10-01", Collections.emptyList()));
    }

    @Test
    void testRegisterIntoExistingRegistryKeepsCustomRules() {
        RuleRegistry custom = new RuleRegistry();
        custom.register("even", (value, args) -> value instanceof Integer && (Integer) value % 2 == 0);

        StandardRuleProfile.register(custom, new com.sentrius.props.DateParser());

        assertEquals(15, custom.size());
        assertTrue(custom.has("even"));
        assertTrue(custom.has("uuid"));
    }
}
