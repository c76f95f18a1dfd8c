package com.sentrius.props;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ContainerEnvironmentTest {

    @Test
    void testDefaults() {
        ContainerEnvironment environment = new ContainerEnvironment.Builder().build();

        assertEquals(ZoneOffset.UTC, environment.getDateParser().getZone());
        assertTrue(environment.getRuleRegistry().has("email"));
        assertEquals(0, environment.getMacroRegistry().size());
        assertNotSame(MacroRegistry.global(), environment.getMacroRegistry());
        assertSame(environment.getRuleRegistry(), environment.getRuleEngine().getRegistry());
    }

    @Test
    void testGlobalIsASingleton() {
        assertSame(ContainerEnvironment.global(), ContainerEnvironment.global());
    }

    @Test
    void testCustomCollaborators() {
        RuleRegistry rules = new RuleRegistry();
        MacroRegistry macros = new MacroRegistry();
        DateParser dates = new DateParser(ZoneId.of("Asia/Tokyo"));

        ContainerEnvironment environment = new ContainerEnvironment.Builder()
            .ruleRegistry(rules)
            .macroRegistry(macros)
            .dateParser(dates)
            .build();

        assertSame(rules, environment.getRuleRegistry());
        assertSame(macros, environment.getMacroRegistry());
        assertSame(dates, environment.getDateParser());
    }

    @Test
    void testDateRulesUseTheConfiguredParser() {
        ContainerEnvironment environment = new ContainerEnvironment.Builder()
            .dateParser(new DateParser(ZoneId.of("Asia/Tokyo")))
            .build();

        assertTrue(environment.getRuleRegistry().has("date"));
        assertEquals(ZoneId.of("Asia/Tokyo"), environment.getDateParser().getZone());
    }
}
