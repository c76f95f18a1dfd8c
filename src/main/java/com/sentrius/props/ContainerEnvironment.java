package com.sentrius.props;

import com.sentrius.props.profiles.StandardRuleProfile;

/**
 * The collaborators a container works with: rule registry, macro registry and
 * date parser. Containers created without an explicit environment use
 * {@link #global()}.
 */
public class ContainerEnvironment {
    private final RuleRegistry ruleRegistry;
    private final MacroRegistry macroRegistry;
    private final DateParser dateParser;
    private final RuleEngine ruleEngine;
    private final AccessorResolver accessorResolver;

    private ContainerEnvironment(Builder builder) {
        this.dateParser = builder.dateParser != null ? builder.dateParser : new DateParser();
        this.ruleRegistry = builder.ruleRegistry != null
            ? builder.ruleRegistry
            : StandardRuleProfile.createRegistry(dateParser);
        this.macroRegistry = builder.macroRegistry != null ? builder.macroRegistry : new MacroRegistry();
        this.ruleEngine = new RuleEngine(ruleRegistry);
        this.accessorResolver = new AccessorResolver(macroRegistry, dateParser);
    }

    /**
     * The process-wide environment: built-in rules, the global macro registry, UTC dates.
     */
    public static ContainerEnvironment global() {
        return GlobalHolder.INSTANCE;
    }

    public RuleRegistry getRuleRegistry() {
        return ruleRegistry;
    }

    public MacroRegistry getMacroRegistry() {
        return macroRegistry;
    }

    public DateParser getDateParser() {
        return dateParser;
    }

    public RuleEngine getRuleEngine() {
        return ruleEngine;
    }

    public AccessorResolver getAccessorResolver() {
        return accessorResolver;
    }

    private static class GlobalHolder {
        static final ContainerEnvironment INSTANCE = new Builder()
            .macroRegistry(MacroRegistry.global())
            .build();
    }

    /**
     * Builder for ContainerEnvironment. Unset collaborators get fresh defaults.
     */
    public static class Builder {
        private RuleRegistry ruleRegistry;
        private MacroRegistry macroRegistry;
        private DateParser dateParser;

        public Builder ruleRegistry(RuleRegistry ruleRegistry) {
            this.ruleRegistry = ruleRegistry;
            return this;
        }

        public Builder macroRegistry(MacroRegistry macroRegistry) {
            this.macroRegistry = macroRegistry;
            return this;
        }

        public Builder dateParser(DateParser dateParser) {
            this.dateParser = dateParser;
            return this;
        }

        public ContainerEnvironment build() {
            return new ContainerEnvironment(this);
        }
    }

    @Override
    public String toString() {
        return "ContainerEnvironment{rules=" + ruleRegistry.size() +
               ", macros=" + macroRegistry.size() +
               ", zone=" + dateParser.getZone() + '}';
    }
}
