package com.sentrius.props;

import com.sentrius.props.model.NamedRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RuleSpecVisitor extends RuleNotationBaseVisitor<Object> {

    @Override
    public NamedRule visitNotation(RuleNotationParser.NotationContext ctx) {
        String name = ctx.name.getText().trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Rule name cannot be blank");
        }

        List<String> arguments = Collections.emptyList();
        if (ctx.arguments() != null) {
            arguments = visitArguments(ctx.arguments());
        }

        return new NamedRule(name, NamingUtil.toPascal(name), arguments);
    }

    @Override
    public List<String> visitArguments(RuleNotationParser.ArgumentsContext ctx) {
        List<String> arguments = new ArrayList<>();
        for (RuleNotationParser.ArgumentContext argCtx : ctx.argument()) {
            arguments.add(argCtx.getText());
        }
        return arguments;
    }
}
