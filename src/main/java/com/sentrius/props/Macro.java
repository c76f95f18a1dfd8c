package com.sentrius.props;

/**
 * A method added to every container at runtime. The container it is called
 * on is passed as the first argument.
 */
@FunctionalInterface
public interface Macro {
    Object invoke(PropertyContainer container, Object... arguments);
}
