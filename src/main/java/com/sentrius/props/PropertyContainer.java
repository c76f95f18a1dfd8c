package com.sentrius.props;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZonedDateTime;
import java.util.*;
import java.util.function.Supplier;

/**
 * A data holder whose properties are declared ad hoc.
 * <p>
 * Subtypes describe themselves by overriding:
 * <ul>
 *   <li>{@link #rules()} - validation rules applied whenever data is filled in,</li>
 *   <li>{@link #dateProperties()} - properties read back as {@link ZonedDateTime},</li>
 *   <li>{@link #accessors()} - computed properties that shadow stored ones.</li>
 * </ul>
 * {@link #rules()} is consulted from the constructor, so it must not depend on
 * instance fields of the subtype; return a static constant.
 * <p>
 * Instances are not thread-safe.
 */
public class PropertyContainer {
    private static final Logger log = LoggerFactory.getLogger(PropertyContainer.class);

    private static final ObjectMapper JSON = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();

    private final ContainerEnvironment environment;
    private final PropertyStore properties = new MapPropertyStore();

    public PropertyContainer() {
        this(Collections.emptyMap());
    }

    public PropertyContainer(Map<String, ?> data) {
        this(ContainerEnvironment.global(), data);
    }

    public PropertyContainer(ContainerEnvironment environment, Map<String, ?> data) {
        if (environment == null) {
            throw new IllegalArgumentException("Environment cannot be null");
        }
        this.environment = environment;
        fill(data);
    }

    public static PropertyContainer make(Map<String, ?> data) {
        return new PropertyContainer(data);
    }

    /**
     * Add a method callable on every container through {@link #call(String, Object...)}.
     * @param name The method name
     * @param macro The method body; receives the container as first argument
     */
    public static void macro(String name, Macro macro) {
        MacroRegistry.global().register(name, macro);
    }

    /**
     * Validate the data against {@link #rules()}, then store every entry.
     * Nothing is stored if validation fails. Entries without declared rules
     * are stored unvalidated.
     * @param data The properties to store
     * @return this container
     * @throws IllegalArgumentException if the data contains a null property name
     * @throws PropertyValidationException if a property fails validation
     * @throws UnknownRuleException if a declared rule is not registered
     */
    public PropertyContainer fill(Map<String, ?> data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        for (String property : data.keySet()) {
            if (property == null) {
                throw new IllegalArgumentException("Property name cannot be null");
            }
        }

        RuleEngine.ValidationResult result = environment.getRuleEngine().validate(rules(), data);
        if (!result.isValid()) {
            log.debug("Rejected data for {}: {}", getClass().getSimpleName(), result.getErrorMessage());
            throw result.toException();
        }

        for (Map.Entry<String, ?> entry : data.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }

        return this;
    }

    /**
     * Get a property, through its computed accessor or macro if one exists.
     * @param property The property name
     * @return The resolved value, or null if the property is not set
     */
    public Object get(String property) {
        return environment.getAccessorResolver().resolve(this, property);
    }

    /**
     * Get the stored value of a property, bypassing accessors, macros and date conversion.
     */
    public Object getRaw(String property) {
        return properties.get(property);
    }

    /**
     * Get the stored value of a property parsed as a date.
     * @return The date, or null if the property is not set
     * @throws java.time.format.DateTimeParseException if the stored value is not a date
     */
    public ZonedDateTime getDate(String property) {
        if (doesNotHave(property)) {
            return null;
        }
        return environment.getDateParser().parse(properties.get(property));
    }

    public PropertyContainer set(String property, Object value) {
        properties.set(property, value);
        return this;
    }

    /**
     * Check if a property is set to a non-null value.
     */
    public boolean has(String property) {
        return properties.has(property);
    }

    public boolean doesNotHave(String property) {
        return !has(property);
    }

    /**
     * Make the container forget a property. Forgetting an unset property does nothing.
     */
    public PropertyContainer forget(String property) {
        properties.forget(property);
        return this;
    }

    public boolean hasMacro(String name) {
        return environment.getMacroRegistry().has(name);
    }

    /**
     * Call a method by name: a computed accessor getter such as {@code getFullName}
     * when called without arguments, otherwise a registered macro.
     * @throws UnknownMethodException if neither exists
     */
    public Object call(String method, Object... arguments) {
        if (arguments.length == 0) {
            Supplier<?> accessor = environment.getAccessorResolver().findAccessor(this, method);
            if (accessor != null) {
                return accessor.get();
            }
        }
        return environment.getMacroRegistry().invoke(this, method, arguments);
    }

    /**
     * Fill this container with the properties of another, overwriting on conflict.
     * The other container's properties are validated against this container's rules.
     */
    public PropertyContainer merge(PropertyContainer container) {
        return fill(container.toMap());
    }

    /**
     * @return A copy of the stored properties, without accessors or date conversion
     */
    public Map<String, Object> toMap() {
        return properties.asMap();
    }

    /**
     * @return The stored properties as JSON
     */
    public String toJson() {
        try {
            return JSON.writeValueAsString(properties.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to convert " + getClass().getSimpleName() + " to JSON", e);
        }
    }

    public ContainerEnvironment getEnvironment() {
        return environment;
    }

    /**
     * The validation rules of this container type.
     */
    protected RuleSet rules() {
        return RuleSet.empty();
    }

    /**
     * Properties converted to {@link ZonedDateTime} by {@link #get(String)}.
     */
    protected Set<String> dateProperties() {
        return Collections.emptySet();
    }

    /**
     * Computed properties, keyed by property name. A computed property is
     * returned by {@link #get(String)} instead of any stored value.
     */
    protected Map<String, Supplier<?>> accessors() {
        return Collections.emptyMap();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + properties.asMap();
    }
}
