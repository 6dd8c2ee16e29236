package com.testflow.action;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Discovers and holds every {@link Action} type.
 *
 * At construction time the registry:
 *   1. Uses the Reflections library to scan the given packages (the built-in
 *      {@code com.testflow.action} tree by default)
 *   2. Finds every class annotated with {@link ActionDefinition}
 *   3. Checks it implements {@link Action} and has a no-arg constructor
 *   4. Registers it under the annotation's type name
 *
 * Adding an action type requires only an annotated class in a scanned package.
 * Actions are stateful, so {@link #create} returns a new instance on every call.
 *
 * Duplicate type names cause an {@link IllegalStateException} at startup so the
 * conflict is never silent.
 */
public class ActionTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionTypeRegistry.class);
    public  static final String BUILT_IN_PACKAGE = "com.testflow.action";

    private final Map<String, ActionTemplate>                 byType  = new HashMap<>();
    private final Map<Class<? extends Action>, ActionTemplate> byClass = new HashMap<>();

    public ActionTypeRegistry() {
        this(BUILT_IN_PACKAGE);
    }

    public ActionTypeRegistry(String... packages) {
        for (String pkg : packages) {
            discoverAndRegister(pkg);
        }
        log.info("ActionTypeRegistry: {} action type(s) registered", byType.size());
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    /** Creates a fresh, READY instance of the given type, or empty if the type is unknown. */
    public Optional<Action> create(String type) {
        ActionTemplate template = byType.get(type);
        if (template == null) return Optional.empty();
        return Optional.of(instantiate(template.actionClass()));
    }

    public Optional<ActionTemplate> find(String type) {
        return Optional.ofNullable(byType.get(type));
    }

    /** The registered type name of {@code action}'s class. */
    public Optional<String> typeOf(Action action) {
        ActionTemplate template = byClass.get(action.getClass());
        return template != null ? Optional.of(template.type()) : Optional.empty();
    }

    public boolean hasType(String type) {
        return byType.containsKey(type);
    }

    public Set<String> getTypes() {
        return new TreeSet<>(byType.keySet());
    }

    public int size() {
        return byType.size();
    }

    /**
     * The action catalogue: templates grouped by category, categories and the types
     * within them in alphabetical order.
     */
    public Map<String, List<ActionTemplate>> getCatalogue() {
        Map<String, List<ActionTemplate>> catalogue = new LinkedHashMap<>();
        byType.values().stream()
            .sorted(Comparator.comparing(ActionTemplate::category).thenComparing(ActionTemplate::type))
            .forEach(t -> catalogue.computeIfAbsent(t.category(), c -> new ArrayList<>()).add(t));
        return catalogue;
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private void discoverAndRegister(String pkg) {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(pkg)
                .setScanners(Scanners.TypesAnnotated)
        );

        for (Class<?> cls : reflections.getTypesAnnotatedWith(ActionDefinition.class)) {
            ActionDefinition definition = cls.getAnnotation(ActionDefinition.class);
            String type = definition.type();

            if (!Action.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @ActionDefinition(type = \"" + type +
                    "\") but does not implement Action");
            }
            if (byType.containsKey(type)) {
                if (byType.get(type).actionClass() == cls) continue;  // overlapping scan packages
                throw new IllegalStateException(
                    "Duplicate action type '" + type + "': " +
                    byType.get(type).actionClass().getName() + " and " + cls.getName());
            }

            @SuppressWarnings("unchecked")
            Class<? extends Action> actionClass = (Class<? extends Action>) cls;
            instantiate(actionClass);  // fail at startup, not on first use

            ActionTemplate template = new ActionTemplate(
                type, definition.category(), definition.description(), actionClass);
            byType.put(type, template);
            byClass.put(actionClass, template);
            log.debug("ActionTypeRegistry: registered {} -> {}", type, cls.getSimpleName());
        }
    }

    private static Action instantiate(Class<? extends Action> cls) {
        try {
            Constructor<? extends Action> constructor = cls.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(
                "Failed to instantiate action " + cls.getName() + "; a no-arg constructor is required", e);
        }
    }
}
