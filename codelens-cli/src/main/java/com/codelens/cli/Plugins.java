package com.codelens.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;

/**
 * ServiceLoader lookups for generator and renderer plugins.
 */
final class Plugins {

    private static final Logger log = LoggerFactory.getLogger(Plugins.class);

    private Plugins() {
        // Utility class
    }

    static <T> List<T> discover(Class<T> type) {
        List<T> plugins = new ArrayList<>();
        ServiceLoader.load(type).forEach(plugins::add);
        log.debug("Discovered {} {} implementations", plugins.size(), type.getSimpleName());
        return plugins;
    }

    static <T> Optional<T> find(Class<T> type, Function<T, String> idOf, String id) {
        return discover(type).stream()
            .filter(plugin -> idOf.apply(plugin).equals(id))
            .findFirst();
    }
}
