package com.pypack.resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Interchangeable variants of one logical extension module, in discovery order.
 * The first variant added is the default.
 */
public final class ExtensionModuleVariants implements Iterable<PythonExtensionModule> {

    private final List<PythonExtensionModule> extensions = new ArrayList<>();

    public ExtensionModuleVariants() {
    }

    public static ExtensionModuleVariants of(PythonExtensionModule... variants) {
        ExtensionModuleVariants v = new ExtensionModuleVariants();
        for (PythonExtensionModule em : variants) v.push(em);
        return v;
    }

    public static ExtensionModuleVariants from(Iterable<PythonExtensionModule> variants) {
        ExtensionModuleVariants v = new ExtensionModuleVariants();
        for (PythonExtensionModule em : variants) v.push(em);
        return v;
    }

    /** Adds a variant after the existing ones. */
    public void push(PythonExtensionModule variant) {
        extensions.add(Objects.requireNonNull(variant, "variant"));
    }

    public boolean isEmpty() {
        return extensions.isEmpty();
    }

    public int size() {
        return extensions.size();
    }

    /**
     * The variant used when no preference applies: the first one added.
     *
     * @throws IllegalStateException if there are no variants
     */
    public PythonExtensionModule defaultVariant() {
        if (extensions.isEmpty()) {
            throw new IllegalStateException("No extension module variants");
        }
        return extensions.get(0);
    }

    /** New group holding the variants matching {@code predicate}, order preserved. */
    public ExtensionModuleVariants filter(Predicate<? super PythonExtensionModule> predicate) {
        ExtensionModuleVariants v = new ExtensionModuleVariants();
        for (PythonExtensionModule em : extensions) {
            if (predicate.test(em)) v.push(em);
        }
        return v;
    }

    /**
     * Chooses one variant. Starts from the default; if {@code preferredVariants} maps this
     * extension's name to a variant name that is present, the first variant with that name wins.
     *
     * @param preferredVariants extension name to preferred variant name
     * @return the chosen variant (never null)
     * @throws IllegalStateException if there are no variants
     */
    public PythonExtensionModule chooseVariant(Map<String, String> preferredVariants) {
        PythonExtensionModule chosen = defaultVariant();
        String preferred = preferredVariants != null ? preferredVariants.get(chosen.getName()) : null;
        if (preferred != null) {
            for (PythonExtensionModule em : extensions) {
                if (preferred.equals(em.getVariant().orElse(null))) {
                    chosen = em;
                    break;
                }
            }
        }
        return chosen;
    }

    public List<PythonExtensionModule> asList() {
        return Collections.unmodifiableList(extensions);
    }

    @Override
    public Iterator<PythonExtensionModule> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return extensions.toString();
    }
}
