package org.neuralchilli.rasterindex.core;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.rasterindex.domain.IndexFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of named index formulas, built once at startup and shared
 * read-only by every resolution.
 *
 * Construction validates the {@code func_index} reference graph with JGraphT:
 * every referenced name must exist and the graph must be acyclic.
 */
public final class FormulaLibrary {

    private static final Logger log = LoggerFactory.getLogger(FormulaLibrary.class);

    private final Map<String, IndexFormula> formulas;
    private final DirectedAcyclicGraph<String, DefaultEdge> dependencies;

    private FormulaLibrary(
            Map<String, IndexFormula> formulas,
            DirectedAcyclicGraph<String, DefaultEdge> dependencies
    ) {
        this.formulas = formulas;
        this.dependencies = dependencies;
    }

    /**
     * Build a library from formula definitions.
     *
     * @throws FormulaLibraryException on duplicates, dangling references or cycles
     */
    public static FormulaLibrary of(Collection<IndexFormula> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new FormulaLibraryException("Formula library must define at least one formula");
        }

        Map<String, IndexFormula> byName = new LinkedHashMap<>();
        for (IndexFormula formula : definitions) {
            if (byName.putIfAbsent(formula.name(), formula) != null) {
                throw new FormulaLibraryException("Duplicate formula name: " + formula.name());
            }
        }

        DirectedAcyclicGraph<String, DefaultEdge> graph = new DirectedAcyclicGraph<>(DefaultEdge.class);
        byName.keySet().forEach(graph::addVertex);

        List<String> errors = new ArrayList<>();
        for (IndexFormula formula : byName.values()) {
            for (String reference : formula.referencedIndices()) {
                if (!byName.containsKey(reference)) {
                    errors.add("Formula '" + formula.name() + "' references '" + reference +
                            "' which is not defined in the library");
                    continue;
                }

                try {
                    // Edge direction: from referenced formula to the formula using it
                    graph.addEdge(reference, formula.name());
                } catch (IllegalArgumentException e) {
                    throw new FormulaLibraryException(
                            "Reference '" + reference + "' -> '" + formula.name() +
                                    "' would create a cycle in the formula library", e);
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new FormulaLibraryException("Formula library validation failed:\n" +
                    String.join("\n", errors));
        }

        log.debug("Formula library built: {} formulas, {} references",
                graph.vertexSet().size(), graph.edgeSet().size());

        return new FormulaLibrary(Collections.unmodifiableMap(byName), graph);
    }

    public static FormulaLibrary of(Map<String, String> templates) {
        List<IndexFormula> definitions = new ArrayList<>();
        templates.forEach((name, template) -> definitions.add(new IndexFormula(name, template)));
        return of(definitions);
    }

    public boolean contains(String name) {
        return formulas.containsKey(name);
    }

    public Optional<IndexFormula> find(String name) {
        return Optional.ofNullable(formulas.get(name));
    }

    /**
     * Raw, unexpanded template of a formula.
     *
     * @throws FormulaException if the name is not defined
     */
    public String template(String name) {
        IndexFormula formula = formulas.get(name);
        if (formula == null) {
            throw new FormulaException("Unknown index formula: " + name);
        }
        return formula.template();
    }

    /**
     * Names in definition order.
     */
    public Set<String> names() {
        return formulas.keySet();
    }

    public Collection<IndexFormula> formulas() {
        return formulas.values();
    }

    public int size() {
        return formulas.size();
    }

    /**
     * All formulas the given one expands through, directly or transitively,
     * in an order where each dependency precedes its dependents.
     */
    public List<String> dependenciesOf(String name) {
        if (!contains(name)) {
            throw new FormulaException("Unknown index formula: " + name);
        }

        Set<String> ancestors = dependencies.getAncestors(name);
        List<String> ordered = new ArrayList<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator = new TopologicalOrderIterator<>(dependencies);
        while (iterator.hasNext()) {
            String next = iterator.next();
            if (ancestors.contains(next)) {
                ordered.add(next);
            }
        }
        return ordered;
    }

    /**
     * Longest {@code func_index} chain in the library, counted in formulas.
     * A flat formula has depth 1.
     */
    public int maxReferenceDepth() {
        Map<String, Integer> depth = new LinkedHashMap<>();
        TopologicalOrderIterator<String, DefaultEdge> iterator = new TopologicalOrderIterator<>(dependencies);
        int max = 0;
        while (iterator.hasNext()) {
            String name = iterator.next();
            int own = dependencies.incomingEdgesOf(name).stream()
                    .map(dependencies::getEdgeSource)
                    .mapToInt(source -> depth.getOrDefault(source, 1))
                    .max()
                    .orElse(0) + 1;
            depth.put(name, own);
            max = Math.max(max, own);
        }
        return max;
    }
}
