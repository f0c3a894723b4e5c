package com.ciflow.matrix;

import com.ciflow.core.ExpansionException;
import com.ciflow.core.JobInstance;
import com.ciflow.core.JobTemplate;
import com.ciflow.core.Matrix;
import com.ciflow.core.RunContext;
import com.ciflow.expr.EvaluationContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Expands a job template bound to a matrix into concrete job instances.
 *
 * <p><b>Algorithm:</b></p>
 * <ol>
 *   <li>Compute the full cartesian product of the axes, in axis order then value order</li>
 *   <li>Drop every combination matched by an exclude entry (all of the entry's keys equal)</li>
 *   <li>Apply include entries: an entry is merged into every combination whose axis values it
 *       does not overwrite; if it fits none, it becomes a combination of its own</li>
 *   <li>Name each combination {@code templateId[axis=value,...]}</li>
 * </ol>
 *
 * <p>The result is deterministic: identical inputs give identical ids in identical order.</p>
 *
 * <p><b>Thread Safety:</b> Stateless and thread-safe.</p>
 */
public class MatrixExpander {
    private static final Logger logger = Logger.getLogger(MatrixExpander.class.getName());

    /** Upper bound on instances produced by one matrix. */
    public static final int MAX_COMBINATIONS = 256;

    /** Upper bound on the raw product before excludes, so oversized matrices fail before allocating. */
    public static final int MAX_PRODUCT = MAX_COMBINATIONS * 16;

    /**
     * Expand without run metadata. Display names may only use {@code matrix.*}.
     *
     * @see #expand(JobTemplate, Matrix, RunContext)
     */
    public List<JobInstance> expand(JobTemplate template, Matrix matrix) {
        return expand(template, matrix, RunContext.builder().runId("expansion").build());
    }

    /**
     * Expand a template into one instance per matrix combination.
     *
     * @param template the job template
     * @param matrix   the matrix bound to it
     * @param run      run metadata for rendering display names
     * @return instances in deterministic order, never empty
     * @throws ExpansionException if an axis has no values, every combination is excluded, two
     *                            combinations collide, or there are more than
     *                            {@value #MAX_COMBINATIONS} (or {@value #MAX_PRODUCT} before excludes)
     */
    public List<JobInstance> expand(JobTemplate template, Matrix matrix, RunContext run) {
        String templateId = template.getId();

        for (Map.Entry<String, List<String>> axis : matrix.getAxes().entrySet()) {
            if (axis.getValue().isEmpty()) {
                throw new ExpansionException(templateId, "axis '" + axis.getKey() + "' has no values");
            }
        }
        if (matrix.getAxes().isEmpty() && matrix.getInclude().isEmpty()) {
            throw new ExpansionException(templateId, "matrix declares no axes and no include entries");
        }

        long size = 1;
        try {
            for (List<String> values : matrix.getAxes().values()) {
                size = Math.multiplyExact(size, values.size());
            }
        } catch (ArithmeticException e) {
            size = Long.MAX_VALUE;
        }
        if (size > MAX_PRODUCT) {
            throw new ExpansionException(templateId, "axes produce " + (size == Long.MAX_VALUE ? "too many" : size)
                    + " combinations before excludes, more than " + MAX_PRODUCT);
        }

        // CARTESIAN PRODUCT: full product first, filtering happens afterwards
        List<Map<String, String>> combinations = cartesianProduct(matrix.getAxes());
        int productSize = combinations.size();

        combinations.removeIf(combination -> isExcluded(combination, matrix.getExclude()));

        // INCLUDES: merge into compatible originals or append as new combinations
        int originals = combinations.size();
        for (Map<String, String> include : matrix.getInclude()) {
            boolean merged = false;
            for (int i = 0; i < originals; i++) {
                Map<String, String> combination = combinations.get(i);
                if (isCompatible(combination, include, matrix.getAxes().keySet())) {
                    combination.putAll(include);
                    merged = true;
                }
            }
            if (!merged) {
                combinations.add(new LinkedHashMap<>(include));
            }
        }

        if (combinations.isEmpty()) {
            throw new ExpansionException(templateId, "every combination is excluded");
        }
        if (combinations.size() > MAX_COMBINATIONS) {
            throw new ExpansionException(templateId, combinations.size()
                    + " combinations exceed the limit of " + MAX_COMBINATIONS);
        }

        List<JobInstance> instances = new ArrayList<>(combinations.size());
        Set<String> seen = new HashSet<>();
        for (Map<String, String> combination : combinations) {
            String id = instanceId(templateId, combination);
            if (!seen.add(id)) {
                throw new ExpansionException(templateId, "duplicate combination " + id);
            }
            instances.add(new JobInstance(id, template, combination, displayName(template, combination, run)));
        }

        logger.fine("Expanded " + templateId + ": " + productSize + " product combinations, "
                + instances.size() + " instances");
        return instances;
    }

    /**
     * Build the deterministic id of a matrix instance.
     *
     * @param templateId  the template id
     * @param combination axis values in matrix order
     * @return e.g. {@code lint[backend=sp1]}
     */
    public static String instanceId(String templateId, Map<String, String> combination) {
        return combination.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(",", templateId + "[", "]"));
    }

    private static List<Map<String, String>> cartesianProduct(Map<String, List<String>> axes) {
        List<Map<String, String>> product = new ArrayList<>();
        if (axes.isEmpty()) {
            return product;
        }
        product.add(new LinkedHashMap<>());
        for (Map.Entry<String, List<String>> axis : axes.entrySet()) {
            List<Map<String, String>> next = new ArrayList<>(product.size() * axis.getValue().size());
            for (Map<String, String> partial : product) {
                for (String value : axis.getValue()) {
                    Map<String, String> combination = new LinkedHashMap<>(partial);
                    combination.put(axis.getKey(), value);
                    next.add(combination);
                }
            }
            product = next;
        }
        return product;
    }

    private static boolean isExcluded(Map<String, String> combination, List<Map<String, String>> excludes) {
        for (Map<String, String> exclude : excludes) {
            boolean matches = exclude.entrySet().stream()
                    .allMatch(entry -> entry.getValue().equals(combination.get(entry.getKey())));
            if (matches) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCompatible(Map<String, String> combination, Map<String, String> include,
                                        Set<String> axisNames) {
        for (Map.Entry<String, String> entry : include.entrySet()) {
            if (axisNames.contains(entry.getKey()) && !entry.getValue().equals(combination.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static String displayName(JobTemplate template, Map<String, String> combination, RunContext run) {
        if (template.getName() != null) {
            return template.getName().render(EvaluationContext.builder(run).matrix(combination).build());
        }
        return template.getId() + combination.values().stream().collect(Collectors.joining(", ", " (", ")"));
    }
}
