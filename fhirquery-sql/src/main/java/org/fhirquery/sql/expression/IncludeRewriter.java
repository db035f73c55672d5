package org.fhirquery.sql.expression;

import org.fhirquery.core.search.expression.IncludeExpression;
import org.fhirquery.sql.generator.IncludeLimitQueryGenerator;
import org.fhirquery.sql.generator.IncludeUnionAllQueryGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reorders the include steps of a search plan so each step runs after the steps it reads from.
 * <p>
 * An iterate include consumes the resources produced by earlier include steps, so a
 * single-pass generator must see the producers first. The include entries are placed in
 * dependency order, each followed by an {@link TableExpressionKind#INCLUDE_LIMIT} marker,
 * and a single {@link TableExpressionKind#INCLUDE_UNION_ALL} marker closes the plan:
 * </p>
 * <pre>
 * All, Top, Include, IncludeLimit, Include, IncludeLimit, ..., IncludeUnionAll
 * </pre>
 * <p>
 * Among steps that are ready, reversed includes go first, then input order decides.
 * Cyclic dependencies are not an error: when no step is ready the same rule is applied to
 * all remaining steps. Markers already present are dropped and rebuilt, so rewriting a
 * rewritten plan gives the same plan.
 * </p>
 */
@Component
public class IncludeRewriter {

    private static final Logger log = LoggerFactory.getLogger(IncludeRewriter.class);

    public SqlRootExpression linearize(SqlRootExpression root) {
        List<TableExpression> others = new ArrayList<>();
        List<TableExpression> includes = new ArrayList<>();

        for (TableExpression table : root.tableExpressions()) {
            switch (table.kind()) {
                case INCLUDE -> includes.add(table);
                case INCLUDE_LIMIT, INCLUDE_UNION_ALL -> {
                    // rebuilt below
                }
                default -> others.add(table);
            }
        }

        if (includes.isEmpty()) {
            return root;
        }

        List<TableExpression> rewritten = new ArrayList<>(others);
        for (TableExpression include : sortByDependency(includes)) {
            rewritten.add(include);
            rewritten.add(new TableExpression(IncludeLimitQueryGenerator.INSTANCE, include.normalizedPredicate(),
                    null, TableExpressionKind.INCLUDE_LIMIT));
        }
        rewritten.add(new TableExpression(IncludeUnionAllQueryGenerator.INSTANCE, null, null,
                TableExpressionKind.INCLUDE_UNION_ALL));

        return root.withTableExpressions(rewritten);
    }

    private static List<TableExpression> sortByDependency(List<TableExpression> includes) {
        int size = includes.size();
        List<IncludeExpression> nodes = new ArrayList<>(size);
        for (TableExpression table : includes) {
            nodes.add(includeOf(table));
        }

        // predecessors.get(c) holds every step whose output step c reads
        List<List<Integer>> predecessors = new ArrayList<>(size);
        for (int c = 0; c < size; c++) {
            List<Integer> preds = new ArrayList<>();
            IncludeExpression consumer = nodes.get(c);
            if (consumer.isIterate()) {
                for (int p = 0; p < size; p++) {
                    if (p != c && !Collections.disjoint(nodes.get(p).produces(), consumer.requires())) {
                        preds.add(p);
                    }
                }
            }
            predecessors.add(preds);
        }

        boolean[] placed = new boolean[size];
        List<TableExpression> ordered = new ArrayList<>(size);

        while (ordered.size() < size) {
            int next = pick(nodes, placed, predecessors, true);
            if (next < 0) {
                next = pick(nodes, placed, predecessors, false);
                log.trace("Include dependency cycle, placing {} by input order", nodes.get(next));
            }
            placed[next] = true;
            ordered.add(includes.get(next));
        }

        return ordered;
    }

    /**
     * Picks the next step to place: a reversed include if one qualifies, else the first
     * qualifying step in input order. Returns -1 if nothing qualifies.
     */
    private static int pick(List<IncludeExpression> nodes, boolean[] placed, List<List<Integer>> predecessors,
                            boolean readyOnly) {
        int firstCandidate = -1;
        for (int i = 0; i < nodes.size(); i++) {
            if (placed[i] || (readyOnly && !allPlaced(predecessors.get(i), placed))) {
                continue;
            }
            if (nodes.get(i).isReversed()) {
                return i;
            }
            if (firstCandidate < 0) {
                firstCandidate = i;
            }
        }
        return firstCandidate;
    }

    private static boolean allPlaced(List<Integer> indexes, boolean[] placed) {
        for (int index : indexes) {
            if (!placed[index]) {
                return false;
            }
        }
        return true;
    }

    private static IncludeExpression includeOf(TableExpression table) {
        if (table.normalizedPredicate() instanceof IncludeExpression include) {
            return include;
        }
        throw new IllegalStateException("Include table expression without an include predicate: " + table);
    }
}
