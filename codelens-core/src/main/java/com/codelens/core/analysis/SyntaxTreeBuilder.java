package com.codelens.core.analysis;

import com.codelens.core.model.AstNode;
import com.codelens.core.model.AstNodeType;
import com.codelens.core.model.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a heuristic {@link SyntaxTree} from source lines.
 *
 * <p>Each line is trimmed and matched against an ordered {@link LineRule} table; the
 * first matching rule appends a node under the current insertion node. Container nodes
 * (class, method, loop) push the current node on an ancestor stack and become current.
 * Leaf nodes (variable, print) do not. When a leaf statement is followed by more text
 * after its first {@code ;}, that remainder is matched again, against leaf rules only.
 *
 * <p>Independently of the rules, a trimmed line ending with {@code }} closes the
 * innermost open container. Closing with an empty ancestor stack is a no-op.
 *
 * <p>Nodes live in an index-addressed arena; the ancestor stack holds indices.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * public class Main
 *   public static void main(String[] args) {
 *     for (int i = 0; i < 3; i++) {
 *       System.out.println(i);
 *     }
 *   }
 * }</pre>
 * yields {@code Root -> Class: Main -> Method: main -> Loop -> Print Statement}.
 */
public class SyntaxTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeBuilder.class);

    private final List<LineRule> rules;

    public SyntaxTreeBuilder() {
        this(LineRule.defaults());
    }

    public SyntaxTreeBuilder(List<LineRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = List.copyOf(rules);
    }

    /**
     * Builds the tree. Never fails; degenerate input yields a root without children.
     *
     * @param source source text
     * @return syntax tree rooted at {@link AstNodeType#ROOT}
     */
    public SyntaxTree build(String source) {
        Objects.requireNonNull(source, "source must not be null");

        Arena arena = new Arena();
        Deque<Integer> ancestors = new ArrayDeque<>();
        int current = Arena.ROOT;

        for (String line : source.lines().toList()) {
            String stripped = line.strip();

            current = applyRules(stripped, arena, ancestors, current);

            if (stripped.endsWith(SourcePatterns.CLOSE_BRACE) && !ancestors.isEmpty()) {
                current = ancestors.pop();
            }
        }

        SyntaxTree tree = arena.freeze();
        log.debug("Built syntax tree with {} nodes", tree.size());
        return tree;
    }

    /**
     * Matches one statement and any leaf-statement continuations on the same line.
     *
     * @return the insertion node after processing the statement
     */
    private int applyRules(String statement, Arena arena, Deque<Integer> ancestors, int current) {
        String remaining = statement;
        boolean continuation = false;
        while (!remaining.isEmpty()) {
            Optional<LineRule> match = firstMatch(remaining, continuation);
            if (match.isEmpty()) {
                break;
            }

            LineRule rule = match.get();
            int node = arena.add(rule.type(), rule.nameOf(remaining), current);

            if (rule.type().isContainer()) {
                ancestors.push(current);
                current = node;
                break;
            }

            int terminator = remaining.indexOf(SourcePatterns.TERMINATOR);
            if (terminator < 0) {
                break;
            }
            remaining = remaining.substring(terminator + 1).strip();
            continuation = true;
        }
        return current;
    }

    private Optional<LineRule> firstMatch(String statement, boolean leafOnly) {
        return rules.stream()
            .filter(rule -> !leafOnly || !rule.type().isContainer())
            .filter(rule -> rule.matches(statement))
            .findFirst();
    }

    /**
     * Mutable node storage used while building; frozen into an immutable tree at the end.
     */
    private static final class Arena {

        static final int ROOT = 0;

        private final List<AstNodeType> types = new ArrayList<>();
        private final List<String> names = new ArrayList<>();
        private final List<Integer> parents = new ArrayList<>();
        private final List<List<Integer>> children = new ArrayList<>();

        Arena() {
            types.add(AstNodeType.ROOT);
            names.add(null);
            parents.add(AstNode.NO_PARENT);
            children.add(new ArrayList<>());
        }

        int add(AstNodeType type, String name, int parent) {
            int id = types.size();
            types.add(type);
            names.add(name);
            parents.add(parent);
            children.add(new ArrayList<>());
            children.get(parent).add(id);
            return id;
        }

        SyntaxTree freeze() {
            List<AstNode> nodes = new ArrayList<>(types.size());
            for (int id = 0; id < types.size(); id++) {
                nodes.add(new AstNode(id, types.get(id), names.get(id), parents.get(id), children.get(id)));
            }
            return new SyntaxTree(nodes);
        }
    }
}
