package com.sigcontract.compiler.model;

import com.sigcontract.compiler.model.Expr.*;

import java.util.*;
import java.util.function.Function;

/**
 * Structural operations over {@link Expr} trees.
 */
public final class Exprs {

    private Exprs() {
    }

    /**
     * Symbols referenced by the expression, in first-occurrence order.
     * Quantifier binders are not free inside their body.
     */
    public static Set<String> freeVariables(Expr expr) {
        Set<String> result = new LinkedHashSet<>();
        collectVariables(expr, new HashSet<>(), result);
        return result;
    }

    private static void collectVariables(Expr expr, Set<String> bound, Set<String> out) {
        if (expr instanceof Var v) {
            if (!bound.contains(v.name())) {
                out.add(v.name());
            }
        } else if (expr instanceof ForAll f) {
            collectVariables(f.collection(), bound, out);
            Set<String> inner = new HashSet<>(bound);
            inner.add(f.binder());
            collectVariables(f.body(), inner, out);
        } else {
            for (Expr child : children(expr)) {
                collectVariables(child, bound, out);
            }
        }
    }

    /**
     * Subjects referenced through {@link Ref} nodes, in first-occurrence order.
     */
    public static Set<Subject> referencedSubjects(Expr expr) {
        Set<Subject> result = new LinkedHashSet<>();
        visit(expr, node -> {
            if (node instanceof Ref r) {
                result.add(r.subject());
            }
        });
        return result;
    }

    /**
     * True if the expression performs arithmetic anywhere in its tree.
     */
    public static boolean containsArithmetic(Expr expr) {
        boolean[] found = {false};
        visit(expr, node -> {
            if (node instanceof Arith) {
                found[0] = true;
            }
        });
        return found[0];
    }

    /**
     * Replaces free variables according to the mapping; unmapped variables are kept.
     */
    public static Expr substitute(Expr expr, Map<String, Expr> mapping) {
        return rewrite(expr, node -> {
            if (node instanceof Var v && mapping.containsKey(v.name())) {
                return mapping.get(v.name());
            }
            return null;
        });
    }

    /**
     * Bottom-up rewrite. The function returns a replacement, or null to keep
     * the node (with rewritten children).
     */
    public static Expr rewrite(Expr expr, Function<Expr, Expr> replacer) {
        Expr replaced = replacer.apply(expr);
        if (replaced != null) {
            return replaced;
        }
        if (expr instanceof Length l) {
            return new Length(rewrite(l.target(), replacer));
        } else if (expr instanceof Field f) {
            return new Field(rewrite(f.target(), replacer), f.name());
        } else if (expr instanceof Unwrap u) {
            return new Unwrap(rewrite(u.target(), replacer));
        } else if (expr instanceof Arith a) {
            return new Arith(a.op(), rewrite(a.left(), replacer), rewrite(a.right(), replacer));
        } else if (expr instanceof Compare c) {
            return new Compare(c.op(), rewrite(c.left(), replacer), rewrite(c.right(), replacer));
        } else if (expr instanceof Logic l) {
            return new Logic(l.op(), rewrite(l.left(), replacer), rewrite(l.right(), replacer));
        } else if (expr instanceof Not n) {
            return new Not(rewrite(n.operand(), replacer));
        } else if (expr instanceof ForAll f) {
            return new ForAll(f.binder(), rewrite(f.collection(), replacer), rewrite(f.body(), replacer));
        }
        return expr;
    }

    /**
     * Constant-folds integer arithmetic and drops additive zeros.
     */
    public static Expr fold(Expr expr) {
        if (expr instanceof Arith a) {
            Expr left = fold(a.left());
            Expr right = fold(a.right());
            if (left instanceof IntLit l && right instanceof IntLit r) {
                return new IntLit(a.op().apply(l.value(), r.value()));
            }
            if (a.op() == ArithOp.ADD && isZero(left)) {
                return right;
            }
            if ((a.op() == ArithOp.ADD || a.op() == ArithOp.SUB) && isZero(right)) {
                return left;
            }
            if (a.op() == ArithOp.MUL && (isZero(left) || isZero(right))) {
                return new IntLit(0);
            }
            return new Arith(a.op(), left, right);
        }
        return expr;
    }

    private static boolean isZero(Expr expr) {
        return expr instanceof IntLit lit && lit.value() == 0;
    }

    /**
     * Flattens a tree of additions into its summands; any other node is a single summand.
     */
    public static List<Expr> summands(Expr expr) {
        List<Expr> result = new ArrayList<>();
        flattenSum(expr, result);
        return result;
    }

    private static void flattenSum(Expr expr, List<Expr> out) {
        if (expr instanceof Arith a && a.op() == ArithOp.ADD) {
            flattenSum(a.left(), out);
            flattenSum(a.right(), out);
        } else {
            out.add(expr);
        }
    }

    /**
     * Rebuilds a left-associated sum; zero for an empty list.
     */
    public static Expr sum(List<Expr> terms) {
        Expr result = null;
        for (Expr term : terms) {
            result = result == null ? term : Expr.add(result, term);
        }
        return result == null ? Expr.lit(0) : result;
    }

    /**
     * Pre-order traversal of every node.
     */
    public static void visit(Expr expr, java.util.function.Consumer<Expr> visitor) {
        visitor.accept(expr);
        for (Expr child : children(expr)) {
            visit(child, visitor);
        }
    }

    private static List<Expr> children(Expr expr) {
        if (expr instanceof Length l) {
            return List.of(l.target());
        } else if (expr instanceof Field f) {
            return List.of(f.target());
        } else if (expr instanceof Unwrap u) {
            return List.of(u.target());
        } else if (expr instanceof Arith a) {
            return List.of(a.left(), a.right());
        } else if (expr instanceof Compare c) {
            return List.of(c.left(), c.right());
        } else if (expr instanceof Logic l) {
            return List.of(l.left(), l.right());
        } else if (expr instanceof Not n) {
            return List.of(n.operand());
        } else if (expr instanceof ForAll f) {
            return List.of(f.collection(), f.body());
        }
        return List.of();
    }
}
