package net.littleredcomputer.rsolver;

import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.List;

/**
 * Evaluates a token stream directly, without building a syntax tree, against
 * the grammar
 * <pre>
 *    expr := clause ( ('&amp;' | '|') clause )*
 *  clause := '~' clause | literal | '(' expr ')'
 * </pre>
 * Operators chain strictly left to right: {@code a & b | c} means
 * {@code (a & b) | c}. Both operands of a binary operator are always
 * evaluated.
 * <p>
 * The grammar is recursive, but the evaluator is not: pending work is kept as
 * frames on an explicit stack, so deeply nested formulas cost heap rather than
 * Java stack. Each frame is a single int. The low two bits give its kind; an
 * expression frame also records the value accumulated so far and the operator
 * waiting for its right operand.
 */
public final class Evaluator {
    private static final int NOT = 0;
    private static final int PAREN = 1;
    private static final int EXPR = 2;
    private static final int KIND_MASK = 3;
    private static final int ACC_BIT = 1 << 2;
    private static final int OP_SHIFT = 3;
    private static final int OP_NONE = 0;
    private static final int OP_AND = 1;
    private static final int OP_OR = 2;

    // Steps of the evaluation loop.
    private static final int CLAUSE = 1;       // parse a clause starting at the cursor
    private static final int CLAUSE_DONE = 2;  // a clause produced v; hand it to the frame below
    private static final int EXPR_DONE = 3;    // an expr produced v; close its bracket, or finish

    private final List<Token> tokens;

    /** @param tokens tokens whose literals have been resolved by a {@link LiteralRegistry} */
    public Evaluator(List<Token> tokens) {
        this.tokens = tokens;
    }

    private Token at(int position) {
        return position < tokens.size() ? tokens.get(position) : Token.EOF;
    }

    private static int exprFrame(boolean acc, int op) {
        return EXPR | (acc ? ACC_BIT : 0) | (op << OP_SHIFT);
    }

    private static String describe(Token t) {
        return t.type() == TokenType.UNKNOWN ? "unknown token '" + t.name() + "'" : t.toString();
    }

    public EvalResult evaluate(int start, Assignment assignment) {
        return evaluate(start, assignment, new SearchStatistics());
    }

    /**
     * Evaluate one expression beginning at {@code start}. Evaluation stops at
     * the end of the tokens or at a close bracket that has no open bracket
     * within this expression; the close bracket is not consumed.
     *
     * @param start cursor position of the first token of the expression
     * @param assignment values for the literals; thawed literals read as false
     * @param stats receives one lookup count per literal evaluated
     * @return the value, or the first error encountered, with the cursor position where evaluation stopped
     */
    public EvalResult evaluate(int start, Assignment assignment, SearchStatistics stats) {
        final int n = tokens.size();
        final TIntStack frames = new TIntArrayStack();
        int pos = start;
        boolean v = false;
        int step = CLAUSE;
        frames.push(exprFrame(false, OP_NONE));

        while (true) {
            switch (step) {
                case CLAUSE: {
                    Token t = at(pos);
                    switch (t.type()) {
                        case NOT:
                            if (++pos >= n) return EvalResult.error(pos, "Expected something after a not");
                            frames.push(NOT);
                            continue;
                        case OPEN_PAREN:
                            if (++pos >= n) return EvalResult.error(pos, "Expected something after an open bracket");
                            frames.push(PAREN);
                            frames.push(exprFrame(false, OP_NONE));
                            continue;
                        case LITERAL: {
                            stats.lookup();
                            int ix = t.index();
                            if (ix < 0 || ix >= assignment.size()) {
                                return EvalResult.error(pos, "Unknown literal %s", t.name());
                            }
                            v = assignment.value(ix);
                            ++pos;
                            step = CLAUSE_DONE;
                            continue;
                        }
                        case AND:
                        case OR:
                            return EvalResult.error(pos, "A clause cannot begin with an %s", t.type().symbol());
                        case CLOSE_PAREN:
                            return EvalResult.error(pos, "Unexpected close bracket");
                        case UNKNOWN:
                            return EvalResult.error(pos, "Encountered %s", describe(t));
                        case EOF:
                            return EvalResult.error(pos, "Unexpected end of formula");
                    }
                    throw new IllegalStateException("unhandled token type " + t.type());
                }
                case CLAUSE_DONE: {
                    int f = frames.pop();
                    if ((f & KIND_MASK) == NOT) {
                        v = !v;
                        continue;
                    }
                    assert (f & KIND_MASK) == EXPR;
                    boolean acc = (f & ACC_BIT) != 0;
                    switch (f >> OP_SHIFT) {
                        case OP_AND: v = acc & v; break;
                        case OP_OR: v = acc | v; break;
                        default: break;  // first clause of the expression
                    }
                    Token t = at(pos);
                    if (t.type().isBinaryOperator()) {
                        if (++pos >= n) return EvalResult.error(pos, "Expected something after an and/or");
                        frames.push(exprFrame(v, t.type() == TokenType.AND ? OP_AND : OP_OR));
                        step = CLAUSE;
                    } else if (t.type() == TokenType.CLOSE_PAREN || t.type() == TokenType.EOF) {
                        // The bracket belongs to an enclosing clause; leave the cursor on it.
                        step = EXPR_DONE;
                    } else {
                        return EvalResult.error(pos, "Unexpected %s -- only and/or can connect clauses", describe(t));
                    }
                    continue;
                }
                case EXPR_DONE: {
                    if (frames.size() == 0) return EvalResult.of(v, pos);
                    int f = frames.pop();
                    assert (f & KIND_MASK) == PAREN;
                    if (at(pos).type() != TokenType.CLOSE_PAREN) return EvalResult.error(pos, "Expected close bracket");
                    ++pos;
                    step = CLAUSE_DONE;
                    continue;
                }
                default:
                    throw new IllegalStateException("bad evaluator step " + step);
            }
        }
    }
}
