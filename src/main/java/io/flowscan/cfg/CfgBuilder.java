package io.flowscan.cfg;

import io.flowscan.ast.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the control-flow graph of one function body.
 * <p>
 * Statements are appended to the current block until a control-transfer statement starts
 * a new one. Branches get a block each plus a join block; loops get a header with a
 * back-edge from the body and a forward edge to the block after the loop. Every block of a
 * {@code try} body edges to each {@code except} handler, and all paths leaving a
 * {@code try} with a {@code finally} clause pass through the finally block first.
 * <p>
 * A statement following a jump lands in a fresh block without predecessors, which is how
 * dead code shows up as unreachable.
 * <p>
 * The builder is stateless and may be shared between threads.
 */
public class CfgBuilder {

    private static final Logger log = LoggerFactory.getLogger(CfgBuilder.class);

    /**
     * Builds the CFG of a function body.
     *
     * @param functionName Name used in log messages
     * @param body         Function body statements
     * @return the graph, or {@link ControlFlowGraph#empty()} when the body is malformed
     */
    public ControlFlowGraph build(String functionName, List<Stmt> body) {
        try {
            return new Construction().run(body);
        } catch (MalformedBodyException e) {
            log.warn("Skipping CFG for {}: {}", functionName, e.getMessage());
            return ControlFlowGraph.empty();
        }
    }

    /**
     * Mutable block under construction. A block with a terminator is closed; anything
     * appended after that goes to a new, unreachable block.
     */
    private static final class Draft {
        final int id;
        final List<Stmt> statements = new ArrayList<>();
        final Set<Integer> successors = new LinkedHashSet<>();
        Terminator terminator;

        Draft(int id) {
            this.id = id;
        }

        boolean open() {
            return terminator == null;
        }

        BasicBlock freeze() {
            Terminator kind = terminator;
            if (kind == null) {
                kind = successors.isEmpty() ? Terminator.NONE : Terminator.FALLTHROUGH;
            }
            return new BasicBlock(id, statements, kind, new ArrayList<>(successors));
        }
    }

    private record LoopFrame(Draft header, Draft after) {}

    /**
     * Open {@code finally} clause. Jumps leaving its try statement are routed to
     * {@code entry} and remembered, so they can continue from the end of the clause.
     */
    private static final class FinallyFrame {
        final Draft entry;
        final int loopDepth;
        final Set<Terminator> pending = EnumSet.noneOf(Terminator.class);

        FinallyFrame(Draft entry, int loopDepth) {
            this.entry = entry;
            this.loopDepth = loopDepth;
        }
    }

    private static final class Construction {
        private final List<Draft> blocks = new ArrayList<>();
        private final Deque<LoopFrame> loops = new ArrayDeque<>();
        private final Deque<FinallyFrame> finallies = new ArrayDeque<>();
        private Draft current;
        private Draft exit;

        ControlFlowGraph run(List<Stmt> body) {
            Draft entry = newBlock();
            exit = newBlock();
            current = entry;
            visitAll(body);
            if (current.open()) {
                edge(current, exit);
            }
            List<BasicBlock> frozen = blocks.stream().map(Draft::freeze).toList();
            return new ControlFlowGraph(frozen, entry.id, exit.id);
        }

        private void visitAll(List<Stmt> statements) {
            for (Stmt stmt : statements) {
                visit(stmt);
            }
        }

        private void visit(Stmt stmt) {
            if (stmt == null) {
                throw new MalformedBodyException("null statement");
            }
            if (stmt instanceof Stmt.Return) {
                append(stmt);
                jump(Terminator.RETURN, current);
                current.terminator = Terminator.RETURN;
            } else if (stmt instanceof Stmt.Raise) {
                append(stmt);
                jump(Terminator.RAISE, current);
                current.terminator = Terminator.RAISE;
            } else if (stmt instanceof Stmt.Break) {
                requireLoop(stmt, "break");
                append(stmt);
                jump(Terminator.BREAK, current);
                current.terminator = Terminator.BREAK;
            } else if (stmt instanceof Stmt.Continue) {
                requireLoop(stmt, "continue");
                append(stmt);
                jump(Terminator.CONTINUE, current);
                current.terminator = Terminator.CONTINUE;
            } else if (stmt instanceof Stmt.If s) {
                visitIf(s);
            } else if (stmt instanceof Stmt.While s) {
                visitLoop(s, s.body(), s.orelse());
            } else if (stmt instanceof Stmt.For s) {
                visitLoop(s, s.body(), s.orelse());
            } else if (stmt instanceof Stmt.Try s) {
                visitTry(s);
            } else if (stmt instanceof Stmt.With s) {
                visitWith(s);
            } else if (stmt instanceof Stmt.Match s) {
                visitMatch(s);
            } else {
                // Plain statements, including nested function and class definitions
                append(stmt);
            }
        }

        private void visitIf(Stmt.If stmt) {
            append(stmt);
            Draft header = current;

            current = successorOf(header);
            visitAll(stmt.body());
            Draft thenEnd = current;

            Draft elseEnd = null;
            if (!stmt.orelse().isEmpty()) {
                current = successorOf(header);
                visitAll(stmt.orelse());
                elseEnd = current;
            }

            Draft join = newBlock();
            if (thenEnd.open()) {
                edge(thenEnd, join);
            }
            if (elseEnd == null) {
                edge(header, join);
            } else if (elseEnd.open()) {
                edge(elseEnd, join);
            }
            current = join;
        }

        private void visitLoop(Stmt loop, List<Stmt> body, List<Stmt> orelse) {
            Draft header = successorOf(current);
            header.statements.add(loop);
            Draft after = newBlock();

            loops.push(new LoopFrame(header, after));
            current = successorOf(header);
            visitAll(body);
            if (current.open()) {
                edge(current, header);
            }
            loops.pop();

            if (orelse.isEmpty()) {
                edge(header, after);
            } else {
                current = successorOf(header);
                visitAll(orelse);
                if (current.open()) {
                    edge(current, after);
                }
            }
            current = after;
        }

        private void visitTry(Stmt.Try stmt) {
            if (stmt.handlers().isEmpty() && stmt.finalbody().isEmpty()) {
                throw new MalformedBodyException("try at line " + stmt.line() + " has neither except nor finally");
            }
            FinallyFrame frame = null;
            if (!stmt.finalbody().isEmpty()) {
                frame = new FinallyFrame(newBlock(), loops.size());
                finallies.push(frame);
            }

            Draft tryHeader = successorOf(current);
            tryHeader.statements.add(stmt);
            current = tryHeader;
            int bodyFirst = tryHeader.id;
            visitAll(stmt.body());
            int bodyLast = blocks.size() - 1;
            Draft bodyEnd = current;

            List<Draft> ends = new ArrayList<>();
            int handlersFirst = blocks.size();
            for (Stmt.ExceptHandler handler : stmt.handlers()) {
                Draft handlerEntry = newBlock();
                for (int id = bodyFirst; id <= bodyLast; id++) {
                    edge(blocks.get(id), handlerEntry);
                }
                current = handlerEntry;
                visitAll(handler.body());
                ends.add(current);
            }
            int handlersLast = blocks.size() - 1;

            if (stmt.orelse().isEmpty()) {
                ends.add(bodyEnd);
            } else {
                current = successorOf(bodyEnd);
                visitAll(stmt.orelse());
                ends.add(current);
            }

            if (frame == null) {
                current = joinOf(ends);
                return;
            }

            finallies.pop();
            // Exceptions not caught by a handler, or raised inside one, still run the finally clause
            for (int id = bodyFirst; id <= bodyLast; id++) {
                edge(blocks.get(id), frame.entry);
            }
            for (int id = handlersFirst; id <= handlersLast; id++) {
                edge(blocks.get(id), frame.entry);
            }
            frame.pending.add(Terminator.RAISE);

            boolean fallsThrough = false;
            for (Draft end : ends) {
                if (end.open()) {
                    edge(end, frame.entry);
                    fallsThrough = true;
                }
            }

            current = frame.entry;
            visitAll(stmt.finalbody());
            Draft finallyEnd = current;
            Draft after = newBlock();
            if (finallyEnd.open()) {
                for (Terminator kind : frame.pending) {
                    jump(kind, finallyEnd);
                }
                if (fallsThrough) {
                    edge(finallyEnd, after);
                }
            }
            current = after;
        }

        private void visitWith(Stmt.With stmt) {
            Draft block = successorOf(current);
            block.statements.add(stmt);
            current = block;
            visitAll(stmt.body());
            current = successorOf(current);
        }

        private void visitMatch(Stmt.Match stmt) {
            Draft header = successorOf(current);
            header.statements.add(stmt);

            List<Draft> ends = new ArrayList<>();
            for (Stmt.MatchCase matchCase : stmt.cases()) {
                current = successorOf(header);
                visitAll(matchCase.body());
                ends.add(current);
            }

            Draft join = joinOf(ends);
            Stmt.MatchCase last = stmt.cases().isEmpty() ? null : stmt.cases().get(stmt.cases().size() - 1);
            if (last == null || !last.irrefutable() || last.guard() != null) {
                edge(header, join);
            }
            current = join;
        }

        /**
         * Routes a jump to its target: through the innermost {@code finally} that intercepts
         * it, otherwise to the exit block or the enclosing loop.
         */
        private void jump(Terminator kind, Draft from) {
            FinallyFrame frame = interceptor(kind);
            if (frame != null) {
                edge(from, frame.entry);
                frame.pending.add(kind);
                return;
            }
            switch (kind) {
                case RETURN, RAISE -> edge(from, exit);
                case BREAK -> edge(from, loops.peek().after());
                case CONTINUE -> edge(from, loops.peek().header());
                default -> throw new IllegalStateException("Not a jump: " + kind);
            }
        }

        private FinallyFrame interceptor(Terminator kind) {
            FinallyFrame innermost = finallies.peek();
            if (innermost == null) {
                return null;
            }
            if (kind == Terminator.BREAK || kind == Terminator.CONTINUE) {
                // Only a finally opened inside the innermost loop sits between the jump and its target
                return innermost.loopDepth == loops.size() ? innermost : null;
            }
            return innermost;
        }

        private void requireLoop(Stmt stmt, String keyword) {
            if (loops.isEmpty()) {
                throw new MalformedBodyException("'" + keyword + "' outside loop at line " + stmt.line());
            }
        }

        private void append(Stmt stmt) {
            if (!current.open()) {
                current = newBlock();
            }
            current.statements.add(stmt);
        }

        private Draft successorOf(Draft block) {
            Draft next = newBlock();
            if (block.open()) {
                edge(block, next);
            }
            return next;
        }

        private Draft joinOf(List<Draft> ends) {
            Draft join = newBlock();
            for (Draft end : ends) {
                if (end.open()) {
                    edge(end, join);
                }
            }
            return join;
        }

        private Draft newBlock() {
            Draft block = new Draft(blocks.size());
            blocks.add(block);
            return block;
        }

        private void edge(Draft from, Draft to) {
            from.successors.add(to.id);
        }
    }

    /**
     * Body that cannot be turned into a graph, such as a {@code break} outside any loop.
     */
    static final class MalformedBodyException extends RuntimeException {
        MalformedBodyException(String message) {
            super(message);
        }
    }
}
