package irforge.transform.structure;

import irforge.base.expressions.ConstantExpr;
import irforge.base.expressions.Locals;
import irforge.base.expressions.Operand;
import irforge.base.expressions.Place;
import irforge.base.expressions.Rvalue;
import irforge.base.llbc.Block;
import irforge.base.llbc.Statement;
import irforge.base.meta.Span;
import irforge.base.types.IntegerTy;
import irforge.base.types.Literal;
import irforge.base.types.ScalarValue;
import irforge.base.types.TyStore;
import irforge.base.ullbc.BlockData;
import irforge.base.ullbc.Body;
import irforge.base.ullbc.SwitchTargets;
import irforge.base.ullbc.Terminator;
import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs random block graphs and their structured form with the same branch decisions and compares
 * the blocks they go through. Every block records its id with a {@code SetDiscriminant} on
 * {@code _2}; {@code _1} drives the two-way branches and {@code _3} the integer switches.
 */
public class StructurerTraceTest {
    private static final int TRACE_LIMIT = 200;
    private static final int RETURNED = -1;
    private static final int GRAPHS = 1000;

    private TyStore store;

    @BeforeEach
    public void setUp() {
        Logging.init();
        store = new TyStore();
    }

    /** Thrown once a run has recorded {@link #TRACE_LIMIT} events. */
    private static class TraceFull extends RuntimeException {
        TraceFull() {
            super(null, null, false, false);
        }
    }

    private static void record(List<Integer> trace, int event) {
        if (trace.size() == TRACE_LIMIT) {
            throw new TraceFull();
        }
        trace.add(event);
    }

    private Body newBody() {
        Locals locals = new Locals(1);
        locals.newVar(null, store.unit());
        locals.newVar("c", store.bool());
        locals.newVar("tag", store.integer(IntegerTy.U32));
        locals.newVar("sel", store.integer(IntegerTy.U32));
        return new Body(Span.DUMMY, locals);
    }

    private static irforge.base.ullbc.Statement tag(int block) {
        return new irforge.base.ullbc.Statement.SetDiscriminant(Span.DUMMY, Place.local(2), block);
    }

    private Body randomBody(Random rnd) {
        int size = 2 + rnd.nextInt(11);
        Body body = newBody();
        for (int id = 0; id < size; id++) {
            Terminator term;
            int kind = id == size - 1 ? 9 : rnd.nextInt(10);
            if (kind <= 2) {
                term = new Terminator.Goto(Span.DUMMY, rnd.nextInt(size));
            } else if (kind <= 5) {
                term = new Terminator.Switch(Span.DUMMY, Operand.copy(Place.local(1)),
                        new SwitchTargets.If(rnd.nextInt(size), rnd.nextInt(size)));
            } else if (kind <= 7) {
                List<SwitchTargets.Branch> branches = new ArrayList<>();
                int count = 1 + rnd.nextInt(3);
                for (int v = 0; v < count; v++) {
                    branches.add(new SwitchTargets.Branch(ScalarValue.of(IntegerTy.U32, v * 3L), rnd.nextInt(size)));
                }
                term = new Terminator.Switch(Span.DUMMY, Operand.copy(Place.local(3)),
                        new SwitchTargets.SwitchInt(IntegerTy.U32, branches, rnd.nextInt(size)));
            } else if (kind == 8) {
                term = new Terminator.Drop(Span.DUMMY, Place.local(3), rnd.nextInt(size));
            } else {
                term = new Terminator.Return(Span.DUMMY);
            }
            body.newBlock(new BlockData(List.of(tag(id)), term));
        }
        return body;
    }

    // Block graph

    private static List<Integer> runUnstructured(Body body, long seed) {
        Random choices = new Random(seed);
        List<Integer> trace = new ArrayList<>();
        int current = Body.ENTRY;
        try {
            while (true) {
                BlockData data = body.block(current);
                for (var st : data.statements) {
                    if (st instanceof irforge.base.ullbc.Statement.SetDiscriminant sd) {
                        record(trace, sd.variant);
                    }
                }
                Terminator term = data.terminator;
                if (term instanceof Terminator.Goto g) {
                    current = g.target;
                } else if (term instanceof Terminator.Drop d) {
                    current = d.target;
                } else if (term instanceof Terminator.Switch sw && sw.targets instanceof SwitchTargets.If targets) {
                    current = choices.nextInt(2) == 0 ? targets.thenBlock : targets.elseBlock;
                } else if (term instanceof Terminator.Switch sw) {
                    var targets = (SwitchTargets.SwitchInt) sw.targets;
                    int choice = choices.nextInt(targets.branches.size() + 1);
                    current = choice < targets.branches.size() ? targets.branches.get(choice).target : targets.otherwise;
                } else {
                    assertInstanceOf(Terminator.Return.class, term);
                    record(trace, RETURNED);
                    return trace;
                }
            }
        } catch (TraceFull e) {
            return trace;
        }
    }

    // Structured body

    private static class Outcome {
        static final Outcome NORMAL = new Outcome(0, -1);
        static final Outcome RETURN = new Outcome(1, -1);

        final int kind;
        final int label;

        Outcome(int kind, int label) {
            this.kind = kind;
            this.label = label;
        }

        static Outcome breakOf(int label) {
            return new Outcome(2, label);
        }

        static Outcome continueOf(int label) {
            return new Outcome(3, label);
        }
    }

    private static class StructuredRun {
        final Random choices;
        final List<Integer> trace = new ArrayList<>();
        final Map<Integer, BigInteger> values = new HashMap<>();
        int steps = 0;

        StructuredRun(long seed) {
            this.choices = new Random(seed);
        }

        Outcome exec(Block block) {
            for (Statement st : block.statements) {
                Outcome outcome = exec(st);
                if (outcome != Outcome.NORMAL) {
                    return outcome;
                }
            }
            return Outcome.NORMAL;
        }

        Outcome exec(Statement st) {
            if (++steps > 1_000_000) {
                fail("Structured body does not make progress");
            }
            if (st instanceof Statement.SetDiscriminant sd) {
                record(trace, sd.variant);
            } else if (st instanceof Statement.Assign assign) {
                var use = (Rvalue.Use) assign.rvalue;
                var lit = (Literal.Scalar) ((ConstantExpr.Lit) ((Operand.Const) use.operand).value).value;
                values.put(assign.place.local, lit.value.value);
            } else if (st instanceof Statement.If s) {
                return exec(choices.nextInt(2) == 0 ? s.thenBlock : s.elseBlock);
            } else if (st instanceof Statement.SwitchInt s) {
                int local = ((Operand.Copy) s.discr).place.local;
                BigInteger value = values.get(local);
                if (value == null) {
                    int choice = choices.nextInt(s.branches.size() + 1);
                    return exec(choice < s.branches.size() ? s.branches.get(choice).block : s.otherwise);
                }
                for (Statement.SwitchBranch branch : s.branches) {
                    if (branch.value.value.equals(value)) {
                        return exec(branch.block);
                    }
                }
                return exec(s.otherwise);
            } else if (st instanceof Statement.Loop loop) {
                while (true) {
                    Outcome outcome = exec(loop.body);
                    if (outcome.kind == 3 && outcome.label == loop.label) {
                        continue;
                    }
                    return outcome.kind == 2 && outcome.label == loop.label ? Outcome.NORMAL : outcome;
                }
            } else if (st instanceof Statement.Labeled labeled) {
                Outcome outcome = exec(labeled.body);
                return outcome.kind == 2 && outcome.label == labeled.label ? Outcome.NORMAL : outcome;
            } else if (st instanceof Statement.Break b) {
                return Outcome.breakOf(b.label);
            } else if (st instanceof Statement.Continue c) {
                return Outcome.continueOf(c.label);
            } else if (st instanceof Statement.Return) {
                record(trace, RETURNED);
                return Outcome.RETURN;
            } else {
                assertInstanceOf(Statement.Drop.class, st);
            }
            return Outcome.NORMAL;
        }
    }

    private static List<Integer> runStructured(irforge.base.llbc.Body body, long seed) {
        StructuredRun run = new StructuredRun(seed);
        try {
            run.exec(body.body);
        } catch (TraceFull e) {
            // limit reached
        }
        return run.trace;
    }

    @Test
    public void testRandomGraphsKeepTheirTraces() {
        Random rnd = new Random(20240917L);
        int irreducible = 0;
        for (int graph = 0; graph < GRAPHS; graph++) {
            Body body = randomBody(rnd);
            long[] seeds = {rnd.nextLong(), rnd.nextLong(), rnd.nextLong()};
            List<List<Integer>> expected = new ArrayList<>();
            for (long seed : seeds) {
                expected.add(runUnstructured(body, seed));
            }
            int localsBefore = body.locals.size();

            irforge.base.llbc.Body structured = new Structurer(body, store).structure();

            if (structured.locals.size() > localsBefore) {
                irreducible++;
            }
            for (int i = 0; i < seeds.length; i++) {
                assertEquals(expected.get(i), runStructured(structured, seeds[i]),
                        String.format("graph %d, run %d", graph, i));
            }
        }
        // the generator is dense enough to produce multi-entry cycles
        assertTrue(irreducible > 0);
    }

    @Test
    public void testLongDropChain() {
        int size = 20_000;
        Body body = newBody();
        for (int id = 0; id < size - 1; id++) {
            body.newBlock(new BlockData(List.of(tag(id)), new Terminator.Drop(Span.DUMMY, Place.local(3), id + 1)));
        }
        body.newBlock(new BlockData(List.of(tag(size - 1)), new Terminator.Return(Span.DUMMY)));

        irforge.base.llbc.Body structured = new Structurer(body, store).structure();

        // one flat sequence: tag and drop per block, then the final tag and return
        assertEquals(2 * size, structured.body.statements.size());
        for (int id = 0; id < size; id++) {
            var sd = (Statement.SetDiscriminant) structured.body.statements.get(2 * id);
            assertEquals(id, sd.variant);
        }
        assertInstanceOf(Statement.Drop.class, structured.body.statements.get(2 * size - 2));
        assertInstanceOf(Statement.Return.class, structured.body.statements.get(2 * size - 1));
    }

    @Test
    public void testLongSequenceOfConditionals() {
        // bb(3i): if c { bb(3i+1) } else { bb(3i+2) }, both arms join at bb(3i+3)
        int diamonds = 5_000;
        Body body = newBody();
        for (int i = 0; i < diamonds; i++) {
            int head = 3 * i;
            body.newBlock(new BlockData(List.of(tag(head)), new Terminator.Switch(Span.DUMMY,
                    Operand.copy(Place.local(1)), new SwitchTargets.If(head + 1, head + 2))));
            body.newBlock(new BlockData(List.of(tag(head + 1)), new Terminator.Goto(Span.DUMMY, head + 3)));
            body.newBlock(new BlockData(List.of(tag(head + 2)), new Terminator.Goto(Span.DUMMY, head + 3)));
        }
        body.newBlock(new BlockData(List.of(tag(3 * diamonds)), new Terminator.Return(Span.DUMMY)));

        irforge.base.llbc.Body structured = new Structurer(body, store).structure();

        // a labeled region per conditional, each followed by the code of its join block
        assertEquals(diamonds + 2, structured.body.statements.size());
        assertInstanceOf(Statement.Labeled.class, structured.body.statements.get(0));
        assertInstanceOf(Statement.Return.class, structured.body.statements.get(diamonds + 1));
    }
}
