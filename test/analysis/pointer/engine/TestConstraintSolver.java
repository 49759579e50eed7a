package analysis.pointer.engine;

import java.util.Arrays;

import junit.framework.TestCase;
import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.graph.ConstraintGraph;
import analysis.pointer.graph.VariableTable;
import analysis.pointer.registrar.ConstraintRegistrar;
import analysis.pointer.registrar.FieldDescriptor;
import analysis.pointer.registrar.ObjectDescriptor;

import com.ibm.wala.util.intset.BitVectorIntSet;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;

/**
 * Test the worklist solver on small constraint systems
 */
public class TestConstraintSolver extends TestCase {

    private VariableTable vars;
    private ConstraintRegistrar registrar;
    private SolverStatistics stats;
    private ConstraintSolver solver;

    @Override
    protected void setUp() {
        this.vars = new VariableTable();
        this.registrar = new ConstraintRegistrar(this.vars, true);
        this.stats = new SolverStatistics();
    }

    private int scalar(String name) {
        return this.registrar.createVariable(ObjectDescriptor.scalar(name, 64));
    }

    private int pair(String name) {
        return this.registrar.createVariable(ObjectDescriptor.struct(name,
                                                                     128,
                                                                     Arrays.asList(FieldDescriptor.leaf("f", 0, 64),
                                                                                   FieldDescriptor.leaf("g", 64, 64))));
    }

    private void emit(ConstraintExpression lhs, ConstraintExpression rhs) {
        this.registrar.emitConstraint(lhs, rhs);
    }

    private static ConstraintExpression v(int var) {
        return ConstraintExpression.scalar(var);
    }

    private static ConstraintExpression addr(int var) {
        return ConstraintExpression.addressOf(var);
    }

    private static ConstraintExpression deref(int var) {
        return ConstraintExpression.deref(var);
    }

    /**
     * Build the graph, collapse its cycles and create the solver, without running it
     */
    private void prepare() {
        ConstraintGraph g = new ConstraintGraphBuilder(this.vars).build(this.registrar.getConstraints());
        NodeUnifier unifier = new NodeUnifier(this.vars, g);
        CycleCollapser collapser = new CycleCollapser(this.vars, g, unifier, this.stats);
        collapser.collapseCycles(null);
        this.solver = new ConstraintSolver(this.vars, g, collapser, this.stats);
    }

    private void solve() {
        prepare();
        this.solver.solve();
        this.solver.verify(this.registrar.getConstraints());
    }

    private MutableIntSet sol(int var) {
        return this.vars.get(this.vars.getRepresentative(var)).getSolution();
    }

    private static void assertSolution(IntSet actual, int... expected) {
        BitVectorIntSet e = new BitVectorIntSet();
        for (int i : expected) {
            e.add(i);
        }
        assertTrue("expected " + e + " but was " + actual, e.sameValue(actual));
    }

    public void testStoreThroughCopiedPointer() {
        int p = scalar("p");
        int q = scalar("q");
        int a = scalar("a");
        int b = scalar("b");
        emit(v(p), addr(a));
        emit(v(q), v(p));
        emit(deref(q), addr(b));
        solve();

        assertSolution(sol(p), a);
        assertSolution(sol(q), a);
        assertSolution(sol(a), b);
        assertSolution(sol(b));
    }

    public void testStoreOfPointerIntoItsTarget() {
        int p = scalar("p");
        int t = scalar("t");
        emit(v(p), addr(t));
        emit(deref(p), v(p));
        solve();

        assertSolution(sol(p), t);
        assertSolution(sol(t), t);
    }

    public void testStoreOfAddressIntoTarget() {
        int p = scalar("p");
        int t = scalar("t");
        emit(v(p), addr(t));
        emit(deref(p), addr(p));
        solve();

        assertSolution(sol(p), t);
        assertSolution(sol(t), p);
    }

    public void testLoad() {
        int p = scalar("p");
        int x = scalar("x");
        int a = scalar("a");
        int b = scalar("b");
        emit(v(p), addr(a));
        emit(v(a), addr(b));
        emit(v(x), deref(p));
        solve();

        assertSolution(sol(x), b);
    }

    public void testFieldAccessThroughPointer() {
        int s = pair("s");
        int g = s + 1;
        int p = scalar("p");
        int x = scalar("x");
        int y = scalar("y");
        int o1 = scalar("o1");
        int o2 = scalar("o2");
        emit(v(p), addr(s));
        emit(deref(p), addr(o1));
        emit(ConstraintExpression.deref(p, 64), addr(o2));
        emit(v(x), ConstraintExpression.deref(p, 64));
        emit(v(y), ConstraintExpression.scalar(p, 64));
        solve();

        assertEquals("s.g", this.vars.get(g).getName());
        assertSolution(sol(s), o1);
        assertSolution(sol(g), o2);
        assertSolution(sol(x), o2);
        // pointer arithmetic moves to the next field
        assertSolution(sol(y), g);
    }

    public void testOutOfBoundsOffsetIsDropped() {
        int s = pair("s");
        int p = scalar("p");
        int x = scalar("x");
        int o = scalar("o");
        emit(v(p), addr(s));
        emit(ConstraintExpression.deref(p, 128), addr(o));
        emit(ConstraintExpression.deref(p, 64), addr(o));
        emit(v(x), ConstraintExpression.deref(p, 192));
        solve();

        assertSolution(sol(s));
        assertSolution(sol(s + 1), o);
        assertSolution(sol(x));
    }

    public void testHeapObjectIsNotSplit() {
        int h = this.registrar.createHeapVariable("h");
        int p = scalar("p");
        int x = scalar("x");
        int o = scalar("o");
        emit(v(p), addr(h));
        emit(ConstraintExpression.deref(p, 64), addr(o));
        emit(v(x), deref(p));
        emit(v(p), ConstraintExpression.scalar(p, 128));
        solve();

        assertSolution(sol(h), o);
        assertSolution(sol(x), o);
        assertSolution(sol(p), h);
    }

    public void testDynamicCycleIsCollapsed() {
        int p = scalar("p");
        int q = scalar("q");
        int a = scalar("a");
        int b = scalar("b");
        int o = scalar("o");
        // *p = b and b = *q with p and q pointing to a close the cycle a -> b -> a
        emit(v(p), addr(a));
        emit(v(q), addr(a));
        emit(deref(p), v(b));
        emit(v(b), deref(q));
        emit(v(b), addr(o));
        solve();

        assertEquals(this.vars.getRepresentative(a), this.vars.getRepresentative(b));
        assertEquals(1, this.stats.getUnifiedVarsDynamic());
        assertSolution(sol(a), o);
        assertSolution(sol(b), o);
    }

    public void testMonotonic() {
        int p = scalar("p");
        int q = scalar("q");
        int r = scalar("r");
        int s = pair("s");
        int a = scalar("a");
        emit(v(p), addr(s));
        emit(v(q), v(p));
        emit(ConstraintExpression.deref(q, 64), addr(a));
        emit(v(r), ConstraintExpression.deref(p, 64));
        emit(deref(r), v(q));
        emit(v(a), ConstraintExpression.scalar(q, 64));
        prepare();

        IntSet[] previous = new IntSet[this.vars.size()];
        for (int i = 0; i < previous.length; i++) {
            previous[i] = new BitVectorIntSet(sol(i));
        }
        this.solver.markAllChanged();
        boolean more = true;
        int rounds = 0;
        while (more) {
            more = this.solver.solveRound();
            rounds++;
            for (int i = 0; i < previous.length; i++) {
                assertTrue(this.vars.get(i).getName() + " shrank", previous[i].isSubset(sol(i)));
                previous[i] = new BitVectorIntSet(sol(i));
            }
        }
        assertTrue(rounds > 1);
        assertEquals(rounds, this.stats.getIterations());
        this.solver.verify(this.registrar.getConstraints());
        assertSolution(sol(a), s, s + 1);
        assertSolution(sol(r), a);
    }

    public void testSolvingAgainChangesNothing() {
        int p = scalar("p");
        int q = scalar("q");
        int a = scalar("a");
        int b = scalar("b");
        emit(v(p), addr(a));
        emit(v(q), v(p));
        emit(deref(q), addr(b));
        emit(v(b), deref(p));
        solve();

        IntSet[] before = new IntSet[this.vars.size()];
        for (int i = 0; i < before.length; i++) {
            before[i] = new BitVectorIntSet(sol(i));
        }
        assertEquals(1, this.solver.solve());
        for (int i = 0; i < before.length; i++) {
            assertTrue(before[i].sameValue(sol(i)));
        }
    }

    public void testVerifyDetectsMissingPointee() {
        int p = scalar("p");
        int q = scalar("q");
        int a = scalar("a");
        emit(v(p), addr(a));
        emit(v(q), ConstraintExpression.scalar(p, 0));
        emit(deref(q), addr(q));
        solve();

        sol(a).remove(q);
        try {
            this.solver.verify(this.registrar.getConstraints());
        }
        catch (InternalInconsistencyException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public void testAnythingIsPropagated() {
        int p = scalar("p");
        int x = scalar("x");
        emit(v(p), addr(VariableTable.ANYTHING_ID));
        emit(v(x), deref(p));
        emit(deref(p), addr(x));
        solve();

        assertTrue(sol(x).contains(VariableTable.ANYTHING_ID));
        assertTrue(sol(VariableTable.ANYTHING_ID).contains(x));
    }
}
