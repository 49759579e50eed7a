package analysis.pointer.engine;

import java.util.Arrays;

import junit.framework.TestCase;
import results.PointsToResult;
import results.PointsToSolution;
import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.graph.VariableTable;
import analysis.pointer.registrar.FieldDescriptor;
import analysis.pointer.registrar.ObjectDescriptor;

/**
 * Test the whole analysis, from registering variables to querying the solution
 */
public class TestStructAliasAnalysis extends TestCase {

    private static ObjectDescriptor pair(String name) {
        return ObjectDescriptor.struct(name,
                                       128,
                                       Arrays.asList(FieldDescriptor.leaf("f1", 0, 64),
                                                     FieldDescriptor.leaf("f2", 64, 64)));
    }

    private static int scalar(StructAliasAnalysis analysis, String name) {
        return analysis.createVariable(ObjectDescriptor.scalar(name, 64));
    }

    private static void addressOf(StructAliasAnalysis analysis, int lhs, int rhs) {
        analysis.emitConstraint(ConstraintExpression.scalar(lhs), ConstraintExpression.addressOf(rhs));
    }

    public static void testFieldsAreDistinguished() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int a = analysis.createVariable(pair("a"));
        int g1 = scalar(analysis, "g1");
        int g2 = scalar(analysis, "g2");
        addressOf(analysis, a, g1);
        addressOf(analysis, a + 1, g2);
        PointsToSolution solution = analysis.run();

        int f2 = solution.findVariable("a.f2");
        assertEquals(a + 1, f2);
        assertEquals(PointsToResult.of(solution.getSolution(a)), solution.queryPointsTo(a));
        assertTrue(solution.queryPointsTo(a).mayPointTo(g1));
        assertFalse(solution.queryPointsTo(a).mayPointTo(g2));
        assertEquals(1, solution.queryPointsTo(f2).size());
        assertTrue(solution.queryPointsTo(f2).mayPointTo(g2));
    }

    public static void testFieldInsensitiveMergesFields() {
        StructAliasAnalysis analysis = new StructAliasAnalysis(false, true);
        int a = analysis.createVariable(pair("a"));
        int g1 = scalar(analysis, "g1");
        int g2 = scalar(analysis, "g2");
        int p = scalar(analysis, "p");
        int x = scalar(analysis, "x");
        addressOf(analysis, p, a);
        analysis.emitConstraint(ConstraintExpression.deref(p), ConstraintExpression.addressOf(g1));
        analysis.emitConstraint(ConstraintExpression.deref(p, 64), ConstraintExpression.addressOf(g2));
        analysis.emitConstraint(ConstraintExpression.scalar(x), ConstraintExpression.deref(p, 64));
        PointsToSolution solution = analysis.run();

        assertEquals(-1, solution.findVariable("a.f2"));
        assertEquals(2, solution.queryPointsTo(a).size());
        assertEquals(2, solution.queryPointsTo(x).size());
    }

    public static void testUnionIsOneUnknownVariable() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int u = analysis.createVariable(ObjectDescriptor.union("u",
                                                               64,
                                                               Arrays.asList(FieldDescriptor.leaf("i", 0, 32),
                                                                             FieldDescriptor.leaf("p", 0, 64))));
        int g = scalar(analysis, "g");
        int p = scalar(analysis, "p");
        int x = scalar(analysis, "x");
        addressOf(analysis, p, u);
        analysis.emitConstraint(ConstraintExpression.deref(p, 32), ConstraintExpression.addressOf(g));
        analysis.emitConstraint(ConstraintExpression.scalar(x), ConstraintExpression.deref(p));
        PointsToSolution solution = analysis.run();

        assertTrue(analysis.getVariableTable().get(u).hasUnion());
        assertTrue(solution.getSolution(u).contains(g));
        assertTrue(solution.queryPointsTo(u).isUnknown());
        assertTrue(solution.queryPointsTo(x).mayPointTo(g));
        assertFalse(solution.queryPointsTo(x).isUnknown());
    }

    private static int union128(StructAliasAnalysis analysis, String name) {
        return analysis.createVariable(ObjectDescriptor.union(name,
                                                              128,
                                                              Arrays.asList(FieldDescriptor.leaf("i", 0, 32),
                                                                            FieldDescriptor.leaf("p", 0, 64))));
    }

    public static void testStructureCopyIntoUnionKeepsEveryField() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int s = analysis.createVariable(pair("s"));
        int u = union128(analysis, "u");
        int p = scalar(analysis, "p");
        int a = scalar(analysis, "a");
        int b = scalar(analysis, "b");
        addressOf(analysis, s, a);
        addressOf(analysis, s + 1, b);
        analysis.emitStructureCopy(ConstraintExpression.scalar(u), ConstraintExpression.scalar(s), 128);
        analysis.emitConstraint(ConstraintExpression.scalar(p), ConstraintExpression.scalar(u));
        PointsToSolution solution = analysis.run();

        assertTrue(solution.queryPointsTo(p).mayPointTo(a));
        assertTrue(solution.queryPointsTo(p).mayPointTo(b));
    }

    public static void testStructureLoadIntoUnionKeepsEveryField() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int s = analysis.createVariable(pair("s"));
        int u = union128(analysis, "u");
        int q = scalar(analysis, "q");
        int a = scalar(analysis, "a");
        int b = scalar(analysis, "b");
        addressOf(analysis, s, a);
        addressOf(analysis, s + 1, b);
        addressOf(analysis, q, s);
        analysis.emitStructureCopy(ConstraintExpression.scalar(u), ConstraintExpression.deref(q), 128, pair("pair"));
        PointsToSolution solution = analysis.run();

        assertTrue(solution.queryPointsTo(u).mayPointTo(a));
        assertTrue(solution.queryPointsTo(u).mayPointTo(b));
    }

    public static void testStructureStoreFromUnionReachesEveryField() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int t = analysis.createVariable(pair("t"));
        int u = union128(analysis, "u");
        int p = scalar(analysis, "p");
        int a = scalar(analysis, "a");
        addressOf(analysis, u, a);
        addressOf(analysis, p, t);
        analysis.emitStructureCopy(ConstraintExpression.deref(p), ConstraintExpression.scalar(u), 128);
        PointsToSolution solution = analysis.run();

        assertTrue(solution.queryPointsTo(t).mayPointTo(a));
        assertTrue(solution.queryPointsTo(t + 1).mayPointTo(a));
    }

    public static void testGlobalMayPointToAnything() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int g = analysis.createVariable(ObjectDescriptor.scalar("g", 64).asGlobal());
        int p = scalar(analysis, "p");
        int q = scalar(analysis, "q");
        int x = scalar(analysis, "x");
        int o = scalar(analysis, "o");
        analysis.emitConstraint(ConstraintExpression.scalar(p), ConstraintExpression.scalar(g));
        addressOf(analysis, q, g);
        analysis.emitConstraint(ConstraintExpression.scalar(x), ConstraintExpression.deref(q));
        addressOf(analysis, o, x);
        PointsToSolution solution = analysis.run();

        assertTrue(solution.queryPointsTo(g).isUnknown());
        assertTrue(solution.queryPointsTo(p).isUnknown());
        assertTrue(solution.queryPointsTo(x).isUnknown());
        assertTrue(solution.queryPointsTo(p).mayPointTo(o));
        assertFalse(solution.queryPointsTo(q).isUnknown());
        assertTrue(solution.queryPointsTo(q).mayPointTo(g));
    }

    public static void testParameterMayPointToAnything() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int arg = analysis.createParameterVariable(pair("arg"));
        PointsToSolution solution = analysis.run();

        assertFalse(analysis.getVariableTable().get(arg).isArtificial());
        assertTrue(solution.getSolution(arg).contains(VariableTable.ANYTHING_ID));
        assertTrue(solution.getSolution(arg + 1).contains(VariableTable.ANYTHING_ID));
        assertTrue(solution.queryPointsTo(arg + 1).isUnknown());
    }

    public static void testHeapAndTemporariesAreUnknown() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int h = analysis.createHeapVariable("h");
        int p = scalar(analysis, "p");
        int q = scalar(analysis, "q");
        int a = scalar(analysis, "a");
        addressOf(analysis, p, h);
        addressOf(analysis, q, h);
        addressOf(analysis, h, a);
        analysis.emitConstraint(ConstraintExpression.deref(p), ConstraintExpression.deref(q));
        PointsToSolution solution = analysis.run();

        assertTrue(solution.queryPointsTo(h).isUnknown());
        assertEquals(PointsToResult.of(solution.getSolution(p)), solution.queryPointsTo(p));
        assertTrue(solution.queryPointsTo(p).mayPointTo(h));
        int tmp = solution.numVariables() - 1;
        assertTrue(solution.getName(tmp).startsWith("doubledereftmp"));
        assertTrue(solution.queryPointsTo(tmp).isUnknown());
        assertTrue(solution.getSolution(tmp).contains(a));
    }

    public static void testCycleMembersShareSolution() {
        StructAliasAnalysis analysis = new StructAliasAnalysis(true, false);
        int x = scalar(analysis, "x");
        int y = scalar(analysis, "y");
        int a = scalar(analysis, "a");
        analysis.emitConstraint(ConstraintExpression.scalar(x), ConstraintExpression.scalar(y));
        analysis.emitConstraint(ConstraintExpression.scalar(y), ConstraintExpression.scalar(x));
        addressOf(analysis, y, a);
        PointsToSolution solution = analysis.run();

        assertEquals(solution.getRepresentative(x), solution.getRepresentative(y));
        assertTrue(solution.getSolution(x).sameValue(solution.getSolution(y)));
        assertTrue(solution.getSolution(x).contains(a));
        assertEquals(1, solution.getStatistics().getUnifiedVarsStatic());
    }

    public static void testDump() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int p = scalar(analysis, "p");
        int a = scalar(analysis, "a");
        int b = scalar(analysis, "b");
        addressOf(analysis, p, a);
        addressOf(analysis, p, b);
        analysis.run();

        String expected = "NULL = { }\n" + "ANYTHING = { ANYTHING }\n" + "READONLY = { ANYTHING }\n"
                + "INTEGER = { ANYTHING }\n" + "p = { a b }\n" + "a = { }\n" + "b = { }\n";
        assertEquals(expected, analysis.dump());
    }

    public static void testRunOnlyOnce() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        scalar(analysis, "p");
        analysis.run();
        try {
            analysis.run();
        }
        catch (IllegalStateException e) {
            try {
                scalar(analysis, "q");
            }
            catch (IllegalStateException e2) {
                return;
            }
        }
        fail("Should have thrown exception");
    }

    public static void testNoExpressionsAfterRun() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        int p = scalar(analysis, "p");
        analysis.run();
        try {
            analysis.addressOf(ConstraintExpression.scalar(p));
        }
        catch (IllegalStateException e) {
            try {
                analysis.dereference(ConstraintExpression.scalar(p));
            }
            catch (IllegalStateException e2) {
                return;
            }
        }
        fail("Should have thrown exception");
    }

    public static void testReset() {
        StructAliasAnalysis analysis = new StructAliasAnalysis(false, false);
        int p = scalar(analysis, "p");
        int a = scalar(analysis, "a");
        addressOf(analysis, p, a);
        analysis.run();

        analysis.reset();
        assertNull(analysis.getGraph());
        assertEquals(VariableTable.NUM_RESERVED, analysis.getVariableTable().size());
        assertFalse(analysis.isFieldSensitive());
        assertFalse(analysis.isVariableSubstitution());
        int q = scalar(analysis, "q");
        assertEquals(p, q);
        PointsToSolution solution = analysis.run();
        assertEquals(0, solution.queryPointsTo(q).size());
    }

    public static void testVerifiedRun() {
        StructAliasAnalysis analysis = new StructAliasAnalysis();
        analysis.setVerify(true);
        int s = analysis.createVariable(pair("s"));
        int p = scalar(analysis, "p");
        int q = scalar(analysis, "q");
        int a = scalar(analysis, "a");
        addressOf(analysis, p, s);
        analysis.emitConstraint(ConstraintExpression.scalar(q), ConstraintExpression.scalar(p, 64));
        analysis.emitConstraint(ConstraintExpression.deref(q), ConstraintExpression.addressOf(a));
        analysis.emitConstraint(ConstraintExpression.deref(p), ConstraintExpression.deref(q));
        PointsToSolution solution = analysis.run();

        assertTrue(solution.queryPointsTo(s + 1).mayPointTo(a));
        assertTrue(solution.queryPointsTo(s).mayPointTo(a));
        assertEquals(solution.getStatistics().getTotalVars(), solution.numVariables());
        assertTrue(solution.getStatistics().getIterations() > 0);
    }
}
