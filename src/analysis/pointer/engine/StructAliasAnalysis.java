package analysis.pointer.engine;

import java.util.List;

import results.PointsToSolution;
import results.SolutionPrinter;
import analysis.pointer.constraints.Constraint;
import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.graph.ConstraintGraph;
import analysis.pointer.graph.VariableTable;
import analysis.pointer.registrar.ConstraintRegistrar;
import analysis.pointer.registrar.ObjectDescriptor;

/**
 * Field-sensitive, inclusion based points-to analysis of one unit. Variables and constraints are registered through
 * this object, then {@link #run()} builds the constraint graph, collapses its cycles, substitutes equivalent
 * variables and solves it.
 */
public class StructAliasAnalysis {

    /**
     * Effects the amount of debugging output, printed to System.err. 1 prints the time taken by each phase and the
     * statistics, 2 prints every unification, 3 prints the offsets that were dropped, 5 prints every solver round.
     */
    public static int outputLevel = 0;

    /**
     * Should aggregates be split into one variable per field
     */
    private final boolean fieldSensitive;
    /**
     * Should offline variable substitution be run before solving
     */
    private final boolean variableSubstitution;
    /**
     * Check the final solution against the constraints
     */
    private boolean verify = false;

    private VariableTable vars;
    private ConstraintRegistrar registrar;
    private SolverStatistics stats;
    private ConstraintGraph graph;
    private boolean hasRun;

    /**
     * Create a field sensitive analysis with variable substitution
     */
    public StructAliasAnalysis() {
        this(true, true);
    }

    public StructAliasAnalysis(boolean fieldSensitive, boolean variableSubstitution) {
        this.fieldSensitive = fieldSensitive;
        this.variableSubstitution = variableSubstitution;
        reset();
    }

    /**
     * Discard all variables, constraints and results, keeping the configuration
     */
    public void reset() {
        this.vars = new VariableTable();
        this.registrar = new ConstraintRegistrar(this.vars, this.fieldSensitive);
        this.stats = new SolverStatistics();
        this.graph = null;
        this.hasRun = false;
    }

    public void setVerify(boolean verify) {
        this.verify = verify;
    }

    private void checkNotRun() {
        if (this.hasRun) {
            throw new IllegalStateException("The analysis has already been run, reset it first");
        }
    }

    /**
     * Create the variables for an object
     *
     * @return id of the first field of the object
     */
    public int createVariable(ObjectDescriptor d) {
        checkNotRun();
        return this.registrar.createVariable(d);
    }

    /**
     * Create the variables for an argument passed by code that is not analyzed
     *
     * @return id of the first field of the argument
     */
    public int createParameterVariable(ObjectDescriptor d) {
        checkNotRun();
        return this.registrar.createParameterVariable(d);
    }

    /**
     * Create an object for an allocation site
     */
    public int createHeapVariable(String name) {
        checkNotRun();
        return this.registrar.createHeapVariable(name);
    }

    public void emitConstraint(ConstraintExpression lhs, ConstraintExpression rhs) {
        checkNotRun();
        this.registrar.emitConstraint(lhs, rhs);
    }

    public void emitStructureCopy(ConstraintExpression lhs, ConstraintExpression rhs, int sizeBits) {
        checkNotRun();
        this.registrar.emitStructureCopy(lhs, rhs, sizeBits);
    }

    public void emitStructureCopy(ConstraintExpression lhs, ConstraintExpression rhs, int sizeBits,
                                  ObjectDescriptor copiedType) {
        checkNotRun();
        this.registrar.emitStructureCopy(lhs, rhs, sizeBits, copiedType);
    }

    /**
     * @see ConstraintRegistrar#dereference(ConstraintExpression)
     */
    public ConstraintExpression dereference(ConstraintExpression e) {
        checkNotRun();
        return this.registrar.dereference(e);
    }

    /**
     * @see ConstraintRegistrar#addressOf(ConstraintExpression)
     */
    public ConstraintExpression addressOf(ConstraintExpression e) {
        checkNotRun();
        return this.registrar.addressOf(e);
    }

    /**
     * Compute the points-to sets of all variables. May only be called once between resets.
     *
     * @return the solution
     */
    public PointsToSolution run() {
        checkNotRun();
        this.hasRun = true;

        List<Constraint> constraints = this.registrar.getConstraints();
        this.stats.setTotalVars(this.vars.size());
        this.stats.setNumConstraints(constraints.size());
        if (outputLevel >= 1) {
            System.err.println("Solving " + constraints.size() + " constraints over " + this.vars.size()
                    + " variables");
        }

        long start = System.currentTimeMillis();
        this.graph = new ConstraintGraphBuilder(this.vars).build(constraints);
        this.stats.setInitialEdges(this.graph.numEdges());
        long end = System.currentTimeMillis();
        this.stats.setBuildTime(end - start);
        if (outputLevel >= 1) {
            System.err.println("   Build time        : " + (end - start) + "ms (" + this.graph.numEdges()
                    + " edges)");
        }

        NodeUnifier unifier = new NodeUnifier(this.vars, this.graph);
        CycleCollapser collapser = new CycleCollapser(this.vars, this.graph, unifier, this.stats);
        start = System.currentTimeMillis();
        collapser.collapseCycles(null);
        end = System.currentTimeMillis();
        this.stats.setCollapseTime(end - start);
        if (outputLevel >= 1) {
            System.err.println("   Collapse time     : " + (end - start) + "ms");
        }

        if (this.variableSubstitution) {
            start = System.currentTimeMillis();
            new OfflineVariableSubstitution(this.vars, this.graph, unifier, this.stats).run();
            end = System.currentTimeMillis();
            this.stats.setSubstitutionTime(end - start);
            if (outputLevel >= 1) {
                System.err.println("   Substitution time : " + (end - start) + "ms");
            }
        }

        ConstraintSolver solver = new ConstraintSolver(this.vars, this.graph, collapser, this.stats);
        start = System.currentTimeMillis();
        solver.solve();
        end = System.currentTimeMillis();
        this.stats.setSolveTime(end - start);
        if (outputLevel >= 1) {
            System.err.println("   Solve time        : " + (end - start) + "ms");
            System.err.print(this.stats);
        }

        if (this.verify) {
            solver.verify(constraints);
            if (outputLevel >= 1) {
                System.err.println("Solution checked against " + constraints.size() + " constraints");
            }
        }
        return new PointsToSolution(this.vars, this.stats);
    }

    /**
     * @return the constraint graph, null if the analysis has not been run
     */
    public ConstraintGraph getGraph() {
        return this.graph;
    }

    public VariableTable getVariableTable() {
        return this.vars;
    }

    public ConstraintRegistrar getRegistrar() {
        return this.registrar;
    }

    public SolverStatistics getStatistics() {
        return this.stats;
    }

    public boolean isFieldSensitive() {
        return this.fieldSensitive;
    }

    public boolean isVariableSubstitution() {
        return this.variableSubstitution;
    }

    /**
     * @return one line <code>name = { n1 n2 }</code> per variable
     */
    public String dump() {
        return new SolutionPrinter(this.vars).dump();
    }
}
