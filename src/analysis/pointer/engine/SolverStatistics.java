package analysis.pointer.engine;

/**
 * Counters collected during one analysis run
 */
public class SolverStatistics {

    /**
     * Number of variables, including the reserved ones
     */
    private int totalVars;
    /**
     * Number of constraints after normalization
     */
    private int numConstraints;
    /**
     * Variables unified by cycle detection before solving
     */
    private int unifiedVarsStatic;
    /**
     * Variables unified by offline variable substitution
     */
    private int collapsedVars;
    /**
     * Variables unified by cycle detection while solving
     */
    private int unifiedVarsDynamic;
    /**
     * Number of solver rounds
     */
    private int iterations;
    /**
     * Number of copy edges when the graph was built
     */
    private int initialEdges;
    /**
     * Time spent in each phase, in ms
     */
    private long buildTime;
    private long collapseTime;
    private long substitutionTime;
    private long solveTime;

    public int getTotalVars() {
        return this.totalVars;
    }

    void setTotalVars(int totalVars) {
        this.totalVars = totalVars;
    }

    public int getNumConstraints() {
        return this.numConstraints;
    }

    void setNumConstraints(int numConstraints) {
        this.numConstraints = numConstraints;
    }

    public int getUnifiedVarsStatic() {
        return this.unifiedVarsStatic;
    }

    void incrementUnifiedVarsStatic() {
        this.unifiedVarsStatic++;
    }

    public int getCollapsedVars() {
        return this.collapsedVars;
    }

    void incrementCollapsedVars() {
        this.collapsedVars++;
    }

    public int getUnifiedVarsDynamic() {
        return this.unifiedVarsDynamic;
    }

    void incrementUnifiedVarsDynamic() {
        this.unifiedVarsDynamic++;
    }

    public int getIterations() {
        return this.iterations;
    }

    void incrementIterations() {
        this.iterations++;
    }

    public int getInitialEdges() {
        return this.initialEdges;
    }

    void setInitialEdges(int initialEdges) {
        this.initialEdges = initialEdges;
    }

    public long getBuildTime() {
        return this.buildTime;
    }

    void setBuildTime(long buildTime) {
        this.buildTime = buildTime;
    }

    public long getCollapseTime() {
        return this.collapseTime;
    }

    void setCollapseTime(long collapseTime) {
        this.collapseTime = collapseTime;
    }

    public long getSubstitutionTime() {
        return this.substitutionTime;
    }

    void setSubstitutionTime(long substitutionTime) {
        this.substitutionTime = substitutionTime;
    }

    public long getSolveTime() {
        return this.solveTime;
    }

    void setSolveTime(long solveTime) {
        this.solveTime = solveTime;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Stats:\n");
        sb.append("Total vars:               ").append(this.totalVars).append("\n");
        sb.append("Constraints:              ").append(this.numConstraints).append("\n");
        sb.append("Statically unified vars:  ").append(this.unifiedVarsStatic).append("\n");
        sb.append("Collapsed vars:           ").append(this.collapsedVars).append("\n");
        sb.append("Dynamically unified vars: ").append(this.unifiedVarsDynamic).append("\n");
        sb.append("Iterations:               ").append(this.iterations).append("\n");
        return sb.toString();
    }
}
