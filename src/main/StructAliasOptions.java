package main;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * Command line options of {@link StructAliasMain}
 */
public final class StructAliasOptions {

    /**
     * File containing the variables and constraints to solve
     */
    @Parameter(names = { "-in", "-input" }, description = "Constraint file to solve, see ConstraintFileParser for the format.")
    private String inputFile;

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information")
    private boolean help = false;

    /**
     * Represent each aggregate by a single variable
     */
    @Parameter(names = { "-noFieldSensitivity" }, description = "If set, do not split aggregates into one variable per field.")
    private boolean noFieldSensitivity = false;

    /**
     * Skip offline variable substitution
     */
    @Parameter(
        names = { "-noVariableSubstitution" },
        description = "If set, do not unify equivalent variables before solving. The solution is the same, only the solver does more work.")
    private boolean noVariableSubstitution = false;

    /**
     * File the solution is written to as JSON
     */
    @Parameter(names = { "-json" }, description = "Write the solution to the given file in JSON format.")
    private String jsonFile;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, validateWith = StructAliasOptions.OutputLevelValidator.class, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    /**
     * Print the normalized constraints before solving
     */
    @Parameter(names = { "-constraints" }, description = "If set, print the normalized constraints.")
    private boolean printConstraints = false;

    /**
     * Print the statistics of the run
     */
    @Parameter(names = { "-stats" }, description = "If set, print statistics about the solver.")
    private boolean printStatistics = false;

    /**
     * Check the solution against the constraints
     */
    @Parameter(names = { "-verify" }, description = "If set, check that the solution satisfies every constraint (slow).")
    private boolean verify = false;

    /**
     * Validate the output level
     */
    public static class OutputLevelValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            try {
                if (Integer.parseInt(value) >= 0) {
                    return;
                }
            }
            catch (NumberFormatException e) {
                throw new ParameterException("Output level must be a number: " + value);
            }
            throw new ParameterException("Output level must not be negative: " + value);
        }
    }

    private StructAliasOptions() {
        // Do not instantiate
    }

    /**
     * Parse the options for the given args
     *
     * @param args arguments to parse
     * @return Options object with the parsed options available via getters
     */
    public static StructAliasOptions getOptions(String[] args) {
        StructAliasOptions o = new StructAliasOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    public boolean shouldPrintUseage() {
        return this.help;
    }

    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        StructAliasOptions o = new StructAliasOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.getUsageFormatter().usage(sb);
        return sb.toString();
    }

    public String getInputFile() {
        if (this.inputFile == null) {
            throw new ParameterException("Must specify a constraint file.");
        }
        return this.inputFile;
    }

    public boolean isFieldSensitive() {
        return !this.noFieldSensitivity;
    }

    public boolean useVariableSubstitution() {
        return !this.noVariableSubstitution;
    }

    /**
     * @return file to write the JSON solution to, null if none
     */
    public String getJSONFile() {
        return this.jsonFile;
    }

    public Integer getOutputLevel() {
        return this.outputLevel;
    }

    public boolean shouldPrintConstraints() {
        return this.printConstraints;
    }

    public boolean shouldPrintStatistics() {
        return this.printStatistics;
    }

    public boolean shouldVerify() {
        return this.verify;
    }
}
