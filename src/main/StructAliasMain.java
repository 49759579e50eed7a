package main;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;

import results.PointsToSolution;
import results.SolutionJSON;
import results.SolutionPrinter;
import analysis.pointer.engine.StructAliasAnalysis;
import analysis.pointer.registrar.ConstraintFileParser;
import analysis.pointer.registrar.ConstraintFileParser.ParseException;

import com.beust.jcommander.ParameterException;

/**
 * Solve the constraints in a file and print the points-to set of every variable, see usage
 */
public class StructAliasMain {

    /**
     * Run the analysis on a constraint file
     *
     * @param args options and parameters see useage (pass in "-h") for details
     * @throws IOException file reading or writing issues
     */
    public static void main(String[] args) throws IOException {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run the analysis on a constraint file without exiting the virtual machine
     *
     * @param args options and parameters, as for {@link #main(String[])}
     * @return 0 on success, 1 if the options or the input file could not be parsed
     * @throws IOException file reading or writing issues
     */
    public static int run(String[] args) throws IOException {
        StructAliasOptions options;
        String inputFile;
        try {
            options = StructAliasOptions.getOptions(args);
            if (options.shouldPrintUseage()) {
                System.err.println(StructAliasOptions.getUseage());
                return 0;
            }
            inputFile = options.getInputFile();
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(StructAliasOptions.getUseage());
            return 1;
        }

        StructAliasAnalysis.outputLevel = options.getOutputLevel();
        StructAliasAnalysis analysis = new StructAliasAnalysis(options.isFieldSensitive(),
                                                               options.useVariableSubstitution());
        analysis.setVerify(options.shouldVerify());

        ConstraintFileParser parser = new ConstraintFileParser(analysis);
        try {
            parser.parseFile(inputFile);
        }
        catch (ParseException e) {
            System.err.println("Error in " + inputFile + ", " + e.getMessage());
            System.err.println(StructAliasOptions.getUseage());
            return 1;
        }

        if (options.shouldPrintConstraints()) {
            SolutionPrinter printer = new SolutionPrinter(analysis.getVariableTable());
            System.out.print(printer.dumpConstraints(analysis.getRegistrar().getConstraints()));
        }

        PointsToSolution solution = analysis.run();
        System.out.print(analysis.dump());

        if (options.shouldPrintStatistics()) {
            System.out.print(solution.getStatistics());
        }

        String jsonFile = options.getJSONFile();
        if (jsonFile != null) {
            try (Writer out = new FileWriter(jsonFile)) {
                SolutionJSON.writeJSON(solution, out, 2);
            }
            if (StructAliasAnalysis.outputLevel >= 1) {
                System.err.println("JSON written to " + jsonFile);
            }
        }
        return 0;
    }
}
