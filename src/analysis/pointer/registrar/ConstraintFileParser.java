package analysis.pointer.registrar;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import analysis.pointer.constraints.ConstraintExpression;
import analysis.pointer.engine.StructAliasAnalysis;
import analysis.pointer.graph.VariableTable;

/**
 * Reads variables and constraints from a text file and registers them with an analysis. Each line is one of
 *
 * <pre>
 * # comment
 * var NAME SIZE [{ FIELD:OFFSET:SIZE[:union|:array] ... }]
 * global NAME SIZE [{ ... }]
 * param NAME SIZE [{ ... }]
 * union NAME SIZE
 * array NAME SIZE
 * unknown NAME
 * heap NAME
 * LHS = RHS
 * copy LHS = RHS SIZE
 * </pre>
 *
 * Sizes and offsets are in bits, a size of <code>?</code> is not a constant. An expression is a variable name,
 * optionally preceded by <code>*</code> or <code>&amp;</code> and followed by <code>+ OFFSET</code>. The field f of
 * an object s is named <code>s.f</code>. The reserved variables are NULL, ANYTHING, READONLY and INTEGER.
 * <p>
 * For example
 *
 * <pre>
 * var s 128 { f:0:64 g:64:64 }
 * var p 64
 * var a 64
 * p = &amp;s
 * *p + 64 = &amp;a
 * </pre>
 */
public class ConstraintFileParser {

    /**
     * Error in the input, with the line it occurred on
     */
    public static class ParseException extends Exception {

        private static final long serialVersionUID = -2413675026378920218L;
        private final int line;

        public ParseException(int line, String message) {
            super("line " + line + ": " + message);
            this.line = line;
        }

        public int getLine() {
            return this.line;
        }
    }

    private final StructAliasAnalysis analysis;
    /**
     * Variable for each name in the input
     */
    private final Map<String, Integer> names = new HashMap<>();
    private int lineNumber;

    public ConstraintFileParser(StructAliasAnalysis analysis) {
        this.analysis = analysis;
        this.names.put("NULL", VariableTable.NULL_ID);
        this.names.put("ANYTHING", VariableTable.ANYTHING_ID);
        this.names.put("READONLY", VariableTable.READONLY_ID);
        this.names.put("INTEGER", VariableTable.INTEGER_ID);
    }

    /**
     * Parse the given file
     */
    public void parseFile(String fileName) throws IOException, ParseException {
        try (Reader r = new FileReader(fileName)) {
            parse(r);
        }
    }

    /**
     * Parse every line of the input
     */
    public void parse(Reader input) throws IOException, ParseException {
        BufferedReader reader = new BufferedReader(input);
        this.lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            this.lineNumber++;
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            parseLine(Arrays.asList(line.split("\\s+")));
        }
    }

    private void parseLine(List<String> tokens) throws ParseException {
        String first = tokens.get(0);
        switch (first) {
        case "var":
        case "global":
        case "param":
            parseObject(first, tokens);
            break;
        case "union":
            expectLength(tokens, 3);
            declare(ObjectDescriptor.union(tokens.get(1), parseSize(tokens.get(2)), null), false);
            break;
        case "array":
            expectLength(tokens, 3);
            declare(ObjectDescriptor.array(tokens.get(1), parseSize(tokens.get(2))), false);
            break;
        case "unknown":
            expectLength(tokens, 2);
            declare(ObjectDescriptor.unknown(tokens.get(1)), false);
            break;
        case "heap":
            expectLength(tokens, 2);
            checkNew(tokens.get(1));
            this.names.put(tokens.get(1), this.analysis.createHeapVariable(tokens.get(1)));
            break;
        case "copy":
            parseStructureCopy(tokens);
            break;
        default:
            parseConstraint(tokens);
        }
    }

    private void parseObject(String kind, List<String> tokens) throws ParseException {
        if (tokens.size() < 3) {
            throw error("expected " + kind + " NAME SIZE");
        }
        String name = tokens.get(1);
        int size = parseSize(tokens.get(2));
        List<FieldDescriptor> fields = null;
        if (tokens.size() > 3) {
            if (!tokens.get(3).equals("{") || !tokens.get(tokens.size() - 1).equals("}")) {
                throw error("fields must be enclosed in { }");
            }
            fields = new ArrayList<>();
            for (String f : tokens.subList(4, tokens.size() - 1)) {
                fields.add(parseField(f));
            }
        }
        ObjectDescriptor d = fields == null ? ObjectDescriptor.scalar(name, size)
                : ObjectDescriptor.struct(name, size, fields);
        if (kind.equals("global")) {
            d = d.asGlobal();
        }
        declare(d, kind.equals("param"));
    }

    private FieldDescriptor parseField(String text) throws ParseException {
        String[] parts = text.split(":");
        if (parts.length < 3 || parts.length > 4) {
            throw error("expected FIELD:OFFSET:SIZE[:union|:array], found " + text);
        }
        int offset = parseInt(parts[1]);
        int size = parseSize(parts[2]);
        if (parts.length == 3) {
            return FieldDescriptor.leaf(parts[0], offset, size);
        }
        switch (parts[3]) {
        case "union":
            return FieldDescriptor.union(parts[0], offset, size);
        case "array":
            return FieldDescriptor.array(parts[0], offset, size);
        default:
            throw error("unknown field kind " + parts[3]);
        }
    }

    /**
     * Create the variables for an object and record the names of the object and its fields
     */
    private void declare(ObjectDescriptor d, boolean parameter) throws ParseException {
        checkNew(d.getName());
        int base;
        try {
            base = parameter ? this.analysis.createParameterVariable(d) : this.analysis.createVariable(d);
        }
        catch (IllegalArgumentException e) {
            throw error(e.getMessage());
        }
        this.names.put(d.getName(), base);
        if (d.getFields() != null) {
            VariableTable vars = this.analysis.getVariableTable();
            for (FieldDescriptor f : d.getFields()) {
                String fieldName = d.getName() + "." + f.getName();
                checkNew(fieldName);
                int id = vars.firstFieldAtOffset(base, f.getOffset());
                this.names.put(fieldName, id < 0 ? base : id);
            }
        }
    }

    private void parseStructureCopy(List<String> tokens) throws ParseException {
        int eq = tokens.indexOf("=");
        if (eq < 2 || tokens.size() < eq + 3) {
            throw error("expected copy LHS = RHS SIZE");
        }
        ConstraintExpression lhs = parseExpression(tokens.subList(1, eq));
        ConstraintExpression rhs = parseExpression(tokens.subList(eq + 1, tokens.size() - 1));
        int size = parseInt(tokens.get(tokens.size() - 1));
        try {
            this.analysis.emitStructureCopy(lhs, rhs, size);
        }
        catch (IllegalArgumentException e) {
            throw error(e.getMessage());
        }
    }

    private void parseConstraint(List<String> tokens) throws ParseException {
        int eq = tokens.indexOf("=");
        if (eq < 1 || eq == tokens.size() - 1) {
            throw error("expected LHS = RHS or a declaration, found " + tokens.get(0));
        }
        ConstraintExpression lhs = parseExpression(tokens.subList(0, eq));
        ConstraintExpression rhs = parseExpression(tokens.subList(eq + 1, tokens.size()));
        try {
            this.analysis.emitConstraint(lhs, rhs);
        }
        catch (IllegalArgumentException e) {
            throw error(e.getMessage());
        }
    }

    /**
     * Parse <code>[*|&amp;]NAME [+ OFFSET]</code>, the operators may be attached to the name
     */
    private ConstraintExpression parseExpression(List<String> tokens) throws ParseException {
        String joined = String.join("", tokens);
        int offset = 0;
        int plus = joined.indexOf('+');
        if (plus >= 0) {
            offset = parseInt(joined.substring(plus + 1));
            joined = joined.substring(0, plus);
        }
        if (joined.isEmpty()) {
            throw error("missing variable");
        }
        char op = joined.charAt(0);
        String name = op == '*' || op == '&' ? joined.substring(1) : joined;
        int var = lookup(name);
        if (op == '*') {
            return ConstraintExpression.deref(var, offset);
        }
        if (op == '&') {
            if (offset != 0) {
                throw error("offset on an address: " + joined + " + " + offset);
            }
            return ConstraintExpression.addressOf(var);
        }
        return ConstraintExpression.scalar(var, offset);
    }

    private int lookup(String name) throws ParseException {
        Integer id = this.names.get(name);
        if (id == null) {
            throw error("undeclared variable " + name);
        }
        return id;
    }

    private void checkNew(String name) throws ParseException {
        if (this.names.containsKey(name)) {
            throw error("duplicate declaration of " + name);
        }
    }

    private int parseSize(String s) throws ParseException {
        if (s.equals("?")) {
            return ObjectDescriptor.NON_CONSTANT;
        }
        return parseInt(s);
    }

    private int parseInt(String s) throws ParseException {
        try {
            int i = Integer.parseInt(s);
            if (i < 0) {
                throw error("negative number " + s);
            }
            return i;
        }
        catch (NumberFormatException e) {
            throw error("not a number: " + s);
        }
    }

    private void expectLength(List<String> tokens, int n) throws ParseException {
        if (tokens.size() != n) {
            throw error("expected " + n + " tokens for " + tokens.get(0));
        }
    }

    private ParseException error(String message) {
        return new ParseException(this.lineNumber, message);
    }

    /**
     * @return the variable with the given name, -1 if there is none
     */
    public int getVariable(String name) {
        Integer id = this.names.get(name);
        return id == null ? -1 : id;
    }

    /**
     * @return names of the declared variables and fields, with their ids
     */
    public Map<String, Integer> getNames() {
        return Collections.unmodifiableMap(this.names);
    }
}
