package unit;

import junit.framework.TestCase;
import main.StructAliasMain;
import main.StructAliasOptions;

import com.beust.jcommander.ParameterException;

/**
 * Test the setting of options for the main method in {@link StructAliasMain}
 */
public class TestOptions extends TestCase {

    public static void testOutputLevel() {
        String[] args = { "-output", "2" };
        StructAliasOptions o = StructAliasOptions.getOptions(args);
        assertEquals(2, o.getOutputLevel().intValue());

        String[] args2 = {};
        StructAliasOptions o2 = StructAliasOptions.getOptions(args2);
        assertEquals(0, o2.getOutputLevel().intValue());

        String[] args3 = { "-o", "4" };
        StructAliasOptions o3 = StructAliasOptions.getOptions(args3);
        assertEquals(4, o3.getOutputLevel().intValue());
    }

    public static void testBadOutputLevel() {
        String[] args = { "-output", "-1" };
        try {
            StructAliasOptions.getOptions(args);
        } catch (ParameterException e) {
            String[] args2 = { "-o", "lots" };
            try {
                StructAliasOptions.getOptions(args2);
            } catch (ParameterException e2) {
                return;
            }
        }
        fail("Should have thrown exception");
    }

    public static void testInputFile() {
        String file = "tests/structs.txt";
        String[] args = { "-in", file };
        StructAliasOptions o = StructAliasOptions.getOptions(args);
        assertEquals(file, o.getInputFile());

        String[] args2 = { "-input", file };
        StructAliasOptions o2 = StructAliasOptions.getOptions(args2);
        assertEquals(file, o2.getInputFile());
    }

    public static void testNoInputFile() {
        String[] args = {};
        try {
            StructAliasOptions o = StructAliasOptions.getOptions(args);
            o.getInputFile();
        } catch (ParameterException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testSolverFlags() {
        String[] args = {};
        StructAliasOptions o = StructAliasOptions.getOptions(args);
        assertTrue(o.isFieldSensitive());
        assertTrue(o.useVariableSubstitution());
        assertFalse(o.shouldVerify());
        assertFalse(o.shouldPrintConstraints());
        assertFalse(o.shouldPrintStatistics());
        assertNull(o.getJSONFile());

        String[] args2 = { "-noFieldSensitivity", "-noVariableSubstitution", "-verify", "-constraints", "-stats",
                "-json", "out.json" };
        StructAliasOptions o2 = StructAliasOptions.getOptions(args2);
        assertFalse(o2.isFieldSensitive());
        assertFalse(o2.useVariableSubstitution());
        assertTrue(o2.shouldVerify());
        assertTrue(o2.shouldPrintConstraints());
        assertTrue(o2.shouldPrintStatistics());
        assertEquals("out.json", o2.getJSONFile());
    }

    public static void testUnknownOption() {
        String[] args = { "-haf", "type" };
        try {
            StructAliasOptions.getOptions(args);
        } catch (ParameterException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public static void testUseage() {
        String[] args = { "-h" };
        StructAliasOptions o = StructAliasOptions.getOptions(args);
        assertEquals(true, o.shouldPrintUseage());

        String[] args2 = { "-useage" };
        StructAliasOptions o2 = StructAliasOptions.getOptions(args2);
        assertEquals(true, o2.shouldPrintUseage());

        String[] args3 = { "-help" };
        StructAliasOptions o3 = StructAliasOptions.getOptions(args3);
        assertEquals(true, o3.shouldPrintUseage());

        String[] args4 = { "--help" };
        StructAliasOptions o4 = StructAliasOptions.getOptions(args4);
        assertEquals(true, o4.shouldPrintUseage());

        assertTrue(StructAliasOptions.getUseage().contains("-noFieldSensitivity"));
    }
}
