package cassia.exec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CommandLineOptionSetTest {

    @Test
    public void storesValues() {
        CommandLineOptionSet set = new CommandLineOptionSet();
        set.add(CommandLineOptionSet.LIMIT, "max-depth", "400", "N", "Nesting limit");
        set.add(CommandLineOptionSet.TRANSFORM, "expand", "Expand");
        assertTrue(set.contains("max-depth"));
        assertFalse(set.contains("depth"));
        assertEquals("400", set.getValue("max-depth"));
        assertNull(set.getValue("expand"));
        set.setValue("expand", "1");
        assertEquals("1", set.getValue("expand"));
        // Unknown options are not created by setValue.
        set.setValue("bogus", "1");
        assertFalse(set.contains("bogus"));
        assertNull(set.getValue("bogus"));
    }

    @Test
    public void describesOptions() {
        CommandLineOptionSet set = new CommandLineOptionSet();
        set.add(CommandLineOptionSet.LIMIT, "max-depth", "400", "N", "Nesting limit");
        set.add(CommandLineOptionSet.TRANSFORM, "derive", "var", "Derivative");
        set.add("help", "Print this message");
        assertTrue(set.takesArgument("max-depth"));
        assertTrue(set.takesArgument("derive"));
        assertFalse(set.takesArgument("help"));
        assertEquals(CommandLineOptionSet.UTILITY, set.getType("help"));
        assertEquals(CommandLineOptionSet.TRANSFORM, set.getType("derive"));
        assertEquals(0, set.getType("bogus"));
        String usage = set.getUsage();
        assertTrue(usage.contains("-max-depth=N"));
        assertTrue(usage.contains("Nesting limit (default: 400)"));
        assertTrue(usage.indexOf("-help") < usage.indexOf("-max-depth"));
        assertTrue(usage.indexOf("-max-depth") < usage.indexOf("-derive"));
        assertFalse(set.getUsage(CommandLineOptionSet.LIMIT).contains("-derive"));
    }

}
