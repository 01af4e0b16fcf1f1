package cassia.hir;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EnvironmentTest {

    private final Variable x = new Variable("x");

    private final Variable y = new Variable("y");

    @Test
    public void definitionsLeaveReceiverUnchanged() {
        Environment empty = Environment.empty();
        Environment env = empty.define("a", Literal.valueOf(3));
        assertFalse(empty.contains("a"));
        assertTrue(env.contains("a"));
        assertEquals("3", env.lookup("a").toString());
        assertNull(env.lookup("b"));
    }

    @Test
    public void definesFunctions() {
        List<Variable> params = Arrays.asList(x, y);
        Environment env = Environment.empty()
                .defineFunction("f", params, Symbolic.add(x, y))
                .define("c", Literal.valueOf(1));
        FunctionCall f = env.lookupFunction("f");
        assertNotNull(f);
        assertTrue(f.isDefinition());
        assertEquals(params, f.getParameters());
        assertEquals("x + y", f.getBody().toString());
        assertNull(env.lookupFunction("c"));
        assertEquals(Collections.singleton("f"), env.getFunctionNames());
        assertEquals("{c = 1, f(x, y) = x + y}", env.toString());
    }

    @Test
    public void rejectsMalformedDefinitions() {
        Environment env = Environment.empty();
        try {
            env.defineFunction("f", Arrays.asList(new Variable("f")), x);
            fail("f was accepted as its own parameter");
        } catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().contains("parameter"));
        }
        try {
            env.defineFunction("g", Arrays.asList(x, x), x);
            fail("a repeated parameter was accepted");
        } catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().contains("repeats"));
        }
        try {
            env.define("a", null);
            fail("a null value was accepted");
        } catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().contains("a"));
        }
    }

    @Test
    public void removesParameters() {
        Environment env = Environment.empty()
                .define("x", Literal.valueOf(1))
                .define("z", Literal.valueOf(2));
        Environment inner = env.without(Arrays.asList(x, y));
        assertFalse(inner.contains("x"));
        assertTrue(inner.contains("z"));
        assertTrue(env.contains("x"));
        assertSame(env, env.without(Arrays.asList(y)));
    }

}
