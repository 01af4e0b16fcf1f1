package cassia.hir;

import cassia.exec.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DepthFirstIteratorTest {

    @Test
    public void visitsInPreOrder() throws Exception {
        Expression e = Parser.parse("x + sin(y)*2");
        DepthFirstIterator<Expression> iter = new DepthFirstIterator<Expression>(e);
        List<String> visited = new ArrayList<String>();
        while (iter.hasNext()) {
            visited.add(iter.next().toString());
        }
        assertEquals(6, visited.size());
        assertEquals("x", visited.get(1));
        assertEquals("sin(y)", visited.get(3));
        assertEquals("y", visited.get(4));
        assertEquals("2", visited.get(5));
    }

    @Test
    public void collectsByClass() throws Exception {
        Expression e = Symbolic.simplify(Parser.parse("x*sin(x + y) + y^2"));
        DepthFirstIterator<Expression> iter = new DepthFirstIterator<Expression>(e);
        List<Variable> vars = iter.getList(Variable.class);
        assertEquals(4, vars.size());
        assertFalse(iter.hasNext());
        iter.reset();
        List<Power> powers = iter.getList(Power.class);
        assertEquals(1, powers.size());
        assertEquals("y^2", powers.get(0).toString());
        iter.reset();
        assertEquals("[sin(x + y)]", iter.getList(ElementaryFunction.class).toString());
    }

    @Test
    public void doesNotRemove() throws Exception {
        Iterator<Expression> iter = new DepthFirstIterator<Expression>(new Variable("x"));
        iter.next();
        assertFalse(iter.hasNext());
        try {
            iter.remove();
            fail("remove was supported");
        } catch (UnsupportedOperationException ex) {
            assertNotNull(ex);
        }
    }

}
