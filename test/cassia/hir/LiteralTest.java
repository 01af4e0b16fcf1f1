package cassia.hir;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class LiteralTest {

    @Test
    public void reducesToLowestTerms() {
        assertEquals("1/2", Literal.valueOf(2, 4).toString());
        assertEquals("-1/2", Literal.valueOf(1, -2).toString());
        assertTrue(Literal.valueOf(4, 2) instanceof IntegerLiteral);
        assertEquals("2", Literal.valueOf(4, 2).toString());
        assertTrue(Literal.valueOf(1, 3) instanceof RationalLiteral);
    }

    @Test
    public void rejectsZeroDenominator() {
        try {
            Literal.valueOf(1, 0);
            fail("1/0 was accepted");
        } catch (ArithmeticException ex) {
            assertTrue(ex.getMessage().contains("zero denominator"));
        }
    }

    @Test
    public void computesExactly() {
        Literal third = Literal.valueOf(1, 3), sixth = Literal.valueOf(1, 6);
        assertEquals("1/2", third.add(sixth).toString());
        assertEquals("1/6", third.subtract(sixth).toString());
        assertEquals("1/18", third.multiply(sixth).toString());
        assertEquals("2", third.divide(sixth).toString());
        assertEquals("-1/3", third.negate().toString());
        assertEquals("3", third.reciprocal().toString());
        assertEquals("9/4", Literal.valueOf(2, 3).pow(-2).toString());
        assertEquals("1", Literal.valueOf(5).pow(0).toString());
    }

    @Test
    public void extractsExactRoots() {
        assertEquals("3/2", Literal.valueOf(9, 4).root(2).toString());
        assertEquals("-2", Literal.valueOf(-8).root(3).toString());
        assertNull(Literal.valueOf(2).root(2));
        assertNull(Literal.valueOf(-4).root(2));
    }

    @Test
    public void comparesValues() {
        assertTrue(Literal.valueOf(1, 3).compareValue(Literal.valueOf(1, 2)) < 0);
        assertTrue(Literal.valueOf(-1).compareValue(Literal.valueOf(-2)) > 0);
        assertEquals(0, Literal.valueOf(2, 4).compareValue(Literal.valueOf(1, 2)));
        assertTrue(Literal.valueOf(0).isZero());
        assertTrue(Literal.valueOf(3, 3).isOne());
        assertTrue(Literal.valueOf(-1, 7).isNegative());
        assertFalse(Literal.valueOf(1, 7).isInteger());
    }

    @Test
    public void handlesBigValues() {
        BigInteger big = BigInteger.TEN.pow(40);
        Literal l = Literal.valueOf(big, big.multiply(BigInteger.valueOf(3)));
        assertEquals("1/3", l.toString());
        assertEquals(big.add(BigInteger.ONE).toString(),
                     Literal.valueOf(big).add(IntegerLiteral.ONE).toString());
    }

}
